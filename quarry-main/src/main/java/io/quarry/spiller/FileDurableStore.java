/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.quarry.spiller;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import io.airlift.log.Logger;
import io.airlift.slice.OutputStreamSliceOutput;
import io.airlift.slice.Slice;
import io.airlift.slice.SliceOutput;
import io.airlift.slice.Slices;
import io.quarry.spi.QuarryException;
import io.quarry.spi.storage.DurableStore;

import javax.annotation.PostConstruct;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.io.BaseEncoding.base16;
import static io.airlift.units.DataSize.succinctBytes;
import static io.quarry.spi.StandardErrorCode.OUT_OF_SPILL_SPACE;
import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.Files.createDirectories;
import static java.nio.file.Files.createTempFile;
import static java.nio.file.Files.deleteIfExists;
import static java.nio.file.Files.getFileStore;
import static java.nio.file.Files.isWritable;
import static java.nio.file.Files.move;
import static java.nio.file.Files.newDirectoryStream;
import static java.nio.file.Files.newInputStream;
import static java.nio.file.Files.newOutputStream;
import static java.nio.file.Files.readAllBytes;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.util.Objects.requireNonNull;

/**
 * Keeps each unit in its own file under one of the spill directories. A unit becomes visible
 * only once it is completely written: data goes to a temporary file first, which is then
 * renamed atomically.
 */
@ThreadSafe
public class FileDurableStore
        implements DurableStore
{
    private static final Logger log = Logger.get(FileDurableStore.class);

    @VisibleForTesting
    static final String SPILL_FILE_PREFIX = "spill";
    @VisibleForTesting
    static final String SPILL_FILE_SUFFIX = ".bin";
    private static final String TEMP_FILE_SUFFIX = ".tmp";
    private static final String SPILL_FILE_GLOB = "spill*.{bin,tmp}";

    private final List<Path> spillPaths;
    private final double maxUsedSpaceThreshold;
    private final Map<String, Path> unitLocations = new ConcurrentHashMap<>();

    @GuardedBy("this")
    private int nextPathIndex;

    public FileDurableStore(SpillConfig config)
    {
        this(
                requireNonNull(config, "config is null").getSpillPaths(),
                config.getMaxUsedSpaceThreshold());
    }

    public FileDurableStore(List<Path> spillPaths, double maxUsedSpaceThreshold)
    {
        checkArgument(maxUsedSpaceThreshold >= 0 && maxUsedSpaceThreshold <= 1, "maxUsedSpaceThreshold should be within [0, 1] range, got %s", maxUsedSpaceThreshold);
        this.spillPaths = ImmutableList.copyOf(requireNonNull(spillPaths, "spillPaths is null"));
        this.maxUsedSpaceThreshold = maxUsedSpaceThreshold;
        this.spillPaths.forEach(FileDurableStore::prepareSpillPath);
    }

    private static void prepareSpillPath(Path directory)
    {
        try {
            createDirectories(directory);
        }
        catch (IOException e) {
            throw new IllegalArgumentException(format("Cannot create spill path %s, check %s and the directory permissions", directory, SpillConfig.SPILL_PATH), e);
        }
        checkArgument(isWritable(directory), "Spill path %s is not writable, check %s and the directory permissions", directory, SpillConfig.SPILL_PATH);
    }

    /**
     * Deletes spill files left behind by a previous worker process.
     */
    @PostConstruct
    public void cleanupOldSpillFiles()
    {
        spillPaths.forEach(FileDurableStore::cleanupOldSpillFiles);
    }

    private static void cleanupOldSpillFiles(Path directory)
    {
        List<Path> oldFiles = new ArrayList<>();
        try (DirectoryStream<Path> stream = newDirectoryStream(directory, SPILL_FILE_GLOB)) {
            stream.forEach(oldFiles::add);
        }
        catch (IOException e) {
            log.warn(e, "Could not list old spill files in %s", directory);
            return;
        }

        int deleted = 0;
        for (Path oldFile : oldFiles) {
            try {
                Files.delete(oldFile);
                deleted++;
            }
            catch (IOException e) {
                log.warn(e, "Could not delete old spill file %s", oldFile);
            }
        }
        if (deleted > 0) {
            log.info("Deleted %s spill files left in %s by a previous process", deleted, directory);
        }
    }

    @Override
    public void write(String unitId, Slice data)
            throws IOException
    {
        requireNonNull(unitId, "unitId is null");
        requireNonNull(data, "data is null");

        Path directory = selectSpillPath(data.length());
        Path tempFile = createTempFile(directory, SPILL_FILE_PREFIX, TEMP_FILE_SUFFIX);
        Path target = directory.resolve(fileName(unitId));
        try {
            try (SliceOutput output = new OutputStreamSliceOutput(newOutputStream(tempFile), SpillManager.BUFFER_SIZE)) {
                output.writeBytes(data);
            }
            move(tempFile, target, ATOMIC_MOVE);
        }
        catch (IOException | RuntimeException e) {
            try {
                deleteIfExists(tempFile);
            }
            catch (IOException deleteException) {
                e.addSuppressed(deleteException);
            }
            throw e;
        }

        Path previous = unitLocations.put(unitId, target);
        if (previous != null && !previous.equals(target)) {
            deleteIfExists(previous);
        }
    }

    @Override
    public Slice read(String unitId)
            throws IOException
    {
        return Slices.wrappedBuffer(readAllBytes(locate(unitId)));
    }

    @Override
    public InputStream openStream(String unitId)
            throws IOException
    {
        return newInputStream(locate(unitId));
    }

    @Override
    public void delete(String unitId)
            throws IOException
    {
        requireNonNull(unitId, "unitId is null");
        Path path = unitLocations.remove(unitId);
        if (path != null) {
            deleteIfExists(path);
        }
    }

    private Path locate(String unitId)
            throws NoSuchFileException
    {
        requireNonNull(unitId, "unitId is null");
        Path path = unitLocations.get(unitId);
        if (path == null) {
            throw new NoSuchFileException("unit " + unitId);
        }
        return path;
    }

    private static String fileName(String unitId)
    {
        return SPILL_FILE_PREFIX + "-" + base16().lowerCase().encode(unitId.getBytes(UTF_8)) + SPILL_FILE_SUFFIX;
    }

    /**
     * Picks the spill directories in turn, skipping those that would be filled past the
     * configured threshold by a file of {@code bytes}.
     */
    private synchronized Path selectSpillPath(long bytes)
    {
        if (spillPaths.isEmpty()) {
            throw new QuarryException(OUT_OF_SPILL_SPACE, "No spill paths configured");
        }
        for (int checked = 0; checked < spillPaths.size(); checked++) {
            Path candidate = spillPaths.get(nextPathIndex);
            nextPathIndex = (nextPathIndex + 1) % spillPaths.size();
            if (hasRoomFor(candidate, bytes)) {
                return candidate;
            }
        }
        throw new QuarryException(OUT_OF_SPILL_SPACE, format("No spill path has room for %s", succinctBytes(bytes)));
    }

    private boolean hasRoomFor(Path directory, long bytes)
    {
        FileStore fileStore;
        long usableBytes;
        long totalBytes;
        try {
            fileStore = getFileStore(directory);
            usableBytes = fileStore.getUsableSpace();
            totalBytes = fileStore.getTotalSpace();
        }
        catch (IOException e) {
            throw new QuarryException(OUT_OF_SPILL_SPACE, "Cannot determine free space in " + directory, e);
        }
        long minFreeBytes = (long) (totalBytes * (1.0 - maxUsedSpaceThreshold));
        return usableBytes - bytes > minFreeBytes;
    }
}
