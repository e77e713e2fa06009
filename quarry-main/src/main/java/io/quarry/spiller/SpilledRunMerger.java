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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.google.common.io.Closer;
import io.airlift.slice.Slice;
import io.airlift.slice.SliceInput;
import io.quarry.spi.QuarryException;

import javax.annotation.concurrent.NotThreadSafe;

import java.io.Closeable;
import java.io.IOException;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

import static com.google.common.base.Preconditions.checkState;
import static io.quarry.spi.StandardErrorCode.GENERIC_INTERNAL_ERROR;
import static java.util.Objects.requireNonNull;

/**
 * Streams the records of several sorted spilled runs as one sorted sequence. Only one
 * buffer per run is held in memory.
 */
@NotThreadSafe
public class SpilledRunMerger
        implements Closeable
{
    private final Closer closer = Closer.create();
    private final Iterator<Slice> merged;
    private boolean closed;

    public SpilledRunMerger(SpillManager spillManager, List<SpillHandle> runs, Comparator<? super Slice> ordering)
    {
        requireNonNull(spillManager, "spillManager is null");
        requireNonNull(runs, "runs is null");
        requireNonNull(ordering, "ordering is null");

        ImmutableList.Builder<Iterator<Slice>> iterators = ImmutableList.builder();
        try {
            for (SpillHandle run : runs) {
                SliceInput input = closer.register(spillManager.openStream(run));
                iterators.add(SpillRecords.readRecords(input));
            }
        }
        catch (RuntimeException e) {
            try {
                closer.close();
            }
            catch (IOException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
        this.merged = Iterators.mergeSorted(iterators.build(), ordering);
    }

    public boolean hasNext()
    {
        checkState(!closed, "merger is closed");
        return merged.hasNext();
    }

    public Slice next()
    {
        checkState(!closed, "merger is closed");
        return merged.next();
    }

    @Override
    public void close()
    {
        if (closed) {
            return;
        }
        closed = true;
        try {
            closer.close();
        }
        catch (IOException e) {
            throw new QuarryException(GENERIC_INTERNAL_ERROR, "Failed to close spilled runs", e);
        }
    }
}
