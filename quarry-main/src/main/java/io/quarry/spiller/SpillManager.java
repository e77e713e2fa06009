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
import com.google.common.collect.ImmutableSet;
import com.google.common.io.Closer;
import io.airlift.log.Logger;
import io.airlift.slice.InputStreamSliceInput;
import io.airlift.slice.Slice;
import io.airlift.slice.SliceInput;
import io.quarry.memory.ExecutionHandle;
import io.quarry.memory.UnifiedMemoryManager;
import io.quarry.spi.QuarryException;
import io.quarry.spi.TaskId;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import javax.inject.Inject;

import java.io.IOException;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static io.airlift.units.DataSize.succinctBytes;
import static io.quarry.spi.StandardErrorCode.CORRUPT_SPILL_DATA;
import static io.quarry.spi.StandardErrorCode.EXECUTION_MEMORY_UNAVAILABLE;
import static io.quarry.spi.StandardErrorCode.GENERIC_INTERNAL_ERROR;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Moves task units between execution memory and the durable store. A unit is written in
 * one call and its execution memory is released only after the write succeeded.
 */
@ThreadSafe
public class SpillManager
{
    private static final Logger log = Logger.get(SpillManager.class);

    static final int BUFFER_SIZE = 4 * 1024;

    private final ExecutionHandle executionHandle;
    private final DurableStoreClient storeClient;
    private final SpillerStats spillerStats;
    private final AtomicLong nextUnitId = new AtomicLong();

    @GuardedBy("this")
    private final Map<TaskId, Set<SpillHandle>> outstandingUnits = new HashMap<>();

    @Inject
    public SpillManager(UnifiedMemoryManager memoryManager, DurableStoreClient storeClient, SpillerStats spillerStats)
    {
        this(requireNonNull(memoryManager, "memoryManager is null").getExecutionHandle(), storeClient, spillerStats);
    }

    public SpillManager(ExecutionHandle executionHandle, DurableStoreClient storeClient, SpillerStats spillerStats)
    {
        this.executionHandle = requireNonNull(executionHandle, "executionHandle is null");
        this.storeClient = requireNonNull(storeClient, "storeClient is null");
        this.spillerStats = requireNonNull(spillerStats, "spillerStats is null");
    }

    /**
     * Writes the unit to the durable store and releases its execution memory. The task must
     * hold at least the unit's size in execution memory. If the write fails the memory stays
     * with the task.
     */
    public SpillHandle spill(SpillUnit unit)
    {
        requireNonNull(unit, "unit is null");
        TaskId taskId = unit.getTaskId();
        long sizeInBytes = unit.getSizeInBytes();
        long reservedBytes = executionHandle.getReservedBytes(taskId);
        checkArgument(sizeInBytes <= reservedBytes, "task %s holds %s bytes of execution memory, cannot spill a unit of %s bytes", taskId, reservedBytes, sizeInBytes);

        String unitId = taskId + "." + nextUnitId.getAndIncrement();
        storeClient.write(unitId, unit.getData());
        executionHandle.releaseExecutionMemory(taskId, sizeInBytes);
        spillerStats.addToTotalSpilledBytes(sizeInBytes);

        SpillHandle handle = new SpillHandle(unitId, taskId, sizeInBytes, this);
        synchronized (this) {
            outstandingUnits.computeIfAbsent(taskId, ignored -> new LinkedHashSet<>()).add(handle);
        }
        log.debug("Spilled %s of task %s as %s", succinctBytes(sizeInBytes), taskId, unitId);
        return handle;
    }

    /**
     * Reads a spilled unit back. The caller must already hold {@code grantedBytes} of execution
     * memory for the unit's task, and the grant must cover the whole unit.
     *
     * @throws QuarryException with {@code EXECUTION_MEMORY_UNAVAILABLE} when the grant is too small
     */
    public SpillUnit restore(SpillHandle handle, long grantedBytes)
    {
        requireNonNull(handle, "handle is null");
        checkState(!handle.isClosed(), "spilled unit %s was already deleted", handle.getUnitId());
        if (grantedBytes < handle.getSizeInBytes()) {
            throw new QuarryException(
                    EXECUTION_MEMORY_UNAVAILABLE,
                    format("Restoring unit %s needs %s of execution memory, but only %s was granted",
                            handle.getUnitId(),
                            succinctBytes(handle.getSizeInBytes()),
                            succinctBytes(grantedBytes)));
        }
        long reservedBytes = executionHandle.getReservedBytes(handle.getTaskId());
        checkArgument(grantedBytes <= reservedBytes, "task %s holds %s bytes of execution memory, not the %s bytes granted", handle.getTaskId(), reservedBytes, grantedBytes);

        Slice data = storeClient.read(handle.getUnitId());
        if (data.length() != handle.getSizeInBytes()) {
            throw new QuarryException(CORRUPT_SPILL_DATA, format("Spilled unit %s has %s bytes, expected %s", handle.getUnitId(), data.length(), handle.getSizeInBytes()));
        }
        spillerStats.addToTotalRestoredBytes(data.length());
        return new SpillUnit(handle.getTaskId(), data);
    }

    /**
     * Opens a sequential reader over a spilled unit without loading it into memory.
     */
    public SliceInput openStream(SpillHandle handle)
    {
        requireNonNull(handle, "handle is null");
        checkState(!handle.isClosed(), "spilled unit %s was already deleted", handle.getUnitId());
        return new InputStreamSliceInput(storeClient.openStream(handle.getUnitId()), BUFFER_SIZE);
    }

    /**
     * Deletes every unit the task still has in the durable store.
     */
    public void cleanupTask(TaskId taskId)
    {
        requireNonNull(taskId, "taskId is null");
        Set<SpillHandle> handles;
        synchronized (this) {
            handles = outstandingUnits.remove(taskId);
        }
        if (handles != null) {
            closeAll(handles);
        }
    }

    public void cleanupAll()
    {
        List<SpillHandle> handles;
        synchronized (this) {
            handles = outstandingUnits.values().stream()
                    .flatMap(Set::stream)
                    .collect(ImmutableList.toImmutableList());
            outstandingUnits.clear();
        }
        closeAll(handles);
    }

    public synchronized Set<SpillHandle> getOutstandingUnits(TaskId taskId)
    {
        return ImmutableSet.copyOf(outstandingUnits.getOrDefault(taskId, ImmutableSet.of()));
    }

    void deleteUnit(SpillHandle handle)
    {
        synchronized (this) {
            Set<SpillHandle> handles = outstandingUnits.get(handle.getTaskId());
            if (handles != null) {
                handles.remove(handle);
                if (handles.isEmpty()) {
                    outstandingUnits.remove(handle.getTaskId());
                }
            }
        }
        storeClient.delete(handle.getUnitId());
        spillerStats.incrementDeletedUnits();
    }

    private static void closeAll(Iterable<SpillHandle> handles)
    {
        Closer closer = Closer.create();
        handles.forEach(closer::register);
        try {
            closer.close();
        }
        catch (IOException e) {
            throw new QuarryException(GENERIC_INTERNAL_ERROR, "Failed to delete spilled units", e);
        }
    }
}
