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
package io.quarry.execution;

import com.google.common.io.Closer;
import io.airlift.slice.Slice;
import io.airlift.units.DataSize;
import io.quarry.memory.ExecutionHandle;
import io.quarry.spi.QuarryException;
import io.quarry.spi.TaskId;
import io.quarry.spiller.SpillHandle;
import io.quarry.spiller.SpillManager;
import io.quarry.spiller.SpillUnit;
import io.quarry.spiller.SpilledRunMerger;

import javax.annotation.concurrent.NotThreadSafe;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static io.quarry.spi.StandardErrorCode.GENERIC_INTERNAL_ERROR;
import static java.util.Objects.requireNonNull;

/**
 * Memory and spill operations of one task. Closing the context deletes the task's spilled
 * units and releases all of its execution memory, whatever state the task ended in.
 */
@NotThreadSafe
public class TaskMemoryContext
        implements AutoCloseable
{
    private final TaskId taskId;
    private final ExecutionHandle executionHandle;
    private final SpillManager spillManager;
    private final long bufferTriggerBytes;

    private boolean closed;

    public TaskMemoryContext(TaskId taskId, ExecutionHandle executionHandle, SpillManager spillManager, DataSize bufferTriggerSize)
    {
        this.taskId = requireNonNull(taskId, "taskId is null");
        this.executionHandle = requireNonNull(executionHandle, "executionHandle is null");
        this.spillManager = requireNonNull(spillManager, "spillManager is null");
        this.bufferTriggerBytes = requireNonNull(bufferTriggerSize, "bufferTriggerSize is null").toBytes();
    }

    public TaskId getTaskId()
    {
        return taskId;
    }

    /**
     * Returns the bytes granted, possibly fewer than requested.
     */
    public long reserve(long bytes)
    {
        checkOpen();
        return executionHandle.acquireExecutionMemory(taskId, bytes);
    }

    public void free(long bytes)
    {
        checkOpen();
        executionHandle.releaseExecutionMemory(taskId, bytes);
    }

    public long getReservedBytes()
    {
        return executionHandle.getReservedBytes(taskId);
    }

    public boolean shouldSpill(long bufferBytes)
    {
        return bufferBytes >= bufferTriggerBytes;
    }

    /**
     * Spills a buffer the task holds execution memory for; the memory is released once the buffer is written.
     */
    public SpillHandle spill(Slice buffer)
    {
        checkOpen();
        return spillManager.spill(new SpillUnit(taskId, buffer));
    }

    /**
     * Reserves memory for a spilled unit and reads it back. The unit is deleted from the
     * store once read. If the unit cannot be restored the reservation is returned.
     */
    public SpillUnit restore(SpillHandle handle)
    {
        checkOpen();
        requireNonNull(handle, "handle is null");
        checkArgument(handle.getTaskId().equals(taskId), "unit %s belongs to task %s, not %s", handle.getUnitId(), handle.getTaskId(), taskId);

        long grantedBytes = executionHandle.acquireExecutionMemory(taskId, handle.getSizeInBytes());
        SpillUnit unit;
        try {
            unit = spillManager.restore(handle, grantedBytes);
        }
        catch (RuntimeException e) {
            executionHandle.releaseExecutionMemory(taskId, grantedBytes);
            throw e;
        }
        handle.close();
        return unit;
    }

    public SpilledRunMerger mergeSpilledRuns(List<SpillHandle> runs, Comparator<? super Slice> ordering)
    {
        checkOpen();
        runs.forEach(run -> checkArgument(run.getTaskId().equals(taskId), "unit %s belongs to task %s, not %s", run.getUnitId(), run.getTaskId(), taskId));
        return new SpilledRunMerger(spillManager, runs, ordering);
    }

    @Override
    public void close()
    {
        if (closed) {
            return;
        }
        closed = true;

        Closer closer = Closer.create();
        closer.register(() -> executionHandle.releaseAllExecutionMemory(taskId));
        closer.register(() -> spillManager.cleanupTask(taskId));
        try {
            closer.close();
        }
        catch (IOException e) {
            throw new QuarryException(GENERIC_INTERNAL_ERROR, "Failed to release resources of task " + taskId, e);
        }
    }

    private void checkOpen()
    {
        checkState(!closed, "task memory context of %s is closed", taskId);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("taskId", taskId)
                .add("reservedBytes", getReservedBytes())
                .add("closed", closed)
                .toString();
    }
}
