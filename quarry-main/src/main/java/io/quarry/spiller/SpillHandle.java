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

import io.quarry.spi.TaskId;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import java.io.Closeable;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Reference to a spilled unit in the durable store. Closing the handle deletes the unit.
 */
@ThreadSafe
public final class SpillHandle
        implements Closeable
{
    private final String unitId;
    private final TaskId taskId;
    private final long sizeInBytes;
    private final SpillManager spillManager;

    @GuardedBy("this")
    private boolean closed;

    SpillHandle(String unitId, TaskId taskId, long sizeInBytes, SpillManager spillManager)
    {
        this.unitId = requireNonNull(unitId, "unitId is null");
        this.taskId = requireNonNull(taskId, "taskId is null");
        this.sizeInBytes = sizeInBytes;
        this.spillManager = requireNonNull(spillManager, "spillManager is null");
    }

    public String getUnitId()
    {
        return unitId;
    }

    public TaskId getTaskId()
    {
        return taskId;
    }

    public long getSizeInBytes()
    {
        return sizeInBytes;
    }

    public synchronized boolean isClosed()
    {
        return closed;
    }

    @Override
    public void close()
    {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        spillManager.deleteUnit(this);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("unitId", unitId)
                .add("taskId", taskId)
                .add("sizeInBytes", sizeInBytes)
                .toString();
    }
}
