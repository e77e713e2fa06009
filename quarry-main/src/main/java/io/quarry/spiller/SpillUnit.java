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

import io.airlift.slice.Slice;
import io.quarry.spi.TaskId;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * One buffer of intermediate state owned by a single task. A unit is spilled and restored as a whole.
 */
public final class SpillUnit
{
    private final TaskId taskId;
    private final Slice data;

    public SpillUnit(TaskId taskId, Slice data)
    {
        this.taskId = requireNonNull(taskId, "taskId is null");
        this.data = requireNonNull(data, "data is null");
    }

    public TaskId getTaskId()
    {
        return taskId;
    }

    public Slice getData()
    {
        return data;
    }

    public long getSizeInBytes()
    {
        return data.length();
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("taskId", taskId)
                .add("sizeInBytes", getSizeInBytes())
                .toString();
    }
}
