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
package io.quarry.memory;

import io.quarry.spi.TaskId;

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Execution memory lent to one task, either out of the execution pool itself or out of
 * storage capacity the task's request evicted.
 */
public final class ExecutionGrant
{
    private final TaskId taskId;
    private final long bytes;
    private final GrantSource source;

    public ExecutionGrant(TaskId taskId, long bytes, GrantSource source)
    {
        this.taskId = requireNonNull(taskId, "taskId is null");
        checkArgument(bytes > 0, "bytes must be positive");
        this.bytes = bytes;
        this.source = requireNonNull(source, "source is null");
    }

    public TaskId getTaskId()
    {
        return taskId;
    }

    public long getBytes()
    {
        return bytes;
    }

    public GrantSource getSource()
    {
        return source;
    }

    ExecutionGrant withBytes(long bytes)
    {
        return new ExecutionGrant(taskId, bytes, source);
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        ExecutionGrant other = (ExecutionGrant) obj;
        return bytes == other.bytes &&
                Objects.equals(taskId, other.taskId) &&
                source == other.source;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(taskId, bytes, source);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("taskId", taskId)
                .add("bytes", bytes)
                .add("source", source)
                .toString();
    }
}
