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

/**
 * Capability handed to task executors. Execution may evict cached entries to make room for
 * itself; nothing reachable from {@link StorageHandle} can take memory back from execution.
 */
public interface ExecutionHandle
{
    /**
     * Returns the number of bytes granted, which is less than requested when the worker is
     * short of memory. Never blocks and never fails for lack of memory.
     */
    long acquireExecutionMemory(TaskId taskId, long requestedBytes);

    void releaseExecutionMemory(TaskId taskId, long bytes);

    /**
     * Releases everything the task holds. Safe to call repeatedly and for tasks that hold nothing.
     */
    void releaseAllExecutionMemory(TaskId taskId);

    long getReservedBytes(TaskId taskId);

    long getExecutionCapacityBytes();

    EvictionResult evictCachedEntries(long bytes);
}
