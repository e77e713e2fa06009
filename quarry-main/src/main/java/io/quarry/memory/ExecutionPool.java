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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.quarry.spi.TaskId;

import javax.annotation.concurrent.NotThreadSafe;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static io.quarry.memory.GrantSource.OWN_POOL;
import static io.quarry.memory.GrantSource.RECLAIMED_FROM_STORAGE;
import static java.util.Objects.requireNonNull;

/**
 * Execution region of the worker and the grants handed out of it. Guarded by the owning
 * {@link UnifiedMemoryManager}.
 */
@NotThreadSafe
final class ExecutionPool
{
    // reclaimed bytes go back first so storage regains its region as early as possible
    private static final List<GrantSource> RELEASE_ORDER = ImmutableList.of(RECLAIMED_FROM_STORAGE, OWN_POOL);

    private final MemoryPool memoryPool;
    private final Map<TaskId, List<ExecutionGrant>> grants = new HashMap<>();

    ExecutionPool(long capacityBytes)
    {
        this.memoryPool = new MemoryPool("execution", capacityBytes);
    }

    MemoryPool getMemoryPool()
    {
        return memoryPool;
    }

    void addGrant(ExecutionGrant grant)
    {
        requireNonNull(grant, "grant is null");
        grants.computeIfAbsent(grant.getTaskId(), ignored -> new ArrayList<>()).add(grant);
    }

    long getReservedBytes(TaskId taskId)
    {
        return grants.getOrDefault(taskId, ImmutableList.of()).stream()
                .mapToLong(ExecutionGrant::getBytes)
                .sum();
    }

    long getGrantedBytes()
    {
        return grants.values().stream()
                .flatMap(List::stream)
                .mapToLong(ExecutionGrant::getBytes)
                .sum();
    }

    List<ExecutionGrant> getGrants(TaskId taskId)
    {
        return ImmutableList.copyOf(grants.getOrDefault(taskId, ImmutableList.of()));
    }

    Set<TaskId> getTasks()
    {
        return ImmutableSet.copyOf(grants.keySet());
    }

    /**
     * Takes {@code bytes} out of the task's grants and returns the released portions.
     */
    List<ExecutionGrant> removeBytes(TaskId taskId, long bytes)
    {
        checkArgument(bytes >= 0, "bytes is negative");
        long reservedBytes = getReservedBytes(taskId);
        checkArgument(bytes <= reservedBytes, "tried to free %s bytes of execution memory, but task %s holds %s", bytes, taskId, reservedBytes);
        if (bytes == 0) {
            return ImmutableList.of();
        }

        List<ExecutionGrant> taskGrants = grants.get(taskId);
        ImmutableList.Builder<ExecutionGrant> released = ImmutableList.builder();
        long remaining = bytes;
        for (GrantSource source : RELEASE_ORDER) {
            for (int i = taskGrants.size() - 1; i >= 0 && remaining > 0; i--) {
                ExecutionGrant grant = taskGrants.get(i);
                if (grant.getSource() != source) {
                    continue;
                }
                if (grant.getBytes() <= remaining) {
                    taskGrants.remove(i);
                    released.add(grant);
                    remaining -= grant.getBytes();
                }
                else {
                    taskGrants.set(i, grant.withBytes(grant.getBytes() - remaining));
                    released.add(grant.withBytes(remaining));
                    remaining = 0;
                }
            }
        }
        if (taskGrants.isEmpty()) {
            grants.remove(taskId);
        }
        return released.build();
    }

    List<ExecutionGrant> removeAll(TaskId taskId)
    {
        List<ExecutionGrant> taskGrants = grants.remove(taskId);
        if (taskGrants == null) {
            return ImmutableList.of();
        }
        return ImmutableList.copyOf(taskGrants);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("memoryPool", memoryPool)
                .add("tasks", grants.size())
                .toString();
    }
}
