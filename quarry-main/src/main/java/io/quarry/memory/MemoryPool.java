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

import org.weakref.jmx.Managed;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Fixed-capacity byte accounting. Holds no policy: callers decide what to do when
 * {@link #tryAcquire} fails.
 */
@ThreadSafe
public class MemoryPool
{
    private final String name;
    private final long capacityBytes;

    @GuardedBy("this")
    private long usedBytes;

    public MemoryPool(String name, long capacityBytes)
    {
        this.name = requireNonNull(name, "name is null");
        checkArgument(capacityBytes >= 0, "capacityBytes is negative");
        this.capacityBytes = capacityBytes;
    }

    /**
     * Reserves the given number of bytes if they fit. On failure the pool is left unchanged.
     */
    public synchronized boolean tryAcquire(long bytes)
    {
        checkArgument(bytes >= 0, "bytes is negative");
        if (bytes > capacityBytes - usedBytes) {
            return false;
        }
        usedBytes += bytes;
        return true;
    }

    public synchronized void release(long bytes)
    {
        checkArgument(bytes >= 0, "bytes is negative");
        checkState(usedBytes - bytes >= 0, "tried to release %s bytes from pool %s, but only %s are used", bytes, name, usedBytes);
        usedBytes -= bytes;
    }

    /**
     * Returns the number of free bytes. The value is a snapshot and may be stale by the time
     * the caller reads it.
     */
    @Managed
    public synchronized long availableBytes()
    {
        return capacityBytes - usedBytes;
    }

    @Managed
    public long getCapacityBytes()
    {
        return capacityBytes;
    }

    @Managed
    public synchronized long getUsedBytes()
    {
        return usedBytes;
    }

    @Override
    public synchronized String toString()
    {
        return toStringHelper(this)
                .add("name", name)
                .add("capacityBytes", capacityBytes)
                .add("usedBytes", usedBytes)
                .toString();
    }
}
