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

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Storage region of the worker: cached entries plus unevictable reservations. Resident bytes
 * may exceed the region's own pool by what has been borrowed from execution. Guarded by the
 * owning {@link UnifiedMemoryManager}.
 */
@NotThreadSafe
final class StoragePool
{
    private final MemoryPool memoryPool;
    // insertion order breaks LRU ties
    private final Map<String, CacheEntry> entries = new LinkedHashMap<>();
    private final Map<String, Long> reservations = new HashMap<>();
    private long residentBytes;

    StoragePool(long capacityBytes)
    {
        this.memoryPool = new MemoryPool("storage", capacityBytes);
    }

    MemoryPool getMemoryPool()
    {
        return memoryPool;
    }

    @Nullable
    CacheEntry getEntry(String key)
    {
        return entries.get(key);
    }

    Collection<CacheEntry> getEntries()
    {
        return ImmutableList.copyOf(entries.values());
    }

    Set<String> getKeys()
    {
        return ImmutableSet.copyOf(entries.keySet());
    }

    void addEntry(CacheEntry entry)
    {
        requireNonNull(entry, "entry is null");
        CacheEntry existing = entries.putIfAbsent(entry.getKey(), entry);
        checkState(existing == null, "entry %s is already cached", entry.getKey());
    }

    @Nullable
    CacheEntry removeEntry(String key)
    {
        return entries.remove(key);
    }

    void addReservation(String key, long bytes)
    {
        reservations.merge(key, bytes, Long::sum);
    }

    @Nullable
    Long removeReservation(String key)
    {
        return reservations.remove(key);
    }

    Set<String> getReservationKeys()
    {
        return ImmutableSet.copyOf(reservations.keySet());
    }

    long getResidentBytes()
    {
        return residentBytes;
    }

    void addResidentBytes(long bytes)
    {
        checkArgument(bytes >= 0, "bytes is negative");
        residentBytes += bytes;
    }

    void removeResidentBytes(long bytes)
    {
        checkArgument(bytes >= 0, "bytes is negative");
        checkState(residentBytes >= bytes, "tried to free %s resident storage bytes, but only %s are resident", bytes, residentBytes);
        residentBytes -= bytes;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("memoryPool", memoryPool)
                .add("entries", entries.size())
                .add("reservations", reservations.size())
                .add("residentBytes", residentBytes)
                .toString();
    }
}
