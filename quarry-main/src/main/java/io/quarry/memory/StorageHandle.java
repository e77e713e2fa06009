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

import io.airlift.slice.Slice;

/**
 * Capability handed to owners of cached data. It deliberately offers no way to reclaim
 * memory from execution: storage only grows into execution capacity that is currently free.
 */
public interface StorageHandle
{
    /**
     * Reserves unevictable storage memory for data the caller manages itself. The reservation
     * never borrows execution capacity, though it may evict cached entries.
     */
    boolean acquireStorageMemory(String entryKey, long bytes);

    void releaseStorageMemory(String entryKey);

    boolean put(String key, Slice content, StorageLevel storageLevel);

    boolean put(String key, Slice content);

    CacheLookup get(String key);

    boolean remove(String key);

    long getResidentBytes();
}
