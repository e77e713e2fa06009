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

public enum StorageLevel
{
    MEMORY_ONLY(true, false, 1),
    MEMORY_AND_DISK(true, true, 1),
    DISK_ONLY(false, true, 1),
    MEMORY_ONLY_2(true, false, 2),
    MEMORY_AND_DISK_2(true, true, 2);

    private final boolean useMemory;
    private final boolean useDisk;
    private final int replication;

    StorageLevel(boolean useMemory, boolean useDisk, int replication)
    {
        this.useMemory = useMemory;
        this.useDisk = useDisk;
        this.replication = replication;
    }

    public boolean useMemory()
    {
        return useMemory;
    }

    /**
     * Whether an entry may fall back to the durable store instead of being dropped on eviction.
     */
    public boolean useDisk()
    {
        return useDisk;
    }

    public int getReplication()
    {
        return replication;
    }
}
