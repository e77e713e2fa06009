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

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static io.quarry.memory.CacheEntry.State.DROPPED;
import static io.quarry.memory.CacheEntry.State.EVICTING;
import static io.quarry.memory.CacheEntry.State.IN_MEMORY;
import static io.quarry.memory.CacheEntry.State.ON_DISK;
import static java.util.Objects.requireNonNull;

/**
 * One cached dataset partition. All mutation happens under the {@link UnifiedMemoryManager} lock.
 */
@NotThreadSafe
public final class CacheEntry
{
    public enum State
    {
        IN_MEMORY,
        /**
         * Selected for eviction; the fallback write is in progress and the entry cannot be read.
         */
        EVICTING,
        ON_DISK,
        DROPPED,
    }

    private final String key;
    private final long version;
    private final long sizeBytes;
    private final StorageLevel storageLevel;

    private State state;
    private long lastAccessNanos;
    @Nullable
    private Slice content;
    private boolean onDisk;
    private boolean removed;

    CacheEntry(String key, long version, Slice content, StorageLevel storageLevel, State state, long lastAccessNanos)
    {
        this.key = requireNonNull(key, "key is null");
        this.version = version;
        this.content = requireNonNull(content, "content is null");
        this.sizeBytes = content.length();
        this.storageLevel = requireNonNull(storageLevel, "storageLevel is null");
        this.state = requireNonNull(state, "state is null");
        this.lastAccessNanos = lastAccessNanos;
        checkArgument(state == IN_MEMORY || state == ON_DISK, "new entry must be in memory or on disk");
        if (state == ON_DISK) {
            this.onDisk = true;
            this.content = null;
        }
    }

    public String getKey()
    {
        return key;
    }

    public long getSizeBytes()
    {
        return sizeBytes;
    }

    public StorageLevel getStorageLevel()
    {
        return storageLevel;
    }

    public int getReplicaCount()
    {
        return storageLevel.getReplication();
    }

    public State getState()
    {
        return state;
    }

    public long getLastAccessNanos()
    {
        return lastAccessNanos;
    }

    /**
     * Whether a copy of the content exists in the durable store.
     */
    public boolean isOnDisk()
    {
        return onDisk;
    }

    boolean isRemoved()
    {
        return removed;
    }

    @Nullable
    Slice getContent()
    {
        return content;
    }

    /**
     * Durable store unit holding the disk copy. Every put of a key writes to a unit of its own.
     */
    String getUnitId()
    {
        return "cache-" + key + "." + version;
    }

    void touch(long nanos)
    {
        lastAccessNanos = nanos;
    }

    void markEvicting()
    {
        checkState(state == IN_MEMORY, "entry %s is %s, not in memory", key, state);
        state = EVICTING;
    }

    void markWrittenToDisk()
    {
        checkState(state == EVICTING, "entry %s is not being evicted", key);
        onDisk = true;
    }

    /**
     * Ends an eviction: the entry keeps its identity on disk when a copy was written, otherwise it is dropped.
     */
    void completeEviction()
    {
        checkState(state == EVICTING, "entry %s is not being evicted", key);
        content = null;
        state = onDisk ? ON_DISK : DROPPED;
    }

    void readmit(Slice content)
    {
        checkState(state == ON_DISK, "entry %s is %s, not on disk", key, state);
        requireNonNull(content, "content is null");
        checkArgument(content.length() == sizeBytes, "content size changed for entry %s", key);
        this.content = content;
        state = IN_MEMORY;
    }

    void markRemoved()
    {
        removed = true;
    }

    void drop()
    {
        content = null;
        state = DROPPED;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("key", key)
                .add("sizeBytes", sizeBytes)
                .add("storageLevel", storageLevel)
                .add("state", state)
                .add("lastAccessNanos", lastAccessNanos)
                .add("onDisk", onDisk)
                .toString();
    }
}
