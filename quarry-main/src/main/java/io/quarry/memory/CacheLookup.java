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

import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static io.quarry.memory.CacheLookup.Status.MISS;
import static java.util.Objects.requireNonNull;

/**
 * Result of reading a cached entry. A miss tells the owner to recompute the data; it is
 * returned for entries that were never cached, were dropped on eviction, or are being evicted.
 */
public final class CacheLookup
{
    public enum Status
    {
        MEMORY_HIT,
        DISK_HIT,
        MISS,
    }

    private static final CacheLookup CACHE_MISS = new CacheLookup(MISS, Optional.empty());

    private final Status status;
    private final Optional<Slice> content;

    private CacheLookup(Status status, Optional<Slice> content)
    {
        this.status = requireNonNull(status, "status is null");
        this.content = requireNonNull(content, "content is null");
        checkArgument(content.isPresent() == (status != MISS), "content must be present exactly for hits");
    }

    public static CacheLookup memoryHit(Slice content)
    {
        return new CacheLookup(Status.MEMORY_HIT, Optional.of(content));
    }

    public static CacheLookup diskHit(Slice content)
    {
        return new CacheLookup(Status.DISK_HIT, Optional.of(content));
    }

    public static CacheLookup miss()
    {
        return CACHE_MISS;
    }

    public Status getStatus()
    {
        return status;
    }

    public boolean isMiss()
    {
        return status == MISS;
    }

    public Optional<Slice> getContent()
    {
        return content;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("status", status)
                .add("contentBytes", content.map(Slice::length).orElse(0))
                .toString();
    }
}
