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

import java.util.List;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public final class EvictionResult
{
    private final long requestedBytes;
    private final long freedBytes;
    private final List<String> writtenToDisk;
    private final List<String> dropped;

    public EvictionResult(long requestedBytes, long freedBytes, List<String> writtenToDisk, List<String> dropped)
    {
        checkArgument(requestedBytes >= 0, "requestedBytes is negative");
        checkArgument(freedBytes >= 0, "freedBytes is negative");
        this.requestedBytes = requestedBytes;
        this.freedBytes = freedBytes;
        this.writtenToDisk = ImmutableList.copyOf(requireNonNull(writtenToDisk, "writtenToDisk is null"));
        this.dropped = ImmutableList.copyOf(requireNonNull(dropped, "dropped is null"));
    }

    public long getRequestedBytes()
    {
        return requestedBytes;
    }

    public long getFreedBytes()
    {
        return freedBytes;
    }

    public boolean isSatisfied()
    {
        return freedBytes >= requestedBytes;
    }

    /**
     * Keys of the evicted entries that now live in the durable store only.
     */
    public List<String> getWrittenToDisk()
    {
        return writtenToDisk;
    }

    /**
     * Keys of the evicted entries whose owners must recompute them.
     */
    public List<String> getDropped()
    {
        return dropped;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("requestedBytes", requestedBytes)
                .add("freedBytes", freedBytes)
                .add("writtenToDisk", writtenToDisk)
                .add("dropped", dropped)
                .toString();
    }
}
