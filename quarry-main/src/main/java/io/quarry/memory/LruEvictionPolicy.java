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
import com.google.common.collect.Ordering;

import java.util.Collection;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static io.quarry.memory.CacheEntry.State.IN_MEMORY;
import static java.util.Objects.requireNonNull;

/**
 * Evicts the least recently accessed entries first. Entries with equal access times keep
 * the order in which they were offered.
 */
public class LruEvictionPolicy
        implements EvictionPolicy
{
    private static final Ordering<CacheEntry> ORDER_BY_LAST_ACCESS = Ordering.natural().onResultOf(CacheEntry::getLastAccessNanos);

    @Override
    public List<CacheEntry> selectVictims(Collection<CacheEntry> candidates, long neededBytes)
    {
        requireNonNull(candidates, "candidates is null");
        checkArgument(neededBytes >= 0, "neededBytes is negative");

        ImmutableList.Builder<CacheEntry> victims = ImmutableList.builder();
        long selectedBytes = 0;
        for (CacheEntry entry : ORDER_BY_LAST_ACCESS.sortedCopy(candidates)) {
            if (selectedBytes >= neededBytes) {
                break;
            }
            if (entry.getState() != IN_MEMORY) {
                continue;
            }
            victims.add(entry);
            selectedBytes += entry.getSizeBytes();
        }
        return victims.build();
    }
}
