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

import java.util.Collection;
import java.util.List;

public interface EvictionPolicy
{
    /**
     * Chooses which of the resident {@code candidates} to evict so that at least
     * {@code neededBytes} are freed. Returns fewer bytes than needed only when the
     * candidates are exhausted. The returned order is the order of eviction.
     */
    List<CacheEntry> selectVictims(Collection<CacheEntry> candidates, long neededBytes);
}
