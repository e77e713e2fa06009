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
package io.quarry.skew;

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Output of the first, salted stage: one partial accumulator per salted key, with the
 * input bytes each salted partition received.
 */
public final class SaltedPartials<K, A>
{
    private final Map<SaltedKey<K>, A> partials;
    private final Map<SaltedKey<K>, Long> partitionBytes;

    public SaltedPartials(Map<SaltedKey<K>, A> partials, Map<SaltedKey<K>, Long> partitionBytes)
    {
        this.partials = ImmutableMap.copyOf(requireNonNull(partials, "partials is null"));
        this.partitionBytes = ImmutableMap.copyOf(requireNonNull(partitionBytes, "partitionBytes is null"));
    }

    public Map<SaltedKey<K>, A> getPartials()
    {
        return partials;
    }

    public Map<SaltedKey<K>, Long> getPartitionBytes()
    {
        return partitionBytes;
    }

    /**
     * Bytes of the largest salted partition of every original key.
     */
    public Map<K, Long> getLargestPartitionBytes()
    {
        Map<K, Long> largest = new LinkedHashMap<>();
        partitionBytes.forEach((saltedKey, bytes) -> largest.merge(saltedKey.getKey(), bytes, Math::max));
        return largest;
    }
}
