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
import java.util.function.ToLongFunction;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Bytes of input per grouping key, either estimated by the plan compiler or counted at runtime.
 */
public final class KeySkewStatistics<K>
{
    private final Map<K, Long> bytesPerKey;

    public KeySkewStatistics(Map<K, Long> bytesPerKey)
    {
        requireNonNull(bytesPerKey, "bytesPerKey is null");
        bytesPerKey.values().forEach(bytes -> checkArgument(bytes >= 0, "key volume is negative"));
        this.bytesPerKey = ImmutableMap.copyOf(bytesPerKey);
    }

    public static <K, V> KeySkewStatistics<K> collect(Iterable<Map.Entry<K, V>> records, ToLongFunction<? super V> recordSize)
    {
        requireNonNull(records, "records is null");
        requireNonNull(recordSize, "recordSize is null");
        Map<K, Long> bytesPerKey = new LinkedHashMap<>();
        for (Map.Entry<K, V> record : records) {
            bytesPerKey.merge(record.getKey(), recordSize.applyAsLong(record.getValue()), Long::sum);
        }
        return new KeySkewStatistics<>(bytesPerKey);
    }

    public Map<K, Long> getBytesPerKey()
    {
        return bytesPerKey;
    }

    public long getBytes(K key)
    {
        return bytesPerKey.getOrDefault(key, 0L);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("keys", bytesPerKey.size())
                .toString();
    }
}
