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

import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Salt fan-out per skewed key. Keys not in the plan are grouped as is, which is a fan-out of one.
 */
public final class SkewPlan<K>
{
    private final Map<K, Integer> fanOuts;
    private final int attempt;

    public SkewPlan(Map<K, Integer> fanOuts, int attempt)
    {
        requireNonNull(fanOuts, "fanOuts is null");
        fanOuts.values().forEach(fanOut -> checkArgument(fanOut > 1, "fan-out of a salted key must be greater than one"));
        checkArgument(attempt >= 1, "attempt must be at least 1");
        this.fanOuts = ImmutableMap.copyOf(fanOuts);
        this.attempt = attempt;
    }

    public static <K> SkewPlan<K> unsalted()
    {
        return new SkewPlan<>(ImmutableMap.of(), 1);
    }

    public int getFanOut(K key)
    {
        return fanOuts.getOrDefault(key, 1);
    }

    public boolean isSalted(K key)
    {
        return fanOuts.containsKey(key);
    }

    public Set<K> getSaltedKeys()
    {
        return fanOuts.keySet();
    }

    public Map<K, Integer> getFanOuts()
    {
        return fanOuts;
    }

    public int getAttempt()
    {
        return attempt;
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        SkewPlan<?> other = (SkewPlan<?>) obj;
        return attempt == other.attempt &&
                Objects.equals(fanOuts, other.fanOuts);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(fanOuts, attempt);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("fanOuts", fanOuts)
                .add("attempt", attempt)
                .toString();
    }
}
