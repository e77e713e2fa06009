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

import com.google.common.annotations.VisibleForTesting;
import io.airlift.log.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.function.ToLongFunction;

import static java.util.Objects.requireNonNull;

/**
 * Two-stage grouping aggregation over salted keys. The first stage aggregates on
 * (key, salt), the second combines the partials of each key. A salted partition found
 * over the threshold after the first stage makes the stage run again with a wider plan.
 */
public class SaltedAggregation<K, V, A>
{
    private static final Logger log = Logger.get(SaltedAggregation.class);

    private final SkewCorrector skewCorrector;
    private final AggregationFunction<V, A> function;
    private final ToLongFunction<? super V> recordSize;
    private final Random random;

    public SaltedAggregation(SkewCorrector skewCorrector, AggregationFunction<V, A> function, ToLongFunction<? super V> recordSize)
    {
        this(skewCorrector, function, recordSize, new Random());
    }

    @VisibleForTesting
    SaltedAggregation(SkewCorrector skewCorrector, AggregationFunction<V, A> function, ToLongFunction<? super V> recordSize, Random random)
    {
        this.skewCorrector = requireNonNull(skewCorrector, "skewCorrector is null");
        this.function = requireNonNull(function, "function is null");
        this.recordSize = requireNonNull(recordSize, "recordSize is null");
        this.random = requireNonNull(random, "random is null");
    }

    /**
     * Aggregates with a plan derived from key statistics gathered over the records first.
     */
    public Map<K, A> aggregate(Iterable<Map.Entry<K, V>> records)
    {
        requireNonNull(records, "records is null");
        return aggregate(records, skewCorrector.plan(KeySkewStatistics.collect(records, recordSize)));
    }

    public Map<K, A> aggregate(Iterable<Map.Entry<K, V>> records, SkewPlan<K> initialPlan)
    {
        requireNonNull(records, "records is null");
        requireNonNull(initialPlan, "initialPlan is null");

        SkewPlan<K> plan = initialPlan;
        while (true) {
            SaltedPartials<K, A> partials = aggregateSalted(records, plan);
            SkewPlan<K> nextPlan = skewCorrector.replan(plan, partials.getLargestPartitionBytes());
            if (nextPlan.equals(plan)) {
                return combine(partials);
            }
            log.debug("Re-running salted stage with %s", nextPlan);
            plan = nextPlan;
        }
    }

    public SaltedPartials<K, A> aggregateSalted(Iterable<Map.Entry<K, V>> records, SkewPlan<K> plan)
    {
        requireNonNull(records, "records is null");
        requireNonNull(plan, "plan is null");

        Map<SaltedKey<K>, A> partials = new LinkedHashMap<>();
        Map<SaltedKey<K>, Long> partitionBytes = new LinkedHashMap<>();
        for (Map.Entry<K, V> record : records) {
            int fanOut = plan.getFanOut(record.getKey());
            int salt = fanOut > 1 ? random.nextInt(fanOut) : 0;
            SaltedKey<K> saltedKey = new SaltedKey<>(record.getKey(), salt);

            A accumulator = partials.get(saltedKey);
            if (accumulator == null) {
                accumulator = function.createAccumulator();
            }
            partials.put(saltedKey, function.add(accumulator, record.getValue()));
            partitionBytes.merge(saltedKey, recordSize.applyAsLong(record.getValue()), Long::sum);
        }
        return new SaltedPartials<>(partials, partitionBytes);
    }

    public Map<K, A> combine(SaltedPartials<K, A> partials)
    {
        requireNonNull(partials, "partials is null");
        Map<K, A> result = new LinkedHashMap<>();
        partials.getPartials().forEach((saltedKey, partial) -> result.merge(saltedKey.getKey(), partial, function::combine));
        return result;
    }
}
