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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.quarry.ExceededCapacityException;
import org.testng.annotations.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.google.common.collect.Maps.immutableEntry;
import static org.testng.Assert.assertEquals;

public class TestSaltedAggregation
{
    @Test
    public void testTwoPartialsCombined()
    {
        SkewCorrector corrector = new SkewCorrector(500, 64, 3);
        SaltedAggregation<String, Long, Long> aggregation = new SaltedAggregation<>(corrector, AggregationFunctions.longSum(), value -> value, new RoundRobinRandom());
        List<Map.Entry<String, Long>> records = records(ImmutableMap.of("hot", 9, "cold", 1), 100L);

        SkewPlan<String> plan = corrector.plan(KeySkewStatistics.collect(records, value -> value));
        assertEquals(plan.getFanOut("hot"), 2);

        SaltedPartials<String, Long> partials = aggregation.aggregateSalted(records, plan);
        assertEquals(partials.getPartials(), ImmutableMap.of(
                new SaltedKey<>("hot", 0), 500L,
                new SaltedKey<>("hot", 1), 400L,
                new SaltedKey<>("cold", 0), 100L));
        assertEquals(partials.getLargestPartitionBytes(), ImmutableMap.of("hot", 500L, "cold", 100L));

        assertEquals(aggregation.combine(partials), ImmutableMap.of("hot", 900L, "cold", 100L));
        assertEquals(aggregation.aggregate(records), ImmutableMap.of("hot", 900L, "cold", 100L));
    }

    @Test
    public void testOversizedPartitionFoundAtRuntime()
    {
        SkewCorrector corrector = new SkewCorrector(500, 64, 3);
        SaltedAggregation<String, Long, Long> aggregation = new SaltedAggregation<>(corrector, AggregationFunctions.longSum(), value -> value, new RoundRobinRandom());
        List<Map.Entry<String, Long>> records = records(ImmutableMap.of("hot", 9), 100L);

        // planned without statistics, the first run finds the key too large and salts it
        assertEquals(aggregation.aggregate(records, SkewPlan.unsalted()), ImmutableMap.of("hot", 900L));
    }

    @Test(expectedExceptions = ExceededCapacityException.class)
    public void testKeyTooLargeToSalt()
    {
        SkewCorrector corrector = new SkewCorrector(100, 2, 3);
        SaltedAggregation<String, Long, Long> aggregation = new SaltedAggregation<>(corrector, AggregationFunctions.longSum(), value -> value);
        aggregation.aggregate(records(ImmutableMap.of("hot", 9), 100L));
    }

    @Test
    public void testSaltedEqualsUnsalted()
    {
        for (int seed = 0; seed < 10; seed++) {
            Random random = new Random(seed);
            ImmutableList.Builder<Map.Entry<Integer, Long>> builder = ImmutableList.builder();
            for (int i = 0; i < 2_000; i++) {
                // key 0 dominates the input
                int key = random.nextInt(3) == 0 ? random.nextInt(20) : 0;
                builder.add(immutableEntry(key, (long) random.nextInt(1_000)));
            }
            List<Map.Entry<Integer, Long>> records = builder.build();
            SkewCorrector corrector = new SkewCorrector(100_000, 64, 5);

            SaltedAggregation<Integer, Long, Long> sum = new SaltedAggregation<>(corrector, AggregationFunctions.longSum(), value -> 100, new Random(seed));
            SaltedAggregation<Integer, Long, Long> count = new SaltedAggregation<>(corrector, AggregationFunctions.count(), value -> 100, new Random(seed));
            SaltedAggregation<Integer, Long, Long> max = new SaltedAggregation<>(corrector, AggregationFunctions.longMax(), value -> 100, new Random(seed));

            assertEquals(sum.aggregate(records), aggregateUnsalted(records, AggregationFunctions.longSum()));
            assertEquals(count.aggregate(records), aggregateUnsalted(records, AggregationFunctions.<Long>count()));
            assertEquals(max.aggregate(records), aggregateUnsalted(records, AggregationFunctions.longMax()));
        }
    }

    private static <K, V, A> Map<K, A> aggregateUnsalted(List<Map.Entry<K, V>> records, AggregationFunction<V, A> function)
    {
        Map<K, A> result = new HashMap<>();
        for (Map.Entry<K, V> record : records) {
            A accumulator = result.containsKey(record.getKey()) ? result.get(record.getKey()) : function.createAccumulator();
            result.put(record.getKey(), function.add(accumulator, record.getValue()));
        }
        return result;
    }

    private static List<Map.Entry<String, Long>> records(Map<String, Integer> counts, long value)
    {
        ImmutableList.Builder<Map.Entry<String, Long>> records = ImmutableList.builder();
        counts.forEach((key, count) -> {
            for (int i = 0; i < count; i++) {
                records.add(immutableEntry(key, value));
            }
        });
        return records.build();
    }

    private static class RoundRobinRandom
            extends Random
    {
        private int next;

        @Override
        public int nextInt(int bound)
        {
            return next++ % bound;
        }
    }
}
