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

public final class AggregationFunctions
{
    private AggregationFunctions() {}

    public static AggregationFunction<Long, Long> longSum()
    {
        return new AggregationFunction<Long, Long>()
        {
            @Override
            public Long createAccumulator()
            {
                return 0L;
            }

            @Override
            public Long add(Long accumulator, Long value)
            {
                return accumulator + value;
            }

            @Override
            public Long combine(Long left, Long right)
            {
                return left + right;
            }
        };
    }

    public static <V> AggregationFunction<V, Long> count()
    {
        return new AggregationFunction<V, Long>()
        {
            @Override
            public Long createAccumulator()
            {
                return 0L;
            }

            @Override
            public Long add(Long accumulator, V value)
            {
                return accumulator + 1;
            }

            @Override
            public Long combine(Long left, Long right)
            {
                return left + right;
            }
        };
    }

    public static AggregationFunction<Long, Long> longMax()
    {
        return new AggregationFunction<Long, Long>()
        {
            @Override
            public Long createAccumulator()
            {
                return Long.MIN_VALUE;
            }

            @Override
            public Long add(Long accumulator, Long value)
            {
                return Math.max(accumulator, value);
            }

            @Override
            public Long combine(Long left, Long right)
            {
                return Math.max(left, right);
            }
        };
    }
}
