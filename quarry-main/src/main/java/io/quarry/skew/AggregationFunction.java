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

/**
 * Grouping aggregation that can be computed in two stages. {@link #combine} must be
 * associative and commutative for salted execution to produce the same result as
 * unsalted execution.
 *
 * @param <V> input value type
 * @param <A> accumulator type
 */
public interface AggregationFunction<V, A>
{
    A createAccumulator();

    A add(A accumulator, V value);

    A combine(A left, A right);
}
