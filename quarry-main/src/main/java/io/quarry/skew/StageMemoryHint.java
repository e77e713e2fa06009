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

import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * What the plan compiler knows about a grouping stage before it runs.
 */
public final class StageMemoryHint<K>
{
    private final String stageId;
    private final long estimatedBytes;
    private final Optional<KeySkewStatistics<K>> keyStatistics;

    public StageMemoryHint(String stageId, long estimatedBytes, Optional<KeySkewStatistics<K>> keyStatistics)
    {
        this.stageId = requireNonNull(stageId, "stageId is null");
        checkArgument(estimatedBytes >= 0, "estimatedBytes is negative");
        this.estimatedBytes = estimatedBytes;
        this.keyStatistics = requireNonNull(keyStatistics, "keyStatistics is null");
    }

    public String getStageId()
    {
        return stageId;
    }

    public long getEstimatedBytes()
    {
        return estimatedBytes;
    }

    public Optional<KeySkewStatistics<K>> getKeyStatistics()
    {
        return keyStatistics;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("stageId", stageId)
                .add("estimatedBytes", estimatedBytes)
                .add("keyStatistics", keyStatistics.orElse(null))
                .toString();
    }
}
