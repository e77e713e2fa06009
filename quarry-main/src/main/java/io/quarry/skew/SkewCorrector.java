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
import io.airlift.units.DataSize;
import io.quarry.ExceededCapacityException;
import io.quarry.memory.UnifiedMemoryManager;

import javax.annotation.concurrent.ThreadSafe;
import javax.inject.Inject;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static io.airlift.units.DataSize.succinctBytes;
import static io.quarry.ExceededCapacityException.exceededSaltFanOut;
import static io.quarry.ExceededCapacityException.exceededSkewAttempts;
import static java.lang.Math.max;
import static java.lang.Math.min;
import static java.util.Objects.requireNonNull;

/**
 * Rewrites grouping stages whose largest key would not fit in execution memory. Each such
 * key is spread over N salted keys so every salted partition stays strictly below the
 * threshold; a second stage combines the partials back per key.
 */
@ThreadSafe
public class SkewCorrector
{
    private static final Logger log = Logger.get(SkewCorrector.class);

    private final long thresholdBytes;
    private final int maxSaltFanOut;
    private final int maxAttempts;

    @Inject
    public SkewCorrector(SkewConfig config, UnifiedMemoryManager memoryManager)
    {
        this(
                Math.round(requireNonNull(memoryManager, "memoryManager is null").getExecutionCapacityBytes() * requireNonNull(config, "config is null").getThresholdFraction()),
                config.getMaxSaltFanOut(),
                config.getMaxAttempts());
    }

    public SkewCorrector(long thresholdBytes, int maxSaltFanOut, int maxAttempts)
    {
        checkArgument(thresholdBytes > 0, "thresholdBytes must be positive");
        checkArgument(maxSaltFanOut >= 2, "maxSaltFanOut must be at least 2");
        checkArgument(maxAttempts >= 1, "maxAttempts must be at least 1");
        this.thresholdBytes = thresholdBytes;
        this.maxSaltFanOut = maxSaltFanOut;
        this.maxAttempts = maxAttempts;
    }

    public long getThresholdBytes()
    {
        return thresholdBytes;
    }

    public <K> SkewPlan<K> plan(StageMemoryHint<K> hint)
    {
        requireNonNull(hint, "hint is null");
        if (!hint.getKeyStatistics().isPresent()) {
            return SkewPlan.unsalted();
        }
        SkewPlan<K> plan = plan(hint.getKeyStatistics().get());
        if (!plan.getSaltedKeys().isEmpty()) {
            log.debug("Salting %s keys of stage %s", plan.getSaltedKeys().size(), hint.getStageId());
        }
        return plan;
    }

    /**
     * @throws ExceededCapacityException if a key needs more salts than allowed
     */
    public <K> SkewPlan<K> plan(KeySkewStatistics<K> statistics)
    {
        requireNonNull(statistics, "statistics is null");
        Map<K, Integer> fanOuts = new LinkedHashMap<>();
        for (Map.Entry<K, Long> entry : statistics.getBytesPerKey().entrySet()) {
            long keyBytes = entry.getValue();
            if (keyBytes <= thresholdBytes) {
                continue;
            }
            int fanOut = requiredFanOut(keyBytes);
            if (fanOut > maxSaltFanOut) {
                throw exceededSaltFanOut(entry.getKey(), keyBytes, threshold(), maxSaltFanOut);
            }
            log.debug("Key %s holds %s, salting it %s ways", entry.getKey(), succinctBytes(keyBytes), fanOut);
            fanOuts.put(entry.getKey(), fanOut);
        }
        return new SkewPlan<>(fanOuts, 1);
    }

    /**
     * Adjusts a plan after the largest salted partition of some keys was observed at runtime.
     * Returns the same plan when every observed partition is within the threshold, so calling
     * it again with the same observations changes nothing.
     *
     * @param largestPartitionBytes per original key, the bytes of its largest salted partition
     * @throws ExceededCapacityException if the maximum fan-out or number of attempts is reached
     */
    public <K> SkewPlan<K> replan(SkewPlan<K> plan, Map<K, Long> largestPartitionBytes)
    {
        requireNonNull(plan, "plan is null");
        requireNonNull(largestPartitionBytes, "largestPartitionBytes is null");

        Map<K, Integer> fanOuts = new LinkedHashMap<>(plan.getFanOuts());
        boolean changed = false;
        for (Map.Entry<K, Long> entry : largestPartitionBytes.entrySet()) {
            K key = entry.getKey();
            long partitionBytes = entry.getValue();
            if (partitionBytes <= thresholdBytes) {
                continue;
            }
            if (plan.getAttempt() >= maxAttempts) {
                throw exceededSkewAttempts(plan.getAttempt(), threshold());
            }
            int currentFanOut = plan.getFanOut(key);
            // a salt may have received all of the key
            long keyBytes = partitionBytes * currentFanOut;
            int fanOut = min(max(currentFanOut * 2, requiredFanOut(keyBytes)), maxSaltFanOut);
            if (fanOut <= currentFanOut) {
                throw exceededSaltFanOut(key, keyBytes, threshold(), maxSaltFanOut);
            }
            log.debug("Salted partition of key %s holds %s, increasing fan-out from %s to %s", key, succinctBytes(partitionBytes), currentFanOut, fanOut);
            fanOuts.put(key, fanOut);
            changed = true;
        }
        if (!changed) {
            return plan;
        }
        return new SkewPlan<>(fanOuts, plan.getAttempt() + 1);
    }

    @VisibleForTesting
    int requiredFanOut(long keyBytes)
    {
        long fanOut = keyBytes / thresholdBytes + 1;
        return (int) min(fanOut, Integer.MAX_VALUE);
    }

    private DataSize threshold()
    {
        return succinctBytes(thresholdBytes);
    }
}
