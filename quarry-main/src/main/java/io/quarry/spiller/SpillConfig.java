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
package io.quarry.spiller;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.airlift.units.DataSize;
import io.airlift.units.Duration;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.airlift.units.DataSize.Unit.MEGABYTE;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;

public class SpillConfig
{
    public static final String SPILL_PATH = "spiller.spill-path";

    private List<Path> spillPaths = ImmutableList.of();
    private DataSize bufferTriggerSize = DataSize.of(64, MEGABYTE);
    private double maxUsedSpaceThreshold = 0.9;
    private int maxAttempts = 3;
    private Duration minBackoffDelay = new Duration(100, MILLISECONDS);
    private Duration maxBackoffDelay = new Duration(1, SECONDS);

    @NotNull
    public List<Path> getSpillPaths()
    {
        return spillPaths;
    }

    @Config(SPILL_PATH)
    @ConfigDescription("Comma separated list of directories spilled units are written to")
    public SpillConfig setSpillPaths(String spillPaths)
    {
        this.spillPaths = Splitter.on(",").trimResults().omitEmptyStrings().splitToList(spillPaths).stream()
                .map(Paths::get)
                .collect(toImmutableList());
        return this;
    }

    @NotNull
    public DataSize getBufferTriggerSize()
    {
        return bufferTriggerSize;
    }

    @Config("spiller.buffer-trigger-size")
    @ConfigDescription("Size of a task buffer above which it should be spilled")
    public SpillConfig setBufferTriggerSize(DataSize bufferTriggerSize)
    {
        this.bufferTriggerSize = bufferTriggerSize;
        return this;
    }

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    public double getMaxUsedSpaceThreshold()
    {
        return maxUsedSpaceThreshold;
    }

    @Config("spiller.max-used-space-threshold")
    public SpillConfig setMaxUsedSpaceThreshold(double maxUsedSpaceThreshold)
    {
        this.maxUsedSpaceThreshold = maxUsedSpaceThreshold;
        return this;
    }

    @Min(1)
    public int getMaxAttempts()
    {
        return maxAttempts;
    }

    @Config("spiller.max-attempts")
    @ConfigDescription("Attempts made for each durable store call before giving up")
    public SpillConfig setMaxAttempts(int maxAttempts)
    {
        this.maxAttempts = maxAttempts;
        return this;
    }

    @NotNull
    public Duration getMinBackoffDelay()
    {
        return minBackoffDelay;
    }

    @Config("spiller.min-backoff-delay")
    public SpillConfig setMinBackoffDelay(Duration minBackoffDelay)
    {
        this.minBackoffDelay = minBackoffDelay;
        return this;
    }

    @NotNull
    public Duration getMaxBackoffDelay()
    {
        return maxBackoffDelay;
    }

    @Config("spiller.max-backoff-delay")
    public SpillConfig setMaxBackoffDelay(Duration maxBackoffDelay)
    {
        this.maxBackoffDelay = maxBackoffDelay;
        return this;
    }
}
