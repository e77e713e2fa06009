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

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;

public class SkewConfig
{
    private double thresholdFraction = 0.8;
    private int maxSaltFanOut = 64;
    private int maxAttempts = 3;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    public double getThresholdFraction()
    {
        return thresholdFraction;
    }

    @Config("skew.threshold-fraction")
    @ConfigDescription("Share of execution capacity a single grouping key may need before it is salted")
    public SkewConfig setThresholdFraction(double thresholdFraction)
    {
        this.thresholdFraction = thresholdFraction;
        return this;
    }

    @Min(2)
    public int getMaxSaltFanOut()
    {
        return maxSaltFanOut;
    }

    @Config("skew.max-salt-fan-out")
    public SkewConfig setMaxSaltFanOut(int maxSaltFanOut)
    {
        this.maxSaltFanOut = maxSaltFanOut;
        return this;
    }

    @Min(1)
    public int getMaxAttempts()
    {
        return maxAttempts;
    }

    @Config("skew.max-attempts")
    @ConfigDescription("Number of salting plans tried for a stage before it fails")
    public SkewConfig setMaxAttempts(int maxAttempts)
    {
        this.maxAttempts = maxAttempts;
        return this;
    }
}
