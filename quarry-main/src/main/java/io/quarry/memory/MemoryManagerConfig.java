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
package io.quarry.memory;

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.airlift.units.DataSize;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.NotNull;

import static io.airlift.units.DataSize.Unit.GIGABYTE;
import static io.airlift.units.DataSize.Unit.MEGABYTE;
import static io.quarry.memory.StorageLevel.MEMORY_AND_DISK;

public class MemoryManagerConfig
{
    private DataSize totalWorkerMemory = DataSize.of(4, GIGABYTE);
    private DataSize reservedRegionSize = DataSize.of(300, MEGABYTE);
    private double executionFraction = 0.6;
    private StorageLevel defaultStorageLevel = MEMORY_AND_DISK;

    @NotNull
    public DataSize getTotalWorkerMemory()
    {
        return totalWorkerMemory;
    }

    @Config("memory.total-worker-memory")
    @ConfigDescription("Working memory available to the worker, including the reserved region")
    public MemoryManagerConfig setTotalWorkerMemory(DataSize totalWorkerMemory)
    {
        this.totalWorkerMemory = totalWorkerMemory;
        return this;
    }

    @NotNull
    public DataSize getReservedRegionSize()
    {
        return reservedRegionSize;
    }

    @Config("memory.reserved-region-size")
    @ConfigDescription("Memory kept back for the runtime and never allocated to execution or storage")
    public MemoryManagerConfig setReservedRegionSize(DataSize reservedRegionSize)
    {
        this.reservedRegionSize = reservedRegionSize;
        return this;
    }

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    public double getExecutionFraction()
    {
        return executionFraction;
    }

    @Config("memory.execution-fraction")
    @ConfigDescription("Share of the usable memory given to the execution pool; the rest goes to storage")
    public MemoryManagerConfig setExecutionFraction(double executionFraction)
    {
        this.executionFraction = executionFraction;
        return this;
    }

    @NotNull
    public StorageLevel getDefaultStorageLevel()
    {
        return defaultStorageLevel;
    }

    @Config("cache.default-storage-level")
    public MemoryManagerConfig setDefaultStorageLevel(StorageLevel defaultStorageLevel)
    {
        this.defaultStorageLevel = defaultStorageLevel;
        return this;
    }
}
