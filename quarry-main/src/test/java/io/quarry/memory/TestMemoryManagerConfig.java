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

import com.google.common.collect.ImmutableMap;
import io.airlift.configuration.testing.ConfigAssertions;
import io.airlift.units.DataSize;
import org.testng.annotations.Test;

import java.util.Map;

import static io.airlift.configuration.testing.ConfigAssertions.assertFullMapping;
import static io.airlift.configuration.testing.ConfigAssertions.assertRecordedDefaults;
import static io.airlift.units.DataSize.Unit.GIGABYTE;
import static io.airlift.units.DataSize.Unit.MEGABYTE;
import static io.quarry.memory.StorageLevel.DISK_ONLY;
import static io.quarry.memory.StorageLevel.MEMORY_AND_DISK;

public class TestMemoryManagerConfig
{
    @Test
    public void testDefaults()
    {
        assertRecordedDefaults(ConfigAssertions.recordDefaults(MemoryManagerConfig.class)
                .setTotalWorkerMemory(DataSize.of(4, GIGABYTE))
                .setReservedRegionSize(DataSize.of(300, MEGABYTE))
                .setExecutionFraction(0.6)
                .setDefaultStorageLevel(MEMORY_AND_DISK));
    }

    @Test
    public void testExplicitPropertyMappings()
    {
        Map<String, String> properties = new ImmutableMap.Builder<String, String>()
                .put("memory.total-worker-memory", "16GB")
                .put("memory.reserved-region-size", "512MB")
                .put("memory.execution-fraction", "0.5")
                .put("cache.default-storage-level", "DISK_ONLY")
                .build();

        MemoryManagerConfig expected = new MemoryManagerConfig()
                .setTotalWorkerMemory(DataSize.of(16, GIGABYTE))
                .setReservedRegionSize(DataSize.of(512, MEGABYTE))
                .setExecutionFraction(0.5)
                .setDefaultStorageLevel(DISK_ONLY);

        assertFullMapping(properties, expected);
    }
}
