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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.airlift.configuration.testing.ConfigAssertions;
import io.airlift.units.DataSize;
import io.airlift.units.Duration;
import org.testng.annotations.Test;

import java.nio.file.Paths;
import java.util.Map;

import static io.airlift.configuration.testing.ConfigAssertions.assertFullMapping;
import static io.airlift.configuration.testing.ConfigAssertions.assertRecordedDefaults;
import static io.airlift.units.DataSize.Unit.MEGABYTE;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.testng.Assert.assertEquals;

public class TestSpillConfig
{
    @Test
    public void testDefaults()
    {
        assertRecordedDefaults(ConfigAssertions.recordDefaults(SpillConfig.class)
                .setSpillPaths("")
                .setBufferTriggerSize(DataSize.of(64, MEGABYTE))
                .setMaxUsedSpaceThreshold(0.9)
                .setMaxAttempts(3)
                .setMinBackoffDelay(new Duration(100, MILLISECONDS))
                .setMaxBackoffDelay(new Duration(1, SECONDS)));
    }

    @Test
    public void testExplicitPropertyMappings()
    {
        Map<String, String> properties = new ImmutableMap.Builder<String, String>()
                .put("spiller.spill-path", "/tmp/spill1,/tmp/spill2")
                .put("spiller.buffer-trigger-size", "16MB")
                .put("spiller.max-used-space-threshold", "0.5")
                .put("spiller.max-attempts", "5")
                .put("spiller.min-backoff-delay", "250ms")
                .put("spiller.max-backoff-delay", "10s")
                .build();

        SpillConfig expected = new SpillConfig()
                .setSpillPaths("/tmp/spill1,/tmp/spill2")
                .setBufferTriggerSize(DataSize.of(16, MEGABYTE))
                .setMaxUsedSpaceThreshold(0.5)
                .setMaxAttempts(5)
                .setMinBackoffDelay(new Duration(250, MILLISECONDS))
                .setMaxBackoffDelay(new Duration(10, SECONDS));

        assertFullMapping(properties, expected);
    }

    @Test
    public void testSpillPathParsing()
    {
        SpillConfig config = new SpillConfig().setSpillPaths(" /tmp/a , ,/tmp/b");
        assertEquals(config.getSpillPaths(), ImmutableList.of(Paths.get("/tmp/a"), Paths.get("/tmp/b")));
    }
}
