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
import io.airlift.slice.Slice;
import io.quarry.memory.ExecutionHandle;
import io.quarry.memory.LruEvictionPolicy;
import io.quarry.memory.ReservedRegion;
import io.quarry.memory.UnifiedMemoryManager;
import io.quarry.spi.TaskId;
import io.quarry.testing.TestingDurableStore;
import io.quarry.testing.TestingTicker;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;

import static io.airlift.slice.Slices.utf8Slice;
import static io.quarry.memory.StorageLevel.MEMORY_AND_DISK;
import static io.quarry.testing.TestingDurableStoreClient.createClient;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;

@Test(singleThreaded = true)
public class TestSpilledRunMerger
{
    private static final TaskId TASK = new TaskId("task");

    private ExecutionHandle execution;
    private SpillManager spillManager;

    @BeforeMethod
    public void setUp()
    {
        TestingDurableStore store = new TestingDurableStore();
        UnifiedMemoryManager memoryManager = new UnifiedMemoryManager(
                10_000,
                new ReservedRegion(0),
                0.6,
                MEMORY_AND_DISK,
                new LruEvictionPolicy(),
                createClient(store),
                new TestingTicker());
        execution = memoryManager.getExecutionHandle();
        spillManager = new SpillManager(execution, createClient(store), new SpillerStats());
    }

    @Test
    public void testMergesSortedRuns()
    {
        List<SpillHandle> runs = ImmutableList.of(
                spillRun("apple", "melon", "pear"),
                spillRun("banana", "cherry"),
                spillRun(),
                spillRun("avocado", "zucchini"));

        List<String> merged = new ArrayList<>();
        try (SpilledRunMerger merger = new SpilledRunMerger(spillManager, runs, Slice::compareTo)) {
            while (merger.hasNext()) {
                merged.add(merger.next().toStringUtf8());
            }
        }
        assertEquals(merged, ImmutableList.of("apple", "avocado", "banana", "cherry", "melon", "pear", "zucchini"));
    }

    @Test
    public void testKeepsDuplicates()
    {
        List<SpillHandle> runs = ImmutableList.of(spillRun("a", "b"), spillRun("a", "b"));

        int count = 0;
        try (SpilledRunMerger merger = new SpilledRunMerger(spillManager, runs, Slice::compareTo)) {
            while (merger.hasNext()) {
                merger.next();
                count++;
            }
            assertFalse(merger.hasNext());
        }
        assertEquals(count, 4);
    }

    private SpillHandle spillRun(String... records)
    {
        ImmutableList.Builder<Slice> slices = ImmutableList.builder();
        for (String record : records) {
            slices.add(utf8Slice(record));
        }
        Slice data = SpillRecords.writeRecords(slices.build());
        execution.acquireExecutionMemory(TASK, data.length());
        return spillManager.spill(new SpillUnit(TASK, data));
    }
}
