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
package io.quarry.server;

import com.google.common.collect.ImmutableMap;
import com.google.inject.Injector;
import io.airlift.bootstrap.Bootstrap;
import io.airlift.bootstrap.LifeCycleManager;
import io.airlift.slice.Slices;
import io.quarry.execution.TaskMemoryContext;
import io.quarry.memory.UnifiedMemoryManager;
import io.quarry.spi.TaskId;
import io.quarry.spiller.SpillHandle;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import org.weakref.jmx.guice.MBeanModule;
import org.weakref.jmx.testing.TestingMBeanServer;

import javax.management.MBeanServer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static com.google.common.io.MoreFiles.deleteRecursively;
import static com.google.common.io.RecursiveDeleteOption.ALLOW_INSECURE;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

@Test(singleThreaded = true)
public class TestWorkerMemoryService
{
    private static final long MB = 1024 * 1024;

    private Path spillPath;
    private LifeCycleManager lifeCycleManager;
    private WorkerMemoryService service;

    @BeforeMethod
    public void setUp()
            throws IOException
    {
        spillPath = Files.createTempDirectory("quarry-spill");
        Files.write(spillPath.resolve("spill-left-over.bin"), new byte[] {1, 2, 3});

        Bootstrap app = new Bootstrap(
                new WorkerMemoryModule(),
                new MBeanModule(),
                binder -> binder.bind(MBeanServer.class).toInstance(new TestingMBeanServer()));

        Injector injector = app
                .doNotInitializeLogging()
                .quiet()
                .setRequiredConfigurationProperties(ImmutableMap.<String, String>builder()
                        .put("memory.total-worker-memory", "100MB")
                        .put("memory.reserved-region-size", "10MB")
                        .put("spiller.spill-path", spillPath.toString())
                        .put("spiller.buffer-trigger-size", "1MB")
                        .build())
                .initialize();

        lifeCycleManager = injector.getInstance(LifeCycleManager.class);
        service = injector.getInstance(WorkerMemoryService.class);
    }

    @AfterMethod(alwaysRun = true)
    public void tearDown()
            throws IOException
    {
        if (lifeCycleManager != null) {
            lifeCycleManager.stop();
        }
        deleteRecursively(spillPath, ALLOW_INSECURE);
    }

    @Test
    public void testStartupLayout()
            throws IOException
    {
        UnifiedMemoryManager memoryManager = service.getMemoryManager();
        assertEquals(memoryManager.getReservedRegionBytes(), 10 * MB);
        assertEquals(memoryManager.getExecutionCapacityBytes() + memoryManager.getStorageCapacityBytes(), 90 * MB);
        assertEquals(memoryManager.getExecutionCapacityBytes(), Math.round(90 * MB * 0.6));
        assertEquals(service.getSkewCorrector().getThresholdBytes(), Math.round(memoryManager.getExecutionCapacityBytes() * 0.8));

        // files left behind by a previous process are removed on startup
        assertFalse(Files.exists(spillPath.resolve("spill-left-over.bin")));
        assertEquals(countFiles(), 0);
    }

    @Test
    public void testTaskSpillsToDisk()
            throws IOException
    {
        TaskId taskId = new TaskId("task-1");
        try (TaskMemoryContext context = service.createTaskContext(taskId)) {
            assertEquals(context.reserve(2 * MB), 2 * MB);
            assertTrue(context.shouldSpill(2 * MB));

            SpillHandle handle = context.spill(Slices.allocate((int) (2 * MB)));
            assertEquals(context.getReservedBytes(), 0);
            assertEquals(countFiles(), 1);

            assertEquals(context.restore(handle).getSizeInBytes(), 2 * MB);
            assertEquals(countFiles(), 0);
        }
        assertEquals(service.getMemoryManager().getExecutionGrantedBytes(), 0);
    }

    @Test
    public void testAbortTask()
            throws IOException
    {
        TaskId taskId = new TaskId("task-1");
        TaskMemoryContext context = service.createTaskContext(taskId);
        context.reserve(3 * MB);
        context.spill(Slices.allocate((int) MB));
        context.spill(Slices.allocate((int) MB));
        assertEquals(countFiles(), 2);

        service.abortTask(taskId);
        assertEquals(context.getReservedBytes(), 0);
        assertEquals(service.getMemoryManager().getExecutionGrantedBytes(), 0);
        assertTrue(service.getSpillManager().getOutstandingUnits(taskId).isEmpty());
        assertEquals(countFiles(), 0);
    }

    @Test
    public void testStopShutsDownManager()
            throws IOException
    {
        TaskMemoryContext context = service.createTaskContext(new TaskId("task-1"));
        context.reserve(MB);
        context.spill(Slices.allocate((int) MB));
        assertEquals(countFiles(), 1);

        lifeCycleManager.stop();
        lifeCycleManager = null;
        assertEquals(countFiles(), 0);

        try {
            service.createTaskContext(new TaskId("task-2")).reserve(MB);
            fail("expected reservation after shutdown to fail");
        }
        catch (IllegalStateException e) {
            assertEquals(e.getMessage(), "memory manager is shut down");
        }
    }

    private long countFiles()
            throws IOException
    {
        try (Stream<Path> files = Files.list(spillPath)) {
            return files.count();
        }
    }
}
