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

import io.airlift.log.Logger;
import io.airlift.units.DataSize;
import io.quarry.execution.TaskMemoryContext;
import io.quarry.memory.UnifiedMemoryManager;
import io.quarry.skew.SkewCorrector;
import io.quarry.spi.TaskId;
import io.quarry.spiller.SpillConfig;
import io.quarry.spiller.SpillManager;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import javax.inject.Inject;

import static io.airlift.units.DataSize.succinctBytes;
import static java.util.Objects.requireNonNull;

/**
 * Entry point for task executors on a worker. There is one instance per worker process.
 */
public class WorkerMemoryService
{
    private static final Logger log = Logger.get(WorkerMemoryService.class);

    private final UnifiedMemoryManager memoryManager;
    private final SpillManager spillManager;
    private final SkewCorrector skewCorrector;
    private final DataSize bufferTriggerSize;

    @Inject
    public WorkerMemoryService(UnifiedMemoryManager memoryManager, SpillManager spillManager, SkewCorrector skewCorrector, SpillConfig spillConfig)
    {
        this.memoryManager = requireNonNull(memoryManager, "memoryManager is null");
        this.spillManager = requireNonNull(spillManager, "spillManager is null");
        this.skewCorrector = requireNonNull(skewCorrector, "skewCorrector is null");
        this.bufferTriggerSize = requireNonNull(spillConfig, "spillConfig is null").getBufferTriggerSize();
    }

    @PostConstruct
    public void start()
    {
        log.info("Worker memory: execution %s, storage %s, reserved %s, skew threshold %s",
                succinctBytes(memoryManager.getExecutionCapacityBytes()),
                succinctBytes(memoryManager.getStorageCapacityBytes()),
                succinctBytes(memoryManager.getReservedRegionBytes()),
                succinctBytes(skewCorrector.getThresholdBytes()));
    }

    @PreDestroy
    public void stop()
    {
        try {
            spillManager.cleanupAll();
        }
        finally {
            memoryManager.shutdown();
        }
    }

    public TaskMemoryContext createTaskContext(TaskId taskId)
    {
        return new TaskMemoryContext(taskId, memoryManager.getExecutionHandle(), spillManager, bufferTriggerSize);
    }

    /**
     * Releases everything a task holds without its cooperation.
     */
    public void abortTask(TaskId taskId)
    {
        requireNonNull(taskId, "taskId is null");
        try {
            spillManager.cleanupTask(taskId);
        }
        finally {
            memoryManager.getExecutionHandle().releaseAllExecutionMemory(taskId);
        }
        log.debug("Released memory and spilled units of aborted task %s", taskId);
    }

    public UnifiedMemoryManager getMemoryManager()
    {
        return memoryManager;
    }

    public SpillManager getSpillManager()
    {
        return spillManager;
    }

    public SkewCorrector getSkewCorrector()
    {
        return skewCorrector;
    }
}
