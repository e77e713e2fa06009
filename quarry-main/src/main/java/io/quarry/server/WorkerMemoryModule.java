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

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import io.quarry.memory.MemoryManagerConfig;
import io.quarry.memory.UnifiedMemoryManager;
import io.quarry.skew.SkewConfig;
import io.quarry.skew.SkewCorrector;
import io.quarry.spi.storage.DurableStore;
import io.quarry.spiller.DurableStoreClient;
import io.quarry.spiller.FileDurableStore;
import io.quarry.spiller.SpillConfig;
import io.quarry.spiller.SpillManager;
import io.quarry.spiller.SpillerStats;

import javax.inject.Singleton;

import static io.airlift.configuration.ConfigBinder.configBinder;
import static org.weakref.jmx.guice.ExportBinder.newExporter;

public class WorkerMemoryModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        configBinder(binder).bindConfig(MemoryManagerConfig.class);
        configBinder(binder).bindConfig(SpillConfig.class);
        configBinder(binder).bindConfig(SkewConfig.class);

        binder.bind(DurableStoreClient.class).in(Scopes.SINGLETON);
        binder.bind(UnifiedMemoryManager.class).in(Scopes.SINGLETON);
        newExporter(binder).export(UnifiedMemoryManager.class).withGeneratedName();

        binder.bind(SpillerStats.class).in(Scopes.SINGLETON);
        newExporter(binder).export(SpillerStats.class).withGeneratedName();
        binder.bind(SpillManager.class).in(Scopes.SINGLETON);

        binder.bind(SkewCorrector.class).in(Scopes.SINGLETON);
        binder.bind(WorkerMemoryService.class).in(Scopes.SINGLETON);
    }

    @Singleton
    @Provides
    public DurableStore createDurableStore(FileDurableStore fileDurableStore)
    {
        return fileDurableStore;
    }

    @Singleton
    @Provides
    public FileDurableStore createFileDurableStore(SpillConfig spillConfig)
    {
        return new FileDurableStore(spillConfig);
    }
}
