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

import org.weakref.jmx.Managed;

import javax.annotation.concurrent.ThreadSafe;

import java.util.concurrent.atomic.AtomicLong;

@ThreadSafe
public class CacheStats
{
    private final AtomicLong memoryHit = new AtomicLong();
    private final AtomicLong diskHit = new AtomicLong();
    private final AtomicLong miss = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    public void incrementMemoryHit()
    {
        memoryHit.getAndIncrement();
    }

    public void incrementDiskHit()
    {
        diskHit.getAndIncrement();
    }

    public void incrementCacheMiss()
    {
        miss.getAndIncrement();
    }

    public void incrementRejected()
    {
        rejected.getAndIncrement();
    }

    @Managed
    public long getMemoryHit()
    {
        return memoryHit.get();
    }

    @Managed
    public long getDiskHit()
    {
        return diskHit.get();
    }

    @Managed
    public long getCacheMiss()
    {
        return miss.get();
    }

    @Managed
    public long getRejected()
    {
        return rejected.get();
    }
}
