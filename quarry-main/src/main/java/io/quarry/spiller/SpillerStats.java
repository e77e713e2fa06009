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

import org.weakref.jmx.Managed;

import javax.annotation.concurrent.ThreadSafe;

import java.util.concurrent.atomic.AtomicLong;

@ThreadSafe
public class SpillerStats
{
    private final AtomicLong totalSpilledBytes = new AtomicLong();
    private final AtomicLong totalRestoredBytes = new AtomicLong();
    private final AtomicLong spilledUnits = new AtomicLong();
    private final AtomicLong deletedUnits = new AtomicLong();

    public void addToTotalSpilledBytes(long delta)
    {
        totalSpilledBytes.addAndGet(delta);
        spilledUnits.incrementAndGet();
    }

    public void addToTotalRestoredBytes(long delta)
    {
        totalRestoredBytes.addAndGet(delta);
    }

    public void incrementDeletedUnits()
    {
        deletedUnits.incrementAndGet();
    }

    @Managed
    public long getTotalSpilledBytes()
    {
        return totalSpilledBytes.get();
    }

    @Managed
    public long getTotalRestoredBytes()
    {
        return totalRestoredBytes.get();
    }

    @Managed
    public long getSpilledUnits()
    {
        return spilledUnits.get();
    }

    @Managed
    public long getDeletedUnits()
    {
        return deletedUnits.get();
    }
}
