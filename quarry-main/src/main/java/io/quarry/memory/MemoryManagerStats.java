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
public class MemoryManagerStats
{
    private final AtomicLong executionRequests = new AtomicLong();
    private final AtomicLong shortGrants = new AtomicLong();
    private final AtomicLong evictedEntries = new AtomicLong();
    private final AtomicLong entriesWrittenToDisk = new AtomicLong();
    private final AtomicLong droppedEntries = new AtomicLong();
    private final AtomicLong failedFallbackWrites = new AtomicLong();

    public void recordExecutionRequest(long requestedBytes, long grantedBytes)
    {
        executionRequests.incrementAndGet();
        if (grantedBytes < requestedBytes) {
            shortGrants.incrementAndGet();
        }
    }

    public void recordEviction(int writtenToDisk, int dropped)
    {
        evictedEntries.addAndGet(writtenToDisk + dropped);
        entriesWrittenToDisk.addAndGet(writtenToDisk);
        droppedEntries.addAndGet(dropped);
    }

    public void recordFailedFallbackWrite()
    {
        failedFallbackWrites.incrementAndGet();
    }

    @Managed
    public long getExecutionRequests()
    {
        return executionRequests.get();
    }

    @Managed
    public long getShortGrants()
    {
        return shortGrants.get();
    }

    @Managed
    public long getEvictedEntries()
    {
        return evictedEntries.get();
    }

    @Managed
    public long getEntriesWrittenToDisk()
    {
        return entriesWrittenToDisk.get();
    }

    @Managed
    public long getDroppedEntries()
    {
        return droppedEntries.get();
    }

    @Managed
    public long getFailedFallbackWrites()
    {
        return failedFallbackWrites.get();
    }
}
