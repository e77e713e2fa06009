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
package io.quarry.testing;

import com.google.common.collect.ImmutableSet;
import io.airlift.slice.Slice;
import io.airlift.slice.Slices;
import io.quarry.spi.storage.DurableStore;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.Objects.requireNonNull;

/**
 * In-memory durable store with injectable failures.
 */
public class TestingDurableStore
        implements DurableStore
{
    private final Map<String, Slice> units = new ConcurrentHashMap<>();
    private final AtomicInteger writeFailures = new AtomicInteger();
    private final AtomicInteger readFailures = new AtomicInteger();
    private final AtomicInteger writeCalls = new AtomicInteger();
    private volatile CountDownLatch writeStarted;
    private volatile CountDownLatch writeAllowed;

    public void failNextWrites(int count)
    {
        writeFailures.set(count);
    }

    public void failNextReads(int count)
    {
        readFailures.set(count);
    }

    /**
     * Makes the next writes count down {@code started} and then wait for {@code allowed}.
     */
    public void blockWrites(CountDownLatch started, CountDownLatch allowed)
    {
        this.writeStarted = requireNonNull(started, "started is null");
        this.writeAllowed = requireNonNull(allowed, "allowed is null");
    }

    @Override
    public void write(String unitId, Slice data)
            throws IOException
    {
        writeCalls.incrementAndGet();
        CountDownLatch started = writeStarted;
        CountDownLatch allowed = writeAllowed;
        if (started != null) {
            started.countDown();
            try {
                allowed.await();
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException(e);
            }
        }
        if (writeFailures.getAndUpdate(count -> Math.max(count - 1, 0)) > 0) {
            throw new IOException("injected write failure for " + unitId);
        }
        units.put(unitId, Slices.copyOf(data));
    }

    @Override
    public Slice read(String unitId)
            throws IOException
    {
        if (readFailures.getAndUpdate(count -> Math.max(count - 1, 0)) > 0) {
            throw new IOException("injected read failure for " + unitId);
        }
        Slice data = units.get(unitId);
        if (data == null) {
            throw new NoSuchFileException(unitId);
        }
        return data;
    }

    @Override
    public InputStream openStream(String unitId)
            throws IOException
    {
        return new ByteArrayInputStream(read(unitId).getBytes());
    }

    @Override
    public void delete(String unitId)
    {
        units.remove(unitId);
    }

    public boolean contains(String unitId)
    {
        return units.containsKey(unitId);
    }

    public Set<String> getUnitIds()
    {
        return ImmutableSet.copyOf(units.keySet());
    }

    public int getWriteCalls()
    {
        return writeCalls.get();
    }
}
