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
import io.airlift.slice.Slices;
import io.quarry.spi.QuarryException;
import io.quarry.testing.TestingDurableStore;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static io.quarry.spi.StandardErrorCode.OUT_OF_SPILL_SPACE;
import static io.quarry.spi.StandardErrorCode.STORAGE_BACKEND_UNAVAILABLE;
import static io.quarry.spi.StandardErrorCode.UNIT_NOT_FOUND;
import static io.quarry.testing.TestingDurableStoreClient.NO_BACKOFF_RETRY;
import static io.quarry.testing.TestingDurableStoreClient.createClient;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

@Test(singleThreaded = true)
public class TestDurableStoreClient
{
    private TestingDurableStore store;
    private DurableStoreClient client;

    @BeforeMethod
    public void setUp()
    {
        store = new TestingDurableStore();
        client = createClient(store);
    }

    @Test
    public void testRetriesTransientFailures()
    {
        store.failNextWrites(2);
        client.write("u1", Slices.utf8Slice("data"));
        assertEquals(store.getWriteCalls(), 3);

        store.failNextReads(2);
        assertEquals(client.read("u1").toString(UTF_8), "data");
    }

    @Test
    public void testSurfacesPersistentFailures()
    {
        store.failNextWrites(3);
        try {
            client.write("u1", Slices.utf8Slice("data"));
            fail("expected exception");
        }
        catch (QuarryException e) {
            assertEquals(e.getErrorCode(), STORAGE_BACKEND_UNAVAILABLE.toErrorCode());
            assertEquals(e.getMessage(), "Failed to write unit u1 after 3 attempts");
        }
        assertFalse(store.contains("u1"));
    }

    @Test
    public void testReadMissingUnit()
    {
        try {
            client.read("missing");
            fail("expected exception");
        }
        catch (QuarryException e) {
            assertEquals(e.getErrorCode(), UNIT_NOT_FOUND.toErrorCode());
            assertFalse(e.isRetriable());
            assertEquals(e.getMessage(), "Unit missing does not exist in the durable store");
            assertEquals(e.getCause().getSuppressed().length, 0);
        }
    }

    @Test
    public void testKeepsErrorCodeOfStoreFailure()
    {
        DurableStoreClient noSpillPaths = new DurableStoreClient(new FileDurableStore(ImmutableList.of(), 1.0), NO_BACKOFF_RETRY);
        try {
            noSpillPaths.write("u1", Slices.utf8Slice("data"));
            fail("expected exception");
        }
        catch (QuarryException e) {
            assertEquals(e.getErrorCode(), OUT_OF_SPILL_SPACE.toErrorCode());
            assertEquals(e.getMessage(), "No spill paths configured");
            assertEquals(e.getSuppressed().length, 0);
        }
    }

    @Test
    public void testIllegalStateIsNotRetried()
    {
        AtomicInteger reads = new AtomicInteger();
        TestingDurableStore brokenStore = new TestingDurableStore()
        {
            @Override
            public Slice read(String unitId)
            {
                reads.incrementAndGet();
                throw new IllegalStateException("store is closed");
            }
        };
        try {
            createClient(brokenStore).read("u1");
            fail("expected exception");
        }
        catch (IllegalStateException e) {
            assertEquals(e.getMessage(), "store is closed");
        }
        assertEquals(reads.get(), 1);
    }

    @Test
    public void testDelete()
    {
        client.write("u1", Slices.utf8Slice("data"));
        assertTrue(store.contains("u1"));
        client.delete("u1");
        assertFalse(store.contains("u1"));
        client.delete("u1");
    }
}
