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
package io.quarry.util;

import io.airlift.units.Duration;
import org.testng.annotations.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import static io.airlift.testing.Assertions.assertBetweenInclusive;
import static io.quarry.util.RetryDriver.retry;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.fail;

public class TestRetryDriver
{
    private static final RetryDriver RETRY = retry()
            .maxAttempts(3)
            .exponentialBackoff(new Duration(0, MILLISECONDS), new Duration(0, MILLISECONDS));

    @Test
    public void testSucceedsWithinAttempts()
            throws Exception
    {
        AtomicInteger calls = new AtomicInteger();
        String result = RETRY.run("test", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("failure " + calls.get());
            }
            return "done";
        });
        assertEquals(result, "done");
        assertEquals(calls.get(), 3);
    }

    @Test
    public void testGivesUpAfterMaxAttempts()
    {
        AtomicInteger calls = new AtomicInteger();
        try {
            RETRY.run("test", () -> {
                throw new IOException("failure " + calls.incrementAndGet());
            });
            fail("expected exception");
        }
        catch (Exception e) {
            assertEquals(e.getClass(), IOException.class);
            assertEquals(e.getMessage(), "failure 3");
            assertEquals(e.getSuppressed().length, 2);
        }
        assertEquals(calls.get(), 3);
    }

    @Test
    public void testSingleAttempt()
    {
        AtomicInteger calls = new AtomicInteger();
        try {
            RETRY.maxAttempts(1).run("test", () -> {
                calls.incrementAndGet();
                throw new IOException("failure");
            });
            fail("expected exception");
        }
        catch (Exception e) {
            assertEquals(e.getSuppressed().length, 0);
        }
        assertEquals(calls.get(), 1);
    }

    @Test
    public void testStopOn()
    {
        AtomicInteger calls = new AtomicInteger();
        try {
            RETRY.stopOn(FileNotFoundException.class).run("test", () -> {
                calls.incrementAndGet();
                throw new FileNotFoundException("gone");
            });
            fail("expected exception");
        }
        catch (Exception e) {
            assertEquals(e.getClass(), FileNotFoundException.class);
        }
        assertEquals(calls.get(), 1);

        // other failures are still retried
        calls.set(0);
        try {
            RETRY.stopOnIllegalExceptions().run("test", () -> {
                throw new IOException("failure " + calls.incrementAndGet());
            });
            fail("expected exception");
        }
        catch (Exception e) {
            assertEquals(e.getMessage(), "failure 3");
        }
    }

    @Test
    public void testBackoff()
    {
        RetryDriver retry = retry().exponentialBackoff(new Duration(100, MILLISECONDS), new Duration(350, MILLISECONDS));
        assertBetweenInclusive(retry.backoffMillis(1), 100L, 110L);
        assertBetweenInclusive(retry.backoffMillis(2), 200L, 220L);
        assertBetweenInclusive(retry.backoffMillis(3), 350L, 385L);
        assertBetweenInclusive(retry.backoffMillis(10), 350L, 385L);
        assertEquals(RETRY.backoffMillis(5), 0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "minBackoff .* is greater than maxBackoff .*")
    public void testInvalidBackoff()
    {
        retry().exponentialBackoff(new Duration(2, SECONDS), new Duration(1, SECONDS));
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "maxAttempts must be at least 1")
    public void testInvalidAttempts()
    {
        retry().maxAttempts(0);
    }
}
