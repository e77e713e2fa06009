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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import io.airlift.log.Logger;
import io.airlift.units.Duration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Runs an operation against an unreliable backend a bounded number of times, sleeping with
 * exponential backoff and jitter between attempts. Exceptions of a {@link #stopOn stop-on}
 * type are rethrown at once.
 */
public class RetryDriver
{
    private static final Logger log = Logger.get(RetryDriver.class);
    private static final double BACKOFF_SCALE_FACTOR = 2.0;
    private static final double MAX_JITTER = 0.1;

    private final int maxAttempts;
    private final Duration minBackoff;
    private final Duration maxBackoff;
    private final List<Class<? extends Exception>> stopOnExceptions;

    private RetryDriver(int maxAttempts, Duration minBackoff, Duration maxBackoff, List<Class<? extends Exception>> stopOnExceptions)
    {
        checkArgument(maxAttempts >= 1, "maxAttempts must be at least 1");
        this.maxAttempts = maxAttempts;
        this.minBackoff = requireNonNull(minBackoff, "minBackoff is null");
        this.maxBackoff = requireNonNull(maxBackoff, "maxBackoff is null");
        checkArgument(minBackoff.compareTo(maxBackoff) <= 0, "minBackoff %s is greater than maxBackoff %s", minBackoff, maxBackoff);
        this.stopOnExceptions = ImmutableList.copyOf(requireNonNull(stopOnExceptions, "stopOnExceptions is null"));
    }

    public static RetryDriver retry()
    {
        return new RetryDriver(3, new Duration(100, MILLISECONDS), new Duration(1, SECONDS), ImmutableList.of());
    }

    public RetryDriver maxAttempts(int maxAttempts)
    {
        return new RetryDriver(maxAttempts, minBackoff, maxBackoff, stopOnExceptions);
    }

    public RetryDriver exponentialBackoff(Duration minBackoff, Duration maxBackoff)
    {
        return new RetryDriver(maxAttempts, minBackoff, maxBackoff, stopOnExceptions);
    }

    @SafeVarargs
    public final RetryDriver stopOn(Class<? extends Exception>... classes)
    {
        requireNonNull(classes, "classes is null");
        return new RetryDriver(
                maxAttempts,
                minBackoff,
                maxBackoff,
                ImmutableList.<Class<? extends Exception>>builder()
                        .addAll(stopOnExceptions)
                        .addAll(Arrays.asList(classes))
                        .build());
    }

    public RetryDriver stopOnIllegalExceptions()
    {
        return stopOn(NullPointerException.class, IllegalStateException.class, IllegalArgumentException.class);
    }

    public int getMaxAttempts()
    {
        return maxAttempts;
    }

    public <V> V run(String operationName, Callable<V> operation)
            throws Exception
    {
        requireNonNull(operationName, "operationName is null");
        requireNonNull(operation, "operation is null");

        List<Exception> failures = new ArrayList<>();
        for (int attempt = 1; ; attempt++) {
            try {
                return operation.call();
            }
            catch (Exception e) {
                if (attempt >= maxAttempts || isStopOn(e)) {
                    failures.forEach(e::addSuppressed);
                    throw e;
                }
                failures.add(e);
                long delayMillis = backoffMillis(attempt);
                log.debug("Attempt %s of %s failed, retrying in %sms: %s", attempt, operationName, delayMillis, e.getMessage());
                sleep(delayMillis);
            }
        }
    }

    @VisibleForTesting
    long backoffMillis(int attempt)
    {
        long delayMillis = (long) Math.min(minBackoff.toMillis() * Math.pow(BACKOFF_SCALE_FACTOR, attempt - 1), maxBackoff.toMillis());
        if (delayMillis == 0) {
            return 0;
        }
        return delayMillis + ThreadLocalRandom.current().nextLong(Math.max(1, (long) (delayMillis * MAX_JITTER)));
    }

    private boolean isStopOn(Exception e)
    {
        return stopOnExceptions.stream().anyMatch(type -> type.isInstance(e));
    }

    private static void sleep(long millis)
    {
        try {
            MILLISECONDS.sleep(millis);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        }
    }
}
