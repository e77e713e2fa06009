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

import com.google.common.annotations.VisibleForTesting;
import io.airlift.slice.Slice;
import io.quarry.spi.QuarryException;
import io.quarry.spi.storage.DurableStore;
import io.quarry.util.RetryDriver;

import javax.inject.Inject;

import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.util.concurrent.Callable;

import static io.quarry.spi.StandardErrorCode.STORAGE_BACKEND_UNAVAILABLE;
import static io.quarry.spi.StandardErrorCode.UNIT_NOT_FOUND;
import static io.quarry.util.RetryDriver.retry;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Calls into the {@link DurableStore} with bounded retries. Once the retries are used up an I/O
 * failure surfaces as {@code STORAGE_BACKEND_UNAVAILABLE}. A missing unit surfaces as
 * {@code UNIT_NOT_FOUND}; errors the store already classified and precondition failures are
 * rethrown as they are, without retrying.
 */
public class DurableStoreClient
{
    private final DurableStore store;
    private final RetryDriver retryDriver;

    @Inject
    public DurableStoreClient(DurableStore store, SpillConfig config)
    {
        this(store, retry()
                .maxAttempts(config.getMaxAttempts())
                .exponentialBackoff(config.getMinBackoffDelay(), config.getMaxBackoffDelay()));
    }

    @VisibleForTesting
    public DurableStoreClient(DurableStore store, RetryDriver retryDriver)
    {
        this.store = requireNonNull(store, "store is null");
        // a missing unit does not come back on retry
        this.retryDriver = requireNonNull(retryDriver, "retryDriver is null")
                .stopOn(NoSuchFileException.class, QuarryException.class)
                .stopOnIllegalExceptions();
    }

    public void write(String unitId, Slice data)
    {
        requireNonNull(data, "data is null");
        run("write", unitId, () -> {
            store.write(unitId, data);
            return null;
        });
    }

    public Slice read(String unitId)
    {
        return run("read", unitId, () -> store.read(unitId));
    }

    public InputStream openStream(String unitId)
    {
        return run("open", unitId, () -> store.openStream(unitId));
    }

    public void delete(String unitId)
    {
        run("delete", unitId, () -> {
            store.delete(unitId);
            return null;
        });
    }

    private <V> V run(String operation, String unitId, Callable<V> callable)
    {
        requireNonNull(unitId, "unitId is null");
        try {
            return retryDriver.run(operation + " " + unitId, callable);
        }
        catch (QuarryException | IllegalArgumentException | IllegalStateException | NullPointerException e) {
            throw e;
        }
        catch (NoSuchFileException e) {
            throw new QuarryException(UNIT_NOT_FOUND, format("Unit %s does not exist in the durable store", unitId), e);
        }
        catch (Exception e) {
            throw new QuarryException(
                    STORAGE_BACKEND_UNAVAILABLE,
                    format("Failed to %s unit %s after %s attempts", operation, unitId, retryDriver.getMaxAttempts()),
                    e);
        }
    }
}
