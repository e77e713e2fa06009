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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import io.airlift.log.Logger;
import io.airlift.slice.Slice;
import io.quarry.spi.QuarryException;
import io.quarry.spi.TaskId;
import io.quarry.spiller.DurableStoreClient;
import org.weakref.jmx.Managed;
import org.weakref.jmx.Nested;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import javax.inject.Inject;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.base.Verify.verify;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.airlift.units.DataSize.succinctBytes;
import static io.quarry.memory.BorrowRecord.Direction.EXECUTION_FROM_STORAGE;
import static io.quarry.memory.BorrowRecord.Direction.STORAGE_FROM_EXECUTION;
import static io.quarry.memory.CacheEntry.State.EVICTING;
import static io.quarry.memory.CacheEntry.State.IN_MEMORY;
import static io.quarry.memory.CacheEntry.State.ON_DISK;
import static io.quarry.memory.GrantSource.OWN_POOL;
import static io.quarry.memory.GrantSource.RECLAIMED_FROM_STORAGE;
import static java.lang.Math.max;
import static java.lang.Math.min;
import static java.util.Objects.requireNonNull;

/**
 * Single arbiter for the worker's execution and storage memory.
 * <p>
 * Execution may evict cached entries, down to none, to satisfy a request; the bytes it frees
 * in the storage region are then held by execution until the task releases them. Storage may
 * only borrow execution capacity that is free at the time, and only for cache entries, so every
 * borrowed byte is backed by an evictable entry that execution can always take back. Plain
 * storage reservations are limited to the storage region. Storage never takes memory a task
 * holds.
 * <p>
 * All byte accounting happens under this object's monitor. Fallback writes of evicted entries
 * happen outside of it while the entries are marked {@link CacheEntry.State#EVICTING}.
 */
@ThreadSafe
public class UnifiedMemoryManager
{
    private static final Logger log = Logger.get(UnifiedMemoryManager.class);

    private final ReservedRegion reservedRegion;
    private final StorageLevel defaultStorageLevel;
    private final EvictionPolicy evictionPolicy;
    private final DurableStoreClient cacheStore;
    private final Ticker ticker;

    private final MemoryManagerStats stats = new MemoryManagerStats();
    private final CacheStats cacheStats = new CacheStats();
    private final AtomicLong nextEntryVersion = new AtomicLong();

    @GuardedBy("this")
    private final ExecutionPool executionPool;
    @GuardedBy("this")
    private final StoragePool storagePool;
    @GuardedBy("this")
    private final BorrowRecord storageBorrow = new BorrowRecord(STORAGE_FROM_EXECUTION);
    @GuardedBy("this")
    private final BorrowRecord executionReclaim = new BorrowRecord(EXECUTION_FROM_STORAGE);
    @GuardedBy("this")
    private boolean shutdown;

    private final ExecutionHandle executionHandle = new ManagerExecutionHandle();
    private final StorageHandle storageHandle = new ManagerStorageHandle();

    @Inject
    public UnifiedMemoryManager(MemoryManagerConfig config, DurableStoreClient cacheStore)
    {
        this(
                requireNonNull(config, "config is null").getTotalWorkerMemory().toBytes(),
                ReservedRegion.of(config.getReservedRegionSize()),
                config.getExecutionFraction(),
                config.getDefaultStorageLevel(),
                new LruEvictionPolicy(),
                cacheStore,
                Ticker.systemTicker());
    }

    public UnifiedMemoryManager(
            long totalWorkerBytes,
            ReservedRegion reservedRegion,
            double executionFraction,
            StorageLevel defaultStorageLevel,
            EvictionPolicy evictionPolicy,
            DurableStoreClient cacheStore,
            Ticker ticker)
    {
        this.reservedRegion = requireNonNull(reservedRegion, "reservedRegion is null");
        checkArgument(0 <= executionFraction && executionFraction <= 1, "executionFraction should be within [0, 1] range, got %s", executionFraction);
        this.defaultStorageLevel = requireNonNull(defaultStorageLevel, "defaultStorageLevel is null");
        this.evictionPolicy = requireNonNull(evictionPolicy, "evictionPolicy is null");
        this.cacheStore = requireNonNull(cacheStore, "cacheStore is null");
        this.ticker = requireNonNull(ticker, "ticker is null");

        long usableBytes = reservedRegion.getUsableBytes(totalWorkerBytes);
        long executionBytes = Math.round(usableBytes * executionFraction);
        this.executionPool = new ExecutionPool(executionBytes);
        this.storagePool = new StoragePool(usableBytes - executionBytes);
    }

    public ExecutionHandle getExecutionHandle()
    {
        return executionHandle;
    }

    public StorageHandle getStorageHandle()
    {
        return storageHandle;
    }

    /**
     * Force-releases every grant and drops every cached entry. Releases issued afterwards by
     * tasks that are still tearing down are ignored.
     */
    public void shutdown()
    {
        List<String> unitsToDelete = new ArrayList<>();
        synchronized (this) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            for (TaskId taskId : executionPool.getTasks()) {
                returnGrants(executionPool.removeAll(taskId));
            }
            for (String key : storagePool.getKeys()) {
                removeEntry(key).ifPresent(unitsToDelete::add);
            }
            for (String key : storagePool.getReservationKeys()) {
                releaseStorageBytes(storagePool.removeReservation(key));
            }
        }
        deleteCacheUnits(unitsToDelete);
        log.info("Released all worker memory");
    }

    private long acquireExecutionMemory(TaskId taskId, long requestedBytes)
    {
        requireNonNull(taskId, "taskId is null");
        checkArgument(requestedBytes >= 0, "requestedBytes is negative");
        if (requestedBytes == 0) {
            return 0;
        }

        long grantedBytes;
        List<CacheEntry> victims;
        synchronized (this) {
            checkState(!shutdown, "memory manager is shut down");
            grantedBytes = grantFromExecutionPool(taskId, requestedBytes);
            if (grantedBytes == requestedBytes) {
                stats.recordExecutionRequest(requestedBytes, grantedBytes);
                return grantedBytes;
            }
            victims = selectVictims(requestedBytes - grantedBytes, null);
        }

        if (!victims.isEmpty()) {
            writeEvictedEntries(victims);
            EvictionOutcome outcome;
            synchronized (this) {
                outcome = completeEviction(requestedBytes - grantedBytes, victims);
                if (!shutdown) {
                    long remainingBytes = requestedBytes - grantedBytes;
                    long fromExecutionPool = grantFromExecutionPool(taskId, remainingBytes);
                    grantedBytes += fromExecutionPool;
                    grantedBytes += reclaimFromStorage(taskId, min(remainingBytes - fromExecutionPool, outcome.getFreedStorageRegionBytes()));
                }
            }
            deleteCacheUnits(outcome.getUnitsToDelete());
        }

        stats.recordExecutionRequest(requestedBytes, grantedBytes);
        if (grantedBytes < requestedBytes) {
            log.debug("Task %s requested %s of execution memory, granted %s", taskId, succinctBytes(requestedBytes), succinctBytes(grantedBytes));
        }
        return grantedBytes;
    }

    private void releaseExecutionMemory(TaskId taskId, long bytes)
    {
        requireNonNull(taskId, "taskId is null");
        checkArgument(bytes >= 0, "bytes is negative");
        synchronized (this) {
            if (shutdown || bytes == 0) {
                return;
            }
            returnGrants(executionPool.removeBytes(taskId, bytes));
        }
    }

    private synchronized void releaseAllExecutionMemory(TaskId taskId)
    {
        requireNonNull(taskId, "taskId is null");
        if (shutdown) {
            return;
        }
        returnGrants(executionPool.removeAll(taskId));
    }

    private EvictionResult evictCachedEntries(long bytes)
    {
        checkArgument(bytes >= 0, "bytes is negative");
        List<CacheEntry> victims;
        synchronized (this) {
            victims = selectVictims(bytes, null);
        }
        writeEvictedEntries(victims);
        EvictionOutcome outcome;
        synchronized (this) {
            outcome = completeEviction(bytes, victims);
        }
        deleteCacheUnits(outcome.getUnitsToDelete());
        return outcome.getResult();
    }

    private boolean put(String key, Slice content, StorageLevel storageLevel)
    {
        requireNonNull(key, "key is null");
        requireNonNull(content, "content is null");
        requireNonNull(storageLevel, "storageLevel is null");
        remove(key);

        if (storageLevel.useMemory()) {
            CacheEntry entry = new CacheEntry(key, nextEntryVersion.getAndIncrement(), content, storageLevel, IN_MEMORY, ticker.read());
            if (admit(key, entry.getSizeBytes(), entry)) {
                return true;
            }
            if (!storageLevel.useDisk()) {
                cacheStats.incrementRejected();
                return false;
            }
            log.debug("No storage memory for %s of %s, keeping it on disk only", key, succinctBytes(content.length()));
        }

        CacheEntry entry = new CacheEntry(key, nextEntryVersion.getAndIncrement(), content, storageLevel, ON_DISK, ticker.read());
        cacheStore.write(entry.getUnitId(), content);
        synchronized (this) {
            checkState(!shutdown, "memory manager is shut down");
            storagePool.addEntry(entry);
        }
        return true;
    }

    private CacheLookup get(String key)
    {
        requireNonNull(key, "key is null");
        CacheEntry entry;
        synchronized (this) {
            entry = storagePool.getEntry(key);
            if (entry == null || entry.getState() == EVICTING) {
                cacheStats.incrementCacheMiss();
                return CacheLookup.miss();
            }
            entry.touch(ticker.read());
            if (entry.getState() == IN_MEMORY) {
                cacheStats.incrementMemoryHit();
                return CacheLookup.memoryHit(entry.getContent());
            }
        }

        Slice content;
        try {
            content = cacheStore.read(entry.getUnitId());
        }
        catch (QuarryException e) {
            Optional<String> unitToDelete;
            synchronized (this) {
                if (storagePool.getEntry(key) != entry) {
                    // removed while reading
                    cacheStats.incrementCacheMiss();
                    return CacheLookup.miss();
                }
                if (e.isRetriable()) {
                    throw e;
                }
                log.warn(e, "Cached entry %s cannot be read back from the durable store, dropping it", key);
                unitToDelete = removeEntry(key);
                cacheStats.incrementCacheMiss();
            }
            unitToDelete.ifPresent(unitId -> deleteCacheUnits(ImmutableList.of(unitId)));
            return CacheLookup.miss();
        }

        if (entry.getStorageLevel().useMemory()) {
            synchronized (this) {
                if (!shutdown && storagePool.getEntry(key) == entry && entry.getState() == ON_DISK && tryReserveStorage(entry.getSizeBytes(), true)) {
                    entry.readmit(content);
                    storagePool.addResidentBytes(entry.getSizeBytes());
                }
            }
        }
        cacheStats.incrementDiskHit();
        return CacheLookup.diskHit(content);
    }

    private boolean remove(String key)
    {
        requireNonNull(key, "key is null");
        Optional<String> unitToDelete;
        synchronized (this) {
            if (storagePool.getEntry(key) == null) {
                return false;
            }
            unitToDelete = removeEntry(key);
        }
        unitToDelete.ifPresent(unitId -> deleteCacheUnits(ImmutableList.of(unitId)));
        return true;
    }

    private boolean acquireStorageMemory(String entryKey, long bytes)
    {
        requireNonNull(entryKey, "entryKey is null");
        checkArgument(bytes >= 0, "bytes is negative");
        return admit(entryKey, bytes, null);
    }

    private synchronized void releaseStorageMemory(String entryKey)
    {
        requireNonNull(entryKey, "entryKey is null");
        if (shutdown) {
            return;
        }
        Long bytes = storagePool.removeReservation(entryKey);
        checkArgument(bytes != null, "no storage memory is reserved for %s", entryKey);
        releaseStorageBytes(bytes);
    }

    /**
     * Reserves storage memory for a cache entry, or for a plain reservation when {@code entry}
     * is null, evicting other entries if that makes the reservation fit.
     */
    private boolean admit(String key, long bytes, @Nullable CacheEntry entry)
    {
        List<CacheEntry> victims;
        synchronized (this) {
            checkState(!shutdown, "memory manager is shut down");
            if (tryAdmit(key, bytes, entry)) {
                return true;
            }
            boolean mayBorrow = entry != null;
            long freeBytes = storagePool.getMemoryPool().availableBytes();
            if (mayBorrow) {
                freeBytes += executionPool.getMemoryPool().availableBytes();
            }
            long evictableBytes = storagePool.getEntries().stream()
                    .filter(candidate -> candidate.getState() == IN_MEMORY && !candidate.getKey().equals(key))
                    .mapToLong(CacheEntry::getSizeBytes)
                    .sum();
            // evicting repays the borrow before it frees any storage region bytes
            long unusableBytes = mayBorrow ? 0 : storageBorrow.getBytes();
            if (bytes > freeBytes + evictableBytes - unusableBytes) {
                log.debug("Cannot cache %s: %s needed, at most %s can be made free", key, succinctBytes(bytes), succinctBytes(max(0, freeBytes + evictableBytes - unusableBytes)));
                return false;
            }
            victims = selectVictims(bytes - freeBytes + unusableBytes, key);
        }

        writeEvictedEntries(victims);
        EvictionOutcome outcome;
        boolean admitted;
        synchronized (this) {
            outcome = completeEviction(bytes, victims);
            admitted = !shutdown && tryAdmit(key, bytes, entry);
        }
        deleteCacheUnits(outcome.getUnitsToDelete());
        return admitted;
    }

    @GuardedBy("this")
    private boolean tryAdmit(String key, long bytes, @Nullable CacheEntry entry)
    {
        if (!tryReserveStorage(bytes, entry != null)) {
            return false;
        }
        if (entry == null) {
            storagePool.addReservation(key, bytes);
        }
        else {
            storagePool.addEntry(entry);
        }
        storagePool.addResidentBytes(bytes);
        return true;
    }

    /**
     * Takes storage's own free capacity first. When {@code mayBorrow} is set the rest is borrowed
     * from currently free execution capacity.
     */
    @GuardedBy("this")
    private boolean tryReserveStorage(long bytes, boolean mayBorrow)
    {
        MemoryPool storageMemory = storagePool.getMemoryPool();
        MemoryPool executionMemory = executionPool.getMemoryPool();
        long ownBytes = min(bytes, storageMemory.availableBytes());
        long borrowedBytes = bytes - ownBytes;
        if (borrowedBytes > 0 && (!mayBorrow || borrowedBytes > executionMemory.availableBytes())) {
            return false;
        }
        verify(storageMemory.tryAcquire(ownBytes), "storage pool changed while locked");
        verify(executionMemory.tryAcquire(borrowedBytes), "execution pool changed while locked");
        storageBorrow.borrow(borrowedBytes);
        return true;
    }

    /**
     * Frees resident storage bytes, repaying execution before freeing storage's own region.
     *
     * @return the bytes freed in the storage region
     */
    @GuardedBy("this")
    private long releaseStorageBytes(long bytes)
    {
        storagePool.removeResidentBytes(bytes);
        long repaidBytes = min(bytes, storageBorrow.getBytes());
        storageBorrow.repay(repaidBytes);
        executionPool.getMemoryPool().release(repaidBytes);
        long ownBytes = bytes - repaidBytes;
        storagePool.getMemoryPool().release(ownBytes);
        return ownBytes;
    }

    @GuardedBy("this")
    private long grantFromExecutionPool(TaskId taskId, long bytes)
    {
        long grantedBytes = min(bytes, executionPool.getMemoryPool().availableBytes());
        if (grantedBytes <= 0) {
            return 0;
        }
        verify(executionPool.getMemoryPool().tryAcquire(grantedBytes), "execution pool changed while locked");
        executionPool.addGrant(new ExecutionGrant(taskId, grantedBytes, OWN_POOL));
        return grantedBytes;
    }

    @GuardedBy("this")
    private long reclaimFromStorage(TaskId taskId, long bytes)
    {
        long reclaimedBytes = min(bytes, storagePool.getMemoryPool().availableBytes());
        if (reclaimedBytes <= 0) {
            return 0;
        }
        verify(storagePool.getMemoryPool().tryAcquire(reclaimedBytes), "storage pool changed while locked");
        executionReclaim.borrow(reclaimedBytes);
        executionPool.addGrant(new ExecutionGrant(taskId, reclaimedBytes, RECLAIMED_FROM_STORAGE));
        return reclaimedBytes;
    }

    @GuardedBy("this")
    private void returnGrants(List<ExecutionGrant> grants)
    {
        for (ExecutionGrant grant : grants) {
            if (grant.getSource() == RECLAIMED_FROM_STORAGE) {
                executionReclaim.repay(grant.getBytes());
                storagePool.getMemoryPool().release(grant.getBytes());
            }
            else {
                executionPool.getMemoryPool().release(grant.getBytes());
            }
        }
    }

    @GuardedBy("this")
    private List<CacheEntry> selectVictims(long neededBytes, @Nullable String excludedKey)
    {
        List<CacheEntry> candidates = storagePool.getEntries().stream()
                .filter(entry -> entry.getState() == IN_MEMORY)
                .filter(entry -> !entry.getKey().equals(excludedKey))
                .collect(toImmutableList());
        List<CacheEntry> victims = evictionPolicy.selectVictims(candidates, neededBytes);
        victims.forEach(CacheEntry::markEvicting);
        return victims;
    }

    /**
     * Writes disk-capable victims to the durable store. Called without holding the lock; a
     * victim whose write fails is dropped instead.
     */
    private void writeEvictedEntries(List<CacheEntry> victims)
    {
        for (CacheEntry victim : victims) {
            if (!victim.getStorageLevel().useDisk() || victim.isOnDisk()) {
                continue;
            }
            try {
                cacheStore.write(victim.getUnitId(), victim.getContent());
            }
            catch (QuarryException e) {
                stats.recordFailedFallbackWrite();
                log.warn(e, "Failed to write evicted entry %s to the durable store, dropping it", victim.getKey());
                continue;
            }
            synchronized (this) {
                victim.markWrittenToDisk();
            }
        }
    }

    @GuardedBy("this")
    private EvictionOutcome completeEviction(long requestedBytes, List<CacheEntry> victims)
    {
        ImmutableList.Builder<String> writtenToDisk = ImmutableList.builder();
        ImmutableList.Builder<String> dropped = ImmutableList.builder();
        ImmutableList.Builder<String> unitsToDelete = ImmutableList.builder();
        long freedBytes = 0;
        long freedStorageRegionBytes = 0;
        int writtenCount = 0;
        int droppedCount = 0;

        for (CacheEntry victim : victims) {
            victim.completeEviction();
            freedBytes += victim.getSizeBytes();
            freedStorageRegionBytes += releaseStorageBytes(victim.getSizeBytes());

            if (victim.isRemoved()) {
                if (victim.isOnDisk()) {
                    unitsToDelete.add(victim.getUnitId());
                }
                continue;
            }
            if (victim.getState() == ON_DISK) {
                writtenToDisk.add(victim.getKey());
                writtenCount++;
            }
            else {
                storagePool.removeEntry(victim.getKey());
                dropped.add(victim.getKey());
                droppedCount++;
            }
        }

        stats.recordEviction(writtenCount, droppedCount);
        EvictionResult result = new EvictionResult(requestedBytes, freedBytes, writtenToDisk.build(), dropped.build());
        if (!victims.isEmpty()) {
            log.debug("Evicted cached entries: %s", result);
        }
        return new EvictionOutcome(result, freedStorageRegionBytes, unitsToDelete.build());
    }

    /**
     * Unmaps an entry and frees its memory. An entry being evicted keeps its memory until the
     * eviction completes.
     *
     * @return the durable store unit to delete, if the entry had a disk copy
     */
    @GuardedBy("this")
    private Optional<String> removeEntry(String key)
    {
        CacheEntry entry = storagePool.removeEntry(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.getState() == EVICTING) {
            entry.markRemoved();
            return Optional.empty();
        }
        if (entry.getState() == IN_MEMORY) {
            releaseStorageBytes(entry.getSizeBytes());
        }
        boolean onDisk = entry.isOnDisk();
        entry.drop();
        return onDisk ? Optional.of(entry.getUnitId()) : Optional.empty();
    }

    private void deleteCacheUnits(List<String> unitIds)
    {
        for (String unitId : unitIds) {
            try {
                cacheStore.delete(unitId);
            }
            catch (QuarryException e) {
                log.warn(e, "Could not delete cached unit %s", unitId);
            }
        }
    }

    @Managed
    public synchronized long getExecutionCapacityBytes()
    {
        return executionPool.getMemoryPool().getCapacityBytes();
    }

    @Managed
    public synchronized long getStorageCapacityBytes()
    {
        return storagePool.getMemoryPool().getCapacityBytes();
    }

    @Managed
    public long getReservedRegionBytes()
    {
        return reservedRegion.getSizeBytes();
    }

    /**
     * Bytes currently held by tasks, wherever they live.
     */
    @Managed
    public synchronized long getExecutionGrantedBytes()
    {
        return executionPool.getGrantedBytes();
    }

    /**
     * Bytes of cached entries and storage reservations currently in memory.
     */
    @Managed
    public synchronized long getStorageResidentBytes()
    {
        return storagePool.getResidentBytes();
    }

    @Managed
    public synchronized long getStorageBorrowedBytes()
    {
        return storageBorrow.getBytes();
    }

    @Managed
    public synchronized long getExecutionReclaimedBytes()
    {
        return executionReclaim.getBytes();
    }

    @Managed
    @Nested
    public MemoryManagerStats getStats()
    {
        return stats;
    }

    @Managed
    @Nested
    public CacheStats getCacheStats()
    {
        return cacheStats;
    }

    public synchronized List<ExecutionGrant> getGrants(TaskId taskId)
    {
        return executionPool.getGrants(taskId);
    }

    public synchronized Optional<CacheEntry.State> getEntryState(String key)
    {
        return Optional.ofNullable(storagePool.getEntry(key)).map(CacheEntry::getState);
    }

    @VisibleForTesting
    synchronized void checkInvariants()
    {
        MemoryPool executionMemory = executionPool.getMemoryPool();
        MemoryPool storageMemory = storagePool.getMemoryPool();
        verify(executionMemory.getUsedBytes() == executionPool.getGrantedBytes() - executionReclaim.getBytes() + storageBorrow.getBytes(),
                "execution pool usage does not match grants: %s", this);
        verify(storageMemory.getUsedBytes() == storagePool.getResidentBytes() - storageBorrow.getBytes() + executionReclaim.getBytes(),
                "storage pool usage does not match residency: %s", this);
    }

    @Override
    public synchronized String toString()
    {
        return toStringHelper(this)
                .add("reservedRegion", reservedRegion)
                .add("executionPool", executionPool)
                .add("storagePool", storagePool)
                .add("storageBorrow", storageBorrow)
                .add("executionReclaim", executionReclaim)
                .add("shutdown", shutdown)
                .toString();
    }

    private static final class EvictionOutcome
    {
        private final EvictionResult result;
        private final long freedStorageRegionBytes;
        private final List<String> unitsToDelete;

        private EvictionOutcome(EvictionResult result, long freedStorageRegionBytes, List<String> unitsToDelete)
        {
            this.result = result;
            this.freedStorageRegionBytes = freedStorageRegionBytes;
            this.unitsToDelete = unitsToDelete;
        }

        EvictionResult getResult()
        {
            return result;
        }

        long getFreedStorageRegionBytes()
        {
            return freedStorageRegionBytes;
        }

        List<String> getUnitsToDelete()
        {
            return unitsToDelete;
        }
    }

    private class ManagerExecutionHandle
            implements ExecutionHandle
    {
        @Override
        public long acquireExecutionMemory(TaskId taskId, long requestedBytes)
        {
            return UnifiedMemoryManager.this.acquireExecutionMemory(taskId, requestedBytes);
        }

        @Override
        public void releaseExecutionMemory(TaskId taskId, long bytes)
        {
            UnifiedMemoryManager.this.releaseExecutionMemory(taskId, bytes);
        }

        @Override
        public void releaseAllExecutionMemory(TaskId taskId)
        {
            UnifiedMemoryManager.this.releaseAllExecutionMemory(taskId);
        }

        @Override
        public long getReservedBytes(TaskId taskId)
        {
            synchronized (UnifiedMemoryManager.this) {
                return executionPool.getReservedBytes(taskId);
            }
        }

        @Override
        public long getExecutionCapacityBytes()
        {
            return UnifiedMemoryManager.this.getExecutionCapacityBytes();
        }

        @Override
        public EvictionResult evictCachedEntries(long bytes)
        {
            return UnifiedMemoryManager.this.evictCachedEntries(bytes);
        }
    }

    private class ManagerStorageHandle
            implements StorageHandle
    {
        @Override
        public boolean acquireStorageMemory(String entryKey, long bytes)
        {
            return UnifiedMemoryManager.this.acquireStorageMemory(entryKey, bytes);
        }

        @Override
        public void releaseStorageMemory(String entryKey)
        {
            UnifiedMemoryManager.this.releaseStorageMemory(entryKey);
        }

        @Override
        public boolean put(String key, Slice content, StorageLevel storageLevel)
        {
            return UnifiedMemoryManager.this.put(key, content, storageLevel);
        }

        @Override
        public boolean put(String key, Slice content)
        {
            return UnifiedMemoryManager.this.put(key, content, defaultStorageLevel);
        }

        @Override
        public CacheLookup get(String key)
        {
            return UnifiedMemoryManager.this.get(key);
        }

        @Override
        public boolean remove(String key)
        {
            return UnifiedMemoryManager.this.remove(key);
        }

        @Override
        public long getResidentBytes()
        {
            return getStorageResidentBytes();
        }
    }
}
