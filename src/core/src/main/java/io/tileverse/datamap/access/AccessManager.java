/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.datamap.access;

import static java.util.Objects.requireNonNull;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.tileverse.datamap.FormatMismatchException;
import io.tileverse.datamap.PersistenceException;
import io.tileverse.datamap.format.ChannelTuple;
import io.tileverse.datamap.format.ColorValueFormat;
import io.tileverse.datamap.region.BufferLayout;
import io.tileverse.datamap.region.RegionBuffer;
import io.tileverse.datamap.region.RegionGrid;
import io.tileverse.datamap.region.RegionKey;
import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Residency broker of the regions of one value map.
 * <p>
 * A region is loaded through the {@link AccessFormat} the first time it is
 * {@link #acquire(RegionKey, AccessMode) acquired}, stays resident while {@link RegionHandle
 * handles} reference it, and is written back and dropped by {@link #evictIdle()} once no handle
 * references it. Concurrent acquisitions of a region that is being loaded share the single
 * in-flight load, which is tracked with a Caffeine {@link AsyncCache}.
 * <p>
 * <strong>Residency limit:</strong> with {@link Builder#maxResidentRegions(int)} set, releasing
 * a handle evicts the least recently released idle regions until the limit is met. Regions
 * referenced by handles are never evicted, so the limit can be exceeded while more regions than
 * that are held.
 * <p>
 * <strong>Locking:</strong> a {@link AccessMode#READ} handle holds the region's read lock and a
 * {@link AccessMode#WRITE} handle its write lock until released. A thread holding a READ handle
 * cannot acquire a WRITE handle on the same region; the request fails instead of deadlocking.
 *
 * <pre>{@code
 * AccessManager manager = AccessManager.builder(new InMemoryAccessFormat())
 *     .grid(RegionGrid.of(256, 256))
 *     .format(Monochrome.gray())
 *     .maxResidentRegions(64)
 *     .build();
 * }</pre>
 */
public class AccessManager implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(AccessManager.class);

    private final AccessFormat accessFormat;
    private final RegionGrid grid;
    private final BufferLayout layout;
    private final ChannelTuple fillTuple;
    private final int maxResidentRegions;

    private final ConcurrentMap<RegionKey, Region> regions = new ConcurrentHashMap<>();
    private final AsyncCache<RegionKey, Region> residency;

    private final AtomicLong releaseClock = new AtomicLong();
    private final AtomicInteger residentCount = new AtomicInteger();
    private final LongAdder evictionCount = new LongAdder();
    private final LongAdder flushCount = new LongAdder();
    private final ReentrantLock trimLock = new ReentrantLock();

    private volatile boolean closed;

    AccessManager(Builder builder) {
        this.accessFormat = builder.accessFormat;
        this.grid = requireNonNull(builder.grid, "Region grid cannot be null");
        ColorValueFormat format = requireNonNull(builder.format, "Value format cannot be null");
        this.layout = BufferLayout.of(grid.regionWidth(), grid.regionHeight(), format);
        this.fillTuple = format.emptyTuple();
        this.maxResidentRegions = builder.maxResidentRegions;
        accessFormat.checkLayout(layout);
        this.residency = Caffeine.newBuilder()
                .executor(builder.executor)
                .recordStats()
                .buildAsync();
    }

    public AccessFormat accessFormat() {
        return accessFormat;
    }

    public RegionGrid grid() {
        return grid;
    }

    public BufferLayout layout() {
        return layout;
    }

    /**
     * @return the tuple new regions are filled with
     */
    public ChannelTuple fillTuple() {
        return fillTuple;
    }

    /**
     * @return the residency limit, 0 if unbounded
     */
    public int maxResidentRegions() {
        return maxResidentRegions;
    }

    /**
     * Acquires a handle on a region, loading it if needed, waiting as long as it takes.
     *
     * @see #acquire(RegionKey, AccessMode, Duration)
     */
    public RegionHandle acquire(RegionKey key, AccessMode mode) throws IOException {
        return acquire(key, mode, null);
    }

    /**
     * Acquires a handle on a region.
     * <p>
     * If the region is not resident it is read from the {@link AccessFormat}, or filled with the
     * format's empty marker when the store has nothing for it. A caller that gives up waiting,
     * by timeout or interruption, does not cancel the load for the other callers.
     *
     * @param key the region to acquire
     * @param mode shared or exclusive access
     * @param timeout how long to wait for the load and the lock, {@code null} to wait
     *     indefinitely
     * @return a handle the caller must close
     * @throws InterruptedIOException if the wait timed out or the thread was interrupted
     * @throws IOException if the region could not be loaded; every caller waiting for the same
     *     load gets the failure
     * @throws IllegalStateException if the manager is closed, or a WRITE handle is requested by
     *     a thread holding a READ handle on the region
     */
    public RegionHandle acquire(RegionKey key, AccessMode mode, Duration timeout) throws IOException {
        requireNonNull(key, "Region key cannot be null");
        requireNonNull(mode, "Access mode cannot be null");
        ensureOpen();
        final boolean timed = timeout != null;
        final long deadline = timed ? System.nanoTime() + timeout.toNanos() : 0L;

        Region region;
        while (true) {
            CompletableFuture<Region> future = residency.get(
                    key, (k, executor) -> CompletableFuture.supplyAsync(() -> load(k), executor));
            region = await(key, future, deadline, timed);
            if (region.retain()) {
                break;
            }
            // evicted between the end of the load and our retain
            awaitSettled(region);
            if (region.state() != RegionState.RESIDENT) {
                residency.asMap().remove(key, future);
            }
        }

        try {
            lock(region, mode, deadline, timed);
        } catch (IOException | RuntimeException e) {
            region.release(-1);
            throw e;
        }
        return new RegionHandle(this, region, mode);
    }

    /**
     * Releases a handle: unlocks the region and decrements its reference count. Never evicts
     * the region by itself unless a residency limit is set or the manager is closed. Releasing a
     * handle twice has no effect.
     *
     * @param handle a handle acquired from this manager, on the thread that acquired it
     */
    public void release(RegionHandle handle) {
        requireNonNull(handle, "handle cannot be null");
        if (handle.manager() != this) {
            throw new IllegalArgumentException("Handle " + handle + " belongs to another access manager");
        }
        if (!handle.markReleased()) {
            return;
        }
        Region region = handle.region();
        lockFor(region, handle.mode()).unlock();
        region.release(releaseClock.incrementAndGet());

        if (closed) {
            evictQuietly(region);
        } else if (maxResidentRegions > 0 && residentCount.get() > maxResidentRegions) {
            trimQuietly();
        }
    }

    /**
     * Writes a region back to the store if it is resident and dirty. Does nothing for clean or
     * unloaded regions.
     *
     * @throws PersistenceException if the write failed; the region stays resident and dirty
     */
    public void flush(RegionKey key) throws PersistenceException {
        Region region = regions.get(requireNonNull(key, "Region key cannot be null"));
        if (region != null) {
            writeIfDirty(region);
        }
    }

    /**
     * Writes back every resident dirty region.
     *
     * @throws PersistenceException for the first region that failed, with the other failures
     *     suppressed; the regions that failed stay dirty
     */
    public void flush() throws PersistenceException {
        PersistenceException failure = null;
        for (Region region : regions.values()) {
            try {
                writeIfDirty(region);
            } catch (PersistenceException e) {
                failure = merge(failure, e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Evicts every resident region no handle references, least recently released first. Dirty
     * regions are flushed before being dropped.
     *
     * @return the number of evicted regions
     * @throws PersistenceException if some regions could not be flushed, after every other idle
     *     region was evicted; the regions that failed stay resident and dirty
     */
    public int evictIdle() throws PersistenceException {
        return trimTo(0);
    }

    /**
     * Evicts idle regions, least recently released first, until at most {@code maxResident}
     * regions are resident or no idle region is left.
     *
     * @return the number of evicted regions
     * @throws PersistenceException if some regions could not be flushed
     */
    public int trimTo(int maxResident) throws PersistenceException {
        if (maxResident < 0) {
            throw new IllegalArgumentException("Resident limit cannot be negative: " + maxResident);
        }
        int evicted = 0;
        PersistenceException failure = null;
        for (Region region : idleByRecency()) {
            if (residentCount.get() <= maxResident) {
                break;
            }
            try {
                if (evict(region)) {
                    evicted++;
                }
            } catch (PersistenceException e) {
                failure = merge(failure, e);
            }
        }
        if (failure != null) {
            throw failure;
        }
        return evicted;
    }

    /**
     * Applies {@code reader} to the content of a region without making it resident: in place
     * under the region's read lock when it is resident, otherwise on a buffer read straight from
     * the store.
     *
     * @return the reader's result, or empty when the region is neither resident nor stored
     */
    public <T> Optional<T> peek(RegionKey key, Function<RegionBuffer, T> reader) throws IOException {
        requireNonNull(reader, "reader cannot be null");
        Region region = regions.get(requireNonNull(key, "Region key cannot be null"));
        if (region != null) {
            awaitSettled(region);
            if (region.retain()) {
                Lock lock = region.contentLock().readLock();
                lock.lock();
                try {
                    return Optional.ofNullable(reader.apply(region.buffer()));
                } finally {
                    lock.unlock();
                    region.release(-1);
                }
            }
        }
        return accessFormat.read(key, layout).map(reader);
    }

    /**
     * @return a copy of the region content, resident or stored, without retaining the region
     */
    public Optional<RegionBuffer> snapshot(RegionKey key) throws IOException {
        return peek(key, RegionBuffer::copy);
    }

    /**
     * @return whether the region is resident
     */
    public boolean isResident(RegionKey key) {
        Region region = regions.get(key);
        return region != null && region.state() == RegionState.RESIDENT;
    }

    /**
     * @return whether the region is resident or has content in the store
     */
    public boolean isPresent(RegionKey key) throws IOException {
        return isResident(key) || accessFormat.exists(key);
    }

    /**
     * @return the bookkeeping of a region this manager has seen
     */
    public Optional<Region> region(RegionKey key) {
        return Optional.ofNullable(regions.get(key));
    }

    /**
     * @return the keys of the resident regions, in row-major order
     */
    public List<RegionKey> residentKeys() {
        return regions.values().stream()
                .filter(r -> r.state() == RegionState.RESIDENT)
                .map(Region::key)
                .sorted()
                .toList();
    }

    public int residentCount() {
        return residentCount.get();
    }

    /**
     * Drops the bookkeeping of unloaded, unreferenced regions.
     *
     * @return the number of dropped entries
     */
    public int compact() {
        int removed = 0;
        for (RegionKey key : regions.keySet()) {
            boolean[] retired = {false};
            regions.computeIfPresent(key, (k, region) -> {
                retired[0] = region.retire();
                return retired[0] ? null : region;
            });
            if (retired[0]) {
                removed++;
            }
        }
        logger.debug("Compacted {} unloaded regions", removed);
        return removed;
    }

    /**
     * @return the residency counters
     */
    public ResidencyStats stats() {
        int resident = residentCount.get();
        return ResidencyStats.fromCaffeine(
                residency.synchronous().stats(),
                evictionCount.sum(),
                flushCount.sum(),
                resident,
                (long) resident * layout.byteSize());
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Evicts every idle region, flushing the dirty ones. Acquisitions fail from now on; regions
     * still held by handles are flushed and dropped as their handles are released, so closing
     * never waits for a handle. Calling it again retries the regions that failed to flush.
     *
     * @throws PersistenceException if some regions could not be flushed
     */
    @Override
    public void close() throws IOException {
        closed = true;
        evictIdle();
        long held = regions.values().stream()
                .filter(r -> r.referenceCount() > 0)
                .count();
        if (held > 0) {
            logger.warn("Closing access manager with {} regions still held by open handles", held);
        }
        logger.debug("Closed access manager over {}", accessFormat);
    }

    private Region load(RegionKey key) {
        while (true) {
            Region region = regions.computeIfAbsent(key, this::newRegion);
            if (!claimLoad(region)) {
                if (region.isRetired()) {
                    continue;
                }
                return region;
            }
            long start = System.nanoTime();
            try {
                Optional<RegionBuffer> stored = accessFormat.read(key, layout);
                RegionBuffer buffer = stored.isPresent()
                        ? checkLoaded(key, stored.get())
                        : RegionBuffer.allocate(layout, fillTuple);
                region.completeLoad(buffer);
                residentCount.incrementAndGet();
                if (logger.isDebugEnabled()) {
                    logger.debug(
                            "Loaded region {} ({}) in {} ms",
                            key,
                            stored.isPresent() ? "stored" : "new",
                            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
                }
                return region;
            } catch (IOException e) {
                region.abortLoad();
                logger.debug("Failed to load region {}: {}", key, e.getMessage());
                throw new UncheckedIOException("Failed to load region " + key, e);
            } catch (RuntimeException e) {
                region.abortLoad();
                throw e;
            }
        }
    }

    private static boolean claimLoad(Region region) {
        try {
            return region.beginLoad();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UncheckedIOException(
                    new InterruptedIOException("Interrupted while waiting for region " + region.key() + " to settle"));
        }
    }

    private RegionBuffer checkLoaded(RegionKey key, RegionBuffer buffer) {
        if (!layout.equals(buffer.layout())) {
            throw new FormatMismatchException("Stored region " + key + " has another layout", layout, buffer.layout());
        }
        return buffer;
    }

    private Region newRegion(RegionKey key) {
        return new Region(key, grid.boundsOf(key), accessFormat.resourceId(key));
    }

    private Region await(RegionKey key, CompletableFuture<Region> future, long deadline, boolean timed)
            throws IOException {
        try {
            if (!timed) {
                return future.get();
            }
            return future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for region " + key);
        } catch (TimeoutException e) {
            throw new InterruptedIOException("Timed out waiting for region " + key);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UncheckedIOException u) {
                throw u.getCause();
            }
            if (cause instanceof RuntimeException r) {
                throw r;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IOException("Failed to load region " + key, cause);
        }
    }

    private void lock(Region region, AccessMode mode, long deadline, boolean timed) throws IOException {
        if (mode == AccessMode.WRITE && region.contentLock().getReadHoldCount() > 0) {
            throw new IllegalStateException(
                    "Cannot acquire WRITE access to region " + region.key() + " while holding READ access");
        }
        Lock lock = lockFor(region, mode);
        if (!timed) {
            lock.lock();
            return;
        }
        try {
            if (!lock.tryLock(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                throw new InterruptedIOException("Timed out waiting for " + mode + " access to region " + region.key());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for " + mode + " access to region " + region.key());
        }
    }

    private static Lock lockFor(Region region, AccessMode mode) {
        return mode == AccessMode.READ
                ? region.contentLock().readLock()
                : region.contentLock().writeLock();
    }

    private static void awaitSettled(Region region) throws InterruptedIOException {
        try {
            region.awaitSettled();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for region " + region.key() + " to be evicted");
        }
    }

    private boolean writeIfDirty(Region region) throws PersistenceException {
        Lock lock = region.contentLock().readLock();
        lock.lock();
        try {
            RegionBuffer buffer = region.buffer();
            if (!region.isDirty() || buffer == null) {
                return false;
            }
            accessFormat.write(region.key(), buffer);
            region.markClean();
            flushCount.increment();
            logger.debug("Flushed region {} to {}", region.key(), region.resourceId());
            return true;
        } finally {
            lock.unlock();
        }
    }

    private boolean evict(Region region) throws PersistenceException {
        if (!region.beginEviction()) {
            return false;
        }
        RegionKey key = region.key();
        CompletableFuture<Region> entry = residency.asMap().get(key);
        try {
            writeIfDirty(region);
        } catch (PersistenceException | RuntimeException e) {
            region.abortEviction();
            throw e;
        }
        region.completeEviction();
        residentCount.decrementAndGet();
        if (entry != null) {
            residency.asMap().remove(key, entry);
        }
        evictionCount.increment();
        logger.debug("Evicted region {}", key);
        return true;
    }

    private void evictQuietly(Region region) {
        try {
            evict(region);
        } catch (PersistenceException e) {
            logger.warn("Failed to flush region {} released after close, keeping it resident", region.key(), e);
        }
    }

    private void trimQuietly() {
        if (!trimLock.tryLock()) {
            return;
        }
        try {
            trimTo(maxResidentRegions);
        } catch (PersistenceException e) {
            logger.warn(
                    "Failed to flush regions while trimming to {} resident regions, keeping them resident",
                    maxResidentRegions,
                    e);
        } finally {
            trimLock.unlock();
        }
    }

    private List<Region> idleByRecency() {
        return regions.values().stream()
                .filter(Region::isEvictable)
                .sorted(Comparator.comparingLong(Region::lastReleased))
                .toList();
    }

    private static PersistenceException merge(PersistenceException first, PersistenceException next) {
        if (first == null) {
            return next;
        }
        first.addSuppressed(next);
        return first;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("AccessManager is closed");
        }
    }

    @Override
    public String toString() {
        return "AccessManager[" + accessFormat + ", " + grid + ", resident=" + residentCount.get() + "]";
    }

    /**
     * Creates a builder for an access manager over the given store.
     *
     * @param accessFormat the backing store of the regions
     * @return a new builder
     */
    public static Builder builder(AccessFormat accessFormat) {
        return new Builder(accessFormat);
    }

    /**
     * Builder for {@link AccessManager}. The region grid and value format are mandatory.
     */
    public static class Builder {
        private final AccessFormat accessFormat;
        private RegionGrid grid;
        private ColorValueFormat format;
        private int maxResidentRegions;
        private Executor executor = ForkJoinPool.commonPool();

        private Builder(AccessFormat accessFormat) {
            this.accessFormat = requireNonNull(accessFormat, "Access format cannot be null");
        }

        public Builder grid(RegionGrid grid) {
            this.grid = requireNonNull(grid, "Region grid cannot be null");
            return this;
        }

        /**
         * @param format the value format, which determines the buffer layout and the tuple new
         *     regions are filled with
         * @return this builder
         */
        public Builder format(ColorValueFormat format) {
            this.format = requireNonNull(format, "Value format cannot be null");
            return this;
        }

        /**
         * @param maxResidentRegions number of idle regions kept resident, 0 for no limit
         * @return this builder
         */
        public Builder maxResidentRegions(int maxResidentRegions) {
            if (maxResidentRegions < 0) {
                throw new IllegalArgumentException("Resident limit cannot be negative: " + maxResidentRegions);
            }
            this.maxResidentRegions = maxResidentRegions;
            return this;
        }

        /**
         * @param executor the executor loads run on, the common fork join pool by default
         * @return this builder
         */
        public Builder executor(Executor executor) {
            this.executor = requireNonNull(executor, "Executor cannot be null");
            return this;
        }

        /**
         * @throws io.tileverse.datamap.FormatMismatchException if the access format cannot hold
         *     regions of the format's layout
         */
        public AccessManager build() {
            return new AccessManager(this);
        }
    }
}
