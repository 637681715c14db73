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

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.tileverse.datamap.FormatMismatchException;
import io.tileverse.datamap.OutOfBoundsException;
import io.tileverse.datamap.PersistenceException;
import io.tileverse.datamap.access.memory.InMemoryAccessFormat;
import io.tileverse.datamap.format.ChannelTuple;
import io.tileverse.datamap.format.Monochrome;
import io.tileverse.datamap.region.BufferLayout;
import io.tileverse.datamap.region.RegionBuffer;
import io.tileverse.datamap.region.RegionGrid;
import io.tileverse.datamap.region.RegionKey;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AccessManagerTest {

    private static final RegionKey KEY = RegionKey.of(0, 0);

    private final Monochrome format = Monochrome.gray();
    private final RegionGrid grid = RegionGrid.of(2, 2);

    private ExecutorService executor;
    private InMemoryAccessFormat store;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        store = new InMemoryAccessFormat("test");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private AccessManager manager(AccessFormat accessFormat) {
        return AccessManager.builder(accessFormat)
                .grid(grid)
                .format(format)
                .executor(executor)
                .build();
    }

    @Test
    void testNewRegionIsFilledWithEmptyMarker() throws IOException {
        AccessManager manager = manager(store);

        try (RegionHandle handle = manager.acquire(KEY, AccessMode.READ)) {
            assertEquals(format.emptyTuple(), handle.get(1, 1));
            assertEquals(grid.boundsOf(KEY), handle.bounds());
        }
        assertTrue(manager.isResident(KEY));
        assertEquals(1, manager.residentCount());
        assertEquals(1, store.readCount());
    }

    @Test
    void testConcurrentAcquiresShareOneLoad() throws Exception {
        final int threads = 8;
        GatedAccessFormat gated = new GatedAccessFormat(store);
        AccessManager manager = manager(gated);
        CountDownLatch start = new CountDownLatch(1);

        List<Future<ChannelTuple>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            results.add(executor.submit(() -> {
                start.await();
                try (RegionHandle handle = manager.acquire(KEY, AccessMode.READ)) {
                    return handle.get(0, 0);
                }
            }));
        }
        start.countDown();
        // every caller is waiting on the same in-flight load before it is allowed to finish
        await().atMost(5, TimeUnit.SECONDS).until(() -> manager.stats().requestCount() == threads);
        gated.open();

        for (Future<ChannelTuple> result : results) {
            assertEquals(format.emptyTuple(), result.get(5, TimeUnit.SECONDS));
        }
        assertEquals(1, gated.reads.get());
        assertEquals(1, manager.stats().missCount());
        assertEquals(threads - 1, manager.stats().hitCount());
    }

    @Test
    void testHeldRegionIsNeverEvicted() throws IOException {
        AccessManager manager = manager(store);

        RegionHandle handle = manager.acquire(KEY, AccessMode.WRITE);
        handle.set(1, 0, format.encode(3));

        assertEquals(0, manager.evictIdle());
        assertEquals(0, manager.trimTo(0));
        assertTrue(manager.isResident(KEY));
        assertEquals(1, manager.region(KEY).orElseThrow().referenceCount());
        assertThat(store.keys()).isEmpty();

        handle.close();
        assertEquals(1, manager.evictIdle());
        assertFalse(manager.isResident(KEY));
        assertEquals(RegionState.UNLOADED, manager.region(KEY).orElseThrow().state());
        // the dirty region was written back on eviction
        assertThat(store.keys()).containsExactly(KEY);
        assertEquals(ChannelTuple.of(3), store.read(KEY, manager.layout()).orElseThrow().get(1, 0));
    }

    @Test
    void testHeldRegionsSurviveConcurrentTrimming() throws Exception {
        AccessManager manager = AccessManager.builder(store)
                .grid(grid)
                .format(format)
                .maxResidentRegions(1)
                .executor(executor)
                .build();
        RegionKey other = RegionKey.of(0, 1);
        RegionHandle writer = manager.acquire(KEY, AccessMode.WRITE);
        writer.set(1, 0, format.encode(11));
        RegionHandle reader = manager.acquire(other, AccessMode.READ);

        final int threads = 6;
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> churn = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            final int row = 2 + t;
            churn.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 50; i++) {
                    RegionKey key = RegionKey.of(i % 10, row);
                    try (RegionHandle handle = manager.acquire(key, AccessMode.WRITE)) {
                        handle.set(key.column() * 2, row * 2, format.encode(1 + i % 10));
                    }
                    manager.trimTo(0);
                    assertTrue(manager.isResident(KEY));
                    assertTrue(manager.isResident(other));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : churn) {
            f.get(30, TimeUnit.SECONDS);
        }

        assertTrue(manager.isResident(KEY));
        assertTrue(manager.isResident(other));
        assertEquals(format.encode(11), writer.get(1, 0));
        assertEquals(1, manager.region(KEY).orElseThrow().referenceCount());
        assertEquals(1, manager.region(other).orElseThrow().referenceCount());
        assertThat(store.keys()).doesNotContain(KEY);

        reader.close();
        writer.close();
        manager.evictIdle();
        assertEquals(0, manager.residentCount());
        assertEquals(ChannelTuple.of(11), store.read(KEY, manager.layout()).orElseThrow().get(1, 0));
        for (int t = 0; t < threads; t++) {
            RegionKey key = RegionKey.of(9, 2 + t);
            assertEquals(ChannelTuple.of(10), store.read(key, manager.layout()).orElseThrow().get(0, 0));
        }
    }

    @Test
    void testEvictedRegionIsReloadedFromStore() throws IOException {
        AccessManager manager = manager(store);
        try (RegionHandle handle = manager.acquire(RegionKey.of(1, 1), AccessMode.WRITE)) {
            handle.set(3, 2, format.encode(77));
        }
        manager.evictIdle();

        try (RegionHandle handle = manager.acquire(RegionKey.of(1, 1), AccessMode.READ)) {
            assertThat(format.decode(handle.get(3, 2))).hasValue(77);
        }
        assertEquals(2, store.readCount());
    }

    @Test
    void testResidencyLimitEvictsLeastRecentlyReleased() throws IOException {
        AccessManager manager = AccessManager.builder(store)
                .grid(grid)
                .format(format)
                .maxResidentRegions(2)
                .executor(executor)
                .build();

        for (int column = 0; column < 3; column++) {
            try (RegionHandle handle = manager.acquire(RegionKey.of(column, 0), AccessMode.WRITE)) {
                handle.set(column * 2, 0, format.encode(column + 1));
            }
        }

        assertThat(manager.residentKeys()).containsExactly(RegionKey.of(1, 0), RegionKey.of(2, 0));
        assertThat(store.keys()).containsExactly(RegionKey.of(0, 0));
        assertEquals(1, manager.stats().evictionCount());
    }

    @Test
    void testReleasingHandleKeepsRegionResidentWithoutLimit() throws IOException {
        AccessManager manager = manager(store);
        for (int column = 0; column < 5; column++) {
            manager.acquire(RegionKey.of(column, 0), AccessMode.READ).close();
        }
        assertEquals(5, manager.residentCount());
        assertEquals(5, manager.evictIdle());
        assertEquals(0, manager.residentCount());
    }

    @Test
    void testFailedFlushKeepsRegionDirty() throws IOException {
        AccessFormat failing = mock(AccessFormat.class);
        when(failing.read(any(), any())).thenReturn(Optional.empty());
        doThrow(new PersistenceException("0_0", "Disk full"))
                .doNothing()
                .when(failing)
                .write(eq(KEY), any());
        AccessManager manager = manager(failing);

        try (RegionHandle handle = manager.acquire(KEY, AccessMode.WRITE)) {
            handle.set(0, 0, format.encode(9));
        }
        PersistenceException e = assertThrows(PersistenceException.class, manager::flush);
        assertThat(e.getMessage()).contains("Disk full");
        assertTrue(manager.region(KEY).orElseThrow().isDirty());

        // retrying writes the region again
        manager.flush();
        assertFalse(manager.region(KEY).orElseThrow().isDirty());
        assertEquals(1, manager.stats().flushCount());
        verify(failing, times(2)).write(eq(KEY), any());
    }

    @Test
    void testFailedEvictionKeepsRegionResident() throws IOException {
        AccessFormat failing = mock(AccessFormat.class);
        when(failing.read(any(), any())).thenReturn(Optional.empty());
        doThrow(new PersistenceException("0_0", "Read-only file system"))
                .when(failing)
                .write(any(), any());
        AccessManager manager = manager(failing);

        try (RegionHandle handle = manager.acquire(KEY, AccessMode.WRITE)) {
            handle.set(0, 0, format.encode(9));
        }
        assertThrows(PersistenceException.class, manager::evictIdle);
        assertTrue(manager.isResident(KEY));
        assertTrue(manager.region(KEY).orElseThrow().isDirty());

        // the content survived the failed eviction
        try (RegionHandle handle = manager.acquire(KEY, AccessMode.READ)) {
            assertThat(format.decode(handle.get(0, 0))).hasValue(9);
        }
    }

    @Test
    void testCleanRegionIsNotWritten() throws IOException {
        AccessFormat accessFormat = mock(AccessFormat.class);
        when(accessFormat.read(any(), any())).thenReturn(Optional.empty());
        AccessManager manager = manager(accessFormat);

        manager.acquire(KEY, AccessMode.READ).close();
        manager.acquire(KEY, AccessMode.WRITE).close();
        manager.flush();
        assertEquals(1, manager.evictIdle());

        verify(accessFormat, times(0)).write(any(), any());
    }

    @Test
    void testLoadFailureReachesCallerAndIsRetried() throws IOException {
        AccessFormat flaky = mock(AccessFormat.class);
        when(flaky.read(any(), any()))
                .thenThrow(new PersistenceException("0_0", "Connection reset"))
                .thenReturn(Optional.empty());
        AccessManager manager = manager(flaky);

        PersistenceException e =
                assertThrows(PersistenceException.class, () -> manager.acquire(KEY, AccessMode.READ));
        assertThat(e.getMessage()).contains("Connection reset");
        assertFalse(manager.isResident(KEY));

        // a failed load is not cached
        await().atMost(5, TimeUnit.SECONDS)
                .ignoreExceptionsInstanceOf(PersistenceException.class)
                .untilAsserted(() -> {
                    try (RegionHandle handle = manager.acquire(KEY, AccessMode.READ)) {
                        assertEquals(format.emptyTuple(), handle.get(0, 0));
                    }
                });
        assertTrue(manager.isResident(KEY));
    }

    @Test
    void testStoredLayoutMismatch() throws IOException {
        store.write(KEY, RegionBuffer.allocate(new BufferLayout(4, 4, 1, 1), ChannelTuple.of(0)));
        AccessManager manager = manager(store);

        assertThrows(FormatMismatchException.class, () -> manager.acquire(KEY, AccessMode.READ));
    }

    @Test
    void testReadToWriteUpgradeFails() throws IOException {
        AccessManager manager = manager(store);

        try (RegionHandle read = manager.acquire(KEY, AccessMode.READ)) {
            IllegalStateException e =
                    assertThrows(IllegalStateException.class, () -> manager.acquire(KEY, AccessMode.WRITE));
            assertThat(e.getMessage()).contains("holding READ");
            assertEquals(1, manager.region(KEY).orElseThrow().referenceCount());
            assertEquals(format.emptyTuple(), read.get(0, 0));
        }
        try (RegionHandle write = manager.acquire(KEY, AccessMode.WRITE)) {
            write.set(0, 0, format.encode(1));
        }
    }

    @Test
    void testSharedReadsAreReferenceCounted() throws IOException {
        AccessManager manager = manager(store);

        RegionHandle first = manager.acquire(KEY, AccessMode.READ);
        RegionHandle second = manager.acquire(KEY, AccessMode.READ);
        Region region = manager.region(KEY).orElseThrow();
        assertEquals(2, region.referenceCount());

        first.close();
        assertEquals(1, region.referenceCount());
        assertEquals(0, manager.evictIdle());
        second.close();
        assertEquals(0, region.referenceCount());
        assertEquals(1, manager.evictIdle());
    }

    @Test
    void testTimedOutLockWait() throws Exception {
        AccessManager manager = manager(store);

        try (RegionHandle write = manager.acquire(KEY, AccessMode.WRITE)) {
            Future<RegionHandle> reader =
                    executor.submit(() -> manager.acquire(KEY, AccessMode.READ, Duration.ofMillis(100)));
            ExecutionException e = assertThrows(ExecutionException.class, () -> reader.get(5, TimeUnit.SECONDS));
            assertThat(e.getCause()).isInstanceOf(InterruptedIOException.class);
            assertEquals(1, manager.region(KEY).orElseThrow().referenceCount());
        }
    }

    @Test
    void testTimedOutLoadDoesNotCancelIt() throws Exception {
        GatedAccessFormat gated = new GatedAccessFormat(store);
        AccessManager manager = manager(gated);

        assertThrows(
                InterruptedIOException.class, () -> manager.acquire(KEY, AccessMode.READ, Duration.ofMillis(50)));
        gated.open();

        try (RegionHandle handle = manager.acquire(KEY, AccessMode.READ, Duration.ofSeconds(5))) {
            assertEquals(format.emptyTuple(), handle.get(0, 0));
        }
        assertEquals(1, gated.reads.get());
    }

    @Test
    void testHandleChecks() throws IOException {
        AccessManager manager = manager(store);
        AccessManager other = manager(new InMemoryAccessFormat());

        RegionHandle read = manager.acquire(KEY, AccessMode.READ);
        assertThrows(IllegalStateException.class, () -> read.set(0, 0, format.encode(1)));
        assertThrows(OutOfBoundsException.class, () -> read.get(2, 0));
        assertThrows(IllegalArgumentException.class, () -> other.release(read));

        read.close();
        assertTrue(read.isReleased());
        assertThrows(IllegalStateException.class, () -> read.get(0, 0));
        // releasing twice is harmless
        read.close();
        assertEquals(0, manager.region(KEY).orElseThrow().referenceCount());
    }

    @Test
    void testPeekAndSnapshotDoNotRetain() throws IOException {
        AccessManager manager = manager(store);
        assertThat(manager.snapshot(KEY)).isEmpty();
        assertFalse(manager.isPresent(KEY));

        try (RegionHandle handle = manager.acquire(KEY, AccessMode.WRITE)) {
            handle.set(1, 1, format.encode(5));
        }
        assertThat(manager.peek(KEY, b -> b.get(1, 1))).contains(ChannelTuple.of(5));
        assertTrue(manager.isPresent(KEY));

        manager.evictIdle();
        RegionBuffer snapshot = manager.snapshot(KEY).orElseThrow();
        assertEquals(ChannelTuple.of(5), snapshot.get(1, 1));
        assertFalse(manager.isResident(KEY));
        assertEquals(0, manager.residentCount());
    }

    @Test
    void testCompactDropsUnloadedRegions() throws IOException {
        AccessManager manager = manager(store);
        manager.acquire(KEY, AccessMode.READ).close();
        manager.acquire(RegionKey.of(1, 0), AccessMode.READ).close();
        manager.evictIdle();

        assertEquals(2, manager.compact());
        assertThat(manager.region(KEY)).isEmpty();

        try (RegionHandle handle = manager.acquire(KEY, AccessMode.READ)) {
            assertEquals(format.emptyTuple(), handle.get(0, 0));
        }
        assertEquals(0, manager.compact());
    }

    @Test
    void testStats() throws IOException {
        AccessManager manager = manager(store);
        manager.acquire(KEY, AccessMode.READ).close();
        manager.acquire(KEY, AccessMode.READ).close();

        ResidencyStats stats = manager.stats();
        assertEquals(1, stats.missCount());
        assertEquals(1, stats.hitCount());
        assertEquals(2, stats.requestCount());
        assertEquals(1, stats.residentRegions());
        assertEquals(manager.layout().byteSize(), stats.residentBytes());
        assertThat(stats.toString()).contains("resident=1");
    }

    @Test
    void testCloseFlushesAndRejectsAcquisitions() throws IOException {
        AccessManager manager = manager(store);
        try (RegionHandle handle = manager.acquire(KEY, AccessMode.WRITE)) {
            handle.set(0, 0, format.encode(4));
        }
        manager.close();

        assertTrue(manager.isClosed());
        assertEquals(0, manager.residentCount());
        assertThat(store.keys()).containsExactly(KEY);
        assertThrows(IllegalStateException.class, () -> manager.acquire(KEY, AccessMode.READ));
    }

    @Test
    void testHandleHeldAcrossCloseIsFlushedOnRelease() throws IOException {
        AccessManager manager = manager(store);
        RegionHandle handle = manager.acquire(KEY, AccessMode.WRITE);

        manager.close();
        assertTrue(manager.isResident(KEY));

        handle.set(1, 1, format.encode(8));
        handle.close();
        assertFalse(manager.isResident(KEY));
        assertEquals(ChannelTuple.of(8), store.read(KEY, manager.layout()).orElseThrow().get(1, 1));
    }

    @Test
    void testBuilderValidation() {
        assertThrows(NullPointerException.class, () -> AccessManager.builder(null));
        assertThrows(NullPointerException.class, () -> AccessManager.builder(store).format(format).build());
        assertThrows(NullPointerException.class, () -> AccessManager.builder(store).grid(grid).build());
        assertThrows(IllegalArgumentException.class, () -> AccessManager.builder(store).maxResidentRegions(-1));

        AccessManager manager = manager(store);
        assertSame(store, manager.accessFormat());
        assertEquals(new BufferLayout(2, 2, 1, 1), manager.layout());
        assertEquals(format.emptyTuple(), manager.fillTuple());
    }

    /**
     * Delegating store whose reads block until {@link #open()} is called.
     */
    private static class GatedAccessFormat implements AccessFormat {
        private final AccessFormat delegate;
        private final CountDownLatch gate = new CountDownLatch(1);
        final AtomicInteger reads = new AtomicInteger();

        GatedAccessFormat(AccessFormat delegate) {
            this.delegate = delegate;
        }

        void open() {
            gate.countDown();
        }

        @Override
        public Optional<RegionBuffer> read(RegionKey key, BufferLayout layout) throws IOException {
            reads.incrementAndGet();
            try {
                if (!gate.await(10, TimeUnit.SECONDS)) {
                    throw new IOException("Gate never opened");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException();
            }
            return delegate.read(key, layout);
        }

        @Override
        public void write(RegionKey key, RegionBuffer buffer) throws PersistenceException {
            delegate.write(key, buffer);
        }

        @Override
        public boolean exists(RegionKey key) throws IOException {
            return delegate.exists(key);
        }
    }
}
