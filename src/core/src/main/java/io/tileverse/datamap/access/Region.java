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

import io.tileverse.datamap.Bounds;
import io.tileverse.datamap.region.RegionBuffer;
import io.tileverse.datamap.region.RegionKey;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bookkeeping of one region of an {@link AccessManager}: lifecycle state, reference count,
 * dirty flag and, while resident, the region content.
 * <p>
 * Lifecycle fields are guarded by the region's monitor. The content is guarded by
 * {@link #contentLock()}: handles hold its read or write lock for their whole life, and the
 * buffer is only dropped under the write lock.
 */
public final class Region {

    private final RegionKey key;
    private final Bounds bounds;
    private final String resourceId;
    private final ReentrantReadWriteLock contentLock = new ReentrantReadWriteLock();

    private RegionState state = RegionState.UNLOADED;
    private RegionBuffer buffer;
    private int referenceCount;
    private long lastReleased;
    private boolean retired;
    private volatile boolean dirty;

    Region(RegionKey key, Bounds bounds, String resourceId) {
        this.key = key;
        this.bounds = bounds;
        this.resourceId = resourceId;
    }

    public RegionKey key() {
        return key;
    }

    /**
     * @return the full footprint of the region in physical coordinates
     */
    public Bounds bounds() {
        return bounds;
    }

    public String resourceId() {
        return resourceId;
    }

    public synchronized RegionState state() {
        return state;
    }

    public synchronized int referenceCount() {
        return referenceCount;
    }

    /**
     * @return the value of the release clock when the last handle was released, 0 if never
     */
    public synchronized long lastReleased() {
        return lastReleased;
    }

    public boolean isDirty() {
        return dirty;
    }

    synchronized boolean isRetired() {
        return retired;
    }

    synchronized boolean isEvictable() {
        return state == RegionState.RESIDENT && referenceCount == 0;
    }

    ReentrantReadWriteLock contentLock() {
        return contentLock;
    }

    /**
     * Caller must hold {@link #contentLock()}.
     */
    RegionBuffer buffer() {
        return buffer;
    }

    void markDirty() {
        dirty = true;
    }

    void markClean() {
        dirty = false;
    }

    /**
     * Waits for a concurrent load or eviction to settle, then claims the load.
     *
     * @return {@code true} if the caller must read the region, {@code false} if it is already
     *     resident or was retired and must be looked up again
     */
    synchronized boolean beginLoad() throws InterruptedException {
        while (state == RegionState.LOADING || state == RegionState.EVICTING) {
            wait();
        }
        if (retired || state == RegionState.RESIDENT) {
            return false;
        }
        state = RegionState.LOADING;
        return true;
    }

    synchronized void completeLoad(RegionBuffer loaded) {
        expect(RegionState.LOADING);
        buffer = loaded;
        dirty = false;
        state = RegionState.RESIDENT;
        notifyAll();
    }

    synchronized void abortLoad() {
        expect(RegionState.LOADING);
        state = RegionState.UNLOADED;
        notifyAll();
    }

    /**
     * @return {@code true} if the region was resident and its reference count was incremented
     */
    synchronized boolean retain() {
        if (state != RegionState.RESIDENT) {
            return false;
        }
        referenceCount++;
        return true;
    }

    /**
     * @param tick release clock value, negative to leave the recency unchanged
     */
    synchronized void release(long tick) {
        if (referenceCount <= 0) {
            throw new IllegalStateException("Region " + key + " released more times than retained");
        }
        referenceCount--;
        if (tick >= 0) {
            lastReleased = tick;
        }
    }

    /**
     * @return {@code true} if the region was resident and unreferenced, and is now evicting
     */
    synchronized boolean beginEviction() {
        if (state != RegionState.RESIDENT || referenceCount > 0) {
            return false;
        }
        state = RegionState.EVICTING;
        return true;
    }

    void completeEviction() {
        contentLock.writeLock().lock();
        try {
            synchronized (this) {
                expect(RegionState.EVICTING);
                buffer = null;
                dirty = false;
                state = RegionState.UNLOADED;
                notifyAll();
            }
        } finally {
            contentLock.writeLock().unlock();
        }
    }

    synchronized void abortEviction() {
        expect(RegionState.EVICTING);
        state = RegionState.RESIDENT;
        notifyAll();
    }

    /**
     * Blocks while the region is being evicted.
     */
    synchronized void awaitSettled() throws InterruptedException {
        while (state == RegionState.EVICTING) {
            wait();
        }
    }

    /**
     * Marks an unloaded, unreferenced region as dropped from its manager.
     *
     * @return whether the region was retired
     */
    synchronized boolean retire() {
        if (retired || state != RegionState.UNLOADED || referenceCount > 0) {
            return false;
        }
        retired = true;
        return true;
    }

    private void expect(RegionState expected) {
        if (state != expected) {
            throw new IllegalStateException("Region " + key + " is " + state + ", expected " + expected);
        }
    }

    @Override
    public synchronized String toString() {
        return "Region[" + key + ", " + state + ", refs=" + referenceCount + (dirty ? ", dirty" : "") + "]";
    }
}
