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
import io.tileverse.datamap.OutOfBoundsException;
import io.tileverse.datamap.format.ChannelTuple;
import io.tileverse.datamap.region.RegionBuffer;
import io.tileverse.datamap.region.RegionKey;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pins a resident region and grants {@link AccessMode#READ shared} or
 * {@link AccessMode#WRITE exclusive} access to its content.
 * <p>
 * Coordinates are physical map coordinates and must lie within {@link #bounds()}. A handle
 * must be closed by the thread that acquired it, preferably with try-with-resources; closing
 * it more than once has no further effect.
 *
 * <pre>{@code
 * try (RegionHandle handle = manager.acquire(key, AccessMode.WRITE)) {
 *     handle.set(x, y, tuple);
 * }
 * }</pre>
 */
public final class RegionHandle implements AutoCloseable {

    private final AccessManager manager;
    private final Region region;
    private final AccessMode mode;
    private final AtomicBoolean released = new AtomicBoolean();

    RegionHandle(AccessManager manager, Region region, AccessMode mode) {
        this.manager = manager;
        this.region = region;
        this.mode = mode;
    }

    public RegionKey key() {
        return region.key();
    }

    public Bounds bounds() {
        return region.bounds();
    }

    public AccessMode mode() {
        return mode;
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * @return the tuple stored at physical coordinate {@code (x, y)}
     * @throws OutOfBoundsException if the coordinate is outside this region
     * @throws IllegalStateException if the handle was released
     */
    public ChannelTuple get(int x, int y) {
        checkUsable(x, y);
        Bounds b = region.bounds();
        return region.buffer().get(x - b.x(), y - b.y());
    }

    /**
     * Stores {@code tuple} at physical coordinate {@code (x, y)} and marks the region dirty.
     *
     * @throws IllegalStateException if this is not a {@link AccessMode#WRITE} handle or it was
     *     released
     */
    public void set(int x, int y, ChannelTuple tuple) {
        if (mode != AccessMode.WRITE) {
            throw new IllegalStateException("Region " + key() + " is held for " + mode);
        }
        checkUsable(x, y);
        Bounds b = region.bounds();
        region.buffer().set(x - b.x(), y - b.y(), tuple);
        region.markDirty();
    }

    /**
     * @return a copy of the region content
     */
    public RegionBuffer snapshot() {
        checkOpen();
        return region.buffer().copy();
    }

    Region region() {
        return region;
    }

    AccessManager manager() {
        return manager;
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    private void checkUsable(int x, int y) {
        checkOpen();
        if (!region.bounds().contains(x, y)) {
            throw new OutOfBoundsException(x, y, "Coordinate (%d, %d) is outside region %s %s"
                    .formatted(x, y, key(), region.bounds()));
        }
    }

    private void checkOpen() {
        if (released.get()) {
            throw new IllegalStateException("Handle on region " + key() + " was released");
        }
    }

    @Override
    public void close() {
        manager.release(this);
    }

    @Override
    public String toString() {
        return "RegionHandle[" + key() + ", " + mode + (isReleased() ? ", released" : "") + "]";
    }
}
