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
package io.tileverse.datamap;

import io.tileverse.datamap.access.AccessFormat;
import io.tileverse.datamap.access.AccessManager;
import io.tileverse.datamap.format.ColorValueFormat;
import io.tileverse.datamap.region.RegionGrid;
import io.tileverse.datamap.region.RegionKey;
import java.io.IOException;
import java.util.List;
import java.util.NavigableSet;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link RegionValueMap} whose extent grows on demand.
 * <p>
 * The region grid is fixed and the extent never shrinks. A region key is registered the first
 * time an access references a cell of that region, so growing the extent by any amount costs
 * nothing until the new area is used. Extent changes are serialized with accesses by a
 * read/write lock, so an access never observes a partially grown map, and handles held across
 * a growth stay valid.
 * <p>
 * With {@link Builder#autoExtend(boolean) auto extension} (the default), writing past the
 * extent grows it to include the coordinate; reads past the extent always fail with
 * {@link OutOfBoundsException}. Dynamic maps can't be reordered.
 */
public class DynamicRegionValueMap extends RegionValueMap {

    private static final Logger logger = LoggerFactory.getLogger(DynamicRegionValueMap.class);

    private final ReentrantReadWriteLock extentLock = new ReentrantReadWriteLock();
    private final NavigableSet<RegionKey> registeredKeys = new ConcurrentSkipListSet<>();
    private final boolean autoExtend;
    private volatile Extent extent;

    protected DynamicRegionValueMap(
            Extent extent, ColorValueFormat format, AccessManager manager, boolean autoExtend) {
        super(extent, format, manager, null);
        this.extent = extent;
        this.autoExtend = autoExtend;
    }

    @Override
    public Extent extent() {
        return extent;
    }

    public boolean isAutoExtend() {
        return autoExtend;
    }

    /**
     * @return the keys of every region referenced so far, in row-major order
     */
    @Override
    public List<RegionKey> regionKeys() {
        return List.copyOf(registeredKeys);
    }

    /**
     * Grows the extent. Regions of the new area are registered when first referenced.
     *
     * @param newExtent the new extent, at least as large as the current one in both dimensions;
     *     the current extent is a no-op
     * @throws ShrinkNotSupportedException if {@code newExtent} is smaller in any dimension
     */
    public void extend(Extent newExtent) {
        Lock lock = extentLock.writeLock();
        lock.lock();
        try {
            Extent current = extent;
            if (!newExtent.encloses(current)) {
                throw new ShrinkNotSupportedException(current, newExtent);
            }
            if (newExtent.equals(current)) {
                return;
            }
            extent = newExtent;
            logger.debug("Extended map from {} to {}", current, newExtent);
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected RegionKey register(RegionKey key) {
        if (registeredKeys.add(key)) {
            logger.trace("Registered region {}", key);
        }
        return key;
    }

    /**
     * @throws OutOfBoundsException if the coordinate is outside the current extent
     */
    @Override
    public OptionalLong get(int x, int y) throws IOException {
        Lock lock = extentLock.readLock();
        lock.lock();
        try {
            return super.get(x, y);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a value, first growing the extent to include {@code (x, y)} when auto extension is
     * on.
     *
     * @throws OutOfBoundsException if the coordinate is negative, or outside the extent with auto
     *     extension off
     */
    @Override
    public void set(int x, int y, long value) throws IOException {
        ensureContains(x, y);
        Lock lock = extentLock.readLock();
        lock.lock();
        try {
            super.set(x, y, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clearing a cell outside the extent grows nothing: it fails like a read.
     */
    @Override
    public void clear(int x, int y) throws IOException {
        Lock lock = extentLock.readLock();
        lock.lock();
        try {
            super.clear(x, y);
        } finally {
            lock.unlock();
        }
    }

    private void ensureContains(int x, int y) {
        Extent current = extent;
        if (current.contains(x, y) || !autoExtend) {
            return;
        }
        // negative or unreachable coordinates fail in the bounds check
        if (x < 0 || y < 0 || x == Integer.MAX_VALUE || y == Integer.MAX_VALUE) {
            return;
        }
        Lock lock = extentLock.writeLock();
        lock.lock();
        try {
            extend(extent.union(new Extent(x + 1, y + 1)));
        } finally {
            lock.unlock();
        }
    }

    public static Builder dynamicBuilder() {
        return new Builder();
    }

    /**
     * Builder for {@link DynamicRegionValueMap}. The format and access format are mandatory; the
     * initial extent defaults to empty and the region size to
     * {@link RegionGrid#MIN_REGION_LENGTH} squared.
     */
    public static class Builder {
        private final RegionValueMap.Builder delegate = RegionValueMap.builder();
        private boolean autoExtend = true;

        private Builder() {}

        public Builder extent(Extent initial) {
            delegate.extent(initial);
            return this;
        }

        public Builder extent(int width, int height) {
            delegate.extent(width, height);
            return this;
        }

        public Builder regionSize(int width, int height) {
            delegate.regionSize(width, height);
            return this;
        }

        public Builder grid(RegionGrid grid) {
            delegate.grid(grid);
            return this;
        }

        public Builder format(ColorValueFormat format) {
            delegate.format(format);
            return this;
        }

        public Builder accessFormat(AccessFormat accessFormat) {
            delegate.accessFormat(accessFormat);
            return this;
        }

        public Builder maxResidentRegions(int maxResidentRegions) {
            delegate.maxResidentRegions(maxResidentRegions);
            return this;
        }

        public Builder executor(Executor executor) {
            delegate.executor(executor);
            return this;
        }

        /**
         * @param autoExtend whether writes past the extent grow it, {@code true} by default
         */
        public Builder autoExtend(boolean autoExtend) {
            this.autoExtend = autoExtend;
            return this;
        }

        public DynamicRegionValueMap build() {
            ColorValueFormat format = delegate.checkFormat();
            Extent initial = delegate.extent() == null ? new Extent(0, 0) : delegate.extent();
            RegionGrid grid = delegate.grid() == null
                    ? new RegionGrid(RegionGrid.MIN_REGION_LENGTH, RegionGrid.MIN_REGION_LENGTH)
                    : delegate.grid();
            return new DynamicRegionValueMap(initial, format, delegate.manager(grid), autoExtend);
        }
    }
}
