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

import static java.util.Objects.requireNonNull;

import io.tileverse.datamap.access.AccessFormat;
import io.tileverse.datamap.access.AccessManager;
import io.tileverse.datamap.access.AccessMode;
import io.tileverse.datamap.access.RegionHandle;
import io.tileverse.datamap.format.ChannelTuple;
import io.tileverse.datamap.format.ColorValueFormat;
import io.tileverse.datamap.region.RegionGrid;
import io.tileverse.datamap.region.RegionKey;
import io.tileverse.datamap.reorder.ReversibleReorder;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.Executor;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ValueMap} over a fixed extent, partitioned into regions of a {@link RegionGrid} that
 * an {@link AccessManager} pages in and out of a backing {@link AccessFormat}.
 * <p>
 * Each access resolves the logical coordinate to a physical one through the optional
 * {@link ReversibleReorder}: logical index {@code i = y * width + x} is stored at physical index
 * {@code p = reorder.forward(i)}, i.e. at {@code (p % width, p / width)}. The physical
 * coordinate selects the region, which is held for the duration of the access only.
 * <p>
 * Safe for concurrent use: reads of a region share it, writes are exclusive per region.
 *
 * <pre>{@code
 * try (RegionValueMap map = RegionValueMap.builder()
 *         .extent(Extent.of(40_000, 20_000))
 *         .regionSize(512, 512)
 *         .format(Monochrome.builder().channelWidth(16).build())
 *         .accessFormat(FileAccessFormat.builder().directory(dir).build())
 *         .maxResidentRegions(256)
 *         .build()) {
 *     map.set(12_345, 6_789, 42);
 * }
 * }</pre>
 */
public class RegionValueMap implements ValueMap {

    private static final Logger logger = LoggerFactory.getLogger(RegionValueMap.class);

    private final Extent extent;
    private final ColorValueFormat format;
    private final AccessManager manager;
    private final ReversibleReorder reorder;

    protected RegionValueMap(Extent extent, ColorValueFormat format, AccessManager manager, ReversibleReorder reorder) {
        this.extent = requireNonNull(extent, "Extent cannot be null");
        this.format = requireNonNull(format, "Value format cannot be null");
        this.manager = requireNonNull(manager, "Access manager cannot be null");
        if (reorder != null && reorder.size() != extent.area()) {
            throw new IllegalArgumentException(
                    "Reorder of size " + reorder.size() + " does not cover the " + extent.area() + " cells of " + extent);
        }
        this.reorder = reorder;
        logger.debug(
                "Created {} map with {} over {}{}",
                extent,
                manager.grid(),
                manager.accessFormat(),
                reorder == null ? "" : " reordered by " + reorder);
    }

    @Override
    public Extent extent() {
        return extent;
    }

    @Override
    public ColorValueFormat format() {
        return format;
    }

    public RegionGrid grid() {
        return manager.grid();
    }

    public Optional<ReversibleReorder> reorder() {
        return Optional.ofNullable(reorder);
    }

    public AccessManager accessManager() {
        return manager;
    }

    /**
     * @return the keys of the regions covering the extent, in row-major order
     */
    public List<RegionKey> regionKeys() {
        return grid().keys(extent());
    }

    @Override
    public OptionalLong get(int x, int y) throws IOException {
        Coordinate p = toPhysical(x, y);
        try (RegionHandle handle = acquire(grid().keyOf(p.x(), p.y()), AccessMode.READ)) {
            return format.decode(handle.get(p.x(), p.y()));
        }
    }

    @Override
    public void set(int x, int y, long value) throws IOException {
        Coordinate p = toPhysical(x, y);
        store(p, format.encode(value));
    }

    @Override
    public void clear(int x, int y) throws IOException {
        Coordinate p = toPhysical(x, y);
        store(p, format.emptyTuple());
    }

    private void store(Coordinate p, ChannelTuple tuple) throws IOException {
        try (RegionHandle handle = acquire(grid().keyOf(p.x(), p.y()), AccessMode.WRITE)) {
            handle.set(p.x(), p.y(), tuple);
        }
    }

    /**
     * Holds a region of this map for direct access to its physical cells. The handle must be
     * closed.
     *
     * @see AccessManager#acquire(RegionKey, AccessMode)
     */
    public RegionHandle acquire(RegionKey key, AccessMode mode) throws IOException {
        return manager.acquire(register(key), mode);
    }

    /**
     * Called with the key of every region this map accesses, before the region is acquired.
     *
     * @return the key to acquire
     */
    protected RegionKey register(RegionKey key) {
        return key;
    }

    /**
     * @return the physical coordinate holding logical coordinate {@code (x, y)}
     * @throws OutOfBoundsException if the coordinate is outside the extent
     */
    public Coordinate toPhysical(int x, int y) {
        Extent e = extent();
        if (!e.contains(x, y)) {
            throw new OutOfBoundsException(x, y, e);
        }
        if (reorder == null) {
            return new Coordinate(x, y);
        }
        long w = e.width();
        long p = reorder.forward(y * w + x);
        return new Coordinate((int) (p % w), (int) (p / w));
    }

    /**
     * @return the logical coordinate stored at physical coordinate {@code (px, py)}
     * @throws OutOfBoundsException if the coordinate is outside the extent
     */
    public Coordinate toLogical(int px, int py) {
        Extent e = extent();
        if (!e.contains(px, py)) {
            throw new OutOfBoundsException(px, py, e);
        }
        if (reorder == null) {
            return new Coordinate(px, py);
        }
        long w = e.width();
        long i = reorder.inverse(py * w + px);
        return new Coordinate((int) (i % w), (int) (i / w));
    }

    /**
     * {@link AccessOrder#REGION_MAJOR} visits the logical coordinates stored in each region
     * together, which follows the physical layout when the map is reordered.
     */
    @Override
    public Stream<Coordinate> coordinates(AccessOrder order) {
        Stream<Coordinate> coordinates = order.coordinates(extent(), grid());
        if (order == AccessOrder.REGION_MAJOR && reorder != null) {
            return coordinates.map(p -> toLogical(p.x(), p.y()));
        }
        return coordinates;
    }

    @Override
    public void flush() throws IOException {
        manager.flush();
    }

    /**
     * Flushes and evicts every region. The map can't be used afterwards.
     */
    @Override
    public void close() throws IOException {
        manager.close();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + extent() + ", " + format + ", " + manager + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link RegionValueMap}. The extent, format and access format are mandatory.
     * Without a region size, {@link RegionGrid} suggests one from the extent, aligning region
     * columns on the pivots of the reorder if there is one.
     */
    public static class Builder {
        private Extent extent;
        private RegionGrid grid;
        private ColorValueFormat format;
        private AccessFormat accessFormat;
        private ReversibleReorder reorder;
        private int maxResidentRegions;
        private Executor executor;

        private Builder() {}

        public Builder extent(Extent extent) {
            this.extent = requireNonNull(extent, "Extent cannot be null");
            return this;
        }

        public Builder extent(int width, int height) {
            return extent(new Extent(width, height));
        }

        public Builder regionSize(int width, int height) {
            return grid(new RegionGrid(width, height));
        }

        public Builder grid(RegionGrid grid) {
            this.grid = requireNonNull(grid, "Region grid cannot be null");
            return this;
        }

        public Builder format(ColorValueFormat format) {
            this.format = requireNonNull(format, "Value format cannot be null");
            return this;
        }

        public Builder accessFormat(AccessFormat accessFormat) {
            this.accessFormat = requireNonNull(accessFormat, "Access format cannot be null");
            return this;
        }

        /**
         * @param reorder a reorder over the {@code width * height} cells of the extent
         */
        public Builder reorder(ReversibleReorder reorder) {
            this.reorder = reorder;
            return this;
        }

        /**
         * @param maxResidentRegions idle regions kept in memory, 0 for no limit
         */
        public Builder maxResidentRegions(int maxResidentRegions) {
            if (maxResidentRegions < 0) {
                throw new IllegalArgumentException("Resident limit cannot be negative: " + maxResidentRegions);
            }
            this.maxResidentRegions = maxResidentRegions;
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = requireNonNull(executor, "Executor cannot be null");
            return this;
        }

        /**
         * @throws IllegalStateException if a mandatory property is missing
         * @throws IllegalArgumentException if the reorder does not cover the extent
         * @throws FormatMismatchException if the access format can't hold the format's tuples
         */
        public RegionValueMap build() {
            if (extent == null) {
                throw new IllegalStateException("Extent must be set");
            }
            RegionGrid regionGrid = grid == null ? RegionGrid.suggest(extent, reorder) : grid;
            return new RegionValueMap(extent, checkFormat(), manager(regionGrid), reorder);
        }

        ColorValueFormat checkFormat() {
            if (format == null) {
                throw new IllegalStateException("Value format must be set");
            }
            if (accessFormat == null) {
                throw new IllegalStateException("Access format must be set");
            }
            return format;
        }

        AccessManager manager(RegionGrid regionGrid) {
            AccessManager.Builder builder = AccessManager.builder(accessFormat)
                    .grid(regionGrid)
                    .format(format)
                    .maxResidentRegions(maxResidentRegions);
            if (executor != null) {
                builder.executor(executor);
            }
            return builder.build();
        }

        Extent extent() {
            return extent;
        }

        RegionGrid grid() {
            return grid;
        }

        ReversibleReorder reorder() {
            return reorder;
        }
    }
}
