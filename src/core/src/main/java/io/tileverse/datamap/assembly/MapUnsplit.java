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
package io.tileverse.datamap.assembly;

import io.tileverse.datamap.Bounds;
import io.tileverse.datamap.DynamicRegionValueMap;
import io.tileverse.datamap.Extent;
import io.tileverse.datamap.FormatMismatchException;
import io.tileverse.datamap.OutOfBoundsException;
import io.tileverse.datamap.PartitionMismatchException;
import io.tileverse.datamap.RegionValueMap;
import io.tileverse.datamap.access.AccessFormat;
import io.tileverse.datamap.access.AccessMode;
import io.tileverse.datamap.access.RegionHandle;
import io.tileverse.datamap.format.ColorValueFormat;
import io.tileverse.datamap.region.BufferLayout;
import io.tileverse.datamap.region.RegionGrid;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds a map from region snapshots, the inverse of {@link MapUnwrap}.
 * <p>
 * Snapshots hold physical content, so the rebuilt map reproduces the source values when it
 * uses the same reorder as the source, or none when the source had none.
 */
public final class MapUnsplit {

    private static final Logger logger = LoggerFactory.getLogger(MapUnsplit.class);

    private MapUnsplit() {
        // utility class
    }

    /**
     * Copies the populated cells of every snapshot into {@code target}, region by region, and
     * flushes it.
     *
     * @param parts the snapshots, in any order
     * @param format the format the snapshots were taken with
     * @param target the map to write to
     * @return {@code target}
     * @throws FormatMismatchException if {@code format} is not the target's format or a
     *     snapshot's channels don't match it
     * @throws PartitionMismatchException if a snapshot's size differs from the target's regions or
     *     its bounds are not those of its key
     * @throws OutOfBoundsException if a snapshot lies outside the target; a dynamic target is
     *     extended instead
     */
    public static <M extends RegionValueMap> M unsplit(Iterable<RegionSnapshot> parts, ColorValueFormat format, M target)
            throws IOException {
        Objects.requireNonNull(parts, "parts cannot be null");
        Objects.requireNonNull(format, "format cannot be null");
        Objects.requireNonNull(target, "target cannot be null");
        if (!format.equals(target.format())) {
            throw new FormatMismatchException("Snapshots and target map have different formats", format, target.format());
        }
        RegionGrid grid = target.grid();
        BufferLayout layout = target.accessManager().layout();
        int copied = 0;
        for (RegionSnapshot part : parts) {
            check(part, grid, layout);
            Bounds populated = part.populatedBounds();
            if (populated.isEmpty()) {
                continue;
            }
            if (target instanceof DynamicRegionValueMap dynamic) {
                dynamic.extend(dynamic.extent().union(new Extent(populated.maxX(), populated.maxY())));
            }
            if (!target.extent().toBounds().intersection(populated).equals(populated)) {
                throw new OutOfBoundsException(
                        populated.maxX() - 1,
                        populated.maxY() - 1,
                        "Region " + part.key() + " " + populated + " lies outside of " + target.extent());
            }
            Bounds b = part.bounds();
            try (RegionHandle handle = target.acquire(part.key(), AccessMode.WRITE)) {
                for (int y = populated.y(); y < populated.maxY(); y++) {
                    for (int x = populated.x(); x < populated.maxX(); x++) {
                        handle.set(x, y, part.buffer().get(x - b.x(), y - b.y()));
                    }
                }
            }
            copied++;
        }
        target.flush();
        logger.debug("Unsplit {} regions into {}", copied, target);
        return target;
    }

    /**
     * Rebuilds a map into a new {@link DynamicRegionValueMap} over {@code accessFormat}, whose
     * region size is taken from the snapshots and whose extent covers their populated bounds.
     *
     * @throws IllegalArgumentException if there is no snapshot
     * @see #unsplit(Iterable, ColorValueFormat, RegionValueMap)
     */
    public static DynamicRegionValueMap unsplit(
            Iterable<RegionSnapshot> parts, ColorValueFormat format, AccessFormat accessFormat) throws IOException {
        Objects.requireNonNull(parts, "parts cannot be null");
        List<RegionSnapshot> all = new ArrayList<>();
        parts.forEach(all::add);
        if (all.isEmpty()) {
            throw new IllegalArgumentException("At least one region snapshot is required");
        }
        RegionSnapshot first = all.get(0);
        Bounds covered = Bounds.EMPTY;
        for (RegionSnapshot part : all) {
            covered = covered.union(part.populatedBounds());
        }
        DynamicRegionValueMap target = DynamicRegionValueMap.dynamicBuilder()
                .extent(new Extent(covered.maxX(), covered.maxY()))
                .regionSize(first.bounds().width(), first.bounds().height())
                .format(format)
                .accessFormat(accessFormat)
                .build();
        return unsplit(all, format, target);
    }

    private static void check(RegionSnapshot part, RegionGrid grid, BufferLayout layout) {
        BufferLayout partLayout = part.buffer().layout();
        if (partLayout.width() != grid.regionWidth() || partLayout.height() != grid.regionHeight()) {
            throw new PartitionMismatchException("Region %s of %dx%d does not match the target %s"
                    .formatted(part.key(), partLayout.width(), partLayout.height(), grid));
        }
        if (!grid.boundsOf(part.key()).equals(part.bounds())) {
            throw new PartitionMismatchException(
                    "Region " + part.key() + " has bounds " + part.bounds() + " not aligned with " + grid);
        }
        if (partLayout.channels() != layout.channels() || partLayout.bytesPerChannel() != layout.bytesPerChannel()) {
            throw new FormatMismatchException("Region " + part.key() + " has another layout", layout, partLayout);
        }
    }
}
