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
package io.tileverse.datamap.region;

import io.tileverse.datamap.Bounds;
import io.tileverse.datamap.Extent;
import io.tileverse.datamap.reorder.Permutations;
import io.tileverse.datamap.reorder.Reorder;
import java.util.ArrayList;
import java.util.List;

/**
 * Partition of the coordinate space into regions of {@code regionWidth x regionHeight} cells.
 * <p>
 * Cell {@code (x, y)} belongs to region {@code (x / regionWidth, y / regionHeight)}. Regions on
 * the right and bottom edges of an extent may be partially outside of it.
 *
 * @param regionWidth columns per region
 * @param regionHeight rows per region
 */
public record RegionGrid(int regionWidth, int regionHeight) {

    /** Smallest region edge {@link #suggest(Extent)} picks. */
    public static final int MIN_REGION_LENGTH = 32;

    /** Largest region edge {@link #suggest(Extent)} picks. */
    public static final int MAX_REGION_LENGTH = 1024;

    /** Preferred number of regions along each axis when suggesting a grid. */
    public static final int MIN_DIVISIONS = 8;

    public RegionGrid {
        if (regionWidth <= 0 || regionHeight <= 0) {
            throw new IllegalArgumentException("Region size must be positive: " + regionWidth + "x" + regionHeight);
        }
    }

    public static RegionGrid of(int regionWidth, int regionHeight) {
        return new RegionGrid(regionWidth, regionHeight);
    }

    public RegionKey keyOf(int x, int y) {
        return new RegionKey(x / regionWidth, y / regionHeight);
    }

    /**
     * @return the full footprint of the region, which may extend past a map's extent
     */
    public Bounds boundsOf(RegionKey key) {
        return new Bounds(key.column() * regionWidth, key.row() * regionHeight, regionWidth, regionHeight);
    }

    public int columns(Extent extent) {
        return (int) ((extent.width() + (long) regionWidth - 1) / regionWidth);
    }

    public int rows(Extent extent) {
        return (int) ((extent.height() + (long) regionHeight - 1) / regionHeight);
    }

    /**
     * @return the keys of the regions covering {@code extent}, in row-major order
     * @throws IllegalArgumentException if there are more than {@link Integer#MAX_VALUE} of them
     */
    public List<RegionKey> keys(Extent extent) {
        int columns = columns(extent);
        int rows = rows(extent);
        long count = (long) columns * rows;
        if (count > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                    "%s splits %s into %d regions, too many to list".formatted(this, extent, count));
        }
        List<RegionKey> keys = new ArrayList<>((int) count);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                keys.add(new RegionKey(c, r));
            }
        }
        return keys;
    }

    /**
     * @return whether {@code bounds} starts on a region boundary of this grid
     */
    public boolean isAligned(Bounds bounds) {
        return bounds.x() % regionWidth == 0 && bounds.y() % regionHeight == 0;
    }

    /**
     * Picks a region size for {@code extent} within the default limits.
     *
     * @see #suggestRegionLength(int, int, int)
     */
    public static RegionGrid suggest(Extent extent) {
        return new RegionGrid(
                suggestRegionLength(extent.width(), MIN_REGION_LENGTH, MAX_REGION_LENGTH),
                suggestRegionLength(extent.height(), MIN_REGION_LENGTH, MAX_REGION_LENGTH));
    }

    /**
     * Picks a region size for a reordered {@code extent}: the width is
     * {@link #alignedRegionLength(Reorder, int, int, int) aligned} on the reorder's pivots, the
     * height is suggested as for an unordered map.
     *
     * @param reorder the reorder of the map, or {@code null}
     */
    public static RegionGrid suggest(Extent extent, Reorder reorder) {
        if (reorder == null || extent.width() == 0) {
            return suggest(extent);
        }
        return new RegionGrid(
                alignedRegionLength(reorder, extent.width(), MIN_REGION_LENGTH, MAX_REGION_LENGTH),
                suggestRegionLength(extent.height(), MIN_REGION_LENGTH, MAX_REGION_LENGTH));
    }

    /**
     * Picks a region edge for an axis of {@code length} cells.
     * <p>
     * Candidates are the divisors of {@code length} between {@code max(min, length / 128)} and
     * {@code min(max, length / MIN_DIVISIONS)}, so the axis splits evenly into a reasonable number
     * of regions. The divisor with the most divisors of its own wins, which keeps the edge
     * friendly to later subdivision. When no divisor qualifies the edge is clamped to
     * {@code [min, max]} and edge regions are partial.
     *
     * @param length axis length in cells
     * @param min smallest acceptable edge
     * @param max largest acceptable edge
     * @return the chosen edge, at least 1
     */
    public static int suggestRegionLength(int length, int min, int max) {
        if (min <= 0 || max < min) {
            throw new IllegalArgumentException("Invalid region length limits [" + min + ", " + max + "]");
        }
        if (length <= min) {
            return Math.max(1, length == 0 ? min : length);
        }
        int lo = Math.max(min, length / 128);
        int hi = Math.min(max, Math.max(lo, length / MIN_DIVISIONS));
        List<Integer> candidates = Permutations.divisions(length, lo, hi);
        if (!candidates.isEmpty()) {
            return candidates.get(0);
        }
        return Math.min(max, Math.max(min, length / MIN_DIVISIONS));
    }

    /**
     * Picks a region width whose boundaries fall on the stride discontinuities of a reorder over
     * a {@code width}-column grid, so a run of consecutive logical cells tends to stay inside one
     * region.
     *
     * @param reorder the reorder of the map
     * @param width number of columns of the map
     * @param min smallest acceptable edge
     * @param max largest acceptable edge
     * @return a divisor of the common period of the reorder's pivots and {@code width} when one
     *     lies in {@code [min, max]}, otherwise {@link #suggestRegionLength(int, int, int)}
     */
    public static int alignedRegionLength(Reorder reorder, int width, int min, int max) {
        long period = width;
        for (long pivot : Permutations.pivots(reorder)) {
            period = Permutations.gcd(period, pivot);
        }
        if (period > 0 && period <= Integer.MAX_VALUE) {
            List<Integer> candidates = Permutations.divisions((int) period, min, max);
            if (!candidates.isEmpty()) {
                return candidates.get(0);
            }
        }
        return suggestRegionLength(width, min, max);
    }

    @Override
    public String toString() {
        return "RegionGrid[" + regionWidth + "x" + regionHeight + "]";
    }
}
