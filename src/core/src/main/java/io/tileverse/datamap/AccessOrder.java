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

import io.tileverse.datamap.region.RegionGrid;
import java.util.stream.IntStream;
import java.util.stream.LongStream;
import java.util.stream.Stream;

/**
 * Orders in which the coordinates of a map can be visited.
 */
public enum AccessOrder {

    /** Rows top to bottom, each row left to right. */
    ROW_MAJOR {
        @Override
        public Stream<Coordinate> coordinates(Extent extent, RegionGrid grid) {
            int w = extent.width();
            return LongStream.range(0, extent.area())
                    .mapToObj(i -> new Coordinate((int) (i % w), (int) (i / w)));
        }
    },

    /** Columns left to right, each column top to bottom. */
    COLUMN_MAJOR {
        @Override
        public Stream<Coordinate> coordinates(Extent extent, RegionGrid grid) {
            int h = extent.height();
            return LongStream.range(0, extent.area())
                    .mapToObj(i -> new Coordinate((int) (i / h), (int) (i % h)));
        }
    },

    /**
     * Regions in row-major order, the cells of each region in row-major order. Visiting a map in
     * this order touches each region once.
     */
    REGION_MAJOR {
        @Override
        public Stream<Coordinate> coordinates(Extent extent, RegionGrid grid) {
            if (grid == null) {
                return ROW_MAJOR.coordinates(extent, null);
            }
            Bounds all = extent.toBounds();
            return grid.keys(extent).stream()
                    .map(key -> grid.boundsOf(key).intersection(all))
                    .flatMap(AccessOrder::cells);
        }
    };

    /**
     * @param extent the extent to visit
     * @param grid the region grid of the map, only used by {@link #REGION_MAJOR}, which falls back
     *     to {@link #ROW_MAJOR} without one
     * @return every coordinate of {@code extent} once, in this order
     */
    public abstract Stream<Coordinate> coordinates(Extent extent, RegionGrid grid);

    /**
     * @return the cells of {@code bounds} in row-major order
     */
    static Stream<Coordinate> cells(Bounds bounds) {
        return IntStream.range(bounds.y(), bounds.maxY())
                .boxed()
                .flatMap(y -> IntStream.range(bounds.x(), bounds.maxX()).mapToObj(x -> new Coordinate(x, y)));
    }
}
