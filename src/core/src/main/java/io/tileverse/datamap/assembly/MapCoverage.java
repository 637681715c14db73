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
import io.tileverse.datamap.RegionValueMap;
import io.tileverse.datamap.ValueMap;
import io.tileverse.datamap.access.AccessManager;
import io.tileverse.datamap.format.ColorValueFormat;
import io.tileverse.datamap.region.RegionBuffer;
import io.tileverse.datamap.region.RegionKey;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Measures how much of a map holds values.
 */
public final class MapCoverage {

    private static final Logger logger = LoggerFactory.getLogger(MapCoverage.class);

    private MapCoverage() {
        // utility class
    }

    /**
     * @return the fraction of the extent holding a value, in {@code [0, 1]}
     */
    public static double coverage(ValueMap map) throws IOException {
        return coverageStats(map).ratio();
    }

    /**
     * Counts the cells of the extent holding a value.
     * <p>
     * Region maps are counted region by region: resident regions in place, others read straight
     * from the store without becoming resident, and regions never written count as empty.
     * Stitched maps add up their sources. Any other map is scanned cell by cell.
     */
    public static CoverageStats coverageStats(ValueMap map) throws IOException {
        Objects.requireNonNull(map, "map cannot be null");
        CoverageStats stats;
        if (map instanceof RegionValueMap regionMap) {
            stats = ofRegions(regionMap);
        } else if (map instanceof StitchedValueMap stitched) {
            stats = ofPlacements(stitched);
        } else {
            stats = ofCells(map);
        }
        logger.debug("Coverage of {}: {}", map, stats);
        return stats;
    }

    private static CoverageStats ofRegions(RegionValueMap map) throws IOException {
        AccessManager manager = map.accessManager();
        ColorValueFormat format = map.format();
        Bounds extent = map.extent().toBounds();
        long populated = 0;
        for (RegionKey key : map.regionKeys()) {
            Bounds footprint = map.grid().boundsOf(key);
            Bounds inside = footprint.intersection(extent);
            if (inside.isEmpty()) {
                continue;
            }
            Optional<Long> count = manager.peek(key, buffer -> countPopulated(buffer, footprint, inside, format));
            populated += count.orElse(0L);
        }
        return new CoverageStats(populated, extent.area());
    }

    private static long countPopulated(RegionBuffer buffer, Bounds footprint, Bounds inside, ColorValueFormat format) {
        long count = 0;
        for (int y = inside.y(); y < inside.maxY(); y++) {
            for (int x = inside.x(); x < inside.maxX(); x++) {
                if (!format.isEmptyMarker(buffer.get(x - footprint.x(), y - footprint.y()))) {
                    count++;
                }
            }
        }
        return count;
    }

    private static CoverageStats ofPlacements(StitchedValueMap map) throws IOException {
        long populated = 0;
        for (Placement p : map.placements()) {
            populated += coverageStats(p.map()).populated();
        }
        return new CoverageStats(populated, map.extent().area());
    }

    private static CoverageStats ofCells(ValueMap map) throws IOException {
        long populated = 0;
        int w = map.extent().width();
        int h = map.extent().height();
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (map.has(x, y)) {
                    populated++;
                }
            }
        }
        return new CoverageStats(populated, map.extent().area());
    }
}
