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

import io.tileverse.datamap.FormatMismatchException;
import io.tileverse.datamap.OverlapDetectedException;
import io.tileverse.datamap.format.ColorValueFormat;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composes value maps covering disjoint areas into one {@link StitchedValueMap}.
 */
public final class MapStitch {

    private static final Logger logger = LoggerFactory.getLogger(MapStitch.class);

    private MapStitch() {
        // utility class
    }

    /**
     * @param placements the source maps and their offsets
     * @return a map delegating every covered coordinate to its source
     * @throws IllegalArgumentException if no placement is given
     * @throws OverlapDetectedException if two placements cover a common cell
     * @throws FormatMismatchException if the source maps have different formats
     */
    public static StitchedValueMap stitch(List<Placement> placements) {
        Objects.requireNonNull(placements, "placements cannot be null");
        if (placements.isEmpty()) {
            throw new IllegalArgumentException("At least one map is required to stitch");
        }
        ColorValueFormat format = placements.get(0).map().format();
        for (int i = 0; i < placements.size(); i++) {
            Placement a = placements.get(i);
            if (!format.equals(a.map().format())) {
                throw new FormatMismatchException("Cannot stitch maps of different formats", format, a.map().format());
            }
            for (int j = i + 1; j < placements.size(); j++) {
                Placement b = placements.get(j);
                if (a.bounds().intersects(b.bounds())) {
                    throw new OverlapDetectedException(a.bounds(), b.bounds());
                }
            }
        }
        StitchedValueMap stitched = new StitchedValueMap(placements, format);
        logger.debug("Stitched {} maps into {}", placements.size(), stitched.extent());
        return stitched;
    }

    /**
     * @see #stitch(List)
     */
    public static StitchedValueMap stitch(Placement... placements) {
        return stitch(List.of(placements));
    }
}
