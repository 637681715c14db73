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
import io.tileverse.datamap.ValueMap;
import java.util.Objects;

/**
 * A value map placed at an offset of a {@link StitchedValueMap}.
 *
 * @param map the source map
 * @param x column of the stitched map where the source's column 0 lands
 * @param y row of the stitched map where the source's row 0 lands
 */
public record Placement(ValueMap map, int x, int y) {

    public Placement {
        Objects.requireNonNull(map, "map cannot be null");
        if (x < 0 || y < 0) {
            throw new IllegalArgumentException("Placement offset can't be negative: (" + x + ", " + y + ")");
        }
    }

    public static Placement of(ValueMap map, int x, int y) {
        return new Placement(map, x, y);
    }

    /**
     * @return the cells of the stitched map covered by the source
     */
    public Bounds bounds() {
        return new Bounds(x, y, map.extent().width(), map.extent().height());
    }
}
