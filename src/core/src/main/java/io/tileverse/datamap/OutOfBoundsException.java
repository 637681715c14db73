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

/**
 * Thrown when a coordinate falls outside the extent of a map, or outside the area covered by
 * the maps of a stitched map when writing.
 */
public class OutOfBoundsException extends DataMapException {

    private static final long serialVersionUID = 1L;

    private final int x;
    private final int y;

    /**
     * @param x the offending column
     * @param y the offending row
     * @param extent the extent the coordinate was checked against
     */
    public OutOfBoundsException(int x, int y, Extent extent) {
        this(x, y, "Coordinate (%d, %d) is outside of %s".formatted(x, y, extent));
    }

    /**
     * @param x the offending column
     * @param y the offending row
     * @param message the detail message
     */
    public OutOfBoundsException(int x, int y, String message) {
        super(message);
        this.x = x;
        this.y = y;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }
}
