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
 * A cell address in a value map.
 *
 * @param x the column, starting at zero
 * @param y the row, starting at zero
 */
public record Coordinate(int x, int y) {

    public Coordinate {
        if (x < 0) {
            throw new IllegalArgumentException("x can't be < 0: " + x);
        }
        if (y < 0) {
            throw new IllegalArgumentException("y can't be < 0: " + y);
        }
    }

    /**
     * Factory method to create a new {@link Coordinate}.
     *
     * @param x the column
     * @param y the row
     * @return a new coordinate
     */
    public static Coordinate of(int x, int y) {
        return new Coordinate(x, y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
