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

/**
 * Identifies a region by its position in the region grid.
 *
 * @param column region column, {@code x / regionWidth}
 * @param row region row, {@code y / regionHeight}
 */
public record RegionKey(int column, int row) implements Comparable<RegionKey> {

    public RegionKey {
        if (column < 0) {
            throw new IllegalArgumentException("column can't be < 0: " + column);
        }
        if (row < 0) {
            throw new IllegalArgumentException("row can't be < 0: " + row);
        }
    }

    public static RegionKey of(int column, int row) {
        return new RegionKey(column, row);
    }

    /** Row-major order. */
    @Override
    public int compareTo(RegionKey o) {
        int c = Integer.compare(row, o.row);
        return c != 0 ? c : Integer.compare(column, o.column);
    }

    @Override
    public String toString() {
        return "R[" + column + "," + row + "]";
    }
}
