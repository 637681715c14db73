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

/**
 * Counts of the cells holding a value in a map.
 *
 * @param populated cells holding a value
 * @param total cells of the extent
 */
public record CoverageStats(long populated, long total) {

    public CoverageStats {
        if (total < 0 || populated < 0 || populated > total) {
            throw new IllegalArgumentException("Invalid coverage " + populated + "/" + total);
        }
    }

    /**
     * @return the populated fraction in {@code [0, 1]}, 0 for an empty extent
     */
    public double ratio() {
        return total == 0 ? 0.0 : (double) populated / total;
    }

    @Override
    public String toString() {
        return String.format("CoverageStats[%d/%d, %.2f%%]", populated, total, ratio() * 100);
    }
}
