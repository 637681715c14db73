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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.tileverse.datamap.Bounds;
import io.tileverse.datamap.Extent;
import io.tileverse.datamap.reorder.ReversibleReorder;
import org.junit.jupiter.api.Test;

class RegionGridTest {

    @Test
    void testKeyAndBounds() {
        RegionGrid grid = RegionGrid.of(2, 2);

        assertEquals(RegionKey.of(0, 0), grid.keyOf(1, 1));
        assertEquals(RegionKey.of(1, 0), grid.keyOf(2, 1));
        assertEquals(RegionKey.of(2, 3), grid.keyOf(5, 7));
        assertEquals(new Bounds(4, 6, 2, 2), grid.boundsOf(RegionKey.of(2, 3)));
    }

    @Test
    void testKeysCoverPartialEdgeRegions() {
        RegionGrid grid = RegionGrid.of(4, 4);
        Extent extent = Extent.of(10, 5);

        assertEquals(3, grid.columns(extent));
        assertEquals(2, grid.rows(extent));
        assertThat(grid.keys(extent))
                .containsExactly(
                        RegionKey.of(0, 0),
                        RegionKey.of(1, 0),
                        RegionKey.of(2, 0),
                        RegionKey.of(0, 1),
                        RegionKey.of(1, 1),
                        RegionKey.of(2, 1));
        assertThat(grid.keys(Extent.of(0, 0))).isEmpty();
    }

    @Test
    void testKeyCountOverflowIsRejected() {
        RegionGrid grid = RegionGrid.of(1, 1);

        assertEquals(100_000, grid.columns(Extent.of(100_000, 100_000)));
        assertThrows(IllegalArgumentException.class, () -> grid.keys(Extent.of(100_000, 100_000)));
    }

    @Test
    void testAlignment() {
        RegionGrid grid = RegionGrid.of(4, 4);

        assertTrue(grid.isAligned(new Bounds(8, 4, 3, 3)));
        assertThat(grid.isAligned(new Bounds(2, 4, 3, 3))).isFalse();
    }

    @Test
    void testSuggestPrefersDivisorsWithMostSubdivisions() {
        // divisors of 4096 between 32 and 512, 512 having the most divisors
        assertEquals(512, RegionGrid.suggestRegionLength(4096, 32, 1024));
        // no divisor of 100 in [32, 32], clamped
        assertEquals(32, RegionGrid.suggestRegionLength(100, 32, 1024));
        assertEquals(RegionGrid.of(512, 32), RegionGrid.suggest(Extent.of(4096, 100)));
    }

    @Test
    void testSuggestSmallAxes() {
        assertEquals(20, RegionGrid.suggestRegionLength(20, 32, 1024));
        assertEquals(32, RegionGrid.suggestRegionLength(0, 32, 1024));
        assertThrows(IllegalArgumentException.class, () -> RegionGrid.suggestRegionLength(100, 0, 10));
    }

    @Test
    void testAlignedRegionLengthFollowsPivots() {
        // forward sequence 0 2 4 1 3 5 changes stride at index 3
        ReversibleReorder reorder = ReversibleReorder.of(0, 2, 4, 1, 3, 5);

        assertEquals(3, RegionGrid.alignedRegionLength(reorder, 6, 2, 6));
        assertEquals(RegionGrid.suggest(Extent.of(6, 1)), RegionGrid.suggest(Extent.of(6, 1), null));
    }

    @Test
    void testInvalidGrid() {
        assertThrows(IllegalArgumentException.class, () -> RegionGrid.of(0, 2));
        assertThrows(IllegalArgumentException.class, () -> RegionKey.of(-1, 0));
    }
}
