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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.tileverse.datamap.Bounds;
import io.tileverse.datamap.Extent;
import io.tileverse.datamap.FormatMismatchException;
import io.tileverse.datamap.OutOfBoundsException;
import io.tileverse.datamap.OverlapDetectedException;
import io.tileverse.datamap.RegionValueMap;
import io.tileverse.datamap.access.memory.InMemoryAccessFormat;
import io.tileverse.datamap.format.ColorValueFormat;
import io.tileverse.datamap.format.Monochrome;
import io.tileverse.datamap.format.Polychrome;
import java.io.IOException;
import java.util.List;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class MapStitchTest {

    private static RegionValueMap map(int width, int height, ColorValueFormat format) {
        return RegionValueMap.builder()
                .extent(width, height)
                .regionSize(2, 2)
                .format(format)
                .accessFormat(new InMemoryAccessFormat())
                .build();
    }

    @Test
    void testStitchDelegatesToSources() throws IOException {
        RegionValueMap left = map(4, 4, Monochrome.gray());
        RegionValueMap right = map(4, 4, Monochrome.gray());
        right.set(1, 2, 42);

        try (StitchedValueMap stitched = MapStitch.stitch(Placement.of(left, 0, 0), Placement.of(right, 4, 0))) {
            assertEquals(Extent.of(8, 4), stitched.extent());
            assertEquals(Monochrome.gray(), stitched.format());
            assertEquals(OptionalLong.of(42), stitched.get(5, 2));
            assertThat(stitched.locate(5, 2)).map(Placement::map).contains(right);

            stitched.set(3, 3, 9);
            assertEquals(OptionalLong.of(9), left.get(3, 3));
            stitched.clear(5, 2);
            assertThat(right.get(1, 2)).isEmpty();
        }
    }

    @Test
    void testUncoveredCells() throws IOException {
        RegionValueMap a = map(2, 2, Monochrome.gray());
        RegionValueMap b = map(2, 2, Monochrome.gray());

        try (StitchedValueMap stitched = MapStitch.stitch(List.of(Placement.of(a, 0, 0), Placement.of(b, 2, 2)))) {
            assertEquals(Extent.of(4, 4), stitched.extent());
            assertThat(stitched.get(3, 0)).isEmpty();
            assertThat(stitched.locate(3, 0)).isEmpty();
            stitched.clear(3, 0);
            assertThrows(OutOfBoundsException.class, () -> stitched.set(3, 0, 1));
            assertThrows(OutOfBoundsException.class, () -> stitched.get(4, 0));
        }
    }

    @Test
    void testOverlapDetected() {
        Placement first = Placement.of(map(4, 4, Monochrome.gray()), 0, 0);
        Placement second = Placement.of(map(4, 4, Monochrome.gray()), 2, 0);

        OverlapDetectedException e =
                assertThrows(OverlapDetectedException.class, () -> MapStitch.stitch(first, second));
        assertEquals(new Bounds(0, 0, 4, 4), e.getFirst());
        assertEquals(new Bounds(2, 0, 4, 4), e.getSecond());
    }

    @Test
    void testFormatMismatch() {
        Placement gray = Placement.of(map(2, 2, Monochrome.gray()), 0, 0);
        Placement rgb = Placement.of(map(2, 2, Polychrome.rgb()), 2, 0);

        assertThrows(FormatMismatchException.class, () -> MapStitch.stitch(gray, rgb));
    }

    @Test
    void testInvalidPlacements() {
        assertThrows(IllegalArgumentException.class, () -> MapStitch.stitch(List.of()));
        assertThrows(NullPointerException.class, () -> MapStitch.stitch((List<Placement>) null));
        assertThrows(IllegalArgumentException.class, () -> Placement.of(map(2, 2, Monochrome.gray()), -1, 0));
    }
}
