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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.tileverse.datamap.access.file.FileAccessFormat;
import io.tileverse.datamap.access.memory.InMemoryAccessFormat;
import io.tileverse.datamap.format.Monochrome;
import io.tileverse.datamap.format.Polychrome;
import io.tileverse.datamap.region.RegionGrid;
import io.tileverse.datamap.region.RegionKey;
import io.tileverse.datamap.reorder.Reorders;
import io.tileverse.datamap.reorder.ReversibleReorder;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class RegionValueMapTest {

    @TempDir
    Path tempDir;

    private RegionValueMap grayMap(InMemoryAccessFormat store) {
        return RegionValueMap.builder()
                .extent(4, 4)
                .regionSize(2, 2)
                .format(Monochrome.gray())
                .accessFormat(store)
                .build();
    }

    @Test
    void testSetAndGet() throws Exception {
        try (RegionValueMap map = grayMap(new InMemoryAccessFormat())) {
            map.set(0, 0, 7);

            assertEquals(OptionalLong.of(7), map.get(0, 0));
            assertEquals(OptionalLong.empty(), map.get(1, 1));
            assertTrue(map.has(Coordinate.of(0, 0)));
            assertFalse(map.has(1, 1));
        }
    }

    @Test
    void testClear() throws Exception {
        try (RegionValueMap map = grayMap(new InMemoryAccessFormat())) {
            map.set(3, 3, 200);
            map.clear(Coordinate.of(3, 3));

            assertThat(map.get(3, 3)).isEmpty();
        }
    }

    @Test
    void testValuesArePersistedOnClose() throws Exception {
        InMemoryAccessFormat store = new InMemoryAccessFormat();
        try (RegionValueMap map = grayMap(store)) {
            map.set(0, 0, 1);
            map.set(3, 2, 2);
        }
        assertThat(store.keys()).containsExactly(RegionKey.of(0, 0), RegionKey.of(1, 1));

        try (RegionValueMap reopened = grayMap(store)) {
            assertEquals(OptionalLong.of(1), reopened.get(0, 0));
            assertEquals(OptionalLong.of(2), reopened.get(3, 2));
            assertThat(reopened.get(2, 3)).isEmpty();
        }
    }

    @Test
    void testFileBackedMap() throws Exception {
        FileAccessFormat store = FileAccessFormat.builder().directory(tempDir).build();
        try (RegionValueMap map = RegionValueMap.builder()
                .extent(100, 50)
                .regionSize(32, 32)
                .format(Polychrome.rgb())
                .accessFormat(store)
                .maxResidentRegions(1)
                .build()) {
            map.set(5, 5, 0x123456);
            map.set(99, 49, 0xFFFFFF);
            map.set(40, 10, 1);
            map.flush();

            assertTrue(store.exists(RegionKey.of(0, 0)));
            assertTrue(store.exists(RegionKey.of(3, 1)));
            assertEquals(OptionalLong.of(0x123456), map.get(5, 5));
            assertEquals(OptionalLong.of(0xFFFFFF), map.get(99, 49));
            assertEquals(OptionalLong.of(1), map.get(40, 10));
            assertThat(map.accessManager().residentCount()).isLessThanOrEqualTo(1);
        }
    }

    @Test
    void testOutOfBounds() throws Exception {
        try (RegionValueMap map = grayMap(new InMemoryAccessFormat())) {
            OutOfBoundsException e = assertThrows(OutOfBoundsException.class, () -> map.get(4, 0));
            assertEquals(4, e.getX());
            assertEquals(0, e.getY());
            assertThrows(OutOfBoundsException.class, () -> map.set(0, 4, 1));
            assertThrows(OutOfBoundsException.class, () -> map.clear(-1, 0));
        }
    }

    @Test
    void testValueOutOfRange() throws Exception {
        try (RegionValueMap map = grayMap(new InMemoryAccessFormat())) {
            assertThrows(ValueOutOfRangeException.class, () -> map.set(0, 0, 256));
            assertThrows(ValueOutOfRangeException.class, () -> map.set(0, 0, 0));
            assertThat(map.get(0, 0)).isEmpty();
        }
    }

    @Test
    void testReorderedMap() throws Exception {
        InMemoryAccessFormat store = new InMemoryAccessFormat();
        try (RegionValueMap map = RegionValueMap.builder()
                .extent(4, 3)
                .regionSize(2, 2)
                .format(Monochrome.gray())
                .accessFormat(store)
                .reorder(Reorders.columnMajor(4, 3))
                .build()) {
            assertEquals(Coordinate.of(3, 0), map.toPhysical(1, 0));
            assertEquals(Coordinate.of(1, 0), map.toPhysical(0, 1));
            assertEquals(Coordinate.of(0, 1), map.toLogical(1, 0));

            map.set(1, 0, 9);
            assertEquals(OptionalLong.of(9), map.get(1, 0));
            map.flush();
            // physical (3, 0) lives in region (1, 0)
            assertThat(store.keys()).containsExactly(RegionKey.of(1, 0));

            for (int y = 0; y < 3; y++) {
                for (int x = 0; x < 4; x++) {
                    Coordinate p = map.toPhysical(x, y);
                    assertEquals(Coordinate.of(x, y), map.toLogical(p.x(), p.y()));
                }
            }
        }
    }

    @Test
    void testReorderMustCoverExtent() {
        RegionValueMap.Builder builder = RegionValueMap.builder()
                .extent(4, 4)
                .regionSize(2, 2)
                .format(Monochrome.gray())
                .accessFormat(new InMemoryAccessFormat())
                .reorder(Reorders.identity(15));

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void testCoordinates() throws Exception {
        try (RegionValueMap map = grayMap(new InMemoryAccessFormat())) {
            List<Coordinate> rowMajor = map.coordinates(AccessOrder.ROW_MAJOR).toList();
            assertEquals(16, rowMajor.size());
            assertEquals(Coordinate.of(1, 0), rowMajor.get(1));

            List<Coordinate> regionMajor = map.coordinates(AccessOrder.REGION_MAJOR).toList();
            assertThat(regionMajor.subList(0, 4))
                    .containsExactly(Coordinate.of(0, 0), Coordinate.of(1, 0), Coordinate.of(0, 1), Coordinate.of(1, 1));
            assertThat(regionMajor).containsExactlyInAnyOrderElementsOf(rowMajor);
        }
    }

    @Test
    void testRegionMajorCoordinatesOfReorderedMap() throws Exception {
        try (RegionValueMap map = RegionValueMap.builder()
                .extent(4, 3)
                .regionSize(2, 2)
                .format(Monochrome.gray())
                .accessFormat(new InMemoryAccessFormat())
                .reorder(Reorders.columnMajor(4, 3))
                .build()) {
            List<Coordinate> coordinates =
                    map.coordinates(AccessOrder.REGION_MAJOR).toList();

            assertEquals(12, coordinates.size());
            assertEquals(12, coordinates.stream().collect(Collectors.toSet()).size());
            // first region holds physical (0, 0), (1, 0), (0, 1), (1, 1)
            assertThat(coordinates.subList(0, 4))
                    .containsExactly(Coordinate.of(0, 0), Coordinate.of(0, 1), Coordinate.of(1, 1), Coordinate.of(1, 2));
        }
    }

    @ParameterizedTest
    @EnumSource(AccessOrder.class)
    void testCoordinatesVisitEveryCellOnce(AccessOrder order) throws Exception {
        try (RegionValueMap map = RegionValueMap.builder()
                .extent(5, 3)
                .regionSize(2, 2)
                .format(Monochrome.gray())
                .accessFormat(new InMemoryAccessFormat())
                .reorder(Reorders.columnMajor(5, 3))
                .build()) {
            List<Coordinate> coordinates = map.coordinates(order).toList();

            assertEquals(15, coordinates.size());
            assertThat(coordinates).doesNotHaveDuplicates().allMatch(c -> map.extent().contains(c.x(), c.y()));
        }
    }

    @Test
    void testConcurrentAccessUnderResidencyLimit() throws Exception {
        InMemoryAccessFormat store = new InMemoryAccessFormat();
        try (RegionValueMap map = RegionValueMap.builder()
                .extent(16, 16)
                .regionSize(4, 4)
                .format(Monochrome.builder().channelWidth(16).build())
                .accessFormat(store)
                .maxResidentRegions(3)
                .build()) {
            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int t = 0; t < 8; t++) {
                    final int row = t * 2;
                    futures.add(executor.submit(() -> {
                        for (int round = 0; round < 5; round++) {
                            for (int x = 0; x < 16; x++) {
                                map.set(x, row, 1 + x + row * 16);
                                map.get(15 - x, 15 - row);
                            }
                        }
                        return null;
                    }));
                }
                for (Future<?> f : futures) {
                    f.get(30, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            for (int row = 0; row < 16; row += 2) {
                for (int x = 0; x < 16; x++) {
                    assertEquals(OptionalLong.of(1 + x + row * 16), map.get(x, row));
                }
            }
            map.accessManager().evictIdle();
            assertEquals(0, map.accessManager().residentCount());
            assertThat(map.accessManager().region(RegionKey.of(0, 0)))
                    .hasValueSatisfying(r -> assertEquals(0, r.referenceCount()));
        }
    }

    @Test
    void testSuggestedGrid() throws Exception {
        try (RegionValueMap map = RegionValueMap.builder()
                .extent(4096, 100)
                .format(Monochrome.gray())
                .accessFormat(new InMemoryAccessFormat())
                .build()) {
            assertEquals(RegionGrid.suggest(Extent.of(4096, 100)), map.grid());
            assertEquals(map.grid().columns(map.extent()) * map.grid().rows(map.extent()), map.regionKeys().size());
        }
    }

    @Test
    void testSuggestedGridFollowsReorderPivots() throws Exception {
        // evens first, then odds: the stride breaks at index 48
        ReversibleReorder interleave = ReversibleReorder.of(96, i -> i < 48 ? 2 * i : 2 * (i - 48) + 1);
        try (RegionValueMap map = RegionValueMap.builder()
                .extent(96, 1)
                .format(Monochrome.gray())
                .accessFormat(new InMemoryAccessFormat())
                .reorder(interleave)
                .build()) {
            assertEquals(RegionGrid.of(32, 1), RegionGrid.suggest(Extent.of(96, 1)));
            assertEquals(RegionGrid.of(48, 1), map.grid());

            map.set(1, 0, 9);
            assertEquals(OptionalLong.of(9), map.get(1, 0));
            assertEquals(new Coordinate(2, 0), map.toPhysical(1, 0));
        }
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalStateException.class, () -> RegionValueMap.builder()
                .format(Monochrome.gray())
                .accessFormat(new InMemoryAccessFormat())
                .build());
        assertThrows(IllegalStateException.class, () -> RegionValueMap.builder()
                .extent(4, 4)
                .accessFormat(new InMemoryAccessFormat())
                .build());
        assertThrows(IllegalStateException.class, () -> RegionValueMap.builder()
                .extent(4, 4)
                .format(Monochrome.gray())
                .build());
        assertThrows(IllegalArgumentException.class, () -> RegionValueMap.builder().maxResidentRegions(-1));
        assertThrows(NullPointerException.class, () -> RegionValueMap.builder().extent(null));
    }
}
