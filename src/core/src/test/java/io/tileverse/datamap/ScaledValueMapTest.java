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
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.tileverse.datamap.access.memory.InMemoryAccessFormat;
import io.tileverse.datamap.format.Monochrome;
import io.tileverse.datamap.format.ValueScale;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScaledValueMapTest {

    private RegionValueMap map;
    private ScaledValueMap elevation;

    @BeforeEach
    void setUp() {
        map = RegionValueMap.builder()
                .extent(8, 8)
                .regionSize(4, 4)
                .format(Monochrome.builder().channelWidth(16).build())
                .accessFormat(new InMemoryAccessFormat())
                .build();
        elevation = new ScaledValueMap(map, new ValueScale(-100, 1000));
    }

    @AfterEach
    void tearDown() throws Exception {
        map.close();
    }

    @Test
    void testScaledValues() throws Exception {
        double step = 1100.0 / (map.format().maxValue() - map.format().minValue());

        elevation.set(1, 2, 123.45);
        elevation.set(7, 7, -100);

        assertEquals(123.45, elevation.get(1, 2).getAsDouble(), step);
        assertEquals(-100.0, elevation.get(7, 7).getAsDouble());
        assertEquals(map.format().minValue(), map.get(7, 7).getAsLong());
        assertThat(elevation.get(0, 0)).isEmpty();
        assertEquals(map.extent(), elevation.extent());
    }

    @Test
    void testClear() throws Exception {
        elevation.set(3, 3, 1000);
        assertEquals(map.format().maxValue(), map.get(3, 3).getAsLong());

        elevation.clear(3, 3);
        assertThat(elevation.get(3, 3)).isEmpty();
    }

    @Test
    void testOutOfScale() {
        assertThrows(ValueOutOfRangeException.class, () -> elevation.set(0, 0, 1000.5));
        assertThrows(OutOfBoundsException.class, () -> elevation.set(8, 0, 0));
    }
}
