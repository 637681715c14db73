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
package io.tileverse.datamap.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.tileverse.datamap.ValueOutOfRangeException;
import org.junit.jupiter.api.Test;

class ValueScaleTest {

    private final Monochrome gray = Monochrome.gray();

    @Test
    void testScaleBoundsMapToFormatBounds() {
        ValueScale scale = new ValueScale(-10, 10);

        assertEquals(1, scale.toRaw(-10, gray));
        assertEquals(255, scale.toRaw(10, gray));
        assertEquals(-10.0, scale.fromRaw(1, gray));
        assertEquals(10.0, scale.fromRaw(255, gray));
    }

    @Test
    void testRoundTripIsWithinOneStep() {
        ValueScale scale = new ValueScale(0, 1);
        double step = 1.0 / (gray.maxValue() - gray.minValue());

        for (double v = 0; v <= 1.0; v += 0.037) {
            double back = scale.fromRaw(scale.toRaw(v, gray), gray);
            assertEquals(v, back, step);
        }
    }

    @Test
    void testValuesOutsideScaleAreRejected() {
        ValueScale scale = new ValueScale(0, 100);

        assertThrows(ValueOutOfRangeException.class, () -> scale.toRaw(100.5, gray));
        assertThrows(ValueOutOfRangeException.class, () -> scale.toRaw(-0.1, gray));
        assertThrows(ValueOutOfRangeException.class, () -> scale.toRaw(Double.NaN, gray));
    }

    @Test
    void testInvalidScales() {
        assertThrows(IllegalArgumentException.class, () -> new ValueScale(1, 1));
        assertThrows(IllegalArgumentException.class, () -> new ValueScale(2, 1));
        assertThrows(IllegalArgumentException.class, () -> new ValueScale(0, Double.POSITIVE_INFINITY));
    }
}
