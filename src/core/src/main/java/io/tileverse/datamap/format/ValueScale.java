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

import io.tileverse.datamap.ValueOutOfRangeException;

/**
 * Linear mapping of real numbers in {@code [min, max]} onto the encodable range
 * {@code [minValue(), maxValue()]} of a {@link ColorValueFormat}.
 *
 * @param min smallest real value
 * @param max largest real value
 */
public record ValueScale(double min, double max) {

    public ValueScale {
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            throw new IllegalArgumentException("Scale bounds must be finite: [" + min + ", " + max + "]");
        }
        if (min >= max) {
            throw new IllegalArgumentException("Scale min must be lower than max: [" + min + ", " + max + "]");
        }
    }

    /**
     * @param value a real value within the scale
     * @param format the target format
     * @return the closest raw value of {@code format}
     * @throws ValueOutOfRangeException if {@code value} lies outside {@code [min, max]}
     */
    public long toRaw(double value, ColorValueFormat format) {
        if (!(value >= min && value <= max)) {
            throw new ValueOutOfRangeException((long) value, "Value " + value + " is outside " + this);
        }
        long lo = format.minValue();
        long hi = format.maxValue();
        long offset = Math.round((value - min) * (hi - lo) / (max - min));
        return offset >= hi - lo ? hi : lo + offset;
    }

    /**
     * @param raw a raw value of {@code format}
     * @param format the format {@code raw} belongs to
     * @return the real value {@code raw} stands for
     */
    public double fromRaw(long raw, ColorValueFormat format) {
        long lo = format.minValue();
        long hi = format.maxValue();
        if (hi == lo) {
            return min;
        }
        return min + (raw - lo) * (max - min) / (hi - lo);
    }

    @Override
    public String toString() {
        return "ValueScale[" + min + ", " + max + "]";
    }
}
