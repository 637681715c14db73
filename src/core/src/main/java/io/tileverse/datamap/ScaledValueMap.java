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

import io.tileverse.datamap.format.ValueScale;
import java.io.IOException;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * A view of a {@link ValueMap} holding real numbers, mapped linearly onto the raw value range of
 * the map's format by a {@link ValueScale}. Precision is limited by the format's range.
 */
public class ScaledValueMap {

    private final ValueMap map;
    private final ValueScale scale;

    public ScaledValueMap(ValueMap map, ValueScale scale) {
        this.map = Objects.requireNonNull(map, "map cannot be null");
        this.scale = Objects.requireNonNull(scale, "scale cannot be null");
    }

    public ValueMap map() {
        return map;
    }

    public ValueScale scale() {
        return scale;
    }

    public Extent extent() {
        return map.extent();
    }

    public OptionalDouble get(int x, int y) throws IOException {
        OptionalLong raw = map.get(x, y);
        return raw.isPresent() ? OptionalDouble.of(scale.fromRaw(raw.getAsLong(), map.format())) : OptionalDouble.empty();
    }

    /**
     * @throws ValueOutOfRangeException if {@code value} is outside the scale
     */
    public void set(int x, int y, double value) throws IOException {
        map.set(x, y, scale.toRaw(value, map.format()));
    }

    public void clear(int x, int y) throws IOException {
        map.clear(x, y);
    }

    @Override
    public String toString() {
        return "ScaledValueMap[" + scale + ", " + map + "]";
    }
}
