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

import io.tileverse.datamap.format.ColorValueFormat;
import java.io.Closeable;
import java.io.IOException;
import java.util.OptionalLong;
import java.util.stream.Stream;

/**
 * A two dimensional map of values addressed by {@link Coordinate}, each cell holding either a
 * value of the map's {@link #format() format} or nothing.
 * <p>
 * Every coordinate within the {@link #extent()} is addressable; any other coordinate fails with
 * an {@link OutOfBoundsException}. Methods touching the backing store declare
 * {@link IOException}.
 */
public interface ValueMap extends Closeable {

    /**
     * @return the addressable extent of the map
     */
    Extent extent();

    /**
     * @return the format values are encoded with
     */
    ColorValueFormat format();

    /**
     * @return the value at {@code (x, y)}, empty if the cell holds none
     * @throws OutOfBoundsException if the coordinate is outside the extent
     */
    OptionalLong get(int x, int y) throws IOException;

    /**
     * Stores a value.
     *
     * @throws OutOfBoundsException if the coordinate is outside the extent
     * @throws ValueOutOfRangeException if the format can't encode {@code value}
     */
    void set(int x, int y, long value) throws IOException;

    /**
     * Removes the value at {@code (x, y)}, if any.
     *
     * @throws OutOfBoundsException if the coordinate is outside the extent
     */
    void clear(int x, int y) throws IOException;

    /**
     * @return whether the cell at {@code (x, y)} holds a value
     */
    default boolean has(int x, int y) throws IOException {
        return get(x, y).isPresent();
    }

    default boolean has(Coordinate c) throws IOException {
        return has(c.x(), c.y());
    }

    default OptionalLong get(Coordinate c) throws IOException {
        return get(c.x(), c.y());
    }

    default void set(Coordinate c, long value) throws IOException {
        set(c.x(), c.y(), value);
    }

    default void clear(Coordinate c) throws IOException {
        clear(c.x(), c.y());
    }

    /**
     * @return every coordinate of the extent once, in the given order
     */
    default Stream<Coordinate> coordinates(AccessOrder order) {
        return order.coordinates(extent(), null);
    }

    /**
     * Persists every pending change to the backing store.
     */
    void flush() throws IOException;

    /**
     * Flushes pending changes and releases the resources of the map.
     */
    @Override
    void close() throws IOException;
}
