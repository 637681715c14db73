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

import io.tileverse.datamap.Bounds;
import io.tileverse.datamap.Extent;
import io.tileverse.datamap.OutOfBoundsException;
import io.tileverse.datamap.ValueMap;
import io.tileverse.datamap.format.ColorValueFormat;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A {@link ValueMap} composed of disjoint source maps placed at offsets, created by
 * {@link MapStitch#stitch(List)}.
 * <p>
 * The extent spans from the origin to the far corner of the farthest placement. A coordinate
 * covered by a placement is delegated to its source map, translated by the placement offset.
 * A coordinate covered by none reads as empty and can't be written.
 */
public class StitchedValueMap implements ValueMap {

    private final List<Placement> placements;
    private final ColorValueFormat format;
    private final Extent extent;

    StitchedValueMap(List<Placement> placements, ColorValueFormat format) {
        this.placements = List.copyOf(placements);
        this.format = format;
        Bounds all = Bounds.EMPTY;
        for (Placement p : this.placements) {
            all = all.union(p.bounds());
        }
        this.extent = new Extent(all.maxX(), all.maxY());
    }

    public List<Placement> placements() {
        return placements;
    }

    @Override
    public Extent extent() {
        return extent;
    }

    @Override
    public ColorValueFormat format() {
        return format;
    }

    /**
     * @return the placement covering {@code (x, y)}, if any
     */
    public Optional<Placement> locate(int x, int y) {
        for (Placement p : placements) {
            if (p.bounds().contains(x, y)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    @Override
    public OptionalLong get(int x, int y) throws IOException {
        checkBounds(x, y);
        Optional<Placement> p = locate(x, y);
        if (p.isEmpty()) {
            return OptionalLong.empty();
        }
        return p.get().map().get(x - p.get().x(), y - p.get().y());
    }

    /**
     * @throws OutOfBoundsException if no source map covers the coordinate
     */
    @Override
    public void set(int x, int y, long value) throws IOException {
        Placement p = require(x, y);
        p.map().set(x - p.x(), y - p.y(), value);
    }

    @Override
    public void clear(int x, int y) throws IOException {
        checkBounds(x, y);
        Optional<Placement> p = locate(x, y);
        if (p.isPresent()) {
            p.get().map().clear(x - p.get().x(), y - p.get().y());
        }
    }

    private Placement require(int x, int y) {
        checkBounds(x, y);
        return locate(x, y)
                .orElseThrow(() -> new OutOfBoundsException(
                        x, y, "Coordinate (%d, %d) is not covered by any stitched map".formatted(x, y)));
    }

    private void checkBounds(int x, int y) {
        if (!extent.contains(x, y)) {
            throw new OutOfBoundsException(x, y, extent);
        }
    }

    @Override
    public void flush() throws IOException {
        IOException failure = null;
        for (Placement p : placements) {
            try {
                p.map().flush();
            } catch (IOException e) {
                failure = merge(failure, e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Closes every source map.
     */
    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (Placement p : placements) {
            try {
                p.map().close();
            } catch (IOException e) {
                failure = merge(failure, e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private static IOException merge(IOException first, IOException next) {
        if (first == null) {
            return next;
        }
        first.addSuppressed(next);
        return first;
    }

    @Override
    public String toString() {
        return "StitchedValueMap[" + extent + ", " + placements.size() + " maps]";
    }
}
