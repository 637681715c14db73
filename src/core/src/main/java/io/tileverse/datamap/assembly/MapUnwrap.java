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
import io.tileverse.datamap.RegionValueMap;
import io.tileverse.datamap.access.AccessManager;
import io.tileverse.datamap.region.RegionBuffer;
import io.tileverse.datamap.region.RegionKey;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Exposes the regions of a map as {@link RegionSnapshot}s, for export or for rebuilding the map
 * elsewhere with {@link MapUnsplit}.
 */
public final class MapUnwrap {

    private MapUnwrap() {
        // utility class
    }

    /**
     * Returns a lazy view of the regions of {@code map} that are resident or present in its
     * backing store, in row-major key order. Regions that were never written are skipped.
     * <p>
     * Each call to {@link Iterable#iterator()} starts over. A snapshot is copied when the
     * iterator reaches it, without keeping the region resident. Store failures surface as
     * {@link UncheckedIOException}.
     */
    public static Iterable<RegionSnapshot> unwrap(RegionValueMap map) {
        Objects.requireNonNull(map, "map cannot be null");
        return () -> new SnapshotIterator(map);
    }

    private static final class SnapshotIterator implements Iterator<RegionSnapshot> {
        private final RegionValueMap map;
        private final AccessManager manager;
        private final Iterator<RegionKey> keys;
        private RegionSnapshot next;

        SnapshotIterator(RegionValueMap map) {
            this.map = map;
            this.manager = map.accessManager();
            List<RegionKey> all = map.regionKeys();
            this.keys = all.iterator();
        }

        @Override
        public boolean hasNext() {
            while (next == null && keys.hasNext()) {
                next = snapshot(keys.next()).orElse(null);
            }
            return next != null;
        }

        @Override
        public RegionSnapshot next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            RegionSnapshot current = next;
            next = null;
            return current;
        }

        private Optional<RegionSnapshot> snapshot(RegionKey key) {
            try {
                Optional<RegionBuffer> buffer = manager.snapshot(key);
                if (buffer.isEmpty()) {
                    return Optional.empty();
                }
                Bounds bounds = map.grid().boundsOf(key);
                Bounds populated = bounds.intersection(map.extent().toBounds());
                return Optional.of(new RegionSnapshot(key, bounds, populated, buffer.get()));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to snapshot region " + key, e);
            }
        }
    }
}
