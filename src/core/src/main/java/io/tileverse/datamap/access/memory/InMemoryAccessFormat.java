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
package io.tileverse.datamap.access.memory;

import io.tileverse.datamap.FormatMismatchException;
import io.tileverse.datamap.PersistenceException;
import io.tileverse.datamap.access.AccessFormat;
import io.tileverse.datamap.region.BufferLayout;
import io.tileverse.datamap.region.RegionBuffer;
import io.tileverse.datamap.region.RegionKey;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An {@link AccessFormat} keeping region content on the heap.
 * <p>
 * Buffers are copied on the way in and on the way out, so the stored content is never shared
 * with a resident region. Useful for tests and for maps whose total size fits in memory but
 * that still benefit from region level locking.
 */
public class InMemoryAccessFormat implements AccessFormat {

    private final String name;
    private final Map<RegionKey, RegionBuffer> store = new ConcurrentHashMap<>();
    private final AtomicLong readCount = new AtomicLong();
    private final AtomicLong writeCount = new AtomicLong();

    public InMemoryAccessFormat() {
        this("memory");
    }

    /**
     * @param name identifies this store in log messages and resource ids
     */
    public InMemoryAccessFormat(String name) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
    }

    public String name() {
        return name;
    }

    @Override
    public Optional<RegionBuffer> read(RegionKey key, BufferLayout layout) {
        readCount.incrementAndGet();
        RegionBuffer stored = store.get(key);
        if (stored == null) {
            return Optional.empty();
        }
        if (!stored.layout().equals(layout)) {
            throw new FormatMismatchException("Stored region " + key + " has another layout", layout, stored.layout());
        }
        return Optional.of(stored.copy());
    }

    @Override
    public void write(RegionKey key, RegionBuffer buffer) throws PersistenceException {
        Objects.requireNonNull(buffer, "buffer cannot be null");
        writeCount.incrementAndGet();
        store.put(key, buffer.copy());
    }

    @Override
    public boolean exists(RegionKey key) {
        return store.containsKey(key);
    }

    @Override
    public String resourceId(RegionKey key) {
        return name + ":" + key.column() + "_" + key.row();
    }

    /**
     * @return the keys with stored content, in row-major order
     */
    public Set<RegionKey> keys() {
        return new TreeSet<>(store.keySet());
    }

    /**
     * Removes the stored content of a region.
     *
     * @return whether content was stored
     */
    public boolean remove(RegionKey key) {
        return store.remove(key) != null;
    }

    /**
     * @return the number of {@link #read} calls so far
     */
    public long readCount() {
        return readCount.get();
    }

    /**
     * @return the number of {@link #write} calls so far
     */
    public long writeCount() {
        return writeCount.get();
    }

    @Override
    public String toString() {
        return "InMemoryAccessFormat[" + name + ", " + store.size() + " regions]";
    }
}
