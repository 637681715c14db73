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
package io.tileverse.datamap.access;

import io.tileverse.datamap.PersistenceException;
import io.tileverse.datamap.region.BufferLayout;
import io.tileverse.datamap.region.RegionBuffer;
import io.tileverse.datamap.region.RegionKey;
import java.io.IOException;
import java.util.Optional;

/**
 * Backing store of region content.
 * <p>
 * An {@link AccessManager} calls {@link #read} when a region becomes resident and
 * {@link #write} when a dirty region is flushed. Implementations must tolerate concurrent calls
 * for different keys; the manager never issues concurrent writes for the same key from a single
 * eviction, but a flush and an eviction may race, so writes of a key must replace the stored
 * content atomically.
 */
public interface AccessFormat {

    /**
     * @param key the region to read
     * @param layout the layout the region content must have
     * @return the stored content, or empty if nothing was ever stored for {@code key}
     * @throws IOException if the store cannot be read
     * @throws io.tileverse.datamap.FormatMismatchException if the stored content has another
     *     layout
     */
    Optional<RegionBuffer> read(RegionKey key, BufferLayout layout) throws IOException;

    /**
     * Replaces the stored content of {@code key}.
     *
     * @throws PersistenceException if the content could not be stored
     */
    void write(RegionKey key, RegionBuffer buffer) throws PersistenceException;

    /**
     * @return whether content is stored for {@code key}
     * @throws IOException if the store cannot be queried
     */
    boolean exists(RegionKey key) throws IOException;

    /**
     * @return a human readable identifier of the resource holding {@code key}, a file name for
     *     file based stores
     */
    default String resourceId(RegionKey key) {
        return key.column() + "_" + key.row();
    }

    /**
     * Verifies this store can hold buffers of the given layout. Called once when an access
     * manager is built.
     *
     * @throws io.tileverse.datamap.FormatMismatchException if it can't
     */
    default void checkLayout(BufferLayout layout) {
        // any layout
    }
}
