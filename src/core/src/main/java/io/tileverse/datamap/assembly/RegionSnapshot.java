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
import io.tileverse.datamap.region.RegionBuffer;
import io.tileverse.datamap.region.RegionKey;
import java.util.Objects;

/**
 * A copy of the content of one region, as produced by {@link MapUnwrap} and consumed by
 * {@link MapUnsplit}.
 *
 * @param key the region key
 * @param bounds the full footprint of the region, in physical coordinates
 * @param populatedBounds the part of the footprint within the map extent
 * @param buffer the region content
 */
public record RegionSnapshot(RegionKey key, Bounds bounds, Bounds populatedBounds, RegionBuffer buffer) {

    public RegionSnapshot {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(bounds, "bounds cannot be null");
        Objects.requireNonNull(populatedBounds, "populatedBounds cannot be null");
        Objects.requireNonNull(buffer, "buffer cannot be null");
        if (bounds.width() != buffer.width() || bounds.height() != buffer.height()) {
            throw new IllegalArgumentException("Buffer " + buffer.layout() + " does not match bounds " + bounds);
        }
    }
}
