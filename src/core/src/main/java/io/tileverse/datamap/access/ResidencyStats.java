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

/**
 * Snapshot of the residency counters of an {@link AccessManager}.
 *
 * @param hitCount acquisitions served by an already resident or loading region
 * @param missCount acquisitions that started a load
 * @param loadCount completed loads
 * @param loadFailureCount failed loads
 * @param evictionCount regions evicted
 * @param flushCount region writes to the backing store
 * @param residentRegions regions currently resident
 * @param residentBytes bytes held by resident region buffers
 * @param hitRate {@code hitCount / (hitCount + missCount)}, between 0.0 and 1.0
 */
public record ResidencyStats(
        long hitCount,
        long missCount,
        long loadCount,
        long loadFailureCount,
        long evictionCount,
        long flushCount,
        long residentRegions,
        long residentBytes,
        double hitRate) {

    static ResidencyStats fromCaffeine(
            com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats,
            long evictionCount,
            long flushCount,
            long residentRegions,
            long residentBytes) {
        return new ResidencyStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.loadSuccessCount(),
                caffeineStats.loadFailureCount(),
                evictionCount,
                flushCount,
                residentRegions,
                residentBytes,
                caffeineStats.hitRate());
    }

    public long requestCount() {
        return hitCount + missCount;
    }

    @Override
    public String toString() {
        return String.format(
                "ResidencyStats{resident=%d, bytes=%d, hitRate=%.2f%%, hits=%d, misses=%d, loads=%d, evictions=%d, flushes=%d}",
                residentRegions,
                residentBytes,
                hitRate * 100.0,
                hitCount,
                missCount,
                loadCount,
                evictionCount,
                flushCount);
    }
}
