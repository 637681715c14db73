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
package io.tileverse.datamap.reorder;

/**
 * Factory methods for common reorders.
 */
public final class Reorders {

    private Reorders() {
        // utility class
    }

    /**
     * @return the reorder mapping every index to itself
     */
    public static ReversibleReorder identity(long size) {
        return new ClosedFormReorder(size, "identity") {
            @Override
            long map(long index) {
                return index;
            }

            @Override
            long unmap(long index) {
                return index;
            }
        };
    }

    /**
     * @return the reorder mapping {@code i} to {@code size - 1 - i}
     */
    public static ReversibleReorder reversed(long size) {
        return new ClosedFormReorder(size, "reversed") {
            @Override
            long map(long index) {
                return size - 1 - index;
            }

            @Override
            long unmap(long index) {
                return size - 1 - index;
            }
        };
    }

    /**
     * Transposition of a {@code width x height} grid stored row-major.
     * <p>
     * The logical cell {@code (x, y)}, at index {@code y * width + x}, is mapped to index
     * {@code x * height + y}: each logical column ends up in a contiguous run of the physical
     * grid, so a column scan stays within few regions.
     *
     * @param width number of columns
     * @param height number of rows
     * @return the transposing reorder over {@code width * height} indices
     */
    public static ReversibleReorder columnMajor(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid size must be positive: " + width + "x" + height);
        }
        final long w = width;
        final long h = height;
        return new ClosedFormReorder(w * h, "columnMajor[" + width + "x" + height + "]") {
            @Override
            long map(long index) {
                return (index % w) * h + index / w;
            }

            @Override
            long unmap(long index) {
                return (index % h) * w + index / h;
            }
        };
    }

    /**
     * Base of reorders whose inverse has a closed form and need no validation pass.
     */
    private abstract static class ClosedFormReorder implements ReversibleReorder {
        private final long size;
        private final String name;

        ClosedFormReorder(long size, String name) {
            if (size < 0) {
                throw new IllegalArgumentException("Size can't be negative: " + size);
            }
            this.size = size;
            this.name = name;
        }

        abstract long map(long index);

        abstract long unmap(long index);

        @Override
        public long size() {
            return size;
        }

        @Override
        public long forward(long index) {
            checkIndex(index);
            return map(index);
        }

        @Override
        public long inverse(long index) {
            checkIndex(index);
            return unmap(index);
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
