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

/**
 * The declared size of a value map. A coordinate is valid when
 * {@code 0 <= x < width && 0 <= y < height}.
 *
 * @param width number of columns
 * @param height number of rows
 */
public record Extent(int width, int height) {

    public Extent {
        if (width < 0) {
            throw new IllegalArgumentException("width can't be < 0: " + width);
        }
        if (height < 0) {
            throw new IllegalArgumentException("height can't be < 0: " + height);
        }
    }

    public static Extent of(int width, int height) {
        return new Extent(width, height);
    }

    /**
     * @return the number of addressable cells
     */
    public long area() {
        return (long) width * height;
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    /**
     * @return {@code true} if this extent is at least as large as {@code other} in both dimensions
     */
    public boolean encloses(Extent other) {
        return width >= other.width && height >= other.height;
    }

    /**
     * @return the smallest extent enclosing both this one and {@code other}
     */
    public Extent union(Extent other) {
        return new Extent(Math.max(width, other.width), Math.max(height, other.height));
    }

    public Bounds toBounds() {
        return new Bounds(0, 0, width, height);
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
