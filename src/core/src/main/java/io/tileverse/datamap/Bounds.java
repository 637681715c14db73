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
 * An axis aligned rectangle of cells, {@code [x, x + width) x [y, y + height)}.
 *
 * @param x first column
 * @param y first row
 * @param width number of columns
 * @param height number of rows
 */
public record Bounds(int x, int y, int width, int height) {

    /** A rectangle with no cells. */
    public static final Bounds EMPTY = new Bounds(0, 0, 0, 0);

    public Bounds {
        if (x < 0 || y < 0) {
            throw new IllegalArgumentException("origin can't be negative: (" + x + ", " + y + ")");
        }
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("size can't be negative: " + width + "x" + height);
        }
        if ((long) x + width > Integer.MAX_VALUE || (long) y + height > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("bounds exceed the int coordinate space");
        }
    }

    /** @return the first column past the right edge */
    public int maxX() {
        return x + width;
    }

    /** @return the first row past the bottom edge */
    public int maxY() {
        return y + height;
    }

    public long area() {
        return (long) width * height;
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    public boolean contains(int px, int py) {
        return px >= x && py >= y && px < maxX() && py < maxY();
    }

    public boolean intersects(Bounds other) {
        return !isEmpty()
                && !other.isEmpty()
                && x < other.maxX()
                && other.x < maxX()
                && y < other.maxY()
                && other.y < maxY();
    }

    /**
     * @return the common cells of both rectangles, {@link #EMPTY} if they do not intersect
     */
    public Bounds intersection(Bounds other) {
        if (!intersects(other)) {
            return EMPTY;
        }
        int ix = Math.max(x, other.x);
        int iy = Math.max(y, other.y);
        return new Bounds(ix, iy, Math.min(maxX(), other.maxX()) - ix, Math.min(maxY(), other.maxY()) - iy);
    }

    /**
     * @return the smallest rectangle containing both, ignoring empty operands
     */
    public Bounds union(Bounds other) {
        if (isEmpty()) {
            return other;
        }
        if (other.isEmpty()) {
            return this;
        }
        int ux = Math.min(x, other.x);
        int uy = Math.min(y, other.y);
        return new Bounds(ux, uy, Math.max(maxX(), other.maxX()) - ux, Math.max(maxY(), other.maxY()) - uy);
    }

    @Override
    public String toString() {
        return "[" + x + ", " + maxX() + ")x[" + y + ", " + maxY() + ")";
    }
}
