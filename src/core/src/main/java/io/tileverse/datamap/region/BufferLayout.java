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
package io.tileverse.datamap.region;

import io.tileverse.datamap.format.ColorValueFormat;

/**
 * Shape of a {@link RegionBuffer}: a {@code width x height} grid of tuples of {@code channels}
 * unsigned channels, each stored big-endian on {@code bytesPerChannel} bytes.
 *
 * @param width cells per row
 * @param height rows
 * @param channels channels per cell
 * @param bytesPerChannel 1, 2 or 4
 */
public record BufferLayout(int width, int height, int channels, int bytesPerChannel) {

    public BufferLayout {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Region size must be positive: " + width + "x" + height);
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("Channel count must be positive: " + channels);
        }
        if (bytesPerChannel != 1 && bytesPerChannel != 2 && bytesPerChannel != 4) {
            throw new IllegalArgumentException("Bytes per channel must be 1, 2 or 4: " + bytesPerChannel);
        }
        if ((long) width * height * channels * bytesPerChannel > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException(
                    "Region of %dx%dx%d channels is too large for a single buffer".formatted(width, height, channels));
        }
    }

    /**
     * @return the layout holding {@code width x height} cells of {@code format}
     */
    public static BufferLayout of(int width, int height, ColorValueFormat format) {
        return new BufferLayout(width, height, format.channelCount(), bytesFor(format.channelWidth()));
    }

    /**
     * @return the smallest supported storage width for channels of {@code bits} bits
     */
    public static int bytesFor(int bits) {
        if (bits <= 8) {
            return 1;
        }
        return bits <= 16 ? 2 : 4;
    }

    public int tupleBytes() {
        return channels * bytesPerChannel;
    }

    public int byteSize() {
        return width * height * tupleBytes();
    }

    public long cellCount() {
        return (long) width * height;
    }
}
