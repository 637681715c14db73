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

import io.tileverse.datamap.format.ChannelTuple;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * The resident content of a region: a row-major grid of channel tuples backed by a heap
 * {@link ByteBuffer}.
 * <p>
 * Access uses absolute buffer positions only, so concurrent readers are safe. Writers must be
 * serialized with readers by the caller; the access manager does so with the region's
 * read/write lock.
 */
public final class RegionBuffer {

    private final BufferLayout layout;
    private final ByteBuffer data;

    private RegionBuffer(BufferLayout layout, ByteBuffer data) {
        this.layout = layout;
        this.data = data;
    }

    /**
     * @param layout shape of the buffer
     * @param fill tuple every cell starts with, typically a format's empty marker
     * @return a new buffer
     */
    public static RegionBuffer allocate(BufferLayout layout, ChannelTuple fill) {
        Objects.requireNonNull(layout, "layout cannot be null");
        RegionBuffer buffer = new RegionBuffer(layout, ByteBuffer.allocate(layout.byteSize()));
        buffer.fill(Objects.requireNonNull(fill, "fill tuple cannot be null"));
        return buffer;
    }

    /**
     * Wraps the bytes between position and limit of {@code bytes}, without copying.
     *
     * @throws IllegalArgumentException if the remaining bytes don't match the layout's size
     */
    public static RegionBuffer wrap(BufferLayout layout, ByteBuffer bytes) {
        Objects.requireNonNull(layout, "layout cannot be null");
        if (bytes.remaining() != layout.byteSize()) {
            throw new IllegalArgumentException("Expected %d bytes for %s, got %d"
                    .formatted(layout.byteSize(), layout, bytes.remaining()));
        }
        return new RegionBuffer(layout, bytes.slice());
    }

    public BufferLayout layout() {
        return layout;
    }

    public int width() {
        return layout.width();
    }

    public int height() {
        return layout.height();
    }

    /**
     * @param x column within the region
     * @param y row within the region
     * @return the tuple stored at {@code (x, y)}
     */
    public ChannelTuple get(int x, int y) {
        int offset = offset(x, y);
        long[] channels = new long[layout.channels()];
        for (int c = 0; c < channels.length; c++) {
            channels[c] = readChannel(offset + c * layout.bytesPerChannel());
        }
        return ChannelTuple.of(channels);
    }

    /**
     * @param x column within the region
     * @param y row within the region
     * @param channel channel index
     * @return the unsigned channel value
     */
    public long getChannel(int x, int y, int channel) {
        Objects.checkIndex(channel, layout.channels());
        return readChannel(offset(x, y) + channel * layout.bytesPerChannel());
    }

    /**
     * @throws IllegalArgumentException if the tuple size differs from the layout's channel count
     *     or a channel does not fit the storage width
     */
    public void set(int x, int y, ChannelTuple tuple) {
        if (tuple.size() != layout.channels()) {
            throw new IllegalArgumentException(
                    "Tuple " + tuple + " does not have " + layout.channels() + " channels");
        }
        int offset = offset(x, y);
        for (int c = 0; c < tuple.size(); c++) {
            writeChannel(offset + c * layout.bytesPerChannel(), tuple.get(c));
        }
    }

    public void fill(ChannelTuple tuple) {
        for (int y = 0; y < layout.height(); y++) {
            for (int x = 0; x < layout.width(); x++) {
                set(x, y, tuple);
            }
        }
    }

    /**
     * @return a deep copy of this buffer
     */
    public RegionBuffer copy() {
        ByteBuffer copy = ByteBuffer.allocate(data.capacity());
        copy.put(data.duplicate().clear());
        return new RegionBuffer(layout, copy.flip());
    }

    /**
     * @return a read-only view of the raw bytes, positioned at zero
     */
    public ByteBuffer bytes() {
        return data.asReadOnlyBuffer().clear();
    }

    private int offset(int x, int y) {
        Objects.checkIndex(x, layout.width());
        Objects.checkIndex(y, layout.height());
        return (y * layout.width() + x) * layout.tupleBytes();
    }

    private long readChannel(int position) {
        return switch (layout.bytesPerChannel()) {
            case 1 -> Byte.toUnsignedLong(data.get(position));
            case 2 -> Short.toUnsignedLong(data.getShort(position));
            default -> Integer.toUnsignedLong(data.getInt(position));
        };
    }

    private void writeChannel(int position, long value) {
        long max = layout.bytesPerChannel() == 4 ? 0xFFFFFFFFL : (1L << (8 * layout.bytesPerChannel())) - 1;
        if (value < 0 || value > max) {
            throw new IllegalArgumentException(
                    "Channel value " + value + " does not fit " + layout.bytesPerChannel() + " bytes");
        }
        switch (layout.bytesPerChannel()) {
            case 1 -> data.put(position, (byte) value);
            case 2 -> data.putShort(position, (short) value);
            default -> data.putInt(position, (int) value);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RegionBuffer b && layout.equals(b.layout) && bytes().equals(b.bytes());
    }

    @Override
    public int hashCode() {
        return Objects.hash(layout, bytes());
    }

    @Override
    public String toString() {
        return "RegionBuffer[" + layout + "]";
    }
}
