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
package io.tileverse.datamap.access.image;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.util.Objects;
import javax.imageio.stream.ImageInputStreamImpl;

/**
 * Feeds an image file opened as a {@link SeekableByteChannel} to an ImageIO reader.
 * <p>
 * The stream position always matches the channel position: bytes are read straight into the
 * caller's array without buffering, and seeks are delegated to the channel. The channel is owned
 * by the caller and is not closed by {@link #close()}. Not thread safe.
 */
final class ChannelImageInputStream extends ImageInputStreamImpl {

    private final SeekableByteChannel channel;
    private final ByteBuffer single = ByteBuffer.allocate(1);

    private ChannelImageInputStream(SeekableByteChannel channel) {
        this.channel = Objects.requireNonNull(channel, "channel cannot be null");
    }

    static ChannelImageInputStream of(SeekableByteChannel channel) {
        return new ChannelImageInputStream(channel);
    }

    @Override
    public int read() throws IOException {
        checkClosed();
        single.clear();
        int n = channel.read(single);
        if (n <= 0) {
            return -1;
        }
        bitOffset = 0;
        streamPos = channel.position();
        return single.get(0) & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        checkClosed();
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
            return 0;
        }
        int n = channel.read(ByteBuffer.wrap(b, off, len));
        if (n == -1) {
            return -1;
        }
        bitOffset = 0;
        streamPos = channel.position();
        return n;
    }

    @Override
    public void seek(long pos) throws IOException {
        checkClosed();
        if (pos < flushedPos) {
            throw new IndexOutOfBoundsException("Cannot seek to " + pos + " before the flushed position " + flushedPos);
        }
        bitOffset = 0;
        channel.position(pos);
        streamPos = channel.position();
    }

    /**
     * @return the channel size, or -1 if it can't be determined
     */
    @Override
    public long length() {
        try {
            return channel.size();
        } catch (IOException e) {
            return -1L;
        }
    }

    @Override
    public String toString() {
        return "ChannelImageInputStream[position=%d, size=%d]".formatted(streamPos, length());
    }
}
