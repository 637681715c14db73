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
package io.tileverse.datamap.format;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * An immutable, fixed length sequence of unsigned channel values, the physical representation
 * of one map cell.
 */
public final class ChannelTuple {

    private final long[] channels;

    private ChannelTuple(long[] channels) {
        this.channels = channels;
    }

    /**
     * @param channels the channel values, copied
     * @return a tuple holding the given channel values
     * @throws IllegalArgumentException if no channel is given or a channel is negative
     */
    public static ChannelTuple of(long... channels) {
        if (channels == null || channels.length == 0) {
            throw new IllegalArgumentException("A channel tuple needs at least one channel");
        }
        for (long c : channels) {
            if (c < 0) {
                throw new IllegalArgumentException("Channel values are unsigned: " + Arrays.toString(channels));
            }
        }
        return new ChannelTuple(channels.clone());
    }

    /**
     * @return a tuple of {@code size} channels all set to {@code value}
     */
    public static ChannelTuple filled(int size, long value) {
        if (size <= 0) {
            throw new IllegalArgumentException("Tuple size must be positive: " + size);
        }
        long[] channels = new long[size];
        Arrays.fill(channels, value);
        return of(channels);
    }

    public int size() {
        return channels.length;
    }

    public long get(int channel) {
        return channels[channel];
    }

    public long[] toArray() {
        return channels.clone();
    }

    /**
     * @return {@code true} if every channel holds the same value
     */
    public boolean isUniform() {
        for (int i = 1; i < channels.length; i++) {
            if (channels[i] != channels[0]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ChannelTuple t && Arrays.equals(channels, t.channels);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(channels);
    }

    @Override
    public String toString() {
        return Arrays.stream(channels).mapToObj(Long::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
