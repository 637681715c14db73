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

import io.tileverse.datamap.ValueOutOfRangeException;
import java.util.OptionalLong;

/**
 * A format whose value is a single channel value replicated on every color channel of the
 * medium.
 * <p>
 * One channel value, {@link #emptyValue()}, is reserved as the "no data" marker and cannot be
 * encoded. When the format carries an alpha channel, the last channel is always written fully
 * opaque ({@link #channelMax()}) and is ignored when decoding.
 */
public abstract class Monochromatic extends AbstractColorValueFormat {

    private final long emptyValue;
    private final boolean alpha;
    private final ChannelTuple emptyTuple;

    protected Monochromatic(int channelCount, int channelWidth, long emptyValue, boolean alpha) {
        super(channelCount, channelWidth);
        if (emptyValue < 0 || emptyValue > channelMax()) {
            throw new IllegalArgumentException(
                    "Empty value %d does not fit a %d bit channel".formatted(emptyValue, channelWidth));
        }
        if (alpha && channelCount < 2) {
            throw new IllegalArgumentException("An alpha channel requires at least two channels");
        }
        this.emptyValue = emptyValue;
        this.alpha = alpha;
        this.emptyTuple = tupleOf(emptyValue);
    }

    /**
     * @return the reserved channel value marking an empty cell
     */
    public long emptyValue() {
        return emptyValue;
    }

    /**
     * @return whether the last channel is a constant alpha channel
     */
    public boolean hasAlpha() {
        return alpha;
    }

    /**
     * @return the number of channels carrying the value
     */
    public int colorChannels() {
        return alpha ? channelCount() - 1 : channelCount();
    }

    @Override
    public long minValue() {
        return emptyValue == 0 ? 1 : 0;
    }

    @Override
    public long maxValue() {
        return emptyValue == channelMax() ? channelMax() - 1 : channelMax();
    }

    @Override
    public ChannelTuple encode(long value) {
        checkRange(value);
        if (value == emptyValue) {
            throw new ValueOutOfRangeException(value, "Value " + value + " is reserved as the empty marker of " + this);
        }
        return tupleOf(value);
    }

    @Override
    public OptionalLong decode(ChannelTuple tuple) {
        checkTuple(tuple);
        long value = resolveChannel(tuple);
        return value == emptyValue ? OptionalLong.empty() : OptionalLong.of(value);
    }

    @Override
    public ChannelTuple emptyTuple() {
        return emptyTuple;
    }

    /**
     * Picks the value out of the color channels of a tuple that already passed the channel count
     * and width checks.
     */
    protected abstract long resolveChannel(ChannelTuple tuple);

    private ChannelTuple tupleOf(long value) {
        long[] channels = new long[channelCount()];
        for (int i = 0; i < channels.length; i++) {
            channels[i] = alpha && i == channels.length - 1 ? channelMax() : value;
        }
        return ChannelTuple.of(channels);
    }
}
