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

import io.tileverse.datamap.FormatMismatchException;
import io.tileverse.datamap.ValueOutOfRangeException;

/**
 * Common state and validation of {@link ColorValueFormat} implementations: a channel count and a
 * channel width shared by all channels.
 */
public abstract class AbstractColorValueFormat implements ColorValueFormat {

    /** Widest channel a format can declare. */
    public static final int MAX_CHANNEL_WIDTH = 32;

    private final int channelCount;
    private final int channelWidth;

    protected AbstractColorValueFormat(int channelCount, int channelWidth) {
        if (channelCount <= 0) {
            throw new IllegalArgumentException("Channel count must be positive: " + channelCount);
        }
        if (channelWidth <= 0 || channelWidth > MAX_CHANNEL_WIDTH) {
            throw new IllegalArgumentException(
                    "Channel width must be between 1 and " + MAX_CHANNEL_WIDTH + " bits: " + channelWidth);
        }
        this.channelCount = channelCount;
        this.channelWidth = channelWidth;
    }

    @Override
    public final int channelCount() {
        return channelCount;
    }

    @Override
    public final int channelWidth() {
        return channelWidth;
    }

    /**
     * Verifies {@code tuple} has this format's channel count and every channel fits the
     * channel width.
     *
     * @throws FormatMismatchException if it doesn't
     */
    protected void checkTuple(ChannelTuple tuple) {
        if (tuple.size() != channelCount) {
            throw new FormatMismatchException("Tuple " + tuple + " does not fit " + this, channelCount, tuple.size());
        }
        long max = channelMax();
        for (int i = 0; i < channelCount; i++) {
            if (tuple.get(i) > max) {
                throw new FormatMismatchException(
                        "Channel " + i + " of " + tuple + " exceeds " + channelWidth + " bits");
            }
        }
    }

    /**
     * @throws ValueOutOfRangeException if {@code value} is not within {@code [minValue(), maxValue()]}
     */
    protected void checkRange(long value) {
        if (value < minValue() || value > maxValue()) {
            throw new ValueOutOfRangeException(
                    value, "Value %d is outside [%d, %d] of %s".formatted(value, minValue(), maxValue(), this));
        }
    }
}
