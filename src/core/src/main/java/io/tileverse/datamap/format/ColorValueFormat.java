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
import java.util.OptionalLong;

/**
 * Bidirectional mapping between logical values and fixed width channel tuples.
 * <p>
 * A format reserves one tuple as the empty marker: a cell holding it has no value, and
 * {@link #decode(ChannelTuple)} returns an empty {@link OptionalLong} for it. For every
 * {@code v} in {@code [minValue(), maxValue()]} other than the value mapped to the empty marker,
 * {@code decode(encode(v))} returns {@code v}; for every valid tuple {@code t} that is not the
 * empty marker, {@code encode(decode(t))} returns {@code t}.
 * <p>
 * Implementations are immutable, perform no I/O, and are safe to share between threads and
 * maps. They implement {@code equals} so that maps can be checked for compatibility.
 */
public interface ColorValueFormat {

    /**
     * @return the number of physical channels of a tuple
     */
    int channelCount();

    /**
     * @return the number of significant bits of each channel, between 1 and 32
     */
    int channelWidth();

    /**
     * @return the largest value a single channel can hold
     */
    default long channelMax() {
        return (1L << channelWidth()) - 1;
    }

    /**
     * @return the smallest encodable value
     */
    long minValue();

    /**
     * @return the largest encodable value
     */
    long maxValue();

    /**
     * Maps a logical value to its channel tuple.
     *
     * @param value the value to encode
     * @return the tuple representing {@code value}
     * @throws ValueOutOfRangeException if the value is outside the format's domain or collides
     *     with the empty marker
     */
    ChannelTuple encode(long value);

    /**
     * Maps a channel tuple back to its logical value.
     *
     * @param tuple the tuple read from a region
     * @return the value, or empty if {@code tuple} is the empty marker
     * @throws FormatMismatchException if the tuple does not have {@link #channelCount()} channels
     *     or is otherwise not a tuple of this format
     */
    OptionalLong decode(ChannelTuple tuple);

    /**
     * @return the tuple marking a cell with no value
     */
    ChannelTuple emptyTuple();

    /**
     * Tells whether a cell holding {@code tuple} has no value. This agrees with
     * {@link #decode(ChannelTuple)}, so tuples other than {@link #emptyTuple()} may be empty too,
     * e.g. a monochrome tuple whose value channel holds the empty value but whose alpha channel
     * is not opaque.
     *
     * @throws FormatMismatchException if the tuple is not a tuple of this format
     */
    default boolean isEmptyMarker(ChannelTuple tuple) {
        return decode(tuple).isEmpty();
    }

    /**
     * @return {@code true} if {@code value} can be encoded
     */
    default boolean accepts(long value) {
        try {
            encode(value);
            return true;
        } catch (ValueOutOfRangeException e) {
            return false;
        }
    }

    /**
     * Verifies this format can be carried by a medium with the given number of channels.
     *
     * @param mediumChannels channel count of the medium
     * @throws FormatMismatchException if the counts differ
     */
    default void checkMedium(int mediumChannels) {
        if (mediumChannels != channelCount()) {
            throw new FormatMismatchException("Channel count mismatch for " + this, channelCount(), mediumChannels);
        }
    }
}
