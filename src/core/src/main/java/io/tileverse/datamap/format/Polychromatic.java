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
import io.tileverse.datamap.reorder.ReversibleReorder;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A format spreading the bits of a value over several channels.
 * <p>
 * Subclasses define how bits are laid out by {@link #pack(long)} and {@link #unpack(long[])}.
 * An optional channel order permutes the packed channels before they are stored: logical
 * channel {@code i} is stored at position {@code channelOrder.inverse(i)}, and decoding reads
 * logical channel {@code i} from stored position {@code channelOrder.forward(i)}.
 * <p>
 * The domain is {@code [0, 2^(channelCount * channelWidth) - 1]} minus the reserved
 * {@link #emptyValue()}.
 */
public abstract class Polychromatic extends AbstractColorValueFormat {

    /** Channel count limit of polychromatic formats. */
    public static final int MAX_PALETTE_WIDTH = 16;

    /** Bits a value can span: values are held in a signed {@code long}. */
    public static final int MAX_VALUE_BITS = 63;

    private final ReversibleReorder channelOrder;
    private final long emptyValue;
    private final long rawMax;
    private ChannelTuple emptyTuple;

    protected Polychromatic(int channelCount, int channelWidth, ReversibleReorder channelOrder, long emptyValue) {
        super(channelCount, channelWidth);
        if (channelCount > MAX_PALETTE_WIDTH) {
            throw new IllegalArgumentException(
                    "At most " + MAX_PALETTE_WIDTH + " channels are supported: " + channelCount);
        }
        int bits = channelCount * channelWidth;
        if (bits > MAX_VALUE_BITS) {
            throw new IllegalArgumentException(
                    "%d channels of %d bits exceed %d value bits".formatted(channelCount, channelWidth, MAX_VALUE_BITS));
        }
        if (channelOrder != null && channelOrder.size() != channelCount) {
            throw new IllegalArgumentException(
                    "Channel order of size " + channelOrder.size() + " does not match " + channelCount + " channels");
        }
        this.rawMax = bits == MAX_VALUE_BITS ? Long.MAX_VALUE : (1L << bits) - 1;
        if (emptyValue < 0 || emptyValue > rawMax) {
            throw new IllegalArgumentException("Empty value " + emptyValue + " does not fit " + bits + " bits");
        }
        this.channelOrder = channelOrder;
        this.emptyValue = emptyValue;
    }

    /**
     * @return the raw value whose tuple marks an empty cell
     */
    public long emptyValue() {
        return emptyValue;
    }

    public Optional<ReversibleReorder> channelOrder() {
        return Optional.ofNullable(channelOrder);
    }

    /**
     * @return the number of value bits, {@code channelCount() * channelWidth()}
     */
    public int valueBits() {
        return channelCount() * channelWidth();
    }

    @Override
    public long minValue() {
        return emptyValue == 0 ? 1 : 0;
    }

    @Override
    public long maxValue() {
        return emptyValue == rawMax ? rawMax - 1 : rawMax;
    }

    @Override
    public ChannelTuple encode(long value) {
        checkRange(value);
        if (value == emptyValue) {
            throw new ValueOutOfRangeException(value, "Value " + value + " is reserved as the empty marker of " + this);
        }
        return store(pack(value));
    }

    @Override
    public OptionalLong decode(ChannelTuple tuple) {
        checkTuple(tuple);
        if (tuple.equals(emptyTuple())) {
            return OptionalLong.empty();
        }
        long[] stored = tuple.toArray();
        long[] logical = channelOrder == null ? stored : channelOrder.apply(stored);
        return OptionalLong.of(unpack(logical));
    }

    @Override
    public ChannelTuple emptyTuple() {
        ChannelTuple t = emptyTuple;
        if (t == null) {
            t = store(pack(emptyValue));
            emptyTuple = t;
        }
        return t;
    }

    private ChannelTuple store(long[] logical) {
        return ChannelTuple.of(channelOrder == null ? logical : channelOrder.applyInverse(logical));
    }

    /**
     * Splits a value of {@link #valueBits()} bits into {@link #channelCount()} channels.
     */
    protected abstract long[] pack(long value);

    /**
     * Reassembles the value split by {@link #pack(long)}.
     */
    protected abstract long unpack(long[] channels);

    protected boolean sameLayout(Polychromatic other) {
        return channelCount() == other.channelCount()
                && channelWidth() == other.channelWidth()
                && emptyValue == other.emptyValue
                && Objects.equals(channelOrderMapping(), other.channelOrderMapping());
    }

    /**
     * @return the channel order as a comparable string, {@code null} without one
     */
    protected String channelOrderMapping() {
        if (channelOrder == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (long i = 0; i < channelOrder.size(); i++) {
            sb.append(channelOrder.forward(i)).append(',');
        }
        return sb.toString();
    }
}
