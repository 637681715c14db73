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

import io.tileverse.datamap.IncompleteMappingException;
import io.tileverse.datamap.reorder.ReversibleReorder;
import java.util.Objects;

/**
 * A {@link Polychromatic} format interleaving stripes of the value over the channels.
 * <p>
 * The value's {@code channelCount * channelWidth} bits are cut into stripes of
 * {@code stripeWidth} bits, most significant first. Stripe {@code i} is appended to channel
 * {@code i % channelCount}. With the stripe width equal to the channel width this is plain
 * big-endian packing ({@code 0xRRGGBB} for RGB); narrower stripes spread neighbouring values over
 * all channels.
 *
 * <pre>{@code
 * Polychrome rgb = Polychrome.rgb();          // 3 x 8 bits, 8 bit stripes
 * Polychrome fine = Polychrome.builder().channels(3).stripeWidth(1).build();
 * Polychrome bgr = Polychrome.builder().channels(3).channelOrder(Polychrome.channelOrder("RGB", "BGR")).build();
 * }</pre>
 */
public final class Polychrome extends Polychromatic {

    private final int stripeWidth;

    private Polychrome(Builder builder) {
        super(builder.channels, builder.channelWidth, builder.channelOrder, builder.emptyValue);
        int stripe = builder.stripeWidth == null ? builder.channelWidth : builder.stripeWidth;
        if (stripe <= 0 || builder.channelWidth % stripe != 0) {
            throw new IllegalArgumentException("Stripe width %d does not divide the channel width %d"
                    .formatted(stripe, builder.channelWidth));
        }
        this.stripeWidth = stripe;
    }

    /** @return three 8 bit channels with 8 bit stripes */
    public static Polychrome rgb() {
        return builder().channels(3).build();
    }

    /** @return four 8 bit channels with 8 bit stripes */
    public static Polychrome rgba() {
        return builder().channels(4).build();
    }

    /**
     * Builds the channel order turning channels laid out as {@code stored} into the layout named
     * {@code logical}, e.g. {@code channelOrder("RGB", "BGR")}.
     *
     * @param logical channel names in logical order, one character per channel
     * @param stored the same names in stored order
     * @return the reorder with {@code forward(i) == stored.indexOf(logical.charAt(i))}
     * @throws IncompleteMappingException if the names are not a permutation of each other
     */
    public static ReversibleReorder channelOrder(String logical, String stored) {
        if (logical.length() != stored.length()) {
            throw new IncompleteMappingException("Channel names " + stored + " do not match " + logical);
        }
        long[] mapping = new long[logical.length()];
        for (int i = 0; i < mapping.length; i++) {
            mapping[i] = stored.indexOf(logical.charAt(i));
        }
        return ReversibleReorder.of(mapping, mapping.length);
    }

    public int stripeWidth() {
        return stripeWidth;
    }

    @Override
    protected long[] pack(long value) {
        final int n = channelCount();
        final int bits = valueBits();
        final int stripes = bits / stripeWidth;
        final long mask = (1L << stripeWidth) - 1;
        long[] channels = new long[n];
        for (int i = 0; i < stripes; i++) {
            long stripe = (value >>> (bits - (i + 1) * stripeWidth)) & mask;
            channels[i % n] = (channels[i % n] << stripeWidth) | stripe;
        }
        return channels;
    }

    @Override
    protected long unpack(long[] channels) {
        final int n = channelCount();
        final int width = channelWidth();
        final int stripes = valueBits() / stripeWidth;
        final long mask = (1L << stripeWidth) - 1;
        long value = 0;
        for (int i = 0; i < stripes; i++) {
            int stripeInChannel = i / n;
            long stripe = (channels[i % n] >>> (width - (stripeInChannel + 1) * stripeWidth)) & mask;
            value = (value << stripeWidth) | stripe;
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Polychrome p && stripeWidth == p.stripeWidth && sameLayout(p);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channelCount(), channelWidth(), stripeWidth, emptyValue(), channelOrderMapping());
    }

    @Override
    public String toString() {
        return "Polychrome[%dx%d bits, stripe=%d, empty=%d%s]"
                .formatted(
                        channelCount(),
                        channelWidth(),
                        stripeWidth,
                        emptyValue(),
                        channelOrder().map(o -> ", order=" + o).orElse(""));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link Polychrome}. Defaults to three 8 bit channels, stripes as wide as a
     * channel, no channel order and {@code 0} as the empty value.
     */
    public static class Builder {
        private int channels = 3;
        private int channelWidth = 8;
        private Integer stripeWidth;
        private ReversibleReorder channelOrder;
        private long emptyValue = 0;

        private Builder() {}

        public Builder channels(int channels) {
            this.channels = channels;
            return this;
        }

        public Builder channelWidth(int channelWidth) {
            this.channelWidth = channelWidth;
            return this;
        }

        /**
         * @param stripeWidth bits per stripe, must divide the channel width
         * @return this builder
         */
        public Builder stripeWidth(int stripeWidth) {
            this.stripeWidth = stripeWidth;
            return this;
        }

        public Builder channelOrder(ReversibleReorder channelOrder) {
            this.channelOrder = channelOrder;
            return this;
        }

        public Builder emptyValue(long emptyValue) {
            this.emptyValue = emptyValue;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the channel layout, stripe width or empty value is
         *     invalid
         */
        public Polychrome build() {
            return new Polychrome(this);
        }
    }
}
