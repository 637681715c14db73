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
import java.util.Objects;

/**
 * The concrete {@link Monochromatic} format.
 * <p>
 * Decoding reads the first channel. With {@link Builder#verifyChannels(boolean) channel
 * verification} enabled, a tuple whose color channels disagree is rejected with a
 * {@link FormatMismatchException} instead.
 *
 * <pre>{@code
 * Monochrome gray = Monochrome.gray();                       // 1 x 8 bits, 0 is empty
 * Monochrome strict = Monochrome.builder().channels(3).verifyChannels(true).build();
 * }</pre>
 */
public final class Monochrome extends Monochromatic {

    private final boolean verifyChannels;

    private Monochrome(Builder builder) {
        super(builder.channels, builder.channelWidth, builder.emptyValue, builder.alpha);
        this.verifyChannels = builder.verifyChannels;
    }

    /** @return a single 8 bit channel format */
    public static Monochrome gray() {
        return builder().build();
    }

    /** @return a three 8 bit channel format */
    public static Monochrome rgb() {
        return builder().channels(3).build();
    }

    /** @return three replicated 8 bit channels plus an opaque alpha channel */
    public static Monochrome rgba() {
        return builder().channels(4).alpha(true).build();
    }

    public boolean isVerifyChannels() {
        return verifyChannels;
    }

    @Override
    protected long resolveChannel(ChannelTuple tuple) {
        long first = tuple.get(0);
        if (verifyChannels) {
            for (int i = 1; i < colorChannels(); i++) {
                if (tuple.get(i) != first) {
                    throw new FormatMismatchException("Tuple " + tuple + " is not monochrome");
                }
            }
        }
        return first;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Monochrome m
                && channelCount() == m.channelCount()
                && channelWidth() == m.channelWidth()
                && emptyValue() == m.emptyValue()
                && hasAlpha() == m.hasAlpha()
                && verifyChannels == m.verifyChannels;
    }

    @Override
    public int hashCode() {
        return Objects.hash(channelCount(), channelWidth(), emptyValue(), hasAlpha(), verifyChannels);
    }

    @Override
    public String toString() {
        return "Monochrome[%dx%d bits, empty=%d%s]"
                .formatted(channelCount(), channelWidth(), emptyValue(), hasAlpha() ? ", alpha" : "");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link Monochrome}. Defaults to one 8 bit channel, {@code 0} as the empty
     * value, no alpha channel and no channel verification.
     */
    public static class Builder {
        private int channels = 1;
        private int channelWidth = 8;
        private long emptyValue = 0;
        private boolean alpha;
        private boolean verifyChannels;

        private Builder() {}

        public Builder channels(int channels) {
            this.channels = channels;
            return this;
        }

        public Builder channelWidth(int channelWidth) {
            this.channelWidth = channelWidth;
            return this;
        }

        public Builder emptyValue(long emptyValue) {
            this.emptyValue = emptyValue;
            return this;
        }

        public Builder alpha(boolean alpha) {
            this.alpha = alpha;
            return this;
        }

        /**
         * @param verifyChannels whether decoding rejects tuples whose color channels differ
         * @return this builder
         */
        public Builder verifyChannels(boolean verifyChannels) {
            this.verifyChannels = verifyChannels;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the channel layout or empty value is invalid
         */
        public Monochrome build() {
            return new Monochrome(this);
        }
    }
}
