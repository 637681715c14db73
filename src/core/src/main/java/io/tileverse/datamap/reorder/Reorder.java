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
package io.tileverse.datamap.reorder;

import java.util.ArrayList;
import java.util.List;

/**
 * A bijection over the index domain {@code [0, size())}.
 * <p>
 * Applying a reorder to a sequence places {@code seq[forward(i)]} at position {@code i}. Value
 * maps use it to translate a logical cell index into the physical index it is stored at, which
 * controls how cells are grouped into regions.
 */
public interface Reorder {

    /**
     * @return the number of indices in the domain
     */
    long size();

    /**
     * @param index an index in {@code [0, size())}
     * @return the index {@code index} maps to
     * @throws IndexOutOfBoundsException if {@code index} is outside the domain
     */
    long forward(long index);

    /**
     * @param seq a sequence of {@link #size()} elements
     * @return a new array with {@code out[i] = seq[forward(i)]}
     */
    default long[] apply(long[] seq) {
        checkLength(seq.length);
        long[] out = new long[seq.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = seq[(int) forward(i)];
        }
        return out;
    }

    /**
     * @param seq a list of {@link #size()} elements
     * @return a new list with {@code out.get(i) == seq.get(forward(i))}
     */
    default <T> List<T> apply(List<T> seq) {
        checkLength(seq.size());
        List<T> out = new ArrayList<>(seq.size());
        for (int i = 0; i < seq.size(); i++) {
            out.add(seq.get((int) forward(i)));
        }
        return out;
    }

    /**
     * @throws IllegalArgumentException if {@code length} differs from {@link #size()}
     */
    default void checkLength(long length) {
        if (length != size()) {
            throw new IllegalArgumentException(
                    "Sequence length " + length + " does not match reorder size " + size());
        }
    }

    /**
     * @throws IndexOutOfBoundsException if {@code index} is outside {@code [0, size())}
     */
    default void checkIndex(long index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException("Index " + index + " is outside [0, " + size() + ")");
        }
    }
}
