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

import io.tileverse.datamap.IncompleteMappingException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.LongUnaryOperator;

/**
 * A {@link Reorder} that exposes its exact inverse.
 * <p>
 * {@code inverse(forward(i)) == i} and {@code forward(inverse(i)) == i} hold for every index of
 * the domain. Instances created by the factory methods of this interface are validated with
 * {@link Permutations#allLoops(long[], long)} when constructed, so an instance that exists is a
 * complete bijection.
 */
public interface ReversibleReorder extends Reorder {

    /**
     * @param index an index in {@code [0, size())}
     * @return the index {@code j} such that {@code forward(j) == index}
     */
    long inverse(long index);

    /**
     * Undoes {@link #apply(long[])}: {@code applyInverse(apply(seq))} equals {@code seq}.
     *
     * @param seq a sequence of {@link #size()} elements
     * @return a new array with {@code out[i] = seq[inverse(i)]}
     */
    default long[] applyInverse(long[] seq) {
        checkLength(seq.length);
        long[] out = new long[seq.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = seq[(int) inverse(i)];
        }
        return out;
    }

    /**
     * @param seq a list of {@link #size()} elements
     * @return a new list with {@code out.get(i) == seq.get(inverse(i))}
     */
    default <T> List<T> applyInverse(List<T> seq) {
        checkLength(seq.size());
        List<T> out = new ArrayList<>(seq.size());
        for (int i = 0; i < seq.size(); i++) {
            out.add(seq.get((int) inverse(i)));
        }
        return out;
    }

    /**
     * @return a reorder whose forward mapping is this reorder's inverse
     */
    default ReversibleReorder reversed() {
        ReversibleReorder self = this;
        return new ReversibleReorder() {
            @Override
            public long size() {
                return self.size();
            }

            @Override
            public long forward(long index) {
                return self.inverse(index);
            }

            @Override
            public long inverse(long index) {
                return self.forward(index);
            }

            @Override
            public ReversibleReorder reversed() {
                return self;
            }
        };
    }

    /**
     * Creates a reorder from an explicit mapping, {@code forward(i) == mapping[i]}.
     *
     * @param mapping the image of every index of {@code [0, mapping.length)}
     * @return the validated reorder
     * @throws IncompleteMappingException if {@code mapping} is not a permutation
     */
    static ReversibleReorder of(int... mapping) {
        long[] m = new long[mapping.length];
        for (int i = 0; i < mapping.length; i++) {
            m[i] = mapping[i];
        }
        return of(m, m.length);
    }

    /**
     * Creates a reorder over {@code [0, domainSize)} from an explicit mapping.
     *
     * @param mapping the images of the indices {@code 0 .. mapping.length - 1}
     * @param domainSize the size of the domain
     * @return the validated reorder
     * @throws IncompleteMappingException if an index is mapped outside the domain, two indices
     *     share an image, or {@code mapping} does not cover the whole domain
     */
    static ReversibleReorder of(long[] mapping, long domainSize) {
        return new ArrayReorder(mapping, domainSize);
    }

    /**
     * Creates a reorder backed by a function. The function is checked over the whole domain
     * when the reorder is created; inverses are then computed by walking the cycle of the
     * requested index.
     *
     * @param size the size of the domain, at most {@link Integer#MAX_VALUE}
     * @param forward the forward mapping
     * @return the validated reorder
     * @throws IncompleteMappingException if {@code forward} is not a permutation of the domain
     */
    static ReversibleReorder of(long size, LongUnaryOperator forward) {
        return new FunctionReorder(size, forward);
    }
}
