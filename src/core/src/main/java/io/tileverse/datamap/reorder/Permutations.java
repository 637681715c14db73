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
import java.util.BitSet;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongUnaryOperator;
import java.util.stream.LongStream;

/**
 * Static helpers over index permutations: cycle decomposition, stride run detection and the
 * divisor ranking used to size regions.
 */
public final class Permutations {

    private Permutations() {
        // utility class
    }

    /**
     * Decomposes an explicit mapping into its cycles, {@code mapping[i]} being the image of
     * {@code i}.
     *
     * @param mapping the images of {@code 0 .. mapping.length - 1}
     * @param domainSize the size of the domain the mapping must cover
     * @return the cycles, each starting at its smallest index, ordered by that index
     * @throws IncompleteMappingException if an index is mapped outside the domain, two indices
     *     share an image, or an index of the domain has no image
     */
    public static List<long[]> allLoops(long[] mapping, long domainSize) {
        Objects.requireNonNull(mapping, "mapping cannot be null");
        checkDomainSize(domainSize);
        if (mapping.length > domainSize) {
            throw new IncompleteMappingException(
                    "Index " + domainSize + " is outside the domain [0, " + domainSize + ")");
        }
        if (mapping.length < domainSize) {
            throw new IncompleteMappingException("Index " + mapping.length + " has no image in a domain of "
                    + domainSize + " indices");
        }
        return decompose(domainSize, i -> mapping[(int) i]);
    }

    /**
     * Decomposes a partial mapping given as key/image pairs into its cycles.
     *
     * @param mapping index to image pairs
     * @param domainSize the size of the domain the mapping must cover
     * @return the cycles, each starting at its smallest index
     * @throws IncompleteMappingException under the same conditions as
     *     {@link #allLoops(long[], long)}
     */
    public static List<long[]> allLoops(Map<Long, Long> mapping, long domainSize) {
        Objects.requireNonNull(mapping, "mapping cannot be null");
        checkDomainSize(domainSize);
        for (Long key : mapping.keySet()) {
            if (key < 0 || key >= domainSize) {
                throw new IncompleteMappingException(
                        "Index " + key + " is outside the domain [0, " + domainSize + ")");
            }
        }
        for (long i = 0; i < domainSize; i++) {
            if (mapping.get(i) == null) {
                throw new IncompleteMappingException(
                        "Index " + i + " has no image in a domain of " + domainSize + " indices");
            }
        }
        return decompose(domainSize, mapping::get);
    }

    /**
     * Decomposes the mapping computed by {@code forward} over {@code [0, size)} into its cycles.
     *
     * @throws IncompleteMappingException if {@code forward} maps an index outside the domain or
     *     two indices to the same image
     */
    public static List<long[]> allLoops(long size, LongUnaryOperator forward) {
        Objects.requireNonNull(forward, "forward function cannot be null");
        checkDomainSize(size);
        return decompose(size, forward);
    }

    private static List<long[]> decompose(long size, LongUnaryOperator forward) {
        final int n = (int) size;
        BitSet images = new BitSet(n);
        for (int i = 0; i < n; i++) {
            long image = forward.applyAsLong(i);
            if (image < 0 || image >= n) {
                throw new IncompleteMappingException(
                        "Index " + i + " is mapped to " + image + ", outside the domain [0, " + n + ")");
            }
            if (images.get((int) image)) {
                throw new IncompleteMappingException("Index " + i + " is mapped to " + image
                        + ", which is already the image of another index");
            }
            images.set((int) image);
        }
        // n distinct images inside [0, n): every index is reached exactly once
        List<long[]> loops = new ArrayList<>();
        BitSet visited = new BitSet(n);
        for (int start = visited.nextClearBit(0); start < n; start = visited.nextClearBit(start + 1)) {
            LongStream.Builder cycle = LongStream.builder();
            long current = start;
            do {
                visited.set((int) current);
                cycle.add(current);
                current = forward.applyAsLong(current);
            } while (current != start);
            loops.add(cycle.build().toArray());
        }
        return loops;
    }

    private static void checkDomainSize(long domainSize) {
        if (domainSize < 0 || domainSize > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Domain size must be within [0, 2^31-1]: " + domainSize);
        }
    }

    /**
     * Finds where the forward sequence of a reorder changes stride.
     * <p>
     * The sequence {@code forward(0), forward(1), ...} is cut greedily into runs of constant
     * difference between consecutive images; a run needs two elements to establish its stride.
     * For {@code [0, 2, 4, 1, 3, 5]} the runs are {@code [0, 2, 4]} and {@code [1, 3, 5]}, so the
     * result is {@code [3]}.
     *
     * @param reorder the reorder to scan
     * @return the indices, in increasing order and excluding {@code 0}, where a new run begins
     */
    public static List<Long> pivots(Reorder reorder) {
        List<Long> pivots = new ArrayList<>();
        long size = reorder.size();
        boolean strideKnown = false;
        long stride = 0;
        long previous = size > 0 ? reorder.forward(0) : 0;
        for (long i = 1; i < size; i++) {
            long current = reorder.forward(i);
            long step = current - previous;
            if (!strideKnown) {
                stride = step;
                strideKnown = true;
            } else if (step != stride) {
                pivots.add(i);
                strideKnown = false;
            }
            previous = current;
        }
        return pivots;
    }

    /**
     * Lists the divisors of {@code n} within {@code [min, max]}, those with the most divisors of
     * their own first, ties broken by increasing value.
     *
     * @param n the length to divide
     * @param min smallest acceptable divisor
     * @param max largest acceptable divisor
     * @return the ranked divisors, empty if none falls in range
     */
    public static List<Integer> divisions(int n, int min, int max) {
        if (n <= 0) {
            throw new IllegalArgumentException("Length must be positive: " + n);
        }
        int lo = Math.max(1, min);
        int hi = Math.min(n, max);
        if (lo > hi) {
            return List.of();
        }
        List<int[]> ranked = new ArrayList<>();
        for (int d = lo; d <= hi; d++) {
            if (n % d != 0) {
                continue;
            }
            int subDivisors = 0;
            for (int s = 2; s < d; s++) {
                if (d % s == 0) {
                    subDivisors++;
                }
            }
            ranked.add(new int[] {d, subDivisors});
        }
        ranked.sort(Comparator.<int[]>comparingInt(e -> e[1])
                .reversed()
                .thenComparingInt(e -> e[0]));
        List<Integer> result = new ArrayList<>(ranked.size());
        ranked.forEach(e -> result.add(e[0]));
        return Collections.unmodifiableList(result);
    }

    /**
     * Greatest common divisor of two non-negative numbers.
     */
    public static long gcd(long a, long b) {
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }
}
