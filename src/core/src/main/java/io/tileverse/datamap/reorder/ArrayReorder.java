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

import java.util.Arrays;

/**
 * Reorder holding its forward mapping and the explicit inverse as arrays.
 */
final class ArrayReorder implements ReversibleReorder {

    private final long[] forward;
    private final long[] inverse;

    ArrayReorder(long[] mapping, long domainSize) {
        Permutations.allLoops(mapping, domainSize);
        this.forward = mapping.clone();
        this.inverse = new long[forward.length];
        for (int i = 0; i < forward.length; i++) {
            inverse[(int) forward[i]] = i;
        }
    }

    @Override
    public long size() {
        return forward.length;
    }

    @Override
    public long forward(long index) {
        checkIndex(index);
        return forward[(int) index];
    }

    @Override
    public long inverse(long index) {
        checkIndex(index);
        return inverse[(int) index];
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ArrayReorder r && Arrays.equals(forward, r.forward);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(forward);
    }

    @Override
    public String toString() {
        return "Reorder" + Arrays.toString(forward);
    }
}
