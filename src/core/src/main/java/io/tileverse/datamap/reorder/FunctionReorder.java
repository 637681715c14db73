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

import java.util.function.LongUnaryOperator;

/**
 * Reorder computed by a function. The inverse of an index is found by following the index's
 * cycle until it closes, so its cost is bounded by the cycle length.
 */
final class FunctionReorder implements ReversibleReorder {

    private final long size;
    private final LongUnaryOperator forward;

    FunctionReorder(long size, LongUnaryOperator forward) {
        if (size < 0 || size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Function reorders support domains up to 2^31-1: " + size);
        }
        this.size = size;
        this.forward = forward;
        Permutations.allLoops(size, forward);
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public long forward(long index) {
        checkIndex(index);
        return forward.applyAsLong(index);
    }

    @Override
    public long inverse(long index) {
        checkIndex(index);
        long current = index;
        while (true) {
            long next = forward.applyAsLong(current);
            if (next == index) {
                return current;
            }
            current = next;
        }
    }

    @Override
    public String toString() {
        return "FunctionReorder[size=" + size + "]";
    }
}
