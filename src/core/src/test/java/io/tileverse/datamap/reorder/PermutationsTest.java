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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.tileverse.datamap.IncompleteMappingException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PermutationsTest {

    @Test
    void testSingleCycle() {
        List<long[]> loops = Permutations.allLoops(new long[] {2, 0, 1}, 3);

        assertEquals(1, loops.size());
        assertThat(loops.get(0)).containsExactly(0, 2, 1);
    }

    @Test
    void testCycleAndFixedPoint() {
        List<long[]> loops = Permutations.allLoops(new long[] {1, 0, 2}, 3);

        assertEquals(2, loops.size());
        assertThat(loops.get(0)).containsExactly(0, 1);
        assertThat(loops.get(1)).containsExactly(2);
    }

    @Test
    void testUnmappedIndexIsIncomplete() {
        assertThrows(IncompleteMappingException.class, () -> Permutations.allLoops(new long[] {1, 2}, 3));
        assertThrows(IncompleteMappingException.class, () -> Permutations.allLoops(Map.of(0L, 1L, 1L, 2L), 3));
    }

    @Test
    void testSharedImageIsIncomplete() {
        assertThrows(IncompleteMappingException.class, () -> Permutations.allLoops(new long[] {1, 1, 0}, 3));
        assertThrows(IncompleteMappingException.class, () -> Permutations.allLoops(4, i -> i / 2));
    }

    @Test
    void testImageOutsideDomainIsIncomplete() {
        assertThrows(IncompleteMappingException.class, () -> Permutations.allLoops(new long[] {0, 3, 1}, 3));
        assertThrows(
                IncompleteMappingException.class, () -> Permutations.allLoops(Map.of(0L, 1L, 1L, 0L, 5L, 2L), 3));
    }

    @Test
    void testMapMapping() {
        List<long[]> loops = Permutations.allLoops(Map.of(0L, 2L, 1L, 0L, 2L, 1L), 3);

        assertEquals(1, loops.size());
        assertThat(loops.get(0)).containsExactly(0, 2, 1);
    }

    @Test
    void testEmptyDomain() {
        assertThat(Permutations.allLoops(new long[0], 0)).isEmpty();
        assertThrows(IllegalArgumentException.class, () -> Permutations.allLoops(new long[0], -1));
    }

    @Test
    void testPivots() {
        assertThat(Permutations.pivots(ReversibleReorder.of(0, 2, 4, 1, 3, 5))).containsExactly(3L);
        assertThat(Permutations.pivots(Reorders.identity(10))).isEmpty();
        assertThat(Permutations.pivots(Reorders.columnMajor(3, 2))).containsExactly(3L);
    }

    @Test
    void testDivisionsAreRankedBySubdivisors() {
        assertThat(Permutations.divisions(12, 1, 12)).containsExactly(12, 6, 4, 1, 2, 3);
        assertThat(Permutations.divisions(12, 3, 6)).containsExactly(6, 4, 3);
        assertThat(Permutations.divisions(7, 2, 6)).isEmpty();
        assertThrows(IllegalArgumentException.class, () -> Permutations.divisions(0, 1, 2));
    }

    @Test
    void testGcd() {
        assertEquals(6, Permutations.gcd(12, 18));
        assertEquals(5, Permutations.gcd(5, 0));
        assertEquals(1, Permutations.gcd(7, 12));
    }
}
