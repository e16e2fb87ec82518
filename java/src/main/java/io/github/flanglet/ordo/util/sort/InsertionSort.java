/*
Copyright 2011-2025 Frederic Langlet
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package io.github.flanglet.ordo.util.sort;

import io.github.flanglet.ordo.ElementComparator;
import io.github.flanglet.ordo.Sequence;
import io.github.flanglet.ordo.Sorter;

/**
 * The {@code InsertionSort} class implements the insertion sort algorithm, a simple comparison-based sorting algorithm with
 * a worst-case time complexity of O(n²) and a complexity of O(n+d), where d is the number of inversions.
 *
 * <p>Each element is shifted left past the preceding elements it must sort before, then inserted. Elements are
 * never moved past an equal element, which makes the sort stable. It is used for short spans by {@link QuickSort}
 * and to pre-sort the blocks of {@link MergeSort}.</p>
 *
 * @param <E> the element type
 */
public class InsertionSort<E> implements Sorter<E> {

    // Comparator used for comparing elements in the sequence
    private final ElementComparator<? super E> cmp;

    /**
     * Constructs an {@code InsertionSort} instance with the specified comparator.
     *
     * @param cmp the comparator to use for element comparisons
     * @throws NullPointerException if {@code cmp} is {@code null}
     */
    public InsertionSort(ElementComparator<? super E> cmp) {
        if (cmp == null)
            throw new NullPointerException("Invalid null comparator parameter");

        this.cmp = cmp;
    }

    /**
     * Sorts the specified portion of the input sequence using the insertion sort algorithm.
     *
     * @param input the sequence to be sorted.
     * @param blkptr the starting index of the portion to be sorted.
     * @param len the number of elements to sort.
     * @return {@code true} if the sorting was successful, {@code false} if invalid parameters were provided (e.g., out-of-bounds indices).
     */
    @Override
    public boolean sort(Sequence<E> input, int blkptr, int len) {
        if ((blkptr < 0) || (len < 0) || (blkptr > input.length() - len))
            return false;

        if (len > 1)
            sortSpan(input, blkptr, blkptr + len, this.cmp);

        return true;
    }

    static <E> void sortSpan(Sequence<E> s, int start, int end, ElementComparator<? super E> cmp) {
        for (int i = start + 1; i < end; i++) {
            final E val = s.get(i);
            int j = i;

            while ((j > start) && (cmp.precedes(val, s.get(j - 1)))) {
                s.set(j, s.get(j - 1));
                j--;
            }

            if (j != i)
                s.set(j, val);
        }
    }
}
