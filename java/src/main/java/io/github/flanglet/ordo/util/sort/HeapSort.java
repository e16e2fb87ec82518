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
 * The {@code HeapSort} class implements the heap sort algorithm, a
 * comparison-based sorting algorithm with an average and worst-case time
 * complexity of O(n log n).
 *
 * <p>
 * Heap sort works by first building a binary heap from the input data, and then
 * repeatedly extracting the maximum element from the heap and reconstructing
 * the heap. It is slower in practice than {@link QuickSort} and is only used by
 * it when the worst case guard is enabled and a span is partitioned too deeply.
 * </p>
 *
 * @param <E> the element type
 */
public final class HeapSort<E> implements Sorter<E> {

    // Comparator used for comparing elements in the sequence
    private final ElementComparator<? super E> cmp;

    /**
     * Constructs a {@code HeapSort} instance with the specified comparator.
     *
     * @param cmp
     *            the comparator to use for element comparisons
     * @throws NullPointerException if {@code cmp} is {@code null}
     */
    public HeapSort(ElementComparator<? super E> cmp) {
        if (cmp == null)
            throw new NullPointerException("Invalid null comparator parameter");

        this.cmp = cmp;
    }

    /**
     * Sorts the specified portion of the input sequence using the heap sort algorithm.
     *
     * @param input
     *            the sequence to be sorted.
     * @param blkptr
     *            the starting index of the portion to be sorted.
     * @param len
     *            the number of elements to sort.
     * @return {@code true} if the sorting was successful, {@code false} if invalid
     *         parameters were provided (out-of-bounds indices).
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
        final int count = end - start;

        // Build the heap from the last non-leaf node up
        for (int k = count >> 1; k > 0; k--)
            siftDown(s, start, k, count, cmp);

        // Repeatedly move the maximum to the end and restore the heap
        for (int i = count - 1; i > 0; i--) {
            s.swap(start, start + i);
            siftDown(s, start, 1, i, cmp);
        }
    }

    /**
     * Restores the heap property for the subtree rooted at node {@code idx}.
     * Nodes are numbered from 1, node {@code k} lives at {@code blkptr + k - 1}.
     */
    private static <E> void siftDown(Sequence<E> s, int blkptr, int idx, int count,
        ElementComparator<? super E> cmp) {
        int k = idx;
        final E temp = s.get(blkptr + k - 1);
        final int n = count >> 1;

        while (k <= n) {
            int j = k << 1;

            // If right child exists and is larger, use it instead
            if ((j < count) && (cmp.precedes(s.get(blkptr + j - 1), s.get(blkptr + j))))
                j++;

            if (cmp.precedes(temp, s.get(blkptr + j - 1)) == false)
                break;

            s.set(blkptr + k - 1, s.get(blkptr + j - 1));
            k = j;
        }

        s.set(blkptr + k - 1, temp);
    }
}
