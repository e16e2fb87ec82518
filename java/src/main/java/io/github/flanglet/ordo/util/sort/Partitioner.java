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

/**
 * Median-of-three Hoare-style partitioning shared by {@link QuickSort} and
 * {@link QuickSelect}.
 *
 * <p>The pivot always sits at the first slot of the span when a partition
 * starts ({@link #medianOfThree} puts it there) and at the returned index when
 * it ends. Two cursors move inward and exchange misplaced elements; both stop
 * on index bounds, never on comparator outcomes alone.</p>
 *
 * <ul>
 *   <li>{@link #partitionRight}: {@code [start, p)} precedes the pivot, {@code (p, end)} does not.
 *       Elements equal to the pivot end up on the right.</li>
 *   <li>{@link #partitionLeft}: {@code [start, p)} is not after the pivot, {@code (p, end)} is.
 *       Elements equal to the pivot end up on the left.</li>
 * </ul>
 */
public final class Partitioner {

    private Partitioner() {
    }

    /**
     * Moves the median of the first, middle and last elements to {@code start}
     * using three compare-exchanges. Spans shorter than 3 keep their first
     * element as the pivot.
     *
     * @param <E> the element type
     * @param s the sequence
     * @param start the first index of the span
     * @param end the index past the last element of the span
     * @param cmp the element ordering
     */
    public static <E> void medianOfThree(Sequence<E> s, int start, int end, ElementComparator<? super E> cmp) {
        final int length = end - start;

        if (length < 3)
            return;

        final int mid = start + (length >> 1);
        final int last = end - 1;

        // Order the slots (mid, start, last): the median lands at start
        SmallNetworkSort.sort2(s, mid, start, cmp);
        SmallNetworkSort.sort2(s, start, last, cmp);
        SmallNetworkSort.sort2(s, mid, start, cmp);
    }

    /**
     * Selects a median-of-three pivot and partitions the span around it with
     * {@link #partitionRight}.
     *
     * @param <E> the element type
     * @param s the sequence
     * @param start the first index of the span
     * @param end the index past the last element, with {@code end - start >= 2}
     * @param cmp the element ordering
     * @return the final index of the pivot
     */
    public static <E> int partition(Sequence<E> s, int start, int end, ElementComparator<? super E> cmp) {
        medianOfThree(s, start, end, cmp);
        return partitionRight(s, start, end, cmp);
    }

    /**
     * Partitions the span around the pivot stored at {@code start}, sending the
     * elements equal to the pivot to the right.
     *
     * @param <E> the element type
     * @param s the sequence
     * @param start the first index of the span, holding the pivot
     * @param end the index past the last element, with {@code end - start >= 2}
     * @param cmp the element ordering
     * @return the final index of the pivot
     */
    public static <E> int partitionRight(Sequence<E> s, int start, int end, ElementComparator<? super E> cmp) {
        final E pivot = s.get(start);
        int left = start + 1;
        int right = end - 1;

        while (true) {
            while ((left <= right) && (cmp.precedes(s.get(left), pivot)))
                left++;

            while ((left <= right) && (cmp.precedes(s.get(right), pivot) == false))
                right--;

            if (left > right)
                break;

            s.swap(left, right);
            left++;
            right--;
        }

        // right == left - 1 is the last slot preceding the pivot (or start)
        if (right != start)
            s.swap(start, right);

        return right;
    }

    /**
     * Partitions the span around the pivot stored at {@code start}, sending the
     * elements equal to the pivot to the left.
     *
     * @param <E> the element type
     * @param s the sequence
     * @param start the first index of the span, holding the pivot
     * @param end the index past the last element, with {@code end - start >= 2}
     * @param cmp the element ordering
     * @return the final index of the pivot
     */
    public static <E> int partitionLeft(Sequence<E> s, int start, int end, ElementComparator<? super E> cmp) {
        final E pivot = s.get(start);
        int left = start + 1;
        int right = end - 1;

        while (true) {
            while ((left <= right) && (cmp.precedes(pivot, s.get(left)) == false))
                left++;

            while ((left <= right) && (cmp.precedes(pivot, s.get(right))))
                right--;

            if (left > right)
                break;

            s.swap(left, right);
            left++;
            right--;
        }

        if (right != start)
            s.swap(start, right);

        return right;
    }
}
