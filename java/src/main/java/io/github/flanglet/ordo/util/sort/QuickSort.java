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
 * Iterative quicksort with median-of-three pivots.
 *
 * <p>Pending spans are kept on an explicit {@link PendingStack} rather than on
 * the call stack. Each popped span is handled by size:</p>
 * <ul>
 *   <li>at most 1 element: dropped,</li>
 *   <li>at most {@link SmallNetworkSort#MAX_LENGTH} elements: sorting network,</li>
 *   <li>fewer than the insertion threshold: {@link InsertionSort},</li>
 *   <li>otherwise: partitioned by {@link Partitioner}, sub-spans pushed back.</li>
 * </ul>
 *
 * <p>When the element right before a span does not precede the pivot, the span
 * begins with a run of elements equal to that pivot (the preceding element is
 * a former pivot, not after anything in the span). Such spans are partitioned
 * with {@link Partitioner#partitionLeft} and only their right part is kept, so
 * long runs of duplicates are consumed in linear time.</p>
 *
 * <p>The sort is not stable. Pivot selection is deterministic, so crafted inputs
 * can drive it to O(n²) comparisons. The optional worst case guard bounds the
 * partition depth to {@code 2*log2(n)} and finishes deeper spans with
 * {@link HeapSort}.</p>
 *
 * @param <E> the element type
 */
public class QuickSort<E> implements Sorter<E> {

    /**
     * Default length under which spans are insertion sorted.
     */
    public static final int DEFAULT_INSERTION_SORT_THRESHOLD = 32;

    private final ElementComparator<? super E> cmp;
    private final int threshold;
    private final boolean worstCaseGuard;

    /**
     * Creates a QuickSort instance with the default insertion threshold and
     * no worst case guard.
     *
     * @param cmp the element ordering
     */
    public QuickSort(ElementComparator<? super E> cmp) {
        this(cmp, DEFAULT_INSERTION_SORT_THRESHOLD, false);
    }

    /**
     * Creates a QuickSort instance.
     *
     * @param cmp the element ordering
     * @param threshold spans shorter than this value are insertion sorted, must be at least 2
     * @param worstCaseGuard {@code true} to fall back to heap sort on deep partitions
     * @throws NullPointerException if {@code cmp} is {@code null}
     * @throws IllegalArgumentException if {@code threshold} is less than 2
     */
    public QuickSort(ElementComparator<? super E> cmp, int threshold, boolean worstCaseGuard) {
        if (cmp == null)
            throw new NullPointerException("Invalid null comparator parameter");

        if (threshold < 2)
            throw new IllegalArgumentException("Invalid insertion sort threshold (must be at least 2): " + threshold);

        this.cmp = cmp;
        this.threshold = threshold;
        this.worstCaseGuard = worstCaseGuard;
    }

    @Override
    public boolean sort(Sequence<E> input, int blkptr, int len) {
        if ((blkptr < 0) || (len < 0) || (blkptr > input.length() - len))
            return false;

        if (len > 1)
            this.sortRange(input, blkptr, blkptr + len);

        return true;
    }

    private void sortRange(Sequence<E> s, int low, int high) {
        final ElementComparator<? super E> c = this.cmp;
        final int count = high - low;
        final int maxDepth = (this.worstCaseGuard == true) ?
            2 * (31 - Integer.numberOfLeadingZeros(count)) : Integer.MAX_VALUE;
        final PendingStack stack = new PendingStack(PendingStack.estimateHeight(count));
        stack.push(low, high, 0);

        while (stack.isEmpty() == false) {
            final int start = stack.start();
            final int end = stack.end();
            final int depth = stack.depth();
            stack.pop();
            final int length = end - start;

            if (length <= 1)
                continue;

            if (length <= SmallNetworkSort.MAX_LENGTH) {
                SmallNetworkSort.sortSpan(s, start, length, c);
                continue;
            }

            if (length < this.threshold) {
                InsertionSort.sortSpan(s, start, end, c);
                continue;
            }

            if (depth > maxDepth) {
                HeapSort.sortSpan(s, start, end, c);
                continue;
            }

            Partitioner.medianOfThree(s, start, end, c);

            if ((start > low) && (c.precedes(s.get(start - 1), s.get(start)) == false)) {
                // [start, pivot] is a run equal to the pivot, only the right part is left
                final int pivot = Partitioner.partitionLeft(s, start, end, c);

                if (end - pivot > 2)
                    stack.push(pivot + 1, end, depth + 1);

                continue;
            }

            final int pivot = Partitioner.partitionRight(s, start, end, c);

            if (end - pivot > 2)
                stack.push(pivot + 1, end, depth + 1);

            if (pivot - start > 1)
                stack.push(start, pivot, depth + 1);
        }
    }
}
