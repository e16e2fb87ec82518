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
 * Quickselect: rearranges a span so that a given rank holds the element a full
 * sort would put there.
 *
 * <p>After {@link #select}, {@code s[k]} is the k-th smallest element of the span,
 * the elements before {@code k} are not ordered after it and the elements after
 * {@code k} are not ordered before it. The order within each side is unspecified.
 * The live span is narrowed with {@link Partitioner} until the pivot lands on
 * {@code k}: O(n) comparisons on average, O(n²) in the worst case.</p>
 *
 * <p>For the k-th largest element, select with a {@link ElementComparator#reversed()}
 * ordering.</p>
 *
 * @param <E> the element type
 */
public class QuickSelect<E> {

    private final ElementComparator<? super E> cmp;

    /**
     * Creates a selector using the given ordering.
     *
     * @param cmp the element ordering
     * @throws NullPointerException if {@code cmp} is {@code null}
     */
    public QuickSelect(ElementComparator<? super E> cmp) {
        if (cmp == null)
            throw new NullPointerException("Invalid null comparator parameter");

        this.cmp = cmp;
    }

    /**
     * Partitions {@code len} elements starting at {@code blkptr} around rank {@code k}.
     *
     * @param input the sequence to rearrange
     * @param blkptr the index of the first element of the span
     * @param len the number of elements of the span
     * @param k the absolute index of the rank to settle, in {@code [blkptr, blkptr+len)}
     * @return {@code false} if the range or the rank is invalid
     */
    public boolean select(Sequence<E> input, int blkptr, int len, int k) {
        if ((blkptr < 0) || (len < 0) || (blkptr > input.length() - len))
            return false;

        if ((k < blkptr) || (k - blkptr >= len))
            return false;

        final ElementComparator<? super E> c = this.cmp;
        final int low = blkptr;
        int start = blkptr;
        int end = blkptr + len;

        while (end - start > 1) {
            Partitioner.medianOfThree(input, start, end, c);

            // Same duplicate run detection as QuickSort: s[start-1] is a former pivot
            if ((start > low) && (c.precedes(input.get(start - 1), input.get(start)) == false)) {
                final int pivot = Partitioner.partitionLeft(input, start, end, c);

                // [start, pivot] only holds values equal to the pivot
                if (k <= pivot)
                    return true;

                start = pivot + 1;
                continue;
            }

            final int pivot = Partitioner.partitionRight(input, start, end, c);

            if (pivot == k)
                return true;

            if (k < pivot)
                end = pivot;
            else
                start = pivot + 1;
        }

        return true;
    }
}
