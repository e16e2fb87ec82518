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
 * Sorts spans of 2 to 5 elements with fixed compare-exchange networks.
 *
 * <p>The sequence of comparisons does not depend on the data: a span of
 * length 2, 3, 4 and 5 always costs 1, 3, 5 and 9 comparisons respectively.
 * The networks are not stable.</p>
 *
 * @param <E> the element type
 */
public final class SmallNetworkSort<E> implements Sorter<E> {

    /**
     * The longest span handled by a network.
     */
    public static final int MAX_LENGTH = 5;

    private final ElementComparator<? super E> cmp;

    /**
     * Creates a network sorter using the given ordering.
     *
     * @param cmp the element ordering
     * @throws NullPointerException if {@code cmp} is {@code null}
     */
    public SmallNetworkSort(ElementComparator<? super E> cmp) {
        if (cmp == null)
            throw new NullPointerException("Invalid null comparator parameter");

        this.cmp = cmp;
    }

    /**
     * Sorts up to 5 elements.
     *
     * @param input the sequence to sort
     * @param blkptr the index of the first element
     * @param len the number of elements, at most {@link #MAX_LENGTH}
     * @return {@code false} if the range is invalid or longer than {@link #MAX_LENGTH}
     */
    @Override
    public boolean sort(Sequence<E> input, int blkptr, int len) {
        if ((blkptr < 0) || (len < 0) || (blkptr > input.length() - len))
            return false;

        if (len > MAX_LENGTH)
            return false;

        sortSpan(input, blkptr, len, this.cmp);
        return true;
    }

    static <E> void sortSpan(Sequence<E> s, int blkptr, int len, ElementComparator<? super E> cmp) {
        final int i0 = blkptr;
        final int i1 = blkptr + 1;
        final int i2 = blkptr + 2;
        final int i3 = blkptr + 3;
        final int i4 = blkptr + 4;

        switch (len) {
            case 2:
                sort2(s, i0, i1, cmp);
                break;

            case 3:
                sort2(s, i0, i1, cmp);
                sort2(s, i1, i2, cmp);
                sort2(s, i0, i1, cmp);
                break;

            case 4:
                sort2(s, i0, i2, cmp);
                sort2(s, i1, i3, cmp);
                sort2(s, i0, i1, cmp);
                sort2(s, i2, i3, cmp);
                sort2(s, i1, i2, cmp);
                break;

            case 5:
                sort2(s, i0, i1, cmp);
                sort2(s, i3, i4, cmp);
                sortPartial3(s, i2, i3, i4, cmp);
                sort2(s, i1, i4, cmp);
                sortPartial3(s, i0, i2, i3, cmp);
                sortPartial3(s, i1, i2, i3, cmp);
                break;

            default:
                break;
        }
    }

    /**
     * Orders two slots: after the call {@code s[idx1]} does not precede {@code s[idx0]}.
     */
    static <E> void sort2(Sequence<E> s, int idx0, int idx1, ElementComparator<? super E> cmp) {
        if (cmp.precedes(s.get(idx1), s.get(idx0)))
            s.swap(idx0, idx1);
    }

    /**
     * Orders three slots in two comparisons. Requires {@code s[idx1]} and
     * {@code s[idx2]} to be ordered already.
     */
    static <E> void sortPartial3(Sequence<E> s, int idx0, int idx1, int idx2,
        ElementComparator<? super E> cmp) {
        final E a = s.get(idx0);
        final E b = s.get(idx1);
        final E c = s.get(idx2);
        final boolean r = cmp.precedes(c, a);
        final E t = (r == true) ? c : a;

        if (r == true)
            s.set(idx2, a);

        if (cmp.precedes(b, t)) {
            s.set(idx0, b);
            s.set(idx1, t);
        } else if (r == true) {
            s.set(idx0, t);
        }
    }
}
