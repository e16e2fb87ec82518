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

package io.github.flanglet.ordo;

import java.util.Comparator;

/**
 * This interface defines the ordering used by the sorters: a boolean predicate
 * telling whether an element must be placed before another one.
 *
 * <p>Implementations must define a strict weak ordering (irreflexive, asymmetric
 * and transitive). Other relations do not break the sorters (every loop is
 * bounded by indexes) but the resulting order is unspecified.</p>
 *
 * @param <E> the element type
 */
public interface ElementComparator<E> {

    /**
     * Tells whether the left element must sort before the right element.
     *
     * @param left the left element
     * @param right the right element
     * @return {@code true} if {@code left} is ordered strictly before {@code right}
     */
    public boolean precedes(E left, E right);

    /**
     * Returns a comparator imposing the reverse ordering.
     *
     * @return the reversed comparator
     */
    public default ElementComparator<E> reversed() {
        final ElementComparator<E> self = this;
        return (left, right) -> self.precedes(right, left);
    }

    /**
     * Returns a comparator using the natural ordering of the elements.
     *
     * @param <E> the element type
     * @return the natural "less than" comparator
     */
    public static <E extends Comparable<? super E>> ElementComparator<E> natural() {
        return (left, right) -> left.compareTo(right) < 0;
    }

    /**
     * Adapts a {@link Comparator} to an {@code ElementComparator}.
     *
     * @param <E> the element type
     * @param cmp the three-way comparator
     * @return a comparator answering {@code cmp.compare(left, right) < 0}
     * @throws NullPointerException if {@code cmp} is {@code null}
     */
    public static <E> ElementComparator<E> of(Comparator<? super E> cmp) {
        if (cmp == null)
            throw new NullPointerException("Invalid null comparator parameter");

        return (left, right) -> cmp.compare(left, right) < 0;
    }
}
