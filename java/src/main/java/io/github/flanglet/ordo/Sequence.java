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

import java.util.List;

/**
 * A mutable, random-access, 0-indexed collection of elements. The sorting engine
 * never owns a sequence: it is handed exclusive access to it for the duration
 * of one call and mutates it through {@link #set} and {@link #swap} only, always
 * with in-bounds indexes.
 *
 * @param <E> the element type
 */
public interface Sequence<E> {

    /**
     * Returns the element at the given index.
     *
     * @param idx the index of the element, in {@code [0, length())}
     * @return the element at {@code idx}
     */
    public E get(int idx);

    /**
     * Replaces the element at the given index.
     *
     * @param idx the index of the element, in {@code [0, length())}
     * @param value the new element
     */
    public void set(int idx, E value);

    /**
     * Exchanges the elements at the two given indexes.
     *
     * @param idx0 the index of the first element
     * @param idx1 the index of the second element
     */
    public default void swap(int idx0, int idx1) {
        final E t = this.get(idx0);
        this.set(idx0, this.get(idx1));
        this.set(idx1, t);
    }

    /**
     * Returns the number of elements in this sequence.
     *
     * @return the number of elements
     */
    public int length();

    /**
     * Returns a sequence backed by the whole array.
     *
     * @param <E> the element type
     * @param array the backing array
     * @return a sequence writing through to {@code array}
     */
    public static <E> Sequence<E> of(E[] array) {
        return new SliceArray<>(array);
    }

    /**
     * Returns a sequence backed by a random-access list.
     *
     * @param <E> the element type
     * @param list the backing list, must implement {@link java.util.RandomAccess}
     * @return a sequence writing through to {@code list}
     */
    public static <E> Sequence<E> of(List<E> list) {
        return new ListSequence<>(list);
    }
}
