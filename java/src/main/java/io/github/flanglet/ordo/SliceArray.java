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

import java.util.Objects;

/**
 * A lightweight {@link Sequence} over a window of an object array.
 *
 * <p>The slice covers {@code array[index, index+length)}. Sequence indexes are
 * relative to {@code index}, so sorting a slice never touches array slots
 * outside of the window.</p>
 *
 * @param <E> the element type
 */
public final class SliceArray<E> implements Sequence<E> {
    public final E[] array;
    public final int index;
    public final int length;

    /**
     * Constructs a {@code SliceArray} covering the whole array.
     *
     * @param array the backing array
     * @throws NullPointerException if the provided array is null
     */
    public SliceArray(E[] array) {
        this(array, 0, (array == null) ? 0 : array.length);
    }

    /**
     * Constructs a {@code SliceArray} with the specified array, index and length.
     *
     * @param array the backing array
     * @param idx the starting index of the slice
     * @param length the length of the slice
     * @throws NullPointerException if the provided array is null
     * @throws IllegalArgumentException if the window does not fit in the array
     */
    public SliceArray(E[] array, int idx, int length) {
        if (array == null)
            throw new NullPointerException("The array cannot be null");
        if ((idx < 0) || (length < 0))
            throw new IllegalArgumentException("The index and length cannot be negative");
        if (idx > array.length - length)
            throw new IllegalArgumentException("The slice [" + idx + ", " + ((long) idx + length)
                + ") exceeds the array length " + array.length);

        this.array = array;
        this.index = idx;
        this.length = length;
    }

    @Override
    public E get(int idx) {
        return this.array[this.index + idx];
    }

    @Override
    public void set(int idx, E value) {
        this.array[this.index + idx] = value;
    }

    @Override
    public void swap(int idx0, int idx1) {
        final int i = this.index + idx0;
        final int j = this.index + idx1;
        final E t = this.array[i];
        this.array[i] = this.array[j];
        this.array[j] = t;
    }

    @Override
    public int length() {
        return this.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;

        if ((o instanceof SliceArray) == false)
            return false;

        SliceArray<?> sa = (SliceArray<?>) o;
        return (this.array == sa.array) &&
               (this.length == sa.length) &&
               (this.index == sa.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(this.array), this.index, this.length);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(100);
        builder.append("[ data=");
        builder.append(this.array.getClass().getSimpleName());
        builder.append("@").append(Integer.toHexString(System.identityHashCode(this.array)));
        builder.append(", len=");
        builder.append(this.length);
        builder.append(", idx=");
        builder.append(this.index);
        builder.append("]");
        return builder.toString();
    }
}
