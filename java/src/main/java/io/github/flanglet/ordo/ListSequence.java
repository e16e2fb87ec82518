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
import java.util.RandomAccess;

/**
 * A {@link Sequence} writing through to a random-access {@link List}.
 *
 * @param <E> the element type
 */
public final class ListSequence<E> implements Sequence<E> {

    private final List<E> list;

    /**
     * Constructs a sequence over the given list.
     *
     * @param list the backing list
     * @throws NullPointerException if the list is null
     * @throws IllegalArgumentException if the list does not provide constant-time indexed access
     */
    public ListSequence(List<E> list) {
        if (list == null)
            throw new NullPointerException("Invalid null list parameter");

        if ((list instanceof RandomAccess) == false)
            throw new IllegalArgumentException("The list must support random access, got "
                + list.getClass().getName());

        this.list = list;
    }

    @Override
    public E get(int idx) {
        return this.list.get(idx);
    }

    @Override
    public void set(int idx, E value) {
        this.list.set(idx, value);
    }

    @Override
    public int length() {
        return this.list.size();
    }
}
