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

/**
 * This interface defines a sorter for a portion of a {@link Sequence}.
 *
 * @param <E> the element type
 */
public interface Sorter<E> {

    /**
     * Sorts {@code len} elements of the sequence starting at {@code blkptr}.
     *
     * @param input the sequence to sort in place
     * @param blkptr the index of the first element to sort
     * @param len the number of elements to sort
     * @return {@code false} if the range is invalid, {@code true} otherwise
     */
    public boolean sort(Sequence<E> input, int blkptr, int len);
}
