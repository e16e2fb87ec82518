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
 * Supplies the temporary buffers used by the stable merge sort.
 *
 * <p>A buffer obtained from {@link #allocate} is always handed back to
 * {@link #release} once the sort returns, whether it completed or failed.</p>
 */
public interface BufferAllocator {

    /**
     * Allocates buffers on the Java heap.
     */
    public static final BufferAllocator HEAP = Object[]::new;

    /**
     * Returns a buffer of at least {@code length} slots.
     *
     * @param length the requested number of slots
     * @return the buffer
     * @throws OutOfMemoryError if the buffer cannot be allocated
     */
    public Object[] allocate(int length);

    /**
     * Reclaims a buffer previously returned by {@link #allocate}. Heap buffers
     * are left to the garbage collector.
     *
     * @param buffer the buffer to reclaim
     */
    public default void release(Object[] buffer) {
        // heap buffers need no explicit reclaim
    }
}
