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

import java.util.Arrays;

/**
 * A growable stack of pending spans, used in place of recursive calls.
 *
 * <p>Each entry holds the start and end of a span plus the number of
 * partitions that produced it. Entries live in a single int array, three
 * slots per span.</p>
 */
final class PendingStack {

    private static final int STRIDE = 3;

    private int[] data;
    private int size;

    PendingStack(int capacity) {
        this.data = new int[Math.max(capacity, 1) * STRIDE];
    }

    /**
     * Estimates the stack height needed to sort {@code count} elements with
     * median-of-three pivots: {@code max(2, ceil(1.3 * log2(count)))}, using the
     * integer part of the logarithm.
     */
    static int estimateHeight(int count) {
        final int log2 = (count <= 1) ? 0 : 31 - Integer.numberOfLeadingZeros(count);
        return Math.max(2, (13 * log2 + 9) / 10);
    }

    void push(int start, int end, int depth) {
        int offset = this.size * STRIDE;

        if (offset == this.data.length)
            this.data = Arrays.copyOf(this.data, this.data.length << 1);

        this.data[offset] = start;
        this.data[offset + 1] = end;
        this.data[offset + 2] = depth;
        this.size++;
    }

    /**
     * Removes the top span. Read it first with {@link #start}, {@link #end}
     * and {@link #depth}.
     */
    void pop() {
        this.size--;
    }

    int start() {
        return this.data[(this.size - 1) * STRIDE];
    }

    int end() {
        return this.data[(this.size - 1) * STRIDE + 1];
    }

    int depth() {
        return this.data[(this.size - 1) * STRIDE + 2];
    }

    boolean isEmpty() {
        return this.size == 0;
    }

    int size() {
        return this.size;
    }

    int capacity() {
        return this.data.length / STRIDE;
    }
}
