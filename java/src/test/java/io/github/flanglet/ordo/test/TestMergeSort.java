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

package io.github.flanglet.ordo.test;

import io.github.flanglet.ordo.BufferAllocator;
import io.github.flanglet.ordo.ElementComparator;
import io.github.flanglet.ordo.Sequence;
import io.github.flanglet.ordo.SortException;
import io.github.flanglet.ordo.util.sort.MergeSort;
import java.util.Arrays;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestMergeSort {

    private static final Random RANDOM = new Random(123456789L);

    /**
     * Heap allocator keeping track of the buffers handed out.
     */
    private static class CountingAllocator implements BufferAllocator {
        int allocated;
        int released;

        @Override
        public Object[] allocate(int length) {
            this.allocated++;
            return new Object[length];
        }

        @Override
        public void release(Object[] buffer) {
            this.released++;
        }
    }

    @Test
    void testSortsAllDistributions() {
        for (String distribution : Samples.DISTRIBUTIONS) {
            for (int size : new int[] {0, 1, 2, 31, 32, 33, 64, 65, 100, 1000, 4097}) {
                Integer[] data = Samples.generate(RANDOM, distribution, size);
                Integer[] expected = data.clone();
                Arrays.sort(expected);
                Assertions.assertTrue(new MergeSort<>(Samples.NATURAL).sort(Sequence.of(data), 0, size));
                Assertions.assertArrayEquals(expected, data, distribution + " (size " + size + ")");
            }
        }
    }

    @Test
    void testStability() {
        for (int blockSize : new int[] {1, 2, 7, 32}) {
            for (int size : new int[] {32, 33, 100, 1000, 3000}) {
                Samples.Item[] data = Samples.items(RANDOM, size, 10);
                Assertions.assertTrue(new MergeSort<>(Samples.Item.BY_KEY, blockSize, BufferAllocator.HEAP)
                    .sort(Sequence.of(data), 0, size));
                Samples.assertSorted(data, Samples.Item.BY_KEY);
                Samples.assertStable(data);
            }
        }
    }

    @Test
    void testStableTuples() {
        Samples.Item[] data = {
            new Samples.Item(2, 0), new Samples.Item(1, 1), new Samples.Item(2, 2), new Samples.Item(1, 3)
        };
        new MergeSort<>(Samples.Item.BY_KEY, 1, BufferAllocator.HEAP).sort(Sequence.of(data), 0, 4);
        Assertions.assertEquals("[(1,1), (1,3), (2,0), (2,2)]", Arrays.toString(data));
    }

    @Test
    void testSortedInputMergesWithoutCopy() {
        final int n = 1024;
        Integer[] data = Samples.generate(RANDOM, "SORTED", n);
        Samples.CountingComparator<Integer> cmp = new Samples.CountingComparator<>(Samples.NATURAL);
        new MergeSort<Integer>(cmp).sort(Sequence.of(data), 0, n);

        // 31 comparisons per block of 32, then a single one per merge
        Assertions.assertEquals(n - 1, cmp.count);
    }

    @Test
    void testBufferReleasedOnce() {
        CountingAllocator allocator = new CountingAllocator();
        MergeSort<Integer> sorter = new MergeSort<>(Samples.NATURAL, 8, allocator);
        Integer[] data = Samples.generate(RANDOM, "RANDOM", 500);
        Assertions.assertTrue(sorter.sort(Sequence.of(data), 0, data.length));
        Assertions.assertEquals(1, allocator.allocated);
        Assertions.assertEquals(1, allocator.released);

        // Nothing to merge, nothing allocated
        Assertions.assertTrue(sorter.sort(Sequence.of(data), 10, 1));
        Assertions.assertEquals(1, allocator.allocated);
    }

    @Test
    void testOutOfMemory() {
        BufferAllocator allocator = (length) -> { throw new OutOfMemoryError("No memory for " + length); };
        Integer[] data = Samples.generate(RANDOM, "REVERSED", 100);
        Integer[] input = data.clone();
        SortException e = Assertions.assertThrows(SortException.class,
            () -> new MergeSort<>(Samples.NATURAL, 32, allocator).sort(Sequence.of(data), 0, data.length));
        Assertions.assertEquals(SortException.RESOURCE_EXHAUSTED, e.getErrorCode());
        Assertions.assertTrue(e.getCause() instanceof OutOfMemoryError);
        Assertions.assertArrayEquals(input, data);
    }

    @Test
    void testNullBuffer() {
        BufferAllocator allocator = (length) -> null;
        Integer[] data = Samples.generate(RANDOM, "RANDOM", 100);
        SortException e = Assertions.assertThrows(SortException.class,
            () -> new MergeSort<>(Samples.NATURAL, 32, allocator).sort(Sequence.of(data), 0, data.length));
        Assertions.assertEquals(SortException.RESOURCE_EXHAUSTED, e.getErrorCode());
    }

    @Test
    void testShortBufferIsReleased() {
        CountingAllocator allocator = new CountingAllocator() {
            @Override
            public Object[] allocate(int length) {
                this.allocated++;
                return new Object[length - 1];
            }
        };

        Integer[] data = Samples.generate(RANDOM, "RANDOM", 100);
        SortException e = Assertions.assertThrows(SortException.class,
            () -> new MergeSort<>(Samples.NATURAL, 32, allocator).sort(Sequence.of(data), 0, data.length));
        Assertions.assertEquals(SortException.RESOURCE_EXHAUSTED, e.getErrorCode());
        Assertions.assertEquals(1, allocator.released);
    }

    @Test
    void testComparatorFailureReleasesBuffer() {
        CountingAllocator allocator = new CountingAllocator();
        IllegalStateException failure = new IllegalStateException("Cannot compare");
        ElementComparator<Integer> cmp = (l, r) -> {
            if ((l == 0) || (r == 0))
                throw failure;

            return l < r;
        };

        Integer[] data = Samples.generate(RANDOM, "REVERSED", 200);
        data[150] = 0;
        IllegalStateException e = Assertions.assertThrows(IllegalStateException.class,
            () -> new MergeSort<>(cmp, 32, allocator).sort(Sequence.of(data), 0, data.length));
        Assertions.assertSame(failure, e);
        Assertions.assertEquals(1, allocator.allocated);
        Assertions.assertEquals(1, allocator.released);
    }

    @Test
    void testSubRange() {
        Integer[] data = Samples.generate(RANDOM, "RANDOM", 300);
        Integer[] input = data.clone();
        Assertions.assertTrue(new MergeSort<>(Samples.NATURAL, 4, BufferAllocator.HEAP).sort(Sequence.of(data), 50, 200));
        Samples.assertSorted(Sequence.of(data), 50, 250, Samples.NATURAL);
        Assertions.assertArrayEquals(Arrays.copyOfRange(input, 0, 50), Arrays.copyOfRange(data, 0, 50));
        Assertions.assertArrayEquals(Arrays.copyOfRange(input, 250, 300), Arrays.copyOfRange(data, 250, 300));
    }

    @Test
    void testInvalidArguments() {
        MergeSort<Integer> sorter = new MergeSort<>(Samples.NATURAL);
        Integer[] data = {3, 2, 1};
        Assertions.assertFalse(sorter.sort(Sequence.of(data), -1, 2));
        Assertions.assertFalse(sorter.sort(Sequence.of(data), 0, -1));
        Assertions.assertFalse(sorter.sort(Sequence.of(data), 2, 2));
        Assertions.assertArrayEquals(new Integer[] {3, 2, 1}, data);
        Assertions.assertThrows(IllegalArgumentException.class, () -> new MergeSort<>(Samples.NATURAL, 0, BufferAllocator.HEAP));
        Assertions.assertThrows(NullPointerException.class, () -> new MergeSort<>(Samples.NATURAL, 8, null));
    }
}
