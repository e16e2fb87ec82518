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

import io.github.flanglet.ordo.Sequence;
import io.github.flanglet.ordo.SortDispatcher;
import io.github.flanglet.ordo.util.sort.SmallNetworkSort;
import java.util.Random;
import org.junit.Assert;
import org.junit.Test;

public class TestSmallNetworkSort {
    private final static Random RANDOM = new Random(Long.MAX_VALUE);
    private final static int[] NETWORK_SIZES = {0, 0, 1, 3, 5, 9};

    @Test
    public void testAllPermutations() {
        SmallNetworkSort<Integer> sorter = new SmallNetworkSort<>(Samples.NATURAL);

        for (int n = 0; n <= SmallNetworkSort.MAX_LENGTH; n++) {
            for (Integer[] perm : Samples.permutations(n)) {
                Integer[] data = perm.clone();
                Assert.assertTrue(sorter.sort(Sequence.of(data), 0, n));

                for (int i = 0; i < n; i++)
                    Assert.assertEquals(Integer.valueOf(i), data[i]);
            }
        }
    }

    @Test
    public void testDuplicates() {
        SmallNetworkSort<Integer> sorter = new SmallNetworkSort<>(Samples.NATURAL);

        for (int n = 2; n <= SmallNetworkSort.MAX_LENGTH; n++) {
            // Every array over {0, 1, 2} of length n
            int total = 1;

            for (int i = 0; i < n; i++)
                total *= 3;

            for (int code = 0; code < total; code++) {
                Integer[] data = new Integer[n];
                int c = code;

                for (int i = 0; i < n; i++) {
                    data[i] = c % 3;
                    c /= 3;
                }

                Integer[] input = data.clone();
                sorter.sort(Sequence.of(data), 0, n);
                Samples.assertSorted(data, Samples.NATURAL);
                Samples.assertSameElements(input, data);
            }
        }
    }

    @Test
    public void testComparisonCountIsFixed() {
        for (int n = 2; n <= SmallNetworkSort.MAX_LENGTH; n++) {
            for (Integer[] perm : Samples.permutations(n)) {
                Samples.CountingComparator<Integer> cmp = new Samples.CountingComparator<>(Samples.NATURAL);
                new SmallNetworkSort<Integer>(cmp).sort(Sequence.of(perm.clone()), 0, n);
                Assert.assertEquals("Length " + n, NETWORK_SIZES[n], cmp.count);
            }

            // Random inputs with repeated values cost the same
            for (int test = 0; test < 200; test++) {
                Integer[] data = Samples.generate(RANDOM, "FEW_VALUES", n);
                Samples.CountingComparator<Integer> cmp = new Samples.CountingComparator<>(Samples.NATURAL);
                new SmallNetworkSort<Integer>(cmp).sort(Sequence.of(data), 0, n);
                Assert.assertEquals("Length " + n, NETWORK_SIZES[n], cmp.count);
            }
        }
    }

    @Test
    public void testDispatcherUsesNetworks() {
        SortDispatcher dispatcher = new SortDispatcher();

        for (int n = 2; n <= SmallNetworkSort.MAX_LENGTH; n++) {
            for (Integer[] perm : Samples.permutations(n)) {
                Integer[] data = perm.clone();
                Samples.CountingComparator<Integer> cmp = new Samples.CountingComparator<>(Samples.NATURAL);
                dispatcher.sort(Sequence.of(data), cmp, false);
                Assert.assertEquals(NETWORK_SIZES[n], cmp.count);
                Samples.assertSorted(data, Samples.NATURAL);
            }
        }
    }

    @Test
    public void testSubRange() {
        Integer[] data = {9, 9, 4, 3, 2, 1, 0, 9, 9};
        Assert.assertTrue(new SmallNetworkSort<>(Samples.NATURAL).sort(Sequence.of(data), 2, 5));
        Assert.assertArrayEquals(new Integer[] {9, 9, 0, 1, 2, 3, 4, 9, 9}, data);
    }

    @Test
    public void testInvalidArguments() {
        SmallNetworkSort<Integer> sorter = new SmallNetworkSort<>(Samples.NATURAL);
        Integer[] data = {5, 4, 3, 2, 1, 0};
        Assert.assertFalse(sorter.sort(Sequence.of(data), 0, 6));
        Assert.assertFalse(sorter.sort(Sequence.of(data), -1, 2));
        Assert.assertFalse(sorter.sort(Sequence.of(data), 5, 2));
        Assert.assertArrayEquals(new Integer[] {5, 4, 3, 2, 1, 0}, data);
        Assert.assertTrue(sorter.sort(Sequence.of(data), 6, 0));
    }
}
