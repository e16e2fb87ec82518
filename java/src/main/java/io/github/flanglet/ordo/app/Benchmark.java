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

package io.github.flanglet.ordo.app;

import io.github.flanglet.ordo.ElementComparator;
import io.github.flanglet.ordo.Sequence;
import io.github.flanglet.ordo.SortDispatcher;
import io.github.flanglet.ordo.Sorter;
import io.github.flanglet.ordo.util.sort.HeapSort;
import io.github.flanglet.ordo.util.sort.MergeSort;
import io.github.flanglet.ordo.util.sort.QuickSort;
import java.text.DecimalFormat;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Ordo Sort Benchmark
 *
 * Times each sorting algorithm over several input distributions and checks
 * that every output is ordered.
 *
 * Usage: java -cp ordo.jar io.github.flanglet.ordo.app.Benchmark [size] [runs]
 */
public class Benchmark {

    private static final DecimalFormat TIME_FORMAT = new DecimalFormat("0.000");
    private static final String[] DISTRIBUTIONS = {"RANDOM", "SORTED", "REVERSED", "FEW_VALUES", "ORGAN_PIPE"};

    private final int size;
    private final int runs;
    private final Random random;

    public static void main(String[] args) {
        int size = 100000;
        int runs = 5;

        try {
            if (args.length > 0)
                size = Integer.parseInt(args[0]);

            if (args.length > 1)
                runs = Integer.parseInt(args[1]);
        } catch (NumberFormatException e) {
            System.err.println("Usage: java -cp ordo.jar io.github.flanglet.ordo.app.Benchmark [size] [runs]");
            System.exit(io.github.flanglet.ordo.Error.ERR_INVALID_PARAM);
        }

        if ((size < 1) || (runs < 1)) {
            System.err.println("Error: size and runs must be positive");
            System.exit(io.github.flanglet.ordo.Error.ERR_INVALID_PARAM);
        }

        new Benchmark(size, runs).run();
    }

    public Benchmark(int size, int runs) {
        this.size = size;
        this.runs = runs;
        this.random = new Random(Long.MAX_VALUE);
    }

    public void run() {
        final ElementComparator<Integer> cmp = ElementComparator.natural();
        Map<String, Sorter<Integer>> sorters = new LinkedHashMap<>();
        sorters.put("QuickSort", new QuickSort<>(cmp));
        sorters.put("QuickSort+guard", new QuickSort<>(cmp, SortDispatcher.DEFAULT_THRESHOLD, true));
        sorters.put("MergeSort", new MergeSort<>(cmp));
        sorters.put("HeapSort", new HeapSort<>(cmp));

        System.out.println("Ordo Sort Benchmark");
        System.out.println("Elements: " + this.size + ", runs: " + this.runs);
        System.out.println();
        System.out.printf("%-12s %-16s %12s%n", "INPUT", "ALGORITHM", "TIME (ms)");
        System.out.printf("%-12s %-16s %12s%n", "------------", "----------------", "------------");

        for (String distribution : DISTRIBUTIONS) {
            final Integer[] source = this.generate(distribution);

            for (Map.Entry<String, Sorter<Integer>> entry : sorters.entrySet()) {
                final double ms = this.time(entry.getValue(), source, cmp);
                System.out.printf("%-12s %-16s %12s%n", distribution, entry.getKey(), TIME_FORMAT.format(ms));
            }

            final double ms = this.timeBaseline(source);
            System.out.printf("%-12s %-16s %12s%n", distribution, "Arrays.sort", TIME_FORMAT.format(ms));
        }
    }

    private double time(Sorter<Integer> sorter, Integer[] source, ElementComparator<Integer> cmp) {
        long total = 0;

        for (int r = 0; r < this.runs; r++) {
            final Integer[] data = Arrays.copyOf(source, source.length);
            final long before = System.nanoTime();
            sorter.sort(Sequence.of(data), 0, data.length);
            total += System.nanoTime() - before;

            for (int i = 1; i < data.length; i++) {
                if (cmp.precedes(data[i], data[i - 1])) {
                    throw new IllegalStateException("Output not sorted at index " + i + " (" + sorter.getClass().getSimpleName() + ")");
                }
            }
        }

        return total / (this.runs * 1000000.0);
    }

    private double timeBaseline(Integer[] source) {
        long total = 0;

        for (int r = 0; r < this.runs; r++) {
            final Integer[] data = Arrays.copyOf(source, source.length);
            final long before = System.nanoTime();
            Arrays.sort(data);
            total += System.nanoTime() - before;
        }

        return total / (this.runs * 1000000.0);
    }

    Integer[] generate(String distribution) {
        final Integer[] data = new Integer[this.size];

        for (int i = 0; i < this.size; i++) {
            switch (distribution) {
                case "SORTED":
                    data[i] = i;
                    break;

                case "REVERSED":
                    data[i] = this.size - i;
                    break;

                case "FEW_VALUES":
                    data[i] = this.random.nextInt(8);
                    break;

                case "ORGAN_PIPE":
                    data[i] = (i < this.size / 2) ? i : this.size - i;
                    break;

                default:
                    data[i] = this.random.nextInt();
            }
        }

        return data;
    }
}
