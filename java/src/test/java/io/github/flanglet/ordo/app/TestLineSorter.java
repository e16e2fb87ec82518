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
import io.github.flanglet.ordo.Error;
import io.github.flanglet.ordo.Sequence;
import io.github.flanglet.ordo.SortDispatcher;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestLineSorter {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testLexicalSort() throws IOException {
        Assert.assertEquals("apple\nfig\npear\n", run("pear\napple\nfig\n", new HashMap<>()));
    }

    @Test
    public void testNumericReverseSort() throws IOException {
        Map<String, Object> map = new HashMap<>();
        map.put("numeric", true);
        map.put("reverse", true);
        Assert.assertEquals("100\n10\n9\n-1.5\n", run("10\n9\n100\n-1.5\n", map));
    }

    @Test
    public void testStableNumericSort() throws IOException {
        Map<String, Object> map = new HashMap<>();
        map.put("numeric", true);
        map.put("stable", true);
        Assert.assertEquals("0.50\n1.0\n1\n1.00\n", run("1.0\n1\n0.50\n1.00\n", map));
    }

    @Test
    public void testRank() throws IOException {
        Map<String, Object> map = new HashMap<>();
        map.put("numeric", true);
        map.put("rank", 1);
        Assert.assertEquals("2\n", run("5\n3\n1\n4\n2\n", map));
    }

    @Test
    public void testRankTooLarge() throws IOException {
        Map<String, Object> map = this.options("a\nb\n");
        map.put("rank", 2);
        Assert.assertEquals(Error.ERR_INVALID_PARAM, (int) new LineSorter(map).call());
    }

    @Test
    public void testInvalidNumber() throws IOException {
        Map<String, Object> map = this.options("1\ntwo\n3\n");
        map.put("numeric", true);
        Assert.assertEquals(Error.ERR_INVALID_PARAM, (int) new LineSorter(map).call());
    }

    @Test
    public void testMissingInput() throws IOException {
        Map<String, Object> map = new HashMap<>();
        map.put("inputName", new File(this.folder.getRoot(), "missing.txt").getPath());
        map.put("outputName", new File(this.folder.getRoot(), "out.txt").getPath());
        map.put("verbose", 0);
        Assert.assertEquals(Error.ERR_OPEN_FILE, (int) new LineSorter(map).call());
    }

    @Test
    public void testOverwrite() throws IOException {
        Map<String, Object> map = this.options("b\na\n");
        File output = new File((String) map.get("outputName"));
        Files.write(output.toPath(), "old\n".getBytes(StandardCharsets.UTF_8));
        Assert.assertEquals(Error.ERR_OVERWRITE_FILE, (int) new LineSorter(map).call());
        Assert.assertEquals("old\n", read(output));

        map = this.options("b\na\n");
        map.put("outputName", output.getPath());
        map.put("overwrite", true);
        Assert.assertEquals(0, (int) new LineSorter(map).call());
        Assert.assertEquals("a\nb\n", read(output));
    }

    @Test
    public void testOutputIsDirectory() throws IOException {
        Map<String, Object> map = this.options("b\na\n");
        map.put("outputName", this.folder.newFolder("dir").getPath());
        Assert.assertEquals(Error.ERR_OUTPUT_IS_DIR, (int) new LineSorter(map).call());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidThreshold() throws IOException {
        Map<String, Object> map = this.options("a\n");
        map.put("threshold", 2);
        new LineSorter(map);
    }

    @Test
    public void testReadWriteLines() throws IOException {
        List<LineSorter.Line> lines = LineSorter.readLines(
            new ByteArrayInputStream("3\n 1 \n2".getBytes(StandardCharsets.UTF_8)), true);
        Assert.assertEquals(3, lines.size());
        Assert.assertEquals(" 1 ", lines.get(1).text);
        Assert.assertEquals(0, lines.get(1).number.compareTo(java.math.BigDecimal.ONE));

        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        LineSorter.writeLines(baos, lines);
        Assert.assertEquals("3\n 1 \n2\n", new String(baos.toByteArray(), StandardCharsets.UTF_8));
    }

    @Test
    public void testCommandLine() {
        Map<String, Object> map = new HashMap<>();
        String[] args = {
            "-i", "in.txt", "--output=out.txt", "-s", "-n", "-r", "-f", "-g", "--rank=3", "-t", "64", "--verbose=2"
        };
        Assert.assertEquals(0, Ordo.processCommandLine(args, map));
        Assert.assertEquals("in.txt", map.get("inputName"));
        Assert.assertEquals("out.txt", map.get("outputName"));
        Assert.assertEquals(Boolean.TRUE, map.get("stable"));
        Assert.assertEquals(Boolean.TRUE, map.get("numeric"));
        Assert.assertEquals(Boolean.TRUE, map.get("reverse"));
        Assert.assertEquals(Boolean.TRUE, map.get("overwrite"));
        Assert.assertEquals(Boolean.TRUE, map.get("worstCaseGuard"));
        Assert.assertEquals(3, map.get("rank"));
        Assert.assertEquals(64, map.get("threshold"));
        Assert.assertEquals(2, map.get("verbose"));

        map.clear();
        Assert.assertEquals(0, Ordo.processCommandLine(new String[0], map));
        Assert.assertEquals(1, map.size());
        Assert.assertEquals(1, map.get("verbose"));
    }

    @Test
    public void testInvalidCommandLine() {
        String[][] invalid = {
            {"--verbose=9"}, {"-v", "x"}, {"--rank=-2"}, {"-k", "one"},
            {"--threshold=5"}, {"-t", "2000"}
        };

        for (String[] args : invalid) {
            Map<String, Object> map = new HashMap<>();
            Assert.assertEquals(args[0], Error.ERR_INVALID_PARAM, Ordo.processCommandLine(args, map));
            Assert.assertTrue(map.isEmpty());
        }
    }

    @Test
    public void testInfoPrinter() {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        SortDispatcher dispatcher = new SortDispatcher();
        dispatcher.addListener(new InfoPrinter(3, new PrintStream(baos, true)));
        Integer[] data = new Integer[100];

        for (int i = 0; i < data.length; i++)
            data[i] = (i * 37) % 101;

        dispatcher.sort(Sequence.of(data), ElementComparator.<Integer>natural());
        dispatcher.partitionByRank(Sequence.of(data), 5, ElementComparator.<Integer>natural());
        String[] output = new String(baos.toByteArray(), StandardCharsets.UTF_8).trim().split("\\R");
        Assert.assertEquals(2, output.length);
        Assert.assertTrue(output[0], output[0].startsWith("Sort 1: 100 elements, QUICK ["));
        Assert.assertTrue(output[1], output[1].startsWith("Select 2: 100 elements, SELECT ["));

        // Raw events as well at the highest level
        baos.reset();
        dispatcher = new SortDispatcher();
        dispatcher.addListener(new InfoPrinter(5, new PrintStream(baos, true)));
        dispatcher.sort(Sequence.of(data), ElementComparator.<Integer>natural(), true);
        output = new String(baos.toByteArray(), StandardCharsets.UTF_8).trim().split("\\R");
        Assert.assertEquals(3, output.length);
        Assert.assertTrue(output[0], output[0].startsWith("{ \"type\":\"SORT_START\", \"id\":1, \"size\":100"));

        // Nothing below level 3
        baos.reset();
        dispatcher = new SortDispatcher();
        dispatcher.addListener(new InfoPrinter(2, new PrintStream(baos, true)));
        dispatcher.sort(Sequence.of(data), ElementComparator.<Integer>natural());
        Assert.assertEquals(0, baos.size());
    }

    // Sorts the given text with the given options through files
    private String run(String input, Map<String, Object> options) throws IOException {
        Map<String, Object> map = this.options(input);
        map.putAll(options);

        // The sorter consumes the options it reads
        File output = new File((String) map.get("outputName"));
        Assert.assertEquals(0, (int) new LineSorter(map).call());
        return read(output);
    }

    private Map<String, Object> options(String input) throws IOException {
        File in = this.folder.newFile();
        Files.write(in.toPath(), input.getBytes(StandardCharsets.UTF_8));
        Map<String, Object> map = new HashMap<>();
        map.put("inputName", in.getPath());
        map.put("outputName", new File(this.folder.getRoot(), in.getName() + ".out").getPath());
        map.put("verbose", 0);
        return map;
    }

    private static String read(File file) throws IOException {
        return new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
    }
}
