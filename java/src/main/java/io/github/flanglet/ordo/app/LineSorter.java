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
import io.github.flanglet.ordo.SortException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;


/**
 * Sorts the lines of a text input, or extracts the line of a given rank.
 *
 * <p>Lines are compared as strings, or as decimal numbers in numeric mode. The
 * whole input is loaded in memory, sorted with a {@link SortDispatcher} and
 * written out. The returned value is 0 on success or one of the {@link Error}
 * codes.</p>
 */
public class LineSorter implements Callable<Integer>
{
   private static final String STDOUT = "STDOUT";
   private static final String STDIN = "STDIN";

   private final int verbosity;
   private final boolean overwrite;
   private final boolean stable;
   private final boolean numeric;
   private final boolean reverse;
   private final int rank;
   private final String inputName;
   private final String outputName;
   private final SortDispatcher dispatcher;


   /**
    * Constructs a {@code LineSorter} with the specified parameters.
    *
    * @param map a map containing the configuration options
    * @throws IllegalArgumentException if an option is invalid
    */
   public LineSorter(Map<String, Object> map)
   {
      this.inputName = map.containsKey("inputName") ? (String) map.remove("inputName") : STDIN;
      this.outputName = map.containsKey("outputName") ? (String) map.remove("outputName") : STDOUT;
      Boolean bForce = (Boolean) map.remove("overwrite");
      this.overwrite = (bForce == null) ? false : bForce;
      Boolean bStable = (Boolean) map.remove("stable");
      this.stable = (bStable == null) ? false : bStable;
      Boolean bNumeric = (Boolean) map.remove("numeric");
      this.numeric = (bNumeric == null) ? false : bNumeric;
      Boolean bReverse = (Boolean) map.remove("reverse");
      this.reverse = (bReverse == null) ? false : bReverse;
      Integer iRank = (Integer) map.remove("rank");
      this.rank = (iRank == null) ? -1 : iRank;

      if ((iRank != null) && (this.rank < 0))
         throw new IllegalArgumentException("Invalid rank (must be positive or zero, got " + this.rank + ")");

      Integer iVerbose = (Integer) map.remove("verbose");
      int verbose = (iVerbose == null) ? 1 : iVerbose;

      // The output goes to the console: do not interleave information messages
      if (STDOUT.equalsIgnoreCase(this.outputName))
         verbose = 0;

      this.verbosity = verbose;
      Map<String, Object> ctx = new HashMap<>();

      if (map.containsKey("threshold"))
         ctx.put("threshold", map.remove("threshold"));

      if (map.containsKey("worstCaseGuard"))
         ctx.put("worstCaseGuard", map.remove("worstCaseGuard"));

      this.dispatcher = new SortDispatcher(ctx);

      if (this.verbosity > 2)
         this.dispatcher.addListener(new InfoPrinter(this.verbosity, System.out));

      for (String k : map.keySet())
         printOut("Warning: Ignoring invalid option [" + k + "]", this.verbosity > 0);
   }


   /**
    * Reads, sorts (or selects) and writes the lines.
    *
    * @return 0 on success, an error code otherwise
    */
   @Override
   public Integer call()
   {
      List<Line> lines;

      try (InputStream is = this.openInput())
      {
         lines = readLines(is, this.numeric);
      }
      catch (FileNotFoundException e)
      {
         System.err.println("Cannot open input file '" + this.inputName + "': " + e.getMessage());
         return Error.ERR_OPEN_FILE;
      }
      catch (NumberFormatException e)
      {
         System.err.println("Invalid number in input '" + this.inputName + "': " + e.getMessage());
         return Error.ERR_INVALID_PARAM;
      }
      catch (IOException e)
      {
         System.err.println("Cannot read input '" + this.inputName + "': " + e.getMessage());
         return Error.ERR_READ_FILE;
      }

      printOut("Read " + lines.size() + " line" + ((lines.size() > 1) ? "s" : "")
         + " from '" + this.inputName + "'", this.verbosity > 1);

      if (this.rank >= lines.size())
      {
         System.err.println("Invalid rank " + this.rank + " for an input of " + lines.size() + " lines");
         return Error.ERR_INVALID_PARAM;
      }

      ElementComparator<Line> cmp = (this.numeric == true) ?
         ElementComparator.of(Comparator.comparing((Line l) -> l.number)) :
         ElementComparator.of(Comparator.comparing((Line l) -> l.text));

      if (this.reverse == true)
         cmp = cmp.reversed();

      final long before = System.nanoTime();

      try
      {
         if (this.rank >= 0)
         {
            this.dispatcher.partitionByRank(Sequence.of(lines), this.rank, cmp);
            Line selected = lines.get(this.rank);
            lines.clear();
            lines.add(selected);
         }
         else
         {
            this.dispatcher.sort(Sequence.of(lines), cmp, this.stable);
         }
      }
      catch (SortException e)
      {
         System.err.println("Sort failure: " + e.getMessage());
         return (e.getErrorCode() == SortException.RESOURCE_EXHAUSTED) ?
            Error.ERR_RESOURCE_EXHAUSTED : Error.ERR_INVALID_PARAM;
      }

      final long after = System.nanoTime();
      printOut("Processing time: " + ((after - before) / 1000000L) + " ms", this.verbosity > 1);

      final int status = this.checkOutput();

      if (status != 0)
         return status;

      try (OutputStream os = this.openOutput())
      {
         writeLines(os, lines);
      }
      catch (IOException e)
      {
         System.err.println("Cannot write output '" + this.outputName + "': " + e.getMessage());
         return Error.ERR_WRITE_FILE;
      }

      printOut("Wrote " + lines.size() + " line" + ((lines.size() > 1) ? "s" : "")
         + " to '" + this.outputName + "'", this.verbosity > 1);
      return 0;
   }


   private InputStream openInput() throws IOException
   {
      if (STDIN.equalsIgnoreCase(this.inputName))
         return new NonClosingInputStream(System.in);

      return new FileInputStream(this.inputName);
   }


   private int checkOutput()
   {
      if (STDOUT.equalsIgnoreCase(this.outputName))
         return 0;

      File output = new File(this.outputName);

      if (output.exists() == false)
         return 0;

      if (output.isDirectory())
      {
         System.err.println("The output file is a directory");
         return Error.ERR_OUTPUT_IS_DIR;
      }

      if (this.overwrite == false)
      {
         System.err.println("File '" + this.outputName + "' exists and " +
            "the 'force' command line option has not been provided");
         return Error.ERR_OVERWRITE_FILE;
      }

      return 0;
   }


   private OutputStream openOutput() throws IOException
   {
      if (STDOUT.equalsIgnoreCase(this.outputName))
         return new NonClosingOutputStream(System.out);

      return new FileOutputStream(this.outputName);
   }


   static List<Line> readLines(InputStream is, boolean numeric) throws IOException
   {
      List<Line> lines = new ArrayList<>();
      BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
      String s;

      while ((s = reader.readLine()) != null)
         lines.add(new Line(s, (numeric == true) ? new BigDecimal(s.trim()) : null));

      return lines;
   }


   static void writeLines(OutputStream os, List<Line> lines) throws IOException
   {
      Writer writer = new BufferedWriter(new OutputStreamWriter(os, StandardCharsets.UTF_8));

      for (Line l : lines)
      {
         writer.write(l.text);
         writer.write('\n');
      }

      writer.flush();
   }


   private static void printOut(String msg, boolean print)
   {
      if ((print == true) && (msg != null))
         System.out.println(msg);
   }


   static final class Line
   {
      final String text;
      final BigDecimal number;

      Line(String text, BigDecimal number)
      {
         this.text = text;
         this.number = number;
      }
   }


   // Keeps System.in open when the input is closed
   static final class NonClosingInputStream extends java.io.FilterInputStream
   {
      NonClosingInputStream(InputStream is)
      {
         super(is);
      }

      @Override
      public void close()
      {
         // System.in stays open
      }
   }


   // Flushes System.out instead of closing it
   static final class NonClosingOutputStream extends java.io.FilterOutputStream
   {
      NonClosingOutputStream(OutputStream os)
      {
         super(os);
      }

      @Override
      public void write(byte[] b, int off, int len) throws IOException
      {
         this.out.write(b, off, len);
      }

      @Override
      public void close() throws IOException
      {
         this.flush();
      }
   }
}
