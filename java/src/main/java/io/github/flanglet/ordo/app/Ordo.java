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

import io.github.flanglet.ordo.SortDispatcher;
import java.util.HashMap;
import java.util.Map;



/**
 * The {@code Ordo} class is a command-line application sorting the lines of a
 * text file, or extracting the line of a given rank.
 *
 * <p>It processes the command line arguments into a map of options and hands
 * them to a {@link LineSorter}.</p>
 */
public class Ordo
{
   private static final String[] CMD_LINE_ARGS = new String[]
   {
      "-i", "-o", "-v", "-k", "-t", "-s", "-n", "-r", "-g", "-f", "-h"
   };

   private static final int ARG_IDX_INPUT = 0;
   private static final int ARG_IDX_OUTPUT = 1;
   private static final int ARG_IDX_VERBOSE = 2;
   private static final int ARG_IDX_RANK = 3;
   private static final int ARG_IDX_THRESHOLD = 4;

   private static final String ORDO_VERSION = "1.0.0";
   private static final String APP_HEADER = "Ordo " + ORDO_VERSION + " (c) Frederic Langlet";
   private static final String APP_SUB_HEADER = "In-memory line sorter.";
   private static final String APP_USAGE = "Usage: java -jar ordo.jar [flags and files in any order]";


   /**
    * The main method that serves as the entry point for the Ordo application.
    *
    * @param args command line arguments passed to the application
    */
   public static void main(String[] args)
   {
      Map<String, Object> map = new HashMap<>();
      int status = processCommandLine(args, map);

      // Command line processing error ?
      if (status != 0)
         System.exit(status);

      // Help mode only ?
      if (map.containsKey("help"))
         System.exit(0);

      LineSorter ls = null;

      try
      {
         ls = new LineSorter(map);
      }
      catch (Exception e)
      {
         System.err.println("Could not create the line sorter: " + e.getMessage());
         System.exit(io.github.flanglet.ordo.Error.ERR_INVALID_PARAM);
      }

      int code;

      try
      {
         code = ls.call();
      }
      catch (RuntimeException e)
      {
         System.err.println("An unexpected error occurred: " + e.getMessage());
         code = io.github.flanglet.ordo.Error.ERR_UNKNOWN;
      }

      System.exit(code);
   }


    /**
     * Processes the command line arguments and populates the provided map with options.
     *
     * @param args the command line arguments
     * @param map a map to store processed options and their values
     * @return 0 if the arguments are valid, an error code otherwise
     */
    static int processCommandLine(String[] args, Map<String, Object> map)
    {
        int verbose = 1;
        int rank = -1;
        int threshold = -1;
        boolean overwrite = false;
        boolean stable = false;
        boolean numeric = false;
        boolean reverse = false;
        boolean guard = false;
        boolean showHelp = false;
        String inputName = "";
        String outputName = "";
        int ctx = -1;

        for (String arg : args)
        {
           arg = arg.trim();

           if (arg.equals("--help") || arg.equals("-h"))
           {
              showHelp = true;
              ctx = -1;
              continue;
           }

           if (arg.equals("--force") || arg.equals("-f"))
           {
              if (ctx != -1)
                 printWarning(CMD_LINE_ARGS[ctx], " with no value.", verbose);

              overwrite = true;
              ctx = -1;
              continue;
           }

           if (arg.equals("--stable") || arg.equals("-s"))
           {
              if (ctx != -1)
                 printWarning(CMD_LINE_ARGS[ctx], " with no value.", verbose);

              stable = true;
              ctx = -1;
              continue;
           }

           if (arg.equals("--numeric") || arg.equals("-n"))
           {
              if (ctx != -1)
                 printWarning(CMD_LINE_ARGS[ctx], " with no value.", verbose);

              numeric = true;
              ctx = -1;
              continue;
           }

           if (arg.equals("--reverse") || arg.equals("-r"))
           {
              if (ctx != -1)
                 printWarning(CMD_LINE_ARGS[ctx], " with no value.", verbose);

              reverse = true;
              ctx = -1;
              continue;
           }

           if (arg.equals("--guard") || arg.equals("-g"))
           {
              if (ctx != -1)
                 printWarning(CMD_LINE_ARGS[ctx], " with no value.", verbose);

              guard = true;
              ctx = -1;
              continue;
           }

           if (ctx == -1)
           {
              int idx = -1;

              for (int i=0; i<CMD_LINE_ARGS.length; i++)
              {
                 if (CMD_LINE_ARGS[i].equals(arg))
                 {
                    idx = i;
                    break;
                 }
              }

              if (idx != -1)
              {
                 ctx = idx;
                 continue;
              }
           }

           if (arg.startsWith("--input=") || (ctx == ARG_IDX_INPUT))
           {
              String name = arg.startsWith("--input=") ? arg.substring(8).trim() : arg;

              if (!inputName.isEmpty())
                 printWarning((ctx == ARG_IDX_INPUT) ? CMD_LINE_ARGS[ctx] : "--input", " (duplicate input name).", verbose);
              else
                 inputName = name;

              ctx = -1;
              continue;
           }

           if (arg.startsWith("--output=") || (ctx == ARG_IDX_OUTPUT))
           {
              String name = arg.startsWith("--output=") ? arg.substring(9).trim() : arg;

              if (!outputName.isEmpty())
                 printWarning((ctx == ARG_IDX_OUTPUT) ? CMD_LINE_ARGS[ctx] : "--output", " (duplicate output name).", verbose);
              else
                 outputName = name;

              ctx = -1;
              continue;
           }

           if (arg.startsWith("--verbose=") || (ctx == ARG_IDX_VERBOSE))
           {
              String verboseLevel = arg.startsWith("--verbose=") ? arg.substring(10).trim() : arg;

              try
              {
                 verbose = Integer.parseInt(verboseLevel);

                 if ((verbose < 0) || (verbose > 5))
                    throw new NumberFormatException();
              }
              catch (NumberFormatException e)
              {
                 System.err.println("Invalid verbosity level provided on command line: "+arg);
                 return io.github.flanglet.ordo.Error.ERR_INVALID_PARAM;
              }

              ctx = -1;
              continue;
           }

           if (arg.startsWith("--rank=") || (ctx == ARG_IDX_RANK))
           {
              String strRank = arg.startsWith("--rank=") ? arg.substring(7).trim() : arg;

              try
              {
                 rank = Integer.parseInt(strRank);

                 if (rank < 0)
                    throw new NumberFormatException();
              }
              catch (NumberFormatException e)
              {
                 System.err.println("Invalid rank provided on command line: "+arg);
                 return io.github.flanglet.ordo.Error.ERR_INVALID_PARAM;
              }

              ctx = -1;
              continue;
           }

           if (arg.startsWith("--threshold=") || (ctx == ARG_IDX_THRESHOLD))
           {
              String strThreshold = arg.startsWith("--threshold=") ? arg.substring(12).trim() : arg;

              try
              {
                 threshold = Integer.parseInt(strThreshold);

                 if ((threshold < SortDispatcher.MIN_THRESHOLD) || (threshold > SortDispatcher.MAX_THRESHOLD))
                    throw new NumberFormatException();
              }
              catch (NumberFormatException e)
              {
                 System.err.println("Invalid insertion sort threshold provided on command line: "+arg
                    + " (must be in [" + SortDispatcher.MIN_THRESHOLD + ".." + SortDispatcher.MAX_THRESHOLD + "])");
                 return io.github.flanglet.ordo.Error.ERR_INVALID_PARAM;
              }

              ctx = -1;
              continue;
           }

           printWarning(arg, "(unknown option).", verbose);
           ctx = -1;
        }

        if (ctx != -1)
           printWarning(CMD_LINE_ARGS[ctx], " with no value.", verbose);

        if (showHelp == true)
        {
           printHelp();
           map.put("help", true);
           return 0;
        }

        if (!inputName.isEmpty())
           map.put("inputName", inputName);

        if (!outputName.isEmpty())
           map.put("outputName", outputName);

        if (rank >= 0)
           map.put("rank", rank);

        if (threshold >= 0)
           map.put("threshold", threshold);

        if (overwrite == true)
           map.put("overwrite", true);

        if (stable == true)
           map.put("stable", true);

        if (numeric == true)
           map.put("numeric", true);

        if (reverse == true)
           map.put("reverse", true);

        if (guard == true)
           map.put("worstCaseGuard", true);

        map.put("verbose", verbose);
        return 0;
    }


    private static void printHelp()
    {
      printOut("", true);
      printOut(APP_HEADER+"\n", true);
      printOut(APP_SUB_HEADER, true);
      printOut(APP_USAGE, true);
      printOut("", true);
      printOut("   -h, --help", true);
      printOut("        Display this message\n", true);
      printOut("   -i, --input=<inputName>", true);
      printOut("        Name of the input file (default STDIN)\n", true);
      printOut("   -o, --output=<outputName>", true);
      printOut("        Name of the output file (default STDOUT)\n", true);
      printOut("   -f, --force", true);
      printOut("        Overwrite the output file if it already exists\n", true);
      printOut("   -s, --stable", true);
      printOut("        Keep equal lines in their input order\n", true);
      printOut("   -n, --numeric", true);
      printOut("        Compare lines as decimal numbers\n", true);
      printOut("   -r, --reverse", true);
      printOut("        Sort in descending order\n", true);
      printOut("   -k, --rank=<rank>", true);
      printOut("        Only output the line of the given rank (0 for the first line)\n", true);
      printOut("   -t, --threshold=<size>", true);
      printOut("        Span length under which insertion sort is used, in ["
         + SortDispatcher.MIN_THRESHOLD + ".." + SortDispatcher.MAX_THRESHOLD + "] (default "
         + SortDispatcher.DEFAULT_THRESHOLD + ")\n", true);
      printOut("   -g, --guard", true);
      printOut("        Bound the unstable sort to O(n log n) comparisons\n", true);
      printOut("   -v, --verbose=<level>", true);
      printOut("        0=silent, 1=default, 2=display details, 3=display timings,", true);
      printOut("        5=display all events\n", true);
      printOut("", true);
      printOut("EG. java -jar ordo.jar -i names.txt -o sorted.txt -s", true);
      printOut("EG. java -jar ordo.jar --input=values.txt --numeric --rank=10", true);
    }


    private static void printWarning(String val, String reason, int verbose)
    {
         String msg = String.format("Warning: Ignoring option [%s] %s", val, reason);
         printOut(msg, verbose>0);
    }


    private static void printOut(String msg, boolean print)
    {
       if ((print == true) && (msg != null))
          System.out.println(msg);
    }
}
