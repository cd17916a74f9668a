/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.vclpp;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import javax.annotation.Nonnull;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point.
 *
 * <pre>
 * vclpp &lt;input-file&gt; [output-file] [options]
 * </pre>
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    /** Extension given to the output file when no name is supplied. */
    public static final String OUTPUT_EXTENSION = "vsm";

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;

    @Nonnull
    private static CharSequence getWarnings() {
        StringBuilder buf = new StringBuilder();
        for (Warning w : Warning.values()) {
            if (buf.length() > 0)
                buf.append(", ");
            String name = w.name().toLowerCase();
            buf.append(name.replace('_', '-'));
        }
        return buf;
    }

    /**
     * Returns the input name with its extension replaced by '.vsm'.
     */
    @Nonnull
    public static String getDefaultOutputName(@Nonnull String input) {
        return FilenameUtils.removeExtension(input) + "." + OUTPUT_EXTENSION;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    public static int run(@Nonnull String[] args, @Nonnull PrintStream out) {
        OptionParser parser = new OptionParser();
        /* Stray flags are dropped below rather than rejected. */
        parser.allowsUnrecognizedOptions();
        OptionSpec<?> helpOption = parser.acceptsAll(Arrays.asList("h", "help"),
                "Prints this message and exits.")
                .forHelp();
        OptionSpec<?> junkOption = parser.acceptsAll(Arrays.asList("j", "vcljunk"),
                "Adds the standard VCL prologue/epilogue junk to the output.");
        OptionSpec<?> debugOption = parser.accepts("debug",
                "Enables debug output.");
        OptionSpec<File> incdirOption = parser.acceptsAll(Arrays.asList("incdir", "I"),
                "Adds the directory dir to the list of directories searched for #" + "include files.")
                .withRequiredArg().ofType(File.class).describedAs("dir");
        OptionSpec<String> warningOption = parser.acceptsAll(Arrays.asList("warning", "W"),
                "Enables the named warning class (" + getWarnings() + ", all).")
                .withRequiredArg().ofType(String.class).describedAs("warning");
        OptionSpec<Void> noWarningOption = parser.acceptsAll(Arrays.asList("no-warnings", "w"),
                "Disables ALL warnings.");
        OptionSpec<String> filesOption = parser.nonOptions()
                .ofType(String.class).describedAs("<input-file> [output-file]");

        if (args.length == 0) {
            help(parser, out);
            return EXIT_FAILURE;
        }

        OptionSet options;
        try {
            options = parser.parse(args);
        } catch (OptionException e) {
            LOG.error(e.getMessage());
            help(parser, out);
            return EXIT_FAILURE;
        }

        if (options.has(helpOption)) {
            help(parser, out);
            return EXIT_SUCCESS;
        }

        List<String> files = new ArrayList<String>();
        for (String file : options.valuesOf(filesOption)) {
            /* The input slot is checked below. */
            if (!files.isEmpty() && file.startsWith("-")) {
                LOG.warn("Ignoring unknown option \"" + file + "\".");
                continue;
            }
            files.add(file);
        }
        if (files.isEmpty()) {
            help(parser, out);
            return EXIT_FAILURE;
        }
        if (files.size() > 2) {
            LOG.error("Too many file arguments: " + files);
            return EXIT_FAILURE;
        }

        String input = files.get(0);
        /* Check for a flag in the wrong place or an empty string. */
        if (input.isEmpty() || input.startsWith("-")) {
            LOG.error("Invalid filename \"" + input + "\"!");
            return EXIT_FAILURE;
        }
        String output = files.size() > 1 ? files.get(1) : getDefaultOutputName(input);

        DefaultPreprocessorListener listener = new DefaultPreprocessorListener();
        Preprocessor pp = new Preprocessor();
        pp.setListener(listener);

        if (options.has(junkOption))
            pp.addFeature(Feature.BOILERPLATE);
        if (options.has(debugOption))
            pp.addFeature(Feature.DEBUG);

        if (options.has(noWarningOption))
            pp.getWarnings().clear();

        for (String warning : options.valuesOf(warningOption)) {
            warning = warning.toUpperCase();
            warning = warning.replace('-', '_');
            if (warning.equals("ALL")) {
                pp.addWarnings(EnumSet.allOf(Warning.class));
                continue;
            }
            try {
                pp.addWarning(Enum.valueOf(Warning.class, warning));
            } catch (IllegalArgumentException e) {
                LOG.error("Unknown warning class \"" + warning + "\"!");
                return EXIT_FAILURE;
            }
        }

        for (File dir : options.valuesOf(incdirOption))
            pp.getIncludePath().add(dir.getPath());

        if (pp.getFeature(Feature.DEBUG))
            LOG.info("Preprocessing " + input + " into " + output + " with " + pp);

        try {
            pp.preprocess(new File(input), new File(output));
        } catch (PreprocessorException e) {
            LOG.debug("Preprocessor failed", e);
            LOG.error("Terminating due to " + listener.getErrors() + " error(s)...");
            return EXIT_FAILURE;
        } catch (IOException e) {
            LOG.debug("Preprocessor failed", e);
            LOG.error("Terminating due to I/O error: " + e.getMessage());
            return EXIT_FAILURE;
        }
        if (listener.getWarnings() > 0)
            LOG.info("Wrote " + output + " with " + listener.getWarnings() + " warning(s).");
        return EXIT_SUCCESS;
    }

    private static void help(@Nonnull OptionParser parser, @Nonnull PrintStream out) {
        out.println();
        out.println("Usage:");
        out.println(" $ vclpp <input-file> [output-file] [options]");
        out.println(" Applies custom preprocessing to a source file prior to running VCL.");
        out.println(" This preprocessor supports C-style #" + "define constants and custom #" + "macro directives.");
        out.println(" If no output filename is provided the input name is used but the extension is replaced with '."
                + OUTPUT_EXTENSION + "'");
        out.println();
        try {
            parser.printHelpOn(out);
        } catch (IOException e) {
            LOG.error("Failed to print help", e);
        }
    }
}
