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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import javax.annotation.Nonnull;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import static org.anarres.vclpp.PreprocessorCommand.*;

/**
 * Parses the directives of a single file.
 *
 * Each line is classified by a two-state machine (see {@link State}):
 * blank lines are skipped, lines starting with '#' are directives,
 * lines starting with ';' are comments, and everything else is code.
 * Inside a '#macro' block, every line up to '#endmacro' belongs to the
 * macro body.
 *
 * A parser is single-use. It does not close its {@link Source}.
 */
public class DirectiveParser {

    private static final Logger LOG = LoggerFactory.getLogger(DirectiveParser.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Preprocessor pp;
    private final Source source;
    private final boolean include;

    /**
     * @param include true if the source is an included file. Included
     * files are not required to carry the program markers.
     */
    public DirectiveParser(@Nonnull Preprocessor pp, @Nonnull Source source, boolean include) {
        this.pp = pp;
        this.source = source;
        this.include = include;
    }

    /* pp */ static boolean isBlank(@Nonnull String s) {
        for (int i = 0; i < s.length(); i++) {
            if (!TokenBoundary.isSpace(s.charAt(i)))
                return false;
        }
        return true;
    }

    /**
     * Splits a line into whitespace-separated tokens.
     */
    @Nonnull
    /* pp */ static String[] tokenize(@Nonnull String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty())
            return new String[0];
        return WHITESPACE.split(trimmed);
    }

    private void error(@Nonnull String msg)
            throws PreprocessorException {
        pp.error(source.getName(), source.getLine(), msg);
    }

    @Nonnull
    public ParsedSource parse()
            throws PreprocessorException {
        State state = State.NORMAL;
        Directives directives = Directives.empty();
        PVector<String> codeLines = TreePVector.empty();
        PVector<Integer> codeLineNumbers = TreePVector.empty();

        /* Advisory only: warn if missing. */
        boolean foundProgStart = false;
        boolean foundProgEnd = false;

        for (;;) {
            String line = source.line();
            if (line == null)
                break;

            if (isBlank(line))
                continue;

            if (state.isInsideMacroBlock()) {
                if (line.equals(PP_ENDMACRO.getDirective())) {
                    if (pp.getFeature(Feature.DEBUG))
                        LOG.info("Closed " + state + " at line " + source.getLine());
                    directives = directives.plusMacro(state.getMacro());
                    state = State.NORMAL;
                } else if (line.charAt(0) == '#') {
                    error("Preprocessor directive inside macro block: '" + line + "'");
                } else {
                    state = state.withLine(line);
                }
                continue;
            }

            char first = line.charAt(0);
            if (first != '#') {
                if (first != ';') {
                    codeLines = codeLines.plus(line);
                    codeLineNumbers = codeLineNumbers.plus(source.getLine());
                }
                continue;
            }

            String[] tokens = tokenize(line);
            PreprocessorCommand command = forDirective(tokens[0]);
            if (command == null) {
                error("Unknown preprocessor directive '" + tokens[0] + "'!");
                continue;
            }

            switch (command) {
                case PP_INCLUDE:
                    directives = directives.plusInclude(include(tokens));
                    break;
                case PP_DEFINE:
                    directives = directives.plusDefine(define(tokens));
                    break;
                case PP_MACRO:
                    state = State.insideMacro(macro(tokens), source.getLine());
                    break;
                case PP_VUPROG:
                    foundProgStart = true;
                    break;
                case PP_ENDVUPROG:
                    foundProgEnd = true;
                    break;
                default:
                    /* '#endmacro' outside of a block. */
                    error("Unknown preprocessor directive '" + tokens[0] + "'!");
                    break;
            }
        }

        if (state.isInsideMacroBlock()) {
            error("End of file reached while parsing a macro directive! "
                    + "Last macro seen '" + state.getMacro().getName() + "'.");
        }

        if (!include) {
            if (!foundProgStart)
                pp.warning(Warning.PROGRAM_MARKERS, source.getName(), 0,
                        "Program start directive '" + PP_VUPROG.getDirective() + "' was not found!");
            if (!foundProgEnd)
                pp.warning(Warning.PROGRAM_MARKERS, source.getName(), 0,
                        "Program end directive '" + PP_ENDVUPROG.getDirective() + "' was not found!");
        }

        ParsedSource result = new ParsedSource(source.getName(), directives, codeLines, codeLineNumbers);
        if (pp.getFeature(Feature.DEBUG))
            LOG.info("Parsed " + result);
        return result;
    }

    /* processes an #include directive */
    @Nonnull
    private String include(@Nonnull String[] tokens)
            throws PreprocessorException {
        String quoted = tokens.length < 2 ? "" : tokens[1];
        if (quoted.length() < 2 || quoted.charAt(0) != '"' || quoted.charAt(quoted.length() - 1) != '"')
            error("Include directive must be between double quotes and contain no spaces!");
        return quoted.substring(1, quoted.length() - 1);
    }

    /* processes a #define directive */
    @Nonnull
    private Definition define(@Nonnull String[] tokens)
            throws PreprocessorException {
        if (tokens.length < 2)
            error("Expected a name after '" + PP_DEFINE.getDirective() + "'!");

        /* [0] = #define, [1] = name, [2..N] = value */
        StringBuilder value = new StringBuilder();
        for (int t = 2; t < tokens.length; t++) {
            if (t > 2)
                value.append(' ');
            value.append(tokens[t]);
        }
        return new Definition(tokens[1], value.toString());
    }

    /* processes a #macro header; the body follows on later lines */
    @Nonnull
    private MacroBlock macro(@Nonnull String[] tokens)
            throws PreprocessorException {
        if (tokens.length < 2)
            error("Expected a name after '" + PP_MACRO.getDirective() + "'!");

        String name = tokens[1];
        List<String> params = new ArrayList<String>();

        if (name.endsWith(":")) {
            /* Name directly followed by a colon: a parameter list. */
            name = name.substring(0, name.length() - 1);
            if (name.isEmpty())
                error("Expected a name after '" + PP_MACRO.getDirective() + "'!");

            int last = tokens.length - 1;
            for (int t = 2; t < tokens.length; t++) {
                if (tokens[t].charAt(0) == ';') {
                    /* Trailing comment ends the list. */
                    last = t - 1;
                    break;
                }
            }

            for (int t = 2; t <= last; t++) {
                String param = tokens[t];

                if (param.equals(","))
                    error("Lost comma in macro '" + name + "' parameter list!");

                if (param.endsWith(",")) {
                    param = param.substring(0, param.length() - 1);
                    if (t == last)
                        error("Extraneous comma after last macro parameter '" + param + "'!");
                    if (param.endsWith(",")) {
                        param = param.substring(0, param.length() - 1);
                        error("Lost comma after macro parameter '" + param + "'!");
                    }
                } else if (t != last) {
                    error("Missing comma after macro parameter '" + param + "'!");
                }
                params.add(param);
            }
        } else if (tokens.length > 2 && tokens[2].charAt(0) != ';') {
            error("More text follows macro declaration. "
                    + "Add a ':' right after the macro name to define a param list!");
        }

        return new MacroBlock(name, params);
    }
}
