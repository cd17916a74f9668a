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

import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands '#macro' invocations in code lines.
 *
 * At most one invocation is recognized per line: the first macro, in
 * directive set order and then declaration order, whose name first
 * occurs on the line immediately followed by '{'. Expanded bodies are
 * not rescanned for further invocations.
 */
public class MacroExpander {

    private static final Logger LOG = LoggerFactory.getLogger(MacroExpander.class);

    private final Preprocessor pp;
    private final String sourceName;

    /**
     * @param sourceName the file the code lines came from, for diagnostics.
     */
    public MacroExpander(@Nonnull Preprocessor pp, @Nonnull String sourceName) {
        this.pp = pp;
        this.sourceName = sourceName;
    }

    /**
     * Returns the macro invoked on the given line, or null if there is none.
     */
    @CheckForNull
    public static MacroBlock findInvocation(@Nonnull String line, @Nonnull List<Directives> directives) {
        for (Directives dir : directives) {
            for (MacroBlock macro : dir.getMacros()) {
                String name = macro.getName();
                int pos = line.indexOf(name);
                if (pos != -1 && TokenBoundary.isMacroInvocation(line, pos, name.length()))
                    return macro;
            }
        }
        return null;
    }

    /**
     * Strips a single trailing and then a single leading comma.
     */
    @Nonnull
    /* pp */ static String stripCommas(@Nonnull String arg) {
        if (arg.endsWith(","))
            arg = arg.substring(0, arg.length() - 1);
        if (arg.startsWith(","))
            arg = arg.substring(1);
        return arg;
    }

    /**
     * Expands lines whose source line numbers are unknown. Errors are
     * reported against the file only.
     */
    @Nonnull
    public PVector<String> expand(@Nonnull List<String> lines, @Nonnull List<Directives> directives)
            throws PreprocessorException {
        return expand(lines, null, directives);
    }

    /**
     * @param lineNumbers the 1-based source line of each entry in lines,
     * used in diagnostics, or null if unknown.
     */
    @Nonnull
    public PVector<String> expand(@Nonnull List<String> lines, @CheckForNull List<Integer> lineNumbers,
            @Nonnull List<Directives> directives)
            throws PreprocessorException {
        PVector<String> result = TreePVector.empty();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            MacroBlock macro = findInvocation(line, directives);
            if (macro == null) {
                result = result.plus(line);
                continue;
            }
            if (pp.getFeature(Feature.DEBUG))
                LOG.info("Expanding macro " + macro.getName() + " in '" + line + "'");
            int lineNumber = lineNumbers == null ? 0 : lineNumbers.get(i);
            result = result.plusAll(expand(line, lineNumber, macro));
        }
        return result;
    }

    /**
     * Expands a single invocation line.
     *
     * The line is split on whitespace: the first token carries the name
     * and the '{', the last token closes the invocation, and every token
     * in between is one argument.
     *
     * @param lineNumber the 1-based source line, or 0 if unknown.
     * @return the replacement lines: a blank line then the body, or a
     * single blank line if the body is empty.
     */
    @Nonnull
    /* pp */ PVector<String> expand(@Nonnull String line, int lineNumber, @Nonnull MacroBlock macro)
            throws PreprocessorException {
        String[] tokens = DirectiveParser.tokenize(line);
        int provided = Math.max(0, tokens.length - 2);
        PVector<String> params = macro.getParams();

        if (macro.isParameterized()) {
            if (tokens.length - 2 != params.size())
                pp.error(sourceName, lineNumber, "Macro '" + macro.getName() + "' takes "
                        + params.size() + " arguments, but "
                        + provided + " were provided!");
        } else if (tokens.length > 2) {
            pp.error(sourceName, lineNumber, "Macro '" + macro.getName() + "' takes no arguments, but "
                    + provided + " were provided!");
        }

        PVector<String> expansion = TreePVector.singleton("");
        if (macro.getBody().isEmpty())
            return expansion;

        for (String body : macro.getBody()) {
            for (int p = 0; p < params.size(); p++)
                body = DefineExpander.replace(body, params.get(p), stripCommas(tokens[p + 1]));
            expansion = expansion.plus(body);
        }
        return expansion;
    }
}
