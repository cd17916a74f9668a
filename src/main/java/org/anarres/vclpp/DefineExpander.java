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
import javax.annotation.Nonnull;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Substitutes '#define' constants into code lines.
 *
 * Every line is tested against every definition of every directive set,
 * in order, so substitutions compound left to right and set by set.
 */
public class DefineExpander {

    private static final Logger LOG = LoggerFactory.getLogger(DefineExpander.class);

    private final Preprocessor pp;

    public DefineExpander(@Nonnull Preprocessor pp) {
        this.pp = pp;
    }

    /**
     * Replaces every standalone occurrence of name in line with value.
     *
     * The scan never re-enters text it has just inserted, so a value
     * containing its own name does not expand again.
     */
    @Nonnull
    public static String replace(@Nonnull String line, @Nonnull String name, @Nonnull String value) {
        if (name.isEmpty())
            return line;
        StringBuilder buf = new StringBuilder(line);
        int pos = 0;
        while ((pos = buf.indexOf(name, pos)) != -1) {
            if (TokenBoundary.isStandaloneIdentifier(buf, pos, name.length())) {
                buf.replace(pos, pos + name.length(), value);
                pos += value.length();
            } else {
                pos += name.length();
            }
        }
        return buf.toString();
    }

    @Nonnull
    public PVector<String> expand(@Nonnull List<String> lines, @Nonnull List<Directives> directives) {
        PVector<String> result = TreePVector.empty();
        for (String line : lines) {
            String expanded = line;
            for (Directives dir : directives) {
                for (Definition def : dir.getDefines())
                    expanded = replace(expanded, def.getName(), def.getValue());
            }
            if (pp.getFeature(Feature.DEBUG) && !expanded.equals(line))
                LOG.info("Defines: '" + line + "' -> '" + expanded + "'");
            result = result.plus(expanded);
        }
        return result;
    }
}
