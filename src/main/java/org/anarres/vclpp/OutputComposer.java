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

import java.util.Arrays;
import java.util.List;
import javax.annotation.Nonnull;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

/**
 * Produces the final output lines: strips ';' comments, drops blank
 * lines and optionally wraps the result in the VCL program framing.
 */
public class OutputComposer {

    /** The only comment syntax. */
    public static final char COMMENT = ';';

    public static final PVector<String> PROLOGUE = TreePVector.from(Arrays.asList(
            "",
            ".init_vf_all",
            ".init_vi_all",
            ".syntax new",
            ".vu",
            "",
            "--enter",
            "--endenter",
            ""));

    public static final PVector<String> EPILOGUE = TreePVector.from(Arrays.asList(
            "",
            "--exit",
            "--endexit",
            ""));

    private final boolean boilerplate;

    public OutputComposer(boolean boilerplate) {
        this.boilerplate = boilerplate;
    }

    /**
     * Truncates the line at the first ';', which is discarded too.
     */
    @Nonnull
    public static String stripComment(@Nonnull String line) {
        int pos = line.indexOf(COMMENT);
        if (pos == -1)
            return line;
        return line.substring(0, pos);
    }

    @Nonnull
    public PVector<String> compose(@Nonnull List<String> lines) {
        PVector<String> result = TreePVector.empty();
        if (boilerplate)
            result = result.plusAll(PROLOGUE);
        for (String line : lines) {
            String code = stripComment(line);
            if (!DirectiveParser.isBlank(code))
                result = result.plus(code);
        }
        if (boilerplate)
            result = result.plusAll(EPILOGUE);
        return result;
    }
}
