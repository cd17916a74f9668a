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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import javax.annotation.Nonnull;
import org.pcollections.PVector;

/**
 * The result of parsing one file: its directive set plus the
 * remaining code lines.
 *
 * Code lines of an included file are parsed but never used.
 */
public final class ParsedSource {

    private final String name;
    private final Directives directives;
    private final PVector<String> codeLines;
    private final PVector<Integer> codeLineNumbers;

    /**
     * @param codeLineNumbers the 1-based source line of each code line.
     */
    public ParsedSource(@Nonnull String name, @Nonnull Directives directives,
            @Nonnull PVector<String> codeLines, @Nonnull PVector<Integer> codeLineNumbers) {
        if (codeLines.size() != codeLineNumbers.size())
            throw new IllegalArgumentException("Expected " + codeLines.size()
                    + " line numbers, got " + codeLineNumbers.size());
        this.name = name;
        this.directives = directives;
        this.codeLines = codeLines;
        this.codeLineNumbers = codeLineNumbers;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public Directives getDirectives() {
        return directives;
    }

    @Nonnull
    public PVector<String> getCodeLines() {
        return codeLines;
    }

    /**
     * Returns the 1-based source line of each code line, parallel to
     * {@link #getCodeLines()}.
     */
    @Nonnull
    public PVector<Integer> getCodeLineNumbers() {
        return codeLineNumbers;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("name", name);
        result.add("directives", directives.toJson());
        JsonArray code = new JsonArray();
        for (String line : codeLines)
            code.add(line);
        result.add("code", code);
        return result;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
