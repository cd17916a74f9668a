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

import java.util.HashMap;
import java.util.Map;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * The preprocessor directive keywords, without the leading '#'.
 */
public enum PreprocessorCommand {

    PP_INCLUDE("include"),
    PP_DEFINE("define"),
    PP_MACRO("macro"),
    PP_ENDMACRO("endmacro"),
    PP_VUPROG("vuprog"),
    PP_ENDVUPROG("endvuprog");

    private static final Map<String, PreprocessorCommand> BY_TEXT = new HashMap<String, PreprocessorCommand>();

    static {
        for (PreprocessorCommand command : values())
            BY_TEXT.put(command.getDirective(), command);
    }

    private final String text;

    PreprocessorCommand(@Nonnull String text) {
        this.text = text;
    }

    /** Returns the directive as written in source, e.g. <code>#define</code>. */
    @Nonnull
    public String getDirective() {
        return "#" + text;
    }

    /**
     * Looks up a command by its directive token, including the '#'.
     *
     * @return the command, or null if the token is not a known directive.
     */
    @CheckForNull
    public static PreprocessorCommand forDirective(@Nonnull String token) {
        return BY_TEXT.get(token);
    }
}
