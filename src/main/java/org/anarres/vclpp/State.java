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

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * The state of the directive parser between two lines.
 *
 * Either {@link Kind#NORMAL}, or {@link Kind#INSIDE_MACRO_BLOCK} carrying
 * the macro accumulated so far.
 */
/* pp */ final class State {

    /* pp */ enum Kind {

        NORMAL, INSIDE_MACRO_BLOCK
    }

    /* pp */ static final State NORMAL = new State(Kind.NORMAL, null, 0);

    private final Kind kind;
    private final MacroBlock macro;
    private final int openedAt;

    private State(@Nonnull Kind kind, @CheckForNull MacroBlock macro, int openedAt) {
        this.kind = kind;
        this.macro = macro;
        this.openedAt = openedAt;
    }

    /* pp */ static State insideMacro(@Nonnull MacroBlock macro, int line) {
        return new State(Kind.INSIDE_MACRO_BLOCK, macro, line);
    }

    /* pp */ boolean isInsideMacroBlock() {
        return kind == Kind.INSIDE_MACRO_BLOCK;
    }

    /**
     * Returns the macro being accumulated.
     *
     * @throws IllegalStateException if not inside a macro block.
     */
    @Nonnull
    /* pp */ MacroBlock getMacro() {
        if (macro == null)
            throw new IllegalStateException("Not inside a macro block");
        return macro;
    }

    /* pp */ State withLine(@Nonnull String line) {
        return new State(kind, getMacro().withLine(line), openedAt);
    }

    @Override
    public String toString() {
        if (macro == null)
            return kind.toString();
        return kind + " " + macro.getName() + " (line " + openedAt + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof State))
            return false;
        State o = (State) obj;
        if (o.kind != this.kind || o.openedAt != this.openedAt)
            return false;
        return macro == null ? o.macro == null : macro.equals(o.macro);
    }

    @Override
    public int hashCode() {
        return (kind.hashCode() * 31 + openedAt) * 31 + (macro == null ? 0 : macro.hashCode());
    }
}
