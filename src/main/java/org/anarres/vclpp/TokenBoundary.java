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

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * Decides whether a substring match is a genuine use of a name.
 *
 * A name referenced in code must be surrounded by whitespace,
 * punctuation or the edge of the line, so that a define named
 * <code>FOO</code> is not replaced inside <code>FOOBAR</code>.
 * Punctuation is the ASCII punctuation set, which includes
 * <code>'_'</code>.
 */
public final class TokenBoundary {

    /** The character which must immediately follow a macro invocation. */
    public static final char INVOCATION_MARKER = '{';

    private TokenBoundary() {
    }

    /* pp */ static boolean isSpace(char c) {
        switch (c) {
            case ' ':
            case '\t':
            case '\n':
            case '\r':
            case '\f':
            case 0x0B:
                return true;
            default:
                return false;
        }
    }

    /* pp */ static boolean isPunct(char c) {
        return (c >= '!' && c <= '/')
                || (c >= ':' && c <= '@')
                || (c >= '[' && c <= '`')
                || (c >= '{' && c <= '~');
    }

    private static boolean isSeparator(char c) {
        return isSpace(c) || isPunct(c);
    }

    /**
     * Returns true if the left neighbour of a match at pos is absent,
     * whitespace or punctuation.
     */
    private static boolean isLeftBoundary(@Nonnull CharSequence s, @Nonnegative int pos) {
        return pos == 0 || isSeparator(s.charAt(pos - 1));
    }

    /**
     * Returns true if the match of length len at pos in s is a
     * standalone identifier.
     *
     * E.g. in <code>func(FOO+42)</code>, <code>FOO</code> is standalone,
     * while in <code>FOOBAR</code> it is not.
     */
    public static boolean isStandaloneIdentifier(@Nonnull CharSequence s, @Nonnegative int pos, @Nonnegative int len) {
        int post = pos + len;
        if (!isLeftBoundary(s, pos))
            return false;
        return post >= s.length() || isSeparator(s.charAt(post));
    }

    /**
     * Returns true if the match of length len at pos in s is a macro
     * invocation, that is, the name is immediately followed by
     * {@link #INVOCATION_MARKER}.
     *
     * A name at the very end of the line is never an invocation.
     */
    public static boolean isMacroInvocation(@Nonnull CharSequence s, @Nonnegative int pos, @Nonnegative int len) {
        int post = pos + len;
        if (post >= s.length())
            return false;
        return s.charAt(post) == INVOCATION_MARKER && isLeftBoundary(s, pos);
    }
}
