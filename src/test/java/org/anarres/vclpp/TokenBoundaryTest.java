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

import org.junit.Test;
import static org.anarres.vclpp.TokenBoundary.*;
import static org.junit.Assert.*;

public class TokenBoundaryTest {

    @Test
    public void testStandaloneAtEdges() {
        assertTrue(isStandaloneIdentifier("FOO", 0, 3));
        assertTrue(isStandaloneIdentifier("FOO bar", 0, 3));
        assertTrue(isStandaloneIdentifier("bar FOO", 4, 3));
    }

    @Test
    public void testStandaloneInPunctuation() {
        String line = "func(FOO+42);";
        assertTrue(isStandaloneIdentifier(line, line.indexOf("FOO"), 3));
        line = "vf01.xyz";
        assertTrue(isStandaloneIdentifier(line, 5, 3));
    }

    @Test
    public void testEmbeddedIsNotStandalone() {
        assertFalse(isStandaloneIdentifier("FOOBAR", 0, 3));
        assertFalse(isStandaloneIdentifier("BARFOO", 3, 3));
        assertFalse(isStandaloneIdentifier("AFOO", 1, 3));
        assertFalse(isStandaloneIdentifier("x FOO1 y", 2, 3));
    }

    @Test
    public void testInvocationNeedsBrace() {
        assertTrue(isMacroInvocation("TAG{}", 0, 3));
        assertTrue(isMacroInvocation("  TAG{ a, b }", 2, 3));
        assertFalse(isMacroInvocation("TAG {}", 0, 3));
        assertFalse(isMacroInvocation("TAG", 0, 3));
        assertFalse(isMacroInvocation("call TAG", 5, 3));
    }

    @Test
    public void testInvocationLeftBoundary() {
        assertFalse(isMacroInvocation("XTAG{}", 1, 3));
        assertTrue(isMacroInvocation("(TAG{}", 1, 3));
    }

    @Test
    public void testCharacterClasses() {
        assertTrue(isSpace('\t'));
        assertFalse(isSpace('a'));
        assertTrue(isPunct('_'));
        assertTrue(isPunct(','));
        assertTrue(isPunct('{'));
        assertFalse(isPunct('7'));
        assertFalse(isPunct('Z'));
    }
}
