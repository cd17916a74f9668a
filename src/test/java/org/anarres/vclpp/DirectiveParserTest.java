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
import java.util.Collections;
import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

public class DirectiveParserTest {

    private Preprocessor pp;
    private CollectingListener listener;

    @Before
    public void setUp() {
        pp = new Preprocessor();
        listener = new CollectingListener();
        pp.setListener(listener);
    }

    private ParsedSource parse(String text) throws Exception {
        return parse(text, false);
    }

    private ParsedSource parse(String text, boolean include) throws Exception {
        return pp.parse(new StringSource("test.vcl", text), include);
    }

    private void assertError(String text, String expected) throws Exception {
        try {
            parse(text);
            fail("Expected error: " + expected);
        } catch (PreprocessorException e) {
            assertTrue(e.getMessage(), e.getMessage().endsWith(expected));
            assertEquals(1, listener.errors.size());
            assertTrue(listener.errors.get(0).endsWith(expected));
        }
    }

    @Test
    public void testDirectivesAndCodeLines() throws Exception {
        ParsedSource parsed = parse(
                "#vuprog\n"
                + "#include \"common.inc\"\n"
                + "#define WIDTH 4\n"
                + "\n"
                + "; a comment\n"
                + "#macro SWAP: a, b\n"
                + "    move a, b\n"
                + "\n"
                + "    move b, a\n"
                + "#endmacro\n"
                + "    iaddiu vi01, vi00, WIDTH ; trailing\n"
                + "SWAP{ vf01, vf02 }\n"
                + "#endvuprog\n");

        Directives dirs = parsed.getDirectives();
        assertEquals(Collections.singletonList("common.inc"), dirs.getIncludes());
        assertEquals(Collections.singletonList(new Definition("WIDTH", "4")), dirs.getDefines());
        assertEquals(1, dirs.getMacros().size());
        MacroBlock swap = dirs.getMacros().get(0);
        assertEquals("SWAP", swap.getName());
        assertEquals(Arrays.asList("a", "b"), swap.getParams());
        assertEquals(Arrays.asList("    move a, b", "    move b, a"), swap.getBody());

        assertEquals(Arrays.asList(
                "    iaddiu vi01, vi00, WIDTH ; trailing",
                "SWAP{ vf01, vf02 }"), parsed.getCodeLines());
        assertEquals(Arrays.asList(11, 12), parsed.getCodeLineNumbers());
        assertTrue(listener.warnings.isEmpty());
        assertEquals(Arrays.asList("PUSH test.vcl", "POP test.vcl"), listener.sources);
    }

    @Test
    public void testDefineValueIsRejoined() throws Exception {
        Directives dirs = parse("#define V   a    b\tc\n#define EMPTY\n").getDirectives();
        assertEquals(Arrays.asList(
                new Definition("V", "a b c"),
                new Definition("EMPTY", "")), dirs.getDefines());
    }

    @Test
    public void testDuplicateNamesAreKept() throws Exception {
        Directives dirs = parse("#define A 1\n#define A 2\n").getDirectives();
        assertEquals(2, dirs.getDefines().size());
        assertEquals("1", dirs.getDefines().get(0).getValue());
    }

    @Test
    public void testParameterlessMacro() throws Exception {
        Directives dirs = parse("#macro NOPS ; pads the pipeline\nnop\nnop\n#endmacro\n#macro EMPTY\n#endmacro\n")
                .getDirectives();
        assertEquals(2, dirs.getMacros().size());
        assertFalse(dirs.getMacros().get(0).isParameterized());
        assertEquals(Arrays.asList("nop", "nop"), dirs.getMacros().get(0).getBody());
        assertTrue(dirs.getMacros().get(1).getBody().isEmpty());
    }

    @Test
    public void testParameterListWithComment() throws Exception {
        MacroBlock m = parse("#macro M: x, y ; two args\n#endmacro\n").getDirectives().getMacros().get(0);
        assertEquals(Arrays.asList("x", "y"), m.getParams());
    }

    @Test
    public void testIndentedLinesAreCode() throws Exception {
        ParsedSource parsed = parse("  #define X 1\n  ; not a comment line\n");
        assertTrue(parsed.getDirectives().getIncludes().isEmpty());
        assertTrue(parsed.getDirectives().getDefines().isEmpty());
        assertTrue(parsed.getDirectives().getMacros().isEmpty());
        assertEquals(2, parsed.getCodeLines().size());
        assertEquals(Arrays.asList(1, 2), parsed.getCodeLineNumbers());
    }

    @Test
    public void testMissingProgramMarkersWarn() throws Exception {
        parse("nop\n");
        assertEquals(Arrays.asList(
                "File test.vcl: Program start directive '#vuprog' was not found!",
                "File test.vcl: Program end directive '#endvuprog' was not found!"),
                listener.warnings);
    }

    @Test
    public void testIncludeModeDoesNotWarn() throws Exception {
        parse("#define A 1\n", true);
        assertTrue(listener.warnings.isEmpty());
    }

    @Test
    public void testWarningsAsErrors() throws Exception {
        pp.addWarning(Warning.ERROR);
        assertError("#endvuprog\n", "Program start directive '#vuprog' was not found!");
    }

    @Test
    public void testDisabledWarnings() throws Exception {
        pp.getWarnings().clear();
        parse("nop\n");
        assertTrue(listener.warnings.isEmpty());
    }

    @Test
    public void testBadIncludeQuoting() throws Exception {
        assertError("#include common.inc\n",
                "test.vcl(1): Include directive must be between double quotes and contain no spaces!");
    }

    @Test
    public void testIncludeWithSpaces() throws Exception {
        assertError("nop\n#include \"my file.inc\"\n",
                "test.vcl(2): Include directive must be between double quotes and contain no spaces!");
    }

    @Test
    public void testLostComma() throws Exception {
        assertError("#macro M: a, , b\n#endmacro\n", "Lost comma in macro 'M' parameter list!");
    }

    @Test
    public void testDoubleComma() throws Exception {
        assertError("#macro M: a,, b\n#endmacro\n", "Lost comma after macro parameter 'a'!");
    }

    @Test
    public void testMissingComma() throws Exception {
        assertError("#macro M: a b\n#endmacro\n", "Missing comma after macro parameter 'a'!");
    }

    @Test
    public void testTrailingComma() throws Exception {
        assertError("#macro M: a, b,\n#endmacro\n", "Extraneous comma after last macro parameter 'b'!");
    }

    @Test
    public void testTextAfterParameterlessMacro() throws Exception {
        assertError("#macro M a, b\n#endmacro\n",
                "More text follows macro declaration. "
                + "Add a ':' right after the macro name to define a param list!");
    }

    @Test
    public void testDirectiveInsideMacro() throws Exception {
        assertError("#macro M\n#define X 1\n#endmacro\n",
                "test.vcl(2): Preprocessor directive inside macro block: '#define X 1'");
    }

    @Test
    public void testUnterminatedMacro() throws Exception {
        assertError("#macro LOOP: n\n  ibne n, vi00, loop\n",
                "End of file reached while parsing a macro directive! Last macro seen 'LOOP'.");
    }

    @Test
    public void testUnknownDirective() throws Exception {
        assertError("#ifdef X\n", "test.vcl(1): Unknown preprocessor directive '#ifdef'!");
    }

    @Test
    public void testEndMacroOutsideBlock() throws Exception {
        assertError("#endmacro\n", "Unknown preprocessor directive '#endmacro'!");
    }

    @Test
    public void testTokenize() {
        assertArrayEquals(new String[]{"a", "b,", "c"}, DirectiveParser.tokenize("  a\tb,   c "));
        assertEquals(0, DirectiveParser.tokenize("   ").length);
    }
}
