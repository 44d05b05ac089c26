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
package org.anarres.ccscan;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ParserTest {

    private static class RecordingListener extends DefaultParserListener {

        private final List<String> messages = new ArrayList<String>();

        @Override
        protected void print(String msg) {
            super.print(msg);
            messages.add(msg);
        }
    }

    private RecordingListener listener;

    private SourceInfo parse(String input) throws LexerException {
        listener = new RecordingListener();
        Parser parser = new Parser("test.c", input.getBytes(StandardCharsets.UTF_8));
        parser.setListener(listener);
        return parser.parse();
    }

    private static Directive.Include quoted(String path) {
        return new Directive.Include(path, false);
    }

    private static Directive.Include system(String path) {
        return new Directive.Include(path, true);
    }

    @Test
    public void testIncludes() throws Exception {
        SourceInfo info = parse("#include <stdio.h>\n#include \"foo.h\"\n");
        assertThat(info.collectIncludes()).containsExactly(system("stdio.h"), quoted("foo.h"));
        assertThat(info.hasMain()).isFalse();
        assertThat(listener.getErrors()).isZero();
        assertThat(listener.getWarnings()).isZero();
    }

    @Test
    public void testIncludeForms() throws Exception {
        SourceInfo info = parse("  #  include <sys/types.h>  // why\n"
                + "#include_next <limits.h>\n"
                + "#include \"foo/bar.h\" /* c */\n");
        assertThat(info.getDirectives()).containsExactly(
                system("sys/types.h"),
                new Directive.Include("limits.h", true, true),
                quoted("foo/bar.h"));
        assertThat(listener.getWarnings()).isZero();
    }

    @Test
    public void testSystemIncludeSpacing() throws Exception {
        SourceInfo info = parse("#include < stdio.h >\n#include </* c */sys/types.h\t>\n#include <my file.h>\n");
        assertThat(info.getDirectives()).containsExactly(
                system("stdio.h"), system("sys/types.h"), system("my file.h"));
        assertThat(listener.getErrors()).isZero();
    }

    @Test
    public void testBadIncludes() throws Exception {
        SourceInfo info = parse("#include\n"
                + "#include foo.h\n"
                + "#include <a.h\n"
                + "#include \"\"\n"
                + "#include \"ok.h\"\n");
        assertThat(info.getDirectives()).containsExactly(quoted("ok.h"));
        assertThat(listener.getErrors()).isEqualTo(4);
    }

    @Test
    public void testTrailingTokensWarn() throws Exception {
        SourceInfo info = parse("#include \"a.h\" junk more\n#undef X Y\n");
        assertThat(info.getDirectives()).containsExactly(quoted("a.h"), new Directive.Undefine("X"));
        assertThat(listener.getWarnings()).isEqualTo(2);
        assertThat(listener.getErrors()).isZero();
        assertThat(listener.messages.get(0)).isEqualTo("test.c:1:16: warning: Unexpected nonwhite token junk");
    }

    @Test
    public void testDefines() throws Exception {
        SourceInfo info = parse("#define FOO 1\n"
                + "#define EMPTY\n"
                + "#define ADD(x, y) x + y\n"
                + "#define NOARGS() 2\n"
                + "#define VA(fmt, ...) printf(fmt)\n"
                + "#define PAREN (x)\n"
                + "#undef FOO\n");
        assertThat(info.getDirectives()).containsExactly(
                new Directive.Define("FOO", Arrays.asList("1")),
                new Directive.Define("EMPTY", Collections.<String>emptyList()),
                new Directive.Define("ADD", true, Arrays.asList("x", "y"), Arrays.asList("x", "+", "y")),
                new Directive.Define("NOARGS", true, Collections.<String>emptyList(), Arrays.asList("2")),
                new Directive.Define("VA", true, Arrays.asList("fmt", "..."), Arrays.asList("printf", "(", "fmt", ")")),
                new Directive.Define("PAREN", Arrays.asList("(", "x", ")")),
                new Directive.Undefine("FOO"));
        assertThat(listener.getErrors()).isZero();
    }

    @Test
    public void testDefineContinuesOverLines() throws Exception {
        SourceInfo info = parse("#define A \\\n  1\n#define B 2\n");
        assertThat(info.getDirectives()).containsExactly(
                new Directive.Define("A", Arrays.asList("1")),
                new Directive.Define("B", Arrays.asList("2")));
    }

    @Test
    public void testBadDefines() throws Exception {
        SourceInfo info = parse("#define\n"
                + "#define 1 2\n"
                + "#define defined 1\n"
                + "#define F(a, 1) a\n"
                + "#define G(..., a) a\n"
                + "#define H(a\n"
                + "#undef 3\n"
                + "#define OK 1\n");
        assertThat(info.getDirectives()).containsExactly(new Directive.Define("OK", Arrays.asList("1")));
        assertThat(listener.getErrors()).isEqualTo(7);
    }

    @Test
    public void testConditionalBlock() throws Exception {
        SourceInfo info = parse("#ifdef FOO\n"
                + "#include \"a.h\"\n"
                + "#elif BAR > 1\n"
                + "#include \"b.h\"\n"
                + "#else\n"
                + "#include \"c.h\"\n"
                + "#endif\n");
        assertThat(info.getDirectives()).containsExactly(new Directive.IfBlock(Arrays.asList(
                new ConditionalBranch(ConditionalBranch.Kind.IF, new Expr.Defined("FOO"),
                        Arrays.<Directive>asList(quoted("a.h"))),
                new ConditionalBranch(ConditionalBranch.Kind.ELIF,
                        new Expr.Compare(new Expr.Ident("BAR"), Expr.Compare.Operator.GT, new Expr.ConstantInt(1)),
                        Arrays.<Directive>asList(quoted("b.h"))),
                new ConditionalBranch(ConditionalBranch.Kind.ELSE, null,
                        Arrays.<Directive>asList(quoted("c.h"))))));
        assertThat(info.collectIncludes()).containsExactly(quoted("a.h"), quoted("b.h"), quoted("c.h"));
        assertThat(listener.getErrors()).isZero();
    }

    @Test
    public void testIfndefAndNesting() throws Exception {
        SourceInfo info = parse("#ifndef GUARD\n"
                + "#define GUARD\n"
                + "#if defined(A) && !defined(B)\n"
                + "#include \"ab.h\"\n"
                + "#endif\n"
                + "#endif\n");
        assertThat(info.getDirectives()).hasSize(1);
        Directive.IfBlock outer = (Directive.IfBlock) info.getDirectives().get(0);
        assertThat(outer.getBranches()).hasSize(1);
        ConditionalBranch branch = outer.getBranches().get(0);
        assertThat(branch.getCondition()).isEqualTo(new Expr.Not(new Expr.Defined("GUARD")));
        assertThat(branch.getBody()).hasSize(2);
        Directive.IfBlock inner = (Directive.IfBlock) branch.getBody().get(1);
        assertThat(inner.getBranches().get(0).getCondition().toString()).isEqualTo("(defined(A) && !defined(B))");
        assertThat(info.collectIncludes()).containsExactly(quoted("ab.h"));
    }

    @Test
    public void testElifdef() throws Exception {
        SourceInfo info = parse("#if 0\n#elifdef X\n#elifndef Y\n#endif\n");
        Directive.IfBlock block = (Directive.IfBlock) info.getDirectives().get(0);
        assertThat(block.getBranches()).extracting(ConditionalBranch::getCondition).containsExactly(
                new Expr.ConstantInt(0), new Expr.Defined("X"), new Expr.Not(new Expr.Defined("Y")));
    }

    @Test
    public void testStrayBranchDirectives() throws Exception {
        SourceInfo info = parse("#endif\n#else\n#elif 1\n#include \"a.h\"\n");
        assertThat(info.getDirectives()).containsExactly(quoted("a.h"));
        assertThat(listener.getErrors()).isEqualTo(3);
        assertThat(listener.messages.get(0)).isEqualTo("test.c:1:1: error: #endif without #if");
    }

    @Test
    public void testBadConditionSkipsDirective() throws Exception {
        SourceInfo info = parse("#if A +\n#include \"a.h\"\n#else\n#include \"b.h\"\n#endif\n#include \"c.h\"\n");
        assertThat(listener.getErrors()).isEqualTo(1);
        assertThat(info.getDirectives()).containsExactly(quoted("a.h"), quoted("b.h"), quoted("c.h"));
        assertThat(info.collectReachableIncludes(Environment.empty()))
                .containsExactly(quoted("a.h"), quoted("b.h"), quoted("c.h"));
    }

    @Test
    public void testBadIfdefSkipsDirective() throws Exception {
        SourceInfo info = parse("#ifdef 3\n#include \"a.h\"\n#elifdef B\n#include \"b.h\"\n#endif\n");
        assertThat(listener.getErrors()).isEqualTo(1);
        assertThat(info.getDirectives()).containsExactly(quoted("a.h"), quoted("b.h"));
    }

    @Test
    public void testBadConditionInsideBlock() throws Exception {
        SourceInfo info = parse("#ifdef X\n"
                + "#if A +\n#include \"a.h\"\n#else\n#include \"b.h\"\n#endif\n"
                + "#else\n#include \"c.h\"\n#endif\n");
        assertThat(listener.getErrors()).isEqualTo(1);
        assertThat(info.getDirectives()).containsExactly(new Directive.IfBlock(Arrays.asList(
                new ConditionalBranch(ConditionalBranch.Kind.IF, new Expr.Defined("X"),
                        Arrays.<Directive>asList(quoted("a.h"), quoted("b.h"))),
                new ConditionalBranch(ConditionalBranch.Kind.ELSE, null,
                        Arrays.<Directive>asList(quoted("c.h"))))));
    }

    @Test
    public void testBadElifContinuesPreviousBranch() throws Exception {
        SourceInfo info = parse("#ifdef A\n#include \"a.h\"\n"
                + "#elif B ==\n#include \"b.h\"\n"
                + "#else\n#include \"c.h\"\n#endif\n");
        assertThat(listener.getErrors()).isEqualTo(1);
        assertThat(info.getDirectives()).containsExactly(new Directive.IfBlock(Arrays.asList(
                new ConditionalBranch(ConditionalBranch.Kind.IF, new Expr.Defined("A"),
                        Arrays.<Directive>asList(quoted("a.h"), quoted("b.h"))),
                new ConditionalBranch(ConditionalBranch.Kind.ELSE, null,
                        Arrays.<Directive>asList(quoted("c.h"))))));
        assertThat(info.collectReachableIncludes(Environment.empty())).containsExactly(quoted("c.h"));
    }

    @Test
    public void testBranchAfterElseIsDropped() throws Exception {
        SourceInfo info = parse("#if X\n#else\n#include \"b.h\"\n#elif Y\n#include \"c.h\"\n#else\n#endif\n");
        assertThat(listener.getErrors()).isEqualTo(2);
        Directive.IfBlock block = (Directive.IfBlock) info.getDirectives().get(0);
        assertThat(block.getBranches()).extracting(ConditionalBranch::getKind).containsExactly(
                ConditionalBranch.Kind.IF, ConditionalBranch.Kind.ELSE);
        assertThat(info.collectIncludes()).containsExactly(quoted("b.h"));
    }

    /*
     * An unclosed block discards every directive of the file, including
     * those before the block. This looks like an oversight; a partial
     * result would be more useful.
     */
    @Test
    public void testUnterminatedBlockDiscardsDirectives() throws Exception {
        SourceInfo info = parse("#include \"a.h\"\nint main() {}\n#if 1\n#include \"b.h\"\n");
        assertThat(info.getDirectives()).isEmpty();
        assertThat(info.hasMain()).isTrue();
        assertThat(listener.getErrors()).isEqualTo(1);
        assertThat(listener.messages.get(0)).isEqualTo("test.c:3:1: error: Unterminated #if");
    }

    @Test
    public void testDirectivesInCommentsAndStrings() throws Exception {
        SourceInfo info = parse("// #include \"a.h\"\n"
                + "/* #include \"b.h\"\n#include \"c.h\" */\n"
                + "const char *s = \"#include <d.h>\";\n");
        assertThat(info.getDirectives()).isEmpty();
    }

    @Test
    public void testMain() throws Exception {
        assertThat(parse("int main(int argc, char **argv) { return 0; }\n").hasMain()).isTrue();
        assertThat(parse("int /* entry */ main (void)\n").hasMain()).isTrue();
        assertThat(parse("void main() {}\n").hasMain()).isFalse();
        assertThat(parse("int mainly(void);\n").hasMain()).isFalse();
        assertThat(parse("int main;\n").hasMain()).isFalse();
        assertThat(parse("#ifdef TEST\nint main() {}\n#endif\n").hasMain()).isTrue();
    }

    @Test
    public void testLexerErrorsPropagate() {
        assertThatThrownBy(() -> parse("#include \"a.h\"\n/* open"))
                .isInstanceOf(LexerException.class);
    }

    @Test
    public void testParseWithoutListener() throws Exception {
        SourceInfo info = Parser.parse("#include <a.h>\n");
        assertThat(info.collectIncludes()).containsExactly(system("a.h"));
        assertThat(Parser.parse("x.c", "#include <a.h>\n".getBytes(StandardCharsets.UTF_8))).isEqualTo(info);
    }
}
