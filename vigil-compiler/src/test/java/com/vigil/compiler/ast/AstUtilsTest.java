package com.vigil.compiler.ast;

import com.vigil.compiler.TranslationUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * AstUtils 查询测试
 */
class AstUtilsTest {

    private static List<String> strs(List<Token> toks) {
        return toks.stream().map(Token::getStr).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("展开与计数")
    class FlattenTests {

        @Test
        @DisplayName("按运算符展开")
        void testFlatten() {
            TranslationUnit tu = TranslationUnit.parse("x = a && b && (c || d);");
            Token and = tu.findLast("&&");
            assertEquals(List.of("a", "b", "||"), strs(AstUtils.astFlatten(and, "&&")));
            assertEquals(3, AstUtils.astCount(and, "&&"));
            assertEquals(1, AstUtils.astCount(tu.find("a"), "&&"));
            assertEquals(0, AstUtils.astCount(null, "&&"));
        }

        @Test
        @DisplayName("深度耗尽时计数饱和")
        void testCountDepthLimit() {
            TranslationUnit tu = TranslationUnit.parse("x = a && b && c;");
            assertEquals(Short.MAX_VALUE * 2, AstUtils.astCount(tu.findLast("&&"), "&&", 0));
        }

        @Test
        @DisplayName("子树包含表达式")
        void testAstHasExpr() {
            TranslationUnit tu = TranslationUnit.parse("x = a + b * c;");
            Token plus = tu.find("+");
            assertTrue(AstUtils.astHasExpr(plus, tu.find("c").getExprId()));
            assertFalse(AstUtils.astHasExpr(plus, tu.find("x").getExprId()));
            assertTrue(AstUtils.astHasVar(plus, tu.find("b").getVarId()));
        }
    }

    @Nested
    @DisplayName("位置")
    class PositionTests {

        @Test
        @DisplayName("跳过整条语句")
        void testNextAfterRightmostLeaf() {
            TranslationUnit tu = TranslationUnit.parse("x = (a + b); y = f(a, b); z = 1;");
            assertEquals(";", AstUtils.nextAfterAstRightmostLeaf(tu.find("=")).getStr());
            assertSame(tu.find("y").getPrevious(), AstUtils.nextAfterAstRightmostLeaf(tu.find("=")));
            Token second = tu.find("y =").getNext();
            assertSame(tu.find("z").getPrevious(), AstUtils.nextAfterAstRightmostLeaf(second));
        }

        @Test
        @DisplayName("条件不吞掉控制括号")
        void testConditionParen() {
            TranslationUnit tu = TranslationUnit.parse("void f(int a) { if (a > 1) { a = 0; } }");
            Token cond = tu.find(">");
            assertEquals(")", AstUtils.nextAfterAstRightmostLeaf(cond).getStr());
        }

        @Test
        @DisplayName("最左叶子之前")
        void testPreviousBeforeLeftmostLeaf() {
            TranslationUnit tu = TranslationUnit.parse("y = a + b;");
            assertEquals("=", AstUtils.previousBeforeAstLeftmostLeaf(tu.find("+")).getStr());
            assertNull(AstUtils.previousBeforeAstLeftmostLeaf(tu.find("=")));
        }

        @Test
        @DisplayName("先后顺序")
        void testPrecedes() {
            TranslationUnit tu = TranslationUnit.parse("y = a + b;");
            assertTrue(AstUtils.precedes(tu.find("a"), tu.find("b")));
            assertFalse(AstUtils.precedes(tu.find("b"), tu.find("a")));
            assertFalse(AstUtils.precedes(null, tu.find("a")));
        }
    }

    @Nested
    @DisplayName("条件")
    class ConditionTests {

        private final String source = "void f(int a) {\n"
                + "  if (a > 1) { a = 0; } else { a = 2; }\n"
                + "  while (a) { a--; }\n"
                + "  for (int i = 0; i < a; i++) { }\n"
                + "  do { a++; } while (a < 5);\n"
                + "}\n";

        @Test
        @DisplayName("由块结尾找到条件")
        void testCondTokFromEnd() {
            TranslationUnit tu = TranslationUnit.parse(source);
            Token ifEnd = tu.find("a = 0 ; }").tokAt(4);
            Token elseEnd = tu.find("a = 2 ; }").tokAt(4);
            Token gt = tu.find(">");
            assertSame(gt, AstUtils.getCondTokFromEnd(ifEnd));
            assertSame(gt, AstUtils.getCondTokFromEnd(elseEnd));
            Token forEnd = tu.find("i ++ ) {").tokAt(4);
            assertEquals("<", AstUtils.getCondTokFromEnd(forEnd).getStr());
            Token doEnd = tu.find("a ++ ; }").tokAt(3);
            assertNull(AstUtils.getCondTokFromEnd(doEnd));
            assertNull(AstUtils.getCondTokFromEnd(tu.getTokenList().back()));
        }

        @Test
        @DisplayName("三段式 for 循环")
        void testBasicForLoop() {
            TranslationUnit tu = TranslationUnit.parse(source);
            assertTrue(AstUtils.isBasicForLoop(tu.find("i ++ ) {").tokAt(3)));
            assertFalse(AstUtils.isBasicForLoop(tu.find("while ( a )").tokAt(4)));
        }

        @Test
        @DisplayName("布尔上下文")
        void testUsedAsBool() {
            TranslationUnit tu = TranslationUnit.parse("void f(int a, int b) { if (a) { } x = !b; y = a + 1; z = a ? 1 : 2; for (;b;) { } }");
            assertTrue(AstUtils.isUsedAsBool(tu.find("( a )").getNext()));
            assertTrue(AstUtils.isUsedAsBool(tu.find("! b").getNext()));
            assertFalse(AstUtils.isUsedAsBool(tu.find("a + 1")));
            assertTrue(AstUtils.isUsedAsBool(tu.find("a ?")));
            assertTrue(AstUtils.isUsedAsBool(tu.find("; b ;").getNext()));
        }
    }

    @Nested
    @DisplayName("调用")
    class CallTests {

        @Test
        @DisplayName("实参及其所在调用")
        void testArguments() {
            TranslationUnit tu = TranslationUnit.parse("void g(int a, int b, int c); void f(int x) { g(x, 2, 3); }");
            Token paren = tu.find("g ( x").getNext();
            assertThat(strs(AstUtils.getArguments(paren))).containsExactly("x", "2", "3");
            int[] index = new int[1];
            assertSame(paren, AstUtils.getCallParen(tu.find("3"), index));
            assertEquals(2, index[0]);
            assertNull(AstUtils.getCallParen(paren, null));
        }
    }
}
