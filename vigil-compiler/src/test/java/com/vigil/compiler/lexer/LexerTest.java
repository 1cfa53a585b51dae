package com.vigil.compiler.lexer;

import com.vigil.compiler.ast.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回非 EOF 的 token 列表 */
    private List<Token> tokens(String source) {
        return new Lexer(source, "<test>").scanTokens().stream()
                .filter(t -> t.getType() != TokenType.EOF)
                .collect(Collectors.toList());
    }

    private List<TokenType> types(String source) {
        return tokens(source).stream().map(Token::getType).collect(Collectors.toList());
    }

    /** 扫描源码，捕获错误输出 */
    private String scanWithErrors(String source) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos, true, StandardCharsets.UTF_8);
        new Lexer(source, "<test>", ps).scanTokens();
        return baos.toString(StandardCharsets.UTF_8);
    }

    private void assertSingleToken(String source, TokenType expected) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expected, toks.get(0).getType());
    }

    @Nested
    @DisplayName("运算符")
    class OperatorTests {

        @Test
        @DisplayName("多字符运算符取最长匹配")
        void testLongestMatch() {
            assertSingleToken("<<=", TokenType.SHL_ASSIGN);
            assertSingleToken(">>", TokenType.SHR);
            assertSingleToken("->", TokenType.ARROW);
            assertSingleToken("::", TokenType.DOUBLE_COLON);
            assertSingleToken("&&", TokenType.AND);
            assertSingleToken("||", TokenType.OR);
            assertSingleToken("!=", TokenType.NE);
            assertSingleToken("++", TokenType.INC);
        }

        @Test
        @DisplayName("表达式的 token 序列")
        void testExpression() {
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.PLUS_ASSIGN, TokenType.IDENTIFIER,
                            TokenType.MUL, TokenType.INT_LITERAL, TokenType.SEMICOLON),
                    types("x += y * 3;"));
        }
    }

    @Nested
    @DisplayName("关键词与标识符")
    class KeywordTests {

        @Test
        @DisplayName("类型关键词与控制关键词")
        void testKeywords() {
            assertEquals(List.of(TokenType.KW_UNSIGNED, TokenType.KW_INT, TokenType.IDENTIFIER),
                    types("unsigned int n"));
            assertSingleToken("static_cast", TokenType.KW_STATIC_CAST);
            assertSingleToken("nullptr", TokenType.KW_NULLPTR);
            assertSingleToken("size_t", TokenType.IDENTIFIER);
        }

        @Test
        @DisplayName("预处理行被跳过")
        void testPreprocessorLine() {
            assertEquals(List.of(TokenType.KW_INT, TokenType.IDENTIFIER, TokenType.SEMICOLON),
                    types("#include <string.h>\nint x;"));
        }

        @Test
        @DisplayName("注释被跳过")
        void testComments() {
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER),
                    types("a // line\n /* block\n comment */ b"));
        }
    }

    @Nested
    @DisplayName("字面量")
    class LiteralTests {

        @Test
        @DisplayName("整数与浮点")
        void testNumbers() {
            assertSingleToken("42", TokenType.INT_LITERAL);
            assertSingleToken("0x1F", TokenType.INT_LITERAL);
            assertSingleToken("10u", TokenType.INT_LITERAL);
            assertSingleToken("100UL", TokenType.INT_LITERAL);
            assertSingleToken("1.5", TokenType.FLOAT_LITERAL);
            assertSingleToken("2.0f", TokenType.FLOAT_LITERAL);
            assertSingleToken("1e10", TokenType.FLOAT_LITERAL);
            assertSingleToken(".5", TokenType.FLOAT_LITERAL);
        }

        @Test
        @DisplayName("字符串反转义")
        void testStringEscapes() {
            List<Token> toks = tokens("\"a\\tb\\x41\"");
            assertEquals(1, toks.size());
            assertEquals(TokenType.STRING_LITERAL, toks.get(0).getType());
            assertEquals("a\tbA", toks.get(0).getStrValue());
            assertEquals("\"a\\tb\\x41\"", toks.get(0).getStr());
        }

        @Test
        @DisplayName("字符字面量")
        void testCharLiteral() {
            List<Token> toks = tokens("'\\n' 'z'");
            assertEquals(2, toks.size());
            assertEquals("\n", toks.get(0).getStrValue());
            assertEquals("z", toks.get(1).getStrValue());
        }
    }

    @Nested
    @DisplayName("位置与错误")
    class PositionTests {

        @Test
        @DisplayName("行列号")
        void testLineColumn() {
            List<Token> toks = tokens("int a;\n  a = 1;");
            Token second = toks.get(3);
            assertEquals("a", second.getStr());
            assertEquals(2, second.getLine());
            assertEquals(3, second.getColumn());
        }

        @Test
        @DisplayName("非法字符产生 ERROR token 并输出错误")
        void testUnexpectedCharacter() {
            String errors = scanWithErrors("a @ b");
            assertTrue(errors.contains("Unexpected character"));
            assertTrue(types("a @ b").contains(TokenType.ERROR));
        }

        @Test
        @DisplayName("未闭合字符串")
        void testUnterminatedString() {
            assertTrue(scanWithErrors("\"abc").contains("Unterminated string"));
        }

        @Test
        @DisplayName("非法数字后缀")
        void testInvalidNumber() {
            assertTrue(scanWithErrors("12abc").contains("Invalid numeric literal"));
        }
    }
}
