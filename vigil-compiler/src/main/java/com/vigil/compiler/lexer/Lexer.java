package com.vigil.compiler.lexer;

import com.vigil.compiler.ast.Token;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * C 系源码词法分析器
 *
 * <p>直接产出表达式图节点 {@link Token}。预处理指令整行跳过。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<Token>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private boolean lineHasTokens = false;

    private final PrintStream errStream;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("for", TokenType.KW_FOR);
        map.put("while", TokenType.KW_WHILE);
        map.put("do", TokenType.KW_DO);
        map.put("return", TokenType.KW_RETURN);
        map.put("break", TokenType.KW_BREAK);
        map.put("continue", TokenType.KW_CONTINUE);

        // 常量
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        map.put("nullptr", TokenType.KW_NULLPTR);

        // 修饰符
        map.put("const", TokenType.KW_CONST);
        map.put("static", TokenType.KW_STATIC);
        map.put("extern", TokenType.KW_EXTERN);
        map.put("inline", TokenType.KW_INLINE);
        map.put("volatile", TokenType.KW_VOLATILE);
        map.put("virtual", TokenType.KW_VIRTUAL);
        map.put("unsigned", TokenType.KW_UNSIGNED);
        map.put("signed", TokenType.KW_SIGNED);

        // 内置类型
        map.put("void", TokenType.KW_VOID);
        map.put("bool", TokenType.KW_BOOL);
        map.put("char", TokenType.KW_CHAR);
        map.put("short", TokenType.KW_SHORT);
        map.put("int", TokenType.KW_INT);
        map.put("long", TokenType.KW_LONG);
        map.put("float", TokenType.KW_FLOAT);
        map.put("double", TokenType.KW_DOUBLE);
        map.put("auto", TokenType.KW_AUTO);

        // 类型操作
        map.put("sizeof", TokenType.KW_SIZEOF);
        map.put("static_cast", TokenType.KW_STATIC_CAST);
        map.put("const_cast", TokenType.KW_CONST_CAST);
        map.put("reinterpret_cast", TokenType.KW_REINTERPRET_CAST);
        map.put("dynamic_cast", TokenType.KW_DYNAMIC_CAST);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        this(source, fileName, System.err);
    }

    public Lexer(String source, String fileName, PrintStream errStream) {
        this.source = source;
        this.fileName = fileName;
        this.errStream = errStream;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    /**
     * 执行词法分析，返回 Token 列表（末尾为 EOF）
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }

        tokens.add(new Token(TokenType.EOF, "", line, column));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '?': addToken(TokenType.QUESTION); break;
            case '~': addToken(TokenType.BIT_NOT); break;

            case '#':
                if (!lineHasTokens) {
                    // 预处理指令
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else {
                    error("Unexpected character '#'");
                }
                break;

            case '.':
                if (isDigit(peek())) {
                    number();
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case ':':
                addToken(match(':') ? TokenType.DOUBLE_COLON : TokenType.COLON);
                break;

            case '+':
                if (match('+')) addToken(TokenType.INC);
                else if (match('=')) addToken(TokenType.PLUS_ASSIGN);
                else addToken(TokenType.PLUS);
                break;

            case '-':
                if (match('-')) addToken(TokenType.DEC);
                else if (match('=')) addToken(TokenType.MINUS_ASSIGN);
                else if (match('>')) addToken(TokenType.ARROW);
                else addToken(TokenType.MINUS);
                break;

            case '*':
                addToken(match('=') ? TokenType.MUL_ASSIGN : TokenType.MUL);
                break;

            case '/':
                if (match('/')) {
                    // 单行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    blockComment();
                } else if (match('=')) {
                    addToken(TokenType.DIV_ASSIGN);
                } else {
                    addToken(TokenType.DIV);
                }
                break;

            case '%':
                addToken(match('=') ? TokenType.MOD_ASSIGN : TokenType.MOD);
                break;

            case '^':
                addToken(match('=') ? TokenType.XOR_ASSIGN : TokenType.BIT_XOR);
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;

            case '!':
                addToken(match('=') ? TokenType.NE : TokenType.NOT);
                break;

            case '<':
                if (match('<')) {
                    addToken(match('=') ? TokenType.SHL_ASSIGN : TokenType.SHL);
                } else {
                    addToken(match('=') ? TokenType.LE : TokenType.LT);
                }
                break;

            case '>':
                if (match('>')) {
                    addToken(match('=') ? TokenType.SHR_ASSIGN : TokenType.SHR);
                } else {
                    addToken(match('=') ? TokenType.GE : TokenType.GT);
                }
                break;

            case '&':
                if (match('&')) addToken(TokenType.AND);
                else if (match('=')) addToken(TokenType.AND_ASSIGN);
                else addToken(TokenType.BIT_AND);
                break;

            case '|':
                if (match('|')) addToken(TokenType.OR);
                else if (match('=')) addToken(TokenType.OR_ASSIGN);
                else addToken(TokenType.BIT_OR);
                break;

            // 空白字符
            case ' ':
            case '\r':
            case '\t':
                break;

            case '\n':
                newLine();
                break;

            case '"':
                string();
                break;

            case '\'':
                character();
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
        lineHasTokens = false;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, String strValue) {
        String text = source.substring(start, current);
        int tokenColumn = column - (current - start);
        tokens.add(new Token(type, text, strValue, line, tokenColumn));
        lineHasTokens = true;
    }

    // === 复杂 Token 扫描 ===

    private void string() {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\n') {
                error("Unterminated string");
                return;
            }
            if (peek() == '\\') {
                advance();
                value.append(escapeChar());
            } else {
                value.append(advance());
            }
        }

        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }

        advance(); // 闭合的 "
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    private char escapeChar() {
        if (isAtEnd()) {
            error("Invalid escape at end of input");
            return '\0';
        }
        char c = advance();
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            case 'a': return '\u0007';
            case 'b': return '\b';
            case 'f': return '\f';
            case 'v': return '\u000B';
            case '\\': return '\\';
            case '\'': return '\'';
            case '"': return '"';
            case '?': return '?';
            case 'x': {
                int value = 0;
                int digits = 0;
                while (isHexDigit(peek())) {
                    value = value * 16 + Character.digit(advance(), 16);
                    digits++;
                }
                if (digits == 0) {
                    error("Invalid hex escape");
                }
                return (char) (value & 0xFF);
            }
            default:
                if (c >= '0' && c <= '7') {
                    // 八进制转义，最多三位
                    int value = c - '0';
                    for (int i = 0; i < 2 && peek() >= '0' && peek() <= '7'; i++) {
                        value = value * 8 + (advance() - '0');
                    }
                    return (char) (value & 0xFF);
                }
                error("Invalid escape character: \\" + c);
                return c;
        }
    }

    private void character() {
        if (isAtEnd()) {
            error("Unterminated character literal");
            return;
        }

        char value;
        if (peek() == '\\') {
            advance();
            value = escapeChar();
        } else {
            value = advance();
        }

        if (peek() != '\'') {
            error("Unterminated character literal");
            return;
        }
        advance();

        addToken(TokenType.CHAR_LITERAL, String.valueOf(value));
    }

    private void number() {
        boolean isFloat = source.charAt(start) == '.';
        if (source.charAt(start) == '0' && (peek() == 'x' || peek() == 'X')) {
            advance();
            while (isHexDigit(peek())) advance();
        } else if (source.charAt(start) == '0' && (peek() == 'b' || peek() == 'B')) {
            advance();
            while (peek() == '0' || peek() == '1') advance();
        } else {
            while (isDigit(peek())) advance();

            // 小数部分
            if (!isFloat && peek() == '.') {
                isFloat = true;
                advance();
                while (isDigit(peek())) advance();
            }

            // 指数部分
            if ((peek() == 'e' || peek() == 'E')
                    && (isDigit(peekNext()) || peekNext() == '+' || peekNext() == '-')) {
                isFloat = true;
                advance();
                if (peek() == '+' || peek() == '-') advance();
                while (isDigit(peek())) advance();
            }
        }

        // 后缀
        if (isFloat) {
            if (peek() == 'f' || peek() == 'F' || peek() == 'l' || peek() == 'L') advance();
            addToken(TokenType.FLOAT_LITERAL);
            return;
        }
        while (peek() == 'u' || peek() == 'U' || peek() == 'l' || peek() == 'L') advance();
        if (isAlphaNumeric(peek())) {
            while (isAlphaNumeric(peek())) advance();
            error("Invalid numeric literal: " + source.substring(start, current));
            return;
        }
        addToken(TokenType.INT_LITERAL);
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            if (peek() == '\n') {
                advance();
                line++;
                column = 1;
                continue;
            }
            advance();
        }
        error("Unterminated block comment");
    }

    private void error(String message) {
        String errorMsg = String.format("[%s:%d:%d] Lexer error: %s",
                fileName, line, column, message);
        errStream.println(errorMsg);
        addToken(TokenType.ERROR, message);
    }
}
