package com.vigil.compiler.parser;

import com.vigil.compiler.ast.Token;

/**
 * 解析异常
 *
 * <p>只在构建表达式图时抛出；求值阶段从不抛出。</p>
 */
public class ParseException extends RuntimeException {
    private final Token token;
    private final String expected;

    public ParseException(String message, Token token) {
        this(message, token, null);
    }

    public ParseException(String message, Token token, String expected) {
        super(message);
        this.token = token;
        this.expected = expected;
    }

    /** “期望 X” 形式的异常 */
    public static ParseException expected(String what, Token found) {
        return new ParseException("Expected " + what, found, what);
    }

    public Token getToken() { return token; }
    public String getExpected() { return expected; }

    public int getLine() {
        return token != null ? token.getLine() : 0;
    }

    public int getColumn() {
        return token != null ? token.getColumn() : 0;
    }

    @Override
    public String getMessage() {
        if (token == null) {
            return super.getMessage() + " at end of input";
        }
        return String.format("%d:%d: %s (found '%s')",
                token.getLine(), token.getColumn(), super.getMessage(), token.getStr());
    }
}
