package com.vigil.compiler.parser;

import com.vigil.compiler.analysis.Scope;
import com.vigil.compiler.ast.Token;

import static com.vigil.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 *
 * <p>控制语句的体在分词阶段已规范化为花括号块。</p>
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    /** 解析语句直到 end（不消费 end） */
    void parseStatementsUntil(Token end) {
        while (!parser.isAtEnd() && parser.current != end) {
            parseStatement();
        }
    }

    void parseStatement() {
        switch (parser.current.getType()) {
            case LBRACE:
                parseBody(Scope.ScopeType.UNCONDITIONAL, null, null);
                break;
            case KW_IF:
                parseIf();
                break;
            case KW_WHILE:
                parseWhile();
                break;
            case KW_DO:
                parseDoWhile();
                break;
            case KW_FOR:
                parseFor();
                break;
            case KW_RETURN:
                parseReturn();
                break;
            case KW_BREAK:
            case KW_CONTINUE:
                parser.advance();
                parser.expect(SEMICOLON, "Expected ';'");
                break;
            case SEMICOLON:
                parser.advance();
                break;
            default:
                if (parser.declParser.isDeclarationStart(parser.current)) {
                    parser.declParser.parseDeclaration(false);
                } else {
                    parser.exprParser.parseExpression();
                    parser.expect(SEMICOLON, "Expected ';' after expression");
                }
                break;
        }
    }

    /**
     * 解析花括号块并建立对应作用域
     */
    Scope parseBody(Scope.ScopeType type, Token classDef, Token condition) {
        Token open = parser.expect(LBRACE, "Expected '{'");
        Scope scope = parser.newScope(type, classDef);
        scope.setBody(open, open.getLink());
        scope.setCondition(condition);
        parser.pushScope(scope);
        try {
            parseStatementsUntil(open.getLink());
            parser.expect(RBRACE, "Expected '}'");
        } finally {
            parser.popScope();
        }
        return scope;
    }

    /** 控制括号：'(' 的左操作数为关键词，右操作数为条件 */
    private Token parseCondition(Token keyword) {
        Token paren = parser.expect(LPAREN, "Expected '(' after '" + keyword.getStr() + "'");
        Token cond = parser.exprParser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after condition");
        paren.setAstOperand1(keyword);
        paren.setAstOperand2(cond);
        return cond;
    }

    private void parseIf() {
        Token keyword = parser.advance();
        Token cond = parseCondition(keyword);
        parseBody(Scope.ScopeType.IF, keyword, cond);
        if (parser.check(KW_ELSE)) {
            Token elseTok = parser.advance();
            parseBody(Scope.ScopeType.ELSE, elseTok, cond);
        }
    }

    private void parseWhile() {
        Token keyword = parser.advance();
        Token cond = parseCondition(keyword);
        parseBody(Scope.ScopeType.WHILE, keyword, cond);
    }

    private void parseDoWhile() {
        Token keyword = parser.advance();
        Scope scope = parseBody(Scope.ScopeType.DO, keyword, null);
        Token whileTok = parser.expect(KW_WHILE, "Expected 'while' after do body");
        scope.setCondition(parseCondition(whileTok));
        parser.expect(SEMICOLON, "Expected ';' after do-while");
    }

    /**
     * for (init; cond; inc)：'(' 右操作数为第一个 ';'，其左为 init、右为第二个 ';'，
     * 第二个 ';' 的左右分别为条件与步进；范围 for 用 ':' 连接变量与范围
     */
    private void parseFor() {
        Token keyword = parser.advance();
        Token paren = parser.expect(LPAREN, "Expected '(' after 'for'");
        Scope scope = parser.newScope(Scope.ScopeType.FOR, keyword);
        parser.pushScope(scope);
        try {
            Token init = null;
            if (!parser.check(SEMICOLON)) {
                init = parser.declParser.isDeclarationStart(parser.current)
                        ? parser.declParser.parseForInitDeclaration()
                        : parser.exprParser.parseExpression();
            }
            paren.setAstOperand1(keyword);
            if (parser.check(COLON)) {
                Token colon = parser.advance();
                Token range = parser.exprParser.parseExpression();
                parser.expect(RPAREN, "Expected ')' after range");
                colon.setAstOperand1(init);
                colon.setAstOperand2(range);
                paren.setAstOperand2(colon);
            } else {
                Token semi1 = parser.expect(SEMICOLON, "Expected ';' in for");
                Token cond = parser.check(SEMICOLON) ? null : parser.exprParser.parseExpression();
                Token semi2 = parser.expect(SEMICOLON, "Expected ';' in for");
                Token inc = parser.check(RPAREN) ? null : parser.exprParser.parseExpression();
                parser.expect(RPAREN, "Expected ')' after for");
                semi1.setAstOperand1(init);
                semi1.setAstOperand2(semi2);
                semi2.setAstOperand1(cond);
                semi2.setAstOperand2(inc);
                paren.setAstOperand2(semi1);
                scope.setCondition(cond);
            }
            Token open = parser.expect(LBRACE, "Expected '{'");
            scope.setBody(open, open.getLink());
            parseStatementsUntil(open.getLink());
            parser.expect(RBRACE, "Expected '}'");
        } finally {
            parser.popScope();
        }
    }

    private void parseReturn() {
        Token keyword = parser.advance();
        if (!parser.check(SEMICOLON)) {
            keyword.setAstOperand1(parser.exprParser.parseExpression());
        }
        parser.expect(SEMICOLON, "Expected ';' after return");
    }
}
