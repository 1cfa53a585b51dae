package com.vigil.compiler.parser;

import com.vigil.compiler.analysis.ValueType;
import com.vigil.compiler.analysis.Variable;
import com.vigil.compiler.ast.Token;
import com.vigil.compiler.lexer.TokenType;

import static com.vigil.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>运算符 token 本身成为 AST 节点：二元运算左右操作数分别为 astOperand1/astOperand2，
 * 一元运算只有 astOperand1。分组括号不进入 AST。</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    /** 逗号表达式（最低优先级） */
    Token parseExpression() {
        Token left = parseAssignment();
        while (parser.check(COMMA)) {
            Token comma = parser.advance();
            left = binary(left, comma, parseAssignment());
        }
        return left;
    }

    // 赋值表达式（右结合）
    Token parseAssignment() {
        Token left = parseConditional();
        if (parser.current != null && parser.current.isAssignmentOp()) {
            Token op = parser.advance();
            Token right = parser.check(LBRACE) ? parseInitList() : parseAssignment();
            return binary(left, op, right);
        }
        return left;
    }

    // 三元表达式：'?' 的右操作数为 ':'，':' 的左右为两个分支
    private Token parseConditional() {
        Token cond = parseBinary(0);
        if (parser.check(QUESTION)) {
            Token question = parser.advance();
            Token thenExpr = parseAssignment();
            Token colon = parser.expect(COLON, "Expected ':' in conditional expression");
            Token elseExpr = parseAssignment();
            binary(thenExpr, colon, elseExpr);
            return binary(cond, question, colon);
        }
        return cond;
    }

    // 二元运算符优先级，从低到高
    private static final TokenType[][] LEVELS = {
            {OR},
            {AND},
            {BIT_OR},
            {BIT_XOR},
            {BIT_AND},
            {EQ, NE},
            {LT, GT, LE, GE},
            {SHL, SHR},
            {PLUS, MINUS},
            {MUL, DIV, MOD},
    };

    private Token parseBinary(int level) {
        if (level >= LEVELS.length) {
            return parseUnary();
        }
        Token left = parseBinary(level + 1);
        while (parser.checkAny(LEVELS[level])) {
            Token op = parser.advance();
            left = binary(left, op, parseBinary(level + 1));
        }
        return left;
    }

    private Token parseUnary() {
        if (parser.checkAny(NOT, BIT_NOT, MINUS, PLUS, MUL, BIT_AND, INC, DEC)) {
            Token op = parser.advance();
            op.setAstOperand1(parseUnary());
            return op;
        }
        if (parser.check(KW_SIZEOF)) {
            Token op = parser.advance();
            if (parser.check(LPAREN) && isTypeInParens(parser.current)) {
                Token open = parser.advance();
                open.setDeclSpecifier(true);
                parser.declParser.parseTypeUntil(open.getLink());
                parser.advance().setDeclSpecifier(true);
                return op;
            }
            op.setAstOperand1(parseUnary());
            return op;
        }
        if (parser.check(LPAREN) && isCastParen(parser.current)) {
            Token open = parser.advance();
            ValueType type = parser.declParser.parseTypeUntil(open.getLink());
            parser.advance().setDeclSpecifier(true);
            open.setCast(true);
            open.setValueType(type);
            open.setAstOperand1(parseUnary());
            return open;
        }
        return parsePostfix(parsePrimary());
    }

    private Token parsePostfix(Token expr) {
        while (true) {
            if (parser.check(LPAREN)) {
                Token paren = parser.advance();
                Token args = parser.check(RPAREN) ? null : parseExpression();
                parser.expect(RPAREN, "Expected ')' after arguments");
                paren.setAstOperand1(expr);
                paren.setAstOperand2(args);
                expr = paren;
            } else if (parser.check(LBRACKET)) {
                Token bracket = parser.advance();
                Token index = parseExpression();
                parser.expect(RBRACKET, "Expected ']'");
                expr = binary(expr, bracket, index);
            } else if (parser.checkAny(DOT, ARROW)) {
                Token op = parser.advance();
                if (parser.current == null || !parser.current.isName()) {
                    throw ParseException.expected("member name", parser.current);
                }
                expr = binary(expr, op, parser.advance());
            } else if (parser.checkAny(INC, DEC)) {
                Token op = parser.advance();
                op.setPostfix(true);
                op.setAstOperand1(expr);
                expr = op;
            } else {
                return expr;
            }
        }
    }

    private Token parsePrimary() {
        Token tok = parser.current;
        if (tok == null) {
            throw new ParseException("Expected expression", null);
        }
        switch (tok.getType()) {
            case INT_LITERAL:
            case FLOAT_LITERAL:
            case CHAR_LITERAL:
            case STRING_LITERAL:
            case KW_TRUE:
            case KW_FALSE:
            case KW_NULLPTR:
                parser.advance();
                parser.literalHelper.annotate(tok);
                return tok;
            case IDENTIFIER:
                return parseName();
            case LPAREN: {
                parser.advance();
                Token inner = parseExpression();
                parser.expect(RPAREN, "Expected ')'");
                return inner;
            }
            case LBRACE:
                return parseInitList();
            case KW_STATIC_CAST:
            case KW_CONST_CAST:
            case KW_REINTERPRET_CAST:
            case KW_DYNAMIC_CAST:
                return parseCppCast();
            default:
                throw ParseException.expected("expression", tok);
        }
    }

    /**
     * 名字：限定名构成 '::' 节点；后跟 '(' 的名字留给函数解析；
     * 其余按作用域解析为变量，找不到时视为隐式全局变量
     */
    private Token parseName() {
        Token name = parser.advance();
        if (parser.check(DOUBLE_COLON)) {
            Token node = name;
            while (parser.check(DOUBLE_COLON)) {
                Token op = parser.advance();
                Token rhs = parser.expect(IDENTIFIER, "Expected name after '::'");
                node = binary(node, op, rhs);
            }
            return node;
        }
        if (parser.check(LPAREN)) {
            return name;
        }
        Variable var = parser.currentScope.findVariable(name.getStr());
        if (var != null) {
            name.setVariable(var);
            name.setVarId(var.getDeclarationId());
        } else {
            parser.symbols.implicitVariable(name);
        }
        return name;
    }

    /** {@code static_cast<T>(e)}：'(' 的左操作数为转换关键词，右操作数为被转换表达式 */
    private Token parseCppCast() {
        Token keyword = parser.advance();
        Token lt = parser.expect(LT, "Expected '<' after " + keyword.getStr());
        lt.setDeclSpecifier(true);
        Token gt = lt;
        int depth = 0;
        for (Token t = lt; t != null; t = t.getNext()) {
            if (t.is(LT)) depth++;
            if (t.is(GT)) depth--;
            if (depth == 0) {
                gt = t;
                break;
            }
        }
        if (gt == lt) {
            throw ParseException.expected("'>'", lt);
        }
        ValueType type = parser.declParser.parseTypeUntil(gt);
        parser.advance().setDeclSpecifier(true);
        Token paren = parser.expect(LPAREN, "Expected '(' after cast type");
        Token expr = parseExpression();
        parser.expect(RPAREN, "Expected ')'");
        paren.setCast(true);
        paren.setValueType(type);
        return binary(keyword, paren, expr);
    }

    /** 花括号初始化列表，'{' 的左操作数为元素 */
    private Token parseInitList() {
        Token open = parser.advance();
        if (!parser.check(RBRACE)) {
            open.setAstOperand1(parseExpression());
        }
        parser.expect(RBRACE, "Expected '}'");
        return open;
    }

    // ============ 类型转换判定 ============

    private boolean isTypeInParens(Token open) {
        Token first = open.getNext();
        if (first == null || first == open.getLink()) return false;
        return isTypeTokens(first, open.getLink());
    }

    /**
     * (类型) 后跟操作数时视为 C 风格转换；类型由内置类型关键词、const、*、& 及 *_t 名字组成
     */
    private boolean isCastParen(Token open) {
        if (!isTypeInParens(open)) return false;
        Token after = open.getLink().getNext();
        if (after == null) return false;
        return after.isOneOf(IDENTIFIER, INT_LITERAL, FLOAT_LITERAL, CHAR_LITERAL, STRING_LITERAL,
                KW_TRUE, KW_FALSE, KW_NULLPTR, KW_SIZEOF, LPAREN, NOT, BIT_NOT, MINUS, PLUS, MUL,
                BIT_AND, INC, DEC) || after.getType().isCppCast();
    }

    private static boolean isTypeTokens(Token from, Token end) {
        boolean sawType = false;
        for (Token t = from; t != end; t = t.getNext()) {
            if (t.getType().isTypeKeyword() || (t.is(IDENTIFIER) && t.getStr().endsWith("_t"))) {
                sawType = true;
            } else if (!t.isOneOf(KW_CONST, MUL, BIT_AND)) {
                return false;
            }
        }
        return sawType;
    }

    private static Token binary(Token left, Token op, Token right) {
        op.setAstOperand1(left);
        op.setAstOperand2(right);
        return op;
    }
}
