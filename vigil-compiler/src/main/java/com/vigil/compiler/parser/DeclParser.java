package com.vigil.compiler.parser;

import com.vigil.compiler.analysis.Function;
import com.vigil.compiler.analysis.Scope;
import com.vigil.compiler.analysis.ValueType;
import com.vigil.compiler.analysis.Variable;
import com.vigil.compiler.ast.Token;
import com.vigil.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.vigil.compiler.lexer.TokenType.*;

/**
 * 声明解析辅助类：声明说明符、声明符、函数
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    /** 声明说明符的解析结果 */
    static final class DeclSpec {
        ValueType type;
        boolean isStatic;
        boolean isVirtual;
    }

    // ============ 判定 ============

    /**
     * 从 tok 开始是否为声明：类型关键词/修饰符开头，
     * 或 "类型名 [*&]* 名字" 且类型名不是已知变量
     */
    boolean isDeclarationStart(Token tok) {
        if (tok == null) return false;
        if (tok.getType().isTypeKeyword() || tok.getType().isQualifier()) return true;
        if (!tok.is(IDENTIFIER) || parser.currentScope.findVariable(tok.getStr()) != null) return false;
        Token t = tok.getNext();
        while (t != null && t.is(DOUBLE_COLON) && t.getNext() != null && t.getNext().is(IDENTIFIER)) {
            t = t.tokAt(2);
        }
        if (t != null && t.is(LT)) {
            t = skipTemplateArgs(t, false);
            if (t == null) return false;
        }
        while (t != null && t.isOneOf(MUL, BIT_AND, AND, KW_CONST)) {
            t = t.getNext();
        }
        return t != null && t.is(IDENTIFIER) && t.getNext() != null
                && t.getNext().isOneOf(ASSIGN, SEMICOLON, COMMA, LPAREN, LBRACKET, LBRACE, COLON, RPAREN);
    }

    /**
     * 跳过模板实参 {@code <...>}，返回其后的 token；不配对返回 null
     */
    private static Token skipTemplateArgs(Token lt, boolean mark) {
        int depth = 0;
        for (Token t = lt; t != null; t = t.getNext()) {
            if (mark) t.setDeclSpecifier(true);
            if (t.is(LT)) {
                depth++;
            } else if (t.is(GT)) {
                depth--;
            } else if (t.is(SHR)) {
                depth -= 2;
            } else if (t.isOneOf(SEMICOLON, LBRACE, RBRACE)) {
                return null;
            }
            if (depth <= 0) return t.getNext();
        }
        return null;
    }

    // ============ 说明符 ============

    DeclSpec parseSpecifiers() {
        DeclSpec spec = new DeclSpec();
        boolean constness = false;
        boolean unsigned = false;
        boolean signed = false;
        int longs = 0;
        ValueType.Type base = null;
        String recordName = null;

        while (!parser.isAtEnd()) {
            Token tok = parser.current;
            TokenType type = tok.getType();
            if (type.isQualifier()) {
                if (type == KW_CONST) constness = true;
                if (type == KW_STATIC) spec.isStatic = true;
                if (type == KW_VIRTUAL) spec.isVirtual = true;
            } else if (type == KW_UNSIGNED) {
                unsigned = true;
            } else if (type == KW_SIGNED) {
                signed = true;
            } else if (type == KW_LONG) {
                longs++;
            } else if (type.isTypeKeyword()) {
                base = keywordType(type);
            } else if (type == IDENTIFIER && base == null && recordName == null && longs == 0
                    && !unsigned && !signed) {
                recordName = parseTypeName();
                continue;
            } else {
                break;
            }
            tok.setDeclSpecifier(true);
            parser.advance();
        }

        ValueType vt;
        if (recordName != null) {
            vt = namedType(recordName);
        } else {
            if (base == null || base == ValueType.Type.INT) {
                base = longs >= 2 ? ValueType.Type.LONGLONG : longs == 1 ? ValueType.Type.LONG
                        : base == null && !unsigned && !signed ? ValueType.Type.UNKNOWN : ValueType.Type.INT;
            } else if (base == ValueType.Type.DOUBLE && longs > 0) {
                base = ValueType.Type.DOUBLE;
            }
            ValueType.Sign sign;
            if (base == ValueType.Type.FLOAT || base == ValueType.Type.DOUBLE) {
                sign = ValueType.Sign.SIGNED;
            } else if (base == ValueType.Type.BOOL || base == ValueType.Type.VOID || base == ValueType.Type.UNKNOWN) {
                sign = ValueType.Sign.UNKNOWN;
            } else {
                sign = unsigned ? ValueType.Sign.UNSIGNED : ValueType.Sign.SIGNED;
            }
            vt = ValueType.of(base, sign);
        }
        spec.type = constness ? vt.withConst(true) : vt;
        return spec;
    }

    /** 限定名（含模板实参），只返回不含模板实参的名字 */
    private String parseTypeName() {
        StringBuilder sb = new StringBuilder();
        Token name = parser.advance();
        name.setDeclSpecifier(true);
        sb.append(name.getStr());
        while (parser.check(DOUBLE_COLON) && parser.peek(1) != null && parser.peek(1).is(IDENTIFIER)) {
            parser.advance().setDeclSpecifier(true);
            Token part = parser.advance();
            part.setDeclSpecifier(true);
            sb.append("::").append(part.getStr());
        }
        if (parser.check(LT)) {
            Token after = skipTemplateArgs(parser.current, true);
            if (after == null) {
                throw ParseException.expected("'>'", parser.current);
            }
            parser.jumpTo(after);
        }
        return sb.toString();
    }

    private static ValueType.Type keywordType(TokenType type) {
        switch (type) {
            case KW_VOID: return ValueType.Type.VOID;
            case KW_BOOL: return ValueType.Type.BOOL;
            case KW_CHAR: return ValueType.Type.CHAR;
            case KW_SHORT: return ValueType.Type.SHORT;
            case KW_INT: return ValueType.Type.INT;
            case KW_FLOAT: return ValueType.Type.FLOAT;
            case KW_DOUBLE: return ValueType.Type.DOUBLE;
            default: return ValueType.Type.UNKNOWN;
        }
    }

    /** 标准 typedef 名映射到内置类型，其余作为具名类型 */
    static ValueType namedType(String name) {
        String simple = name.startsWith("std::") ? name.substring(5) : name;
        switch (simple) {
            case "size_t":
            case "uintptr_t":
                return ValueType.of(ValueType.Type.LONG, ValueType.Sign.UNSIGNED);
            case "ssize_t":
            case "ptrdiff_t":
            case "intptr_t":
                return ValueType.of(ValueType.Type.LONG, ValueType.Sign.SIGNED);
            default:
                break;
        }
        if (simple.matches("u?int(8|16|32|64)_t")) {
            boolean unsigned = simple.startsWith("u");
            int bits = Integer.parseInt(simple.replaceAll("\\D", ""));
            ValueType.Type t = bits == 8 ? ValueType.Type.CHAR : bits == 16 ? ValueType.Type.SHORT
                    : bits == 32 ? ValueType.Type.INT : ValueType.Type.LONG;
            return ValueType.of(t, unsigned ? ValueType.Sign.UNSIGNED : ValueType.Sign.SIGNED);
        }
        return ValueType.record(name);
    }

    /**
     * 解析括号内的类型名（用于类型转换与 sizeof），标记为声明说明符
     */
    ValueType parseTypeUntil(Token end) {
        DeclSpec spec = parseSpecifiers();
        int pointer = 0;
        while (parser.current != end && !parser.isAtEnd()) {
            Token t = parser.advance();
            t.setDeclSpecifier(true);
            if (t.is(MUL)) pointer++;
        }
        return pointer > 0 ? spec.type.withPointer(spec.type.getPointer() + pointer) : spec.type;
    }

    // ============ 声明 ============

    /**
     * 解析一条声明（含结尾分号）
     *
     * @param topLevel 顶层时 "名字(" 总是函数
     */
    void parseDeclaration(boolean topLevel) {
        DeclSpec spec = parseSpecifiers();
        if (parser.check(SEMICOLON)) {
            parser.advance();
            return;
        }
        Token first = parseDeclaratorList(spec, topLevel);
        if (first != null) {
            parser.expect(SEMICOLON, "Expected ';' after declaration");
        }
    }

    /**
     * for 初始化部分的声明，不消费结尾分号；返回声明的 AST 根
     */
    Token parseForInitDeclaration() {
        DeclSpec spec = parseSpecifiers();
        return parseDeclaratorList(spec, false);
    }

    /**
     * 解析逗号分隔的声明符；遇到函数定义/声明时返回 null 且已消费完整函数
     */
    private Token parseDeclaratorList(DeclSpec spec, boolean topLevel) {
        List<Token> nodes = new ArrayList<Token>();
        List<Token> commas = new ArrayList<Token>();
        while (true) {
            int pointer = 0;
            boolean reference = false;
            while (parser.checkAny(MUL, BIT_AND, AND, KW_CONST)) {
                Token t = parser.advance();
                t.setDeclSpecifier(true);
                if (t.is(MUL)) pointer++;
                if (t.isOneOf(BIT_AND, AND)) reference = true;
            }
            Token name = parser.expect(IDENTIFIER, "Expected declarator name");
            if (nodes.isEmpty() && parser.check(LPAREN) && (topLevel || looksLikeParameters(parser.current))) {
                parseFunction(spec, name, pointer);
                return null;
            }
            nodes.add(parseDeclarator(spec, name, pointer, reference));
            if (parser.check(COMMA)) {
                commas.add(parser.advance());
            } else {
                break;
            }
        }
        Token result = nodes.get(0);
        for (int i = 0; i < commas.size(); i++) {
            Token comma = commas.get(i);
            comma.setAstOperand1(result);
            comma.setAstOperand2(nodes.get(i + 1));
            result = comma;
        }
        return result;
    }

    private boolean looksLikeParameters(Token paren) {
        Token first = paren.getNext();
        return first != null && (first.is(RPAREN) || isDeclarationStart(first));
    }

    /**
     * 单个变量声明符及其初始化，返回 AST 根（名字、'=' 或直接初始化括号）
     */
    private Token parseDeclarator(DeclSpec spec, Token name, int pointer, boolean reference) {
        boolean array = false;
        while (parser.check(LBRACKET)) {
            Token open = parser.current;
            for (Token t = open; t != open.getLink(); t = t.getNext()) {
                t.setDeclSpecifier(true);
            }
            open.getLink().setDeclSpecifier(true);
            parser.jumpTo(open.getLink().getNext());
            pointer++;
            array = true;
        }
        ValueType type = pointer > 0 ? spec.type.withPointer(spec.type.getPointer() + pointer) : spec.type;
        Scope scope = parser.currentScope;
        Variable.Kind kind;
        if (scope.getType() == Scope.ScopeType.GLOBAL) {
            kind = Variable.Kind.GLOBAL;
        } else {
            kind = spec.isStatic ? Variable.Kind.STATIC : Variable.Kind.LOCAL;
        }
        Variable var = parser.symbols.newVariable(name, type, scope, kind, -1);
        var.setReference(reference);
        var.setArray(array);

        if (parser.check(ASSIGN)) {
            Token eq = parser.advance();
            Token init = parser.exprParser.parseAssignment();
            eq.setAstOperand1(name);
            eq.setAstOperand2(init);
            return eq;
        }
        if (parser.checkAny(LPAREN, LBRACE)) {
            Token open = parser.advance();
            TokenType close = open.is(LPAREN) ? RPAREN : RBRACE;
            Token init = parser.check(close) ? null : parser.exprParser.parseExpression();
            parser.expect(close, "Expected '" + open.getLink().getStr() + "' after initializer");
            open.setDirectInit(true);
            open.setAstOperand1(name);
            open.setAstOperand2(init);
            return open;
        }
        return name;
    }

    // ============ 函数 ============

    private void parseFunction(DeclSpec spec, Token name, int pointer) {
        ValueType returnType = pointer > 0 ? spec.type.withPointer(spec.type.getPointer() + pointer) : spec.type;
        Function function = new Function(name.getStr(), name, returnType, spec.isVirtual);
        Scope scope = parser.newScope(Scope.ScopeType.FUNCTION, name);
        scope.setFunction(function);
        function.setFunctionScope(scope);

        Token open = parser.expect(LPAREN, "Expected '('");
        open.setDeclSpecifier(true);
        parser.pushScope(scope);
        try {
            if (parser.check(KW_VOID) && parser.peek(1) != null && parser.peek(1).is(RPAREN)) {
                parser.advance().setDeclSpecifier(true);
            }
            int index = 0;
            while (!parser.check(RPAREN)) {
                function.addArgument(parseParameter(index++));
                if (!parser.check(RPAREN)) {
                    parser.expect(COMMA, "Expected ',' or ')' in parameter list").setDeclSpecifier(true);
                }
            }
            parser.advance().setDeclSpecifier(true);
            while (parser.check(KW_CONST)) {
                parser.advance().setDeclSpecifier(true);
            }

            if (parser.check(LBRACE)) {
                Token body = parser.advance();
                scope.setBody(body, body.getLink());
                parser.stmtParser.parseStatementsUntil(body.getLink());
                parser.expect(RBRACE, "Expected '}'");
            } else {
                parser.expect(SEMICOLON, "Expected ';' or function body");
            }
        } finally {
            parser.popScope();
        }
        parser.symbols.addFunction(function);
    }

    private Variable parseParameter(int index) {
        DeclSpec spec = parseSpecifiers();
        int pointer = 0;
        boolean reference = false;
        while (parser.checkAny(MUL, BIT_AND, AND, KW_CONST)) {
            Token t = parser.advance();
            t.setDeclSpecifier(true);
            if (t.is(MUL)) pointer++;
            if (t.isOneOf(BIT_AND, AND)) reference = true;
        }
        Token name = parser.check(IDENTIFIER) ? parser.advance() : null;
        boolean array = false;
        while (parser.check(LBRACKET)) {
            Token open = parser.current;
            for (Token t = open; t != open.getLink(); t = t.getNext()) {
                t.setDeclSpecifier(true);
            }
            open.getLink().setDeclSpecifier(true);
            parser.jumpTo(open.getLink().getNext());
            pointer++;
            array = true;
        }
        if (parser.check(ASSIGN)) {
            // 默认实参不参与求值
            while (!parser.isAtEnd() && !parser.checkAny(COMMA, RPAREN)) {
                Token t = parser.advance();
                t.setDeclSpecifier(true);
                if (t.getLink() != null && t.isOneOf(LPAREN, LBRACKET, LBRACE)) {
                    for (Token s = t; s != t.getLink(); s = s.getNext()) {
                        s.setDeclSpecifier(true);
                    }
                    t.getLink().setDeclSpecifier(true);
                    parser.jumpTo(t.getLink().getNext());
                }
            }
        }
        ValueType type = pointer > 0 ? spec.type.withPointer(spec.type.getPointer() + pointer) : spec.type;
        Variable var = parser.symbols.newVariable(name, type, parser.currentScope, Variable.Kind.ARGUMENT, index);
        var.setReference(reference);
        var.setArray(array);
        return var;
    }
}
