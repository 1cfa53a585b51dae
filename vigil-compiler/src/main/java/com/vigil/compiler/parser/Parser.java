package com.vigil.compiler.parser;

import com.vigil.compiler.analysis.Scope;
import com.vigil.compiler.analysis.SymbolDatabase;
import com.vigil.compiler.ast.Token;
import com.vigil.compiler.ast.TokenList;
import com.vigil.compiler.lexer.TokenType;

/**
 * 语法分析器（递归下降）
 *
 * <p>直接在 {@link TokenList} 上建立 AST 链接，并向 {@link SymbolDatabase} 登记作用域和符号。
 * 顶层既接受声明也接受语句。</p>
 */
public class Parser {

    final TokenList tokens;
    final SymbolDatabase symbols;
    Token current;
    Token previous;
    Scope currentScope;

    // === Helper 实例 ===
    final LiteralHelper literalHelper = new LiteralHelper(this);
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(TokenList tokens) {
        this.tokens = tokens;
        this.symbols = new SymbolDatabase(tokens);
        this.currentScope = symbols.getGlobalScope();
        this.current = tokens.front();
    }

    /**
     * 解析整个翻译单元并完成语义标注
     *
     * @throws ParseException 语法错误
     */
    public SymbolDatabase parse() {
        while (!isAtEnd()) {
            if (declParser.isDeclarationStart(current)) {
                declParser.parseDeclaration(true);
            } else {
                stmtParser.parseStatement();
            }
        }
        symbols.finish();
        return symbols;
    }

    // ============ 基础方法 ============

    boolean isAtEnd() {
        return current == null;
    }

    /**
     * 前进到下一个 token
     */
    Token advance() {
        if (current == null) {
            throw new ParseException("Unexpected end of input", null);
        }
        previous = current;
        current = current.getNext();
        return previous;
    }

    /**
     * 跳到指定 token（用于越过已整体处理的括号）
     */
    void jumpTo(Token tok) {
        previous = tok != null ? tok.getPrevious() : tokens.back();
        current = tok;
    }

    Token peek(int offset) {
        return current != null ? current.tokAt(offset) : null;
    }

    boolean check(TokenType type) {
        return current != null && current.is(type);
    }

    boolean checkAny(TokenType... types) {
        return current != null && current.isOneOf(types);
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current != null ? current : tokens.back(), type.name());
    }

    // ============ 作用域 ============

    Scope newScope(Scope.ScopeType type, Token classDef) {
        Scope scope = new Scope(type, currentScope, classDef);
        symbols.addScope(scope);
        return scope;
    }

    void pushScope(Scope scope) {
        currentScope = scope;
    }

    void popScope() {
        currentScope = currentScope.getNestedIn();
    }
}
