package com.vigil.valueflow.memory;

import com.vigil.compiler.ast.Token;

/**
 * 状态表的键：按表达式标识比较，同时记住该标识的一个节点
 */
public final class ExprIdToken {

    private final Token tok;
    private final int exprId;

    public ExprIdToken(Token tok) {
        this.tok = tok;
        this.exprId = tok.getExprId();
    }

    private ExprIdToken(int exprId) {
        this.tok = null;
        this.exprId = exprId;
    }

    /** 只有标识、没有节点的键，用于查找 */
    public static ExprIdToken of(int exprId) {
        return new ExprIdToken(exprId);
    }

    /** 可能为 null */
    public Token getToken() { return tok; }

    public int getExprId() { return exprId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExprIdToken)) return false;
        return exprId == ((ExprIdToken) o).exprId;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(exprId);
    }

    @Override
    public String toString() {
        return tok != null ? tok.getStr() + "#" + exprId : "#" + exprId;
    }
}
