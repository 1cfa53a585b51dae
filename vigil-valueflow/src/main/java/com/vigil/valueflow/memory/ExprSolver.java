package com.vigil.valueflow.memory;

import com.vigil.compiler.ast.Token;
import com.vigil.compiler.lexer.TokenType;
import com.vigil.compiler.value.AbstractValue;
import com.vigil.compiler.value.ValueKind;

import java.util.OptionalLong;
import java.util.function.Function;

/**
 * 反解二元整数表达式：已知 {@code x + 1 == 5} 时得到 {@code x == 4}
 */
final class ExprSolver {

    private ExprSolver() {}

    /** 反解结果：最内层的子表达式及其值 */
    static final class Solution {
        final Token expr;
        final AbstractValue value;

        Solution(Token expr, AbstractValue value) {
            this.expr = expr;
            this.value = value;
        }
    }

    /**
     * 沿 {@code + - * ^} 向下求解，一侧必须有已知整数值；无法继续时停在当前节点
     *
     * @param eval 节点的已知整数值
     */
    static Solution solve(Token expr, AbstractValue value, Function<Token, OptionalLong> eval) {
        ValueKind kind = value.getKind();
        if (kind != ValueKind.INT && !kind.isIterator() && kind != ValueKind.SYMBOLIC) {
            return new Solution(expr, value);
        }
        if (kind == ValueKind.SYMBOLIC && !expr.isOneOf(TokenType.PLUS, TokenType.MINUS)) {
            return new Solution(expr, value);
        }
        if (!expr.isOneOf(TokenType.PLUS, TokenType.MINUS, TokenType.MUL, TokenType.BIT_XOR)
                || !expr.isBinaryOp()) {
            return new Solution(expr, value);
        }
        Token lhs = expr.getAstOperand1();
        Token rhs = expr.getAstOperand2();
        if (lhs.getExprId() == 0 && rhs.getExprId() == 0) {
            return new Solution(expr, value);
        }
        OptionalLong lhsKnown = eval.apply(lhs);
        OptionalLong rhsKnown = eval.apply(rhs);
        if (lhsKnown.isPresent() == rhsKnown.isPresent()) {
            return new Solution(expr, value);
        }
        Token unknownSide = lhsKnown.isPresent() ? rhs : lhs;
        long c = lhsKnown.isPresent() ? lhsKnown.getAsLong() : rhsKnown.getAsLong();
        long v = value.getIntValue();
        switch (expr.getType()) {
            case PLUS:
                v -= c;
                break;
            case MINUS:
                v = unknownSide == rhs ? c - v : v + c;
                break;
            case MUL:
                if (c == 0 || v % c != 0) {
                    return new Solution(expr, value);
                }
                v /= c;
                break;
            default:
                v ^= c;
                break;
        }
        return solve(unknownSide, value.withIntValue(v), eval);
    }
}
