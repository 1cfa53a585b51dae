package com.vigil.valueflow.eval;

import com.vigil.compiler.value.AbstractValue;
import com.vigil.compiler.value.Bound;
import com.vigil.compiler.value.Knowledge;
import com.vigil.compiler.value.ValueKind;

import com.vigil.valueflow.infer.Interval;

import java.util.Collections;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * 抽象值上的二元运算
 */
public final class Calculator {

    private Calculator() {}

    /**
     * 组合两个抽象值；运算无意义或出错时返回 Unknown
     *
     * @param op 二元运算符，如 "+"、"&lt;="
     */
    public static AbstractValue combine(String op, AbstractValue lhs, AbstractValue rhs) {
        if (lhs.isImpossible() && rhs.isImpossible()) {
            return AbstractValue.unknown();
        }
        boolean impossible = lhs.isImpossible() || rhs.isImpossible();
        if (impossible && isNonInvertible(op)) {
            return AbstractValue.unknown();
        }
        Knowledge knowledge = impossible ? Knowledge.IMPOSSIBLE
                : lhs.isKnown() && rhs.isKnown() ? Knowledge.KNOWN : Knowledge.POSSIBLE;

        if (lhs.isFloatValue() || rhs.isFloatValue()) {
            if (!lhs.isNumeric() || !rhs.isNumeric()) {
                return AbstractValue.unknown();
            }
            OptionalDouble r = calculate(op, lhs.asDouble(), rhs.asDouble());
            if (!r.isPresent() || Double.isNaN(r.getAsDouble())) {
                return AbstractValue.unknown();
            }
            if (isComparison(op)) {
                return resolve(op, AbstractValue.ranged((long) r.getAsDouble(), knowledge, Bound.POINT));
            }
            return AbstractValue.ofFloat(r.getAsDouble(), knowledge);
        }

        ValueKind lk = lhs.getKind();
        ValueKind rk = rhs.getKind();
        if (!lk.isIntegral() || !rk.isIntegral()) {
            return AbstractValue.unknown();
        }
        boolean compare = isComparison(op);
        boolean additive = "+".equals(op) || "-".equals(op);
        if (lk != rk) {
            // 不同种类只能与 INT 做加减
            if (compare || !additive || (lk != ValueKind.INT && rk != ValueKind.INT)) {
                return AbstractValue.unknown();
            }
        } else if (lk != ValueKind.INT) {
            if (!compare && (lk.isIterator() || !"-".equals(op))) {
                return AbstractValue.unknown();
            }
            if (lhs.getTokValue() == null || rhs.getTokValue() == null
                    || lhs.getTokValue().getExprId() != rhs.getTokValue().getExprId()) {
                return AbstractValue.unknown();
            }
        }

        if (compare && lk == ValueKind.INT && !impossible && (isRange(lhs) || isRange(rhs))) {
            // 范围值只在整个区间结论一致时才有确定的比较结果
            Optional<Boolean> cmp = Interval.fromValues(Collections.singletonList(lhs))
                    .compare(op, Interval.fromValues(Collections.singletonList(rhs)));
            if (!cmp.isPresent()) {
                return AbstractValue.unknown();
            }
            return AbstractValue.ranged(cmp.get() ? 1 : 0, knowledge, Bound.POINT);
        }

        OptionalLong r = calculate(op, lhs.getIntValue(), rhs.getIntValue());
        if (!r.isPresent()) {
            return AbstractValue.unknown();
        }
        AbstractValue result;
        if (compare || lk == rk) {
            // 比较结果与同锚点符号值之差都是普通整数
            result = AbstractValue.ranged(r.getAsLong(), knowledge, compare ? Bound.POINT : resultBound(op, lhs, rhs));
        } else if (lk != ValueKind.INT) {
            result = lhs.withIntValue(r.getAsLong()).withKnowledge(knowledge).withBound(resultBound(op, lhs, rhs));
        } else {
            if ("-".equals(op)) {
                // 整数减去迭代器/符号值没有意义
                return AbstractValue.unknown();
            }
            result = rhs.withIntValue(r.getAsLong()).withKnowledge(knowledge).withBound(resultBound(op, lhs, rhs));
        }
        return resolve(op, result);
    }

    /** IMPOSSIBLE 的 != 结果归一为确定的布尔值 */
    private static AbstractValue resolve(String op, AbstractValue result) {
        if (!result.isImpossible() || !"!=".equals(op)) {
            return result;
        }
        if (result.isDefinitelyTrue()) {
            return AbstractValue.known(1);
        }
        if (result.isDefinitelyFalse()) {
            return AbstractValue.known(0);
        }
        return AbstractValue.unknown();
    }

    /** 加减一个点值时保留另一侧的方向边界 */
    private static Bound resultBound(String op, AbstractValue lhs, AbstractValue rhs) {
        boolean lhsRange = isRange(lhs);
        boolean rhsRange = isRange(rhs);
        if (lhsRange == rhsRange) {
            return Bound.POINT;
        }
        if ("+".equals(op)) {
            return lhsRange ? lhs.getBound() : rhs.getBound();
        }
        if ("-".equals(op)) {
            return lhsRange ? lhs.getBound() : rhs.getBound().invert();
        }
        return Bound.POINT;
    }

    private static boolean isRange(AbstractValue v) {
        return v.getBound() == Bound.LOWER || v.getBound() == Bound.UPPER;
    }

    private static boolean isNonInvertible(String op) {
        return "%".equals(op) || "/".equals(op) || "&".equals(op) || "|".equals(op);
    }

    public static boolean isComparison(String op) {
        switch (op) {
            case "==": case "!=": case "<": case "<=": case ">": case ">=":
                return true;
            default:
                return false;
        }
    }

    // ============ 标量运算 ============

    /**
     * 64 位整数运算；除零、{@code Long.MIN_VALUE / -1}、负数或过大的移位量返回空
     */
    public static OptionalLong calculate(String op, long x, long y) {
        switch (op) {
            case "+": return OptionalLong.of(x + y);
            case "-": return OptionalLong.of(x - y);
            case "*": return OptionalLong.of(x * y);
            case "/":
            case "%":
                if (y == 0 || (x == Long.MIN_VALUE && y == -1)) return OptionalLong.empty();
                return OptionalLong.of("/".equals(op) ? x / y : x % y);
            case "<<":
            case ">>":
                if (y < 0 || y >= Long.SIZE) return OptionalLong.empty();
                return OptionalLong.of("<<".equals(op) ? x << y : x >> y);
            case "&": return OptionalLong.of(x & y);
            case "|": return OptionalLong.of(x | y);
            case "^": return OptionalLong.of(x ^ y);
            case "&&": return OptionalLong.of(x != 0 && y != 0 ? 1 : 0);
            case "||": return OptionalLong.of(x != 0 || y != 0 ? 1 : 0);
            case "==": return OptionalLong.of(x == y ? 1 : 0);
            case "!=": return OptionalLong.of(x != y ? 1 : 0);
            case "<": return OptionalLong.of(x < y ? 1 : 0);
            case "<=": return OptionalLong.of(x <= y ? 1 : 0);
            case ">": return OptionalLong.of(x > y ? 1 : 0);
            case ">=": return OptionalLong.of(x >= y ? 1 : 0);
            default: return OptionalLong.empty();
        }
    }

    /**
     * 浮点运算；比较结果为 0/1，位运算、取模与除零返回空
     */
    public static OptionalDouble calculate(String op, double x, double y) {
        switch (op) {
            case "+": return OptionalDouble.of(x + y);
            case "-": return OptionalDouble.of(x - y);
            case "*": return OptionalDouble.of(x * y);
            case "/":
                if (y == 0.0) return OptionalDouble.empty();
                return OptionalDouble.of(x / y);
            case "&&": return OptionalDouble.of(x != 0.0 && y != 0.0 ? 1 : 0);
            case "||": return OptionalDouble.of(x != 0.0 || y != 0.0 ? 1 : 0);
            case "==": return OptionalDouble.of(x == y ? 1 : 0);
            case "!=": return OptionalDouble.of(x != y ? 1 : 0);
            case "<": return OptionalDouble.of(x < y ? 1 : 0);
            case "<=": return OptionalDouble.of(x <= y ? 1 : 0);
            case ">": return OptionalDouble.of(x > y ? 1 : 0);
            case ">=": return OptionalDouble.of(x >= y ? 1 : 0);
            default: return OptionalDouble.empty();
        }
    }
}
