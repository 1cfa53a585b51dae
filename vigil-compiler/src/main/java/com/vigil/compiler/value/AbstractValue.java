package com.vigil.compiler.value;

import com.vigil.compiler.ast.Token;

import java.util.Objects;

/**
 * 抽象值：表达式在运行时的一种可能结果
 *
 * <p>不可变值对象，所有修改方法都返回新实例。
 * IMPOSSIBLE 值只表达排除，不能作为“总是为真”的正面回答。</p>
 */
public final class AbstractValue {

    private static final AbstractValue UNKNOWN =
            new AbstractValue(ValueKind.UNINIT, 0, 0.0, null, Knowledge.POSSIBLE, Bound.NONE, 0);

    private final ValueKind kind;
    private final long intValue;
    private final double floatValue;
    private final Token tokValue;
    private final Knowledge knowledge;
    private final Bound bound;
    private final int indirect;

    private AbstractValue(ValueKind kind, long intValue, double floatValue, Token tokValue,
                          Knowledge knowledge, Bound bound, int indirect) {
        this.kind = kind;
        this.intValue = intValue;
        this.floatValue = floatValue;
        this.tokValue = tokValue;
        this.knowledge = knowledge;
        this.bound = bound;
        this.indirect = indirect;
    }

    // ============ 工厂方法 ============

    /** 未知值（唯一的错误结果） */
    public static AbstractValue unknown() {
        return UNKNOWN;
    }

    public static AbstractValue known(long value) {
        return new AbstractValue(ValueKind.INT, value, 0.0, null, Knowledge.KNOWN, Bound.POINT, 0);
    }

    public static AbstractValue possible(long value) {
        return new AbstractValue(ValueKind.INT, value, 0.0, null, Knowledge.POSSIBLE, Bound.POINT, 0);
    }

    public static AbstractValue impossible(long value) {
        return new AbstractValue(ValueKind.INT, value, 0.0, null, Knowledge.IMPOSSIBLE, Bound.POINT, 0);
    }

    public static AbstractValue ofFloat(double value, Knowledge knowledge) {
        return new AbstractValue(ValueKind.FLOAT, 0, value, null, knowledge, Bound.POINT, 0);
    }

    public static AbstractValue ofTok(Token tok, Knowledge knowledge) {
        return new AbstractValue(ValueKind.TOK, 0, 0.0, tok, knowledge, Bound.POINT, 0);
    }

    public static AbstractValue containerSize(long size, Knowledge knowledge) {
        return new AbstractValue(ValueKind.CONTAINER_SIZE, size, 0.0, null, knowledge, Bound.POINT, 0);
    }

    public static AbstractValue iteratorStart(Token container, long offset, Knowledge knowledge) {
        return new AbstractValue(ValueKind.ITERATOR_START, offset, 0.0, container, knowledge, Bound.POINT, 0);
    }

    public static AbstractValue iteratorEnd(Token container, long offset, Knowledge knowledge) {
        return new AbstractValue(ValueKind.ITERATOR_END, offset, 0.0, container, knowledge, Bound.POINT, 0);
    }

    /** anchor + offset */
    public static AbstractValue symbolic(Token anchor, long offset, Knowledge knowledge) {
        return new AbstractValue(ValueKind.SYMBOLIC, offset, 0.0, anchor, knowledge, Bound.POINT, 0);
    }

    /** 带方向边界的整数值，如 {@code x > 5} 的真分支为 possible(6, LOWER) */
    public static AbstractValue ranged(long value, Knowledge knowledge, Bound bound) {
        return new AbstractValue(ValueKind.INT, value, 0.0, null, knowledge, bound, 0);
    }

    // ============ 访问器 ============

    public ValueKind getKind() { return kind; }
    public long getIntValue() { return intValue; }
    public double getFloatValue() { return floatValue; }
    public Token getTokValue() { return tokValue; }
    public Knowledge getKnowledge() { return knowledge; }
    public Bound getBound() { return bound; }
    public int getIndirect() { return indirect; }

    public boolean isKnown() { return knowledge == Knowledge.KNOWN; }
    public boolean isPossible() { return knowledge == Knowledge.POSSIBLE; }
    public boolean isImpossible() { return knowledge == Knowledge.IMPOSSIBLE; }

    public boolean isIntValue() { return kind == ValueKind.INT; }
    public boolean isFloatValue() { return kind == ValueKind.FLOAT; }
    public boolean isTokValue() { return kind == ValueKind.TOK; }
    public boolean isContainerSizeValue() { return kind == ValueKind.CONTAINER_SIZE; }
    public boolean isIteratorValue() { return kind.isIterator(); }
    public boolean isSymbolicValue() { return kind == ValueKind.SYMBOLIC; }
    public boolean isUninitValue() { return kind == ValueKind.UNINIT; }
    public boolean isNumeric() { return kind == ValueKind.INT || kind == ValueKind.FLOAT; }

    /** 整数视图（浮点截断） */
    public long asLong() {
        return kind == ValueKind.FLOAT ? (long) floatValue : intValue;
    }

    /** 浮点视图 */
    public double asDouble() {
        return kind == ValueKind.FLOAT ? floatValue : (double) intValue;
    }

    // ============ 真值约定 ============

    /**
     * 确定为真：非未知，且取值范围不含 0。点值按整数判断；
     * 范围值只有在边界已经越过 0 时才为真
     */
    public boolean isDefinitelyTrue() {
        if (isUninitValue()) return false;
        if (isImpossible()) {
            switch (bound) {
                case UPPER: return intValue >= 0;
                case LOWER: return intValue <= 0;
                default: return intValue == 0;
            }
        }
        switch (bound) {
            case LOWER: return intValue > 0;
            case UPPER: return intValue < 0;
            default: return intValue != 0;
        }
    }

    /**
     * 确定为假：非未知、非 IMPOSSIBLE 的零点值，范围值从不确定为假
     */
    public boolean isDefinitelyFalse() {
        if (isUninitValue()) return false;
        if (isImpossible()) return false;
        return bound == Bound.POINT && intValue == 0;
    }

    public boolean isDefinitely(boolean truth) {
        return truth ? isDefinitelyTrue() : isDefinitelyFalse();
    }

    // ============ 派生 ============

    public AbstractValue withKind(ValueKind newKind) {
        return new AbstractValue(newKind, intValue, floatValue, tokValue, knowledge, bound, indirect);
    }

    public AbstractValue withIntValue(long value) {
        return new AbstractValue(kind, value, floatValue, tokValue, knowledge, bound, indirect);
    }

    public AbstractValue withFloatValue(double value) {
        return new AbstractValue(kind, intValue, value, tokValue, knowledge, bound, indirect);
    }

    public AbstractValue withTokValue(Token tok) {
        return new AbstractValue(kind, intValue, floatValue, tok, knowledge, bound, indirect);
    }

    public AbstractValue withKnowledge(Knowledge newKnowledge) {
        return new AbstractValue(kind, intValue, floatValue, tokValue, newKnowledge, bound, indirect);
    }

    public AbstractValue withBound(Bound newBound) {
        return new AbstractValue(kind, intValue, floatValue, tokValue, knowledge, newBound, indirect);
    }

    public AbstractValue withIndirect(int newIndirect) {
        return new AbstractValue(kind, intValue, floatValue, tokValue, knowledge, bound, newIndirect);
    }

    public AbstractValue asKnown() { return withKnowledge(Knowledge.KNOWN); }
    public AbstractValue asPossible() { return withKnowledge(Knowledge.POSSIBLE); }

    /**
     * 转为排除形式：范围值翻转方向并平移一位，使排除区间恰为原区间的补集
     */
    public AbstractValue asImpossible() {
        long value = intValue;
        Bound inverted = bound.invert();
        if (inverted == Bound.LOWER) {
            value++;
        } else if (inverted == Bound.UPPER) {
            value--;
        }
        return new AbstractValue(kind, value, floatValue, tokValue, Knowledge.IMPOSSIBLE, inverted, indirect);
    }

    /**
     * 将状态中已存在的条目标记为“已追踪但未知”
     */
    public AbstractValue asUninit() {
        return withKind(ValueKind.UNINIT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AbstractValue)) return false;
        AbstractValue that = (AbstractValue) o;
        return intValue == that.intValue
                && Double.compare(floatValue, that.floatValue) == 0
                && indirect == that.indirect
                && kind == that.kind
                && knowledge == that.knowledge
                && bound == that.bound
                && tokValue == that.tokValue;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, intValue, floatValue, knowledge, bound, indirect,
                tokValue == null ? 0 : System.identityHashCode(tokValue));
    }

    @Override
    public String toString() {
        if (isUninitValue()) {
            return "Unknown";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(knowledge.name().toLowerCase()).append(' ').append(kind.name().toLowerCase()).append(' ');
        switch (kind) {
            case FLOAT:
                sb.append(floatValue);
                break;
            case TOK:
                sb.append(tokValue != null ? tokValue.getStr() : "null");
                break;
            case SYMBOLIC:
            case ITERATOR_START:
            case ITERATOR_END:
                sb.append(tokValue != null ? tokValue.getStr() : "?").append(intValue >= 0 ? "+" : "").append(intValue);
                break;
            default:
                sb.append(intValue);
                break;
        }
        if (bound == Bound.LOWER || bound == Bound.UPPER) {
            sb.append(" (").append(bound.name().toLowerCase()).append(')');
        }
        return sb.toString();
    }
}
