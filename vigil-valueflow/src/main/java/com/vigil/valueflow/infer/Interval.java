package com.vigil.valueflow.infer;

import com.vigil.compiler.value.AbstractValue;
import com.vigil.compiler.value.Bound;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * 整数闭区间 [min, max]，可排除若干单点。{@link Long#MIN_VALUE} 与 {@link Long#MAX_VALUE} 表示无界。
 */
public final class Interval {

    private static final Interval UNBOUNDED = new Interval(Long.MIN_VALUE, Long.MAX_VALUE, Collections.<Long>emptySet());

    private final long min;
    private final long max;
    private final Set<Long> excluded;

    private Interval(long min, long max, Set<Long> excluded) {
        this.min = min;
        this.max = max;
        this.excluded = excluded;
    }

    public static Interval unbounded() {
        return UNBOUNDED;
    }

    public static Interval point(long value) {
        return new Interval(value, value, Collections.<Long>emptySet());
    }

    public static Interval of(long min, long max) {
        return new Interval(min, max, Collections.<Long>emptySet());
    }

    /**
     * 由值集合构造：KNOWN 值或唯一的 POSSIBLE 点值给出单点；
     * POSSIBLE 的 LOWER/UPPER 与 IMPOSSIBLE 的 UPPER/LOWER 收紧边界；IMPOSSIBLE 点值成为排除点。
     * 非整数值被忽略。
     */
    public static Interval fromValues(List<AbstractValue> values) {
        long min = Long.MIN_VALUE;
        long max = Long.MAX_VALUE;
        Set<Long> excluded = new TreeSet<Long>();
        AbstractValue onlyPossible = null;
        int possibleCount = 0;
        for (AbstractValue v : values) {
            if (!v.isIntValue()) continue;
            long x = v.getIntValue();
            if (v.isKnown()) {
                return point(x);
            }
            if (v.isImpossible()) {
                if (v.getBound() == Bound.UPPER && x != Long.MAX_VALUE) {
                    min = Math.max(min, x + 1);
                } else if (v.getBound() == Bound.LOWER && x != Long.MIN_VALUE) {
                    max = Math.min(max, x - 1);
                } else if (v.getBound() == Bound.POINT) {
                    excluded.add(x);
                }
                continue;
            }
            possibleCount++;
            onlyPossible = v;
            if (v.getBound() == Bound.LOWER) {
                min = Math.max(min, x);
            } else if (v.getBound() == Bound.UPPER) {
                max = Math.min(max, x);
            }
        }
        if (possibleCount == 1 && onlyPossible.getBound() == Bound.POINT) {
            return point(onlyPossible.getIntValue());
        }
        // 边界上的排除点向内收缩
        while (min < max && excluded.contains(min)) min++;
        while (max > min && excluded.contains(max)) max--;
        long lo = min;
        long hi = max;
        excluded.removeIf(x -> x < lo || x > hi);
        return new Interval(lo, hi, excluded.isEmpty() ? Collections.<Long>emptySet() : excluded);
    }

    public long getMin() { return min; }
    public long getMax() { return max; }

    public boolean isPoint() {
        return min == max;
    }

    public boolean isEmpty() {
        return min > max || (isPoint() && excluded.contains(min));
    }

    public boolean contains(long value) {
        return value >= min && value <= max && !excluded.contains(value);
    }

    /** 与另一个区间比较；结果不确定时为空 */
    public Optional<Boolean> compare(String op, Interval rhs) {
        if (isEmpty() || rhs.isEmpty()) return Optional.empty();
        switch (op) {
            case "<":
                if (max < rhs.min) return Optional.of(true);
                if (min >= rhs.max) return Optional.of(false);
                return Optional.empty();
            case "<=":
                if (max <= rhs.min) return Optional.of(true);
                if (min > rhs.max) return Optional.of(false);
                return Optional.empty();
            case ">":
                return rhs.compare("<", this);
            case ">=":
                return rhs.compare("<=", this);
            case "==":
                return equalsTo(rhs);
            case "!=":
                return equalsTo(rhs).map(b -> !b);
            default:
                return Optional.empty();
        }
    }

    private Optional<Boolean> equalsTo(Interval rhs) {
        if (isPoint() && rhs.isPoint()) return Optional.of(min == rhs.min);
        if (max < rhs.min || rhs.max < min) return Optional.of(false);
        if (isPoint() && !rhs.contains(min)) return Optional.of(false);
        if (rhs.isPoint() && !contains(rhs.min)) return Optional.of(false);
        return Optional.empty();
    }

    @Override
    public String toString() {
        String lo = min == Long.MIN_VALUE ? "-inf" : String.valueOf(min);
        String hi = max == Long.MAX_VALUE ? "+inf" : String.valueOf(max);
        return "[" + lo + ", " + hi + "]" + (excluded.isEmpty() ? "" : " \\ " + excluded);
    }
}
