package com.vigil.compiler.value;

/**
 * 值的方向边界
 *
 * <p>对 POSSIBLE 值：LOWER 表示“至少为 v”，UPPER 表示“至多为 v”。
 * 对 IMPOSSIBLE 值：UPPER 表示排除所有 ≤ v 的值，LOWER 表示排除所有 ≥ v 的值。</p>
 */
public enum Bound {
    NONE,
    LOWER,
    UPPER,
    POINT;

    /** 取反方向（POINT/NONE 不变） */
    public Bound invert() {
        switch (this) {
            case LOWER: return UPPER;
            case UPPER: return LOWER;
            default: return this;
        }
    }
}
