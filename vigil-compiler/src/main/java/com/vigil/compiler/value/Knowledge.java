package com.vigil.compiler.value;

/**
 * 值的确定程度
 */
public enum Knowledge {
    /** 确定为该值 */
    KNOWN,
    /** 可能为该值 */
    POSSIBLE,
    /** 不可能为该值（只表达排除） */
    IMPOSSIBLE
}
