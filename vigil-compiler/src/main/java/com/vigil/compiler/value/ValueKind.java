package com.vigil.compiler.value;

/**
 * 抽象值种类
 */
public enum ValueKind {
    INT,
    FLOAT,
    /** 指向/等于某个字面量或对象节点 */
    TOK,
    CONTAINER_SIZE,
    ITERATOR_START,
    ITERATOR_END,
    /** 相对另一个表达式的偏移量 */
    SYMBOLIC,
    /** 未初始化，同时也是“未知”的表示 */
    UNINIT;

    public boolean isIterator() {
        return this == ITERATOR_START || this == ITERATOR_END;
    }

    /** 可参与整数运算的种类 */
    public boolean isIntegral() {
        return this == INT || isIterator() || this == SYMBOLIC;
    }
}
