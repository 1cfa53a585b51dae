package com.vigil.valueflow.library;

/**
 * 容器成员函数“产出”的东西
 */
public enum YieldKind {
    SIZE,
    EMPTY,
    ITEM,
    START_ITERATOR,
    END_ITERATOR,
    NO_YIELD
}
