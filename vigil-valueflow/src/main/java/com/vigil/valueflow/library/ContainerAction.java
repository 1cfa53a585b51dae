package com.vigil.valueflow.library;

/**
 * 容器成员函数对容器的修改
 */
public enum ContainerAction {
    NO_ACTION,
    PUSH,
    POP,
    CLEAR,
    RESIZE,
    INSERT,
    ERASE,
    /** 未归类的修改 */
    CHANGE;

    /** 是否可能改变容器大小 */
    public boolean changesSize() {
        return this != NO_ACTION;
    }
}
