package com.vigil.valueflow.library;

import com.vigil.compiler.ast.Token;

import java.util.Optional;

/**
 * 库知识：纯函数、返回值模板与容器语义
 */
public interface LibraryModel {

    /** 没有副作用的函数 */
    boolean isPure(String functionName);

    /** 返回值模板，形如 {@code arg0 < 0 ? -arg0 : arg0} */
    Optional<String> returnValueExpression(String functionName);

    /** 具名类型（如 {@code std::vector}）是否为容器 */
    boolean isContainerType(String typeName);

    YieldKind containerYield(String member);

    ContainerAction containerAction(String member);

    /**
     * 调用产出的东西；只有容器对象上的成员调用才有产出
     *
     * @param callParen 调用的 '('
     */
    YieldKind functionYield(Token callParen);

    /**
     * 对 {@code c.size()} 这样的调用，产出类型匹配时返回容器表达式 {@code c}
     *
     * @param callParen 调用的 '('
     * @return 不匹配时返回 null
     */
    Token getContainerFromYield(Token callParen, YieldKind yield);

    /** 节点的静态类型是否为容器 */
    boolean isContainer(Token tok);
}
