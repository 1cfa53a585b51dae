package com.vigil.valueflow.oracle;

import com.vigil.compiler.ast.Token;

/**
 * 判断表达式在两个位置之间是否可能被修改
 *
 * <p>区间均为 [from, to)，from 不在 to 之前时视为未修改。</p>
 */
public interface MutationOracle {

    /** expr 中任一可变子表达式在区间内被修改 */
    boolean isExpressionChanged(Token expr, Token from, Token to);

    /**
     * 同 {@link #isExpressionChanged}，但跳过条件确定为假（或确定为真时的 else）的分支
     */
    boolean isExpressionChangedSkipDeadCode(Token expr, Token from, Token to, ConditionEvaluator evaluator);

    /**
     * 该位置上的这次出现是否修改了变量
     *
     * @param indirect 0 为变量本身，1 为其指向的对象
     */
    boolean isVariableChanged(Token tok, int indirect);

    /**
     * 区间内标识为 exprId 的表达式是否被修改；globalvar 为真时，任何非纯函数调用都视为修改
     */
    boolean isVariableChanged(Token from, Token to, int exprId, boolean globalvar);

    /** 该位置上的这次出现是否可能改变容器大小 */
    boolean isContainerSizeChanged(Token tok, int indirect);
}
