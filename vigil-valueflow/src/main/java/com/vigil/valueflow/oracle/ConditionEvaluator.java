package com.vigil.valueflow.oracle;

import com.vigil.compiler.ast.Token;
import com.vigil.compiler.value.AbstractValue;

/**
 * 在当前状态下求条件的值，用于跳过不可达的分支
 */
@FunctionalInterface
public interface ConditionEvaluator {

    AbstractValue evaluate(Token condition);
}
