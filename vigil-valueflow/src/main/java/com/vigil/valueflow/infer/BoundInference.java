package com.vigil.valueflow.infer;

import com.vigil.compiler.value.AbstractValue;

import java.util.List;

/**
 * 由两侧的值集合推断二元运算的结果
 */
public interface BoundInference {

    /**
     * @param op 运算符，如 "&lt;"、"=="
     * @return 推断出的值；无法推断时为空列表
     */
    List<AbstractValue> infer(String op, List<AbstractValue> lhsValues, List<AbstractValue> rhsValues);
}
