package com.vigil.valueflow.infer;

import com.vigil.compiler.value.AbstractValue;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 区间推断：只回答比较运算，结果确定时给出 KNOWN 0/1
 */
public final class IntervalInference implements BoundInference {

    @Override
    public List<AbstractValue> infer(String op, List<AbstractValue> lhsValues, List<AbstractValue> rhsValues) {
        if (!isComparison(op) || lhsValues.isEmpty() || rhsValues.isEmpty()) {
            return Collections.emptyList();
        }
        Optional<Boolean> result = Interval.fromValues(lhsValues).compare(op, Interval.fromValues(rhsValues));
        if (!result.isPresent()) {
            return Collections.emptyList();
        }
        return Collections.singletonList(AbstractValue.known(result.get() ? 1 : 0));
    }

    private static boolean isComparison(String op) {
        switch (op) {
            case "==": case "!=": case "<": case "<=": case ">": case ">=":
                return true;
            default:
                return false;
        }
    }
}
