package com.vigil.valueflow.eval;

import com.vigil.compiler.ast.AstUtils;
import com.vigil.compiler.ast.Token;
import com.vigil.compiler.lexer.TokenType;
import com.vigil.compiler.value.AbstractValue;
import com.vigil.valueflow.ValueFlowSettings;
import com.vigil.valueflow.memory.ExprIdToken;
import com.vigil.valueflow.memory.ProgramState;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code &&} / {@code ||} 链的求值
 *
 * <p>b 为决定性的真值：{@code ||} 为 true，{@code &&} 为 false。叶子依次求值，
 * 遇到决定性的叶子即短路；所有叶子都取相反真值时整体取相反真值。</p>
 *
 * <p>仍然无法确定时，与状态中已经记录过的同类条件比较：叶子集合相同直接沿用；
 * 只差少数叶子时，尝试证明多出的叶子可以由对方的叶子推出。</p>
 */
final class MultiCondition {

    private final Executor executor;
    private final ProgramState pm;
    private final ValueFlowSettings settings;

    MultiCondition(Executor executor) {
        this.executor = executor;
        this.pm = executor.getState();
        this.settings = executor.getEvaluator().getContext().getSettings();
    }

    AbstractValue evaluate(boolean b, Token expr) {
        if (expr.getExprId() > 0 && pm.hasValue(expr.getExprId())) {
            AbstractValue stored = pm.at(expr.getExprId());
            if (stored.isIntValue()) {
                return stored;
            }
        }
        Token op1 = expr.getAstOperand1();
        Token op2 = expr.getAstOperand2();
        if (op1.getExprId() == 0 || op2.getExprId() == 0) {
            return structural(b, op1, op2);
        }

        String op = expr.getStr();
        int n = AstUtils.astCount(expr, op);
        if (n > settings.getMaxConditionNodes()) {
            return AbstractValue.unknown();
        }
        List<Token> conditions1 = AstUtils.astFlatten(expr, op);
        Map<Integer, AbstractValue> condValues = executeAll(executor, conditions1, b);
        boolean allNegated = true;
        for (AbstractValue v : condValues.values()) {
            if (v.isDefinitely(b)) {
                return truth(b);
            }
            if (!v.isDefinitely(!b)) {
                allNegated = false;
            }
        }
        if (allNegated && condValues.size() == distinctIds(conditions1)) {
            return truth(!b);
        }
        if (n > settings.getMaxConditionLeaves()) {
            return AbstractValue.unknown();
        }
        if (!sortConditions(conditions1)) {
            return AbstractValue.unknown();
        }

        // 叶子求值可能写入 pm，遍历快照
        for (Map.Entry<ExprIdToken, AbstractValue> entry : pm.copy()) {
            Token tok = entry.getKey().getToken();
            if (tok == null || !tok.getStr().equals(op)) continue;
            if (AstUtils.astHasExpr(tok, expr.getExprId())) continue;
            if (AstUtils.astCount(tok, op) != n) continue;
            List<Token> conditions2 = AstUtils.astFlatten(tok, op);
            if (!sortConditions(conditions2)) {
                return AbstractValue.unknown();
            }
            AbstractValue value = entry.getValue();
            if (sameIds(conditions1, conditions2)) {
                return value;
            }
            List<Token> diffConditions1 = setDifference(conditions1, conditions2);
            List<Token> diffConditions2 = setDifference(conditions2, conditions1);
            pruneConditions(diffConditions1, !b, condValues);
            pruneConditions(diffConditions2, !b, executeAll(executor.onCopy(), diffConditions2, null));
            if (diffConditions1.size() != diffConditions2.size()) continue;
            if (diffConditions1.size() == conditions1.size()) continue;
            for (Token cond1 : diffConditions1) {
                Iterator<Token> it = diffConditions2.iterator();
                boolean matched = false;
                while (it.hasNext()) {
                    Token cond2 = it.next();
                    if (evalSameCondition(cond2, cond1)) {
                        it.remove();
                        matched = true;
                        break;
                    }
                }
                if (!matched) break;
            }
            if (diffConditions2.isEmpty()) {
                return value;
            }
        }
        return AbstractValue.unknown();
    }

    /** 某个操作数没有表达式标识时只看两侧各自的真值 */
    private AbstractValue structural(boolean b, Token op1, Token op2) {
        AbstractValue lhs = executor.execute(op1);
        if (lhs.isDefinitely(b)) {
            return truth(b);
        }
        AbstractValue rhs = executor.execute(op2);
        if (rhs.isDefinitely(b)) {
            return truth(b);
        }
        if (lhs.isDefinitely(!b) && rhs.isDefinitely(!b)) {
            return truth(!b);
        }
        return AbstractValue.unknown();
    }

    private static AbstractValue truth(boolean b) {
        return AbstractValue.known(b ? 1 : 0);
    }

    /** 按顺序求值，跳过未知；b 不为 null 时遇到真值为 b 的叶子即停止 */
    private static Map<Integer, AbstractValue> executeAll(Executor executor, List<Token> toks, Boolean b) {
        Map<Integer, AbstractValue> result = new LinkedHashMap<Integer, AbstractValue>();
        for (Token tok : toks) {
            AbstractValue r = executor.execute(tok);
            if (r.isUninitValue()) continue;
            if (!result.containsKey(tok.getExprId())) {
                result.put(tok.getExprId(), r);
            }
            if (b != null && r.isDefinitely(b)) break;
        }
        return result;
    }

    /** 按标识排序去重；含嵌套的另一种逻辑运算符时放弃 */
    private static boolean sortConditions(List<Token> conditions) {
        for (Token t : conditions) {
            if (t.isOneOf(TokenType.AND, TokenType.OR)) {
                return false;
            }
        }
        conditions.sort(Comparator.comparingInt(Token::getExprId));
        Iterator<Token> it = conditions.iterator();
        int last = -1;
        while (it.hasNext()) {
            int id = it.next().getExprId();
            if (id == last) {
                it.remove();
            }
            last = id;
        }
        return !conditions.isEmpty() && conditions.get(0).getExprId() != 0;
    }

    private static int distinctIds(List<Token> conditions) {
        return (int) conditions.stream().mapToInt(Token::getExprId).distinct().count();
    }

    private static boolean sameIds(List<Token> a, List<Token> b) {
        if (a.size() != b.size()) return false;
        for (int i = 0; i < a.size(); i++) {
            if (a.get(i).getExprId() != b.get(i).getExprId()) return false;
        }
        return true;
    }

    /** a 中标识不在 b 里的叶子，a 与 b 均已排序 */
    private static List<Token> setDifference(List<Token> a, List<Token> b) {
        List<Token> result = new ArrayList<Token>();
        for (Token t : a) {
            boolean found = false;
            for (Token u : b) {
                if (u.getExprId() == t.getExprId()) {
                    found = true;
                    break;
                }
            }
            if (!found) result.add(t);
        }
        return result;
    }

    /** 去掉真值已经等于 !b 的叶子 */
    private static void pruneConditions(List<Token> conditions, boolean b, Map<Integer, AbstractValue> values) {
        conditions.removeIf(cond -> {
            if (cond.getExprId() == 0) return false;
            AbstractValue v = values.get(cond.getExprId());
            return v != null && v.isDefinitely(!b);
        });
    }

    /**
     * 假设 assumed 成立后 cond 是否必然成立；假设本身没有带来任何新信息时视为不成立
     */
    private boolean evalSameCondition(Token assumed, Token cond) {
        ProgramState assumedState = pm.copy();
        executor.getEvaluator().stateBuilder().parseCondition(assumedState, assumed, null, true);
        if (assumedState.equals(pm)) {
            return false;
        }
        return executor.getEvaluator().conditionIsTrue(cond, assumedState);
    }
}
