package com.vigil.valueflow.state;

import com.vigil.compiler.ast.AstUtils;
import com.vigil.compiler.ast.Token;
import com.vigil.compiler.value.AbstractValue;
import com.vigil.valueflow.eval.ExpressionEvaluator;
import com.vigil.valueflow.memory.ExprIdToken;
import com.vigil.valueflow.memory.ProgramState;
import com.vigil.valueflow.oracle.ConditionEvaluator;
import com.vigil.valueflow.oracle.MutationOracle;

import java.util.HashMap;
import java.util.Map;

/**
 * 沿程序前进的状态游标
 *
 * <p>除状态本身外还记录每个条目的来源点；之后只要在来源点与当前点之间
 * 表达式可能被修改，条目就会被丢弃。</p>
 */
public final class StateCursor {

    private final ExpressionEvaluator evaluator;
    private final ProgramStateBuilder builder;
    private final MutationOracle oracle;
    private final ProgramState state;
    private final Map<Integer, Token> origins;

    public StateCursor(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
        this.builder = evaluator.stateBuilder();
        this.oracle = evaluator.getContext().getOracle();
        this.state = new ProgramState();
        this.origins = new HashMap<Integer, Token>();
    }

    /** 拷贝：状态按写时复制共享，来源表复制一份 */
    public StateCursor(StateCursor other) {
        this.evaluator = other.evaluator;
        this.builder = other.builder;
        this.oracle = other.oracle;
        this.state = other.state.copy();
        this.origins = new HashMap<Integer, Token>(other.origins);
    }

    /** 合并 pm，并把其中的条目记为来自 origin */
    public void replace(ProgramState pm, Token origin) {
        if (origin != null) {
            for (Map.Entry<ExprIdToken, AbstractValue> e : pm) {
                origins.put(e.getKey().getExprId(), origin);
            }
        }
        state.replace(pm);
    }

    private static void addVars(ProgramState pm, Map<ExprIdToken, AbstractValue> vars) {
        for (Map.Entry<ExprIdToken, AbstractValue> e : vars.entrySet()) {
            pm.setValue(e.getKey().getToken(), e.getValue());
        }
    }

    /** 在 tok 处叠加外层条件与前面赋值得到的事实 */
    public void addState(Token tok, Map<ExprIdToken, AbstractValue> vars) {
        ProgramState pm = state.copy();
        addVars(pm, vars);
        builder.fillFromConditions(pm, tok);
        ProgramState local = pm.copy();
        builder.fillFromAssignments(pm, tok, local, vars);
        addVars(pm, vars);
        replace(pm, tok);
    }

    /**
     * 假设 tok 的真值为 b
     *
     * @param isEmpty tok 是容器，假设的是“容器为空”
     */
    public void assume(Token tok, boolean b, boolean isEmpty) {
        ProgramState pm = state.copy();
        if (isEmpty) {
            pm.setContainerSizeValue(tok, 0, b);
        } else {
            builder.parseCondition(pm, tok, null, b);
        }
        Token origin = tok;
        Token top = tok.astTop();
        if (Token.match(top.getPrevious(), "for|while|if (") && !Token.match(tok.getAstParent(), "?")) {
            origin = top.getLink().getNext();
            if (!b && origin != null && origin.getLink() != null) {
                origin = origin.getLink();
            }
        }
        replace(pm, origin);
    }

    /** 丢弃来源点到 tok 之间可能被修改的条目；没有来源点的条目保留 */
    public void removeModifiedVars(Token tok) {
        ProgramState current = state;
        ConditionEvaluator eval = cond -> {
            AbstractValue r = evaluator.evaluate(cond, current.copy());
            if (r.isDefinitelyTrue()) return AbstractValue.known(1);
            if (r.isDefinitelyFalse()) return AbstractValue.known(0);
            return AbstractValue.unknown();
        };
        state.eraseIf((key, value) -> {
            Token start = origins.get(key.getExprId());
            Token expr = key.getToken();
            if (expr == null || oracle.isExpressionChangedSkipDeadCode(expr, start, tok, eval)) {
                origins.remove(key.getExprId());
                return true;
            }
            return false;
        });
    }

    /**
     * 求值 tok 时使用的状态，不修改本游标
     *
     * @param ctx 可为 null
     */
    public ProgramState get(Token tok, Token ctx, Map<ExprIdToken, AbstractValue> vars) {
        StateCursor local = new StateCursor(this);
        if (ctx != null) {
            local.addState(ctx, vars);
        }
        Token start = AstUtils.previousBeforeAstLeftmostLeaf(tok);
        if (start == null) {
            start = tok;
        }
        if (ctx == null || AstUtils.precedes(start, ctx)) {
            local.removeModifiedVars(start);
            local.addState(start, vars);
        } else {
            local.removeModifiedVars(ctx);
        }
        return local.state.copy();
    }

    /** 当前状态的拷贝 */
    public ProgramState getState() {
        return state.copy();
    }

    /** 条目的来源点，没有时为 null */
    public Token getOrigin(int exprId) {
        return origins.get(exprId);
    }
}
