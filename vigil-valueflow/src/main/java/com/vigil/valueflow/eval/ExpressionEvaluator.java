package com.vigil.valueflow.eval;

import com.vigil.compiler.analysis.Scope;
import com.vigil.compiler.ast.Token;
import com.vigil.compiler.value.AbstractValue;
import com.vigil.valueflow.ValueFlowContext;
import com.vigil.valueflow.memory.ProgramState;
import com.vigil.valueflow.state.ProgramStateBuilder;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 表达式求值入口
 *
 * <p>每次调用都是一次独立查询，拥有完整的深度与访问预算。求值可能修改传入的状态
 * （赋值、自增自减、调用后的失效），只想“看一眼”时请传入 {@link ProgramState#copy()}。</p>
 *
 * <p>实例不保存查询之间的状态，可以在线程间共享；但同一个 {@link ProgramState}
 * 不能被两个线程同时求值。</p>
 */
public final class ExpressionEvaluator {

    private static final Logger LOG = Logger.getLogger(ExpressionEvaluator.class.getName());

    private final ValueFlowContext context;
    private final ProgramStateBuilder stateBuilder;

    public ExpressionEvaluator(ValueFlowContext context) {
        this.context = context;
        this.stateBuilder = new ProgramStateBuilder(this);
    }

    public static ExpressionEvaluator standard() {
        return new ExpressionEvaluator(ValueFlowContext.standard());
    }

    public ValueFlowContext getContext() {
        return context;
    }

    /** 使用同一上下文的状态构造器 */
    public ProgramStateBuilder stateBuilder() {
        return stateBuilder;
    }

    /**
     * 在 state 上求值 expr
     *
     * @return 无法确定时为 Unknown
     */
    public AbstractValue evaluate(Token expr, ProgramState state) {
        Executor.Budget budget = newBudget();
        AbstractValue result = new Executor(this, state, budget).execute(expr);
        if (LOG.isLoggable(Level.FINEST)) {
            LOG.finest(String.format("%s => %s (%d nodes)", expr, result, budget.getVisits()));
        }
        return result;
    }

    /**
     * 求值并要求结果为非 IMPOSSIBLE 的整数
     *
     * @return 其余情况为空
     */
    public OptionalLong evaluateInt(Token expr, ProgramState state) {
        AbstractValue v = evaluate(expr, state);
        if (!v.isIntValue() || v.isImpossible()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(v.getIntValue());
    }

    /**
     * 在状态中执行一个函数体（内联调用使用的同一套规则）
     *
     * @return 第一个 return 的值；无法继续时为 [Unknown]；走到体尾时为空
     */
    public List<AbstractValue> execute(Scope scope, ProgramState state) {
        return new Executor(this, state, newBudget()).execute(scope);
    }

    /**
     * 用返回值模板计算库函数的结果
     *
     * @param args 实参下标（从 0 开始）到实参值，未知的实参不必给出
     */
    public AbstractValue evaluateLibraryFunction(Map<Integer, AbstractValue> args, String template) {
        return new Executor(this, new ProgramState(), newBudget()).evaluateTemplate(args, template);
    }

    /** 条件在状态的拷贝上确定为真 */
    public boolean conditionIsTrue(Token condition, ProgramState state) {
        if (condition == null) return false;
        return evaluate(condition, state.copy()).isDefinitelyTrue();
    }

    /** 条件在状态的拷贝上确定为假 */
    public boolean conditionIsFalse(Token condition, ProgramState state) {
        if (condition == null) return false;
        return evaluate(condition, state.copy()).isDefinitelyFalse();
    }

    private Executor.Budget newBudget() {
        return new Executor.Budget(context.getSettings().getMaxNodeVisits());
    }
}
