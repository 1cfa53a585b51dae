package com.vigil.valueflow.eval;

import com.vigil.compiler.analysis.Function;
import com.vigil.compiler.analysis.Scope;
import com.vigil.compiler.analysis.Variable;
import com.vigil.compiler.ast.AstUtils;
import com.vigil.compiler.ast.Token;
import com.vigil.compiler.lexer.TokenType;
import com.vigil.compiler.value.AbstractValue;
import com.vigil.compiler.value.Bound;
import com.vigil.compiler.value.Knowledge;
import com.vigil.compiler.value.ValueKind;
import com.vigil.valueflow.ValueFlowContext;
import com.vigil.valueflow.library.CompiledTemplate;
import com.vigil.valueflow.library.LibraryModel;
import com.vigil.valueflow.library.YieldKind;
import com.vigil.valueflow.memory.ProgramState;
import com.vigil.valueflow.oracle.MutationOracle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * 表达式求值器
 *
 * <p>在一份 {@link ProgramState} 上对 AST 节点求值。赋值与自增自减会写回状态，
 * 函数调用后实参中可能被修改的条目会被置为未知。</p>
 *
 * <p>三个预算同时生效：递归深度、函数内联深度以及单次查询的节点访问总数。
 * 任一预算耗尽都得到 Unknown，而不是异常。</p>
 */
final class Executor {

    private static final Logger LOG = Logger.getLogger(Executor.class.getName());

    /** 单次查询内所有执行器共享的访问计数 */
    static final class Budget {
        private final int limit;
        private int visits;
        private boolean reported;

        Budget(int limit) {
            this.limit = limit;
        }

        boolean spend() {
            if (++visits <= limit) {
                return true;
            }
            if (!reported) {
                reported = true;
                LOG.fine(() -> "Node visit budget of " + limit + " exhausted");
            }
            return false;
        }

        int getVisits() {
            return visits;
        }
    }

    private final ExpressionEvaluator evaluator;
    private final ValueFlowContext context;
    private final ProgramState pm;
    private final Budget budget;
    private int depth;
    private int fdepth;

    Executor(ExpressionEvaluator evaluator, ProgramState pm, Budget budget) {
        this.evaluator = evaluator;
        this.context = evaluator.getContext();
        this.pm = pm;
        this.budget = budget;
        this.depth = context.getSettings().getMaxExpressionDepth();
        this.fdepth = context.getSettings().getMaxFunctionDepth();
    }

    /** 内联时使用：新的状态，继承剩余的深度预算 */
    private Executor(Executor parent, ProgramState pm) {
        this.evaluator = parent.evaluator;
        this.context = parent.context;
        this.pm = pm;
        this.budget = parent.budget;
        this.depth = parent.depth;
        this.fdepth = parent.fdepth - 1;
    }

    /** 在当前状态的拷贝上求值，写入不回到当前状态；预算与深度照旧 */
    Executor onCopy() {
        Executor copy = new Executor(this, pm.copy());
        copy.fdepth = fdepth;
        return copy;
    }

    ProgramState getState() {
        return pm;
    }

    ExpressionEvaluator getEvaluator() {
        return evaluator;
    }

    // ============ 入口 ============

    AbstractValue execute(Token expr) {
        depth--;
        try {
            if (depth < 0) {
                LOG.finer("Expression depth budget exhausted");
                return AbstractValue.unknown();
            }
            if (!budget.spend()) {
                return AbstractValue.unknown();
            }
            AbstractValue v = executeImpl(expr);
            if (isResolved(v)) {
                return v;
            }
            if (expr == null) {
                return v;
            }
            if (expr.getExprId() > 0 && pm.hasValue(expr.getExprId())) {
                AbstractValue stored = pm.at(expr.getExprId());
                if (isResolved(stored)) {
                    return stored;
                }
                if (v.isUninitValue()) {
                    v = stored;
                }
            }
            AbstractValue symbolic = fromSymbolicAnnotations(expr);
            if (symbolic != null) {
                return symbolic;
            }
            if (v.isImpossible() && v.isIntValue()) {
                return v;
            }
            AbstractValue impossible = impossibleAnnotation(expr);
            return impossible != null ? impossible : v;
        } finally {
            depth++;
        }
    }

    private static boolean isResolved(AbstractValue v) {
        return !v.isUninitValue() && !v.isImpossible();
    }

    /** KNOWN 的 SYMBOLIC 标注：锚点在状态里有值时加上偏移 */
    private AbstractValue fromSymbolicAnnotations(Token expr) {
        for (AbstractValue value : expr.getValues()) {
            if (!value.isSymbolicValue() || !value.isKnown()) continue;
            Token anchor = value.getTokValue();
            if (anchor == null || anchor.getExprId() <= 0 || !pm.hasValue(anchor.getExprId())) continue;
            AbstractValue ref = pm.at(anchor.getExprId());
            if (!ref.isIntValue() && value.getIntValue() != 0) continue;
            return ref.withIntValue(ref.getIntValue() + value.getIntValue());
        }
        return null;
    }

    /** intValue 最大的 IMPOSSIBLE 整数或容器大小标注 */
    private static AbstractValue impossibleAnnotation(Token expr) {
        AbstractValue best = null;
        for (AbstractValue value : expr.getValues()) {
            if (!value.isImpossible()) continue;
            if (!value.isIntValue() && !value.isContainerSizeValue()) continue;
            if (best == null || value.getIntValue() > best.getIntValue()) {
                best = value;
            }
        }
        return best;
    }

    // ============ 各类节点 ============

    private AbstractValue executeImpl(Token expr) {
        if (expr == null) {
            return AbstractValue.unknown();
        }
        if (expr.is(TokenType.INT_LITERAL)) {
            AbstractValue literal = expr.getKnownValue(ValueKind.INT);
            if (literal == null || (literal.getIntValue() < 0 && AstUtils.astIsUnsigned(expr))) {
                return AbstractValue.unknown();
            }
            return literal;
        }
        AbstractValue annotated = annotatedValue(expr);
        if (annotated != null) {
            return annotated;
        }
        if (expr.is(TokenType.FLOAT_LITERAL)) {
            return AbstractValue.unknown();
        }
        if (expr.isBoolean()) {
            return AbstractValue.known(expr.is(TokenType.KW_TRUE) ? 1 : 0);
        }

        LibraryModel library = context.getLibrary();
        if (AstUtils.isFunctionCall(expr) && expr.getAstOperand1().isOneOf(TokenType.DOT, TokenType.ARROW)) {
            YieldKind yield = library.functionYield(expr);
            if (yield == YieldKind.SIZE || yield == YieldKind.EMPTY) {
                return containerYield(expr, yield);
            }
        }

        if (expr.isAssignmentOp() && expr.getAstOperand1() != null && expr.getAstOperand2() != null
                && expr.getAstOperand1().getExprId() > 0) {
            return assign(expr);
        }
        if (expr.isDirectInit() && expr.getAstOperand1() != null
                && expr.getAstOperand2() != null && expr.getAstOperand1().getExprId() > 0) {
            AbstractValue rhs = execute(expr.getAstOperand2());
            pm.setValue(expr.getAstOperand1(), rhs);
            return rhs;
        }
        if (expr.isOneOf(TokenType.AND, TokenType.OR) && expr.isBinaryOp()) {
            return new MultiCondition(this).evaluate(expr.is(TokenType.OR), expr);
        }
        if (expr.is(TokenType.COMMA) && expr.isBinaryOp()) {
            execute(expr.getAstOperand1());
            return execute(expr.getAstOperand2());
        }
        if (expr.isIncDecOp() && expr.getAstOperand1() != null && expr.getAstOperand1().getExprId() != 0) {
            return incDec(expr);
        }
        if (expr.is(TokenType.LBRACKET) && expr.isBinaryOp()) {
            return stringIndex(expr);
        }
        if (expr.isConstOp() && expr.isBinaryOp()) {
            return binary(expr);
        }
        if (expr.getAstOperand1() != null && expr.getAstOperand2() == null
                && expr.isOneOf(TokenType.NOT, TokenType.PLUS, TokenType.MINUS, TokenType.BIT_NOT)) {
            return unary(expr);
        }
        if (expr.is(TokenType.QUESTION) && expr.isBinaryOp() && expr.getAstOperand2().is(TokenType.COLON)) {
            AbstractValue cond = execute(expr.getAstOperand1());
            if (!cond.isIntValue()) {
                return AbstractValue.unknown();
            }
            Token branches = expr.getAstOperand2();
            if (cond.isDefinitelyFalse()) {
                return execute(branches.getAstOperand2());
            }
            if (cond.isDefinitelyTrue()) {
                return execute(branches.getAstOperand1());
            }
            return AbstractValue.unknown();
        }
        if (expr.is(TokenType.LPAREN) && expr.isCast()) {
            if (expr.getAstOperand2() != null) {
                if (expr.getAstOperand1() != null && expr.getAstOperand1().is(TokenType.KW_DYNAMIC_CAST)) {
                    return AbstractValue.unknown();
                }
                return execute(expr.getAstOperand2());
            }
            return execute(expr.getAstOperand1());
        }
        if (expr.getExprId() > 0 && pm.hasValue(expr.getExprId())) {
            AbstractValue stored = pm.at(expr.getExprId());
            if (stored.isImpossible() && stored.isIntValue() && stored.getIntValue() == 0
                    && AstUtils.isUsedAsBool(expr)) {
                return AbstractValue.known(1);
            }
            return stored;
        }
        if (AstUtils.isFunctionCall(expr)) {
            return call(expr);
        }
        return AbstractValue.unknown();
    }

    /** 静态标注：KNOWN 整数（赋值与逗号除外）以及 KNOWN 的浮点、字符串、迭代器和容器大小 */
    private static AbstractValue annotatedValue(Token expr) {
        if (!expr.isAssignmentOp() && !expr.is(TokenType.COMMA)) {
            AbstractValue v = expr.getKnownValue(ValueKind.INT);
            if (v != null) return v;
        }
        for (AbstractValue v : expr.getValues()) {
            if (!v.isKnown()) continue;
            switch (v.getKind()) {
                case FLOAT:
                case TOK:
                case ITERATOR_START:
                case ITERATOR_END:
                case CONTAINER_SIZE:
                    return v;
                default:
                    break;
            }
        }
        return null;
    }

    private AbstractValue containerYield(Token callParen, YieldKind yield) {
        Token container = context.getLibrary().getContainerFromYield(callParen, yield);
        if (container == null) {
            return AbstractValue.unknown();
        }
        AbstractValue size = execute(container);
        if (!size.isContainerSizeValue()) {
            return AbstractValue.unknown();
        }
        if (yield == YieldKind.SIZE) {
            return size.withKind(ValueKind.INT);
        }
        if (size.isImpossible()) {
            return size.getIntValue() == 0 ? AbstractValue.known(0) : AbstractValue.unknown();
        }
        if (size.isKnown()) {
            return AbstractValue.known(size.getIntValue() == 0 ? 1 : 0);
        }
        if (size.getIntValue() != 0 && size.getBound() != Bound.UPPER) {
            return AbstractValue.possible(0);
        }
        return AbstractValue.unknown();
    }

    private AbstractValue assign(Token expr) {
        Token lhsTok = expr.getAstOperand1();
        AbstractValue rhs = execute(expr.getAstOperand2());
        if (rhs.isUninitValue()) {
            return AbstractValue.unknown();
        }
        if (expr.is(TokenType.ASSIGN)) {
            pm.setValue(lhsTok, rhs);
            return rhs;
        }
        if (!pm.hasValue(lhsTok.getExprId())) {
            return AbstractValue.unknown();
        }
        AbstractValue lhs = pm.at(lhsTok.getExprId());
        String op = expr.getStr().substring(0, expr.getStr().length() - 1);
        AbstractValue result = Calculator.combine(op, lhs, rhs);
        if (result.isUninitValue()) {
            return AbstractValue.unknown();
        }
        AbstractValue updated;
        if (lhs.isIntValue()) {
            updated = lhs.withIntValue(result.asLong());
        } else if (lhs.isFloatValue()) {
            updated = lhs.withFloatValue(result.asDouble());
        } else {
            return AbstractValue.unknown();
        }
        pm.setValue(lhsTok, updated);
        return updated;
    }

    private AbstractValue incDec(Token expr) {
        Token operand = expr.getAstOperand1();
        if (!pm.hasValue(operand.getExprId())) {
            return AbstractValue.unknown();
        }
        AbstractValue old = pm.at(operand.getExprId());
        if (!old.isIntValue()) {
            return AbstractValue.unknown();
        }
        boolean decrement = expr.is(TokenType.DEC);
        if (decrement && !old.isImpossible() && old.getIntValue() == 0 && AstUtils.astIsUnsigned(operand)) {
            // 无符号 0 自减会回绕
            return AbstractValue.unknown();
        }
        AbstractValue updated = old.withIntValue(old.getIntValue() + (decrement ? -1 : 1));
        pm.setValue(operand, updated);
        return expr.isPostfix() ? old : updated;
    }

    /** 字符串字面量下标，等于长度时为结尾的 0 */
    private AbstractValue stringIndex(Token expr) {
        Token array = expr.getAstOperand1();
        Token literal = pm.getTokValue(array.getExprId()).orElse(null);
        if (literal == null) {
            AbstractValue annotated = array.getKnownValue(ValueKind.TOK);
            literal = annotated != null ? annotated.getTokValue() : null;
        }
        if (literal == null || !literal.isString()) {
            return AbstractValue.unknown();
        }
        AbstractValue index = execute(expr.getAstOperand2());
        if (!index.isIntValue() || index.isImpossible()) {
            return AbstractValue.unknown();
        }
        String s = literal.getStrValue();
        long i = index.getIntValue();
        Knowledge knowledge = index.isKnown() ? Knowledge.KNOWN : Knowledge.POSSIBLE;
        if (i >= 0 && i < s.length()) {
            return AbstractValue.ranged(s.charAt((int) i), knowledge, Bound.POINT);
        }
        if (i == s.length()) {
            return AbstractValue.ranged(0, knowledge, Bound.POINT);
        }
        return AbstractValue.unknown();
    }

    private AbstractValue binary(Token expr) {
        Token op1 = expr.getAstOperand1();
        Token op2 = expr.getAstOperand2();
        AbstractValue lhs = execute(op1);
        if (lhs.isUninitValue()) {
            return AbstractValue.unknown();
        }
        AbstractValue rhs = execute(op2);
        if (rhs.isUninitValue()) {
            return AbstractValue.unknown();
        }
        String op = expr.getStr();
        AbstractValue result = Calculator.combine(op, lhs, rhs);
        if (!expr.isComparisonOp() || isResolved(result)) {
            return result;
        }
        if (rhs.isIntValue()) {
            List<AbstractValue> facts = operandFacts(op1, lhs);
            if (!facts.isEmpty()) {
                AbstractValue inferred = firstKnown(context.getInference().infer(op, facts,
                        Collections.singletonList(rhs)));
                if (inferred != null) return inferred;
            }
        }
        if (lhs.isIntValue()) {
            List<AbstractValue> facts = operandFacts(op2, rhs);
            if (!facts.isEmpty()) {
                AbstractValue inferred = firstKnown(context.getInference().infer(op,
                        Collections.singletonList(lhs), facts));
                if (inferred != null) return inferred;
            }
        }
        return AbstractValue.unknown();
    }

    /** 操作数的标注值，加上求出的 IMPOSSIBLE 值与无符号的非负事实 */
    private static List<AbstractValue> operandFacts(Token operand, AbstractValue evaluated) {
        List<AbstractValue> facts = new ArrayList<AbstractValue>(operand.getValues());
        if (evaluated.isImpossible()) {
            facts.add(evaluated);
        }
        if (AstUtils.astIsUnsigned(operand)) {
            facts.add(AbstractValue.ranged(-1, Knowledge.IMPOSSIBLE, Bound.UPPER));
        }
        return facts;
    }

    private static AbstractValue firstKnown(List<AbstractValue> values) {
        if (!values.isEmpty() && values.get(0).isKnown()) {
            return values.get(0);
        }
        return null;
    }

    private AbstractValue unary(Token expr) {
        AbstractValue v = execute(expr.getAstOperand1());
        if (!v.isIntValue()) {
            return AbstractValue.unknown();
        }
        switch (expr.getType()) {
            case NOT:
                if (v.isDefinitelyTrue()) return AbstractValue.known(0);
                if (v.isDefinitelyFalse()) return AbstractValue.known(1);
                return AbstractValue.unknown();
            case MINUS:
                if (v.getIntValue() == Long.MIN_VALUE) return AbstractValue.unknown();
                return v.withIntValue(-v.getIntValue()).withBound(v.getBound().invert());
            case BIT_NOT:
                return v.withIntValue(~v.getIntValue()).withBound(v.getBound().invert());
            default:
                return v;
        }
    }

    // ============ 函数调用 ============

    private AbstractValue call(Token expr) {
        List<AbstractValue> args = new ArrayList<AbstractValue>();
        for (Token arg : AstUtils.getArguments(expr)) {
            args.add(execute(arg));
        }
        Token name = AstUtils.getCallName(expr);
        Function f = name != null ? name.getFunction() : null;
        AbstractValue result = AbstractValue.unknown();
        boolean inlined = false;
        if (f != null) {
            if (fdepth > 0 && !f.isVirtual() && f.hasBody()) {
                ProgramState functionState = new ProgramState();
                for (int i = 0; i < args.size(); i++) {
                    Variable param = f.getArgumentVar(i);
                    if (param == null) {
                        return AbstractValue.unknown();
                    }
                    if (param.getNameToken() != null) {
                        functionState.setValue(param.getNameToken(), args.get(i));
                    }
                }
                List<AbstractValue> returns = new Executor(this, functionState).execute(f.getFunctionScope());
                if (!returns.isEmpty()) {
                    result = returns.get(0);
                }
                inlined = true;
            }
        } else if (name != null) {
            Optional<BuiltinFunctions.Builtin> builtin = BuiltinFunctions.lookup(name.getStr());
            if (builtin.isPresent()) {
                return builtin.get().apply(args);
            }
            Optional<String> template = context.getLibrary().returnValueExpression(name.getStr());
            if (template.isPresent()) {
                Map<Integer, AbstractValue> bound = new LinkedHashMap<Integer, AbstractValue>();
                for (int i = 0; i < args.size(); i++) {
                    if (!args.get(i).isUninitValue()) {
                        bound.put(i, args.get(i));
                    }
                }
                return evaluateTemplate(bound, template.get());
            }
        }
        if (!inlined || context.getSettings().isInvalidateReferenceArguments()) {
            invalidateArguments(expr.getAstOperand2());
        }
        return result;
    }

    /** 调用后实参中可能被修改的已记录子表达式置为未知 */
    private void invalidateArguments(Token args) {
        if (args == null) return;
        MutationOracle oracle = context.getOracle();
        AstUtils.forEach(args, child -> {
            if (child.getExprId() <= 0 || !pm.hasValue(child.getExprId())) return;
            AbstractValue v = pm.at(child.getExprId());
            boolean changed;
            if (v.isContainerSizeValue()) {
                changed = oracle.isContainerSizeChanged(child, v.getIndirect());
            } else if (!v.isUninitValue()) {
                changed = oracle.isVariableChanged(child, v.getIndirect());
            } else {
                changed = false;
            }
            if (changed) {
                pm.setValue(child, AbstractValue.unknown());
            }
        });
    }

    /** 返回值模板：argN 绑定第 N 个实参（从 0 开始），在独立状态中求值 */
    AbstractValue evaluateTemplate(Map<Integer, AbstractValue> args, String template) {
        Optional<CompiledTemplate> compiled = context.getTemplates().compile(template);
        if (!compiled.isPresent()) {
            return AbstractValue.unknown();
        }
        ProgramState templateState = new ProgramState();
        for (Map.Entry<Integer, AbstractValue> e : args.entrySet()) {
            Token argTok = compiled.get().getArgument(e.getKey());
            if (argTok != null) {
                templateState.setValue(argTok, e.getValue());
            }
        }
        return new Executor(evaluator, templateState, budget).execute(compiled.get().getExpression());
    }

    // ============ 函数体 ============

    /**
     * 逐条执行函数体，遇到第一个 return 时给出其值；中途无法继续时给出 [Unknown]，
     * 走到体尾则为空列表
     */
    List<AbstractValue> execute(Scope scope) {
        if (scope == null || scope.getBodyStart() == null) {
            return Collections.singletonList(AbstractValue.unknown());
        }
        Token end = scope.getBodyEnd();
        for (Token tok = scope.getBodyStart().getNext(); AstUtils.precedes(tok, end); tok = tok.getNext()) {
            if (tok.is(TokenType.SEMICOLON) || tok.isDeclSpecifier()) {
                continue;
            }
            Token top = tok.astTop();
            if (top.is(TokenType.KW_RETURN) && top.getAstOperand1() != null) {
                return Collections.singletonList(execute(top.getAstOperand1()));
            }
            if (top.isOp() || top.isDirectInit()) {
                if (execute(top).isUninitValue()) {
                    return Collections.singletonList(AbstractValue.unknown());
                }
                Token next = AstUtils.nextAfterAstRightmostLeaf(top);
                if (next == null) {
                    return Collections.singletonList(AbstractValue.unknown());
                }
                tok = next;
            } else if (isDeclaredName(tok, top)) {
                continue;
            } else if (AstUtils.isControlParen(top) && top.getAstOperand1().is(TokenType.KW_IF)) {
                AbstractValue cond = execute(top.getAstOperand2());
                if (!cond.isIntValue()) {
                    return Collections.singletonList(AbstractValue.unknown());
                }
                Token thenStart = top.getLink().getNext();
                Token next = thenStart.getLink();
                Token elseStart = null;
                if (Token.match(next, "} else {")) {
                    elseStart = next.tokAt(2);
                    next = elseStart.getLink();
                }
                List<AbstractValue> result;
                if (cond.isDefinitelyTrue()) {
                    result = execute(thenStart.getScope());
                } else if (cond.isDefinitelyFalse()) {
                    result = elseStart != null ? execute(elseStart.getScope()) : Collections.<AbstractValue>emptyList();
                } else {
                    return Collections.singletonList(AbstractValue.unknown());
                }
                if (!result.isEmpty()) {
                    return result;
                }
                tok = next;
            } else {
                return Collections.singletonList(AbstractValue.unknown());
            }
        }
        return Collections.emptyList();
    }

    /** 不带初始化的局部声明 {@code int y;} */
    private static boolean isDeclaredName(Token tok, Token top) {
        Variable var = tok.getVariable();
        return top == tok && var != null && var.getNameToken() == tok;
    }
}
