package com.vigil.valueflow.state;

import com.vigil.compiler.analysis.Scope;
import com.vigil.compiler.ast.AstUtils;
import com.vigil.compiler.ast.Token;
import com.vigil.compiler.lexer.TokenType;
import com.vigil.compiler.value.AbstractValue;
import com.vigil.compiler.value.Bound;
import com.vigil.compiler.value.Knowledge;
import com.vigil.compiler.value.ValueKind;
import com.vigil.valueflow.eval.ExpressionEvaluator;
import com.vigil.valueflow.library.LibraryModel;
import com.vigil.valueflow.library.YieldKind;
import com.vigil.valueflow.memory.ExprIdToken;
import com.vigil.valueflow.memory.ProgramState;
import com.vigil.valueflow.oracle.MutationOracle;

import java.util.Collections;
import java.util.Map;
import java.util.OptionalLong;

/**
 * 为某个程序点构造初始状态
 *
 * <p>事实有两个来源：外层条件（进入 if/while/for 块意味着条件成立，进入 else 意味着不成立）
 * 以及向前回溯找到的赋值。回溯遇到无法确定是否会执行的块时停止。</p>
 */
public final class ProgramStateBuilder {

    private final ExpressionEvaluator evaluator;
    private final LibraryModel library;
    private final MutationOracle oracle;

    public ProgramStateBuilder(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
        this.library = evaluator.getContext().getLibrary();
        this.oracle = evaluator.getContext().getOracle();
    }

    // ============ 条件 ============

    /**
     * 把“tok 的真值为 then”记入状态
     *
     * @param endTok 不为 null 时，被比较的表达式在 tok 与 endTok 之间可能改变则不记录
     */
    public void parseCondition(ProgramState pm, Token tok, Token endTok, boolean then) {
        if (tok == null) return;
        if (tok.isComparisonOp()) {
            parseComparison(pm, tok, endTok, then);
        } else if (tok.is(TokenType.NOT)) {
            parseCondition(pm, tok.getAstOperand1(), endTok, !then);
        } else if ((then && tok.is(TokenType.AND)) || (!then && tok.is(TokenType.OR))) {
            parseCondition(pm, tok.getAstOperand1(), endTok, then);
            parseCondition(pm, tok.getAstOperand2(), endTok, then);
        } else if (tok.isOneOf(TokenType.AND, TokenType.OR)) {
            OptionalLong lhs = evalInt(pm, tok.getAstOperand1());
            OptionalLong rhs = evalInt(pm, tok.getAstOperand2());
            if (lhs.isPresent() && rhs.isPresent()) return;
            if (frontIs(lhs, !then)) {
                parseCondition(pm, tok.getAstOperand2(), endTok, then);
            } else if (frontIs(rhs, !then)) {
                parseCondition(pm, tok.getAstOperand1(), endTok, then);
            } else {
                pm.setIntValue(tok, 0, then);
            }
        } else if (tok.getExprId() > 0) {
            if (endTok != null && oracle.isExpressionChanged(tok, tok.getNext(), endTok)) return;
            pm.setIntValue(tok, 0, then);
            Token container = library.getContainerFromYield(tok, YieldKind.EMPTY);
            if (container != null) {
                pm.setContainerSizeValue(container, 0, then);
            }
        }
    }

    private void parseComparison(ProgramState pm, Token tok, Token endTok, boolean then) {
        Token op1 = tok.getAstOperand1();
        Token op2 = tok.getAstOperand2();
        if (op1 == null || op2 == null) return;
        OptionalLong value1 = evalInt(pm, op1);
        OptionalLong value2 = evalInt(pm, op2);
        if (value1.isPresent() && value2.isPresent()) {
            if (op1.hasKnownIntValue()) value2 = OptionalLong.empty();
            if (op2.hasKnownIntValue()) value1 = OptionalLong.empty();
        }
        Token vartok;
        String op;
        long constant;
        if (value2.isPresent()) {
            vartok = op1;
            op = tok.getStr();
            constant = value2.getAsLong();
        } else if (value1.isPresent()) {
            vartok = op2;
            op = mirror(tok.getStr());
            constant = value1.getAsLong();
        } else {
            return;
        }
        if (vartok.getExprId() == 0) return;
        if (endTok != null && oracle.isExpressionChanged(vartok, tok.getNext(), endTok)) return;

        AbstractValue v = then ? trueValue(op, constant) : falseValue(op, constant);
        if (v == null) return;
        boolean impossible = ("==".equals(op) && !then) || ("!=".equals(op) && then);
        AbstractValue stored = impossible ? v.asImpossible() : v;
        pm.setValue(vartok, stored);
        Token container = library.getContainerFromYield(vartok, YieldKind.SIZE);
        if (container != null) {
            pm.setValue(container, stored.withKind(ValueKind.CONTAINER_SIZE));
        }
    }

    /** 常量在左侧时交换方向 */
    private static String mirror(String op) {
        switch (op) {
            case "<": return ">";
            case ">": return "<";
            case "<=": return ">=";
            case ">=": return "<=";
            default: return op;
        }
    }

    private static AbstractValue trueValue(String op, long v) {
        switch (op) {
            case "==":
            case "!=":
                return AbstractValue.possible(v);
            case ">": return v == Long.MAX_VALUE ? null : range(v + 1, Bound.LOWER);
            case ">=": return range(v, Bound.LOWER);
            case "<": return v == Long.MIN_VALUE ? null : range(v - 1, Bound.UPPER);
            case "<=": return range(v, Bound.UPPER);
            default: return null;
        }
    }

    private static AbstractValue falseValue(String op, long v) {
        switch (op) {
            case "==":
            case "!=":
                return AbstractValue.possible(v);
            case ">": return range(v, Bound.UPPER);
            case ">=": return v == Long.MIN_VALUE ? null : range(v - 1, Bound.UPPER);
            case "<": return range(v, Bound.LOWER);
            case "<=": return v == Long.MAX_VALUE ? null : range(v + 1, Bound.LOWER);
            default: return null;
        }
    }

    private static AbstractValue range(long v, Bound bound) {
        return AbstractValue.ranged(v, Knowledge.POSSIBLE, bound);
    }

    private static boolean frontIs(OptionalLong v, boolean truth) {
        return v.isPresent() && (v.getAsLong() != 0) == truth;
    }

    /** KNOWN 标注优先，否则在 pm 上求值 */
    private OptionalLong evalInt(ProgramState pm, Token t) {
        if (t == null) return OptionalLong.empty();
        AbstractValue annotated = t.getKnownValue(ValueKind.INT);
        if (annotated != null) return OptionalLong.of(annotated.getIntValue());
        return evaluator.evaluateInt(t, pm);
    }

    /**
     * 由 tok 所在的局部作用域向外，把每层 if/else/while/for 的条件记入状态（外层先记）
     */
    public void fillFromConditions(ProgramState pm, Token tok) {
        fillFromConditions(pm, tok.getScope(), tok);
    }

    private void fillFromConditions(ProgramState pm, Scope scope, Token endTok) {
        if (scope == null || !scope.isLocal()) return;
        fillFromConditions(pm, scope.getNestedIn(), endTok);
        switch (scope.getType()) {
            case IF:
            case ELSE:
            case WHILE:
            case FOR: {
                Token condTok = AstUtils.getCondTokFromEnd(scope.getBodyEnd());
                if (condTok == null) return;
                if (!evaluator.evaluateInt(condTok, pm).isPresent()) {
                    parseCondition(pm, condTok, endTok, scope.getType() != Scope.ScopeType.ELSE);
                }
                break;
            }
            default:
                break;
        }
    }

    // ============ 赋值 ============

    /**
     * 从 tok 向前回溯收集赋值
     *
     * @param snapshot 判断分支条件时使用的状态
     * @param bindings 优先于赋值右值的绑定
     */
    public void fillFromAssignments(ProgramState pm, Token tok, ProgramState snapshot,
                                    Map<ExprIdToken, AbstractValue> bindings) {
        int indentlevel = 0;
        for (Token tok2 = tok; tok2 != null; tok2 = tok2.getPrevious()) {
            if ((tok2.is(TokenType.ASSIGN) || tok2.isDirectInit())
                    && tok2.getAstOperand1() != null && tok2.getAstOperand2() != null) {
                Token vartok = tok2.getAstOperand1();
                boolean setvar = false;
                for (Map.Entry<ExprIdToken, AbstractValue> binding : bindings.entrySet()) {
                    if (binding.getKey().getExprId() != vartok.getExprId()) continue;
                    if (vartok == tok) continue;
                    pm.setValue(vartok, binding.getValue());
                    setvar = true;
                }
                if (!setvar && !pm.hasValue(vartok.getExprId())) {
                    pm.setValue(vartok, evaluator.evaluate(tok2.getAstOperand2(), pm));
                }
            } else if (tok2.getExprId() > 0 && isTrackable(tok2) && !pm.hasValue(tok2.getExprId())
                    && oracle.isVariableChanged(tok2, 0)) {
                pm.setUnknown(tok2);
            }

            if (tok2.is(TokenType.LBRACE) && isScopeBrace(tok2)) {
                if (indentlevel <= 0) {
                    Token cond = AstUtils.getCondTokFromEnd(tok2.getLink());
                    Scope.ScopeType type = tok2.getScope().getType();
                    // do 块、普通块以及条件恒真的分支继续回溯
                    if (type != Scope.ScopeType.DO && type != Scope.ScopeType.UNCONDITIONAL
                            && !evaluator.conditionIsTrue(cond, snapshot)
                            && (cond != null || !AstUtils.isBasicForLoop(tok2))) {
                        break;
                    }
                } else {
                    --indentlevel;
                }
                if (Token.match(tok2.getPrevious(), "else {")) {
                    tok2 = tok2.linkAt(-2).getPrevious();
                }
            }
            if (tok2.is(TokenType.RBRACE) && isScopeBrace(tok2.getLink())) {
                Token cond = AstUtils.getCondTokFromEnd(tok2);
                boolean inElse = Token.match(tok2.getLink().getPrevious(), "else {");
                if (cond != null) {
                    if (evaluator.conditionIsFalse(cond, snapshot)) {
                        if (inElse) {
                            ++indentlevel;
                            continue;
                        }
                    } else if (evaluator.conditionIsTrue(cond, snapshot)) {
                        if (inElse) {
                            tok2 = tok2.getLink().tokAt(-2);
                        }
                        ++indentlevel;
                        continue;
                    }
                }
                break;
            }
        }
    }

    private static boolean isTrackable(Token tok) {
        return tok.isOneOf(TokenType.DOT, TokenType.LPAREN, TokenType.LBRACKET, TokenType.MUL) || tok.getVarId() != 0;
    }

    /** 作用域体的花括号，不含初始化列表 */
    private static boolean isScopeBrace(Token open) {
        return open != null && open.getScope() != null && open.getScope().getBodyStart() == open;
    }

    /** 删除 origin 与 tok 之间可能被修改的条目 */
    public void removeModifiedVars(ProgramState pm, Token tok, Token origin) {
        pm.eraseIf((key, value) -> oracle.isVariableChanged(origin, tok, key.getExprId(), false));
    }

    // ============ 组合 ============

    public ProgramState getInitialProgramState(Token tok, Token origin) {
        return getInitialProgramState(tok, origin, Collections.<ExprIdToken, AbstractValue>emptyMap());
    }

    /**
     * 以 origin 为锚点：先记外层条件，再回溯 tok 之前的赋值，最后删去两点之间被修改的条目
     *
     * @return origin 为 null 时为空状态
     */
    public ProgramState getInitialProgramState(Token tok, Token origin, Map<ExprIdToken, AbstractValue> bindings) {
        ProgramState pm = new ProgramState();
        if (origin != null) {
            fillFromConditions(pm, origin);
            ProgramState snapshot = pm.copy();
            fillFromAssignments(pm, tok, snapshot, bindings);
            removeModifiedVars(pm, tok, origin);
        }
        return pm;
    }

    /**
     * tok 处 expr 取 value 时的状态
     */
    public ProgramState getProgramMemory(Token tok, Token expr, AbstractValue value) {
        ProgramState pm = new ProgramState();
        pm.replace(getInitialProgramState(tok, value.getTokValue()));
        fillFromConditions(pm, tok);
        pm.setValue(expr, value);
        ProgramState snapshot = pm.copy();
        fillFromAssignments(pm, tok, snapshot, Collections.singletonMap(new ExprIdToken(expr), value));
        return pm;
    }

    public boolean conditionIsTrue(Token condition, ProgramState state) {
        return evaluator.conditionIsTrue(condition, state);
    }

    public boolean conditionIsFalse(Token condition, ProgramState state) {
        return evaluator.conditionIsFalse(condition, state);
    }
}
