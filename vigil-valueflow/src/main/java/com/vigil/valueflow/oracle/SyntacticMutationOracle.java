package com.vigil.valueflow.oracle;

import com.vigil.compiler.analysis.Function;
import com.vigil.compiler.analysis.ValueType;
import com.vigil.compiler.analysis.Variable;
import com.vigil.compiler.ast.AstUtils;
import com.vigil.compiler.ast.Token;
import com.vigil.compiler.lexer.TokenType;
import com.vigil.compiler.value.AbstractValue;
import com.vigil.valueflow.library.LibraryModel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 基于语法形态的修改判定
 *
 * <p>赋值左侧、自增自减、取地址后逃逸、非 const 引用或指针形参、容器的修改型成员调用都算修改。
 * 未解析的非纯函数：指针、数组与具名类型实参视为可能被修改，标量实参按值传递处理。
 * 非局部变量遇到任何非纯函数调用都视为可能被修改。</p>
 */
public final class SyntacticMutationOracle implements MutationOracle {

    private final LibraryModel library;

    public SyntacticMutationOracle(LibraryModel library) {
        this.library = library;
    }

    @Override
    public boolean isExpressionChanged(Token expr, Token from, Token to) {
        return expressionChanged(expr, from, to, null);
    }

    @Override
    public boolean isExpressionChangedSkipDeadCode(Token expr, Token from, Token to, ConditionEvaluator evaluator) {
        return expressionChanged(expr, from, to, evaluator);
    }

    private boolean expressionChanged(Token expr, Token from, Token to, ConditionEvaluator evaluator) {
        if (expr == null || !AstUtils.precedes(from, to)) return false;
        List<Token> nodes = new ArrayList<Token>();
        AstUtils.forEach(expr, nodes::add);
        for (Token node : nodes) {
            if (!isMutable(node)) continue;
            Variable var = node.getVariable();
            boolean global = false;
            if (var != null) {
                if (var.isConst() && !var.isPointer()) continue;
                global = !var.isLocal() && !var.isArgument();
            }
            int exprId = node.getExprId();
            int maxIndirect = node.getValueType() != null ? node.getValueType().getPointer() : 0;
            boolean isGlobal = global;
            boolean changed = anyLive(from, to, evaluator, tok -> {
                if (tok.getExprId() == exprId && isMutable(tok)) {
                    for (int indirect = 0; indirect <= maxIndirect; indirect++) {
                        if (isVariableChanged(tok, indirect)) return true;
                    }
                }
                return isGlobal && isImpureCall(tok);
            });
            if (changed) return true;
        }
        return false;
    }

    @Override
    public boolean isVariableChanged(Token from, Token to, int exprId, boolean globalvar) {
        if (exprId == 0 || !AstUtils.precedes(from, to)) return false;
        return anyLive(from, to, null, tok -> (tok.getExprId() == exprId && isVariableChanged(tok, 0))
                || (globalvar && isImpureCall(tok)));
    }

    @Override
    public boolean isVariableChanged(Token tok, int indirect) {
        if (tok == null) return false;
        tok = skipCasts(tok);
        Token parent = tok.getAstParent();
        if (parent == null) return false;
        if (parent.isAssignmentOp() && parent.getAstOperand1() == tok) {
            return indirect == 0;
        }
        if (parent.isIncDecOp()) {
            return indirect == 0;
        }
        if (parent.is(TokenType.LPAREN) && parent.isDirectInit() && parent.getAstOperand1() == tok) {
            return indirect == 0;
        }
        if (parent.isUnaryOp("&")) {
            return isChangedByCall(parent, indirect + 1) || isAssignedFrom(parent);
        }
        if (parent.isUnaryOp("*")) {
            return indirect > 0 && isVariableChanged(parent, indirect - 1);
        }
        if (parent.is(TokenType.LBRACKET) && parent.getAstOperand1() == tok) {
            return isVariableChanged(parent, 0);
        }
        if (parent.isOneOf(TokenType.DOT, TokenType.ARROW) && parent.getAstOperand1() == tok) {
            Token call = parent.getAstParent();
            if (AstUtils.isFunctionCall(call) && call.getAstOperand1() == parent) {
                if (library.isContainer(tok)) {
                    return library.containerAction(parent.getAstOperand2().getStr()).changesSize();
                }
                return true;
            }
            return isVariableChanged(parent, indirect);
        }
        return isChangedByCall(tok, indirect);
    }

    @Override
    public boolean isContainerSizeChanged(Token tok, int indirect) {
        if (tok == null) return false;
        tok = skipCasts(tok);
        Token parent = tok.getAstParent();
        if (parent == null) return false;
        if (parent.isAssignmentOp() && parent.getAstOperand1() == tok) return true;
        if (parent.is(TokenType.LPAREN) && parent.isDirectInit() && parent.getAstOperand1() == tok) return true;
        if (parent.isUnaryOp("&")) return true;
        if (parent.is(TokenType.DOT) && parent.getAstOperand1() == tok) {
            Token call = parent.getAstParent();
            if (AstUtils.isFunctionCall(call) && call.getAstOperand1() == parent) {
                return library.containerAction(parent.getAstOperand2().getStr()).changesSize();
            }
            return false;
        }
        return isChangedByCall(tok, indirect);
    }

    // ============ 调用 ============

    /** 作为实参传入后是否可能被修改 */
    private boolean isChangedByCall(Token arg, int indirect) {
        int[] index = {-1};
        Token paren = AstUtils.getCallParen(arg, index);
        if (paren == null) return false;
        Token name = AstUtils.getCallName(paren);
        Function function = name != null ? name.getFunction() : null;
        if (function != null) {
            Variable param = function.getArgumentVar(index[0]);
            if (param == null) return true;
            if (param.isReference()) return !param.isConst();
            return param.isPointer() && indirect > 0 && !param.isConst();
        }
        if (name != null && library.isPure(name.getStr())) return false;
        if (indirect > 0) return true;
        ValueType vt = arg.getValueType();
        if (vt == null) return false;
        if (vt.getPointer() > 0 || vt.getType() == ValueType.Type.RECORD) return true;
        Variable var = arg.getVariable();
        return var != null && var.isArray();
    }

    private boolean isImpureCall(Token tok) {
        if (!AstUtils.isFunctionCall(tok)) return false;
        Token name = AstUtils.getCallName(tok);
        if (name == null) return true;
        if (library.isPure(name.getStr())) return false;
        Token callee = tok.getAstOperand1();
        if (callee.is(TokenType.DOT) && library.isContainer(callee.getAstOperand1())) {
            return library.containerAction(name.getStr()).changesSize();
        }
        return true;
    }

    private static boolean isAssignedFrom(Token tok) {
        Token parent = tok.getAstParent();
        return parent != null && parent.isAssignmentOp() && parent.getAstOperand2() == tok;
    }

    private static Token skipCasts(Token tok) {
        Token parent = tok.getAstParent();
        while (parent != null && parent.isCast()) {
            tok = parent;
            parent = tok.getAstParent();
        }
        return tok;
    }

    private static boolean isMutable(Token tok) {
        if (tok.getExprId() == 0 || tok.isLiteral() || tok.is(TokenType.KW_NULLPTR)) return false;
        Token parent = tok.getAstParent();
        return parent == null || !parent.isOneOf(TokenType.DOT, TokenType.ARROW) || parent.getAstOperand2() != tok;
    }

    // ============ 区间扫描 ============

    /**
     * 顺序扫描 [from, to)；给出 evaluator 时跳过条件确定为假的 then 块和条件确定为真的 else 块
     */
    private static boolean anyLive(Token from, Token to, ConditionEvaluator evaluator, Predicate<Token> predicate) {
        Set<Token> deadBlocks = evaluator != null
                ? Collections.newSetFromMap(new IdentityHashMap<Token, Boolean>())
                : Collections.<Token>emptySet();
        for (Token tok = from; tok != null && tok != to; tok = tok.getNext()) {
            if (deadBlocks.contains(tok)) {
                Token end = tok.getLink();
                if (end == null || (to != null && to.getIndex() <= end.getIndex())) return false;
                tok = end;
                continue;
            }
            if (evaluator != null && tok.is(TokenType.KW_IF)) {
                markDeadBranch(tok, evaluator, deadBlocks);
            }
            if (predicate.test(tok)) return true;
        }
        return false;
    }

    private static void markDeadBranch(Token ifTok, ConditionEvaluator evaluator, Set<Token> deadBlocks) {
        Token paren = ifTok.getNext();
        if (paren == null || paren.getLink() == null) return;
        Token open = paren.getLink().getNext();
        Token cond = paren.getAstOperand2();
        if (cond == null || open == null || !open.is(TokenType.LBRACE)) return;
        AbstractValue value = evaluator.evaluate(cond);
        if (value == null) return;
        if (value.isDefinitelyFalse()) {
            deadBlocks.add(open);
        } else if (value.isDefinitelyTrue() && Token.match(open.getLink(), "} else {")) {
            deadBlocks.add(open.getLink().tokAt(2));
        }
    }
}
