package com.vigil.compiler.analysis;

import com.vigil.compiler.ast.AstUtils;
import com.vigil.compiler.ast.Token;
import com.vigil.compiler.ast.TokenList;
import com.vigil.compiler.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 符号数据库：作用域树、变量、函数，以及表达式图的语义标注
 *
 * <p>解析器在构建过程中登记作用域和符号，结束后调用 {@link #finish()} 完成
 * 作用域归属、函数解析、类型推导和表达式标识分配。</p>
 */
public final class SymbolDatabase {

    private final TokenList tokens;
    private final Scope globalScope;
    private final List<Scope> scopeList = new ArrayList<Scope>();
    /** 下标即 varId，0 号位空置 */
    private final List<Variable> variableList = new ArrayList<Variable>();
    private final Map<String, List<Function>> functions = new LinkedHashMap<String, List<Function>>();
    private final Map<String, Variable> implicitVariables = new HashMap<String, Variable>();
    private boolean finished;

    public SymbolDatabase(TokenList tokens) {
        this.tokens = tokens;
        this.globalScope = new Scope(Scope.ScopeType.GLOBAL, null, null);
        scopeList.add(globalScope);
        variableList.add(null);
    }

    public TokenList getTokenList() { return tokens; }
    public Scope getGlobalScope() { return globalScope; }
    public List<Scope> getScopeList() { return Collections.unmodifiableList(scopeList); }

    public void addScope(Scope scope) {
        scopeList.add(scope);
    }

    // ============ 变量 ============

    /**
     * 登记新变量并在作用域中定义；nameToken 获得 varId
     */
    public Variable newVariable(Token nameToken, ValueType type, Scope scope, Variable.Kind kind, int index) {
        String name = nameToken != null ? nameToken.getStr() : "";
        Variable var = new Variable(nameToken, name, variableList.size(), type, scope, kind, index);
        variableList.add(var);
        if (nameToken != null) {
            nameToken.setVariable(var);
            nameToken.setVarId(var.getDeclarationId());
            scope.define(var);
        }
        return var;
    }

    /** 未声明名字对应的隐式全局变量，同名共享一个 varId */
    public Variable implicitVariable(Token nameToken) {
        Variable var = implicitVariables.get(nameToken.getStr());
        if (var == null) {
            var = new Variable(nameToken, nameToken.getStr(), variableList.size(), null, globalScope,
                    Variable.Kind.GLOBAL, -1);
            var.setImplicit(true);
            variableList.add(var);
            implicitVariables.put(nameToken.getStr(), var);
        }
        nameToken.setVariable(var);
        nameToken.setVarId(var.getDeclarationId());
        return var;
    }

    public Variable getVariableFromVarId(int varId) {
        if (varId <= 0 || varId >= variableList.size()) return null;
        return variableList.get(varId);
    }

    public int getVariableCount() {
        return variableList.size() - 1;
    }

    // ============ 函数 ============

    public void addFunction(Function function) {
        List<Function> list = functions.get(function.getName());
        if (list == null) {
            list = new ArrayList<Function>();
            functions.put(function.getName(), list);
        }
        list.add(function);
    }

    /**
     * 按名字和实参个数查找，有函数体者优先；个数都不符时退回第一个同名函数
     */
    public Function findFunction(String name, int argc) {
        List<Function> list = functions.get(name);
        if (list == null || list.isEmpty()) return null;
        Function match = null;
        for (Function f : list) {
            if (f.argCount() == argc && (match == null || (!match.hasBody() && f.hasBody()))) {
                match = f;
            }
        }
        return match != null ? match : list.get(0);
    }

    public List<Function> getFunctions() {
        List<Function> all = new ArrayList<Function>();
        for (List<Function> list : functions.values()) {
            all.addAll(list);
        }
        return all;
    }

    // ============ 收尾 ============

    public void finish() {
        if (finished) return;
        finished = true;
        assignScopes();
        resolveFunctions();
        setValueTypes();
        createExpressionIds();
    }

    private void assignScopes() {
        Map<Token, Scope> byBodyStart = new IdentityHashMap<Token, Scope>();
        for (Scope scope : scopeList) {
            if (scope.getBodyStart() != null) {
                byBodyStart.put(scope.getBodyStart(), scope);
            }
        }
        Deque<Scope> stack = new ArrayDeque<Scope>();
        stack.push(globalScope);
        for (Token tok : tokens) {
            if (tok.is(TokenType.LBRACE)) {
                Scope inner = byBodyStart.get(tok);
                stack.push(inner != null ? inner : stack.peek());
                tok.setScope(stack.peek());
            } else if (tok.is(TokenType.RBRACE)) {
                tok.setScope(stack.peek());
                if (stack.size() > 1) stack.pop();
            } else {
                tok.setScope(stack.peek());
            }
        }
    }

    private void resolveFunctions() {
        for (Token tok : tokens) {
            Token name = AstUtils.getCallName(tok);
            if (name == null || name.getVariable() != null) continue;
            Function f = findFunction(name.getStr(), AstUtils.numberOfArguments(tok));
            if (f != null && !tok.getAstOperand1().isOneOf(TokenType.DOT, TokenType.ARROW)) {
                name.setFunction(f);
            }
        }
    }

    private void setValueTypes() {
        for (Token tok : tokens) {
            if (isAstRoot(tok)) {
                AstUtils.forEachPostOrder(tok, this::setValueType);
            }
        }
    }

    private void setValueType(Token tok) {
        if (tok.getValueType() != null || tok.isDeclSpecifier()) return;
        Token op1 = tok.getAstOperand1();
        Token op2 = tok.getAstOperand2();
        ValueType t1 = op1 != null ? op1.getValueType() : null;
        ValueType t2 = op2 != null ? op2.getValueType() : null;
        ValueType vt = null;
        if (tok.getVariable() != null) {
            vt = tok.getVariable().getValueType();
        } else if (tok.isComparisonOp() || tok.isLogicalOp()) {
            vt = ValueType.of(ValueType.Type.BOOL, ValueType.Sign.UNKNOWN);
        } else if (tok.isAssignmentOp() || tok.isIncDecOp()) {
            vt = t1;
        } else if (tok.is(TokenType.KW_SIZEOF)) {
            vt = ValueType.of(ValueType.Type.LONG, ValueType.Sign.UNSIGNED);
        } else if (op1 != null && op2 != null && (tok.isArithmeticalOp() || tok.isOneOf(TokenType.BIT_AND,
                TokenType.BIT_OR, TokenType.BIT_XOR))) {
            vt = tok.isOneOf(TokenType.SHL, TokenType.SHR) ? ValueType.promote(t1) : ValueType.arithmetic(t1, t2);
        } else if (op1 != null && op2 == null && tok.isOneOf(TokenType.MINUS, TokenType.PLUS, TokenType.BIT_NOT)) {
            vt = ValueType.promote(t1);
        } else if (op1 != null && op2 == null && tok.is(TokenType.MUL)) {
            vt = t1 != null && t1.getPointer() > 0 ? t1.withPointer(t1.getPointer() - 1) : null;
        } else if (op1 != null && op2 == null && tok.is(TokenType.BIT_AND)) {
            vt = t1 != null ? t1.withPointer(t1.getPointer() + 1) : null;
        } else if (tok.is(TokenType.QUESTION)) {
            vt = t2;
        } else if (tok.is(TokenType.COLON)) {
            vt = t1;
        } else if (tok.is(TokenType.COMMA)) {
            vt = t2;
        } else if (tok.is(TokenType.LBRACKET)) {
            vt = t1 != null && t1.getPointer() > 0 ? t1.withPointer(t1.getPointer() - 1) : null;
        } else if (tok.is(TokenType.LPAREN) && tok.isDirectInit()) {
            vt = t1;
        } else if (AstUtils.isFunctionCall(tok)) {
            Token name = AstUtils.getCallName(tok);
            if (name != null && name.getFunction() != null) {
                vt = name.getFunction().getReturnType();
            }
        }
        if (vt != null) {
            tok.setValueType(vt);
        }
    }

    /**
     * 表达式标识：变量取 varId；其余节点按 "运算符(左标识,右标识)" 结构共享，
     * 赋值、自增自减与函数调用各自唯一；控制结构节点为 0
     */
    private void createExpressionIds() {
        int[] nextId = {variableList.size()};
        Map<String, Integer> structural = new HashMap<String, Integer>();
        for (Token tok : tokens) {
            if (!isAstRoot(tok)) continue;
            AstUtils.forEachPostOrder(tok, t -> {
                if (t.getVarId() != 0) {
                    t.setExprId(t.getVarId());
                    return;
                }
                if (isControlNode(t)) {
                    t.setExprId(0);
                    return;
                }
                if (isUniqueNode(t)) {
                    t.setExprId(nextId[0]++);
                    return;
                }
                String key = t.getStr() + "(" + idOf(t.getAstOperand1()) + "," + idOf(t.getAstOperand2()) + ")"
                        + (t.isCast() ? "cast" : "") + (t.isPostfix() ? "post" : "");
                Integer id = structural.get(key);
                if (id == null) {
                    id = nextId[0]++;
                    structural.put(key, id);
                }
                t.setExprId(id);
            });
        }
    }

    private static String idOf(Token tok) {
        return tok == null ? "" : String.valueOf(tok.getExprId());
    }

    private static boolean isAstRoot(Token tok) {
        if (tok.getAstParent() != null || tok.isDeclSpecifier()) return false;
        return tok.getAstOperand1() != null || tok.getAstOperand2() != null || tok.getVarId() != 0
                || tok.isLiteral() || tok.is(TokenType.KW_NULLPTR);
    }

    private static boolean isControlNode(Token tok) {
        if (tok.isOneOf(TokenType.KW_IF, TokenType.KW_WHILE, TokenType.KW_FOR, TokenType.KW_RETURN)) return true;
        if (AstUtils.isControlParen(tok)) return true;
        Token parent = tok.getAstParent();
        if (tok.is(TokenType.SEMICOLON)) return true;
        return tok.is(TokenType.COLON) && AstUtils.isControlParen(parent);
    }

    private static boolean isUniqueNode(Token tok) {
        if (tok.isAssignmentOp() || tok.isIncDecOp() && tok.getAstOperand1() != null) return true;
        if (tok.is(TokenType.LPAREN) && tok.isDirectInit()) return true;
        if (AstUtils.isFunctionCall(tok)) {
            Token callee = tok.getAstOperand1();
            boolean memberCall = callee.isOneOf(TokenType.DOT, TokenType.ARROW);
            return !(memberCall && tok.getAstOperand2() == null);
        }
        return false;
    }
}
