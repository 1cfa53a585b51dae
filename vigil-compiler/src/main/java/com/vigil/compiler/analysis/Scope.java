package com.vigil.compiler.analysis;

import com.vigil.compiler.ast.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 作用域
 *
 * <p>块作用域的 bodyStart/bodyEnd 为其 '{' 与 '}'，两者的 {@link Token#getScope()} 都是本作用域。</p>
 */
public final class Scope {

    public enum ScopeType {
        GLOBAL,         // 顶层
        FUNCTION,       // 函数体
        IF,
        ELSE,
        WHILE,
        DO,
        FOR,
        UNCONDITIONAL   // 匿名块
    }

    private final ScopeType type;
    private final Scope nestedIn;
    /** 引出本作用域的关键词（if/else/while/do/for）或函数名 */
    private final Token classDef;
    private final Map<String, Variable> variables = new LinkedHashMap<String, Variable>();
    private final List<Scope> nestedList = new ArrayList<Scope>();

    private Token bodyStart;
    private Token bodyEnd;
    /** 控制条件；ELSE 为对应 if 的条件，DO 为尾部 while 的条件 */
    private Token condition;
    private Function function;

    public Scope(ScopeType type, Scope nestedIn, Token classDef) {
        this.type = type;
        this.nestedIn = nestedIn;
        this.classDef = classDef;
        if (nestedIn != null) {
            nestedIn.nestedList.add(this);
        }
    }

    public ScopeType getType() { return type; }
    public Scope getNestedIn() { return nestedIn; }
    public Token getClassDef() { return classDef; }
    public List<Scope> getNestedList() { return Collections.unmodifiableList(nestedList); }

    public Token getBodyStart() { return bodyStart; }
    public Token getBodyEnd() { return bodyEnd; }

    public void setBody(Token bodyStart, Token bodyEnd) {
        this.bodyStart = bodyStart;
        this.bodyEnd = bodyEnd;
    }

    public Token getCondition() { return condition; }
    public void setCondition(Token condition) { this.condition = condition; }

    public Function getFunction() { return function; }
    public void setFunction(Function function) { this.function = function; }

    /** 函数内部的块作用域 */
    public boolean isLocal() {
        return type != ScopeType.GLOBAL && type != ScopeType.FUNCTION;
    }

    public boolean isLoopScope() {
        return type == ScopeType.WHILE || type == ScopeType.DO || type == ScopeType.FOR;
    }

    public boolean isExecutable() {
        return type != ScopeType.GLOBAL;
    }

    /** 最近的函数作用域 */
    public Scope getFunctionScope() {
        Scope s = this;
        while (s != null && s.type != ScopeType.FUNCTION) {
            s = s.nestedIn;
        }
        return s;
    }

    // ============ 变量 ============

    public void define(Variable var) {
        variables.put(var.getName(), var);
    }

    public List<Variable> getVariables() {
        return new ArrayList<Variable>(variables.values());
    }

    /** 从当前作用域向外查找 */
    public Variable findVariable(String name) {
        Variable v = variables.get(name);
        if (v != null) return v;
        if (nestedIn != null) return nestedIn.findVariable(name);
        return null;
    }

    /** 仅查找当前作用域 */
    public Variable findLocalVariable(String name) {
        return variables.get(name);
    }

    @Override
    public String toString() {
        return type.name().toLowerCase() + (classDef != null ? " " + classDef.getStr() : "")
                + (bodyStart != null ? " @" + bodyStart.getLine() : "");
    }
}
