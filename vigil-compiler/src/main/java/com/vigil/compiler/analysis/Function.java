package com.vigil.compiler.analysis;

import com.vigil.compiler.ast.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数声明/定义
 */
public final class Function {

    private final String name;
    private final Token tokenDef;
    private final ValueType returnType;
    private final boolean virtual;
    private final List<Variable> arguments = new ArrayList<Variable>();
    private Scope functionScope;

    public Function(String name, Token tokenDef, ValueType returnType, boolean virtual) {
        this.name = name;
        this.tokenDef = tokenDef;
        this.returnType = returnType;
        this.virtual = virtual;
    }

    public String getName() { return name; }
    public Token getTokenDef() { return tokenDef; }
    public ValueType getReturnType() { return returnType; }
    public boolean isVirtual() { return virtual; }
    public List<Variable> getArguments() { return Collections.unmodifiableList(arguments); }
    public int argCount() { return arguments.size(); }

    public Scope getFunctionScope() { return functionScope; }
    public void setFunctionScope(Scope functionScope) { this.functionScope = functionScope; }

    public boolean hasBody() {
        return functionScope != null && functionScope.getBodyStart() != null;
    }

    public void addArgument(Variable var) {
        arguments.add(var);
    }

    /** 第 i 个形参，越界返回 null */
    public Variable getArgumentVar(int i) {
        if (i < 0 || i >= arguments.size()) return null;
        return arguments.get(i);
    }

    @Override
    public String toString() {
        return name + "/" + arguments.size();
    }
}
