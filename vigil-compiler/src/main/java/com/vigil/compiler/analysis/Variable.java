package com.vigil.compiler.analysis;

import com.vigil.compiler.ast.Token;

/**
 * 变量声明
 */
public final class Variable {

    public enum Kind {
        ARGUMENT,
        LOCAL,
        GLOBAL,
        STATIC
    }

    private final Token nameToken;
    private final String name;
    private final int declarationId;
    private final ValueType valueType;
    private final Scope scope;
    private final Kind kind;
    /** 参数下标，非参数为 -1 */
    private final int index;

    private boolean reference;
    private boolean array;
    /** 未声明即使用的名字，按全局变量处理 */
    private boolean implicit;

    public Variable(Token nameToken, String name, int declarationId, ValueType valueType,
                    Scope scope, Kind kind, int index) {
        this.nameToken = nameToken;
        this.name = name;
        this.declarationId = declarationId;
        this.valueType = valueType;
        this.scope = scope;
        this.kind = kind;
        this.index = index;
    }

    public Token getNameToken() { return nameToken; }
    public String getName() { return name; }
    public int getDeclarationId() { return declarationId; }
    public ValueType getValueType() { return valueType; }
    public Scope getScope() { return scope; }
    public Kind getKind() { return kind; }
    public int getIndex() { return index; }

    public boolean isArgument() { return kind == Kind.ARGUMENT; }
    public boolean isLocal() { return kind == Kind.LOCAL; }
    public boolean isGlobal() { return kind == Kind.GLOBAL; }
    public boolean isStatic() { return kind == Kind.STATIC; }

    public boolean isReference() { return reference; }
    public void setReference(boolean reference) { this.reference = reference; }

    public boolean isArray() { return array; }
    public void setArray(boolean array) { this.array = array; }

    public boolean isImplicit() { return implicit; }
    public void setImplicit(boolean implicit) { this.implicit = implicit; }

    public boolean isPointer() {
        return valueType != null && valueType.getPointer() > 0;
    }

    public boolean isConst() {
        return valueType != null && valueType.isConst();
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " " + (valueType != null ? valueType + " " : "") + name;
    }
}
