package com.vigil.compiler.ast;

import com.vigil.compiler.analysis.Function;
import com.vigil.compiler.analysis.Scope;
import com.vigil.compiler.analysis.ValueType;
import com.vigil.compiler.analysis.Variable;
import com.vigil.compiler.lexer.TokenType;
import com.vigil.compiler.value.AbstractValue;
import com.vigil.compiler.value.ValueKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 表达式图节点
 *
 * <p>同一个对象既是词法单元（next/previous/link 链），也是 AST 节点（astOperand1/2、astParent）。
 * 所有节点由 {@link TokenList} 统一持有，{@link #getIndex()} 为其在列表中的稠密下标。</p>
 */
public final class Token {

    private final TokenType type;
    private final String str;
    /** 字符串/字符字面量的反转义内容 */
    private final String strValue;
    private final int line;
    private final int column;

    private int index;
    private Token next;
    private Token previous;
    private Token link;

    private Token astOperand1;
    private Token astOperand2;
    private Token astParent;

    private Scope scope;
    private Variable variable;
    private Function function;
    private ValueType valueType;
    private int varId;
    private int exprId;

    private boolean cast;
    private boolean postfix;
    private boolean directInit;
    private boolean declSpecifier;

    private final List<AbstractValue> values = new ArrayList<AbstractValue>(1);

    public Token(TokenType type, String str, String strValue, int line, int column) {
        this.type = type;
        this.str = str;
        this.strValue = strValue;
        this.line = line;
        this.column = column;
    }

    public Token(TokenType type, String str, int line, int column) {
        this(type, str, null, line, column);
    }

    // ============ 基本属性 ============

    public TokenType getType() { return type; }
    public String getStr() { return str; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public int getIndex() { return index; }

    /** 字面量内容；非字符串/字符字面量时为原文 */
    public String getStrValue() {
        return strValue != null ? strValue : str;
    }

    public boolean is(TokenType t) {
        return type == t;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (type == t) return true;
        }
        return false;
    }

    public boolean isName() {
        return type == TokenType.IDENTIFIER || type.isKeyword();
    }

    public boolean isKeyword() { return type.isKeyword(); }
    public boolean isNumber() { return type == TokenType.INT_LITERAL || type == TokenType.FLOAT_LITERAL; }
    public boolean isString() { return type == TokenType.STRING_LITERAL; }
    public boolean isCharLiteral() { return type == TokenType.CHAR_LITERAL; }
    public boolean isBoolean() { return type == TokenType.KW_TRUE || type == TokenType.KW_FALSE; }
    public boolean isLiteral() { return type.isLiteral(); }

    public boolean isAssignmentOp() { return type.isAssignment(); }
    public boolean isComparisonOp() { return type.isComparison(); }
    public boolean isIncDecOp() { return type.isIncDec(); }
    public boolean isLogicalOp() { return type.isLogical(); }

    /** 算术运算符（含二元位运算与移位），与一元形式无关 */
    public boolean isArithmeticalOp() {
        return type.isArithmetic() || type == TokenType.SHL || type == TokenType.SHR;
    }

    /** 不改变操作数的运算符：算术、位、比较、逻辑 */
    public boolean isConstOp() {
        return type.isArithmetic() || type.isBitwise() || type.isComparison() || type.isLogical();
    }

    /** 任意运算符（常量运算符、赋值、自增自减） */
    public boolean isOp() {
        return isConstOp() || isAssignmentOp() || isIncDecOp();
    }

    public boolean isBinaryOp() {
        return astOperand1 != null && astOperand2 != null;
    }

    public boolean isUnaryOp(String op) {
        return astOperand1 != null && astOperand2 == null && str.equals(op);
    }

    // ============ 链接 ============

    public Token getNext() { return next; }
    public Token getPrevious() { return previous; }
    public Token getLink() { return link; }

    void setIndex(int index) { this.index = index; }
    void setNext(Token next) { this.next = next; }
    void setPrevious(Token previous) { this.previous = previous; }
    void setLink(Token link) { this.link = link; }

    /** 相对偏移处的节点，越界返回 null */
    public Token tokAt(int offset) {
        Token tok = this;
        while (offset > 0 && tok != null) {
            tok = tok.next;
            offset--;
        }
        while (offset < 0 && tok != null) {
            tok = tok.previous;
            offset++;
        }
        return tok;
    }

    public String strAt(int offset) {
        Token tok = tokAt(offset);
        return tok != null ? tok.str : "";
    }

    public Token linkAt(int offset) {
        Token tok = tokAt(offset);
        return tok != null ? tok.link : null;
    }

    // ============ AST ============

    public Token getAstOperand1() { return astOperand1; }
    public Token getAstOperand2() { return astOperand2; }
    public Token getAstParent() { return astParent; }

    public void setAstOperand1(Token operand) {
        if (astOperand1 != null && astOperand1.astParent == this) {
            astOperand1.astParent = null;
        }
        astOperand1 = operand;
        if (operand != null) {
            operand.astParent = this;
        }
    }

    public void setAstOperand2(Token operand) {
        if (astOperand2 != null && astOperand2.astParent == this) {
            astOperand2.astParent = null;
        }
        astOperand2 = operand;
        if (operand != null) {
            operand.astParent = this;
        }
    }

    /** AST 根节点 */
    public Token astTop() {
        Token tok = this;
        while (tok.astParent != null) {
            tok = tok.astParent;
        }
        return tok;
    }

    // ============ 语义信息 ============

    public Scope getScope() { return scope; }
    public void setScope(Scope scope) { this.scope = scope; }

    public Variable getVariable() { return variable; }
    public void setVariable(Variable variable) { this.variable = variable; }

    public Function getFunction() { return function; }
    public void setFunction(Function function) { this.function = function; }

    public ValueType getValueType() { return valueType; }
    public void setValueType(ValueType valueType) { this.valueType = valueType; }

    public int getVarId() { return varId; }
    public void setVarId(int varId) { this.varId = varId; }

    /** 表达式标识，0 表示没有稳定标识 */
    public int getExprId() { return exprId; }
    public void setExprId(int exprId) { this.exprId = exprId; }

    public boolean isCast() { return cast; }
    public void setCast(boolean cast) { this.cast = cast; }

    public boolean isPostfix() { return postfix; }
    public void setPostfix(boolean postfix) { this.postfix = postfix; }

    /** 直接初始化 {@code int x(5)} 中的括号 */
    public boolean isDirectInit() { return directInit; }
    public void setDirectInit(boolean directInit) { this.directInit = directInit; }

    /** 声明说明符/类型名中的 token，不参与表达式 */
    public boolean isDeclSpecifier() { return declSpecifier; }
    public void setDeclSpecifier(boolean declSpecifier) { this.declSpecifier = declSpecifier; }

    // ============ 值标注 ============

    public List<AbstractValue> getValues() {
        return Collections.unmodifiableList(values);
    }

    public void addValue(AbstractValue value) {
        values.add(value);
    }

    public void clearValues() {
        values.clear();
    }

    public boolean hasKnownIntValue() {
        return getKnownValue(ValueKind.INT) != null;
    }

    public boolean hasKnownValue() {
        for (AbstractValue v : values) {
            if (v.isKnown()) return true;
        }
        return false;
    }

    /** 指定种类的 KNOWN 标注值，不存在返回 null */
    public AbstractValue getKnownValue(ValueKind kind) {
        for (AbstractValue v : values) {
            if (v.isKnown() && v.getKind() == kind) return v;
        }
        return null;
    }

    // ============ 模式匹配 ============

    /**
     * 简单模式匹配：以空格分隔的若干项依次匹配后续 token，
     * 每项可用 {@code |} 给出候选，{@code %name%} 匹配任意名字，{@code %var%} 匹配变量，
     * {@code %num%} 匹配数字，{@code %op%} 匹配运算符，{@code %oror%} 与 {@code %or%}
     * 分别匹配 {@code ||} 与 {@code |}
     */
    public static boolean match(Token tok, String pattern) {
        if (tok == null) return false;
        String[] parts = pattern.split(" ");
        Token t = tok;
        for (String part : parts) {
            if (t == null || !matchPart(t, part)) return false;
            t = t.next;
        }
        return true;
    }

    private static boolean matchPart(Token tok, String part) {
        for (String alt : part.split("\\|", -1)) {
            switch (alt) {
                case "%name%":
                    if (tok.isName()) return true;
                    break;
                case "%var%":
                    if (tok.varId != 0) return true;
                    break;
                case "%num%":
                    if (tok.isNumber()) return true;
                    break;
                case "%op%":
                    if (tok.isOp()) return true;
                    break;
                case "%oror%":
                    if (tok.type == TokenType.OR) return true;
                    break;
                case "%or%":
                    if (tok.type == TokenType.BIT_OR) return true;
                    break;
                default:
                    if (alt.equals(tok.str)) return true;
                    break;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return String.format("%s at %d:%d", str, line, column);
    }
}
