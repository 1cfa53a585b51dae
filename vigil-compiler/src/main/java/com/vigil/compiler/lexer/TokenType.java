package com.vigil.compiler.lexer;

/**
 * 词法单元类型
 */
public enum TokenType {
    // 字面量
    INT_LITERAL,
    FLOAT_LITERAL,
    CHAR_LITERAL,
    STRING_LITERAL,

    // 标识符
    IDENTIFIER,

    // 控制流关键词
    KW_IF,
    KW_ELSE,
    KW_FOR,
    KW_WHILE,
    KW_DO,
    KW_RETURN,
    KW_BREAK,
    KW_CONTINUE,

    // 常量关键词
    KW_TRUE,
    KW_FALSE,
    KW_NULLPTR,

    // 修饰符
    KW_CONST,
    KW_STATIC,
    KW_EXTERN,
    KW_INLINE,
    KW_VOLATILE,
    KW_VIRTUAL,
    KW_UNSIGNED,
    KW_SIGNED,

    // 内置类型
    KW_VOID,
    KW_BOOL,
    KW_CHAR,
    KW_SHORT,
    KW_INT,
    KW_LONG,
    KW_FLOAT,
    KW_DOUBLE,
    KW_AUTO,

    // 类型操作
    KW_SIZEOF,
    KW_STATIC_CAST,
    KW_CONST_CAST,
    KW_REINTERPRET_CAST,
    KW_DYNAMIC_CAST,

    // 算术运算符
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    MOD,            // %
    INC,            // ++
    DEC,            // --

    // 比较运算符
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // 逻辑运算符
    AND,            // &&
    OR,             // ||
    NOT,            // !

    // 位运算符
    BIT_AND,        // &
    BIT_OR,         // |
    BIT_XOR,        // ^
    BIT_NOT,        // ~
    SHL,            // <<
    SHR,            // >>

    // 赋值运算符
    ASSIGN,         // =
    PLUS_ASSIGN,    // +=
    MINUS_ASSIGN,   // -=
    MUL_ASSIGN,     // *=
    DIV_ASSIGN,     // /=
    MOD_ASSIGN,     // %=
    AND_ASSIGN,     // &=
    OR_ASSIGN,      // |=
    XOR_ASSIGN,     // ^=
    SHL_ASSIGN,     // <<=
    SHR_ASSIGN,     // >>=

    // 其他运算符
    QUESTION,       // ?
    COLON,          // :
    DOUBLE_COLON,   // ::
    DOT,            // .
    ARROW,          // ->

    // 分隔符
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    COMMA,
    SEMICOLON,

    // 特殊
    EOF,
    ERROR;

    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    public boolean isLiteral() {
        return this == INT_LITERAL || this == FLOAT_LITERAL || this == CHAR_LITERAL
                || this == STRING_LITERAL || this == KW_TRUE || this == KW_FALSE;
    }

    /** 内置类型关键词及类型修饰符 */
    public boolean isTypeKeyword() {
        switch (this) {
            case KW_VOID: case KW_BOOL: case KW_CHAR: case KW_SHORT: case KW_INT:
            case KW_LONG: case KW_FLOAT: case KW_DOUBLE: case KW_AUTO:
            case KW_UNSIGNED: case KW_SIGNED:
                return true;
            default:
                return false;
        }
    }

    /** 可出现在声明说明符中的修饰符 */
    public boolean isQualifier() {
        switch (this) {
            case KW_CONST: case KW_STATIC: case KW_EXTERN: case KW_INLINE:
            case KW_VOLATILE: case KW_VIRTUAL:
                return true;
            default:
                return false;
        }
    }

    public boolean isCppCast() {
        return this == KW_STATIC_CAST || this == KW_CONST_CAST
                || this == KW_REINTERPRET_CAST || this == KW_DYNAMIC_CAST;
    }

    public boolean isAssignment() {
        switch (this) {
            case ASSIGN: case PLUS_ASSIGN: case MINUS_ASSIGN: case MUL_ASSIGN: case DIV_ASSIGN:
            case MOD_ASSIGN: case AND_ASSIGN: case OR_ASSIGN: case XOR_ASSIGN:
            case SHL_ASSIGN: case SHR_ASSIGN:
                return true;
            default:
                return false;
        }
    }

    public boolean isComparison() {
        return this == EQ || this == NE || this == LT || this == GT || this == LE || this == GE;
    }

    public boolean isArithmetic() {
        return this == PLUS || this == MINUS || this == MUL || this == DIV || this == MOD;
    }

    public boolean isBitwise() {
        return this == BIT_AND || this == BIT_OR || this == BIT_XOR || this == BIT_NOT
                || this == SHL || this == SHR;
    }

    public boolean isLogical() {
        return this == AND || this == OR || this == NOT;
    }

    public boolean isIncDec() {
        return this == INC || this == DEC;
    }
}
