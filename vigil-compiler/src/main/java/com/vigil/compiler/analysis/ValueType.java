package com.vigil.compiler.analysis;

/**
 * 表达式的静态类型
 */
public final class ValueType {

    public enum Sign {
        SIGNED,
        UNSIGNED,
        UNKNOWN
    }

    public enum Type {
        UNKNOWN,
        BOOL,
        CHAR,
        SHORT,
        INT,
        LONG,
        LONGLONG,
        FLOAT,
        DOUBLE,
        VOID,
        /** 类/结构体/容器等具名类型 */
        RECORD;

        /** 整数提升后的等级 */
        int rank() {
            switch (this) {
                case BOOL: return 1;
                case CHAR: return 2;
                case SHORT: return 3;
                case INT: return 4;
                case LONG: return 5;
                case LONGLONG: return 6;
                default: return 0;
            }
        }
    }

    private final Type type;
    private final Sign sign;
    private final int pointer;
    private final boolean constness;
    /** RECORD 的限定名，如 std::vector */
    private final String typeName;

    public ValueType(Type type, Sign sign, int pointer, boolean constness, String typeName) {
        this.type = type;
        this.sign = sign;
        this.pointer = pointer;
        this.constness = constness;
        this.typeName = typeName;
    }

    public static ValueType of(Type type, Sign sign) {
        return new ValueType(type, sign, 0, false, null);
    }

    public static ValueType record(String typeName) {
        return new ValueType(Type.RECORD, Sign.UNKNOWN, 0, false, typeName);
    }

    public Type getType() { return type; }
    public Sign getSign() { return sign; }
    public int getPointer() { return pointer; }
    public boolean isConst() { return constness; }
    public String getTypeName() { return typeName; }

    public boolean isIntegral() {
        return pointer == 0 && type.rank() > 0;
    }

    public boolean isFloat() {
        return pointer == 0 && (type == Type.FLOAT || type == Type.DOUBLE);
    }

    public boolean isUnsigned() {
        return isIntegral() && sign == Sign.UNSIGNED;
    }

    public boolean isRecord() {
        return pointer == 0 && type == Type.RECORD;
    }

    public ValueType withPointer(int newPointer) {
        return new ValueType(type, sign, newPointer, constness, typeName);
    }

    public ValueType withConst(boolean newConst) {
        return new ValueType(type, sign, pointer, newConst, typeName);
    }

    /**
     * 二元算术的结果类型（常规算术转换）
     */
    public static ValueType arithmetic(ValueType a, ValueType b) {
        if (a == null || b == null) return null;
        if (a.pointer > 0 && b.isIntegral()) return a.withConst(false);
        if (b.pointer > 0 && a.isIntegral()) return b.withConst(false);
        if (a.isFloat() || b.isFloat()) {
            boolean isDouble = a.type == Type.DOUBLE || b.type == Type.DOUBLE;
            return of(isDouble ? Type.DOUBLE : Type.FLOAT, Sign.SIGNED);
        }
        if (!a.isIntegral() || !b.isIntegral()) return null;
        Type t = a.type.rank() >= b.type.rank() ? a.type : b.type;
        if (t.rank() < Type.INT.rank()) t = Type.INT;
        boolean unsigned = (a.isUnsigned() && a.type.rank() >= Type.INT.rank())
                || (b.isUnsigned() && b.type.rank() >= Type.INT.rank());
        return of(t, unsigned ? Sign.UNSIGNED : Sign.SIGNED);
    }

    /** 一元算术的整数提升 */
    public static ValueType promote(ValueType a) {
        if (a == null || !a.isIntegral()) return a;
        if (a.type.rank() < Type.INT.rank()) return of(Type.INT, Sign.SIGNED);
        return a.withConst(false);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (constness) sb.append("const ");
        if (sign == Sign.UNSIGNED) sb.append("unsigned ");
        sb.append(type == Type.RECORD ? typeName : type.name().toLowerCase());
        for (int i = 0; i < pointer; i++) sb.append('*');
        return sb.toString();
    }
}
