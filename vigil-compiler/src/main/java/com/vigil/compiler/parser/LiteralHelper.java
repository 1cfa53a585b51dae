package com.vigil.compiler.parser;

import com.vigil.compiler.analysis.ValueType;
import com.vigil.compiler.ast.Token;
import com.vigil.compiler.lexer.TokenType;
import com.vigil.compiler.value.AbstractValue;
import com.vigil.compiler.value.Knowledge;

import java.math.BigInteger;
import java.util.OptionalLong;

/**
 * 字面量解析辅助类：数值解析、字面量类型与已知值标注
 */
class LiteralHelper {

    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    final Parser parser;

    LiteralHelper(Parser parser) {
        this.parser = parser;
    }

    /**
     * 给字面量节点设置类型和 KNOWN 值
     */
    void annotate(Token tok) {
        switch (tok.getType()) {
            case INT_LITERAL: {
                tok.setValueType(intLiteralType(tok.getStr()));
                OptionalLong v = parseInteger(tok.getStr());
                if (v.isPresent()) {
                    tok.addValue(AbstractValue.known(v.getAsLong()));
                }
                break;
            }
            case FLOAT_LITERAL: {
                String text = tok.getStr();
                boolean single = text.endsWith("f") || text.endsWith("F");
                tok.setValueType(ValueType.of(single ? ValueType.Type.FLOAT : ValueType.Type.DOUBLE,
                        ValueType.Sign.SIGNED));
                tok.addValue(AbstractValue.ofFloat(parseFloat(text), Knowledge.KNOWN));
                break;
            }
            case CHAR_LITERAL:
                tok.setValueType(ValueType.of(ValueType.Type.CHAR, ValueType.Sign.SIGNED));
                if (!tok.getStrValue().isEmpty()) {
                    tok.addValue(AbstractValue.known(tok.getStrValue().charAt(0)));
                }
                break;
            case STRING_LITERAL:
                tok.setValueType(new ValueType(ValueType.Type.CHAR, ValueType.Sign.SIGNED, 1, true, null));
                tok.addValue(AbstractValue.ofTok(tok, Knowledge.KNOWN));
                break;
            case KW_TRUE:
            case KW_FALSE:
                tok.setValueType(ValueType.of(ValueType.Type.BOOL, ValueType.Sign.UNKNOWN));
                tok.addValue(AbstractValue.known(tok.is(TokenType.KW_TRUE) ? 1 : 0));
                break;
            case KW_NULLPTR:
                tok.setValueType(new ValueType(ValueType.Type.VOID, ValueType.Sign.UNKNOWN, 1, false, null));
                tok.addValue(AbstractValue.known(0));
                break;
            default:
                break;
        }
    }

    /**
     * 解析整数字面量（十进制/十六进制/二进制/八进制，忽略 u/l 后缀）；超出 long 范围时为空
     */
    static OptionalLong parseInteger(String text) {
        String digits = stripIntegerSuffix(text);
        int radix = 10;
        if (digits.length() > 2 && (digits.startsWith("0x") || digits.startsWith("0X"))) {
            radix = 16;
            digits = digits.substring(2);
        } else if (digits.length() > 2 && (digits.startsWith("0b") || digits.startsWith("0B"))) {
            radix = 2;
            digits = digits.substring(2);
        } else if (digits.length() > 1 && digits.charAt(0) == '0') {
            radix = 8;
            digits = digits.substring(1);
        }
        try {
            BigInteger value = new BigInteger(digits, radix);
            if (value.compareTo(LONG_MAX) > 0) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(value.longValue());
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    static double parseFloat(String text) {
        String t = text;
        char last = t.charAt(t.length() - 1);
        if (last == 'f' || last == 'F' || last == 'l' || last == 'L') {
            t = t.substring(0, t.length() - 1);
        }
        return Double.parseDouble(t);
    }

    static ValueType intLiteralType(String text) {
        String suffix = text.substring(stripIntegerSuffix(text).length()).toLowerCase();
        boolean unsigned = suffix.contains("u");
        int longs = suffix.length() - (unsigned ? 1 : 0);
        ValueType.Type type = longs >= 2 ? ValueType.Type.LONGLONG
                : longs == 1 ? ValueType.Type.LONG : ValueType.Type.INT;
        if (type == ValueType.Type.INT) {
            OptionalLong v = parseInteger(text);
            if (!v.isPresent() || v.getAsLong() > Integer.MAX_VALUE) {
                type = ValueType.Type.LONG;
            }
        }
        return ValueType.of(type, unsigned ? ValueType.Sign.UNSIGNED : ValueType.Sign.SIGNED);
    }

    private static String stripIntegerSuffix(String text) {
        int end = text.length();
        while (end > 0 && "uUlL".indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        return text.substring(0, end);
    }
}
