package com.vigil.valueflow.eval;

import com.vigil.compiler.TranslationUnit;
import com.vigil.compiler.ast.Token;
import com.vigil.compiler.value.AbstractValue;
import com.vigil.compiler.value.Knowledge;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 内置函数测试
 */
class BuiltinFunctionsTest {

    private static AbstractValue call(String name, AbstractValue... args) {
        return BuiltinFunctions.lookup(name).get().apply(Arrays.asList(args));
    }

    private static AbstractValue f(double v) {
        return AbstractValue.ofFloat(v, Knowledge.KNOWN);
    }

    @Test
    @DisplayName("注册表")
    void testRegistry() {
        assertTrue(BuiltinFunctions.isBuiltin("sqrt"));
        assertFalse(BuiltinFunctions.isBuiltin("printf"));
        assertFalse(BuiltinFunctions.lookup("printf").isPresent());
        assertThat(BuiltinFunctions.names()).contains("strlen", "strcmp", "pow", "atan2",
                "lgamma", "tgamma", "erf", "erfc");
    }

    @Test
    @DisplayName("数学函数")
    void testMath() {
        assertEquals(3.0, call("sqrt", f(9.0)).getFloatValue(), 1e-12);
        assertEquals(8.0, call("pow", AbstractValue.known(2), AbstractValue.known(3)).getFloatValue(), 1e-12);
        assertEquals(-2.0, call("trunc", f(-2.7)).getFloatValue(), 1e-12);
        assertEquals(-3.0, call("round", f(-2.5)).getFloatValue(), 1e-12);
        assertEquals(2.0, call("fmax", f(Double.NaN), f(2.0)).getFloatValue(), 1e-12);
    }

    @Test
    @DisplayName("特殊函数与反双曲函数")
    void testSpecialFunctions() {
        assertEquals(24.0, call("tgamma", AbstractValue.known(5)).getFloatValue(), 1e-9);
        assertEquals(Math.log(24.0), call("lgamma", f(5.0)).getFloatValue(), 1e-9);
        assertEquals(0.0, call("erf", f(0.0)).getFloatValue(), 1e-12);
        assertEquals(1.0, call("erfc", f(0.0)).getFloatValue(), 1e-12);
        assertEquals(0.0, call("asinh", f(0.0)).getFloatValue(), 1e-12);
        assertEquals(0.0, call("acosh", f(1.0)).getFloatValue(), 1e-12);
        assertEquals(3.0, call("log2", f(8.0)).getFloatValue(), 1e-12);
        assertTrue(call("acosh", f(0.5)).isUninitValue());
        assertTrue(call("lgamma", f(-1.0)).isUninitValue());
    }

    @Test
    @DisplayName("NaN、参数个数错误与 IMPOSSIBLE 参数得到未知")
    void testUnknownResults() {
        assertTrue(call("sqrt", f(-1.0)).isUninitValue());
        assertTrue(call("sqrt", f(1.0), f(2.0)).isUninitValue());
        assertTrue(call("sqrt", AbstractValue.impossible(4)).isUninitValue());
        assertTrue(call("sqrt", AbstractValue.unknown()).isUninitValue());
    }

    @Test
    @DisplayName("POSSIBLE 参数得到 POSSIBLE 结果")
    void testPossible() {
        AbstractValue r = call("sqrt", AbstractValue.possible(4));
        assertTrue(r.isPossible());
        assertEquals(2.0, r.getFloatValue(), 1e-12);
    }

    @Test
    @DisplayName("字符串函数")
    void testStrings() {
        TranslationUnit tu = TranslationUnit.parse("void f() { a = \"abc\"; b = \"abd\"; }", "<test>");
        Token abc = tu.find("a =").tokAt(2);
        Token abd = tu.find("b =").tokAt(2);
        AbstractValue s1 = AbstractValue.ofTok(abc, Knowledge.KNOWN);
        AbstractValue s2 = AbstractValue.ofTok(abd, Knowledge.KNOWN);
        assertEquals(3, call("strlen", s1).getIntValue());
        assertEquals(-1, call("strcmp", s1, s2).getIntValue());
        assertEquals(0, call("strncmp", s1, s2, AbstractValue.known(2)).getIntValue());
        assertTrue(call("strlen", AbstractValue.known(3)).isUninitValue());
    }

    @Test
    @DisplayName("ilogb")
    void testIlogb() {
        AbstractValue r = call("ilogb", f(8.0));
        assertTrue(r.isIntValue());
        assertEquals(3, r.getIntValue());
        assertTrue(call("ilogb", f(0.0)).isUninitValue());
        List<AbstractValue> none = Collections.emptyList();
        assertTrue(BuiltinFunctions.lookup("ilogb").get().apply(none).isUninitValue());
    }
}
