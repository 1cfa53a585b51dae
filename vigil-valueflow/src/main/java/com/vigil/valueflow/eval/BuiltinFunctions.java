package com.vigil.valueflow.eval;

import com.vigil.compiler.ast.Token;
import com.vigil.compiler.value.AbstractValue;
import com.vigil.compiler.value.Bound;
import com.vigil.compiler.value.Knowledge;
import org.apache.commons.math3.special.Erf;
import org.apache.commons.math3.special.Gamma;
import org.apache.commons.math3.util.FastMath;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * 内置函数：C 字符串函数与 math.h 函数
 *
 * <p>参数个数必须严格一致。数学函数的参数必须是 INT 或 FLOAT，结果为 FLOAT（ilogb 为 INT）；
 * 结果为 NaN（定义域错误）时返回 Unknown。任一参数为 IMPOSSIBLE 时结果同样未知。</p>
 */
public final class BuiltinFunctions {

    private BuiltinFunctions() {}

    /** 内置函数实现 */
    @FunctionalInterface
    public interface Builtin {
        AbstractValue apply(List<AbstractValue> args);
    }

    private static final Map<String, Builtin> FUNCTIONS = new HashMap<String, Builtin>();

    static {
        // ---- 字符串 ----
        register("strlen", args -> {
            if (args.size() != 1) return AbstractValue.unknown();
            String s = stringOf(args.get(0));
            if (s == null) return AbstractValue.unknown();
            return AbstractValue.ranged(s.length(), knowledgeOf(args), Bound.POINT);
        });
        register("strcmp", args -> {
            if (args.size() != 2) return AbstractValue.unknown();
            String a = stringOf(args.get(0));
            String b = stringOf(args.get(1));
            if (a == null || b == null) return AbstractValue.unknown();
            return intResult(Integer.signum(a.compareTo(b)), args);
        });
        register("strncmp", args -> {
            if (args.size() != 3) return AbstractValue.unknown();
            String a = stringOf(args.get(0));
            String b = stringOf(args.get(1));
            AbstractValue n = args.get(2);
            if (a == null || b == null || !n.isIntValue() || n.isImpossible() || n.getIntValue() < 0) {
                return AbstractValue.unknown();
            }
            int len = (int) Math.min(n.getIntValue(), Integer.MAX_VALUE);
            String pa = a.length() > len ? a.substring(0, len) : a;
            String pb = b.length() > len ? b.substring(0, len) : b;
            return intResult(Integer.signum(pa.compareTo(pb)), args);
        });

        // ---- 三角函数 ----
        unary("sin", Math::sin);
        unary("cos", Math::cos);
        unary("tan", Math::tan);
        unary("asin", Math::asin);
        unary("acos", Math::acos);
        unary("atan", Math::atan);
        binary("atan2", Math::atan2);

        // ---- 双参数 ----
        binary("remainder", Math::IEEEremainder);
        binary("nextafter", Math::nextAfter);
        binary("nexttoward", Math::nextAfter);
        binary("hypot", Math::hypot);
        binary("fdim", (x, y) -> Double.isNaN(x) || Double.isNaN(y) ? Double.NaN : x > y ? x - y : 0.0);
        binary("fmax", (x, y) -> Double.isNaN(x) ? y : Double.isNaN(y) ? x : Math.max(x, y));
        binary("fmin", (x, y) -> Double.isNaN(x) ? y : Double.isNaN(y) ? x : Math.min(x, y));
        binary("fmod", (x, y) -> x % y);
        binary("pow", Math::pow);
        binary("scalbln", (x, y) -> Math.scalb(x, (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, y))));
        binary("ldexp", (x, y) -> Math.scalb(x, (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, y))));

        register("ilogb", args -> {
            if (args.size() != 1 || !isNumber(args.get(0)) || args.get(0).isImpossible()) return AbstractValue.unknown();
            double x = args.get(0).asDouble();
            if (x == 0.0 || Double.isNaN(x) || Double.isInfinite(x)) return AbstractValue.unknown();
            return intResult(Math.getExponent(x), args);
        });

        // ---- 取整 / 指数 / 对数 ----
        unary("floor", Math::floor);
        unary("sqrt", Math::sqrt);
        unary("cbrt", Math::cbrt);
        unary("ceil", Math::ceil);
        unary("exp", Math::exp);
        unary("exp2", x -> Math.pow(2.0, x));
        unary("expm1", Math::expm1);
        unary("fabs", Math::abs);
        unary("log", Math::log);
        unary("log10", Math::log10);
        unary("log1p", Math::log1p);
        unary("log2", x -> FastMath.log(2.0, x));
        unary("logb", x -> x == 0.0 ? Double.NaN : Math.getExponent(x));
        unary("nearbyint", Math::rint);
        unary("round", x -> Math.signum(x) * Math.floor(Math.abs(x) + 0.5));
        unary("trunc", x -> x < 0 ? Math.ceil(x) : Math.floor(x));

        // ---- 双曲函数 ----
        unary("sinh", Math::sinh);
        unary("cosh", Math::cosh);
        unary("tanh", Math::tanh);
        unary("asinh", FastMath::asinh);
        unary("acosh", FastMath::acosh);
        unary("atanh", FastMath::atanh);

        // ---- 特殊函数 ----
        // logGamma 只定义在正数上，非正参数得到 NaN
        unary("lgamma", Gamma::logGamma);
        unary("tgamma", Gamma::gamma);
        unary("erf", Erf::erf);
        unary("erfc", Erf::erfc);
    }

    private static void register(String name, Builtin fn) {
        FUNCTIONS.put(name, fn);
    }

    private static void unary(String name, DoubleUnaryOperator fn) {
        register(name, args -> {
            if (args.size() != 1 || !allNumbers(args)) return AbstractValue.unknown();
            return floatResult(fn.applyAsDouble(args.get(0).asDouble()), args);
        });
    }

    private static void binary(String name, DoubleBinaryOperator fn) {
        register(name, args -> {
            if (args.size() != 2 || !allNumbers(args)) return AbstractValue.unknown();
            return floatResult(fn.applyAsDouble(args.get(0).asDouble(), args.get(1).asDouble()), args);
        });
    }

    public static Optional<Builtin> lookup(String name) {
        return Optional.ofNullable(FUNCTIONS.get(name));
    }

    public static boolean isBuiltin(String name) {
        return FUNCTIONS.containsKey(name);
    }

    public static Set<String> names() {
        return Collections.unmodifiableSet(FUNCTIONS.keySet());
    }

    // ============ 辅助 ============

    private static boolean isNumber(AbstractValue v) {
        return v.isIntValue() || v.isFloatValue();
    }

    private static boolean allNumbers(List<AbstractValue> args) {
        for (AbstractValue v : args) {
            if (!isNumber(v) || v.isImpossible()) return false;
        }
        return true;
    }

    /** 所有参数 KNOWN 时为 KNOWN，否则 POSSIBLE */
    private static Knowledge knowledgeOf(List<AbstractValue> args) {
        for (AbstractValue v : args) {
            if (!v.isKnown()) return Knowledge.POSSIBLE;
        }
        return Knowledge.KNOWN;
    }

    private static AbstractValue floatResult(double r, List<AbstractValue> args) {
        if (Double.isNaN(r)) return AbstractValue.unknown();
        return AbstractValue.ofFloat(r, knowledgeOf(args));
    }

    private static AbstractValue intResult(long r, List<AbstractValue> args) {
        return AbstractValue.ranged(r, knowledgeOf(args), Bound.POINT);
    }

    /** 指向字符串字面量的 TOK 值的内容 */
    private static String stringOf(AbstractValue v) {
        if (!v.isTokValue() || v.isImpossible()) return null;
        Token tok = v.getTokValue();
        return tok != null && tok.isString() ? tok.getStrValue() : null;
    }
}
