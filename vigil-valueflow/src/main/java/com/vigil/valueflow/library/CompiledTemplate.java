package com.vigil.valueflow.library;

import com.vigil.compiler.TranslationUnit;
import com.vigil.compiler.ast.Token;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 编译后的返回值模板：表达式图与 argN 占位符
 *
 * <p>构造后不再修改，可在查询间共享。</p>
 */
public final class CompiledTemplate {

    private static final Pattern ARG = Pattern.compile("arg(\\d+)");

    private final String source;
    private final Token expression;
    private final Map<Integer, Token> arguments;

    private CompiledTemplate(String source, Token expression, Map<Integer, Token> arguments) {
        this.source = source;
        this.expression = expression;
        this.arguments = arguments;
    }

    /** 无法解析的模板 */
    static CompiledTemplate invalid(String source) {
        return new CompiledTemplate(source, null, Collections.<Integer, Token>emptyMap());
    }

    /**
     * @param unit {@code return <模板>;} 的翻译单元
     */
    static CompiledTemplate of(String source, TranslationUnit unit) {
        Token ret = unit.getTokenList().front();
        Token expression = ret != null ? ret.getAstOperand1() : null;
        if (expression == null) {
            return invalid(source);
        }
        Map<Integer, Token> arguments = new HashMap<Integer, Token>();
        for (Token tok : unit.getTokenList()) {
            if (tok.getVariable() == null || !tok.getVariable().isImplicit()) continue;
            Matcher m = ARG.matcher(tok.getStr());
            if (m.matches()) {
                arguments.putIfAbsent(Integer.parseInt(m.group(1)), tok);
            }
        }
        return new CompiledTemplate(source, expression, Collections.unmodifiableMap(arguments));
    }

    public boolean isValid() {
        return expression != null;
    }

    /** 模板表达式的根节点 */
    public Token getExpression() { return expression; }

    /** 第 index 个参数（从 0 开始）的占位节点，模板未使用时返回 null */
    public Token getArgument(int index) {
        return arguments.get(index);
    }

    public int getArgumentCount() {
        int max = -1;
        for (int i : arguments.keySet()) {
            max = Math.max(max, i);
        }
        return max + 1;
    }

    @Override
    public String toString() {
        return source;
    }
}
