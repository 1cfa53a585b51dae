package com.vigil.valueflow.library;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.vigil.compiler.analysis.ValueType;
import com.vigil.compiler.ast.Token;
import com.vigil.compiler.lexer.TokenType;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 从 JSON 定义加载的库模型
 *
 * <p>格式：</p>
 * <pre>
 * {
 *   "containers": {
 *     "types":   ["std::vector", ...],
 *     "yields":  {"size": "SIZE", ...},
 *     "actions": {"push_back": "PUSH", ...}
 *   },
 *   "functions": [
 *     {"name": "abs", "pure": true, "returnValue": "arg0 &lt; 0 ? -arg0 : arg0"}
 *   ]
 * }
 * </pre>
 *
 * <p>重复定义以后出现的为准，并记录警告。</p>
 */
public final class Library implements LibraryModel {

    private static final Logger LOG = Logger.getLogger(Library.class.getName());

    private static final Gson GSON = new Gson();

    public static final String STANDARD_RESOURCE = "/vigil/library/std.json";

    private final Set<String> containerTypes = new HashSet<String>();
    private final Map<String, YieldKind> yields = new HashMap<String, YieldKind>();
    private final Map<String, ContainerAction> actions = new HashMap<String, ContainerAction>();
    private final Map<String, FunctionDef> functions = new HashMap<String, FunctionDef>();

    /** 单个函数定义 */
    private static final class FunctionDef {
        final boolean pure;
        final String returnValue;

        FunctionDef(boolean pure, String returnValue) {
            this.pure = pure;
            this.returnValue = returnValue;
        }
    }

    private Library() {}

    /** 不含任何定义的库 */
    public static Library empty() {
        return new Library();
    }

    /**
     * @throws LibraryLoadException JSON 格式错误或含有未知的枚举名
     */
    public static Library load(Reader reader) {
        Library library = new Library();
        library.merge(reader, "<reader>");
        return library;
    }

    /**
     * 从 classpath 资源加载
     *
     * @throws LibraryLoadException 资源不存在或格式错误
     */
    public static Library loadResource(String path) {
        Library library = new Library();
        library.mergeResource(path);
        return library;
    }

    /** 标准库定义（懒加载，全局共享） */
    public static Library standard() {
        return StandardHolder.INSTANCE;
    }

    private static final class StandardHolder {
        static final Library INSTANCE = loadResource(STANDARD_RESOURCE);
    }

    /** 在当前库之上叠加另一个资源的定义 */
    public Library mergeResource(String path) {
        InputStream in = Library.class.getResourceAsStream(path);
        if (in == null) {
            throw new LibraryLoadException("Library resource not found: " + path);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            merge(reader, path);
        } catch (IOException e) {
            throw new LibraryLoadException("Cannot read library resource " + path, e);
        }
        return this;
    }

    private void merge(Reader reader, String source) {
        JsonObject root;
        try {
            root = GSON.fromJson(reader, JsonObject.class);
        } catch (JsonParseException | ClassCastException e) {
            throw new LibraryLoadException("Malformed library definition " + source + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new LibraryLoadException("Empty library definition " + source);
        }
        try {
            if (root.has("containers")) {
                readContainers(root.getAsJsonObject("containers"), source);
            }
            if (root.has("functions")) {
                readFunctions(root.getAsJsonArray("functions"), source);
            }
        } catch (ClassCastException | IllegalStateException | UnsupportedOperationException e) {
            throw new LibraryLoadException("Unexpected structure in library definition " + source, e);
        }
    }

    private void readContainers(JsonObject containers, String source) {
        if (containers.has("types")) {
            for (JsonElement e : containers.getAsJsonArray("types")) {
                containerTypes.add(e.getAsString());
            }
        }
        if (containers.has("yields")) {
            for (Map.Entry<String, JsonElement> e : containers.getAsJsonObject("yields").entrySet()) {
                YieldKind kind = enumValue(YieldKind.class, e.getValue().getAsString(), source);
                if (yields.put(e.getKey(), kind) != null) {
                    LOG.warning("Duplicate yield for '" + e.getKey() + "' in " + source);
                }
            }
        }
        if (containers.has("actions")) {
            for (Map.Entry<String, JsonElement> e : containers.getAsJsonObject("actions").entrySet()) {
                ContainerAction action = enumValue(ContainerAction.class, e.getValue().getAsString(), source);
                if (actions.put(e.getKey(), action) != null) {
                    LOG.warning("Duplicate action for '" + e.getKey() + "' in " + source);
                }
            }
        }
    }

    private void readFunctions(JsonArray array, String source) {
        for (JsonElement element : array) {
            JsonObject obj = element.getAsJsonObject();
            if (!obj.has("name")) {
                throw new LibraryLoadException("Function definition without name in " + source);
            }
            String name = obj.get("name").getAsString();
            boolean pure = obj.has("pure") && obj.get("pure").getAsBoolean();
            String returnValue = obj.has("returnValue") && !obj.get("returnValue").isJsonNull()
                    ? obj.get("returnValue").getAsString() : null;
            if (functions.put(name, new FunctionDef(pure, returnValue)) != null) {
                LOG.warning("Duplicate definition of function '" + name + "' in " + source + ", keeping the last one");
            }
        }
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String name, String source) {
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new LibraryLoadException("Unknown " + type.getSimpleName() + " '" + name + "' in " + source, e);
        }
    }

    // ============ LibraryModel ============

    @Override
    public boolean isPure(String functionName) {
        FunctionDef def = functions.get(functionName);
        return def != null && def.pure;
    }

    @Override
    public Optional<String> returnValueExpression(String functionName) {
        FunctionDef def = functions.get(functionName);
        return def == null ? Optional.<String>empty() : Optional.ofNullable(def.returnValue);
    }

    @Override
    public boolean isContainerType(String typeName) {
        return typeName != null && containerTypes.contains(typeName);
    }

    @Override
    public YieldKind containerYield(String member) {
        YieldKind kind = yields.get(member);
        return kind != null ? kind : YieldKind.NO_YIELD;
    }

    /** 容器上未登记、也没有产出的成员调用视为修改 */
    @Override
    public ContainerAction containerAction(String member) {
        ContainerAction action = actions.get(member);
        if (action != null) return action;
        return yields.containsKey(member) ? ContainerAction.NO_ACTION : ContainerAction.CHANGE;
    }

    @Override
    public boolean isContainer(Token tok) {
        if (tok == null) return false;
        ValueType vt = tok.getValueType();
        return vt != null && vt.getType() == ValueType.Type.RECORD && vt.getPointer() == 0
                && isContainerType(vt.getTypeName());
    }

    @Override
    public YieldKind functionYield(Token callParen) {
        Token member = memberOf(callParen);
        if (member == null) return YieldKind.NO_YIELD;
        return containerYield(member.getStr());
    }

    @Override
    public Token getContainerFromYield(Token callParen, YieldKind yield) {
        Token member = memberOf(callParen);
        if (member == null || containerYield(member.getStr()) != yield) return null;
        return callParen.getAstOperand1().getAstOperand1();
    }

    /** {@code c.member(...)} 中 c 为容器时返回 member */
    private Token memberOf(Token callParen) {
        if (callParen == null || !callParen.is(TokenType.LPAREN) || callParen.isCast()) return null;
        Token dot = callParen.getAstOperand1();
        if (dot == null || !dot.is(TokenType.DOT) || dot.getAstOperand2() == null) return null;
        return isContainer(dot.getAstOperand1()) ? dot.getAstOperand2() : null;
    }
}
