package com.vigil.valueflow.memory;

import com.vigil.compiler.ast.Token;
import com.vigil.compiler.value.AbstractValue;
import com.vigil.compiler.value.Knowledge;
import com.vigil.compiler.value.ValueKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiPredicate;

/**
 * 程序状态：表达式标识到抽象值的映射
 *
 * <p>拷贝共享同一个底层表，首次写入时才复制（写时复制）。引用计数为原子量，
 * 不同线程可以各自持有从同一状态拷贝出来的句柄。丢弃的拷贝不会归还计数，因此每次拷贝
 * 至多让原状态多复制一次：复制后原状态独占新表，之后的写入不再复制。标识为 0 的表达式不会被记录。</p>
 */
public final class ProgramState implements Iterable<Map.Entry<ExprIdToken, AbstractValue>> {

    /** 共享的底层表 */
    private static final class Body {
        final LinkedHashMap<ExprIdToken, AbstractValue> values;
        final AtomicInteger refs = new AtomicInteger(1);

        Body(LinkedHashMap<ExprIdToken, AbstractValue> values) {
            this.values = values;
        }
    }

    private Body body;

    public ProgramState() {
        this.body = new Body(new LinkedHashMap<ExprIdToken, AbstractValue>());
    }

    /** 与 other 共享底层表的拷贝 */
    public ProgramState(ProgramState other) {
        this.body = other.body;
        this.body.refs.incrementAndGet();
    }

    public ProgramState copy() {
        return new ProgramState(this);
    }

    private LinkedHashMap<ExprIdToken, AbstractValue> writable() {
        if (body.refs.get() > 1) {
            Body old = body;
            body = new Body(new LinkedHashMap<ExprIdToken, AbstractValue>(old.values));
            old.refs.decrementAndGet();
        }
        return body.values;
    }

    private Map<ExprIdToken, AbstractValue> readable() {
        return body.values;
    }

    // ============ 写入 ============

    /**
     * 记录 expr 的值，并对 {@code a + c}、{@code c - a} 这类表达式反解出子表达式的值
     */
    public void setValue(Token expr, AbstractValue value) {
        if (expr == null) return;
        LinkedHashMap<ExprIdToken, AbstractValue> values = writable();
        if (expr.getExprId() != 0) {
            values.put(new ExprIdToken(expr), value);
        }
        ExprSolver.Solution solution = ExprSolver.solve(expr, value, this::knownIntOf);
        if (solution.expr != expr && solution.expr.getExprId() != 0) {
            values.put(new ExprIdToken(solution.expr), solution.value);
        }
    }

    private OptionalLong knownIntOf(Token tok) {
        AbstractValue annotated = tok.getKnownValue(ValueKind.INT);
        if (annotated != null) {
            return OptionalLong.of(annotated.getIntValue());
        }
        return getIntValue(tok.getExprId());
    }

    public void setIntValue(Token expr, long value, boolean impossible) {
        setValue(expr, impossible ? AbstractValue.impossible(value) : AbstractValue.known(value));
    }

    /** isEqual 为 false 时记录“大小不可能为 n” */
    public void setContainerSizeValue(Token expr, long size, boolean isEqual) {
        setValue(expr, AbstractValue.containerSize(size, isEqual ? Knowledge.KNOWN : Knowledge.IMPOSSIBLE));
    }

    /**
     * 标记为未知：已有条目保留但变为 UNINIT，没有条目时记录未知值
     */
    public void setUnknown(Token expr) {
        if (expr == null || expr.getExprId() == 0) return;
        LinkedHashMap<ExprIdToken, AbstractValue> values = writable();
        ExprIdToken key = new ExprIdToken(expr);
        AbstractValue old = values.get(key);
        values.put(key, old != null ? old.asUninit() : AbstractValue.unknown());
    }

    // ============ 读取 ============

    /**
     * @param impossible 是否接受 IMPOSSIBLE 值
     * @return 不存在（或为不接受的 IMPOSSIBLE 值）时返回 null
     */
    public AbstractValue getValue(int exprId, boolean impossible) {
        AbstractValue value = readable().get(ExprIdToken.of(exprId));
        if (value == null) return null;
        if (!impossible && value.isImpossible()) return null;
        return value;
    }

    public AbstractValue getValue(int exprId) {
        return getValue(exprId, false);
    }

    public OptionalLong getIntValue(int exprId) {
        AbstractValue value = getValue(exprId, false);
        if (value == null || !value.isIntValue()) return OptionalLong.empty();
        return OptionalLong.of(value.getIntValue());
    }

    public Optional<Token> getTokValue(int exprId) {
        AbstractValue value = getValue(exprId, false);
        if (value == null || !value.isTokValue()) return Optional.empty();
        return Optional.ofNullable(value.getTokValue());
    }

    public OptionalLong getContainerSizeValue(int exprId) {
        AbstractValue value = getValue(exprId, false);
        if (value == null || !value.isContainerSizeValue()) return OptionalLong.empty();
        return OptionalLong.of(value.getIntValue());
    }

    /**
     * 容器是否为空：大小为 0 时为 1，大小确定非零或不可能为 0 时为 0
     */
    public OptionalLong getContainerEmptyValue(int exprId) {
        AbstractValue value = getValue(exprId, true);
        if (value == null || !value.isContainerSizeValue()) return OptionalLong.empty();
        if (value.isImpossible()) {
            return value.getIntValue() == 0 ? OptionalLong.of(0) : OptionalLong.empty();
        }
        return OptionalLong.of(value.getIntValue() == 0 ? 1 : 0);
    }

    public boolean hasValue(int exprId) {
        return readable().containsKey(ExprIdToken.of(exprId));
    }

    /**
     * @throws NoSuchElementException 条目不存在
     */
    public AbstractValue at(int exprId) {
        AbstractValue value = readable().get(ExprIdToken.of(exprId));
        if (value == null) {
            throw new NoSuchElementException("No value for expression #" + exprId);
        }
        return value;
    }

    /** 标识对应的节点（记录时的那个），没有条目返回 null */
    public Token getToken(int exprId) {
        for (ExprIdToken key : readable().keySet()) {
            if (key.getExprId() == exprId) return key.getToken();
        }
        return null;
    }

    // ============ 批量操作 ============

    public void eraseIf(BiPredicate<ExprIdToken, AbstractValue> predicate) {
        List<ExprIdToken> doomed = new ArrayList<>();
        for (Map.Entry<ExprIdToken, AbstractValue> e : readable().entrySet()) {
            if (predicate.test(e.getKey(), e.getValue())) {
                doomed.add(e.getKey());
            }
        }
        if (doomed.isEmpty()) return;
        writable().keySet().removeAll(doomed);
    }

    /** 用 other 的条目覆盖本状态 */
    public void replace(ProgramState other) {
        if (other == this || other.isEmpty()) return;
        writable().putAll(other.readable());
    }

    /** 只加入本状态缺少的条目 */
    public void insert(ProgramState other) {
        if (other == this) return;
        LinkedHashMap<ExprIdToken, AbstractValue> values = null;
        for (Map.Entry<ExprIdToken, AbstractValue> e : other.readable().entrySet()) {
            if (readable().containsKey(e.getKey())) continue;
            if (values == null) values = writable();
            values.put(e.getKey(), e.getValue());
        }
    }

    public void swap(ProgramState other) {
        Body tmp = body;
        body = other.body;
        other.body = tmp;
    }

    public void clear() {
        if (isEmpty()) return;
        if (body.refs.get() > 1) {
            body.refs.decrementAndGet();
            body = new Body(new LinkedHashMap<ExprIdToken, AbstractValue>());
        } else {
            body.values.clear();
        }
    }

    public boolean isEmpty() {
        return readable().isEmpty();
    }

    public int size() {
        return readable().size();
    }

    /** 只读视图 */
    public Map<ExprIdToken, AbstractValue> entries() {
        return Collections.unmodifiableMap(readable());
    }

    @Override
    public Iterator<Map.Entry<ExprIdToken, AbstractValue>> iterator() {
        return entries().entrySet().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProgramState)) return false;
        ProgramState that = (ProgramState) o;
        return body == that.body || readable().equals(that.readable());
    }

    @Override
    public int hashCode() {
        return readable().hashCode();
    }

    @Override
    public String toString() {
        return readable().toString();
    }
}
