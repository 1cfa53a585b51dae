package com.vigil.valueflow.state;

import com.vigil.compiler.TranslationUnit;
import com.vigil.compiler.ast.Token;
import com.vigil.compiler.value.AbstractValue;
import com.vigil.compiler.value.Bound;
import com.vigil.valueflow.eval.ExpressionEvaluator;
import com.vigil.valueflow.memory.ExprIdToken;
import com.vigil.valueflow.memory.ProgramState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 初始状态构造测试
 */
class ProgramStateBuilderTest {

    private final ExpressionEvaluator evaluator = ExpressionEvaluator.standard();
    private final ProgramStateBuilder builder = evaluator.stateBuilder();

    private static TranslationUnit parse(String source) {
        return TranslationUnit.parse(source, "<test>");
    }

    @Nested
    @DisplayName("条件")
    class ConditionTests {

        @Test
        @DisplayName("进入 if 块：n > 0 成立但 n 的值不确定")
        void testIfBlock() {
            TranslationUnit tu = parse("void f(int n) { if (n > 0) { y = n; } }");
            Token cond = tu.find("n > 0").getNext();
            ProgramState pm = new ProgramState();
            builder.fillFromConditions(pm, tu.find("y = n"));
            Token n = tu.find("n > 0");
            AbstractValue v = pm.at(n.getExprId());
            assertTrue(v.isPossible());
            assertEquals(1, v.getIntValue());
            assertEquals(Bound.LOWER, v.getBound());
            assertFalse(pm.getValue(n.getExprId()).isKnown());
            assertTrue(builder.conditionIsTrue(cond, pm));
        }

        @Test
        @DisplayName("n >= 0 的范围含 0，n 用作条件时不确定")
        void testRangeContainingZero() {
            TranslationUnit tu = parse("void f(int n) { if (n >= 0) { y = n ? 1 : 2; } }");
            ProgramState pm = new ProgramState();
            builder.fillFromConditions(pm, tu.find("y ="));
            AbstractValue n = pm.at(tu.find("n >=").getExprId());
            assertEquals(0, n.getIntValue());
            assertEquals(Bound.LOWER, n.getBound());
            assertTrue(evaluator.evaluate(tu.find("?"), pm).isUninitValue());
        }

        @Test
        @DisplayName("n <= 5 时 !n 不确定")
        void testNotOnUpperRange() {
            TranslationUnit tu = parse("void f(int n) { if (n <= 5) { y = !n; } }");
            ProgramState pm = new ProgramState();
            builder.fillFromConditions(pm, tu.find("y ="));
            assertTrue(evaluator.evaluate(tu.find("! n"), pm).isUninitValue());
        }

        @Test
        @DisplayName("n > 0 的范围不含 0，n 用作条件时为真")
        void testRangeExcludingZero() {
            TranslationUnit tu = parse("void f(int n) { if (n > 0) { y = n ? 1 : 2; } }");
            ProgramState pm = new ProgramState();
            builder.fillFromConditions(pm, tu.find("y ="));
            assertEquals(AbstractValue.known(1), evaluator.evaluate(tu.find("?"), pm));
        }

        @Test
        @DisplayName("进入 else 块：条件不成立")
        void testElseBlock() {
            TranslationUnit tu = parse("void f(int n) { if (n > 0) { } else { y = n; } }");
            Token cond = tu.find("n > 0").getNext();
            ProgramState pm = new ProgramState();
            builder.fillFromConditions(pm, tu.find("y = n"));
            assertTrue(builder.conditionIsFalse(cond, pm));
        }

        @Test
        @DisplayName("函数体顶层没有条件")
        void testFunctionScope() {
            TranslationUnit tu = parse("void f(int n) { y = n; }");
            ProgramState pm = new ProgramState();
            builder.fillFromConditions(pm, tu.find("y = n"));
            assertTrue(pm.isEmpty());
        }

        @Test
        @DisplayName("== 为真记 POSSIBLE，为假记 IMPOSSIBLE")
        void testEquality() {
            TranslationUnit tu = parse("void f(int n) { if (n == 3) { } }");
            Token cond = tu.find("n == 3").getNext();
            Token n = tu.find("n == 3");
            ProgramState then = new ProgramState();
            builder.parseCondition(then, cond, null, true);
            assertEquals(AbstractValue.possible(3), then.at(n.getExprId()));
            ProgramState otherwise = new ProgramState();
            builder.parseCondition(otherwise, cond, null, false);
            assertTrue(otherwise.at(n.getExprId()).isImpossible());
            assertTrue(builder.conditionIsFalse(cond, otherwise));
        }

        @Test
        @DisplayName("常量在左侧")
        void testConstantOnLeft() {
            TranslationUnit tu = parse("void f(int n) { if (10 < n) { } }");
            Token cond = tu.find("<");
            Token n = tu.find("n )");
            ProgramState pm = new ProgramState();
            builder.parseCondition(pm, cond, null, true);
            AbstractValue v = pm.at(n.getExprId());
            assertEquals(11, v.getIntValue());
            assertEquals(Bound.LOWER, v.getBound());
        }

        @Test
        @DisplayName("&& 为真时两侧都成立，! 取反")
        void testLogical() {
            TranslationUnit tu = parse("void f(int a, int b) { if (a > 1 && !(b < 2)) { } }");
            Token and = tu.find("&&");
            ProgramState pm = new ProgramState();
            builder.parseCondition(pm, and, null, true);
            assertTrue(builder.conditionIsTrue(tu.find("a > 1").getNext(), pm));
            assertTrue(builder.conditionIsFalse(tu.find("b < 2").getNext(), pm));
        }

        @Test
        @DisplayName("单独的变量作为条件")
        void testPlainVariable() {
            TranslationUnit tu = parse("void f(int p) { if (p) { } }");
            Token p = tu.findLast("p )");
            ProgramState pm = new ProgramState();
            builder.parseCondition(pm, p, null, true);
            assertTrue(pm.at(p.getExprId()).isImpossible());
            assertEquals(0, pm.at(p.getExprId()).getIntValue());
            builder.parseCondition(pm, p, null, false);
            assertEquals(OptionalLong.of(0), pm.getIntValue(p.getExprId()));
        }

        @Test
        @DisplayName("容器 empty() 条件")
        void testEmptyCondition() {
            TranslationUnit tu = parse("void f(std::vector<int> v) { if (v.empty()) { } }");
            Token call = tu.find("empty (").getNext();
            Token v = tu.find("v . empty");
            ProgramState pm = new ProgramState();
            builder.parseCondition(pm, call, null, true);
            assertEquals(OptionalLong.of(0), pm.getContainerSizeValue(v.getExprId()));
        }

        @Test
        @DisplayName("容器 size() 比较同时记录容器大小")
        void testSizeCondition() {
            TranslationUnit tu = parse("void f(std::vector<int> v) { if (v.size() > 2) { } }");
            Token cond = tu.find(">");
            Token v = tu.find("v . size");
            ProgramState pm = new ProgramState();
            builder.parseCondition(pm, cond, null, true);
            AbstractValue size = pm.at(v.getExprId());
            assertTrue(size.isContainerSizeValue());
            assertEquals(3, size.getIntValue());
            assertEquals(Bound.LOWER, size.getBound());
        }

        @Test
        @DisplayName("条件之后被修改的表达式不记录")
        void testChangedBeforeEnd() {
            TranslationUnit tu = parse("void f(int n) { if (n > 0) { n = 5; y = n; } }");
            Token cond = tu.find("n > 0").getNext();
            ProgramState pm = new ProgramState();
            builder.parseCondition(pm, cond, tu.find("y = n"), true);
            assertTrue(pm.isEmpty());
        }
    }

    @Nested
    @DisplayName("赋值")
    class AssignmentTests {

        @Test
        @DisplayName("向前回溯收集赋值")
        void testStraightLine() {
            TranslationUnit tu = parse("void f() { int x = 5; int y = x + 3; z = y; }");
            Token x = tu.find("x + 3");
            Token y = tu.find("y ;");
            ProgramState pm = new ProgramState();
            builder.fillFromAssignments(pm, tu.find("z ="), pm.copy(),
                    Collections.<ExprIdToken, AbstractValue>emptyMap());
            assertEquals(OptionalLong.of(5), pm.getIntValue(x.getExprId()));
            assertTrue(pm.hasValue(y.getExprId()));
        }

        @Test
        @DisplayName("条件确定为真的块继续回溯")
        void testTrueBranch() {
            TranslationUnit tu = parse("void f() { int x = 1; if (1) { x = 2; } y = x; }");
            ProgramState pm = new ProgramState();
            builder.fillFromAssignments(pm, tu.find("y = x"), pm.copy(),
                    Collections.<ExprIdToken, AbstractValue>emptyMap());
            assertEquals(OptionalLong.of(2), pm.getIntValue(tu.find("x = 2").getExprId()));
        }

        @Test
        @DisplayName("条件无法确定的块停止回溯")
        void testUnknownBranch() {
            TranslationUnit tu = parse("void f(int a) { int x = 1; if (a) { x = 2; } y = x; }");
            ProgramState pm = new ProgramState();
            builder.fillFromAssignments(pm, tu.find("y = x"), pm.copy(),
                    Collections.<ExprIdToken, AbstractValue>emptyMap());
            assertFalse(pm.hasValue(tu.find("x = 2").getExprId()));
        }

        @Test
        @DisplayName("绑定优先于赋值右值")
        void testBindings() {
            TranslationUnit tu = parse("void f() { int x = 1; y = x; }");
            Token x = tu.find("x = 1");
            ProgramState pm = new ProgramState();
            builder.fillFromAssignments(pm, tu.find("y = x"), pm.copy(),
                    Collections.singletonMap(new ExprIdToken(x), AbstractValue.known(9)));
            assertEquals(OptionalLong.of(9), pm.getIntValue(x.getExprId()));
        }

        @Test
        @DisplayName("以来源点为锚的初始状态")
        void testInitialState() {
            TranslationUnit tu = parse("void f(int x) { a = 0; x = 1; b = x; }");
            Token x = tu.find("x = 1");
            Token b = tu.find("b = x");
            ProgramState atB = builder.getInitialProgramState(b, b);
            assertEquals(OptionalLong.of(1), atB.getIntValue(x.getExprId()));
            ProgramState fromA = builder.getInitialProgramState(b, tu.find("a = 0"));
            assertFalse(fromA.hasValue(x.getExprId()));
            assertTrue(builder.getInitialProgramState(b, null).isEmpty());
        }

        @Test
        @DisplayName("某表达式取给定值时的状态")
        void testProgramMemory() {
            TranslationUnit tu = parse("void f(int n) { if (n > 0) { m = n * 2; r = m; } }");
            Token n = tu.find("n *");
            Token m = tu.find("m =");
            ProgramState pm = builder.getProgramMemory(tu.find("r = m"), n, AbstractValue.known(3));
            assertEquals(OptionalLong.of(3), pm.getIntValue(n.getExprId()));
            assertEquals(OptionalLong.of(6), pm.getIntValue(m.getExprId()));
        }

        @Test
        @DisplayName("删除区间内被修改的条目")
        void testRemoveModifiedVars() {
            TranslationUnit tu = parse("void f(int x, int y) { a = 0; x = 1; b = 0; }");
            Token x = tu.find("x = 1");
            Token y = tu.find("y )");
            ProgramState pm = new ProgramState();
            pm.setIntValue(x, 7, false);
            pm.setIntValue(y, 8, false);
            builder.removeModifiedVars(pm, tu.find("b ="), tu.find("a ="));
            assertFalse(pm.hasValue(x.getExprId()));
            assertTrue(pm.hasValue(y.getExprId()));
        }
    }
}
