package com.vigil.valueflow.memory;

import com.vigil.compiler.TranslationUnit;
import com.vigil.compiler.ast.Token;
import com.vigil.compiler.value.AbstractValue;
import com.vigil.compiler.value.Knowledge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ProgramState 测试
 */
class ProgramStateTest {

    private Token x;
    private Token y;
    private Token plus;
    private Token v;

    @BeforeEach
    void setUp() {
        TranslationUnit tu = TranslationUnit.parse(
                "void f(int x, int y, std::vector<int> v) { y = x + 1; v.clear(); }", "<test>");
        x = tu.find("x + 1");
        plus = x.getNext();
        y = tu.find("y = x");
        v = tu.find("v . clear");
    }

    @Nested
    @DisplayName("写时复制")
    class CopyOnWriteTests {

        @Test
        @DisplayName("写入拷贝不影响原状态")
        void testWriteToCopy() {
            ProgramState a = new ProgramState();
            a.setIntValue(x, 1, false);
            ProgramState b = a.copy();
            b.setIntValue(x, 2, false);
            b.setIntValue(y, 3, false);
            assertEquals(OptionalLong.of(1), a.getIntValue(x.getExprId()));
            assertFalse(a.hasValue(y.getExprId()));
            assertEquals(OptionalLong.of(2), b.getIntValue(x.getExprId()));
        }

        @Test
        @DisplayName("写入原状态不影响拷贝")
        void testWriteToOriginal() {
            ProgramState a = new ProgramState();
            a.setIntValue(x, 1, false);
            ProgramState b = new ProgramState(a);
            a.setUnknown(x);
            a.clear();
            assertTrue(a.isEmpty());
            assertEquals(1, b.size());
            assertEquals(OptionalLong.of(1), b.getIntValue(x.getExprId()));
        }

        @Test
        @DisplayName("未写入的拷贝相等")
        void testEquality() {
            ProgramState a = new ProgramState();
            a.setIntValue(x, 1, false);
            ProgramState b = a.copy();
            assertEquals(a, b);
            b.setIntValue(x, 1, false);
            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
            b.setIntValue(x, 2, false);
            assertNotEquals(a, b);
        }

        @Test
        @DisplayName("交换")
        void testSwap() {
            ProgramState a = new ProgramState();
            a.setIntValue(x, 1, false);
            ProgramState b = new ProgramState();
            a.swap(b);
            assertTrue(a.isEmpty());
            assertTrue(b.hasValue(x.getExprId()));
        }
    }

    @Nested
    @DisplayName("读写")
    class AccessTests {

        @Test
        @DisplayName("IMPOSSIBLE 值默认不可见")
        void testImpossibleHidden() {
            ProgramState pm = new ProgramState();
            pm.setIntValue(x, 0, true);
            assertTrue(pm.hasValue(x.getExprId()));
            assertNull(pm.getValue(x.getExprId()));
            assertNotNull(pm.getValue(x.getExprId(), true));
            assertFalse(pm.getIntValue(x.getExprId()).isPresent());
            assertTrue(pm.at(x.getExprId()).isImpossible());
        }

        @Test
        @DisplayName("不存在的条目")
        void testMissing() {
            ProgramState pm = new ProgramState();
            assertNull(pm.getValue(x.getExprId(), true));
            assertNull(pm.getToken(x.getExprId()));
            assertThrows(NoSuchElementException.class, () -> pm.at(x.getExprId()));
        }

        @Test
        @DisplayName("setUnknown 保留条目")
        void testSetUnknown() {
            ProgramState pm = new ProgramState();
            pm.setIntValue(x, 7, false);
            pm.setUnknown(x);
            pm.setUnknown(y);
            assertTrue(pm.at(x.getExprId()).isUninitValue());
            assertTrue(pm.at(y.getExprId()).isUninitValue());
            assertFalse(pm.getIntValue(x.getExprId()).isPresent());
        }

        @Test
        @DisplayName("记录节点")
        void testGetToken() {
            ProgramState pm = new ProgramState();
            pm.setIntValue(x, 7, false);
            assertSame(x, pm.getToken(x.getExprId()));
        }

        @Test
        @DisplayName("容器大小与是否为空")
        void testContainer() {
            ProgramState pm = new ProgramState();
            pm.setContainerSizeValue(v, 0, true);
            assertEquals(OptionalLong.of(0), pm.getContainerSizeValue(v.getExprId()));
            assertEquals(OptionalLong.of(1), pm.getContainerEmptyValue(v.getExprId()));

            pm.setContainerSizeValue(v, 0, false);
            assertFalse(pm.getContainerSizeValue(v.getExprId()).isPresent());
            assertEquals(OptionalLong.of(0), pm.getContainerEmptyValue(v.getExprId()));

            pm.setContainerSizeValue(v, 3, true);
            assertEquals(OptionalLong.of(0), pm.getContainerEmptyValue(v.getExprId()));
        }
    }

    @Nested
    @DisplayName("反解")
    class SolveTests {

        @Test
        @DisplayName("x + 1 为 5 时 x 为 4")
        void testSolvePlus() {
            ProgramState pm = new ProgramState();
            pm.setValue(plus, AbstractValue.known(5));
            assertEquals(OptionalLong.of(5), pm.getIntValue(plus.getExprId()));
            assertEquals(OptionalLong.of(4), pm.getIntValue(x.getExprId()));
        }

        @Test
        @DisplayName("IMPOSSIBLE 值同样反解")
        void testSolveImpossible() {
            ProgramState pm = new ProgramState();
            pm.setValue(plus, AbstractValue.impossible(1));
            AbstractValue solved = pm.getValue(x.getExprId(), true);
            assertNotNull(solved);
            assertTrue(solved.isImpossible());
            assertEquals(0, solved.getIntValue());
        }

        @Test
        @DisplayName("非整数值不反解")
        void testNoSolveForContainer() {
            ProgramState pm = new ProgramState();
            pm.setValue(plus, AbstractValue.containerSize(2, Knowledge.KNOWN));
            assertFalse(pm.hasValue(x.getExprId()));
        }
    }

    @Nested
    @DisplayName("批量操作")
    class BulkTests {

        @Test
        @DisplayName("eraseIf 每个条目只判断一次")
        void testEraseIf() {
            ProgramState pm = new ProgramState();
            pm.setIntValue(x, 1, false);
            pm.setIntValue(y, 2, false);
            ProgramState shared = pm.copy();
            int[] calls = {0};
            pm.eraseIf((key, value) -> {
                calls[0]++;
                return value.getIntValue() == 1;
            });
            assertEquals(2, calls[0]);
            assertFalse(pm.hasValue(x.getExprId()));
            assertTrue(pm.hasValue(y.getExprId()));
            assertEquals(2, shared.size());
        }

        @Test
        @DisplayName("replace 覆盖，insert 只补缺")
        void testReplaceAndInsert() {
            ProgramState a = new ProgramState();
            a.setIntValue(x, 1, false);
            ProgramState b = new ProgramState();
            b.setIntValue(x, 2, false);
            b.setIntValue(y, 3, false);

            ProgramState inserted = a.copy();
            inserted.insert(b);
            assertEquals(OptionalLong.of(1), inserted.getIntValue(x.getExprId()));
            assertEquals(OptionalLong.of(3), inserted.getIntValue(y.getExprId()));

            ProgramState replaced = a.copy();
            replaced.replace(b);
            assertEquals(OptionalLong.of(2), replaced.getIntValue(x.getExprId()));
            assertEquals(OptionalLong.of(1), a.getIntValue(x.getExprId()));
        }

        @Test
        @DisplayName("迭代视图只读")
        void testEntriesReadOnly() {
            ProgramState pm = new ProgramState();
            pm.setIntValue(x, 1, false);
            assertThat(pm.entries()).hasSize(1);
            assertThrows(UnsupportedOperationException.class, () -> pm.entries().clear());
        }
    }
}
