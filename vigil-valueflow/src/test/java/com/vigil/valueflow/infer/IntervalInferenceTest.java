package com.vigil.valueflow.infer;

import com.vigil.compiler.value.AbstractValue;
import com.vigil.compiler.value.Bound;
import com.vigil.compiler.value.Knowledge;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 区间与区间推断测试
 */
class IntervalInferenceTest {

    private static List<AbstractValue> values(AbstractValue... values) {
        return Arrays.asList(values);
    }

    @Nested
    @DisplayName("区间构造")
    class IntervalTests {

        @Test
        @DisplayName("KNOWN 值给出单点")
        void testKnownPoint() {
            Interval i = Interval.fromValues(values(AbstractValue.possible(3), AbstractValue.known(7)));
            assertTrue(i.isPoint());
            assertEquals(7, i.getMin());
        }

        @Test
        @DisplayName("无符号事实与排除点")
        void testUnsignedNonZero() {
            Interval i = Interval.fromValues(values(
                    AbstractValue.impossible(0),
                    AbstractValue.ranged(-1, Knowledge.IMPOSSIBLE, Bound.UPPER)));
            assertEquals(1, i.getMin());
            assertEquals(Long.MAX_VALUE, i.getMax());
            assertFalse(i.contains(0));
            assertEquals("[1, +inf]", i.toString());
        }

        @Test
        @DisplayName("POSSIBLE 边界")
        void testPossibleBounds() {
            Interval i = Interval.fromValues(values(
                    AbstractValue.ranged(2, Knowledge.POSSIBLE, Bound.LOWER),
                    AbstractValue.ranged(9, Knowledge.POSSIBLE, Bound.UPPER),
                    AbstractValue.impossible(5)));
            assertEquals(2, i.getMin());
            assertEquals(9, i.getMax());
            assertFalse(i.contains(5));
            assertTrue(i.contains(6));
            assertEquals("[2, 9] \\ [5]", i.toString());
        }

        @Test
        @DisplayName("空区间")
        void testEmpty() {
            Interval i = Interval.fromValues(values(
                    AbstractValue.ranged(5, Knowledge.POSSIBLE, Bound.LOWER),
                    AbstractValue.ranged(3, Knowledge.POSSIBLE, Bound.UPPER)));
            assertTrue(i.isEmpty());
            assertEquals(Optional.empty(), i.compare("<", Interval.point(0)));
        }

        @Test
        @DisplayName("比较")
        void testCompare() {
            Interval low = Interval.of(0, 4);
            Interval high = Interval.of(5, 10);
            assertEquals(Optional.of(true), low.compare("<", high));
            assertEquals(Optional.of(false), low.compare(">=", high));
            assertEquals(Optional.of(false), low.compare("==", high));
            assertEquals(Optional.of(true), low.compare("!=", high));
            assertEquals(Optional.empty(), low.compare("<", Interval.of(2, 3)));
            assertEquals(Optional.empty(), Interval.unbounded().compare("==", Interval.point(0)));
        }
    }

    @Nested
    @DisplayName("推断")
    class InferenceTests {

        private final BoundInference inference = new IntervalInference();

        @Test
        @DisplayName("无符号非零值大于 0")
        void testUnsignedGreaterThanZero() {
            List<AbstractValue> r = inference.infer(">",
                    values(AbstractValue.impossible(0), AbstractValue.ranged(-1, Knowledge.IMPOSSIBLE, Bound.UPPER)),
                    values(AbstractValue.known(0)));
            assertThat(r).containsExactly(AbstractValue.known(1));
        }

        @Test
        @DisplayName("排除点使相等比较为假")
        void testExcludedPoint() {
            List<AbstractValue> r = inference.infer("==",
                    values(AbstractValue.impossible(3)), values(AbstractValue.known(3)));
            assertThat(r).containsExactly(AbstractValue.known(0));
        }

        @Test
        @DisplayName("不确定或不适用时为空")
        void testNoResult() {
            assertThat(inference.infer("<", values(AbstractValue.impossible(3)), values(AbstractValue.known(3))))
                    .isEmpty();
            assertThat(inference.infer("+", values(AbstractValue.known(1)), values(AbstractValue.known(2))))
                    .isEmpty();
            assertThat(inference.infer("<", Collections.<AbstractValue>emptyList(), values(AbstractValue.known(2))))
                    .isEmpty();
        }
    }
}
