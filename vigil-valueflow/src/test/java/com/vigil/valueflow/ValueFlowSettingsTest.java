package com.vigil.valueflow;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ValueFlowSettings 测试
 */
class ValueFlowSettingsTest {

    @Test
    @DisplayName("默认预算")
    void testDefaults() {
        ValueFlowSettings s = ValueFlowSettings.defaults();
        assertEquals(ValueFlowSettings.Level.DEFAULT, s.getLevel());
        assertEquals(10, s.getMaxExpressionDepth());
        assertEquals(4, s.getMaxFunctionDepth());
        assertEquals(10_000, s.getMaxNodeVisits());
        assertEquals(50, s.getMaxConditionNodes());
        assertEquals(4, s.getMaxConditionLeaves());
        assertTrue(s.isInvalidateReferenceArguments());
        assertSame(s, ValueFlowSettings.defaults());
    }

    @Test
    @DisplayName("严格预设更小")
    void testStrict() {
        ValueFlowSettings s = ValueFlowSettings.strict();
        assertEquals(ValueFlowSettings.Level.STRICT, s.getLevel());
        assertThat(s.getMaxNodeVisits()).isLessThan(ValueFlowSettings.defaults().getMaxNodeVisits());
        assertThat(s.getMaxExpressionDepth()).isLessThan(ValueFlowSettings.defaults().getMaxExpressionDepth());
    }

    @Test
    @DisplayName("toBuilder 保留原值")
    void testToBuilder() {
        ValueFlowSettings s = ValueFlowSettings.strict().toBuilder()
                .invalidateReferenceArguments(false)
                .build();
        assertEquals(ValueFlowSettings.Level.CUSTOM, s.getLevel());
        assertEquals(ValueFlowSettings.strict().getMaxNodeVisits(), s.getMaxNodeVisits());
        assertFalse(s.isInvalidateReferenceArguments());
        assertThat(s.toString()).contains("CUSTOM", "visits=2000", "invalidateRefs=false");
    }

    @Test
    @DisplayName("非法参数")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> ValueFlowSettings.custom().maxExpressionDepth(0));
        assertThrows(IllegalArgumentException.class, () -> ValueFlowSettings.custom().maxNodeVisits(-1));
        assertThrows(IllegalArgumentException.class, () -> ValueFlowSettings.custom().maxFunctionDepth(-1));
        assertThrows(IllegalArgumentException.class, () -> ValueFlowSettings.custom().templateCacheSize(0));
        assertEquals(0, ValueFlowSettings.custom().maxFunctionDepth(0).build().getMaxFunctionDepth());
    }
}
