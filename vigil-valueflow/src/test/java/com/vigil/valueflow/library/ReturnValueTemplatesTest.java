package com.vigil.valueflow.library;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 返回值模板编译缓存测试
 */
class ReturnValueTemplatesTest {

    @Test
    @DisplayName("编译并定位占位参数")
    void testCompile() {
        ReturnValueTemplates templates = new ReturnValueTemplates(16);
        Optional<CompiledTemplate> compiled = templates.compile("arg1 < arg0 ? arg1 : arg0");
        assertTrue(compiled.isPresent());
        CompiledTemplate t = compiled.get();
        assertEquals(2, t.getArgumentCount());
        assertEquals("arg0", t.getArgument(0).getStr());
        assertEquals("arg1", t.getArgument(1).getStr());
        assertNull(t.getArgument(2));
        assertEquals("?", t.getExpression().getStr());
        assertEquals("arg1 < arg0 ? arg1 : arg0", t.toString());
    }

    @Test
    @DisplayName("同一模板只解析一次")
    void testCached() {
        ReturnValueTemplates templates = new ReturnValueTemplates(16);
        CompiledTemplate first = templates.compile("arg0 * 2").get();
        CompiledTemplate second = templates.compile("arg0 * 2").get();
        assertSame(first, second);
        assertEquals(1, templates.stats().getHits());
        assertEquals(1, templates.stats().getMisses());
    }

    @Test
    @DisplayName("语法错误的模板为空，结果同样缓存")
    void testInvalid() {
        ReturnValueTemplates templates = new ReturnValueTemplates(16);
        assertFalse(templates.compile("(arg0").isPresent());
        assertFalse(templates.compile("(arg0").isPresent());
        assertFalse(templates.compile("arg0 +").isPresent());
        assertEquals(1, templates.stats().getHits());
    }

    @Test
    @DisplayName("清空")
    void testClear() {
        ReturnValueTemplates templates = new ReturnValueTemplates(16);
        templates.compile("arg0");
        templates.clear();
        assertEquals(0, templates.stats().getSize());
    }
}
