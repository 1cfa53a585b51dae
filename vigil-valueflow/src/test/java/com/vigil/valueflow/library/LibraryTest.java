package com.vigil.valueflow.library;

import com.vigil.compiler.TranslationUnit;
import com.vigil.compiler.ast.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Library 加载与查询测试
 */
class LibraryTest {

    private static Library load(String json) {
        return Library.load(new StringReader(json));
    }

    @Nested
    @DisplayName("加载")
    class LoadTests {

        @Test
        @DisplayName("最小定义")
        void testMinimal() {
            Library lib = load("{\"functions\": [{\"name\": \"twice\", \"pure\": true, \"returnValue\": \"arg0 * 2\"},"
                    + " {\"name\": \"log_it\"}]}");
            assertTrue(lib.isPure("twice"));
            assertFalse(lib.isPure("log_it"));
            assertFalse(lib.isPure("missing"));
            assertEquals(Optional.of("arg0 * 2"), lib.returnValueExpression("twice"));
            assertEquals(Optional.empty(), lib.returnValueExpression("log_it"));
        }

        @Test
        @DisplayName("格式错误")
        void testMalformed() {
            assertThrows(LibraryLoadException.class, () -> load("{ not json"));
            assertThrows(LibraryLoadException.class, () -> load(""));
            assertThrows(LibraryLoadException.class, () -> load("[1, 2]"));
        }

        @Test
        @DisplayName("未知枚举名与缺少函数名")
        void testBadContent() {
            LibraryLoadException e = assertThrows(LibraryLoadException.class,
                    () -> load("{\"containers\": {\"yields\": {\"size\": \"HEIGHT\"}}}"));
            assertThat(e.getMessage()).contains("HEIGHT");
            assertThrows(LibraryLoadException.class, () -> load("{\"functions\": [{\"pure\": true}]}"));
        }

        @Test
        @DisplayName("资源不存在")
        void testMissingResource() {
            assertThrows(LibraryLoadException.class, () -> Library.loadResource("/vigil/library/none.json"));
        }

        @Test
        @DisplayName("空库")
        void testEmpty() {
            Library lib = Library.empty();
            assertFalse(lib.isContainerType("std::vector"));
            assertEquals(YieldKind.NO_YIELD, lib.containerYield("size"));
        }
    }

    @Nested
    @DisplayName("标准库")
    class StandardTests {

        @Test
        @DisplayName("全局共享")
        void testShared() {
            assertSame(Library.standard(), Library.standard());
        }

        @Test
        @DisplayName("容器成员")
        void testContainerMembers() {
            Library lib = Library.standard();
            assertTrue(lib.isContainerType("std::vector"));
            assertEquals(YieldKind.SIZE, lib.containerYield("size"));
            assertEquals(YieldKind.EMPTY, lib.containerYield("empty"));
            assertEquals(ContainerAction.PUSH, lib.containerAction("push_back"));
            assertEquals(ContainerAction.NO_ACTION, lib.containerAction("size"));
            assertEquals(ContainerAction.CHANGE, lib.containerAction("frobnicate"));
            assertFalse(ContainerAction.NO_ACTION.changesSize());
            assertTrue(ContainerAction.CLEAR.changesSize());
        }

        @Test
        @DisplayName("返回值模板")
        void testTemplates() {
            Library lib = Library.standard();
            assertTrue(lib.returnValueExpression("abs").isPresent());
            assertTrue(lib.isPure("strlen"));
            assertFalse(lib.returnValueExpression("strlen").isPresent());
        }
    }

    @Nested
    @DisplayName("节点查询")
    class TokenTests {

        @Test
        @DisplayName("容器变量与产出")
        void testYieldFromCall() {
            TranslationUnit tu = TranslationUnit.parse(
                    "void f(std::vector<int> v, int* p) { a = v.size(); b = v.empty(); v.push_back(1); }", "<test>");
            Library lib = Library.standard();
            Token v = tu.find("v . size");
            assertTrue(lib.isContainer(v));
            assertFalse(lib.isContainer(tu.find("p )")));

            Token sizeCall = tu.find("size (").getNext();
            assertEquals(YieldKind.SIZE, lib.functionYield(sizeCall));
            assertSame(v, lib.getContainerFromYield(sizeCall, YieldKind.SIZE));
            assertNull(lib.getContainerFromYield(sizeCall, YieldKind.EMPTY));

            Token pushCall = tu.find("push_back (").getNext();
            assertEquals(YieldKind.NO_YIELD, lib.functionYield(pushCall));
        }

        @Test
        @DisplayName("叠加资源")
        void testMerge() {
            Library lib = Library.empty().mergeResource(Library.STANDARD_RESOURCE);
            assertTrue(lib.isContainerType("std::string"));
        }
    }
}
