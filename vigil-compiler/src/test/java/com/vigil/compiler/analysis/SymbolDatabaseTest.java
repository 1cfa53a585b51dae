package com.vigil.compiler.analysis;

import com.vigil.compiler.TranslationUnit;
import com.vigil.compiler.ast.Token;
import com.vigil.compiler.value.AbstractValue;
import com.vigil.compiler.value.ValueKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * SymbolDatabase 语义标注测试
 */
class SymbolDatabaseTest {

    private TranslationUnit parse(String source) {
        return TranslationUnit.parse(source, "<test>");
    }

    @Nested
    @DisplayName("作用域")
    class ScopeTests {

        private final String source = "int g;\n"
                + "void f(int a) {\n"
                + "  int b;\n"
                + "  if (a) { int c; c = 1; } else { b = 1; }\n"
                + "  while (b) { b--; }\n"
                + "}\n";

        @Test
        @DisplayName("作用域树")
        void testScopeTree() {
            SymbolDatabase db = parse(source).getSymbolDatabase();
            assertEquals(5, db.getScopeList().size());
            Scope global = db.getGlobalScope();
            assertEquals(1, global.getNestedList().size());
            Scope function = global.getNestedList().get(0);
            assertEquals(Scope.ScopeType.FUNCTION, function.getType());
            assertThat(function.getNestedList()).extracting(Scope::getType)
                    .containsExactly(Scope.ScopeType.IF, Scope.ScopeType.ELSE, Scope.ScopeType.WHILE);
        }

        @Test
        @DisplayName("token 的作用域归属")
        void testTokenScopes() {
            TranslationUnit tu = parse(source);
            Token c = tu.find("c = 1");
            assertEquals(Scope.ScopeType.IF, c.getScope().getType());
            assertTrue(c.getScope().isLocal());
            Token ifBrace = tu.find("if ( a ) {").tokAt(4);
            assertEquals(Scope.ScopeType.IF, ifBrace.getScope().getType());
            assertEquals(Scope.ScopeType.IF, ifBrace.getLink().getScope().getType());
            assertEquals(Scope.ScopeType.FUNCTION, tu.find("int b").getScope().getType());
            assertFalse(tu.find("int b").getScope().isLocal());
            assertEquals(Scope.ScopeType.GLOBAL, tu.find("int g").getScope().getType());
        }

        @Test
        @DisplayName("else 作用域共享 if 的条件")
        void testElseCondition() {
            TranslationUnit tu = parse(source);
            Token elseTok = tu.find("else");
            Scope elseScope = elseTok.getNext().getScope();
            assertEquals(Scope.ScopeType.ELSE, elseScope.getType());
            assertSame(tu.find("if ( a").tokAt(2), elseScope.getCondition());
        }

        @Test
        @DisplayName("变量查找与种类")
        void testVariables() {
            TranslationUnit tu = parse(source);
            Variable a = tu.find("a )").getVariable();
            assertTrue(a.isArgument());
            assertEquals(0, a.getIndex());
            assertTrue(tu.find("g").getVariable().isGlobal());
            assertTrue(tu.find("b").getVariable().isLocal());
            assertSame(tu.find("b").getVariable(), tu.findLast("b").getVariable());
        }
    }

    @Nested
    @DisplayName("函数")
    class FunctionTests {

        @Test
        @DisplayName("按实参个数解析重载")
        void testOverloadByArity() {
            TranslationUnit tu = parse("int f(int a); int f(int a, int b); void g() { f(1); f(1, 2); }");
            assertEquals(1, tu.find("f ( 1 )").getFunction().argCount());
            assertEquals(2, tu.find("f ( 1 ,").getFunction().argCount());
        }

        @Test
        @DisplayName("有函数体的定义优先")
        void testDefinitionPreferred() {
            TranslationUnit tu = parse("int f(int a); int f(int a) { return a; } void g() { f(1); }");
            Function f = tu.find("f ( 1").getFunction();
            assertTrue(f.hasBody());
            assertEquals("a", f.getArgumentVar(0).getName());
            assertNull(f.getArgumentVar(1));
        }

        @Test
        @DisplayName("引用与指针形参")
        void testParameterKinds() {
            TranslationUnit tu = parse("void f(int& r, const int* p, int v);");
            Function f = tu.getSymbolDatabase().findFunction("f", 3);
            assertTrue(f.getArgumentVar(0).isReference());
            assertTrue(f.getArgumentVar(1).isPointer());
            assertTrue(f.getArgumentVar(1).getValueType().isConst());
            assertFalse(f.getArgumentVar(2).isReference());
            assertFalse(f.hasBody());
        }
    }

    @Nested
    @DisplayName("表达式标识")
    class ExprIdTests {

        @Test
        @DisplayName("结构相同的表达式共享标识")
        void testStructuralSharing() {
            TranslationUnit tu = parse("void f(int a, int b) { int x = a + b; int y = a + b; int z = b + a; }");
            Token first = tu.find("a + b");
            Token second = tu.findLast("a + b");
            assertNotSame(first, second);
            assertEquals(first.getNext().getExprId(), second.getNext().getExprId());
            assertNotEquals(first.getNext().getExprId(), tu.find("b + a").getNext().getExprId());
            assertEquals(first.getVarId(), first.getExprId());
        }

        @Test
        @DisplayName("调用与赋值各自唯一")
        void testUniqueIds() {
            TranslationUnit tu = parse("int g(); void f() { int x = g(); int y = g(); x = 1; x = 1; }");
            Token call1 = tu.find("= g").tokAt(2);
            Token call2 = tu.findLast("= g").tokAt(2);
            assertNotEquals(call1.getExprId(), call2.getExprId());
            Token assign1 = tu.find("x = 1");
            Token assign2 = tu.findLast("x = 1");
            assertNotEquals(assign1.getNext().getExprId(), assign2.getNext().getExprId());
            assertEquals(assign1.tokAt(2).getExprId(), assign2.tokAt(2).getExprId());
        }

        @Test
        @DisplayName("无参成员调用共享标识")
        void testMemberCallSharing() {
            TranslationUnit tu = parse("void f(std::string s) { int a = s.size(); int b = s.size(); }");
            Token p1 = tu.find("size (").getNext();
            Token p2 = tu.findLast("size (").getNext();
            assertEquals(p1.getExprId(), p2.getExprId());
            assertTrue(p1.getExprId() > 0);
        }

        @Test
        @DisplayName("控制节点没有标识")
        void testControlNodes() {
            TranslationUnit tu = parse("int f(int x) { if (x) { return x; } for (;x;) {} return 0; }");
            assertEquals(0, tu.find("if").getNext().getExprId());
            assertEquals(0, tu.find("return").getExprId());
            assertEquals(0, tu.find("for ( ;").tokAt(2).getExprId());
            assertTrue(tu.find("x )").getExprId() > 0);
        }

        @Test
        @DisplayName("未声明的名字共享隐式变量")
        void testImplicitVariables() {
            TranslationUnit tu = parse("x = 1; y = x;");
            Token x1 = tu.find("x");
            Token x2 = tu.findLast("x");
            assertTrue(x1.getVariable().isImplicit());
            assertSame(x1.getVariable(), x2.getVariable());
            assertEquals(x1.getExprId(), x2.getExprId());
        }
    }

    @Nested
    @DisplayName("类型与字面量")
    class TypeTests {

        @Test
        @DisplayName("算术提升与比较")
        void testArithmeticTypes() {
            TranslationUnit tu = parse("void f(unsigned int u, char c, size_t n) { x = u + 1; y = c + c; z = u < 1; w = n; }");
            ValueType plus = tu.find("u + 1").getNext().getValueType();
            assertTrue(plus.isUnsigned());
            ValueType charSum = tu.find("c + c").getNext().getValueType();
            assertEquals(ValueType.Type.INT, charSum.getType());
            assertFalse(charSum.isUnsigned());
            assertEquals(ValueType.Type.BOOL, tu.find("<").getValueType().getType());
            assertTrue(tu.find("n ;").getValueType().isUnsigned());
        }

        @Test
        @DisplayName("字面量标注已知值")
        void testLiteralValues() {
            TranslationUnit tu = parse("a = 0x10; b = 'a'; c = 1.5; d = true; e = \"abc\"; g = 18446744073709551615u;");
            assertEquals(AbstractValue.known(16), tu.find("0x10").getKnownValue(ValueKind.INT));
            assertEquals(97, tu.find("'a'").getKnownValue(ValueKind.INT).getIntValue());
            assertEquals(1.5, tu.find("1.5").getKnownValue(ValueKind.FLOAT).getFloatValue());
            assertEquals(1, tu.find("true").getKnownValue(ValueKind.INT).getIntValue());
            Token str = tu.find("\"abc\"");
            assertSame(str, str.getKnownValue(ValueKind.TOK).getTokValue());
            assertEquals(1, str.getValueType().getPointer());
            Token big = tu.find("18446744073709551615u");
            assertTrue(big.getValues().isEmpty());
            assertTrue(big.getValueType().isUnsigned());
        }

        @Test
        @DisplayName("八进制与十进制")
        void testIntegerBases() {
            TranslationUnit tu = parse("a = 010; b = 0b101; c = 7L;");
            assertEquals(8, tu.find("010").getKnownValue(ValueKind.INT).getIntValue());
            assertEquals(5, tu.find("0b101").getKnownValue(ValueKind.INT).getIntValue());
            assertEquals(ValueType.Type.LONG, tu.find("7L").getValueType().getType());
        }

        @Test
        @DisplayName("调用的返回类型")
        void testCallReturnType() {
            TranslationUnit tu = parse("unsigned long h(int a); void f() { x = h(1); }");
            assertTrue(tu.find("h ( 1").getNext().getValueType().isUnsigned());
        }
    }
}
