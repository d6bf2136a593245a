package com.cbinding.generator.codegen.model;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.cbinding.generator.codegen.exception.DeclaratorShapeException;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the .pxd output nodes.
 */
class PxdNodeTest {

    @Test
    void testNamedType() {
        assertThat(new NamedType("count", "unsigned long").lines()).containsExactly("unsigned long count");
        assertThat(new NamedType(null, "int").lines()).containsExactly("int");
        assertThat(new NamedType("foo", "foo").isSelfAlias()).isTrue();
        assertThat(new NamedType("foo_t", "foo").isSelfAlias()).isFalse();
    }

    @Test
    void testWithNameOnlyFillsMissingName() {
        Declarator unnamed = new NamedType(null, "int");
        Declarator named = unnamed.withName("x");

        assertThat(named.lines()).containsExactly("int x");
        assertThat(named.withName("y").lines()).containsExactly("int x");
        assertThat(unnamed.withName(null)).isSameAs(unnamed);
    }

    @Test
    void testPointerAndArray() {
        Declarator p = new Pointer(new Pointer(new NamedType("argv", "char")));
        assertThat(p.lines()).containsExactly("char** argv");

        Declarator grid = new Array(new NamedType("grid", "int"),
                List.of(ArrayDimension.of(4), ArrayDimension.unknown()));
        assertThat(grid.getName()).isEqualTo("grid[4][]");
        assertThat(grid.lines()).containsExactly("int grid[4][]");
    }

    @Test
    void testFunctionSignature() {
        FunctionSignature open = new FunctionSignature("int", "open",
                List.of(new Pointer(new NamedType("path", "char")), new NamedType("flags", "int")));

        assertThat(open.lines()).containsExactly("int open(char* path, int flags)");
        assertThat(new FunctionSignature("void", "f", List.of()).lines()).containsExactly("void f()");
    }

    @Test
    void testFunctionPointerRendering() {
        FunctionSignature cb = new FunctionSignature("void", "cb_t", List.of(new NamedType(null, "int")));

        assertThat(new Pointer(cb).lines()).containsExactly("void (*cb_t)(int)");
        assertThat(new Pointer(new Pointer(cb)).lines()).containsExactly("void (**cb_t)(int)");
        assertThat(new TypeAlias(new Pointer(cb)).lines()).containsExactly("ctypedef void (*cb_t)(int)");
    }

    @Test
    void testMultiLineParameterIsRejected() {
        Declarator weird = new Declarator() {
            @Override
            public String getName() {
                return "w";
            }

            @Override
            public String getTypeText() {
                return "int";
            }

            @Override
            public Declarator withName(String name) {
                return this;
            }

            @Override
            public List<String> lines() {
                return List.of("int", "w");
            }
        };
        FunctionSignature f = new FunctionSignature("void", "f", List.of(weird));

        assertThatThrownBy(f::lines)
                .isInstanceOf(DeclaratorShapeException.class)
                .hasMessageContaining("2 lines");
    }

    @Test
    void testAggregateBlock() {
        AggregateBlock point = new AggregateBlock("point", AggregateKind.STRUCT,
                List.of(new NamedType("x", "int"), new NamedType("y", "int")), DeclarationStatement.CDEF);

        assertThat(point).hasToString("cdef struct point:\n    int x\n    int y");
    }

    @Test
    void testNestedBlockIndentation() {
        AggregateBlock inner = new AggregateBlock("in", AggregateKind.STRUCT,
                List.of(new NamedType("a", "int")), DeclarationStatement.CDEF);
        AggregateBlock outer = new AggregateBlock("out", AggregateKind.STRUCT,
                List.of(inner), DeclarationStatement.CTYPEDEF);

        assertThat(outer.lines()).containsExactly(
                "ctypedef struct out:",
                "    cdef struct in:",
                "        int a");
    }

    @Test
    void testEnumBlock() {
        assertThat(new EnumBlock("color", List.of("RED", "GREEN"), DeclarationStatement.CTYPEDEF).lines())
                .containsExactly("ctypedef enum color:", "    RED", "    GREEN");
        assertThat(new EnumBlock(null, List.of("A"), DeclarationStatement.CDEF).lines())
                .containsExactly("cdef enum:", "    A");
    }
}
