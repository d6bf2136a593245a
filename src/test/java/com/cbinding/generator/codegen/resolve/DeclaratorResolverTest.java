package com.cbinding.generator.codegen.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.cbinding.generator.codegen.ConstantTable;
import com.cbinding.generator.codegen.model.AggregateBlock;
import com.cbinding.generator.codegen.model.Array;
import com.cbinding.generator.codegen.model.DeclarationStatement;
import com.cbinding.generator.codegen.model.EnumBlock;
import com.cbinding.generator.codegen.model.FunctionSignature;
import com.cbinding.generator.codegen.model.TypeAlias;
import com.cbinding.generator.codegen.naming.NamingContext;
import com.cbinding.generator.codegen.util.StdintImportManager;

import static com.cbinding.generator.model.CAst.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DeclaratorResolver: which nodes reach the top level, in which order.
 */
class DeclaratorResolverTest {

    private NamingContext naming;
    private ConstantTable constants;
    private TopLevelAccumulator topLevel;
    private DeclaratorResolver resolver;

    @BeforeEach
    void setUp() {
        naming = new NamingContext();
        constants = new ConstantTable();
        topLevel = new TopLevelAccumulator();
        resolver = new DeclaratorResolver(naming, constants, new StdintImportManager(), topLevel);
    }

    @Test
    void testHoistedTypesPrecedeTheirUsers() {
        resolver.resolveTopLevel(decl(null, struct("bar",
                decl("cb", ptr(func(typeDecl("cb", id("void")), param("int")))))));

        assertThat(topLevel.getNodes()).hasSize(2);
        assertThat(topLevel.getNodes().get(0)).isInstanceOf(TypeAlias.class);
        AggregateBlock bar = (AggregateBlock) topLevel.getNodes().get(1);
        assertThat(bar.getName()).isEqualTo("bar");
        assertThat(bar.getStatement()).isEqualTo(DeclarationStatement.CDEF);
        assertThat(naming.depth()).isZero();
    }

    @Test
    void testTypedefTargetUsesTypedefName() {
        resolver.resolveTopLevel(typedef("foo_t", typeDecl("foo_t", struct(null, var("x", "int")))));

        assertThat(topLevel.getNodes()).singleElement()
                .isInstanceOfSatisfying(AggregateBlock.class, block -> {
                    assertThat(block.getName()).isEqualTo("foo_t");
                    assertThat(block.getStatement()).isEqualTo(DeclarationStatement.CTYPEDEF);
                    assertThat(block.getFields()).hasSize(1);
                });
    }

    @Test
    void testFileScopeBlockNamesAreUnique() {
        resolver.resolveTopLevel(decl(null, enumSpec(null, enumerator("A", lit("1")))));
        resolver.resolveTopLevel(decl(null, enumSpec(null, enumerator("B", lit("2")))));
        resolver.resolveTopLevel(decl(null, struct(null, var("x", "int"))));
        resolver.resolveTopLevel(decl(null, union(null, var("y", "int"))));
        resolver.resolveTopLevel(decl("g", typeDecl("g", struct(null, var("z", "int")))));

        List<String> names = new ArrayList<>();
        topLevel.getNodes().stream().filter(AggregateBlock.class::isInstance)
                .forEach(node -> names.add(((AggregateBlock) node).getName()));
        topLevel.getNodes().stream().filter(EnumBlock.class::isInstance)
                .map(node -> ((EnumBlock) node).getName())
                .filter(Objects::nonNull)
                .forEach(names::add);

        assertThat(names).containsExactly("_g_s").doesNotHaveDuplicates();
        assertThat(topLevel.getNodes()).filteredOn(EnumBlock.class::isInstance)
                .extracting(node -> ((EnumBlock) node).getName())
                .containsExactly(null, null);
        assertThat(constants.lookup("B")).hasValue(2);
    }

    @Test
    void testEnumValuesAreRecordedWhileWalking() {
        resolver.resolveTopLevel(decl(null, enumSpec("size", enumerator("SMALL", lit("2")), enumerator("LARGE", null))));

        assertThat(constants.lookup("LARGE")).hasValue(3);
        assertThat(topLevel.getNodes()).singleElement()
                .isInstanceOfSatisfying(EnumBlock.class, block -> assertThat(block.getEnumerators()).containsExactly("SMALL", "LARGE"));
    }

    @Test
    void testNestedArraysCollapseIntoOneNode() {
        resolver.resolveTopLevel(decl("cube", array(array(array(typeDecl("cube", id("char")), lit("4")), lit("3")), lit("2"))));

        assertThat(topLevel.getNodes()).singleElement()
                .isInstanceOfSatisfying(Array.class, cube -> {
                    assertThat(cube.getDimensions()).hasSize(3);
                    assertThat(cube.getName()).isEqualTo("cube[2][3][4]");
                });
    }

    @Test
    void testPrototypeStaysInPlace() {
        resolver.resolveTopLevel(decl("f", func(typeDecl("f", id("int")), var("a", "int"))));

        assertThat(topLevel.getNodes()).singleElement()
                .isInstanceOfSatisfying(FunctionSignature.class, f -> {
                    assertThat(f.getName()).isEqualTo("f");
                    assertThat(f.getParams()).hasSize(1);
                });
    }
}
