package com.cbinding.generator.model;

import org.junit.jupiter.api.Test;

import static com.cbinding.generator.model.CAst.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the declaration tree model.
 */
class CoordTest {

    @Test
    void testCoordRendering() {
        assertThat(new Coord("foo.h", 12, 3)).hasToString("foo.h:12:3");
        assertThat(new Coord("foo.h", 12, 0)).hasToString("foo.h:12");
    }

    @Test
    void testDeclaredNames() {
        assertThat(var("x", "int").getDeclaredName()).isEqualTo("x");
        assertThat(typedef("T", typeDecl("T", id("int"))).getDeclaredName()).isEqualTo("T");
        assertThat(structRef("s").getDeclaredName()).isEqualTo("s");
        assertThat(ptr(id("int")).getDeclaredName()).isNull();
    }

    @Test
    void testBodiesAndFunctionDeclarators() {
        assertThat(structRef("s").hasBody()).isFalse();
        assertThat(struct("s").hasBody()).isFalse();
        assertThat(struct("s", var("x", "int")).hasBody()).isTrue();
        assertThat(enumRef("e").hasBody()).isFalse();

        assertThat(func(typeDecl("f", id("int"))).isFunctionDeclarator()).isTrue();
        assertThat(ptr(id("int")).isFunctionDeclarator()).isFalse();
    }

    @Test
    void testCoordinateIsNotPartOfEquality() {
        Decl a = new Decl("x", typeDecl("x", id("int")), coord("a.h", 1));
        Decl b = new Decl("x", typeDecl("x", id("int")), coord("b.h", 9));

        assertThat(a).isEqualTo(b);
        assertThat(id("unsigned", "long").getTypeText()).isEqualTo("unsigned long");
    }
}
