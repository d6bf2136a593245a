package com.cbinding.generator.codegen.model;

import java.util.List;
import java.util.stream.Collectors;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * One or more array extents appended to the declared name: {@code int grid[4][]}.
 * Nested C array declarators collapse into a single node, outermost extent first.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class Array extends Declarator {
    private final Declarator inner;
    private final List<ArrayDimension> dimensions;

    public Array(Declarator inner, List<ArrayDimension> dimensions) {
        this.inner = inner;
        this.dimensions = List.copyOf(dimensions);
    }

    @Override
    public String getName() {
        return inner.getName() + dimensions.stream()
                .map(ArrayDimension::toString)
                .collect(Collectors.joining());
    }

    @Override
    public String getTypeText() {
        return inner.getTypeText();
    }

    @Override
    public Declarator withName(String name) {
        Declarator named = inner.withName(name);
        return named == inner ? this : new Array(named, dimensions);
    }
}
