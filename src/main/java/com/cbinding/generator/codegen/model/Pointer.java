package com.cbinding.generator.codegen.model;

import java.util.List;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * One pointer level around another declarator.
 * Around a {@link FunctionSignature} it renders as a function-pointer declarator.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class Pointer extends Declarator {
    private final Declarator inner;

    public Pointer(Declarator inner) {
        this.inner = inner;
    }

    @Override
    public String getName() {
        return inner.getName();
    }

    @Override
    public String getTypeText() {
        return inner.getTypeText() + "*";
    }

    @Override
    public Declarator withName(String name) {
        Declarator named = inner.withName(name);
        return named == inner ? this : new Pointer(named);
    }

    @Override
    protected Optional<String> functionPointerLine(int depth) {
        return inner.functionPointerLine(depth + 1);
    }

    @Override
    public List<String> lines() {
        return inner.functionPointerLine(1)
                .map(List::of)
                .orElseGet(super::lines);
    }
}
