package com.cbinding.generator.codegen.model;

import java.util.ArrayList;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Top-level {@code ctypedef} around any declarator.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class TypeAlias extends PxdNode {
    private final PxdNode inner;

    public TypeAlias(PxdNode inner) {
        this.inner = inner;
    }

    @Override
    public List<String> lines() {
        List<String> rv = new ArrayList<>(inner.lines());
        rv.set(0, DeclarationStatement.CTYPEDEF.getKeyword() + " " + rv.get(0));
        return rv;
    }
}
