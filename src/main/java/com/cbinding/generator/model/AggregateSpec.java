package com.cbinding.generator.model;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Common shape of {@code struct} and {@code union} specifiers.
 * {@code decls} is null when the specifier is only a reference ({@code struct foo *p}).
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public abstract class AggregateSpec extends CNode {
    private final String name;
    private final List<Decl> decls;

    protected AggregateSpec(String name, List<Decl> decls, Coord coord) {
        super(coord);
        this.name = name;
        this.decls = decls != null ? List.copyOf(decls) : null;
    }

    public boolean hasBody() {
        return decls != null && !decls.isEmpty();
    }

    @Override
    public String getDeclaredName() {
        return name;
    }
}
