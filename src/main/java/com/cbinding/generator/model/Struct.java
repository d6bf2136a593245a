package com.cbinding.generator.model;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A {@code struct} specifier.
 */
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class Struct extends AggregateSpec {

    public Struct(String name, List<Decl> decls, Coord coord) {
        super(name, decls, coord);
    }

    public Struct(String name, List<Decl> decls) {
        this(name, decls, null);
    }

    @Override
    public <R, A> R accept(CNodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
