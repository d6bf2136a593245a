package com.cbinding.generator.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A {@code typedef} declaration.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class Typedef extends CNode {
    private final String name;
    private final CNode type;

    public Typedef(String name, CNode type, Coord coord) {
        super(coord);
        this.name = name;
        this.type = type;
    }

    public Typedef(String name, CNode type) {
        this(name, type, null);
    }

    @Override
    public String getDeclaredName() {
        return name;
    }

    @Override
    public <R, A> R accept(CNodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
