package com.cbinding.generator.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A declaration: global variable, function prototype, struct field or parameter.
 * Parameters without a name ({@code int} in {@code f(int)}) carry a null name.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class Decl extends CNode {
    private final String name;
    private final CNode type;

    public Decl(String name, CNode type, Coord coord) {
        super(coord);
        this.name = name;
        this.type = type;
    }

    public Decl(String name, CNode type) {
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
