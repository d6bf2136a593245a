package com.cbinding.generator.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One array extent around an inner declarator. {@code dim} is null for {@code x[]}.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ArrayDecl extends CNode {
    private final CNode type;
    private final CExpression dim;

    public ArrayDecl(CNode type, CExpression dim, Coord coord) {
        super(coord);
        this.type = type;
        this.dim = dim;
    }

    public ArrayDecl(CNode type, CExpression dim) {
        this(type, dim, null);
    }

    @Override
    public <R, A> R accept(CNodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
