package com.cbinding.generator.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One pointer level around an inner declarator.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class PtrDecl extends CNode {
    private final CNode type;

    public PtrDecl(CNode type, Coord coord) {
        super(coord);
        this.type = type;
    }

    public PtrDecl(CNode type) {
        this(type, null);
    }

    @Override
    public <R, A> R accept(CNodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
