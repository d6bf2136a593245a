package com.cbinding.generator.model;

/**
 * The trailing {@code ...} of a variadic parameter list.
 */
public class EllipsisParam extends CNode {

    public EllipsisParam(Coord coord) {
        super(coord);
    }

    public EllipsisParam() {
        this(null);
    }

    @Override
    public <R, A> R accept(CNodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
