package com.cbinding.generator.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Base class for all C declaration AST nodes.
 * The node family is closed: every kind has a matching method on {@link CNodeVisitor}.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class CNode {

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private final Coord coord;

    protected CNode(Coord coord) {
        this.coord = coord;
    }

    /**
     * The name this node declares, or {@code null} when it declares none.
     */
    public String getDeclaredName() {
        return null;
    }

    /**
     * Whether this node is a function declarator ({@link FuncDecl}).
     */
    public boolean isFunctionDeclarator() {
        return false;
    }

    public abstract <R, A> R accept(CNodeVisitor<R, A> visitor, A arg);
}
