package com.cbinding.generator.model;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A function declarator. {@code type} is the return-type declarator chain, which
 * also carries the function's name in its innermost {@link TypeDecl}.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class FuncDecl extends CNode {
    private final List<CNode> params;
    private final CNode type;

    public FuncDecl(List<CNode> params, CNode type, Coord coord) {
        super(coord);
        this.params = params != null ? List.copyOf(params) : List.of();
        this.type = type;
    }

    public FuncDecl(List<CNode> params, CNode type) {
        this(params, type, null);
    }

    @Override
    public boolean isFunctionDeclarator() {
        return true;
    }

    @Override
    public <R, A> R accept(CNodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
