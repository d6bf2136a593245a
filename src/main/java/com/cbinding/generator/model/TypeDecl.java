package com.cbinding.generator.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Innermost declarator of a chain: binds the declared name to its base type
 * (an {@link IdentifierType}, {@link Struct}, {@link Union} or {@link EnumSpec}).
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class TypeDecl extends CNode {
    private final String declname;
    private final CNode type;

    public TypeDecl(String declname, CNode type, Coord coord) {
        super(coord);
        this.declname = declname;
        this.type = type;
    }

    public TypeDecl(String declname, CNode type) {
        this(declname, type, null);
    }

    @Override
    public String getDeclaredName() {
        return declname;
    }

    @Override
    public <R, A> R accept(CNodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
