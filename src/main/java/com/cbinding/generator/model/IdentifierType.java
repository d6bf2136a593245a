package com.cbinding.generator.model;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A base type spelled with one or more words, e.g. {@code unsigned long} or {@code uint32_t}.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class IdentifierType extends CNode {
    private final List<String> names;

    public IdentifierType(List<String> names, Coord coord) {
        super(coord);
        this.names = List.copyOf(names);
    }

    public IdentifierType(List<String> names) {
        this(names, null);
    }

    public String getTypeText() {
        return String.join(" ", names);
    }

    @Override
    public <R, A> R accept(CNodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
