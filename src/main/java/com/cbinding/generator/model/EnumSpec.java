package com.cbinding.generator.model;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * An {@code enum} specifier. {@code values} is null for a reference ({@code enum color c}).
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class EnumSpec extends CNode {
    private final String name;
    private final List<Enumerator> values;

    public EnumSpec(String name, List<Enumerator> values, Coord coord) {
        super(coord);
        this.name = name;
        this.values = values != null ? List.copyOf(values) : null;
    }

    public EnumSpec(String name, List<Enumerator> values) {
        this(name, values, null);
    }

    public boolean hasBody() {
        return values != null && !values.isEmpty();
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
