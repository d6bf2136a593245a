package com.cbinding.generator.codegen.model;

import java.util.ArrayList;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * An enum block listing enumerator names. A nameless enum renders as {@code cdef enum:}.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class EnumBlock extends PxdNode {
    private final String name;
    private final List<String> enumerators;
    private final DeclarationStatement statement;

    public EnumBlock(String name, List<String> enumerators, DeclarationStatement statement) {
        this.name = name;
        this.enumerators = List.copyOf(enumerators);
        this.statement = statement;
    }

    @Override
    public List<String> lines() {
        List<String> rv = new ArrayList<>();
        if (name != null) {
            rv.add(statement.getKeyword() + " enum " + name + ":");
        } else {
            rv.add("cdef enum:");
        }
        for (String enumerator : enumerators) {
            rv.add(INDENT + enumerator);
        }
        return rv;
    }
}
