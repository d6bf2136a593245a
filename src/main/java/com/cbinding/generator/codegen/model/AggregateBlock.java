package com.cbinding.generator.codegen.model;

import java.util.ArrayList;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A struct or union block:
 * <pre>
 * cdef struct point:
 *     int x
 *     int y
 * </pre>
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class AggregateBlock extends PxdNode {
    private final String name;
    private final AggregateKind kind;
    private final List<PxdNode> fields;
    private final DeclarationStatement statement;

    public AggregateBlock(String name, AggregateKind kind, List<? extends PxdNode> fields,
                          DeclarationStatement statement) {
        this.name = name;
        this.kind = kind;
        this.fields = List.copyOf(fields);
        this.statement = statement;
    }

    @Override
    public List<String> lines() {
        List<String> rv = new ArrayList<>();
        rv.add(statement.getKeyword() + " " + kind.getKeyword() + " " + name + ":");
        for (PxdNode field : fields) {
            for (String line : field.lines()) {
                rv.add(INDENT + line);
            }
        }
        return rv;
    }
}
