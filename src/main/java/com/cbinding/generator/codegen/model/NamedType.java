package com.cbinding.generator.codegen.model;

import lombok.EqualsAndHashCode;

/**
 * A bare identifier declaration: {@code unsigned long count}.
 */
@EqualsAndHashCode(callSuper = false)
public class NamedType extends Declarator {
    private final String name;
    private final String typeText;

    public NamedType(String name, String typeText) {
        this.name = name != null ? name : "";
        this.typeText = typeText;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getTypeText() {
        return typeText;
    }

    @Override
    public Declarator withName(String newName) {
        if (!name.isEmpty() || newName == null || newName.isEmpty()) {
            return this;
        }
        return new NamedType(newName, typeText);
    }

    @Override
    public boolean isSelfAlias() {
        return name.equals(typeText);
    }
}
