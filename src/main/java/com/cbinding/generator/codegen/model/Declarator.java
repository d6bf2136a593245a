package com.cbinding.generator.codegen.model;

import java.util.List;
import java.util.Optional;

/**
 * A declaration fragment that binds a (possibly empty) name to a type:
 * {@link NamedType}, {@link Pointer}, {@link Array} or {@link FunctionSignature}.
 */
public abstract class Declarator extends PxdNode {

    /**
     * Declared name as rendered, including array extents. Empty when the declarator is abstract.
     */
    public abstract String getName();

    /**
     * Type text written in front of the name, e.g. {@code unsigned long*}.
     */
    public abstract String getTypeText();

    /**
     * Returns this declarator with {@code name} attached to its innermost identifier,
     * or this declarator unchanged when a name is already attached.
     */
    public abstract Declarator withName(String name);

    /**
     * True for {@code typedef foo foo}, which carries no information.
     */
    public boolean isSelfAlias() {
        return false;
    }

    /**
     * Renders this declarator as a function pointer reached through {@code depth} pointer levels,
     * or empty when it does not end in a function signature.
     */
    protected Optional<String> functionPointerLine(int depth) {
        return Optional.empty();
    }

    @Override
    public List<String> lines() {
        String name = getName();
        if (name.isEmpty()) {
            return List.of(getTypeText());
        }
        return List.of(getTypeText() + " " + name);
    }
}
