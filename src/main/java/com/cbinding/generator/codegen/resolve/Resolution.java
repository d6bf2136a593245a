package com.cbinding.generator.codegen.resolve;

import com.cbinding.generator.codegen.model.Declarator;
import com.cbinding.generator.codegen.model.NamedType;
import com.cbinding.generator.codegen.model.Pointer;

/**
 * Intermediate result of resolving one declarator: either plain type text that
 * nothing has wrapped yet, or a shaped declarator node.
 */
public sealed interface Resolution permits Resolution.Bare, Resolution.Shaped {

    /**
     * Turns this result into a declarator carrying {@code name} (null or empty leaves it unnamed).
     */
    Declarator named(String name);

    /**
     * Adds one pointer level.
     */
    Resolution pointer();

    record Bare(String typeText) implements Resolution {

        @Override
        public Declarator named(String name) {
            return new NamedType(name, typeText);
        }

        @Override
        public Resolution pointer() {
            return new Bare(typeText + "*");
        }
    }

    record Shaped(Declarator node) implements Resolution {

        @Override
        public Declarator named(String name) {
            return node.withName(name);
        }

        @Override
        public Resolution pointer() {
            return new Shaped(new Pointer(node));
        }
    }
}
