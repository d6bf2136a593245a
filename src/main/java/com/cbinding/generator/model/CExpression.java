package com.cbinding.generator.model;

/**
 * Constant expression found in an array dimension or enumerator initializer.
 * Only {@link Constant} and {@link IdRef} are ever interpreted; everything else is opaque.
 */
public interface CExpression {

    /**
     * A literal as written in the source, e.g. {@code type=int, value=0x10}.
     */
    record Constant(String type, String value) implements CExpression {
    }

    /**
     * A reference to a named constant.
     */
    record IdRef(String name) implements CExpression {
    }

    /**
     * Any other expression (binary operation, cast, sizeof, ...), kept only by kind.
     */
    record OpaqueExpr(String kind) implements CExpression {
    }
}
