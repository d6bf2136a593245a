package com.cbinding.generator.codegen.exception;

/**
 * Raised when a declarator chain does not have the shape the resolver relies on,
 * e.g. a function declarator whose return type resolves to nothing.
 * Aborts the translation of the whole header.
 */
public class DeclaratorShapeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DeclaratorShapeException(String message) {
        super(message);
    }
}
