package com.cbinding.generator.codegen.exception;

/**
 * Raised when the .pxd document template cannot be loaded or processed.
 */
public class PxdRenderException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PxdRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
