package com.cbinding.generator.parser.exception;

/**
 * The declaration tree document is not valid JSON or does not have the expected node layout.
 */
public class AstFormatException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public AstFormatException(String message) {
		super(message);
	}

	public AstFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
