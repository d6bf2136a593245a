package com.cbinding.generator.codegen.model;

/**
 * Statement keyword that opens a top-level block.
 */
public enum DeclarationStatement {
    /** A plain declaration of a named C type. */
    CDEF("cdef"),
    /** The block is itself the definition of a typedef name. */
    CTYPEDEF("ctypedef");

    private final String keyword;

    DeclarationStatement(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
