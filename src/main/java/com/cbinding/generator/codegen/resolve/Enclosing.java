package com.cbinding.generator.codegen.resolve;

/**
 * What directly encloses the node being resolved. Computed by the parent and
 * passed down, so no node ever inspects its ancestors.
 */
public enum Enclosing {
    /** A top-level declaration. */
    NONE,
    /** Type of a declaration, field or parameter. */
    DECLARATION,
    /** Type of a typedef. */
    TYPEDEF,
    /** Base type of a type declarator. */
    TYPE_DECL,
    /** Base type of a type declarator that is the direct type of a typedef. */
    TYPEDEF_TARGET,
    /** Target of a pointer outside a typedef. */
    POINTER,
    /** Target of a pointer that is the direct type of a typedef. */
    TYPEDEF_POINTER,
    /** Element of an array declarator. */
    ARRAY,
    /** Parameter or return type of a function declarator. */
    FUNCTION;

    public boolean isTypeDecl() {
        return this == TYPE_DECL || this == TYPEDEF_TARGET;
    }
}
