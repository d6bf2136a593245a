package com.cbinding.generator.model;

/**
 * Visitor over the C declaration AST. One method per node kind.
 *
 * @param <R> result type
 * @param <A> argument threaded down by the caller
 */
public interface CNodeVisitor<R, A> {
    R visit(Decl decl, A arg);
    R visit(Typedef typedef, A arg);
    R visit(TypeDecl typeDecl, A arg);
    R visit(PtrDecl ptrDecl, A arg);
    R visit(ArrayDecl arrayDecl, A arg);
    R visit(FuncDecl funcDecl, A arg);
    R visit(IdentifierType identifierType, A arg);
    R visit(Struct struct, A arg);
    R visit(Union union, A arg);
    R visit(EnumSpec enumSpec, A arg);
    R visit(EllipsisParam ellipsisParam, A arg);
}
