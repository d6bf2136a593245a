package com.cbinding.generator.model;

import java.util.List;

import lombok.Value;

/**
 * Root of a parsed header: the ordered top-level declarations.
 */
@Value
public class FileAst {
    List<CNode> ext;

    /**
     * Returns a copy of this tree holding only the given declarations.
     */
    public FileAst withExt(List<CNode> declarations) {
        return new FileAst(List.copyOf(declarations));
    }
}
