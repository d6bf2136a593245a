package com.cbinding.generator.codegen.model;

import java.util.List;

/**
 * Base class for renderable .pxd declaration fragments.
 */
public abstract class PxdNode {

    /** One indentation level in the generated file. */
    public static final String INDENT = "    ";

    /**
     * Renders this node as text lines; nested bodies are already indented relative to the header line.
     */
    public abstract List<String> lines();

    @Override
    public String toString() {
        return String.join("\n", lines());
    }
}
