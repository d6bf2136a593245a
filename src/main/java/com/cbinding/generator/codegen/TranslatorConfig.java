package com.cbinding.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for translating one header.
 */
@Data
@Builder
public class TranslatorConfig {

    /**
     * JSON AST of the preprocessed header (pycparser {@code c_json} layout).
     */
    private Path astFile;

    /**
     * Header name written into {@code cdef extern from "..."}.
     * Derived from the AST file name when not set.
     */
    private String headerName;

    /**
     * Output .pxd file. Defaults to the header's base name with a .pxd extension,
     * next to the AST file.
     */
    private Path outputFile;

    /**
     * Source files whose declarations are kept; empty keeps everything.
     */
    @Builder.Default
    private List<String> whitelist = List.of();

    /**
     * Keep declarations the built-in ignore list would drop.
     */
    private boolean skipBuiltinIgnores;

    /**
     * Overwrite an existing output file.
     */
    private boolean force;

    /**
     * Translate without writing the output file.
     */
    private boolean dryRun;
}
