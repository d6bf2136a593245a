package com.cbinding.generator;

import com.cbinding.generator.cli.TranslateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the C header to Cython .pxd generator.
 * Translates the declaration tree of a preprocessed C header into a
 * {@code cdef extern from} declaration file.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TranslateCommand()).execute(args);
        System.exit(exitCode);
    }
}
