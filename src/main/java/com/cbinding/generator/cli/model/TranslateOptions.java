package com.cbinding.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "translate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class TranslateOptions {

	@Parameters(index = "0", paramLabel = "AST_FILE", description = "Declaration tree of the preprocessed header (pycparser JSON)")
	private Path astFile;

	@Option(names = { "--header", "-H" }, description = "Header name for 'cdef extern from' (defaults to the AST file name)")
	private String headerName;

	@Option(names = { "--output", "-o" }, description = "Output .pxd file (defaults to <header>.pxd next to the AST file)")
	private Path outputFile;

	@Option(names = { "--whitelist", "-w" }, description = "Only keep declarations from this source file (repeatable)")
	private List<String> whitelist = new ArrayList<>();

	@Option(names = { "--no-builtin-ignores" }, description = "Keep libc/stdint typedefs that are dropped by default")
	private boolean noBuiltinIgnores;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;

	@Option(names = { "--dry-run" }, description = "Print the .pxd to standard output instead of writing it")
	private boolean dryRun;

	@Option(names = { "--verbose", "-v" }, description = "Enable debug logging")
	private boolean verbose;

}
