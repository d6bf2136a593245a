package com.cbinding.generator.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cbinding.generator.cli.model.TranslateOptions;
import com.cbinding.generator.cli.model.ValidatedTranslateOptions;
import com.cbinding.generator.codegen.TranslationResult;

/**
 * Responsible only for printing CLI output for the "translate" command.
 * No validation, no execution.
 */
public class TranslateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(TranslateResultsPrinter.class);

    public void printBanner(TranslateOptions o, ValidatedTranslateOptions v) {
        log.info("=================================================");
        log.info("C Header to Cython .pxd Generator");
        log.info("=================================================");
        log.info("Declaration Tree: {}", v.getAstFile().toAbsolutePath());
        log.info("Header Name: {}", v.getHeaderName());
        log.info("Output File: {}", o.isDryRun() ? "None (dry run)" : v.getOutputFile());
        log.info("Whitelist: {}", o.getWhitelist().isEmpty() ? "None" : String.join(", ", o.getWhitelist()));
        log.info("Built-in Ignores: {}", o.isNoBuiltinIgnores() ? "disabled" : "enabled");
        log.info("=================================================");
    }

    public void printSuccess(TranslateOptions o, TranslationResult result) {
        log.info("");
        log.info("=================================================");
        log.info("TRANSLATION SUCCESSFUL");
        log.info("=================================================");
        if (!o.isDryRun()) {
            log.info("Output Path: {}", result.getOutputPath());
        }
        log.info("Declarations Read: {}", result.getDeclarationsRead());
        log.info("Declarations Translated: {}", result.getDeclarationsTranslated());
        log.info("Top-level Blocks: {}", result.getTopLevelDeclarations());
        if (result.getStdintImports() != null && !result.getStdintImports().isEmpty()) {
            log.info("stdint Imports: {}", String.join(", ", result.getStdintImports()));
        }
        if (result.getWarnings() != null) {
            result.getWarnings().forEach(w -> log.warn("Warning: {}", w));
        }
        log.info("=================================================");
    }

    public void printFailure(TranslationResult result) {
        log.error("Translation failed: {}", result.getErrorMessage());
    }
}
