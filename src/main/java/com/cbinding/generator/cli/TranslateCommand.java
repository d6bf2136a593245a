package com.cbinding.generator.cli;

import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cbinding.generator.cli.exception.OptionsValidationException;
import com.cbinding.generator.cli.model.TranslateOptions;
import com.cbinding.generator.cli.model.ValidatedTranslateOptions;
import com.cbinding.generator.cli.output.TranslateResultsPrinter;
import com.cbinding.generator.cli.validation.TranslateOptionsValidator;
import com.cbinding.generator.codegen.PxdGenerator;
import com.cbinding.generator.codegen.TranslationResult;
import com.cbinding.generator.codegen.TranslatorConfig;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command translating a C header's declaration tree into a Cython .pxd file.
 */
@Command(
        name = "translate",
        mixinStandardHelpOptions = true,
        version = "pxd-generator 1.0.0",
        description = "Generates a Cython 'cdef extern from' declaration file from the declaration tree of a preprocessed C header."
)
public class TranslateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TranslateCommand.class);
    private static final String PROJECT_LOGGER = "com.cbinding.generator";

    @Mixin
    private TranslateOptions options;

    private final TranslateOptionsValidator validator = new TranslateOptionsValidator();
    private final TranslateResultsPrinter printer = new TranslateResultsPrinter();

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            enableDebugLogging();
        }

        ValidatedTranslateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(err -> log.error("{}", err));
            return 1;
        }

        printer.printBanner(options, validated);

        TranslatorConfig config = TranslatorConfig.builder()
                .astFile(validated.getAstFile())
                .headerName(validated.getHeaderName())
                .outputFile(validated.getOutputFile())
                .whitelist(List.copyOf(options.getWhitelist()))
                .skipBuiltinIgnores(options.isNoBuiltinIgnores())
                .force(options.isForce())
                .dryRun(options.isDryRun())
                .build();

        TranslationResult result = new PxdGenerator(config).generate();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }

        if (options.isDryRun()) {
            System.out.print(result.getPxd());
            System.out.flush();
        }
        printer.printSuccess(options, result);
        return 0;
    }

    private static void enableDebugLogging() {
        Logger projectLogger = LoggerFactory.getLogger(PROJECT_LOGGER);
        if (projectLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(Level.DEBUG);
        } else {
            log.warn("--verbose has no effect: logging backend is not Logback");
        }
    }
}
