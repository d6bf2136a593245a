package com.cbinding.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.cbinding.generator.cli.exception.OptionsValidationException;
import com.cbinding.generator.cli.model.TranslateOptions;
import com.cbinding.generator.cli.model.ValidatedTranslateOptions;
import com.cbinding.generator.codegen.PxdGenerator;
import com.cbinding.generator.codegen.TranslatorConfig;

public class TranslateOptionsValidator {

	public ValidatedTranslateOptions validate(TranslateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getAstFile() == null) {
			errors.add("The declaration tree file is required.");
		} else if (!Files.isRegularFile(o.getAstFile())) {
			errors.add("Declaration tree file does not exist or is not a file: " + o.getAstFile());
		}

		if (o.getHeaderName() != null && o.getHeaderName().isBlank()) {
			errors.add("Header name must not be blank (--header / -H).");
		}
		if (o.getHeaderName() != null && o.getHeaderName().contains("\"")) {
			errors.add("Header name must not contain a double quote: " + o.getHeaderName());
		}

		for (String entry : o.getWhitelist()) {
			if (isBlank(entry)) {
				errors.add("Whitelist entries must not be blank (--whitelist / -w).");
				break;
			}
		}

		if (o.getOutputFile() != null && Files.isDirectory(o.getOutputFile())) {
			errors.add("Output path is a directory: " + o.getOutputFile());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		TranslatorConfig derived = TranslatorConfig.builder()
				.astFile(o.getAstFile())
				.headerName(o.getHeaderName())
				.outputFile(o.getOutputFile())
				.build();
		String headerName = PxdGenerator.resolveHeaderName(derived);
		Path outputFile = PxdGenerator.resolveOutputFile(derived).toAbsolutePath().normalize();

		if (!o.isDryRun() && Files.exists(outputFile) && !o.isForce()) {
			throw new OptionsValidationException(
					List.of("Output file already exists: " + outputFile + ". Use --force to overwrite."));
		}

		return new ValidatedTranslateOptions(o.getAstFile(), headerName, outputFile);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
