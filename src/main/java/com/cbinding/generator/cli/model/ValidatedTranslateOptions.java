package com.cbinding.generator.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps TranslateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedTranslateOptions {
    Path astFile;
    String headerName;
    Path outputFile;
}
