package com.cbinding.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of translating one header.
 */
@Data
@Builder
public class TranslationResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;
    private String headerName;
    private String pxd;

    private int declarationsRead;
    private int declarationsTranslated;
    private int topLevelDeclarations;
    private List<String> stdintImports;
    private List<String> warnings;

    public static TranslationResult failure(String errorMessage) {
        return TranslationResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
