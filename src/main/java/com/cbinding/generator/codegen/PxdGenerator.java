package com.cbinding.generator.codegen;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cbinding.generator.codegen.context.ToolDiagnostics;
import com.cbinding.generator.codegen.util.FileWriteUtil;
import com.cbinding.generator.model.FileAst;
import com.cbinding.generator.parser.CAstJsonReader;
import com.cbinding.generator.parser.DeclarationFilter;

/**
 * Produces the .pxd file for one header: reads the declaration tree, filters it,
 * translates it and writes the result.
 */
public class PxdGenerator {
    private static final Logger log = LoggerFactory.getLogger(PxdGenerator.class);

    private static final String JSON_EXTENSION = ".json";
    private static final String HEADER_EXTENSION = ".h";
    private static final String PXD_EXTENSION = ".pxd";

    private final TranslatorConfig config;
    private final CAstJsonReader reader;
    private final HeaderTranslator translator;

    public PxdGenerator(TranslatorConfig config) {
        this(config, new CAstJsonReader(), new HeaderTranslator());
    }

    public PxdGenerator(TranslatorConfig config, CAstJsonReader reader, HeaderTranslator translator) {
        this.config = config;
        this.reader = reader;
        this.translator = translator;
    }

    /**
     * Run the translation. Never throws: every failure is reported through the result.
     */
    public TranslationResult generate() {
        try {
            String headerName = resolveHeaderName(config);
            Path outputPath = resolveOutputFile(config);
            ToolDiagnostics diagnostics = new ToolDiagnostics();

            if (!config.isDryRun() && Files.exists(outputPath) && !config.isForce()) {
                return TranslationResult.failure("Output file already exists: " + outputPath + ". Use --force to overwrite.");
            }

            log.info("Step 1: Reading declaration tree {}", config.getAstFile());
            FileAst ast = reader.read(config.getAstFile());

            log.info("Step 2: Filtering declarations...");
            DeclarationFilter filter = new DeclarationFilter(!config.isSkipBuiltinIgnores(), config.getWhitelist());
            FileAst filtered = filter.apply(ast, diagnostics);
            diagnostics.getInfos().forEach(log::info);

            log.info("Step 3: Translating {} declarations for {}...", filtered.getExt().size(), headerName);
            HeaderTranslation translation = translator.translate(filtered.getExt(), headerName);

            if (config.isDryRun()) {
                log.info("Step 4: Dry run, not writing {}", outputPath);
            } else {
                log.info("Step 4: Writing {}", outputPath);
                FileWriteUtil.safeWriteString(outputPath, translation.getPxd());
            }

            return TranslationResult.builder()
                    .success(true)
                    .outputPath(outputPath)
                    .headerName(headerName)
                    .pxd(translation.getPxd())
                    .declarationsRead(ast.getExt().size())
                    .declarationsTranslated(filtered.getExt().size())
                    .topLevelDeclarations(translation.getTopLevelDeclarations())
                    .stdintImports(translation.getStdintImports())
                    .warnings(List.copyOf(diagnostics.getWarnings()))
                    .build();

        } catch (Exception e) {
            log.error("Translation failed", e);
            return TranslationResult.failure(e.getMessage());
        }
    }

    /**
     * The configured header name, or one derived from the AST file name:
     * {@code foo.h.json} gives {@code foo.h}, {@code foo.json} gives {@code foo.h}.
     */
    public static String resolveHeaderName(TranslatorConfig config) {
        if (config.getHeaderName() != null && !config.getHeaderName().isBlank()) {
            return config.getHeaderName();
        }
        String fileName = config.getAstFile().getFileName().toString();
        if (fileName.endsWith(JSON_EXTENSION)) {
            fileName = fileName.substring(0, fileName.length() - JSON_EXTENSION.length());
        }
        return fileName.indexOf('.') > 0 ? fileName : fileName + HEADER_EXTENSION;
    }

    /**
     * The configured output file, or the header's base name with a .pxd extension next to the AST file.
     */
    public static Path resolveOutputFile(TranslatorConfig config) {
        if (config.getOutputFile() != null) {
            return config.getOutputFile();
        }
        String header = Path.of(resolveHeaderName(config)).getFileName().toString();
        Path parent = config.getAstFile().toAbsolutePath().getParent();
        String pxdName = FileWriteUtil.replaceExtension(header, PXD_EXTENSION);
        return parent != null ? parent.resolve(pxdName) : Path.of(pxdName);
    }
}
