package com.cbinding.generator.codegen;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cbinding.generator.codegen.naming.NamingContext;
import com.cbinding.generator.codegen.resolve.DeclaratorResolver;
import com.cbinding.generator.codegen.resolve.TopLevelAccumulator;
import com.cbinding.generator.codegen.util.StdintImportManager;
import com.cbinding.generator.model.CNode;

/**
 * Translates the (already filtered) top-level declarations of one header into .pxd text.
 *
 * Every call is an independent run with its own naming context, constant table,
 * import set and top-level list, so one instance may serve several headers,
 * including concurrently.
 */
public class HeaderTranslator {

    private static final Logger log = LoggerFactory.getLogger(HeaderTranslator.class);

    private final PxdEmitter emitter;

    public HeaderTranslator() {
        this(new PxdEmitter());
    }

    public HeaderTranslator(PxdEmitter emitter) {
        this.emitter = emitter;
    }

    /**
     * @throws com.cbinding.generator.codegen.exception.DeclaratorShapeException when a declarator
     *         chain has an unsupported shape; no partial output is produced
     */
    public HeaderTranslation translate(List<CNode> declarations, String headerName) {
        TopLevelAccumulator topLevel = new TopLevelAccumulator();
        StdintImportManager stdintImports = new StdintImportManager();
        ConstantTable constants = new ConstantTable();
        DeclaratorResolver resolver = new DeclaratorResolver(new NamingContext(), constants, stdintImports, topLevel);

        for (CNode declaration : declarations) {
            resolver.resolveTopLevel(declaration);
        }
        log.debug("Resolved {} declarations of {} into {} top-level blocks ({} constants)",
                declarations.size(), headerName, topLevel.size(), constants.size());

        String pxd = emitter.emit(headerName, stdintImports.getImports(), topLevel.getNodes());
        return new HeaderTranslation(pxd, stdintImports.getImports(), topLevel.size());
    }
}
