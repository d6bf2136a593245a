package com.cbinding.generator.codegen;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.cbinding.generator.codegen.exception.PxdRenderException;
import com.cbinding.generator.codegen.model.PxdNode;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Lays out the final .pxd document: the consolidated stdint import, the
 * {@code cdef extern from} header and one indented block per top-level node,
 * each preceded by a blank line.
 */
public class PxdEmitter {

    private static final String TEMPLATE_NAME = "pxd.ftl";

    private final Configuration freemarkerConfig;

    public PxdEmitter() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String emit(String headerName, List<String> stdintImports, List<PxdNode> topLevel) {
        List<List<String>> blocks = new ArrayList<>();
        for (PxdNode node : topLevel) {
            List<String> lines = new ArrayList<>();
            for (String line : node.lines()) {
                lines.add(PxdNode.INDENT + line);
            }
            blocks.add(lines);
        }

        Map<String, Object> model = new HashMap<>();
        model.put("headerName", headerName);
        model.put("cimports", stdintImports);
        model.put("blocks", blocks);

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new PxdRenderException("Failed to render .pxd for " + headerName, e);
        }
    }
}
