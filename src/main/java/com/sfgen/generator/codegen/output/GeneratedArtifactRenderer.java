package com.sfgen.generator.codegen.output;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

import com.sfgen.generator.codegen.model.GenerationResult;
import com.sfgen.generator.codegen.model.GoGenerateEnvironment;
import com.sfgen.generator.codegen.model.ImportReference;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Wraps generated declarations into a complete Go source file.
 */
public class GeneratedArtifactRenderer {

    static final String TEMPLATE_NAME = "generated_file.ftl";

    private final Configuration freemarkerConfig;

    public GeneratedArtifactRenderer() {
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

    public String render(GenerationResult result, GoGenerateEnvironment environment) throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("sourceLine", environment.isInvokedByGoGenerate()
                ? "// Source " + environment.directiveLocation()
                : "");
        model.put("packageName", result.getOutputPackage());
        model.put("imports", result.getRequiredReferences().stream().map(ImportReference::toImportSpec).toList());
        model.put("body", result.getTextFragment().stripTrailing());

        Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("failed to render " + result.getOutputTarget() + ": " + e.getMessage(), e);
        }
        return out.toString();
    }
}
