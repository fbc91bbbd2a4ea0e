package com.modelforge.generator.export;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the FreeMarker templates under {@code /templates/export} on the classpath.
 */
public class ExportTemplateRenderer {

    private static final Logger log = LoggerFactory.getLogger(ExportTemplateRenderer.class);

    static final String TEMPLATE_ROOT = "/templates/export";

    private final Configuration freemarkerConfig;

    public ExportTemplateRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), TEMPLATE_ROOT);
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(String templateName, Map<String, Object> model) {
        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            StringWriter out = new StringWriter();
            template.process(model, out);
            log.debug("Rendered export template {}", templateName);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new ExportTemplateException(templateName, e);
        }
    }
}
