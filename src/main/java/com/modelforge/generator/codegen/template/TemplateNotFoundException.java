package com.modelforge.generator.codegen.template;

/**
 * Raised when rendering a template name that was never registered.
 */
public class TemplateNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String templateName;

    public TemplateNotFoundException(String templateName) {
        super("Template '" + templateName + "' not found");
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }
}
