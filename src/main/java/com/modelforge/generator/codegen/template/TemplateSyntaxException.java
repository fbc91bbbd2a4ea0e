package com.modelforge.generator.codegen.template;

/**
 * Raised at registration when a template's block tags do not pair up.
 */
public class TemplateSyntaxException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TemplateSyntaxException(String templateName, String detail) {
        super("Invalid template '" + templateName + "': " + detail);
    }
}
