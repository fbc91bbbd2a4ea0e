package com.modelforge.generator.export;

/**
 * Raised when a packaging template cannot be loaded or rendered.
 */
public class ExportTemplateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ExportTemplateException(String templateName, Throwable cause) {
        super("Failed to render export template '" + templateName + "': " + cause.getMessage(), cause);
    }
}
