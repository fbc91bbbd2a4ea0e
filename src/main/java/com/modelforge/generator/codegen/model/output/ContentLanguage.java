package com.modelforge.generator.codegen.model.output;

/**
 * Content-language tags carried by generated files. The formatter dispatches on these.
 */
public final class ContentLanguage {

    public static final String TYPESCRIPT = "typescript";
    public static final String JAVASCRIPT = "javascript";
    public static final String JSON = "json";
    public static final String SQL = "sql";
    public static final String MARKDOWN = "markdown";
    public static final String YAML = "yaml";
    public static final String DOCKERFILE = "dockerfile";
    public static final String IGNORE = "ignore";
    public static final String ENV = "env";

    private ContentLanguage() {
        // Constants only
    }
}
