package com.modelforge.generator.codegen.format;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.modelforge.generator.codegen.model.output.ContentLanguage;
import com.modelforge.generator.codegen.model.output.GeneratedFile;
import com.modelforge.generator.codegen.util.JsonSupport;

/**
 * Normalizes the layout of generated files and runs a shallow syntax smoke test on them.
 *
 * Formatting dispatches on the content-language tag; files with other tags come back unchanged. Every formatted
 * file ends up without trailing whitespace and with exactly one trailing newline. Formatting never fails: a JSON
 * file that does not parse is returned as it was.
 */
public class CodeFormatter {

    private static final Logger log = LoggerFactory.getLogger(CodeFormatter.class);

    private static final Pattern BLANK_RUN = Pattern.compile("\\n[ \\t]*\\n(?:[ \\t]*\\n)+");
    private static final Pattern TRAILING_WHITESPACE = Pattern.compile("[ \\t]+$", Pattern.MULTILINE);
    private static final Pattern HEADING = Pattern.compile("^(#{1,6})[ \\t]*(\\S.*)$", Pattern.MULTILINE);
    private static final Pattern LINE_COMMENT = Pattern.compile("--[^\\n]*");
    private static final Pattern QUOTED = Pattern.compile("'(?:[^']|'')*'");
    private static final Pattern DOLLAR_BODY = Pattern.compile("\\$\\$.*?\\$\\$", Pattern.DOTALL);

    private final FormattingOptions defaultOptions;

    public CodeFormatter() {
        this(FormattingOptions.defaults());
    }

    public CodeFormatter(FormattingOptions defaultOptions) {
        this.defaultOptions = defaultOptions;
    }

    public GeneratedFile formatFile(GeneratedFile file) {
        return formatFile(file, defaultOptions);
    }

    public GeneratedFile formatFile(GeneratedFile file, FormattingOptions options) {
        FormattingOptions effective = options == null ? defaultOptions : options;
        String language = file.getLanguage();
        if (language == null) {
            return file;
        }
        String contents = normalizeLineEndings(file.getContents());
        String formatted = switch (language) {
            case ContentLanguage.TYPESCRIPT, ContentLanguage.JAVASCRIPT -> formatSource(contents, effective);
            case ContentLanguage.JSON -> formatJson(file.getPath(), contents, effective);
            case ContentLanguage.SQL -> new SqlLayout(effective.indentUnit()).format(contents);
            case ContentLanguage.MARKDOWN -> formatMarkdown(contents);
            default -> null;
        };
        if (formatted == null) {
            return file;
        }
        return file.toBuilder().contents(finish(formatted)).build();
    }

    public List<GeneratedFile> formatFiles(List<GeneratedFile> files) {
        return formatFiles(files, defaultOptions);
    }

    public List<GeneratedFile> formatFiles(List<GeneratedFile> files, FormattingOptions options) {
        List<GeneratedFile> formatted = files.stream().map(f -> formatFile(f, options)).toList();
        log.debug("Formatted {} file(s)", formatted.size());
        return formatted;
    }

    private String formatSource(String contents, FormattingOptions options) {
        String collapsed = collapseBlankLines(contents);
        return new SourceReindenter(options.indentUnit()).reindent(collapsed);
    }

    private String formatJson(String path, String contents, FormattingOptions options) {
        try {
            JsonNode node = JsonSupport.parse(contents);
            if (node == null || node.isMissingNode()) {
                log.warn("Leaving {} unformatted: no JSON document", path);
                return contents;
            }
            return JsonSupport.print(node, options.indentUnit());
        } catch (JsonProcessingException e) {
            log.warn("Leaving {} unformatted: {}", path, e.getOriginalMessage());
            return contents;
        }
    }

    private String formatMarkdown(String contents) {
        String[] lines = contents.split("\n", -1);
        boolean inFence = false;
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].strip().startsWith("```")) {
                inFence = !inFence;
            } else if (!inFence) {
                lines[i] = HEADING.matcher(lines[i]).replaceAll("$1 $2");
            }
        }
        return collapseBlankLines(String.join("\n", lines));
    }

    /**
     * Shallow check that catches gross corruption only.
     */
    public CodeValidationResult validateCode(GeneratedFile file) {
        String language = file.getLanguage();
        if (language == null) {
            return CodeValidationResult.ok();
        }
        return switch (language) {
            case ContentLanguage.TYPESCRIPT, ContentLanguage.JAVASCRIPT -> validateSource(file.getContents());
            case ContentLanguage.JSON -> validateJson(file.getContents());
            case ContentLanguage.SQL -> validateSql(file.getContents());
            default -> CodeValidationResult.ok();
        };
    }

    private CodeValidationResult validateSource(String contents) {
        List<String> errors = new ArrayList<>();
        if (count(contents, '{') != count(contents, '}')) {
            errors.add("Mismatched braces");
        }
        if (count(contents, '(') != count(contents, ')')) {
            errors.add("Mismatched parentheses");
        }
        if (count(contents, '[') != count(contents, ']')) {
            errors.add("Mismatched brackets");
        }
        return CodeValidationResult.of(errors);
    }

    private CodeValidationResult validateJson(String contents) {
        try {
            JsonNode node = JsonSupport.parse(contents);
            if (node == null || node.isMissingNode()) {
                return CodeValidationResult.of(List.of("No JSON document"));
            }
            return CodeValidationResult.ok();
        } catch (JsonProcessingException e) {
            return CodeValidationResult.of(List.of(e.getOriginalMessage()));
        }
    }

    private CodeValidationResult validateSql(String contents) {
        String stripped = DOLLAR_BODY.matcher(contents).replaceAll(" ");
        stripped = QUOTED.matcher(stripped).replaceAll("''");
        stripped = LINE_COMMENT.matcher(stripped).replaceAll("");
        List<String> errors = new ArrayList<>();
        for (String statement : stripped.split(";")) {
            String trimmed = statement.strip();
            if (!trimmed.isEmpty() && !SqlLayout.STATEMENT_START.matcher(trimmed).find()) {
                String excerpt = trimmed.length() > 50 ? trimmed.substring(0, 50) + "..." : trimmed;
                errors.add("Invalid SQL statement: " + excerpt);
            }
        }
        return CodeValidationResult.of(errors);
    }

    private static long count(String contents, char c) {
        return contents.chars().filter(ch -> ch == c).count();
    }

    private static String normalizeLineEndings(String contents) {
        return contents.replace("\r\n", "\n");
    }

    /**
     * Runs of two or more blank lines become a single blank line.
     */
    static String collapseBlankLines(String contents) {
        return BLANK_RUN.matcher(contents).replaceAll("\n\n");
    }

    /**
     * Strips trailing whitespace per line and leaves exactly one trailing newline.
     */
    static String finish(String contents) {
        String stripped = TRAILING_WHITESPACE.matcher(contents).replaceAll("");
        return stripped.stripTrailing() + "\n";
    }
}
