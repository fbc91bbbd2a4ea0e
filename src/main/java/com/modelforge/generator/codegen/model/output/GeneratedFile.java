package com.modelforge.generator.codegen.model.output;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Represents a generated file artifact (relative path + contents).
 *
 * Pure structure only. The path always uses forward slashes and never starts with one.
 */
@Value
@Builder(toBuilder = true)
public class GeneratedFile {

    @NonNull
    String path;

    @NonNull
    String contents;

    @NonNull
    GeneratedFileType type;

    /**
     * Content-language tag, see {@link ContentLanguage}. May be null for plain files.
     */
    String language;

    public static GeneratedFile source(String path, String contents, String language) {
        return GeneratedFile.builder().path(path).contents(contents)
                .type(GeneratedFileType.SOURCE).language(language).build();
    }

    public static GeneratedFile config(String path, String contents, String language) {
        return GeneratedFile.builder().path(path).contents(contents)
                .type(GeneratedFileType.CONFIG).language(language).build();
    }

    public static GeneratedFile documentation(String path, String contents) {
        return GeneratedFile.builder().path(path).contents(contents)
                .type(GeneratedFileType.DOCUMENTATION).language(ContentLanguage.MARKDOWN).build();
    }

    public static GeneratedFile test(String path, String contents) {
        return GeneratedFile.builder().path(path).contents(contents)
                .type(GeneratedFileType.TEST).language(ContentLanguage.TYPESCRIPT).build();
    }
}
