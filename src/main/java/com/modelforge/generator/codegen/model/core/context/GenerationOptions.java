package com.modelforge.generator.codegen.model.core.context;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Generation preferences for one run. Immutable.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class GenerationOptions {

    @Builder.Default
    Framework framework = Framework.EXPRESS;

    @Builder.Default
    DatabaseEngine database = DatabaseEngine.POSTGRESQL;

    @Builder.Default
    AuthStrategy authentication = AuthStrategy.JWT;

    @Builder.Default
    TargetLanguage language = TargetLanguage.TYPESCRIPT;

    @Builder.Default
    boolean includeTests = true;

    @Builder.Default
    boolean includeDocumentation = true;

    public static GenerationOptions defaults() {
        return GenerationOptions.builder().build();
    }
}
