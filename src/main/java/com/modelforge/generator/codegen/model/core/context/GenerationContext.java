package com.modelforge.generator.codegen.model.core.context;

import java.util.List;

import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.output.AuthConfig;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Read-only inputs shared by every artifact generator of one run.
 */
@Getter
@Builder(toBuilder = true)
public final class GenerationContext {

    @NonNull
    private final GenerationOptions options;

    @NonNull
    private final List<Model> models;

    @NonNull
    private final AuthConfig authConfig;

    public DatabaseEngine getDatabase() {
        return options.getDatabase();
    }

    public boolean isAuthEnabled() {
        return options.getAuthentication().isEnabled();
    }

    public boolean isJwt() {
        return options.getAuthentication() == AuthStrategy.JWT;
    }

    public boolean isTypeScript() {
        return options.getLanguage() == TargetLanguage.TYPESCRIPT;
    }
}
