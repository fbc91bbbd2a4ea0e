package com.modelforge.generator.codegen.model.output;

import java.util.List;

import com.modelforge.generator.codegen.model.core.context.AuthStrategy;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Resolved authentication configuration of a generated project.
 */
@Value
@Builder(toBuilder = true)
public class AuthConfig {

    @NonNull
    AuthStrategy strategy;

    @NonNull
    @Builder.Default
    List<Role> roles = List.of();

    @NonNull
    @Builder.Default
    List<String> protectedRoutes = List.of();

    public String defaultRoleName() {
        return roles.stream()
                .filter(r -> !"admin".equals(r.getName()))
                .map(Role::getName)
                .findFirst()
                .orElse("user");
    }
}
