package com.modelforge.generator.codegen.generator;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

import com.modelforge.generator.codegen.model.core.context.GenerationContext;
import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.output.AuthConfig;
import com.modelforge.generator.codegen.model.output.CrudOperation;
import com.modelforge.generator.codegen.model.output.Endpoint;
import com.modelforge.generator.codegen.model.output.HttpMethod;
import com.modelforge.generator.codegen.model.output.Role;
import com.modelforge.generator.codegen.util.NamingUtil;

/**
 * Derives the endpoint descriptions of a model.
 *
 * Reads are public. Writes are protected when authentication is enabled and the model requires it; deleting is
 * reserved to {@code admin}. Ids are name-based UUIDs so equal inputs give equal endpoints.
 */
public class EndpointGenerator {

    public static final String ADMIN_ROLE = "admin";

    public List<Endpoint> generate(Model model, GenerationContext context) {
        String base = "/" + NamingUtil.routeSegment(model);
        String item = base + "/:id";
        String name = model.getName();

        boolean protect = context.isAuthEnabled() && model.getMetadata().isRequiresAuth();
        List<String> writeRoles = protect ? writeRoles(model, context.getAuthConfig()) : List.of();
        List<String> deleteRoles = protect ? List.of(ADMIN_ROLE) : List.of();

        return List.of(
                endpoint(name, CrudOperation.CREATE, HttpMethod.POST, base, protect, writeRoles,
                        "Create a new " + name),
                endpoint(name, CrudOperation.READ, HttpMethod.GET, item, false, List.of(),
                        "Get a " + name + " by ID"),
                endpoint(name, CrudOperation.UPDATE, HttpMethod.PUT, item, protect, writeRoles,
                        "Update a " + name + " by ID"),
                endpoint(name, CrudOperation.DELETE, HttpMethod.DELETE, item, protect, deleteRoles,
                        "Delete a " + name + " by ID"),
                endpoint(name, CrudOperation.LIST, HttpMethod.GET, base, false, List.of(),
                        "List all " + name + "s"));
    }

    /**
     * Declared roles of the model when present, otherwise every configured role.
     */
    static List<String> writeRoles(Model model, AuthConfig authConfig) {
        List<String> allowed = model.getMetadata().getAllowedRoles();
        if (allowed != null && !allowed.isEmpty()) {
            return List.copyOf(allowed);
        }
        return authConfig.getRoles().stream().map(Role::getName).toList();
    }

    static Endpoint endpoint(String modelName, CrudOperation operation, HttpMethod method, String path,
                             boolean authenticated, List<String> roles, String description) {
        return Endpoint.builder()
                .id(endpointId(modelName, operation, method, path))
                .path(path)
                .method(method)
                .modelName(modelName)
                .operation(operation)
                .authenticated(authenticated)
                .roles(roles)
                .description(description)
                .build();
    }

    static String endpointId(String modelName, CrudOperation operation, HttpMethod method, String path) {
        String key = modelName + ":" + operation.name() + ":" + method.name() + ":" + path;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
