package com.modelforge.generator.codegen.generator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modelforge.generator.codegen.mapper.FieldTypeMapper;
import com.modelforge.generator.codegen.model.core.context.GenerationContext;
import com.modelforge.generator.codegen.model.input.Field;
import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.output.ContentLanguage;
import com.modelforge.generator.codegen.model.output.CrudOperation;
import com.modelforge.generator.codegen.model.output.Endpoint;
import com.modelforge.generator.codegen.model.output.GeneratedFile;
import com.modelforge.generator.codegen.model.output.GeneratedFileType;
import com.modelforge.generator.codegen.util.JsonSupport;

/**
 * Generates the OpenAPI 3 description of the generated service and a readable endpoint reference.
 */
public class DocumentationGenerator {

    static final String API_TITLE = "Generated API";
    static final String API_VERSION = "1.0.0";
    static final String BEARER_SCHEME = "bearerAuth";

    /**
     * Placeholder description used when documentation is not requested.
     */
    public ObjectNode minimalSpec() {
        ObjectNode components = JsonSupport.object();
        components.set("schemas", JsonSupport.object());
        components.set("securitySchemes", JsonSupport.object());

        ObjectNode api = JsonSupport.object();
        api.put("openapi", "3.0.0");
        api.set("info", info());
        api.set("servers", JsonSupport.array());
        api.set("paths", JsonSupport.object());
        api.set("components", components);
        return api;
    }

    public ObjectNode generateSpec(GenerationContext context, List<Endpoint> endpoints) {
        ObjectNode api = JsonSupport.object();
        api.put("openapi", "3.0.3");
        api.set("info", info());
        ArrayNode servers = JsonSupport.array();
        servers.addObject().put("url", "http://localhost:3000").put("description", "Local development server");
        api.set("servers", servers);

        ObjectNode paths = JsonSupport.object();
        for (Endpoint endpoint : endpoints) {
            String path = toOpenApiPath(endpoint.getPath());
            ObjectNode pathItem = paths.has(path) ? (ObjectNode) paths.get(path) : paths.putObject(path);
            pathItem.set(endpoint.getMethod().name().toLowerCase(Locale.ROOT), operation(endpoint));
        }
        api.set("paths", paths);

        ObjectNode schemas = JsonSupport.object();
        for (Model model : context.getModels()) {
            schemas.set(model.getName(), recordSchema(model));
            schemas.set("Create" + model.getName() + "Request", inputSchema(model, true));
            schemas.set("Update" + model.getName() + "Request", inputSchema(model, false));
        }
        if (context.isAuthEnabled()) {
            schemas.set("RegisterRequest", credentialsSchema(true));
            schemas.set("LoginRequest", credentialsSchema(false));
        }

        ObjectNode securitySchemes = JsonSupport.object();
        if (context.isJwt()) {
            securitySchemes.putObject(BEARER_SCHEME)
                    .put("type", "http")
                    .put("scheme", "bearer")
                    .put("bearerFormat", "JWT");
        }

        ObjectNode components = JsonSupport.object();
        components.set("schemas", schemas);
        components.set("securitySchemes", securitySchemes);
        api.set("components", components);
        return api;
    }

    public List<GeneratedFile> generateFiles(GenerationContext context, List<Endpoint> endpoints, ObjectNode api) {
        return List.of(
                GeneratedFile.builder()
                        .path("docs/openapi.json")
                        .contents(JsonSupport.print(api) + "\n")
                        .type(GeneratedFileType.DOCUMENTATION)
                        .language(ContentLanguage.JSON)
                        .build(),
                GeneratedFile.documentation("docs/API.md", generateMarkdown(context, endpoints)));
    }

    private ObjectNode info() {
        ObjectNode info = JsonSupport.object();
        info.put("title", API_TITLE);
        info.put("version", API_VERSION);
        info.put("description", "REST API generated from the data model");
        return info;
    }

    private ObjectNode operation(Endpoint endpoint) {
        ObjectNode operation = JsonSupport.object();
        operation.put("summary", endpoint.getDescription());
        operation.put("operationId", operationId(endpoint));
        operation.set("tags", JsonSupport.array().add(endpoint.getModelName()));

        if (endpoint.getPath().endsWith("/:id")) {
            ObjectNode parameter = operation.putArray("parameters").addObject();
            parameter.put("name", "id").put("in", "path").put("required", true);
            parameter.putObject("schema").put("type", "string");
        }

        String requestSchema = requestSchema(endpoint);
        if (requestSchema != null) {
            ObjectNode body = operation.putObject("requestBody");
            body.put("required", true);
            body.putObject("content").putObject("application/json").putObject("schema")
                    .put("$ref", "#/components/schemas/" + requestSchema);
        }

        ObjectNode responses = operation.putObject("responses");
        responses.set(successStatus(endpoint), response(successDescription(endpoint)));
        if (requestSchema != null) {
            responses.set("400", response("Validation failed"));
        }
        if (endpoint.getPath().endsWith("/:id")) {
            responses.set("404", response(endpoint.getModelName() + " not found"));
        }
        if (endpoint.isAuthenticated()) {
            responses.set("401", response("Authentication required"));
            responses.set("403", response("Insufficient permissions"));
            operation.putArray("security").addObject().set(BEARER_SCHEME, JsonSupport.array());
        }
        return operation;
    }

    private static String requestSchema(Endpoint endpoint) {
        if (AuthGenerator.AUTH_MODEL_NAME.equals(endpoint.getModelName())) {
            return endpoint.getPath().endsWith("/register") ? "RegisterRequest" : "LoginRequest";
        }
        return switch (endpoint.getOperation()) {
            case CREATE -> "Create" + endpoint.getModelName() + "Request";
            case UPDATE -> "Update" + endpoint.getModelName() + "Request";
            default -> null;
        };
    }

    private static String successStatus(Endpoint endpoint) {
        if (AuthGenerator.AUTH_MODEL_NAME.equals(endpoint.getModelName())) {
            return endpoint.getPath().endsWith("/register") ? "201" : "200";
        }
        return switch (endpoint.getOperation()) {
            case CREATE -> "201";
            case DELETE -> "204";
            default -> "200";
        };
    }

    private static String successDescription(Endpoint endpoint) {
        if (AuthGenerator.AUTH_MODEL_NAME.equals(endpoint.getModelName())) {
            return "Authenticated session";
        }
        Map<CrudOperation, String> descriptions = Map.of(
                CrudOperation.CREATE, endpoint.getModelName() + " created",
                CrudOperation.READ, endpoint.getModelName() + " found",
                CrudOperation.UPDATE, endpoint.getModelName() + " updated",
                CrudOperation.DELETE, endpoint.getModelName() + " deleted",
                CrudOperation.LIST, "Page of " + endpoint.getModelName() + " records");
        return descriptions.get(endpoint.getOperation());
    }

    private static String operationId(Endpoint endpoint) {
        if (AuthGenerator.AUTH_MODEL_NAME.equals(endpoint.getModelName())) {
            return endpoint.getPath().substring(endpoint.getPath().lastIndexOf('/') + 1);
        }
        return endpoint.getOperation().getWireValue() + endpoint.getModelName();
    }

    private static ObjectNode response(String description) {
        ObjectNode response = JsonSupport.object();
        response.put("description", description);
        return response;
    }

    private ObjectNode recordSchema(Model model) {
        ObjectNode schema = JsonSupport.object();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        ArrayNode required = JsonSupport.array().add("id");
        properties.putObject("id").put("type", "string").put("format", "uuid");
        for (Field field : model.dataFields()) {
            properties.set(field.getName(), fieldSchema(field));
            if (field.isRequired()) {
                required.add(field.getName());
            }
        }
        if (model.getMetadata().isTimestamps()) {
            properties.putObject("createdAt").put("type", "string").put("format", "date-time");
            properties.putObject("updatedAt").put("type", "string").put("format", "date-time");
            required.add("createdAt").add("updatedAt");
        }
        schema.set("required", required);
        if (model.getMetadata().getDescription() != null) {
            schema.put("description", model.getMetadata().getDescription());
        }
        return schema;
    }

    private ObjectNode inputSchema(Model model, boolean create) {
        ObjectNode schema = JsonSupport.object();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        ArrayNode required = JsonSupport.array();
        for (Field field : model.dataFields()) {
            properties.set(field.getName(), fieldSchema(field));
            if (create && field.isRequired()) {
                required.add(field.getName());
            }
        }
        if (!required.isEmpty()) {
            schema.set("required", required);
        }
        return schema;
    }

    private ObjectNode fieldSchema(Field field) {
        ObjectNode schema = FieldTypeMapper.toOpenApiSchema(field.getType());
        if (field.getDescription() != null) {
            schema.put("description", field.getDescription());
        }
        if (field.getDefaultValue() != null) {
            schema.set("default", JsonSupport.mapper().valueToTree(field.getDefaultValue()));
        }
        return schema;
    }

    private ObjectNode credentialsSchema(boolean register) {
        ObjectNode schema = JsonSupport.object();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        properties.putObject("email").put("type", "string").put("format", "email");
        properties.putObject("password").put("type", "string").put("minLength", register ? 8 : 1);
        ArrayNode required = JsonSupport.array().add("email").add("password");
        if (register) {
            properties.putObject("name").put("type", "string");
            required.add("name");
        }
        schema.set("required", required);
        return schema;
    }

    String generateMarkdown(GenerationContext context, List<Endpoint> endpoints) {
        StringBuilder md = new StringBuilder();
        md.append("# API Reference\n\n");
        md.append("Base URL: `http://localhost:3000`\n\n");
        if (context.isJwt()) {
            md.append("Protected endpoints expect an `Authorization: Bearer <token>` header. ")
                    .append("Obtain a token from `POST /auth/login`.\n\n");
        }

        Map<String, List<Endpoint>> byModel = endpoints.stream()
                .collect(Collectors.groupingBy(Endpoint::getModelName, LinkedHashMap::new,
                        Collectors.toList()));
        if (byModel.isEmpty()) {
            md.append("No endpoints are defined.\n");
        }
        byModel.forEach((modelName, modelEndpoints) -> {
            md.append("## ").append(modelName).append("\n\n");
            md.append("| Method | Path | Description | Auth |\n");
            md.append("|---|---|---|---|\n");
            for (Endpoint endpoint : modelEndpoints) {
                md.append("| ").append(endpoint.getMethod().name())
                        .append(" | `").append(endpoint.getPath()).append('`')
                        .append(" | ").append(endpoint.getDescription())
                        .append(" | ").append(authColumn(endpoint))
                        .append(" |\n");
            }
            md.append('\n');
        });
        return md.toString();
    }

    private static String authColumn(Endpoint endpoint) {
        if (!endpoint.isAuthenticated()) {
            return "public";
        }
        return endpoint.getRoles().isEmpty() ? "token" : String.join(", ", endpoint.getRoles());
    }

    static String toOpenApiPath(String expressPath) {
        return expressPath.replaceAll(":(\\w+)", "{$1}");
    }
}
