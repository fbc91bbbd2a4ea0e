package com.modelforge.generator.codegen;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modelforge.generator.codegen.exception.UnsupportedOptionException;
import com.modelforge.generator.codegen.generator.ApiControllerGenerator;
import com.modelforge.generator.codegen.generator.ApplicationGenerator;
import com.modelforge.generator.codegen.generator.AuthGenerator;
import com.modelforge.generator.codegen.generator.DocumentationGenerator;
import com.modelforge.generator.codegen.generator.EndpointGenerator;
import com.modelforge.generator.codegen.generator.MiddlewareGenerator;
import com.modelforge.generator.codegen.generator.ModelGenerator;
import com.modelforge.generator.codegen.generator.RepositoryGenerator;
import com.modelforge.generator.codegen.generator.RouteGenerator;
import com.modelforge.generator.codegen.generator.ScaffoldGenerator;
import com.modelforge.generator.codegen.generator.SchemaGenerator;
import com.modelforge.generator.codegen.generator.ServiceGenerator;
import com.modelforge.generator.codegen.generator.TestGenerator;
import com.modelforge.generator.codegen.generator.ValidationGenerator;
import com.modelforge.generator.codegen.model.core.context.GenerationContext;
import com.modelforge.generator.codegen.model.core.context.GenerationOptions;
import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.output.AuthConfig;
import com.modelforge.generator.codegen.model.output.Endpoint;
import com.modelforge.generator.codegen.model.output.GeneratedFile;
import com.modelforge.generator.codegen.model.output.GeneratedProject;
import com.modelforge.generator.codegen.model.output.Role;
import com.modelforge.generator.codegen.template.TemplateEngine;
import com.modelforge.generator.codegen.util.NamingUtil;

/**
 * Turns a validated model set and generation options into a complete backend project.
 *
 * The models are expected to have passed validation; they are not re-validated here. Apart from the run id and
 * the timestamps, equal inputs always produce equal files, endpoints and API description.
 */
public class CodeGenerationService {

    private static final Logger log = LoggerFactory.getLogger(CodeGenerationService.class);

    static final String PROJECT_NAME_PREFIX = "generated-api-";

    private final Clock clock;
    private final Supplier<String> idSupplier;

    private final ScaffoldGenerator scaffoldGenerator;
    private final ModelGenerator modelGenerator;
    private final SchemaGenerator schemaGenerator;
    private final EndpointGenerator endpointGenerator;
    private final ApiControllerGenerator controllerGenerator;
    private final ServiceGenerator serviceGenerator;
    private final RepositoryGenerator repositoryGenerator;
    private final RouteGenerator routeGenerator;
    private final ValidationGenerator validationGenerator;
    private final TestGenerator testGenerator;
    private final AuthGenerator authGenerator;
    private final MiddlewareGenerator middlewareGenerator;
    private final ApplicationGenerator applicationGenerator;
    private final DocumentationGenerator documentationGenerator;

    public CodeGenerationService() {
        this(new TemplateEngine());
    }

    public CodeGenerationService(TemplateEngine templateEngine) {
        this(templateEngine, Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    public CodeGenerationService(TemplateEngine templateEngine, Clock clock, Supplier<String> idSupplier) {
        this.clock = clock;
        this.idSupplier = idSupplier;
        this.scaffoldGenerator = new ScaffoldGenerator();
        this.modelGenerator = new ModelGenerator(templateEngine);
        this.schemaGenerator = new SchemaGenerator(templateEngine);
        this.endpointGenerator = new EndpointGenerator();
        this.controllerGenerator = new ApiControllerGenerator(templateEngine);
        this.serviceGenerator = new ServiceGenerator();
        this.repositoryGenerator = new RepositoryGenerator();
        this.routeGenerator = new RouteGenerator();
        this.validationGenerator = new ValidationGenerator();
        this.testGenerator = new TestGenerator();
        this.authGenerator = new AuthGenerator();
        this.middlewareGenerator = new MiddlewareGenerator();
        this.applicationGenerator = new ApplicationGenerator();
        this.documentationGenerator = new DocumentationGenerator();
    }

    /**
     * Generates the project.
     *
     * @throws UnsupportedOptionException when an option is missing or has no emitter, or a model name clashes with
     *         the authentication artifacts, before anything is emitted
     */
    public GeneratedProject generateProject(List<Model> models, GenerationOptions options) {
        checkOptions(options);
        List<Model> safeModels = models == null ? List.of() : List.copyOf(models);
        checkReservedNames(safeModels, options);

        Instant now = clock.instant();
        String projectId = idSupplier.get();
        String projectName = PROJECT_NAME_PREFIX + now.toEpochMilli();
        log.info("Generating project {} for {} model(s)", projectName, safeModels.size());

        GenerationContext context = GenerationContext.builder()
                .options(options)
                .models(safeModels)
                .authConfig(authConfig(options))
                .build();

        List<GeneratedFile> files = new ArrayList<>();
        List<Endpoint> endpoints = new ArrayList<>();

        // Step 1: Project scaffold
        log.info("Step 1: Generating project scaffold...");
        files.addAll(scaffoldGenerator.generate(context));

        // Step 2: Records and table definitions
        log.info("Step 2: Generating model records...");
        for (Model model : safeModels) {
            files.add(modelGenerator.generate(model));
            if (context.getDatabase().isRelational()) {
                files.add(schemaGenerator.generate(model, context.getDatabase()));
            }
        }

        // Step 3: Authentication
        if (context.isAuthEnabled()) {
            log.info("Step 3: Generating authentication ({})...", options.getAuthentication().getWireValue());
            files.addAll(authGenerator.generate(context));
            endpoints.addAll(authGenerator.endpoints());
        } else {
            log.info("Step 3: Authentication disabled, skipping");
        }

        // Step 4: CRUD slices
        log.info("Step 4: Generating CRUD operations...");
        for (Model model : safeModels) {
            List<Endpoint> modelEndpoints = endpointGenerator.generate(model, context);
            endpoints.addAll(modelEndpoints);
            files.add(controllerGenerator.generate(model));
            files.add(serviceGenerator.generate(model));
            files.add(repositoryGenerator.generate(model, context.getDatabase()));
            files.add(routeGenerator.generate(model, modelEndpoints, context));
            files.add(validationGenerator.generate(model));
            if (options.isIncludeTests()) {
                files.add(testGenerator.generate(model, modelEndpoints));
            }
            log.debug("Generated CRUD slice for {}", model.getName());
        }

        // Step 5: Middleware
        log.info("Step 5: Generating middleware...");
        files.addAll(middlewareGenerator.generate());

        // Step 6: Application entry point
        log.info("Step 6: Generating application entry point...");
        files.add(applicationGenerator.generate(context));

        // Step 7: API description
        ObjectNode apiSpec;
        if (options.isIncludeDocumentation()) {
            log.info("Step 7: Generating API documentation...");
            apiSpec = documentationGenerator.generateSpec(context, endpoints);
            files.addAll(documentationGenerator.generateFiles(context, endpoints, apiSpec));
        } else {
            log.info("Step 7: Documentation disabled, using minimal API description");
            apiSpec = documentationGenerator.minimalSpec();
        }

        AuthConfig authConfig = context.getAuthConfig().toBuilder()
                .protectedRoutes(endpoints.stream()
                        .filter(Endpoint::isAuthenticated)
                        .map(e -> e.getMethod().name() + " " + e.getPath())
                        .toList())
                .build();

        log.info("Project generation complete: {} file(s), {} endpoint(s)", files.size(), endpoints.size());

        return GeneratedProject.builder()
                .id(projectId)
                .name(projectName)
                .models(safeModels)
                .endpoints(List.copyOf(endpoints))
                .authConfig(authConfig)
                .files(List.copyOf(files))
                .apiSpec(apiSpec)
                .generationOptions(options)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Rejects options with no emitter behind them.
     */
    static void checkOptions(GenerationOptions options) {
        if (options == null) {
            throw new UnsupportedOptionException("options", "null", "generation options are required");
        }
        if (options.getFramework() == null) {
            throw new UnsupportedOptionException("framework", "null", "a framework is required");
        }
        if (!options.getFramework().isEmitterAvailable()) {
            throw new UnsupportedOptionException("framework", options.getFramework().getWireValue(),
                    "only express is generated");
        }
        if (options.getDatabase() == null) {
            throw new UnsupportedOptionException("database", "null", "a database is required");
        }
        if (options.getAuthentication() == null) {
            throw new UnsupportedOptionException("authentication", "null", "an authentication strategy is required");
        }
        if (!options.getAuthentication().isEmitterAvailable()) {
            throw new UnsupportedOptionException("authentication", options.getAuthentication().getWireValue(),
                    "only none and jwt are generated");
        }
        if (options.getLanguage() == null) {
            throw new UnsupportedOptionException("language", "null", "a language is required");
        }
        if (!options.getLanguage().isEmitterAvailable()) {
            throw new UnsupportedOptionException("language", options.getLanguage().getWireValue(),
                    "only typescript is generated");
        }
    }

    /**
     * With authentication on, the auth router owns {@code /auth} and the accounts table. A model landing on either
     * cannot be generated alongside it.
     */
    static void checkReservedNames(List<Model> models, GenerationOptions options) {
        if (!options.getAuthentication().isEnabled()) {
            return;
        }
        String strategy = options.getAuthentication().getWireValue();
        for (Model model : models) {
            if (AuthGenerator.ROUTE_SEGMENT.equals(NamingUtil.routeSegment(model))) {
                throw new UnsupportedOptionException("authentication", strategy, "model '" + model.getName()
                        + "' would be served under /" + AuthGenerator.ROUTE_SEGMENT
                        + ", which is reserved for registration and login");
            }
            if (AuthGenerator.TABLE_NAME.equals(NamingUtil.tableName(model))) {
                throw new UnsupportedOptionException("authentication", strategy, "model '" + model.getName()
                        + "' maps to table " + AuthGenerator.TABLE_NAME + ", which stores the user accounts");
            }
        }
    }

    static AuthConfig authConfig(GenerationOptions options) {
        return AuthConfig.builder()
                .strategy(options.getAuthentication())
                .roles(List.of(
                        Role.builder().name(EndpointGenerator.ADMIN_ROLE)
                                .permissions(List.of("create", "read", "update", "delete"))
                                .description("Full access to every resource")
                                .build(),
                        Role.builder().name("user")
                                .permissions(List.of("read"))
                                .description("Read-only access")
                                .build()))
                .build();
    }
}
