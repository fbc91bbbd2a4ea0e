package com.modelforge.generator.codegen;

import static org.assertj.core.api.Assertions.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modelforge.generator.TestModels;
import com.modelforge.generator.codegen.exception.UnsupportedOptionException;
import com.modelforge.generator.codegen.format.CodeFormatter;
import com.modelforge.generator.codegen.model.core.context.AuthStrategy;
import com.modelforge.generator.codegen.model.core.context.DatabaseEngine;
import com.modelforge.generator.codegen.model.core.context.Framework;
import com.modelforge.generator.codegen.model.core.context.GenerationOptions;
import com.modelforge.generator.codegen.model.core.context.TargetLanguage;
import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.input.ModelMetadata;
import com.modelforge.generator.codegen.model.output.CrudOperation;
import com.modelforge.generator.codegen.model.output.Endpoint;
import com.modelforge.generator.codegen.model.output.GeneratedFile;
import com.modelforge.generator.codegen.model.output.GeneratedFileType;
import com.modelforge.generator.codegen.model.output.GeneratedProject;
import com.modelforge.generator.codegen.template.TemplateEngine;

/**
 * Unit tests for CodeGenerationService.
 */
class CodeGenerationServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private final AtomicInteger ids = new AtomicInteger();
    private final CodeGenerationService service = new CodeGenerationService(new TemplateEngine(),
            Clock.fixed(NOW, ZoneOffset.UTC), () -> "project-" + ids.incrementAndGet());

    @Test
    void testFiveEndpointsPerModelPlusAuth() {
        GeneratedProject project = service.generateProject(
                List.of(TestModels.user(), TestModels.post()), GenerationOptions.defaults());

        assertThat(project.getEndpoints()).hasSize(12);
        assertThat(project.getEndpoints())
                .filteredOn(e -> e.getModelName().equals("Post"))
                .extracting(Endpoint::getOperation)
                .containsExactly(CrudOperation.CREATE, CrudOperation.READ, CrudOperation.UPDATE,
                        CrudOperation.DELETE, CrudOperation.LIST);
        assertThat(project.getEndpoints())
                .extracting(Endpoint::getPath)
                .contains("/auth/register", "/auth/login", "/post", "/post/:id", "/user", "/user/:id");
    }

    @Test
    void testNoAuthMeansNoAuthArtifacts() {
        GenerationOptions options = GenerationOptions.builder().authentication(AuthStrategy.NONE).build();

        GeneratedProject project = service.generateProject(List.of(TestModels.post()), options);

        assertThat(project.getEndpoints()).hasSize(5).noneMatch(Endpoint::isAuthenticated);
        assertThat(project.getAuthConfig().getProtectedRoutes()).isEmpty();
        assertThat(project.findFile("src/auth/AuthController.ts")).isEmpty();
        assertThat(project.findFile("src/middleware/auth.ts")).isEmpty();
    }

    @Test
    void testWritesAreProtectedAndDeleteIsAdminOnly() {
        GeneratedProject project = service.generateProject(List.of(TestModels.post()), GenerationOptions.defaults());

        assertThat(project.getAuthConfig().getProtectedRoutes())
                .containsExactly("POST /post", "PUT /post/:id", "DELETE /post/:id");
        Endpoint delete = project.getEndpoints().stream()
                .filter(e -> e.getOperation() == CrudOperation.DELETE)
                .findFirst()
                .orElseThrow();
        assertThat(delete.getRoles()).containsExactly("admin");
    }

    @Test
    void testProjectNameAndTimestampsFromClock() {
        GeneratedProject project = service.generateProject(List.of(TestModels.post()), GenerationOptions.defaults());

        assertThat(project.getId()).isEqualTo("project-1");
        assertThat(project.getName()).isEqualTo("generated-api-" + NOW.toEpochMilli());
        assertThat(project.getCreatedAt()).isEqualTo(NOW);
        assertThat(project.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    void testGenerationIsDeterministic() {
        List<Model> models = List.of(TestModels.user(), TestModels.post());

        GeneratedProject first = service.generateProject(models, GenerationOptions.defaults());
        GeneratedProject second = service.generateProject(models, GenerationOptions.defaults());

        assertThat(second.getFiles()).isEqualTo(first.getFiles());
        assertThat(second.getEndpoints()).isEqualTo(first.getEndpoints());
        assertThat(second.getApiSpec()).isEqualTo(first.getApiSpec());
        assertThat(second.getId()).isNotEqualTo(first.getId());
    }

    @Test
    void testFilePathsAreRelativeAndUnique() {
        GeneratedProject project = service.generateProject(
                List.of(TestModels.user(), TestModels.post()), GenerationOptions.defaults());

        assertThat(project.getFiles())
                .extracting(GeneratedFile::getPath)
                .doesNotHaveDuplicates()
                .allMatch(p -> !p.startsWith("/") && !p.contains("\\"))
                .contains("package.json", "tsconfig.json", "README.md", "src/app.ts",
                        "src/models/User.ts", "src/schemas/user.sql", "src/controllers/UserController.ts",
                        "src/services/UserService.ts", "src/repositories/UserRepository.ts",
                        "src/routes/user.ts", "src/validation/UserValidation.ts",
                        "src/tests/UserController.test.ts", "docs/openapi.json", "docs/API.md");
    }

    @Test
    void testAuthArtifactsHaveTheirOwnDirectory() {
        GeneratedProject project = service.generateProject(List.of(TestModels.user()), GenerationOptions.defaults());

        assertThat(project.getFiles())
                .extracting(GeneratedFile::getPath)
                .contains("src/auth/AuthUser.ts", "src/auth/AuthService.ts", "src/auth/AuthController.ts",
                        "src/auth/routes.ts", "src/auth/AuthUserRepository.ts", "src/auth/AuthValidation.ts",
                        "src/auth/auth_users.sql", "src/middleware/auth.ts", "src/middleware/authorize.ts");
        assertThat(project.findFile("src/app.ts").orElseThrow().getContents())
                .contains("import authRoutes from './auth/routes';", "app.use('/auth', authRoutes);");
    }

    @Test
    void testAuthUserModelKeepsItsOwnFiles() {
        Model authUser = TestModels.model("AuthUser").toBuilder()
                .metadata(ModelMetadata.builder().tableName("members").build())
                .build();

        GeneratedProject project = service.generateProject(List.of(authUser), GenerationOptions.defaults());

        assertThat(project.getFiles())
                .extracting(GeneratedFile::getPath)
                .doesNotHaveDuplicates()
                .contains("src/models/AuthUser.ts", "src/auth/AuthUser.ts",
                        "src/repositories/AuthUserRepository.ts", "src/auth/AuthUserRepository.ts");
    }

    @Test
    void testModelOnAuthRouteRejectedOnlyWithAuthentication() {
        List<Model> models = List.of(TestModels.model("Auth"));

        assertThatThrownBy(() -> service.generateProject(models, GenerationOptions.defaults()))
                .isInstanceOfSatisfying(UnsupportedOptionException.class,
                        e -> assertThat(e.getOption()).isEqualTo("authentication"))
                .hasMessageContaining("model 'Auth'");

        GeneratedProject project = service.generateProject(models,
                GenerationOptions.builder().authentication(AuthStrategy.NONE).build());
        assertThat(project.getFiles())
                .extracting(GeneratedFile::getPath)
                .doesNotHaveDuplicates()
                .contains("src/routes/auth.ts", "src/controllers/AuthController.ts")
                .noneMatch(p -> p.startsWith("src/auth/"));
    }

    @Test
    void testModelOnAccountsTableRejected() {
        assertThatThrownBy(() -> service.generateProject(List.of(TestModels.model("AuthUser")),
                GenerationOptions.defaults()))
                .isInstanceOf(UnsupportedOptionException.class)
                .hasMessageContaining("auth_users");
    }

    @Test
    void testEmptyModelSetStillYieldsRunnableScaffold() {
        GeneratedProject project = service.generateProject(List.of(), GenerationOptions.defaults());

        assertThat(project.getModels()).isEmpty();
        assertThat(project.getEndpoints()).hasSize(2);
        assertThat(project.findFile("package.json")).isPresent();
        assertThat(project.findFile("src/app.ts")).isPresent();
    }

    @Test
    void testMongoHasNoSchemaFiles() {
        GenerationOptions options = GenerationOptions.builder().database(DatabaseEngine.MONGODB).build();

        GeneratedProject project = service.generateProject(List.of(TestModels.post()), options);

        assertThat(project.getFiles()).noneMatch(f -> f.getPath().endsWith(".sql"));
    }

    @Test
    void testTestsAndDocumentationCanBeSkipped() {
        GenerationOptions options = GenerationOptions.builder()
                .includeTests(false)
                .includeDocumentation(false)
                .build();

        GeneratedProject project = service.generateProject(List.of(TestModels.post()), options);

        assertThat(project.getFiles()).noneMatch(f -> f.getType() == GeneratedFileType.TEST);
        assertThat(project.findFile("docs/openapi.json")).isEmpty();
        assertThat(project.getApiSpec().get("paths").isEmpty()).isTrue();
    }

    @Test
    void testApiSpecDescribesRecords() {
        GeneratedProject project = service.generateProject(List.of(TestModels.user()), GenerationOptions.defaults());

        ObjectNode spec = project.getApiSpec();
        JsonNode user = spec.at("/components/schemas/User");
        assertThat(user.get("properties").has("name")).isTrue();
        assertThat(user.get("properties").has("email")).isTrue();
        assertThat(user.at("/properties/email/format").asText()).isEqualTo("email");
        assertThat(spec.get("paths").has("/user/{id}")).isTrue();
        assertThat(spec.at("/components/securitySchemes/bearerAuth/scheme").asText()).isEqualTo("bearer");
    }

    @Test
    void testApiSpecIsACopy() {
        GeneratedProject project = service.generateProject(List.of(TestModels.user()), GenerationOptions.defaults());

        project.getApiSpec().put("openapi", "tampered");

        assertThat(project.getApiSpec().get("openapi").asText()).isNotEqualTo("tampered");
    }

    @Test
    void testUserModelEndToEnd() {
        GeneratedProject project = service.generateProject(List.of(TestModels.user()), GenerationOptions.defaults());
        CodeFormatter formatter = new CodeFormatter();

        String schema = formatter.formatFile(project.findFile("src/schemas/user.sql").orElseThrow()).getContents();
        assertThat(schema)
                .contains("CREATE TABLE IF NOT EXISTS users (")
                .contains("  name VARCHAR(255) NOT NULL,")
                .contains("  email VARCHAR(255) NOT NULL UNIQUE,");
        assertThat(formatter.validateCode(project.findFile("src/schemas/user.sql").orElseThrow()).isValid())
                .isTrue();

        String model = project.findFile("src/models/User.ts").orElseThrow().getContents();
        assertThat(model).contains("export interface User {", "  name: string;", "  email: string;");

        String tests = project.findFile("src/tests/UserController.test.ts").orElseThrow().getContents();
        assertThat(tests).contains("name: 'test string'", "email: 'test@example.com'");
    }

    @Test
    void testUnsupportedOptionsRejectedBeforeGeneration() {
        List<Model> models = List.of(TestModels.post());

        assertThatThrownBy(() -> service.generateProject(models,
                GenerationOptions.builder().framework(Framework.FASTIFY).build()))
                .isInstanceOf(UnsupportedOptionException.class)
                .extracting("option").isEqualTo("framework");
        assertThatThrownBy(() -> service.generateProject(models,
                GenerationOptions.builder().authentication(AuthStrategy.OAUTH).build()))
                .isInstanceOf(UnsupportedOptionException.class)
                .extracting("option").isEqualTo("authentication");
        assertThatThrownBy(() -> service.generateProject(models,
                GenerationOptions.builder().language(TargetLanguage.JAVASCRIPT).build()))
                .isInstanceOf(UnsupportedOptionException.class)
                .extracting("option").isEqualTo("language");
        assertThatThrownBy(() -> service.generateProject(models, null))
                .isInstanceOf(UnsupportedOptionException.class);
        assertThat(ids.get()).isZero();
    }
}
