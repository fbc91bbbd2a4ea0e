package com.modelforge.generator.export;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.modelforge.generator.codegen.model.core.context.AuthStrategy;
import com.modelforge.generator.codegen.model.core.context.DatabaseEngine;
import com.modelforge.generator.codegen.model.core.context.GenerationOptions;
import com.modelforge.generator.codegen.model.output.ContentLanguage;
import com.modelforge.generator.codegen.model.output.GeneratedFile;
import com.modelforge.generator.codegen.model.output.GeneratedProject;

/**
 * Generates the deployment and tooling files added by each packaging tier.
 */
public class TierFileGenerator {

    private record TierFile(TemplateTier tier, String path, String template, String language) {
    }

    private static final List<TierFile> TIER_FILES = List.of(
            new TierFile(TemplateTier.BASIC, ".gitignore", "gitignore.ftl", ContentLanguage.IGNORE),
            new TierFile(TemplateTier.BASIC, "Dockerfile", "Dockerfile.ftl", ContentLanguage.DOCKERFILE),
            new TierFile(TemplateTier.BASIC, "docker-compose.yml", "docker-compose.yml.ftl", ContentLanguage.YAML),
            new TierFile(TemplateTier.ADVANCED, ".github/workflows/ci.yml", "ci.yml.ftl", ContentLanguage.YAML),
            new TierFile(TemplateTier.ADVANCED, ".eslintrc.js", "eslintrc.js.ftl", ContentLanguage.JAVASCRIPT),
            new TierFile(TemplateTier.ADVANCED, ".prettierrc", "prettierrc.ftl", ContentLanguage.JSON),
            new TierFile(TemplateTier.ENTERPRISE, "k8s/deployment.yml", "k8s-deployment.yml.ftl",
                    ContentLanguage.YAML),
            new TierFile(TemplateTier.ENTERPRISE, "helm/Chart.yaml", "helm-Chart.yaml.ftl", ContentLanguage.YAML),
            new TierFile(TemplateTier.ENTERPRISE, "monitoring/prometheus.yml", "prometheus.yml.ftl",
                    ContentLanguage.YAML));

    private static final Map<DatabaseEngine, String> COMPOSE_DATABASE_URLS = Map.of(
            DatabaseEngine.POSTGRESQL, "postgresql://postgres:password@db:5432/api_db",
            DatabaseEngine.MYSQL, "mysql://mysql:password@db:3306/api_db",
            DatabaseEngine.MONGODB, "mongodb://mongo:password@db:27017/api_db?authSource=admin");

    private final ExportTemplateRenderer renderer;

    public TierFileGenerator(ExportTemplateRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * Paths added by the given tier, including those of the tiers it contains.
     */
    public List<String> pathsFor(TemplateTier tier) {
        return TIER_FILES.stream()
                .filter(f -> tier.includes(f.tier()))
                .map(TierFile::path)
                .toList();
    }

    public List<GeneratedFile> generate(GeneratedProject project, TemplateTier tier) {
        Map<String, Object> model = templateModel(project, project.getGenerationOptions(), tier);
        List<GeneratedFile> files = new ArrayList<>();
        for (TierFile tierFile : TIER_FILES) {
            if (tier.includes(tierFile.tier())) {
                files.add(GeneratedFile.config(tierFile.path(), renderer.render(tierFile.template(), model),
                        tierFile.language()));
            }
        }
        return files;
    }

    private Map<String, Object> templateModel(GeneratedProject project, GenerationOptions options,
                                              TemplateTier tier) {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("projectName", project.getName());
        model.put("appName", appName(project.getName()));
        model.put("database", options.getDatabase().getWireValue());
        model.put("composeDatabaseUrl", COMPOSE_DATABASE_URLS.get(options.getDatabase()));
        model.put("jwt", options.getAuthentication() == AuthStrategy.JWT);
        model.put("tests", options.isIncludeTests());
        model.put("tier", tier.getWireValue());
        return model;
    }

    /**
     * Lowercase DNS label usable as a Kubernetes resource name.
     */
    static String appName(String projectName) {
        String slug = projectName.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9-]+", "-")
                .replaceAll("-{2,}", "-")
                .replaceAll("^-|-$", "");
        if (slug.isEmpty()) {
            return "generated-api";
        }
        return slug.length() > 50 ? slug.substring(0, 50).replaceAll("-$", "") : slug;
    }
}
