package com.modelforge.generator.codegen.generator;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modelforge.generator.codegen.model.core.context.DatabaseEngine;
import com.modelforge.generator.codegen.model.core.context.GenerationContext;
import com.modelforge.generator.codegen.model.core.context.GenerationOptions;
import com.modelforge.generator.codegen.model.output.ContentLanguage;
import com.modelforge.generator.codegen.model.output.GeneratedFile;
import com.modelforge.generator.codegen.util.JsonSupport;
import com.modelforge.generator.codegen.util.NamingUtil;

/**
 * Generates the project skeleton: dependency manifest, compiler configuration, environment template, readme and
 * the database connection module.
 */
public class ScaffoldGenerator {

    static final String PACKAGE_NAME = "generated-api";

    public List<GeneratedFile> generate(GenerationContext context) {
        List<GeneratedFile> files = new ArrayList<>();
        files.add(GeneratedFile.config("package.json", generatePackageJson(context), ContentLanguage.JSON));
        if (context.isTypeScript()) {
            files.add(GeneratedFile.config("tsconfig.json", generateTsConfig(), ContentLanguage.JSON));
        }
        files.add(GeneratedFile.config(".env.example", generateEnvExample(context), ContentLanguage.ENV));
        files.add(GeneratedFile.documentation("README.md", generateReadme(context)));
        files.add(GeneratedFile.source("src/database/connection.ts", generateDatabaseConnection(context.getDatabase()),
                ContentLanguage.TYPESCRIPT));
        return files;
    }

    String generatePackageJson(GenerationContext context) {
        GenerationOptions options = context.getOptions();

        ObjectNode dependencies = JsonSupport.object();
        dependencies.put("express", "^4.18.2");
        dependencies.put("cors", "^2.8.5");
        dependencies.put("dotenv", "^16.3.1");
        dependencies.put("express-validator", "^7.0.1");
        switch (context.getDatabase()) {
            case POSTGRESQL -> dependencies.put("pg", "^8.11.0");
            case MYSQL -> dependencies.put("mysql2", "^3.6.0");
            case MONGODB -> dependencies.put("mongodb", "^6.1.0");
        }
        if (context.isJwt()) {
            dependencies.put("jsonwebtoken", "^9.0.0");
            dependencies.put("bcryptjs", "^2.4.3");
        }

        ObjectNode devDependencies = JsonSupport.object();
        devDependencies.put("@types/node", "^20.0.0");
        devDependencies.put("nodemon", "^3.0.0");
        devDependencies.put("typescript", "^5.0.0");
        devDependencies.put("ts-node", "^10.9.0");
        devDependencies.put("@types/express", "^4.17.17");
        devDependencies.put("@types/cors", "^2.8.13");
        if (context.getDatabase() == DatabaseEngine.POSTGRESQL) {
            devDependencies.put("@types/pg", "^8.10.0");
        }
        if (context.isJwt()) {
            devDependencies.put("@types/jsonwebtoken", "^9.0.0");
            devDependencies.put("@types/bcryptjs", "^2.4.0");
        }
        if (options.isIncludeTests()) {
            devDependencies.put("jest", "^29.0.0");
            devDependencies.put("ts-jest", "^29.1.0");
            devDependencies.put("supertest", "^6.3.0");
            devDependencies.put("@types/jest", "^29.0.0");
            devDependencies.put("@types/supertest", "^2.0.0");
        }

        ObjectNode scripts = JsonSupport.object();
        scripts.put("start", "node dist/app.js");
        scripts.put("dev", "nodemon --exec ts-node src/app.ts");
        scripts.put("build", "tsc");
        scripts.put("test", options.isIncludeTests() ? "jest" : "echo \"No tests configured\"");

        ObjectNode root = JsonSupport.object();
        root.put("name", PACKAGE_NAME);
        root.put("version", "1.0.0");
        root.put("description", "Generated API project");
        root.put("main", "dist/app.js");
        root.set("scripts", scripts);
        root.set("dependencies", dependencies);
        root.set("devDependencies", devDependencies);
        if (options.isIncludeTests()) {
            ObjectNode jest = JsonSupport.object();
            jest.put("preset", "ts-jest");
            jest.put("testEnvironment", "node");
            jest.set("roots", JsonSupport.array().add("<rootDir>/src"));
            root.set("jest", jest);
        }
        return JsonSupport.print(root) + "\n";
    }

    String generateTsConfig() {
        ObjectNode compilerOptions = JsonSupport.object();
        compilerOptions.put("target", "ES2020");
        compilerOptions.put("module", "commonjs");
        compilerOptions.set("lib", JsonSupport.array().add("ES2020"));
        compilerOptions.put("outDir", "./dist");
        compilerOptions.put("rootDir", "./src");
        compilerOptions.put("strict", true);
        compilerOptions.put("esModuleInterop", true);
        compilerOptions.put("skipLibCheck", true);
        compilerOptions.put("forceConsistentCasingInFileNames", true);
        compilerOptions.put("resolveJsonModule", true);
        compilerOptions.put("sourceMap", true);

        ObjectNode root = JsonSupport.object();
        root.set("compilerOptions", compilerOptions);
        root.set("include", JsonSupport.array().add("src/**/*"));
        root.set("exclude", JsonSupport.array().add("node_modules").add("dist").add("src/**/*.test.ts"));
        return JsonSupport.print(root) + "\n";
    }

    String generateEnvExample(GenerationContext context) {
        StringBuilder content = new StringBuilder("""
                # Server Configuration
                PORT=3000
                NODE_ENV=development
                CORS_ORIGIN=*

                # Database Configuration
                DATABASE_URL=%s
                """.formatted(context.getDatabase().getExampleConnectionString()));
        if (context.isJwt()) {
            content.append("""

                    # Authentication Configuration
                    JWT_SECRET=your-super-secret-jwt-key-change-this-in-production
                    JWT_REFRESH_SECRET=your-super-secret-refresh-key-change-this-in-production
                    JWT_EXPIRES_IN=15m
                    """);
        }
        return content.toString();
    }

    String generateReadme(GenerationContext context) {
        GenerationOptions options = context.getOptions();
        StringBuilder modelsSection = new StringBuilder();
        context.getModels().forEach(model -> modelsSection
                .append("- `").append(model.getName()).append("`: `/")
                .append(NamingUtil.routeSegment(model)).append("`\n"));
        if (modelsSection.length() == 0) {
            modelsSection.append("No models defined yet.\n");
        }

        return """
                # Generated API Project

                This is an automatically generated API project using %s with %s database.

                ## Features

                - RESTful API endpoints
                - %s database integration
                - %s authentication
                - Input validation
                - Error handling
                - %s
                - %s

                ## Getting Started

                1. Install dependencies:
                   ```bash
                   npm install
                   ```

                2. Set up environment variables:
                   ```bash
                   cp .env.example .env
                   ```

                3. Start the development server:
                   ```bash
                   npm run dev
                   ```

                ## Resources

                %s
                ## Project Structure

                - `src/app.ts` - Main application entry point
                - `src/controllers/` - Request handlers
                - `src/services/` - Business logic
                - `src/repositories/` - Data access layer
                - `src/models/` - Data models
                - `src/routes/` - Route definitions
                - `src/middleware/` - Custom middleware
                - `src/validation/` - Input validation schemas
                %s
                ## License

                MIT
                """.formatted(
                options.getFramework().getWireValue(),
                options.getDatabase().getWireValue(),
                options.getDatabase().getWireValue(),
                options.getAuthentication().getWireValue(),
                options.isIncludeTests() ? "Comprehensive test suite" : "Basic structure",
                options.isIncludeDocumentation() ? "OpenAPI documentation" : "Basic documentation",
                modelsSection,
                (options.getAuthentication().isEnabled() ? "- `src/auth/` - Registration, login and user accounts\n" : "")
                        + (options.isIncludeTests() ? "- `src/tests/` - Test files\n" : ""));
    }

    String generateDatabaseConnection(DatabaseEngine database) {
        return switch (database) {
            case POSTGRESQL -> """
                    import { Pool } from 'pg';

                    const pool = new Pool({
                      connectionString: process.env.DATABASE_URL,
                      ssl: process.env.NODE_ENV === 'production' ? { rejectUnauthorized: false } : false,
                    });

                    export default pool;

                    export const query = (text: string, params?: unknown[]) => {
                      return pool.query(text, params);
                    };
                    """;
            case MYSQL -> """
                    import mysql from 'mysql2/promise';

                    const pool = mysql.createPool({
                      uri: process.env.DATABASE_URL,
                      waitForConnections: true,
                      connectionLimit: 10,
                    });

                    export default pool;

                    export const query = async <T = any>(sql: string, params?: unknown[]): Promise<T[]> => {
                      const [rows] = await pool.query(sql, params);
                      return rows as T[];
                    };
                    """;
            case MONGODB -> """
                    import { Db, MongoClient } from 'mongodb';

                    const client = new MongoClient(process.env.DATABASE_URL || 'mongodb://localhost:27017/app');
                    let database: Db | undefined;

                    export const getDb = async (): Promise<Db> => {
                      if (!database) {
                        await client.connect();
                        database = client.db();
                      }
                      return database;
                    };

                    export default client;
                    """;
        };
    }
}
