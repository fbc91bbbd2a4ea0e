package com.modelforge.generator.codegen.generator;

import java.util.stream.Collectors;

import com.modelforge.generator.codegen.model.core.context.GenerationContext;
import com.modelforge.generator.codegen.model.output.ContentLanguage;
import com.modelforge.generator.codegen.model.output.GeneratedFile;
import com.modelforge.generator.codegen.util.NamingUtil;

/**
 * Generates {@code src/app.ts}: middleware chain, health check, every model router and the auth router when
 * enabled. The server only listens outside tests so suites can import the app.
 */
public class ApplicationGenerator {

    public GeneratedFile generate(GenerationContext context) {
        String imports = context.getModels().stream()
                .map(m -> "import " + NamingUtil.toCamelCase(m.getName()) + "Routes from './routes/"
                        + NamingUtil.routeSegment(m) + "';\n")
                .collect(Collectors.joining());
        String mounts = context.getModels().stream()
                .map(m -> "app.use('/" + NamingUtil.routeSegment(m) + "', "
                        + NamingUtil.toCamelCase(m.getName()) + "Routes);\n")
                .collect(Collectors.joining());
        if (context.isAuthEnabled()) {
            imports += "import authRoutes from './auth/routes';\n";
            mounts = "app.use('/" + AuthGenerator.ROUTE_SEGMENT + "', authRoutes);\n" + mounts;
        }

        String contents = """
                import 'dotenv/config';
                import express from 'express';
                import { corsMiddleware } from './middleware/cors';
                import { loggingMiddleware } from './middleware/logging';
                import { errorHandler } from './middleware/validation';
                %s
                const app = express();
                const PORT = process.env.PORT || 3000;

                app.use(corsMiddleware);
                app.use(express.json());
                app.use(express.urlencoded({ extended: true }));
                app.use(loggingMiddleware);

                app.get('/health', (req, res) => {
                  res.json({ status: 'OK', timestamp: new Date().toISOString() });
                });

                %s
                app.use((req, res) => {
                  res.status(404).json({ success: false, message: 'Route not found' });
                });

                app.use(errorHandler);

                if (process.env.NODE_ENV !== 'test') {
                  app.listen(PORT, () => {
                    console.log(`Server running on port ${PORT}`);
                  });
                }

                export default app;
                """.formatted(imports, mounts);

        return GeneratedFile.source("src/app.ts", contents, ContentLanguage.TYPESCRIPT);
    }
}
