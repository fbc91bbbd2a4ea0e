package com.modelforge.generator.codegen.generator;

import java.util.List;
import java.util.stream.Collectors;

import com.modelforge.generator.codegen.model.core.context.GenerationContext;
import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.output.ContentLanguage;
import com.modelforge.generator.codegen.model.output.CrudOperation;
import com.modelforge.generator.codegen.model.output.Endpoint;
import com.modelforge.generator.codegen.model.output.GeneratedFile;
import com.modelforge.generator.codegen.util.NamingUtil;

/**
 * Generates the router of a model. Guards come from the endpoint descriptions so routes and docs agree.
 */
public class RouteGenerator {

    public GeneratedFile generate(Model model, List<Endpoint> endpoints, GenerationContext context) {
        String name = model.getName();
        String controller = NamingUtil.toCamelCase(name) + "Controller";
        boolean guarded = endpoints.stream().anyMatch(Endpoint::isAuthenticated);

        String authImports = guarded
                ? "\nimport { authenticateToken } from '../middleware/auth';\nimport { authorize } from '../middleware/authorize';"
                : "";

        String contents = """
                import { Router } from 'express';
                import { %1$sController } from '../controllers/%1$sController';
                import { validate%1$s } from '../validation/%1$sValidation';%2$s

                const router = Router();
                const %3$s = new %1$sController();

                // Create %1$s
                router.post('/', %4$svalidate%1$s.create, %3$s.create);

                // List %1$s records
                router.get('/', %5$s%3$s.getAll);

                // Get %1$s by ID
                router.get('/:id', %6$s%3$s.getById);

                // Update %1$s
                router.put('/:id', %7$svalidate%1$s.update, %3$s.update);

                // Delete %1$s
                router.delete('/:id', %8$s%3$s.delete);

                export default router;
                """.formatted(name, authImports, controller,
                guards(endpoints, CrudOperation.CREATE),
                guards(endpoints, CrudOperation.LIST),
                guards(endpoints, CrudOperation.READ),
                guards(endpoints, CrudOperation.UPDATE),
                guards(endpoints, CrudOperation.DELETE));

        return GeneratedFile.source("src/routes/" + NamingUtil.routeSegment(model) + ".ts", contents,
                ContentLanguage.TYPESCRIPT);
    }

    private static String guards(List<Endpoint> endpoints, CrudOperation operation) {
        return endpoints.stream()
                .filter(e -> e.getOperation() == operation && e.isAuthenticated())
                .findFirst()
                .map(e -> e.getRoles().isEmpty()
                        ? "authenticateToken, "
                        : "authenticateToken, authorize(" + e.getRoles().stream()
                                .map(NamingUtil::quote)
                                .collect(Collectors.joining(", ")) + "), ")
                .orElse("");
    }
}
