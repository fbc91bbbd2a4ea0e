package com.modelforge.generator.codegen.generator;

import java.util.Map;

import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.output.ContentLanguage;
import com.modelforge.generator.codegen.model.output.GeneratedFile;
import com.modelforge.generator.codegen.template.BuiltinTemplates;
import com.modelforge.generator.codegen.template.TemplateEngine;
import com.modelforge.generator.codegen.util.NamingUtil;

/**
 * Generates the request handler of a model.
 *
 * The handler exposes create, getById, getAll (paginated), update and delete, answering 404 for unknown ids.
 */
public class ApiControllerGenerator {

    private final TemplateEngine templateEngine;

    public ApiControllerGenerator(TemplateEngine templateEngine) {
        this.templateEngine = templateEngine;
    }

    public GeneratedFile generate(Model model) {
        String contents = templateEngine.render(BuiltinTemplates.EXPRESS_CONTROLLER, Map.of(
                "modelName", model.getName(),
                "serviceField", NamingUtil.toCamelCase(model.getName()) + "Service"));
        return GeneratedFile.source("src/controllers/" + model.getName() + "Controller.ts", contents,
                ContentLanguage.TYPESCRIPT);
    }
}
