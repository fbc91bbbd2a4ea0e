package com.modelforge.generator.codegen.template;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelforge.generator.codegen.template.ast.TemplateNode;

/**
 * Named registry of small placeholder templates.
 *
 * Templates are parsed once when registered; rendering walks the parsed tree, so a block nested in an
 * {@code each} body always sees the iteration scope. The registry is meant to be filled at startup and only
 * read afterwards: concurrent registration during rendering is not supported.
 */
public class TemplateEngine {

    private static final Logger log = LoggerFactory.getLogger(TemplateEngine.class);

    private final Map<String, List<TemplateNode>> templates = new LinkedHashMap<>();

    public TemplateEngine() {
        BuiltinTemplates.all().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> addTemplate(e.getKey(), e.getValue()));
    }

    /**
     * Registers or replaces a template.
     *
     * @throws TemplateSyntaxException when the block tags are not balanced
     */
    public void addTemplate(String name, String text) {
        List<TemplateNode> nodes = TemplateParser.parse(name, text);
        if (templates.put(name, nodes) != null) {
            log.debug("Replaced template '{}'", name);
        }
    }

    public String render(String name, TemplateContext context) {
        List<TemplateNode> nodes = templates.get(name);
        if (nodes == null) {
            throw new TemplateNotFoundException(name);
        }
        StringBuilder out = new StringBuilder();
        for (TemplateNode node : nodes) {
            node.render(context, out);
        }
        return out.toString();
    }

    public String render(String name, Map<String, ?> values) {
        return render(name, TemplateContext.of(values));
    }

    public List<String> getTemplateNames() {
        return new ArrayList<>(templates.keySet());
    }
}
