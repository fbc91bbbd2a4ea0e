package com.modelforge.generator.codegen.template.ast;

import com.modelforge.generator.codegen.template.TemplateContext;

/**
 * {@code {{a.b}}}. An unresolved path is written back verbatim.
 */
public record PathNode(String path, String source) implements TemplateNode {

    @Override
    public void render(TemplateContext context, StringBuilder out) {
        out.append(context.resolve(path).map(String::valueOf).orElse(source));
    }
}
