package com.modelforge.generator.codegen.template.ast;

import com.modelforge.generator.codegen.template.TemplateContext;

/**
 * {@code {{name}}}. An unresolved name is written back verbatim.
 */
public record VariableNode(String name, String source) implements TemplateNode {

    @Override
    public void render(TemplateContext context, StringBuilder out) {
        out.append(context.lookup(name).map(String::valueOf).orElse(source));
    }
}
