package com.modelforge.generator.codegen.template.ast;

import com.modelforge.generator.codegen.template.TemplateContext;

/**
 * Text copied to the output as is.
 */
public record LiteralNode(String text) implements TemplateNode {

    @Override
    public void render(TemplateContext context, StringBuilder out) {
        out.append(text);
    }
}
