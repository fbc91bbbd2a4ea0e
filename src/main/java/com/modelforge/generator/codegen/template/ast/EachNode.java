package com.modelforge.generator.codegen.template.ast;

import java.util.List;

import com.modelforge.generator.codegen.template.TemplateContext;

/**
 * {@code {{#each list}}...{{/each}}}: the body once per element, in order. Anything that is not a list renders
 * nothing.
 */
public class EachNode extends BlockNode {

    public EachNode(String expression, List<TemplateNode> body) {
        super(expression, body);
    }

    @Override
    public void render(TemplateContext context, StringBuilder out) {
        if (!(evaluate(context) instanceof List<?> elements)) {
            return;
        }
        for (Object element : elements) {
            renderBody(context.overlay(element), out);
        }
    }
}
