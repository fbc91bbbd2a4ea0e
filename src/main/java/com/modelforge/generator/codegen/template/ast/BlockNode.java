package com.modelforge.generator.codegen.template.ast;

import java.util.List;

import com.modelforge.generator.codegen.template.TemplateContext;

/**
 * Common part of {@code if} and {@code each} blocks: a body of child nodes.
 */
public abstract class BlockNode implements TemplateNode {

    private final String expression;
    private final List<TemplateNode> body;

    protected BlockNode(String expression, List<TemplateNode> body) {
        this.expression = expression;
        this.body = List.copyOf(body);
    }

    public String getExpression() {
        return expression;
    }

    public List<TemplateNode> getBody() {
        return body;
    }

    protected Object evaluate(TemplateContext context) {
        return context.resolve(expression).orElse(null);
    }

    protected void renderBody(TemplateContext context, StringBuilder out) {
        for (TemplateNode node : body) {
            node.render(context, out);
        }
    }
}
