package com.modelforge.generator.codegen.template.ast;

import java.util.List;

import com.modelforge.generator.codegen.template.TemplateContext;

/**
 * {@code {{#if flag}}...{{/if}}}: the body is kept only when the flag is truthy in the current scope.
 */
public class IfNode extends BlockNode {

    public IfNode(String expression, List<TemplateNode> body) {
        super(expression, body);
    }

    @Override
    public void render(TemplateContext context, StringBuilder out) {
        if (TemplateContext.isTruthy(evaluate(context))) {
            renderBody(context, out);
        }
    }
}
