package com.modelforge.generator.codegen.template.ast;

import com.modelforge.generator.codegen.template.TemplateContext;

/**
 * A node of a parsed template.
 */
public interface TemplateNode {

    void render(TemplateContext context, StringBuilder out);
}
