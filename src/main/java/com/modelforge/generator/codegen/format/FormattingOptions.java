package com.modelforge.generator.codegen.format;

import lombok.Builder;
import lombok.Value;

/**
 * Layout preferences for {@link CodeFormatter}. Defaults: two spaces per level.
 */
@Value
@Builder(toBuilder = true)
public class FormattingOptions {

    @Builder.Default
    int indentSize = 2;

    @Builder.Default
    boolean useTabs = false;

    public static FormattingOptions defaults() {
        return FormattingOptions.builder().build();
    }

    public String indentUnit() {
        return useTabs ? "\t" : " ".repeat(Math.max(0, indentSize));
    }
}
