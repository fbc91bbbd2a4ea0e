package com.modelforge.generator.export;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Packaging preferences. Defaults: zip, tests and documentation included, basic tier.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ExportOptions {

    @Builder.Default
    ArchiveFormat format = ArchiveFormat.ZIP;

    @Builder.Default
    boolean includeTests = true;

    @Builder.Default
    boolean includeDocumentation = true;

    @Builder.Default
    TemplateTier template = TemplateTier.BASIC;

    public static ExportOptions defaults() {
        return ExportOptions.builder().build();
    }
}
