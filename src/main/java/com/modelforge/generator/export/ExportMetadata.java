package com.modelforge.generator.export;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Static description of what the exporter offers, for option pickers and {@code --list-export-options}.
 */
@Value
@Builder
public class ExportMetadata {

    public record FormatInfo(String value, String name, String description, String extension, String mediaType) {
    }

    public record TierInfo(String value, String name, String description, List<String> files) {
    }

    @NonNull
    List<FormatInfo> formats;

    @NonNull
    List<TierInfo> templates;

    @NonNull
    ExportOptions defaultOptions;
}
