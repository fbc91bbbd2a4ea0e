package com.modelforge.generator.export;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.modelforge.generator.codegen.exception.UnsupportedOptionException;

/**
 * Container format of an exported project.
 */
public enum ArchiveFormat {
    ZIP("zip", "ZIP Archive", "Standard ZIP compression, opens everywhere", ".zip", "application/zip"),
    TAR("tar", "TAR.GZ Archive", "Gzip-compressed tarball for Unix systems", ".tar.gz", "application/gzip");

    private final String wireValue;
    private final String label;
    private final String description;
    private final String fileExtension;
    private final String mediaType;

    ArchiveFormat(String wireValue, String label, String description, String fileExtension, String mediaType) {
        this.wireValue = wireValue;
        this.label = label;
        this.description = description;
        this.fileExtension = fileExtension;
        this.mediaType = mediaType;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    public String getMediaType() {
        return mediaType;
    }

    @JsonCreator
    public static ArchiveFormat fromValue(String value) {
        return Arrays.stream(values())
                .filter(f -> f.wireValue.equalsIgnoreCase(value) || f.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new UnsupportedOptionException("format", value, "expected one of zip, tar"));
    }
}
