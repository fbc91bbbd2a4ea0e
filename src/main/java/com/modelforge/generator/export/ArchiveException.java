package com.modelforge.generator.export;

/**
 * Raised when writing an archive stream fails. Carries the entry being written.
 */
public class ArchiveException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String path;

    public ArchiveException(String path, Throwable cause) {
        super("Failed to write archive entry '" + path + "': " + cause.getMessage(), cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
