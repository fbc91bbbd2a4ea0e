package com.modelforge.generator.export.archive;

import java.nio.charset.StandardCharsets;

/**
 * One file of an archive: forward-slash relative path and raw contents.
 */
public record ArchiveEntry(String path, byte[] contents) {

    public static ArchiveEntry of(String path, String contents) {
        return new ArchiveEntry(path, contents.getBytes(StandardCharsets.UTF_8));
    }
}
