package com.modelforge.generator.export.archive;

import java.time.Instant;
import java.util.List;

/**
 * Serializes archive entries into the bytes of one container format.
 */
public interface ArchiveWriter {

    /**
     * @param modifiedAt timestamp recorded on every entry
     * @throws com.modelforge.generator.export.ArchiveException when the stream cannot be written
     */
    byte[] write(List<ArchiveEntry> entries, Instant modifiedAt);
}
