package com.modelforge.generator.export.archive;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import com.modelforge.generator.export.ArchiveException;

/**
 * Writes a zip archive with maximum compression.
 */
public class ZipArchiveWriter implements ArchiveWriter {

    @Override
    public byte[] write(List<ArchiveEntry> entries, Instant modifiedAt) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        String current = "<archive>";
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            zip.setLevel(Deflater.BEST_COMPRESSION);
            for (ArchiveEntry entry : entries) {
                current = entry.path();
                ZipEntry zipEntry = new ZipEntry(entry.path());
                zipEntry.setTime(modifiedAt.toEpochMilli());
                zip.putNextEntry(zipEntry);
                zip.write(entry.contents());
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new ArchiveException(current, e);
        }
        return bytes.toByteArray();
    }
}
