package com.modelforge.generator.export.archive;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.Date;
import java.util.List;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipParameters;

import com.modelforge.generator.export.ArchiveException;

/**
 * Writes a gzip-compressed tarball. Long paths use POSIX extended headers.
 */
public class TarGzArchiveWriter implements ArchiveWriter {

    private static final int FILE_MODE = 0100644;

    @Override
    public byte[] write(List<ArchiveEntry> entries, Instant modifiedAt) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        GzipParameters parameters = new GzipParameters();
        parameters.setCompressionLevel(9);
        parameters.setModificationTime(modifiedAt.toEpochMilli());
        String current = "<archive>";
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(
                new GzipCompressorOutputStream(bytes, parameters), "UTF-8")) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
            for (ArchiveEntry entry : entries) {
                current = entry.path();
                TarArchiveEntry tarEntry = new TarArchiveEntry(entry.path());
                tarEntry.setSize(entry.contents().length);
                tarEntry.setMode(FILE_MODE);
                tarEntry.setModTime(Date.from(modifiedAt));
                tar.putArchiveEntry(tarEntry);
                tar.write(entry.contents());
                tar.closeArchiveEntry();
            }
            tar.finish();
        } catch (IOException e) {
            throw new ArchiveException(current, e);
        }
        return bytes.toByteArray();
    }
}
