package com.modelforge.generator.codegen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;

import com.modelforge.generator.codegen.model.output.GeneratedFile;

/**
 * Writes generated projects to disk for the unpacked CLI output.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    public static void writeText(Path file, String content) throws IOException {
        writeBytes(file, content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Writes {@code content} to {@code file}, creating missing parent directories.
     */
    public static void writeBytes(Path file, byte[] content) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            Files.createDirectories(parent);
        }
        Files.write(file, content);
    }

    /**
     * Lays out every generated file under {@code root}. A relative path that would land outside the root fails
     * the whole write before anything is touched.
     */
    public static void writeTree(Path root, List<GeneratedFile> files) throws IOException {
        Path base = root.toAbsolutePath().normalize();
        for (GeneratedFile file : files) {
            if (!base.resolve(file.getPath()).normalize().startsWith(base)) {
                throw new IOException("Generated path escapes output directory " + base + ": " + file.getPath());
            }
        }
        for (GeneratedFile file : files) {
            writeText(base.resolve(file.getPath()).normalize(), file.getContents());
        }
    }

    /**
     * Removes {@code directory} and everything below it. Missing directories are ignored.
     */
    public static void deleteTree(Path directory) throws IOException {
        if (Files.notExists(directory)) {
            return;
        }
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
