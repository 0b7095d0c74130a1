package com.kinetic.modeller.codegen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        createParent(filePath);
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    /**
     * Writes lines to a file, each terminated by a newline, creating parent directories if needed.
     */
    public static void safeWriteLines(Path filePath, List<String> lines) throws IOException {
        createParent(filePath);
        Files.write(filePath, lines, StandardCharsets.UTF_8);
    }

    private static void createParent(Path filePath) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
    }
}
