package com.metamodel.generator.codegen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * File operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content as UTF-8, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    /**
     * Recursively deletes a directory, if it exists.
     */
    public static void deleteDirectory(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        }
    }
}
