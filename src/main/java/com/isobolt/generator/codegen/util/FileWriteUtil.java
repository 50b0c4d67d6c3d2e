package com.isobolt.generator.codegen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes UTF-8 content to a file, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    /**
     * Writes through a sibling temporary file and moves it into place, so that readers never
     * see a half written file.
     */
    public static void replaceString(Path filePath, String content) throws IOException {
        Path target = filePath.toAbsolutePath();
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        safeWriteString(temp, content);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
}
