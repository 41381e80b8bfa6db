package com.ppser.preprocessor.util;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;

/**
 * File operations for preprocessed output.
 *
 * Sources are read and written as ISO-8859-1 so every byte survives unchanged.
 */
public class FileWriteUtil {

    public static final Charset SOURCE_CHARSET = StandardCharsets.ISO_8859_1;

    private FileWriteUtil() {
        // Utility class
    }

    public static String readSource(Path file) throws IOException {
        return Files.readString(file, SOURCE_CHARSET);
    }

    /**
     * Writes content to a temporary file next to the target and moves it into place,
     * creating parent directories if needed.
     */
    public static void writeAtomically(Path target, String content) throws IOException {
        Path parentDir = target.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Path temp = Files.createTempFile(parentDir, "." + target.getFileName(), ".tmp");
        try {
            Files.writeString(temp, content, SOURCE_CHARSET);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * True if the file exists and holds exactly the given content.
     */
    public static boolean hasContent(Path file, String content) throws IOException {
        if (!Files.isRegularFile(file)) {
            return false;
        }
        byte[] expected = content.getBytes(SOURCE_CHARSET);
        if (Files.size(file) != expected.length) {
            return false;
        }
        return Arrays.equals(Files.readAllBytes(file), expected);
    }

    /**
     * True if the output exists and was modified after the input.
     */
    public static boolean isNewer(Path output, Path input) throws IOException {
        return Files.exists(output)
                && Files.getLastModifiedTime(output).compareTo(Files.getLastModifiedTime(input)) > 0;
    }
}
