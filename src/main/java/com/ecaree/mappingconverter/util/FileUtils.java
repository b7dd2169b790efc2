package com.ecaree.mappingconverter.util;

import javax.annotation.Nonnull;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

public class FileUtils {
    private FileUtils() {
    }

    public static void ensureDirectory(File directory) throws IOException {
        if (directory != null && !directory.exists()) {
            Files.createDirectories(directory.toPath());
        }
    }

    public static void writeStringToFile(@Nonnull File file, @Nonnull String content) throws IOException {
        ensureDirectory(file.getAbsoluteFile().getParentFile());
        Files.writeString(file.toPath(), content, StandardCharsets.UTF_8);
    }

    public static void writeBytesToFile(@Nonnull File file, @Nonnull byte[] content) throws IOException {
        ensureDirectory(file.getAbsoluteFile().getParentFile());
        Files.write(file.toPath(), content);
    }

    /**
     * 去掉扩展名，如 mapping.txt → mapping
     */
    public static String getBaseName(File file) {
        String name = file.getName();
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(0, lastDot) : name;
    }
}
