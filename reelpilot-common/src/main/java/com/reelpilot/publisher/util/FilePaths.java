package com.reelpilot.publisher.util;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class FilePaths {

    private FilePaths() {
    }

    /**
     * Absolute, normalized form used as the identity of a file across the registry and the queue.
     */
    public static String normalize(String filePath) {
        return Paths.get(filePath).toAbsolutePath().normalize().toString();
    }

    public static String fileName(String filePath) {
        if (filePath == null) {
            return null;
        }
        Path name = Paths.get(filePath).getFileName();
        return name != null ? name.toString() : filePath;
    }

    /**
     * @return the extension including its dot, or an empty string when the name has none
     */
    public static String extension(String filePath) {
        String name = fileName(filePath);
        if (name == null) {
            return "";
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }
}
