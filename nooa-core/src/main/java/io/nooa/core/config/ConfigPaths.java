package io.nooa.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path resolveWorkspace(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of("").toAbsolutePath().normalize();
        }
        return expandHome(rawPath).toAbsolutePath().normalize();
    }

    /**
     * Resolves {@code rawPath} against the workspace, falling back to {@code defaultRelative}.
     */
    public static Path resolve(Path workspace, String rawPath, String defaultRelative) {
        if (rawPath == null || rawPath.isBlank()) {
            return workspace.resolve(defaultRelative);
        }
        Path path = expandHome(rawPath.trim());
        return path.isAbsolute() ? path : workspace.resolve(path);
    }

    private static Path expandHome(String rawPath) {
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
