package com.phillippitts.mediametric.service.process;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves external tool names the way a shell would, without invoking one.
 */
public final class ExecutableLocator {

    private ExecutableLocator() {
        // Utility class - prevent instantiation
    }

    /**
     * Resolves {@code binary} to an executable file.
     *
     * <p>A name containing a path separator is checked as a path; a bare name is looked up on
     * {@code PATH}.
     *
     * @param binary tool name or path
     * @return the executable, or empty if none is found
     */
    public static Optional<Path> locate(String binary) {
        if (binary == null || binary.isBlank()) {
            return Optional.empty();
        }
        if (binary.contains("/") || binary.contains(File.separator)) {
            Path p = Path.of(binary);
            return isExecutableFile(p) ? Optional.of(p.toAbsolutePath()) : Optional.empty();
        }
        String path = System.getenv("PATH");
        if (path == null) {
            return Optional.empty();
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir, binary);
            if (isExecutableFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public static boolean isAvailable(String binary) {
        return locate(binary).isPresent();
    }

    private static boolean isExecutableFile(Path p) {
        return Files.isRegularFile(p) && Files.isExecutable(p);
    }
}
