package ai.ralph.executor.jobs;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Checks that a repository path handed over by the job queue is safe to run the tool in: not a system directory,
 * not inside a credential store and, when base paths are configured, below one of them.
 */
public final class ProjectPathValidator {
    private static final Logger logger = LogManager.getLogger(ProjectPathValidator.class);

    static final List<String> PROTECTED_DIRECTORIES = List.of(
            "/etc",
            "/bin",
            "/sbin",
            "/usr/bin",
            "/usr/sbin",
            "/System",
            "/Library",
            "/private",
            "/Windows",
            "/Program Files",
            "/Program Files (x86)",
            "/root",
            "/boot",
            "/dev",
            "/proc",
            "/sys");

    static final List<String> SENSITIVE_SUBDIRECTORIES = List.of(
            ".ssh",
            ".aws",
            ".config/gcloud",
            ".azure",
            ".kube",
            ".docker",
            ".gnupg",
            "Library/Keychains",
            "AppData/Roaming",
            ".password-store",
            ".config/1Password",
            ".config/Bitwarden");

    private final List<Path> allowedBasePaths;

    public ProjectPathValidator(List<Path> allowedBasePaths) {
        this.allowedBasePaths = allowedBasePaths.stream()
                .map(p -> p.toAbsolutePath().normalize())
                .toList();
    }

    /** Validates a raw path string, as it arrives from the queue. */
    public Path validate(@Nullable String rawPath) throws UnsafePathException {
        if (rawPath == null || rawPath.isBlank()) {
            throw new UnsafePathException("Project path is empty");
        }
        if (rawPath.indexOf('\0') >= 0) {
            logger.error("Path contains null bytes (potential attack)");
            throw new UnsafePathException("Invalid or unsafe project path: path contains null bytes");
        }
        return validate(Path.of(rawPath));
    }

    /**
     * Resolves {@code path} to an absolute, normalized path and checks it.
     *
     * @return the normalized path
     */
    public Path validate(Path path) throws UnsafePathException {
        var resolved = path.toAbsolutePath().normalize();
        var unix = resolved.toString().replace(File.separatorChar, '/');

        for (var dir : PROTECTED_DIRECTORIES) {
            if (unix.equals(dir) || unix.startsWith(dir + "/")) {
                logger.error("Path points to protected system directory: {}", resolved);
                throw new UnsafePathException(
                        "Invalid or unsafe project path: " + path + " is a protected system directory");
            }
        }

        for (var dir : SENSITIVE_SUBDIRECTORIES) {
            if (unix.contains("/" + dir + "/") || unix.endsWith("/" + dir)) {
                logger.error("Path contains sensitive directory: {}", dir);
                throw new UnsafePathException("Invalid or unsafe project path: " + path + " is inside " + dir);
            }
        }

        if (!allowedBasePaths.isEmpty()) {
            var allowed = allowedBasePaths.stream().anyMatch(resolved::startsWith);
            if (!allowed) {
                logger.error("Path is outside allowed base paths: {}", resolved);
                throw new UnsafePathException(
                        "Invalid or unsafe project path: " + path + " is outside the allowed paths");
            }
        } else if (!unix.startsWith("/Users/") && !unix.startsWith("/home/")) {
            logger.warn("Path is outside typical user directories: {}", resolved);
        }

        return resolved;
    }

    /** Like {@link #validate(Path)}, and the directory must exist. Used for code-change jobs. */
    public Path validateStrict(Path path) throws UnsafePathException {
        var resolved = validate(path);
        if (!Files.isDirectory(resolved)) {
            throw new UnsafePathException("Project path does not exist: " + resolved);
        }
        logger.debug("Project path validated (strict): {}", resolved);
        return resolved;
    }

    /** The validated path if it is safe and exists, otherwise {@code fallback}. Used for artifact jobs. */
    public Path resolveWithFallback(@Nullable Path path, Path fallback) {
        if (path == null) {
            logger.info("No project path provided, using default directory {}", fallback);
            return fallback;
        }
        try {
            var resolved = validate(path);
            if (Files.isDirectory(resolved)) {
                logger.info("Using project directory {}", resolved);
                return resolved;
            }
            logger.warn("Project path {} does not exist, using default directory {}", resolved, fallback);
        } catch (UnsafePathException e) {
            logger.warn("{}; using default directory {}", e.getMessage(), fallback);
        }
        return fallback;
    }

    /** The path is unsafe or missing. */
    public static class UnsafePathException extends Exception {
        public UnsafePathException(String message) {
            super(message);
        }
    }
}
