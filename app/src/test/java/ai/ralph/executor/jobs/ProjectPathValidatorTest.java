package ai.ralph.executor.jobs;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProjectPathValidatorTest {

    @TempDir
    Path tempDir;

    private final ProjectPathValidator validator = new ProjectPathValidator(List.of());

    @Test
    void testProtectedSystemDirectoriesRejected() {
        assertThrows(ProjectPathValidator.UnsafePathException.class, () -> validator.validate(Path.of("/etc")));
        assertThrows(ProjectPathValidator.UnsafePathException.class, () -> validator.validate(Path.of("/etc/nginx")));
        assertThrows(ProjectPathValidator.UnsafePathException.class, () -> validator.validate(Path.of("/proc/1")));
        assertThrows(
                ProjectPathValidator.UnsafePathException.class,
                () -> validator.validate(Path.of("/home/dev/../../etc/cron.d")));
    }

    @Test
    void testSimilarlyNamedDirectoryAllowed() throws Exception {
        assertEquals(Path.of("/etcetera/project"), validator.validate(Path.of("/etcetera/project")));
    }

    @Test
    void testSensitiveSubdirectoriesRejected() {
        assertThrows(
                ProjectPathValidator.UnsafePathException.class, () -> validator.validate(Path.of("/home/dev/.ssh")));
        assertThrows(
                ProjectPathValidator.UnsafePathException.class,
                () -> validator.validate(Path.of("/home/dev/.config/gcloud/legacy")));
        assertThrows(
                ProjectPathValidator.UnsafePathException.class,
                () -> validator.validate(Path.of("/Users/dev/Library/Keychains")));
    }

    @Test
    void testNullByteRejected() {
        var ex = assertThrows(
                ProjectPathValidator.UnsafePathException.class, () -> validator.validate("/home/dev/repo\0/etc"));
        assertTrue(ex.getMessage().contains("null bytes"));
    }

    @Test
    void testAllowedBasePathsEnforced() throws Exception {
        var restricted = new ProjectPathValidator(List.of(tempDir.resolve("allowed")));

        assertEquals(
                tempDir.resolve("allowed/repo").toAbsolutePath(),
                restricted.validate(tempDir.resolve("allowed/repo")));
        assertThrows(
                ProjectPathValidator.UnsafePathException.class,
                () -> restricted.validate(tempDir.resolve("elsewhere/repo")));
        assertThrows(
                ProjectPathValidator.UnsafePathException.class,
                () -> restricted.validate(tempDir.resolve("allowed-but-not-really")));
    }

    @Test
    void testStrictRequiresExistingDirectory() throws Exception {
        var repo = Files.createDirectories(tempDir.resolve("repo"));

        assertEquals(repo.toAbsolutePath(), validator.validateStrict(repo));
        var ex = assertThrows(
                ProjectPathValidator.UnsafePathException.class,
                () -> validator.validateStrict(tempDir.resolve("missing")));
        assertTrue(ex.getMessage().startsWith("Project path does not exist"));
    }

    @Test
    void testFallbackForMissingOrUnsafePath() throws Exception {
        var repo = Files.createDirectories(tempDir.resolve("repo"));
        var fallback = tempDir.resolve("agent");

        assertEquals(repo.toAbsolutePath(), validator.resolveWithFallback(repo, fallback));
        assertEquals(fallback, validator.resolveWithFallback(tempDir.resolve("missing"), fallback));
        assertEquals(fallback, validator.resolveWithFallback(Path.of("/etc"), fallback));
        assertEquals(fallback, validator.resolveWithFallback(null, fallback));
    }
}
