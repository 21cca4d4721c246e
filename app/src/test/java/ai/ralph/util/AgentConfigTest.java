package ai.ralph.util;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class AgentConfigTest {

    @Test
    void testDefaultsComeFromBundledProperties() {
        var config = AgentConfig.load(Map.of());

        assertEquals("claude", config.toolExecutable());
        assertEquals(
                List.of(
                        "-p",
                        "--output-format",
                        "stream-json",
                        "--include-partial-messages",
                        "--permission-mode",
                        "acceptEdits",
                        "--verbose"),
                config.toolArgs());
        assertEquals(Duration.ofHours(2), config.defaultToolTimeout());
        assertEquals(Duration.ofSeconds(2), config.killGracePeriod());
        assertEquals(Duration.ofSeconds(30), config.gitTimeout());
        assertEquals(3, config.worktreeMaxRetries());
        assertEquals(Duration.ofSeconds(1), config.worktreeInitialBackoff());
        assertEquals(Duration.ofMillis(500), config.staleCleanupDelay());
        assertEquals("ralph", config.branchPrefix());
        assertEquals(".ralph-logs", config.logDirName());
        assertTrue(config.allowedBasePaths().isEmpty());
    }

    @Test
    void testEnvironmentOverridesDefaults() {
        var env = Map.of(
                "RALPH_TOOL_TIMEOUT_MINUTES", "30",
                "RALPH_WORKTREE_BRANCH_PREFIX", "agent",
                "RALPH_ALLOWED_PATHS", "/srv/projects:/home/dev");

        var config = AgentConfig.load(env);

        assertEquals(Duration.ofMinutes(30), config.defaultToolTimeout());
        assertEquals("agent", config.branchPrefix());
        assertEquals(List.of(Path.of("/srv/projects"), Path.of("/home/dev")), config.allowedBasePaths());
    }

    @Test
    void testEnvNameForKey() {
        assertEquals("RALPH_TOOL_KILL_GRACE_MS", AgentConfig.envNameFor("tool.kill-grace.ms"));
        assertEquals("RALPH_LOGS_DIR_NAME", AgentConfig.envNameFor("logs.dir-name"));
    }

    @Test
    void testNonNumericSettingIsRejected() {
        var ex = assertThrows(
                IllegalArgumentException.class, () -> AgentConfig.load(Map.of("RALPH_GIT_TIMEOUT_SECONDS", "soon")));
        assertTrue(ex.getMessage().contains("git.timeout.seconds"));
    }

    @Test
    void testMissingExecutableIsRejected() {
        var props = new Properties();
        props.setProperty("tool.timeout.minutes", "10");

        assertThrows(IllegalArgumentException.class, () -> AgentConfig.fromProperties(props));
    }

    @Test
    void testWithToolCommandKeepsOtherSettings() {
        var config = AgentConfig.load(Map.of()).withToolCommand("/bin/sh", List.of("-c", "true"));

        assertEquals("/bin/sh", config.toolExecutable());
        assertEquals(List.of("-c", "true"), config.toolArgs());
        assertEquals("ralph", config.branchPrefix());
    }
}
