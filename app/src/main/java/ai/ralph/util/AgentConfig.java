package ai.ralph.util;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runtime settings of the job execution engine.
 *
 * <p>Defaults live in the classpath resource {@value #DEFAULTS_RESOURCE}. Every key can be overridden through an
 * environment variable named {@code RALPH_<KEY>} where dots and dashes become underscores, so
 * {@code tool.timeout.minutes} is read from {@code RALPH_TOOL_TIMEOUT_MINUTES}.
 *
 * @param toolExecutable executable of the external coding tool
 * @param toolArgs fixed flags passed to the tool (non-interactive, stream-json output, edit permission mode)
 * @param toolName display name used in user-facing failure messages
 * @param defaultToolTimeout timeout applied when a job does not carry its own
 * @param killGracePeriod delay between graceful termination and the forced kill
 * @param gitTimeout timeout for each git invocation
 * @param worktreeMaxRetries retries after the first workspace creation attempt
 * @param worktreeInitialBackoff first retry delay; doubled for every further retry
 * @param staleCleanupDelay pause after removing a leftover workspace before creating it again
 * @param branchPrefix namespace of job branches
 * @param logDirName name of the per-repository directory holding job transcripts
 * @param allowedBasePaths if non-empty, repositories must live below one of these paths
 */
public record AgentConfig(
        String toolExecutable,
        List<String> toolArgs,
        String toolName,
        Duration defaultToolTimeout,
        Duration killGracePeriod,
        Duration gitTimeout,
        int worktreeMaxRetries,
        Duration worktreeInitialBackoff,
        Duration staleCleanupDelay,
        String branchPrefix,
        String logDirName,
        List<Path> allowedBasePaths) {
    private static final Logger logger = LogManager.getLogger(AgentConfig.class);

    public static final String DEFAULTS_RESOURCE = "/ralph-agent.properties";
    public static final String ENV_PREFIX = "RALPH_";

    private static final Splitter ARG_SPLITTER = Splitter.on(' ').omitEmptyStrings().trimResults();
    private static final Splitter PATH_SPLITTER = Splitter.on(':').omitEmptyStrings().trimResults();

    public AgentConfig {
        if (toolExecutable.isBlank()) {
            throw new IllegalArgumentException("toolExecutable must not be blank");
        }
        if (defaultToolTimeout.isNegative() || defaultToolTimeout.isZero()) {
            throw new IllegalArgumentException("defaultToolTimeout must be positive, got: " + defaultToolTimeout);
        }
        if (killGracePeriod.isNegative()) {
            throw new IllegalArgumentException("killGracePeriod must not be negative, got: " + killGracePeriod);
        }
        if (worktreeMaxRetries < 0) {
            throw new IllegalArgumentException("worktreeMaxRetries must be >= 0, got: " + worktreeMaxRetries);
        }
        if (branchPrefix.isBlank() || branchPrefix.contains(" ")) {
            throw new IllegalArgumentException(
                    "branchPrefix must be a non-blank ref component: '" + branchPrefix + "'");
        }
        if (logDirName.isBlank() || logDirName.contains("/") || logDirName.contains("\\")) {
            throw new IllegalArgumentException("logDirName must be a plain directory name: '" + logDirName + "'");
        }
        toolArgs = List.copyOf(toolArgs);
        allowedBasePaths = List.copyOf(allowedBasePaths);
    }

    /** Defaults overlaid with the process environment. */
    public static AgentConfig load() {
        return load(System.getenv());
    }

    public static AgentConfig load(Map<String, String> env) {
        var props = loadDefaults();
        for (var key : props.stringPropertyNames()) {
            var override = env.get(envNameFor(key));
            if (override != null) {
                logger.debug("Config {} overridden from environment", key);
                props.setProperty(key, override);
            }
        }
        return fromProperties(props);
    }

    public static AgentConfig fromProperties(Properties props) {
        return new AgentConfig(
                required(props, "tool.executable"),
                ARG_SPLITTER.splitToList(props.getProperty("tool.args", "")),
                props.getProperty("tool.name", "the coding tool").trim(),
                Duration.ofMinutes(longValue(props, "tool.timeout.minutes")),
                Duration.ofMillis(longValue(props, "tool.kill-grace.ms")),
                Duration.ofSeconds(longValue(props, "git.timeout.seconds")),
                (int) longValue(props, "worktree.max-retries"),
                Duration.ofMillis(longValue(props, "worktree.initial-backoff.ms")),
                Duration.ofMillis(longValue(props, "worktree.stale-cleanup-delay.ms")),
                required(props, "worktree.branch-prefix"),
                required(props, "logs.dir-name"),
                PATH_SPLITTER.splitToList(props.getProperty("allowed.paths", "")).stream()
                        .map(Path::of)
                        .toList());
    }

    /** Maps a property key such as {@code tool.kill-grace.ms} to {@code RALPH_TOOL_KILL_GRACE_MS}. */
    static String envNameFor(String key) {
        return ENV_PREFIX + key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
    }

    public AgentConfig withToolCommand(String executable, List<String> args) {
        return new AgentConfig(
                executable,
                args,
                toolName,
                defaultToolTimeout,
                killGracePeriod,
                gitTimeout,
                worktreeMaxRetries,
                worktreeInitialBackoff,
                staleCleanupDelay,
                branchPrefix,
                logDirName,
                allowedBasePaths);
    }

    public AgentConfig withTimings(
            Duration killGracePeriod, Duration worktreeInitialBackoff, Duration staleCleanupDelay) {
        return new AgentConfig(
                toolExecutable,
                toolArgs,
                toolName,
                defaultToolTimeout,
                killGracePeriod,
                gitTimeout,
                worktreeMaxRetries,
                worktreeInitialBackoff,
                staleCleanupDelay,
                branchPrefix,
                logDirName,
                allowedBasePaths);
    }

    private static Properties loadDefaults() {
        var props = new Properties();
        try (InputStream in = AgentConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
        return props;
    }

    private static String required(Properties props, String key) {
        @Nullable String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required setting: " + key);
        }
        return value.trim();
    }

    private static long longValue(Properties props, String key) {
        var raw = required(props, key);
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting " + key + " must be a number, got: " + raw, e);
        }
    }
}
