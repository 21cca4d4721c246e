package ai.ralph.executor.failure;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Maps a raw failure (error, stderr, exit code) to a {@link ClassifiedFailure}. Rules are tried in order and the first
 * match wins, so a spawn error code beats any diagnostic text and diagnostic text beats the exit code.
 */
public final class FailureClassifier {
    private static final Logger logger = LogManager.getLogger(FailureClassifier.class);

    private static final Pattern NOT_AUTHENTICATED =
            Pattern.compile("not authenticated|authentication failed|please log in", Pattern.CASE_INSENSITIVE);
    private static final Pattern OUT_OF_QUOTA =
            Pattern.compile("token limit exceeded|quota exceeded|insufficient credits", Pattern.CASE_INSENSITIVE);
    private static final Pattern RATE_LIMITED =
            Pattern.compile("rate limit|too many requests|429", Pattern.CASE_INSENSITIVE);
    private static final Pattern PERMISSION_DENIED =
            Pattern.compile("permission denied|EACCES", Pattern.CASE_INSENSITIVE);

    /** The facts a rule may look at. */
    record Signal(String errorMessage, @Nullable String errorCode, String diagnostic, @Nullable Integer exitCode) {}

    record Rule(FailureCategory category, Predicate<Signal> matches, Function<Signal, String> message) {}

    private final List<Rule> rules;

    public FailureClassifier(String toolName) {
        this.rules = List.of(
                new Rule(
                        FailureCategory.TOOL_NOT_INSTALLED,
                        s -> ErrorCodes.ENOENT.equals(s.errorCode()),
                        s -> toolName + " is not installed or not found in PATH"),
                new Rule(
                        FailureCategory.NOT_AUTHENTICATED,
                        s -> NOT_AUTHENTICATED.matcher(s.diagnostic()).find(),
                        s -> toolName + " is not authenticated. Please log in and retry"),
                new Rule(
                        FailureCategory.OUT_OF_QUOTA,
                        s -> OUT_OF_QUOTA.matcher(s.diagnostic()).find(),
                        s -> "API token limit has been exceeded"),
                new Rule(
                        FailureCategory.RATE_LIMITED,
                        s -> RATE_LIMITED.matcher(s.diagnostic()).find(),
                        s -> "API rate limit reached. Please wait before retrying"),
                new Rule(
                        FailureCategory.PERMISSION_DENIED,
                        s -> PERMISSION_DENIED.matcher(s.diagnostic()).find()
                                || ErrorCodes.EACCES.equals(s.errorCode()),
                        s -> "Permission denied accessing project files or directories"),
                new Rule(
                        FailureCategory.EXECUTION_TIMEOUT,
                        s -> s.errorMessage().contains("timed out"),
                        s -> "Job execution exceeded the maximum timeout"),
                new Rule(
                        FailureCategory.NETWORK_ERROR,
                        s -> ErrorCodes.ECONNREFUSED.equals(s.errorCode())
                                || ErrorCodes.ENOTFOUND.equals(s.errorCode())
                                || ErrorCodes.ETIMEDOUT.equals(s.errorCode()),
                        s -> "Network error connecting to the " + toolName + " API"),
                new Rule(
                        FailureCategory.EXECUTION_ERROR,
                        s -> s.exitCode() != null && s.exitCode() != 0,
                        s -> toolName + " execution failed with exit code " + s.exitCode()));
    }

    public ClassifiedFailure classify(Throwable error, @Nullable String diagnosticText, @Nullable Integer exitCode) {
        return classify(error, diagnosticText, exitCode, "");
    }

    public ClassifiedFailure classify(
            Throwable error, @Nullable String diagnosticText, @Nullable Integer exitCode, String partialOutput) {
        return classify(messageOf(error), ErrorCodes.fromThrowable(error), diagnosticText, exitCode, partialOutput);
    }

    /**
     * Classifies from already extracted facts.
     *
     * @param errorMessage message of the raw error
     * @param errorCode system error code of a spawn or network failure, e.g. {@code ENOENT}
     * @param diagnosticText stderr of the tool
     * @param exitCode exit status, null if the process never exited on its own
     * @param partialOutput output produced before the failure
     */
    public ClassifiedFailure classify(
            String errorMessage,
            @Nullable String errorCode,
            @Nullable String diagnosticText,
            @Nullable Integer exitCode,
            String partialOutput) {
        var diagnostic = Objects.requireNonNullElse(diagnosticText, "");
        var signal = new Signal(errorMessage, errorCode, diagnostic, exitCode);
        var technicalDetails = "Error: " + errorMessage + "\nStderr: " + diagnostic + "\nExit Code: " + exitCode;

        for (var rule : rules) {
            if (rule.matches().test(signal)) {
                logger.debug("Error categorized as: {}", rule.category().tag());
                return new ClassifiedFailure(
                        rule.category(), rule.message().apply(signal), technicalDetails, partialOutput);
            }
        }
        logger.debug("Error categorized as: {}", FailureCategory.UNKNOWN.tag());
        return new ClassifiedFailure(FailureCategory.UNKNOWN, errorMessage, technicalDetails, partialOutput);
    }

    private static String messageOf(Throwable error) {
        var message = error.getMessage();
        return message == null ? error.getClass().getSimpleName() : message;
    }
}
