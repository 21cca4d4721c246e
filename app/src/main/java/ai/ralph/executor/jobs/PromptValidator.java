package ai.ralph.executor.jobs;

import java.util.List;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Rejects prompts that are empty, oversized or ask for destructive or credential-harvesting operations. */
public final class PromptValidator {
    private static final Logger logger = LogManager.getLogger(PromptValidator.class);

    public static final int MAX_PROMPT_LENGTH = 500_000;
    private static final int PREVIEW_LENGTH = 200;

    private record DangerousPattern(Pattern pattern, String description) {
        DangerousPattern(String regex, String description) {
            this(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), description);
        }
    }

    private static final List<DangerousPattern> DANGEROUS = List.of(
            new DangerousPattern("rm\\s+-rf\\s+/", "dangerous deletion command"),
            new DangerousPattern("rm\\s+-rf\\s+~", "dangerous home directory deletion"),
            new DangerousPattern("/etc/passwd", "system file access"),
            new DangerousPattern("/etc/shadow", "password file access"),
            new DangerousPattern("curl.*\\|\\s*sh", "remote code execution pattern"),
            new DangerousPattern("wget.*\\|\\s*sh", "remote code execution pattern"),
            new DangerousPattern("eval\\s*\\(", "code evaluation"),
            new DangerousPattern("exec\\s*\\(", "code execution"),
            new DangerousPattern("\\$\\(.*rm.*-rf", "command injection with deletion"),
            new DangerousPattern("`.*rm.*-rf", "command injection with deletion"),
            new DangerousPattern("base64.*decode.*eval", "obfuscated code execution"),
            new DangerousPattern("\\.ssh/id_rsa", "SSH key access"),
            new DangerousPattern("\\.aws/credentials", "AWS credentials access"));

    public void validate(@Nullable String prompt) throws PromptRejectedException {
        if (prompt == null || prompt.isBlank()) {
            throw new PromptRejectedException("Prompt must be a non-empty string");
        }
        if (prompt.length() > MAX_PROMPT_LENGTH) {
            throw new PromptRejectedException(
                    "Prompt exceeds maximum length of " + MAX_PROMPT_LENGTH + " characters");
        }
        for (var dangerous : DANGEROUS) {
            if (dangerous.pattern().matcher(prompt).find()) {
                logger.error("Prompt validation failed: contains {}", dangerous.description());
                throw new PromptRejectedException(
                        "Prompt contains potentially dangerous content: " + dangerous.description());
            }
        }
        logger.debug("Prompt validated ({} chars): {}...", prompt.length(), preview(prompt));
    }

    static String preview(String prompt) {
        var head = prompt.length() <= PREVIEW_LENGTH ? prompt : prompt.substring(0, PREVIEW_LENGTH);
        return head.replace('\n', ' ').replace('\r', ' ');
    }
}
