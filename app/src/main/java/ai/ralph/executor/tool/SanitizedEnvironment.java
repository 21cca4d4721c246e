package ai.ralph.executor.tool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Builds the environment the tool process runs with: an allow-list of the parent's variables, minus secrets. */
public final class SanitizedEnvironment {
    private static final Logger logger = LogManager.getLogger(SanitizedEnvironment.class);

    public static final List<String> ALLOWED =
            List.of("PATH", "HOME", "USER", "LANG", "LC_ALL", "TERM", "TMPDIR", "SHELL");

    private static final List<Pattern> BLOCKED = List.of(
            Pattern.compile("^RALPH_API_TOKEN$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^RALPHBLASTER_API_TOKEN$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^.*_TOKEN$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^.*_SECRET$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^.*_KEY$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^.*_PASSWORD$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^AWS_", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^AZURE_", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^GCP_", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^GOOGLE_", Pattern.CASE_INSENSITIVE));

    private SanitizedEnvironment() {}

    public static Map<String, String> fromSystem() {
        return from(System.getenv());
    }

    public static Map<String, String> from(Map<String, String> parent) {
        var safe = new LinkedHashMap<String, String>();
        for (var name : ALLOWED) {
            var value = parent.get(name);
            if (value != null && !value.isEmpty() && !isBlocked(name)) {
                safe.put(name, value);
            }
        }
        logger.debug(
                "Sanitized environment: {}",
                safe.keySet().stream().filter(k -> !k.equals("HOME")).toList());
        return safe;
    }

    public static boolean isBlocked(String name) {
        for (var pattern : BLOCKED) {
            if (pattern.matcher(name).find()) {
                return true;
            }
        }
        return false;
    }
}
