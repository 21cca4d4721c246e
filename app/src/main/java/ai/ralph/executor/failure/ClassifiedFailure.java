package ai.ralph.executor.failure;

/**
 * A failure ready to be shown to a user.
 *
 * @param category stable tag
 * @param userMessage short, actionable text
 * @param technicalDetails verbose blob for support: error message, stderr and exit code
 * @param partialOutput whatever the tool produced before failing, so the work is not lost
 */
public record ClassifiedFailure(
        FailureCategory category, String userMessage, String technicalDetails, String partialOutput) {
    public ClassifiedFailure {
        if (userMessage == null || userMessage.isBlank()) {
            userMessage = "Unknown error";
        }
        if (partialOutput == null) {
            partialOutput = "";
        }
    }
}
