package ai.ralph.executor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** What a job asks the tool to do. */
public enum JobKind {
    /** Produce a text artifact (PRD, plan) in the repository directory; no workspace is created. */
    ARTIFACT_GENERATION("artifact_generation"),
    /** Change code on a dedicated branch inside an isolated workspace. */
    CODE_CHANGE("code_change");

    private final String wireName;

    JobKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static JobKind fromWireName(String value) {
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (var kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown job type: " + value);
    }
}
