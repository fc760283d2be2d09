package likelion._th.safepath.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Incident severity. Declaration order is the severity order, so
 * {@link #compareTo} gives low &lt; medium &lt; high.
 */
public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String code;

    Severity(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
