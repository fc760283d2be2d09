package likelion._th.safepath.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IncidentCategory {
    ENCAMPMENT("encampment"),
    AGGRESSIVE_BEHAVIOR("aggressive-behavior"),
    CRIME("crime"),
    SUSPICIOUS_ACTIVITY("suspicious-activity");

    private final String code;

    IncidentCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isSocial() {
        return this == ENCAMPMENT || this == AGGRESSIVE_BEHAVIOR;
    }
}
