package io.pluginwire.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionStatus {
    OK("ok"),
    ERROR("error"),
    ABORT("abort");

    private final String wireName;

    ExecutionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a wire tag ({@code ok}, {@code error}, {@code abort}).
     *
     * @throws IllegalArgumentException for blank or unknown tags
     */
    @JsonCreator
    public static ExecutionStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Execution status cannot be blank");
        }
        String normalized = raw.trim();
        for (ExecutionStatus value : values()) {
            if (value.wireName.equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown execution status: " + raw);
    }
}
