package io.pluginwire.error;

import java.util.List;

/**
 * An envelope does not conform to the base schema or to the schema of its message type.
 */
public class SchemaValidationException extends ProtocolException {
    private final String schemaName;
    private final List<String> violations;

    public SchemaValidationException(String schemaName, List<String> violations) {
        super(describe(schemaName, violations));
        this.schemaName = schemaName;
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    protected SchemaValidationException(String schemaName, String message) {
        super(message);
        this.schemaName = schemaName;
        this.violations = List.of(message);
    }

    /**
     * Name of the schema definition that rejected the envelope, e.g. {@code base_message}.
     */
    public String schemaName() {
        return schemaName;
    }

    public List<String> violations() {
        return violations;
    }

    private static String describe(String schemaName, List<String> violations) {
        if (violations == null || violations.isEmpty()) {
            return "Envelope failed validation against " + schemaName;
        }
        return "Envelope failed validation against " + schemaName + ": " + String.join("; ", violations);
    }
}
