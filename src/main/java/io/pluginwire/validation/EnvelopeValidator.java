package io.pluginwire.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.pluginwire.error.SchemaValidationException;
import io.pluginwire.error.UnknownMessageTypeException;
import io.pluginwire.model.Envelope;
import io.pluginwire.schema.SchemaRegistry;
import io.pluginwire.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Structural conformance check for envelopes.
 *
 * <p>One compiled schema per message type (plus {@code base_message}) is built in the
 * constructor; afterwards the instance is read-only and may be shared between threads
 * without locking.
 */
public final class EnvelopeValidator {
    private static final Logger LOGGER = LoggerFactory.getLogger(EnvelopeValidator.class);
    private static final JsonSchemaFactory SCHEMA_FACTORY = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V4);

    private final SchemaRegistry registry;
    private final Map<String, JsonSchema> compiled;

    public EnvelopeValidator(SchemaRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        Map<String, JsonSchema> schemas = new LinkedHashMap<>();
        schemas.put(SchemaRegistry.BASE_MESSAGE, compile(registry, SchemaRegistry.BASE_MESSAGE));
        for (String type : registry.messageTypes()) {
            schemas.put(type, compile(registry, type));
        }
        this.compiled = Collections.unmodifiableMap(schemas);
        LOGGER.debug("Compiled envelope validators for {}", compiled.keySet());
    }

    /**
     * Validators for {@link SchemaRegistry#standard()}, compiled once per process.
     */
    public static EnvelopeValidator shared() {
        return Holder.SHARED;
    }

    public SchemaRegistry registry() {
        return registry;
    }

    /**
     * Checks {@code envelope} against the base schema, then against the schema of its
     * {@code header.msg_type}.
     *
     * @return the same envelope, for chaining
     * @throws SchemaValidationException if either check fails, or if the envelope holds a value
     *                                   with no JSON form
     */
    public Envelope validate(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        JsonNode tree;
        try {
            tree = Jsons.compact().valueToTree(envelope);
        } catch (IllegalArgumentException e) {
            LOGGER.debug("Rejected envelope that cannot be written as JSON: {}", e.getMessage());
            throw new SchemaValidationException(SchemaRegistry.BASE_MESSAGE,
                    List.of("envelope is not representable as JSON: " + e.getMessage()));
        }
        validate(tree);
        return envelope;
    }

    /**
     * Same as {@link #validate(Envelope)} for envelope data still in tree form, e.g. as
     * read off the transport.
     */
    public JsonNode validate(JsonNode envelope) {
        Objects.requireNonNull(envelope, "envelope");
        check(SchemaRegistry.BASE_MESSAGE, envelope);
        String msgType = envelope.path("header").path("msg_type").asText();
        if (!compiled.containsKey(msgType) || SchemaRegistry.BASE_MESSAGE.equals(msgType)) {
            LOGGER.debug("Rejected envelope with unregistered msg_type={}", msgType);
            throw new UnknownMessageTypeException(msgType);
        }
        check(msgType, envelope);
        return envelope;
    }

    public boolean isValid(JsonNode envelope) {
        try {
            validate(envelope);
            return true;
        } catch (SchemaValidationException e) {
            return false;
        }
    }

    private void check(String schemaName, JsonNode envelope) {
        Set<ValidationMessage> messages = compiled.get(schemaName).validate(envelope);
        if (messages.isEmpty()) {
            return;
        }
        List<String> violations = new ArrayList<>(messages.size());
        for (ValidationMessage message : messages) {
            violations.add(message.getMessage());
        }
        Collections.sort(violations);
        LOGGER.debug("Rejected envelope against {}: {}", schemaName, violations);
        throw new SchemaValidationException(schemaName, violations);
    }

    private static JsonSchema compile(SchemaRegistry registry, String schemaName) {
        JsonSchema schema = SCHEMA_FACTORY.getSchema(registry.schema(schemaName));
        // Resolve $ref chains now so concurrent validate() calls only read.
        schema.initializeValidators();
        return schema;
    }

    private static final class Holder {
        private static final EnvelopeValidator SHARED = new EnvelopeValidator(SchemaRegistry.standard());
    }
}
