package io.pluginwire.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.pluginwire.error.WireFormatException;
import io.pluginwire.model.Envelope;
import io.pluginwire.util.Jsons;
import io.pluginwire.validation.EnvelopeValidator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * JSON text form of an envelope as it travels over the transport.
 *
 * <p>Incoming text is parsed to a tree and validated before it is bound, so an invalid
 * message never becomes an {@link Envelope}.
 */
public final class WireCodec {
    private final EnvelopeValidator validator;

    public WireCodec(EnvelopeValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public String toJson(Envelope envelope) {
        try {
            return Jsons.compact().writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new WireFormatException("Failed to write envelope " + msgIdOf(envelope), e);
        }
    }

    public byte[] toBytes(Envelope envelope) {
        return toJson(envelope).getBytes(StandardCharsets.UTF_8);
    }

    public Envelope fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new WireFormatException("Empty envelope text");
        }
        JsonNode tree;
        try {
            tree = Jsons.compact().readTree(json);
        } catch (JsonProcessingException e) {
            throw new WireFormatException("Envelope text is not valid JSON", e);
        }
        return bind(tree);
    }

    public Envelope fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new WireFormatException("Empty envelope frame");
        }
        JsonNode tree;
        try {
            tree = Jsons.compact().readTree(bytes);
        } catch (IOException e) {
            throw new WireFormatException("Envelope frame is not valid JSON", e);
        }
        return bind(tree);
    }

    /**
     * Validates an already parsed tree and binds it to an {@link Envelope}.
     */
    public Envelope bind(JsonNode tree) {
        if (tree == null || !tree.isObject()) {
            throw new WireFormatException("Envelope must be a JSON object");
        }
        validator.validate(tree);
        try {
            return Jsons.compact().treeToValue(tree, Envelope.class);
        } catch (JsonProcessingException e) {
            throw new WireFormatException("Failed to bind envelope", e);
        }
    }

    private static String msgIdOf(Envelope envelope) {
        return envelope == null || envelope.header() == null ? "<no header>" : envelope.header().msgId();
    }
}
