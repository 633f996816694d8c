package io.pluginwire.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pluginwire.error.UnknownMessageTypeException;
import io.pluginwire.model.MessageType;
import io.pluginwire.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structural definitions of the envelope and of every registered message type.
 *
 * <p>The source document keeps one entry per type under {@code definitions}, each
 * composed as {@code allOf: [base_message, type constraints]}. {@link #schema(String)}
 * wraps such an entry into a standalone document whose root refers to it, so the base
 * requirements always apply on top of the type's own.
 *
 * <p>Instances are immutable: the document is never handed out, only deep copies of it.
 */
public final class SchemaRegistry {
    public static final String RESOURCE = "/io/pluginwire/schema/message-schema.json";
    public static final String BASE_MESSAGE = "base_message";

    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaRegistry.class);

    private final ObjectNode document;
    private final List<String> messageTypes;
    private final List<String> supportedVersions;
    private final String defaultVersion;

    private SchemaRegistry(ObjectNode document) {
        this.document = document;
        JsonNode header = document.path("definitions").path("header").path("properties");
        this.messageTypes = textValues(header.path("msg_type").path("enum"), "header.msg_type.enum");
        this.supportedVersions = textValues(header.path("version").path("enum"), "header.version.enum");
        this.defaultVersion = header.path("version").path("default").asText(
                supportedVersions.get(supportedVersions.size() - 1));
        if (!document.path("definitions").path(BASE_MESSAGE).isObject()) {
            throw new IllegalArgumentException("Schema document has no " + BASE_MESSAGE + " definition");
        }
        for (String type : messageTypes) {
            if (!document.path("definitions").path(type).isObject()) {
                throw new IllegalArgumentException("Schema document lists message type without definition: " + type);
            }
        }
    }

    /**
     * Registry built from the bundled schema document. Loaded on first use and shared by
     * the whole process.
     */
    public static SchemaRegistry standard() {
        return Holder.STANDARD;
    }

    public static SchemaRegistry load(InputStream in) {
        Objects.requireNonNull(in, "in");
        try {
            JsonNode root = Jsons.compact().readTree(in);
            if (root == null || !root.isObject()) {
                throw new IllegalArgumentException("Schema document must be a JSON object");
            }
            return new SchemaRegistry((ObjectNode) root);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read schema document", e);
        }
    }

    /**
     * Starts a registry that extends this one with more message types.
     */
    public Builder toBuilder() {
        return new Builder(document.deepCopy());
    }

    /**
     * Standalone schema for {@code typeTag}: base envelope AND the type's own constraints.
     *
     * @throws UnknownMessageTypeException if the tag is neither registered nor {@code base_message}
     */
    public ObjectNode schema(String typeTag) {
        if (!BASE_MESSAGE.equals(typeTag) && !isRegistered(typeTag)) {
            throw new UnknownMessageTypeException(typeTag);
        }
        ObjectNode schema = Jsons.compact().createObjectNode();
        schema.set("definitions", document.path("definitions").deepCopy());
        ArrayNode allOf = schema.putArray("allOf");
        allOf.addObject().put("$ref", "#/definitions/" + typeTag);
        return schema;
    }

    public ObjectNode schema(MessageType type) {
        return schema(type.tag());
    }

    public ObjectNode baseSchema() {
        return schema(BASE_MESSAGE);
    }

    /**
     * Copy of a single named definition, e.g. {@code header} or {@code error}.
     */
    public ObjectNode definition(String name) {
        JsonNode node = document.path("definitions").path(name);
        if (!node.isObject()) {
            throw new IllegalArgumentException("No schema definition named " + name);
        }
        return (ObjectNode) node.deepCopy();
    }

    public List<String> messageTypes() {
        return messageTypes;
    }

    public boolean isRegistered(String typeTag) {
        return typeTag != null && messageTypes.contains(typeTag);
    }

    public List<String> supportedVersions() {
        return supportedVersions;
    }

    public String defaultVersion() {
        return defaultVersion;
    }

    private static List<String> textValues(JsonNode array, String where) {
        if (!array.isArray() || array.isEmpty()) {
            throw new IllegalArgumentException("Schema document is missing " + where);
        }
        List<String> out = new ArrayList<>(array.size());
        for (JsonNode value : array) {
            out.add(value.asText());
        }
        return List.copyOf(out);
    }

    /**
     * Adds message types to a copy of an existing document. Existing definitions are left
     * untouched; each new type is composed with {@code base_message} and its tag is appended
     * to the header's {@code msg_type} enum.
     */
    public static final class Builder {
        private final ObjectNode document;

        private Builder(ObjectNode document) {
            this.document = document;
        }

        public Builder define(String typeTag, String description, ObjectNode constraints) {
            Objects.requireNonNull(typeTag, "typeTag");
            if (typeTag.isBlank() || BASE_MESSAGE.equals(typeTag)) {
                throw new IllegalArgumentException("invalid message type tag: '" + typeTag + "'");
            }
            ObjectNode definitions = (ObjectNode) document.path("definitions");
            if (definitions.has(typeTag)) {
                throw new IllegalArgumentException("schema definition already exists: " + typeTag);
            }
            ObjectNode definition = definitions.putObject(typeTag);
            if (description != null && !description.isBlank()) {
                definition.put("description", description);
            }
            ArrayNode allOf = definition.putArray("allOf");
            allOf.addObject().put("$ref", "#/definitions/" + BASE_MESSAGE);
            if (constraints != null && !constraints.isEmpty()) {
                allOf.add(constraints.deepCopy());
            }
            ArrayNode tags = (ArrayNode) definitions.path("header").path("properties").path("msg_type").path("enum");
            tags.add(typeTag);
            return this;
        }

        public Builder define(MessageType type, ObjectNode constraints) {
            return define(type.tag(), null, constraints);
        }

        public SchemaRegistry build() {
            return new SchemaRegistry(document.deepCopy());
        }
    }

    private static final class Holder {
        private static final SchemaRegistry STANDARD = loadStandard();

        private static SchemaRegistry loadStandard() {
            try (InputStream in = SchemaRegistry.class.getResourceAsStream(RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Missing schema resource " + RESOURCE);
                }
                SchemaRegistry registry = load(in);
                LOGGER.debug("Loaded message schema: types={} versions={}",
                        registry.messageTypes(), registry.supportedVersions());
                return registry;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to close schema resource " + RESOURCE, e);
            }
        }
    }
}
