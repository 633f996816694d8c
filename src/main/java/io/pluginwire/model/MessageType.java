package io.pluginwire.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Objects;

/**
 * Tag carried in {@code header.msg_type}.
 *
 * <p>The four constants are the types every registry knows about. Further tags are valid
 * once registered through {@link io.pluginwire.schema.SchemaRegistry.Builder#define}, so
 * this is a value type rather than an enum.
 */
public record MessageType(String tag) {
    public static final MessageType CONNECT_REQUEST = new MessageType("connect_request");
    public static final MessageType CONNECT_REPLY = new MessageType("connect_reply");
    public static final MessageType EXECUTE_REQUEST = new MessageType("execute_request");
    public static final MessageType EXECUTE_REPLY = new MessageType("execute_reply");

    public static final List<MessageType> WELL_KNOWN = List.of(
            CONNECT_REQUEST, CONNECT_REPLY, EXECUTE_REQUEST, EXECUTE_REPLY
    );

    public MessageType {
        Objects.requireNonNull(tag, "tag");
        if (tag.isBlank()) {
            throw new IllegalArgumentException("message type tag cannot be empty");
        }
    }

    @JsonCreator
    public static MessageType of(String tag) {
        for (MessageType known : WELL_KNOWN) {
            if (known.tag.equals(tag)) {
                return known;
            }
        }
        return new MessageType(tag);
    }

    @JsonValue
    @Override
    public String tag() {
        return tag;
    }

    @Override
    public String toString() {
        return tag;
    }
}
