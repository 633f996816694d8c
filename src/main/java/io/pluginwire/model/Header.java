package io.pluginwire.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Identity, routing and type of one message. A reply carries the request's header as its
 * {@code parent_header}.
 */
@JsonPropertyOrder({"msg_id", "session", "date", "source", "target", "msg_type", "version"})
public record Header(
        @JsonProperty("msg_id") String msgId,
        @JsonProperty("session") String session,
        @JsonProperty("date") String date,
        @JsonProperty("source") String source,
        @JsonProperty("target") String target,
        @JsonProperty("msg_type") String msgType,
        @JsonProperty("version") String version
) {
    public MessageType messageType() {
        return MessageType.of(msgType);
    }
}
