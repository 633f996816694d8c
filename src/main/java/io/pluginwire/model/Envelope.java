package io.pluginwire.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One protocol message: header, optional parent header, envelope metadata and
 * type-specific content.
 *
 * <p>Metadata and content are copied on construction. Nested maps and lists are copied
 * as well and wrapped unmodifiable, so later changes to the caller's structures do not
 * reach the envelope. Byte arrays are kept as given.
 */
@JsonPropertyOrder({"header", "parent_header", "metadata", "content"})
public record Envelope(
        @JsonProperty("header") Header header,
        @JsonProperty("parent_header") @JsonInclude(JsonInclude.Include.NON_NULL) Header parentHeader,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("content") Map<String, Object> content
) {
    public Envelope {
        metadata = frozen(metadata);
        content = frozen(content);
    }

    public static Envelope of(Header header, Map<String, Object> content) {
        return new Envelope(header, null, Map.of(), content);
    }

    public static Envelope reply(Header header, Header parentHeader, Map<String, Object> content) {
        return new Envelope(header, parentHeader, Map.of(), content);
    }

    public MessageType messageType() {
        return header == null ? null : header.messageType();
    }

    public Object contentValue(String key) {
        return content.get(key);
    }

    private static Map<String, Object> frozen(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        raw.forEach((key, value) -> copy.put(key, frozenValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object frozenValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, frozenValue(nested)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object nested : list) {
                copy.add(frozenValue(nested));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
