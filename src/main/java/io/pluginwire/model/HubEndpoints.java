package io.pluginwire.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Typed form of {@code connect_reply} content: where the hub's command socket and
 * publish socket listen.
 */
public record HubEndpoints(
        String commandUri,
        int commandPort,
        String name,
        String publishUri,
        int publishPort
) {
    public HubEndpoints {
        Objects.requireNonNull(commandUri, "commandUri");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(publishUri, "publishUri");
    }

    public Map<String, Object> toContent() {
        Map<String, Object> command = new LinkedHashMap<>();
        command.put("uri", commandUri);
        command.put("port", commandPort);
        command.put("name", name);
        Map<String, Object> publish = new LinkedHashMap<>();
        publish.put("uri", publishUri);
        publish.put("port", publishPort);
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("command", command);
        content.put("publish", publish);
        return content;
    }

    public static HubEndpoints fromContent(Map<String, Object> content) {
        Map<?, ?> command = section(content, "command");
        Map<?, ?> publish = section(content, "publish");
        return new HubEndpoints(
                String.valueOf(command.get("uri")),
                port(command.get("port"), "command.port"),
                String.valueOf(command.get("name")),
                String.valueOf(publish.get("uri")),
                port(publish.get("port"), "publish.port")
        );
    }

    private static Map<?, ?> section(Map<String, Object> content, String key) {
        Object value = content == null ? null : content.get(key);
        if (value instanceof Map<?, ?> map) {
            return map;
        }
        throw new IllegalArgumentException("connect_reply content missing object: " + key);
    }

    private static int port(Object raw, String field) {
        if (raw instanceof Number number) {
            return number.intValue();
        }
        throw new IllegalArgumentException("connect_reply content has non-numeric " + field + ": " + raw);
    }
}
