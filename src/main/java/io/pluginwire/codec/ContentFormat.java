package io.pluginwire.codec;

/**
 * One payload serialization scheme, selected by the identifier stamped in
 * {@code content.metadata.mime_type}.
 *
 * <p>Text formats (JSON, YAML) do not keep Java number types: integers come back as the
 * smallest of {@code Integer}, {@code Long} or {@code BigInteger} that holds the value, and
 * decimals as {@code Double}. Use {@link ContentCodec#decode(java.util.Map, Class)} to get
 * a specific type back.
 */
public interface ContentFormat {
    String mimeType();

    /**
     * Turns an in-memory value into what goes in {@code content.data}.
     */
    Object encode(Object data);

    /**
     * Recovers the in-memory value from {@code content.data}. Never called with {@code null}.
     */
    Object decode(Object data);
}
