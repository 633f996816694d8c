package io.pluginwire.codec;

import io.pluginwire.config.PluginWireConfig;
import io.pluginwire.error.RemoteReportedException;
import io.pluginwire.error.UnsupportedFormatException;
import io.pluginwire.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Moves payload values in and out of {@code content.data}, keyed by the format identifier
 * in {@code content.metadata.mime_type}.
 *
 * <p>Formats live in an identifier-to-{@link ContentFormat} map fixed at construction, so
 * a codec can be shared freely between threads.
 */
public final class ContentCodec {
    public static final String DATA = "data";
    public static final String METADATA = "metadata";
    public static final String MIME_TYPE = "mime_type";
    public static final String ERROR = "error";

    private static final Logger LOGGER = LoggerFactory.getLogger(ContentCodec.class);

    private final Map<String, ContentFormat> formats;
    private final String defaultFormat;

    private ContentCodec(Map<String, ContentFormat> formats, String defaultFormat) {
        this.formats = Collections.unmodifiableMap(new LinkedHashMap<>(formats));
        this.defaultFormat = defaultFormat;
    }

    public static ContentCodec standard() {
        return Holder.STANDARD;
    }

    public static ContentCodec fromConfig(PluginWireConfig config) {
        return builder()
                .withBuiltIns(config.nativeFilter())
                .defaultFormat(config.defaultFormat())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String defaultFormat() {
        return defaultFormat;
    }

    public Set<String> formats() {
        return formats.keySet();
    }

    public boolean supports(String format) {
        return format != null && formats.containsKey(format);
    }

    public Map<String, Object> encode(Object data) {
        return encode(data, defaultFormat);
    }

    /**
     * Content fragment holding {@code data} serialized as {@code format}.
     *
     * <p>Absent data yields an empty fragment. A {@code null} format stores the value as is
     * and stamps no {@code mime_type}.
     *
     * @throws UnsupportedFormatException if {@code format} is not registered
     */
    public Map<String, Object> encode(Object data, String format) {
        Map<String, Object> content = new LinkedHashMap<>();
        if (data == null) {
            return content;
        }
        if (format == null) {
            content.put(DATA, data);
            return content;
        }
        content.put(DATA, lookup(format).encode(data));
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(MIME_TYPE, format);
        content.put(METADATA, metadata);
        return content;
    }

    /**
     * Recovers the payload of a content mapping.
     *
     * @return the decoded value, or {@code null} when the content carries no data
     * @throws RemoteReportedException if {@code content.error} is set
     * @throws UnsupportedFormatException if {@code mime_type} is not registered
     */
    public Object decode(Map<String, ?> content) {
        if (content == null) {
            return null;
        }
        Object error = content.get(ERROR);
        if (error != null) {
            throw new RemoteReportedException(error);
        }
        String format = mimeTypeOf(content);
        Object data = content.get(DATA);
        if (data == null) {
            return null;
        }
        return lookup(format).decode(data);
    }

    /**
     * Decodes and converts the payload to {@code type}, e.g. a record the value was built from.
     */
    public <T> T decode(Map<String, ?> content, Class<T> type) {
        Object value = decode(content);
        if (value == null || type.isInstance(value)) {
            return type.cast(value);
        }
        return Jsons.compact().convertValue(value, type);
    }

    String mimeTypeOf(Map<String, ?> content) {
        Object metadata = content.get(METADATA);
        if (metadata instanceof Map<?, ?> map) {
            Object mimeType = map.get(MIME_TYPE);
            if (mimeType != null) {
                return mimeType.toString();
            }
        }
        return defaultFormat;
    }

    private ContentFormat lookup(String format) {
        ContentFormat found = formats.get(format);
        if (found == null) {
            LOGGER.debug("No content format registered for mime_type={}", format);
            throw new UnsupportedFormatException(format);
        }
        return found;
    }

    public static final class Builder {
        private final Map<String, ContentFormat> formats = new LinkedHashMap<>();
        private String defaultFormat = ContentFormats.NATIVE;

        private Builder() {
        }

        public Builder withBuiltIns(String nativeFilter) {
            register(new NativeObjectFormat(nativeFilter));
            register(new StructuredTextFormat(ContentFormats.YAML, Jsons.yaml()));
            register(new StructuredTextFormat(ContentFormats.JSON, Jsons.compact()));
            register(PassthroughFormat.binary());
            register(PassthroughFormat.text());
            return this;
        }

        public Builder register(ContentFormat format) {
            Objects.requireNonNull(format, "format");
            Objects.requireNonNull(format.mimeType(), "format.mimeType()");
            formats.put(format.mimeType(), format);
            return this;
        }

        public Builder defaultFormat(String format) {
            this.defaultFormat = Objects.requireNonNull(format, "format");
            return this;
        }

        public ContentCodec build() {
            if (!formats.containsKey(defaultFormat)) {
                throw new UnsupportedFormatException(defaultFormat);
            }
            return new ContentCodec(formats, defaultFormat);
        }
    }

    private static final class Holder {
        private static final ContentCodec STANDARD = builder()
                .withBuiltIns(ContentFormats.DEFAULT_NATIVE_FILTER)
                .build();
    }
}
