package io.pluginwire.config;

import io.pluginwire.codec.ContentFormats;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

public final class PluginWireConfig {
    public static final String DEFAULT_PROTOCOL_VERSION = "0.3";
    public static final String DEFAULT_CONTENT_FORMAT = ContentFormats.NATIVE;
    public static final String DEFAULT_NATIVE_FILTER = ContentFormats.DEFAULT_NATIVE_FILTER;

    public static final String RESOURCE = "/pluginwire.properties";
    public static final String KEY_PROTOCOL_VERSION = "pluginwire.protocol.version";
    public static final String KEY_DEFAULT_FORMAT = "pluginwire.content.default-format";
    public static final String KEY_NATIVE_FILTER = "pluginwire.content.native-filter";

    private final String protocolVersion;
    private final String defaultFormat;
    private final String nativeFilter;

    public PluginWireConfig(String protocolVersion, String defaultFormat, String nativeFilter) {
        this.protocolVersion = orDefault(protocolVersion, DEFAULT_PROTOCOL_VERSION);
        this.defaultFormat = orDefault(defaultFormat, DEFAULT_CONTENT_FORMAT);
        this.nativeFilter = orDefault(nativeFilter, DEFAULT_NATIVE_FILTER);
    }

    public static PluginWireConfig defaults() {
        return new PluginWireConfig(null, null, null);
    }

    public static PluginWireConfig fromProperties(Properties properties) {
        if (properties == null) {
            return defaults();
        }
        return new PluginWireConfig(
                properties.getProperty(KEY_PROTOCOL_VERSION),
                properties.getProperty(KEY_DEFAULT_FORMAT),
                properties.getProperty(KEY_NATIVE_FILTER)
        );
    }

    /**
     * Defaults, overridden by {@code pluginwire.properties} on the classpath, overridden in
     * turn by {@code pluginwire.*} system properties.
     */
    public static PluginWireConfig load() {
        Properties merged = new Properties();
        try (InputStream in = PluginWireConfig.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                merged.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("pluginwire.")) {
                merged.setProperty(key, System.getProperty(key));
            }
        }
        return fromProperties(merged);
    }

    private static String orDefault(String raw, String fallback) {
        return raw == null || raw.isBlank() ? fallback : raw.trim();
    }

    public String protocolVersion() {
        return protocolVersion;
    }

    public String defaultFormat() {
        return defaultFormat;
    }

    public String nativeFilter() {
        return nativeFilter;
    }
}
