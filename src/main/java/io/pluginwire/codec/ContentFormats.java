package io.pluginwire.codec;

import java.util.List;

public final class ContentFormats {
    public static final String NATIVE = "application/x-java-serialized-object";
    public static final String YAML = "application/x-yaml";
    public static final String JSON = "application/json";
    public static final String OCTET_STREAM = "application/octet-stream";
    public static final String TEXT = "text/plain";

    /**
     * Only classes of the {@code java.base} module (collections, boxed numbers, strings,
     * time values and primitive arrays) may be rebuilt from a native payload.
     */
    public static final String DEFAULT_NATIVE_FILTER = "maxdepth=64;maxrefs=100000;java.base/*;!*";

    public static final List<String> BUILT_IN = List.of(NATIVE, YAML, JSON, OCTET_STREAM, TEXT);

    private ContentFormats() {
    }
}
