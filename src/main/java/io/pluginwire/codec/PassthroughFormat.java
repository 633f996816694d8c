package io.pluginwire.codec;

import io.pluginwire.error.ContentCodecException;

import java.util.Base64;

/**
 * Formats that carry the value unchanged. Binary payloads are {@code byte[]} in memory;
 * after a JSON hop they arrive as Base64 text and are turned back into bytes.
 */
final class PassthroughFormat implements ContentFormat {
    private final String mimeType;
    private final boolean binary;

    private PassthroughFormat(String mimeType, boolean binary) {
        this.mimeType = mimeType;
        this.binary = binary;
    }

    static PassthroughFormat text() {
        return new PassthroughFormat(ContentFormats.TEXT, false);
    }

    static PassthroughFormat binary() {
        return new PassthroughFormat(ContentFormats.OCTET_STREAM, true);
    }

    @Override
    public String mimeType() {
        return mimeType;
    }

    @Override
    public Object encode(Object data) {
        if (binary && !(data instanceof byte[])) {
            throw new ContentCodecException(mimeType + " payload must be byte[], got " + data.getClass().getName());
        }
        if (!binary && !(data instanceof CharSequence)) {
            throw new ContentCodecException(mimeType + " payload must be text, got " + data.getClass().getName());
        }
        return binary ? data : data.toString();
    }

    @Override
    public Object decode(Object data) {
        if (binary && data instanceof String text) {
            try {
                return Base64.getDecoder().decode(text);
            } catch (IllegalArgumentException e) {
                throw new ContentCodecException(mimeType + " payload is neither bytes nor Base64 text", e);
            }
        }
        return data;
    }
}
