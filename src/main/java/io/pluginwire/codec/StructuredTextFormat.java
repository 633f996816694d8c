package io.pluginwire.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pluginwire.error.ContentCodecException;

/**
 * Text formats backed by a Jackson mapper: JSON and YAML. Values decode to plain Java
 * collections, strings, numbers and booleans.
 */
final class StructuredTextFormat implements ContentFormat {
    private final String mimeType;
    private final ObjectMapper mapper;

    StructuredTextFormat(String mimeType, ObjectMapper mapper) {
        this.mimeType = mimeType;
        this.mapper = mapper;
    }

    @Override
    public String mimeType() {
        return mimeType;
    }

    @Override
    public Object encode(Object data) {
        try {
            return mapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new ContentCodecException("Failed to write " + mimeType + " payload", e);
        }
    }

    @Override
    public Object decode(Object data) {
        if (!(data instanceof String text)) {
            throw new ContentCodecException(mimeType + " payload must be text, got " + data.getClass().getName());
        }
        try {
            return mapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            throw new ContentCodecException("Failed to read " + mimeType + " payload", e);
        }
    }
}
