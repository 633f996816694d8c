package io.pluginwire.codec;

import io.pluginwire.error.ContentCodecException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InvalidClassException;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.Base64;

/**
 * JDK object serialization. The stream is Base64 encoded so it can sit in a text field of
 * the envelope; reading goes through an {@link ObjectInputFilter}.
 */
final class NativeObjectFormat implements ContentFormat {
    private final ObjectInputFilter filter;

    NativeObjectFormat(String filterPattern) {
        String pattern = filterPattern == null || filterPattern.isBlank()
                ? ContentFormats.DEFAULT_NATIVE_FILTER
                : filterPattern.trim();
        this.filter = ObjectInputFilter.Config.createFilter(pattern);
    }

    @Override
    public String mimeType() {
        return ContentFormats.NATIVE;
    }

    @Override
    public Object encode(Object data) {
        if (!(data instanceof Serializable)) {
            throw new ContentCodecException("Value of type " + data.getClass().getName()
                    + " is not Serializable and cannot use " + ContentFormats.NATIVE);
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(data);
        } catch (IOException e) {
            throw new ContentCodecException("Failed to serialize " + data.getClass().getName(), e);
        }
        return Base64.getEncoder().encodeToString(bytes.toByteArray());
    }

    @Override
    public Object decode(Object data) {
        byte[] raw;
        if (data instanceof byte[] b) {
            raw = b;
        } else if (data instanceof String text) {
            try {
                raw = Base64.getDecoder().decode(text);
            } catch (IllegalArgumentException e) {
                throw new ContentCodecException("Native payload is not valid Base64", e);
            }
        } else {
            throw new ContentCodecException("Native payload must be Base64 text, got " + data.getClass().getName());
        }
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(raw))) {
            in.setObjectInputFilter(filter);
            return in.readObject();
        } catch (InvalidClassException e) {
            throw new ContentCodecException("Native payload rejected: " + e.getMessage(), e);
        } catch (IOException | ClassNotFoundException e) {
            throw new ContentCodecException("Failed to deserialize native payload", e);
        }
    }
}
