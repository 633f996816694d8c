package io.pluginwire.error;

public class ContentCodecException extends ProtocolException {
    public ContentCodecException(String message, Throwable cause) {
        super(message, cause);
    }

    public ContentCodecException(String message) {
        super(message);
    }
}
