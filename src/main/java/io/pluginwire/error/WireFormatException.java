package io.pluginwire.error;

public class WireFormatException extends ProtocolException {
    public WireFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    public WireFormatException(String message) {
        super(message);
    }
}
