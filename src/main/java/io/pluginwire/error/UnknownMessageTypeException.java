package io.pluginwire.error;

public class UnknownMessageTypeException extends SchemaValidationException {
    private final String msgType;

    public UnknownMessageTypeException(String msgType) {
        super(msgType, "Unknown message type: " + msgType);
        this.msgType = msgType;
    }

    public String msgType() {
        return msgType;
    }
}
