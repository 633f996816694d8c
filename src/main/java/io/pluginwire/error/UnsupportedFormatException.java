package io.pluginwire.error;

public class UnsupportedFormatException extends ProtocolException {
    private final String format;

    public UnsupportedFormatException(String format) {
        super("Unrecognized mime-type: " + format);
        this.format = format;
    }

    public String format() {
        return format;
    }
}
