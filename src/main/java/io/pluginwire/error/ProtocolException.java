package io.pluginwire.error;

/**
 * Root of every failure raised by the protocol layer. All subtypes are unchecked and
 * surface to the immediate caller; nothing in this layer retries or recovers.
 */
public class ProtocolException extends RuntimeException {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
