package io.pluginwire.error;

/**
 * A reply was requested with a status and error value that disagree. This is a bug at
 * the call site, not bad input data.
 */
public class InvalidReplyException extends ProtocolException {
    public InvalidReplyException(String message) {
        super(message);
    }
}
