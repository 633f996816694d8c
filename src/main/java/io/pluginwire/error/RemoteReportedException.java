package io.pluginwire.error;

/**
 * The remote side set {@code content.error} on a reply. Raised by content decoding no
 * matter whether a {@code data} field is also present.
 */
public class RemoteReportedException extends ProtocolException {
    private final Object remoteError;

    public RemoteReportedException(Object remoteError) {
        super("Remote reported error: " + remoteError);
        this.remoteError = remoteError;
    }

    /**
     * The raw {@code content.error} value: usually text, or a map with
     * {@code ename}/{@code evalue}/{@code traceback}.
     */
    public Object remoteError() {
        return remoteError;
    }
}
