package ch.so.agi.lspbridge.client;

/**
 * Failure of a language server operation. The {@link Reason} tells callers whether the client is
 * still usable ({@link Reason#TIMEOUT}, {@link Reason#REMOTE_ERROR}) or gone for good.
 */
public class LspClientException extends RuntimeException {

    public enum Reason {
        /** The server process could not be started. */
        LAUNCH_FAILURE,
        /** {@code initialize} timed out, was rejected, or the server died before answering. */
        HANDSHAKE_FAILURE,
        /** The client is not in the ready state. */
        NOT_READY,
        /** A single request exceeded its deadline. */
        TIMEOUT,
        /** A message could not be parsed. */
        PROTOCOL_ERROR,
        /** The server answered with an error response. */
        REMOTE_ERROR,
        /** The server went away while the request was outstanding. */
        UNAVAILABLE,
        /** A change was sent for a document that was never opened. */
        NOT_OPEN,
        /** The document could not be read from or written to the workspace. */
        STORAGE_ERROR
    }

    private final Reason reason;
    private final Integer remoteCode;

    public LspClientException(Reason reason, String message) {
        this(reason, message, null, null);
    }

    public LspClientException(Reason reason, String message, Throwable cause) {
        this(reason, message, null, cause);
    }

    public LspClientException(Reason reason, String message, Integer remoteCode, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.remoteCode = remoteCode;
    }

    public Reason getReason() {
        return reason;
    }

    /** The JSON-RPC error code for {@link Reason#REMOTE_ERROR}, otherwise {@code null}. */
    public Integer getRemoteCode() {
        return remoteCode;
    }
}
