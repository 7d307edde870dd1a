package ch.so.agi.lspbridge.client;

/**
 * Lifecycle of a {@link LanguageServerClient}.
 *
 * <pre>
 * UNSTARTED -&gt; STARTING -&gt; AWAITING_HANDSHAKE -&gt; READY
 *                  |              |                  |
 *                  v              v                  v
 *               FAILED         FAILED             EXITED
 * </pre>
 *
 * Any state before {@code READY} may also end in {@code EXITED} when the process dies.
 */
public enum ClientState {
    UNSTARTED,
    STARTING,
    AWAITING_HANDSHAKE,
    READY,
    FAILED,
    EXITED;

    public boolean isTerminal() {
        return this == FAILED || this == EXITED;
    }
}
