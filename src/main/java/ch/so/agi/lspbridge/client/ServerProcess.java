package ch.so.agi.lspbridge.client;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;

/**
 * The running language server as seen by {@link LanguageServerClient}: three standard streams and
 * an exit signal.
 */
public interface ServerProcess {

    OutputStream stdin();

    InputStream stdout();

    InputStream stderr();

    /** Completes with the exit code once the process has terminated. */
    CompletableFuture<Integer> onExit();

    boolean isAlive();

    /** Terminates the process forcibly. Calling it on a dead process does nothing. */
    void destroy();
}
