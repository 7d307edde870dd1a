package ch.so.agi.lspbridge.client;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helper utilities to consistently unwrap and classify failures of asynchronous client calls.
 */
public final class FutureUtil {

    private FutureUtil() {
    }

    /** Strips the {@link CompletionException}/{@link ExecutionException} layers added by futures. */
    public static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static String describe(Throwable ex) {
        Throwable cause = unwrap(ex);
        if (cause == null) return "unknown error";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    public static <T> CompletableFuture<T> failed(LspClientException.Reason reason, String message) {
        return CompletableFuture.failedFuture(new LspClientException(reason, message));
    }
}
