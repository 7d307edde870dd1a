package ch.so.agi.lspbridge.client;

import org.eclipse.lsp4j.Diagnostic;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Latest diagnostics per document, each tagged with the document version it belongs to, plus the
 * callers waiting for diagnostics of a given version.
 *
 * <p>Confined to the owning client's event loop, which is also the scheduler passed to
 * {@link #await}.</p>
 */
final class DiagnosticsCache {

    private static final class Entry {
        final int version;
        final List<Diagnostic> diagnostics;

        Entry(int version, List<Diagnostic> diagnostics) {
            this.version = version;
            this.diagnostics = diagnostics;
        }
    }

    private static final class Waiter {
        final Path path;
        final int minVersion;
        final CompletableFuture<List<Diagnostic>> future = new CompletableFuture<>();
        ScheduledFuture<?> timeout;

        Waiter(Path path, int minVersion) {
            this.path = path;
            this.minVersion = minVersion;
        }
    }

    private final Map<Path, Entry> entries = new HashMap<>();
    private final List<Waiter> waiters = new ArrayList<>();

    /** Replaces the diagnostics of {@code path} and releases waiters satisfied by {@code version}. */
    void publish(Path path, int version, List<Diagnostic> diagnostics) {
        List<Diagnostic> copy = diagnostics != null ? List.copyOf(diagnostics) : List.of();
        entries.put(path, new Entry(version, copy));

        List<Waiter> released = new ArrayList<>();
        Iterator<Waiter> it = waiters.iterator();
        while (it.hasNext()) {
            Waiter waiter = it.next();
            if (waiter.path.equals(path) && version >= waiter.minVersion) {
                it.remove();
                released.add(waiter);
            }
        }
        for (Waiter waiter : released) {
            waiter.timeout.cancel(false);
            waiter.future.complete(copy);
        }
    }

    List<Diagnostic> get(Path path) {
        Entry entry = entries.get(path);
        return entry != null ? entry.diagnostics : List.of();
    }

    /**
     * Completes with the first set published for {@code minVersion} or later. The timeout failure
     * names the version last published, so callers can tell stale results from missing ones.
     */
    CompletableFuture<List<Diagnostic>> await(Path path, int minVersion, long timeoutMs,
                                              ScheduledExecutorService scheduler, String name) {
        Entry entry = entries.get(path);
        if (entry != null && entry.version >= minVersion) {
            return CompletableFuture.completedFuture(entry.diagnostics);
        }

        Waiter waiter = new Waiter(path, minVersion);
        waiter.timeout = scheduler.schedule(() -> {
            if (waiters.remove(waiter)) {
                Entry last = entries.get(path);
                String published = last != null ? "last published for version " + last.version : "nothing published yet";
                waiter.future.completeExceptionally(new LspClientException(LspClientException.Reason.TIMEOUT,
                        name + " published no diagnostics for version " + minVersion + " of " + path
                                + " within " + timeoutMs + "ms (" + published + ")"));
            }
        }, timeoutMs, TimeUnit.MILLISECONDS);
        waiters.add(waiter);
        return waiter.future;
    }

    void failWaiters(LspClientException.Reason reason, String cause) {
        List<Waiter> failed = new ArrayList<>(waiters);
        waiters.clear();
        for (Waiter waiter : failed) {
            waiter.timeout.cancel(false);
            waiter.future.completeExceptionally(new LspClientException(reason,
                    "Diagnostics for " + waiter.path + " unavailable: " + cause));
        }
    }
}
