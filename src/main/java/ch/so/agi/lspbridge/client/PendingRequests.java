package ch.so.agi.lspbridge.client;

import org.eclipse.lsp4j.jsonrpc.JsonRpcException;
import org.eclipse.lsp4j.jsonrpc.ResponseErrorException;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Requests sent to the server that have not been settled yet.
 *
 * <p>LSP4J matches responses to requests by id. This class adds what it does not do: a deadline per
 * request and failing everything outstanding when the server goes away. The calls into LSP4J run
 * on the {@code dispatcher}, so a server that stops reading its input only stalls the dispatcher.
 * Everything else, timers included, runs on the owning client's event loop, which settles each
 * request exactly once.</p>
 */
final class PendingRequests {
    private static final Logger LOG = LoggerFactory.getLogger(PendingRequests.class);

    private static final class PendingRequest<T> {
        final int sequence;
        final String method;
        final CompletableFuture<T> future = new CompletableFuture<>();
        ScheduledFuture<?> timeout;

        PendingRequest(int sequence, String method) {
            this.sequence = sequence;
            this.method = method;
        }
    }

    private final String name;
    private final ScheduledExecutorService loop;
    private final Executor dispatcher;
    private final Set<PendingRequest<?>> pending = new LinkedHashSet<>();
    private int nextSequence = 1;

    PendingRequests(String name, ScheduledExecutorService loop, Executor dispatcher) {
        this.name = name;
        this.loop = loop;
        this.dispatcher = dispatcher;
    }

    /**
     * Hands {@code call} to the dispatcher and returns a future that completes on the event loop with
     * the response, or fails with {@link LspClientException.Reason#TIMEOUT} once {@code timeoutMs}
     * have passed. A response arriving after that is dropped.
     */
    <T> CompletableFuture<T> send(String method, Supplier<CompletableFuture<T>> call, long timeoutMs) {
        PendingRequest<T> request = new PendingRequest<>(nextSequence++, method);
        pending.add(request);
        request.timeout = loop.schedule(() -> expire(request, timeoutMs), timeoutMs, TimeUnit.MILLISECONDS);

        LOG.debug("{} SEND {} (#{})", name, method, request.sequence);
        try {
            dispatcher.execute(() -> {
                CompletableFuture<T> reply;
                try {
                    reply = call.get();
                } catch (RuntimeException ex) {
                    reply = CompletableFuture.failedFuture(ex);
                }
                reply.whenComplete((value, ex) -> onLoop(() -> settle(request, value, ex)));
            });
        } catch (RejectedExecutionException ex) {
            settle(request, null, ex);
        }
        return request.future;
    }

    void failAll(LspClientException.Reason reason, String cause) {
        if (pending.isEmpty()) return;
        List<PendingRequest<?>> requests = new ArrayList<>(pending);
        pending.clear();
        for (PendingRequest<?> request : requests) {
            request.timeout.cancel(false);
            request.future.completeExceptionally(new LspClientException(reason,
                    name + " request " + request.method + " aborted: " + cause));
        }
        LOG.debug("{} failed {} pending request(s): {}", name, requests.size(), cause);
    }

    int size() {
        return pending.size();
    }

    private <T> void settle(PendingRequest<T> request, T value, Throwable ex) {
        if (!pending.remove(request)) {
            LOG.debug("{} discarding late response to {} (#{})", name, request.method, request.sequence);
            return;
        }
        request.timeout.cancel(false);
        if (ex == null) {
            request.future.complete(value);
        } else {
            request.future.completeExceptionally(translate(request, FutureUtil.unwrap(ex)));
        }
    }

    private void expire(PendingRequest<?> request, long timeoutMs) {
        if (!pending.remove(request)) return;
        request.future.completeExceptionally(new LspClientException(LspClientException.Reason.TIMEOUT,
                name + " request " + request.method + " timed out after " + timeoutMs + "ms"));
    }

    private LspClientException translate(PendingRequest<?> request, Throwable cause) {
        if (cause instanceof ResponseErrorException responseError) {
            ResponseError error = responseError.getResponseError();
            return new LspClientException(LspClientException.Reason.REMOTE_ERROR,
                    name + " request " + request.method + " failed: " + error.getMessage() + " (Code: " + error.getCode() + ")",
                    error.getCode(), cause);
        }
        if (cause instanceof JsonRpcException || cause instanceof RejectedExecutionException) {
            return new LspClientException(LspClientException.Reason.UNAVAILABLE,
                    name + " request " + request.method + " could not be sent: " + FutureUtil.describe(cause), cause);
        }
        if (cause instanceof LspClientException lce) {
            return lce;
        }
        return new LspClientException(LspClientException.Reason.PROTOCOL_ERROR,
                name + " request " + request.method + " failed: " + FutureUtil.describe(cause), cause);
    }

    private void onLoop(Runnable task) {
        try {
            loop.execute(task);
        } catch (RejectedExecutionException ex) {
            LOG.debug("{} event loop stopped, dropping response", name);
        }
    }
}
