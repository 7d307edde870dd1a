package ch.so.agi.lspbridge.tools;

import ch.so.agi.lspbridge.client.FutureUtil;
import ch.so.agi.lspbridge.client.LspClientException;
import ch.so.agi.lspbridge.config.BridgeSettings;
import ch.so.agi.lspbridge.router.FormatResult;
import ch.so.agi.lspbridge.router.LanguageClientRouter;
import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionList;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.LocationLink;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Caller-facing language tools. Each handler blocks on the router for a bounded time and turns the
 * outcome, failures included, into a {@link ToolResult}. Positions are taken 0-based and reported
 * 1-based.
 */
public class LanguageToolHandlers {
    private static final Logger LOG = LoggerFactory.getLogger(LanguageToolHandlers.class);

    private final LanguageClientRouter router;
    private final BridgeSettings settings;

    public LanguageToolHandlers(LanguageClientRouter router, BridgeSettings settings) {
        this.router = router;
        this.settings = settings;
    }

    /**
     * Diagnostics for the synced version of the file. If the server stays silent for the configured
     * wait, whatever it published last is returned, marked as possibly out of date.
     */
    public ToolResult getDiagnostics(String filePath) {
        LOG.info("Getting diagnostics for {}", filePath);
        long waitMs = settings.getDiagnosticsWaitMs();
        CompletableFuture<ToolResult> outcome = router.awaitDiagnostics(filePath, Duration.ofMillis(waitMs))
                .thenApply(diagnostics -> diagnosticsResult(filePath, diagnostics, null))
                .exceptionallyCompose(ex -> {
                    LspClientException silence = diagnosticsWaitExpired(ex);
                    if (silence == null) {
                        return CompletableFuture.failedFuture(ex);
                    }
                    LOG.debug("No fresh diagnostics for {}, using cached: {}", filePath, silence.getMessage());
                    return router.getDiagnostics(filePath)
                            .thenApply(diagnostics -> diagnosticsResult(filePath, diagnostics, silence.getMessage()));
                });
        try {
            return await(outcome, waitMs + settings.getRequestTimeoutMs());
        } catch (LspClientException ex) {
            return failure("getting diagnostics", filePath, ex);
        }
    }

    private static ToolResult diagnosticsResult(String filePath, List<Diagnostic> diagnostics, String staleBecause) {
        ToolResult result = ToolResult.ok().text("Diagnostics for " + filePath + ":");
        if (staleBecause != null) {
            result.text("These diagnostics may be out of date: " + staleBecause);
        }
        return result.json(diagnostics);
    }

    /** The expired wait for fresh diagnostics behind {@code ex}, or {@code null} for any other failure. */
    private static LspClientException diagnosticsWaitExpired(Throwable ex) {
        Throwable cause = FutureUtil.unwrap(ex);
        while (cause instanceof LspClientException lce && lce.getReason() == LspClientException.Reason.TIMEOUT) {
            if (!(lce.getCause() instanceof LspClientException)) {
                return lce;
            }
            cause = lce.getCause();
        }
        return null;
    }

    public ToolResult getCompletions(String filePath, int line, int character) {
        LOG.info("Getting completions for {} at {}:{}", filePath, line, character);
        try {
            Either<List<CompletionItem>, CompletionList> completions = await(router.getCompletions(filePath, line, character), 0);
            return ToolResult.ok()
                    .text("Completions for " + filePath + " at " + position(line, character) + ":")
                    .json(completions.isLeft() ? completions.getLeft() : completions.getRight());
        } catch (LspClientException ex) {
            return failure("getting completions", filePath, ex);
        }
    }

    public ToolResult findDefinition(String filePath, int line, int character) {
        LOG.info("Finding definition for {} at {}:{}", filePath, line, character);
        try {
            Either<List<? extends Location>, List<? extends LocationLink>> definition =
                    await(router.getDefinition(filePath, line, character), 0);
            return ToolResult.ok()
                    .text("Definition(s) for " + filePath + " at " + position(line, character) + ":")
                    .json(definition.isLeft() ? definition.getLeft() : definition.getRight());
        } catch (LspClientException ex) {
            return failure("finding definition", filePath, ex);
        }
    }

    public ToolResult formatDocument(String filePath) {
        LOG.info("Formatting document {}", filePath);
        try {
            FormatResult result = await(router.formatDocument(filePath), 0);
            if (result.isApplied()) {
                return ToolResult.ok().text("Document " + filePath + " formatted successfully.");
            }
            String message = result.getMessage() != null ? result.getMessage()
                    : "Document " + filePath + " was not modified by formatting.";
            return ToolResult.ok().text(message);
        } catch (LspClientException ex) {
            return failure("formatting document", filePath, ex);
        }
    }

    /**
     * Waits for {@code future}; {@code extraMs} is added to the bound covering a cold start plus one
     * request.
     */
    private <T> T await(CompletableFuture<T> future, long extraMs) {
        long waitMs = settings.getInitializeTimeoutMs() + settings.getRequestTimeoutMs() + extraMs;
        try {
            return future.get(waitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(false);
            throw new LspClientException(LspClientException.Reason.TIMEOUT, "No answer within " + waitMs + "ms", ex);
        } catch (ExecutionException ex) {
            Throwable cause = FutureUtil.unwrap(ex);
            if (cause instanceof LspClientException lce) throw lce;
            throw new LspClientException(LspClientException.Reason.PROTOCOL_ERROR, FutureUtil.describe(cause), cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new LspClientException(LspClientException.Reason.UNAVAILABLE, "Interrupted", ex);
        }
    }

    private static ToolResult failure(String action, String filePath, LspClientException ex) {
        LOG.warn("Error {} for {}: {}", action, filePath, ex.getMessage());
        return ToolResult.error("Error " + action + ": " + ex.getMessage());
    }

    private static String position(int line, int character) {
        return "line " + (line + 1) + ", char " + (character + 1);
    }
}
