package ch.so.agi.lspbridge.router;

import ch.so.agi.lspbridge.client.FutureUtil;
import ch.so.agi.lspbridge.client.LanguageServerClient;
import ch.so.agi.lspbridge.client.LspClientException;
import ch.so.agi.lspbridge.client.ServerProcessLauncher;
import ch.so.agi.lspbridge.config.BridgeSettings;
import ch.so.agi.lspbridge.config.LanguageServerConfig;
import ch.so.agi.lspbridge.text.TextEditApplier;
import ch.so.agi.lspbridge.workspace.FileAccess;
import org.eclipse.lsp4j.*;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;

/**
 * Owns one {@link LanguageServerClient} per configured server and routes every operation to the
 * client serving the file's extension, opening the document there first.
 */
public class LanguageClientRouter {
    private static final Logger LOG = LoggerFactory.getLogger(LanguageClientRouter.class);

    public static final String COMPLETION = "textDocument/completion";
    public static final String DEFINITION = "textDocument/definition";
    public static final String FORMATTING = "textDocument/formatting";

    private final BridgeSettings settings;
    private final FileAccess files;
    private final Map<String, LanguageServerClient> clients;
    private final Map<String, LanguageServerClient> clientsByExtension;
    private final LanguageServerClient defaultClient;
    private final AtomicReference<CompletableFuture<Void>> shutdown = new AtomicReference<>();

    public LanguageClientRouter(BridgeSettings settings, FileAccess files, ServerProcessLauncher launcher) {
        if (settings.getServers().isEmpty()) {
            throw new IllegalStateException("No language servers configured");
        }
        this.settings = settings;
        this.files = files;

        Map<String, LanguageServerClient> byName = new LinkedHashMap<>();
        Map<String, LanguageServerClient> byExtension = new LinkedHashMap<>();
        for (LanguageServerConfig config : settings.getServers().values()) {
            LanguageServerClient client = new LanguageServerClient(config, settings, files, launcher);
            byName.put(config.getName(), client);
            for (String ext : config.getExtensions()) {
                LanguageServerClient previous = byExtension.putIfAbsent(ext, client);
                if (previous != null) {
                    LOG.warn("Extension {} is claimed by {} and {}, keeping {}", ext,
                            previous.getConfig().getName(), config.getName(), previous.getConfig().getName());
                }
            }
        }
        this.clients = Collections.unmodifiableMap(byName);
        this.clientsByExtension = byExtension;
        this.defaultClient = byName.get(settings.getDefaultServer());
        LOG.info("Language servers: {}, default: {}", byName.keySet(), settings.getDefaultServer());
    }

    public Collection<LanguageServerClient> getClients() {
        return clients.values();
    }

    public LanguageServerClient getClient(String serverName) {
        return clients.get(serverName);
    }

    /** The client serving {@code path}'s extension, or the default client when no server claims it. */
    public LanguageServerClient selectClient(Path path) {
        String ext = LanguageServerConfig.extensionOf(path);
        LanguageServerClient client = ext != null ? clientsByExtension.get(ext) : null;
        if (client == null) {
            LOG.debug("No specific language server for extension {}, defaulting to {}", ext,
                    defaultClient.getConfig().getName());
            return defaultClient;
        }
        return client;
    }

    /**
     * Diagnostics pushed so far for {@code path}, after making sure the document is open. Never
     * sends a request: diagnostics are push-only.
     */
    public CompletableFuture<List<Diagnostic>> getDiagnostics(String path) {
        return withDocument("getDiagnostics", path, LanguageServerClient::cachedDiagnostics);
    }

    /**
     * Diagnostics for the version of {@code path} currently synced, waiting at most {@code timeout}
     * for the server to publish them.
     */
    public CompletableFuture<List<Diagnostic>> awaitDiagnostics(String path, Duration timeout) {
        return withDocument("getDiagnostics", path, (client, target) -> client.awaitDiagnostics(target, timeout));
    }

    public CompletableFuture<Either<List<CompletionItem>, CompletionList>> getCompletions(String path, int line, int character) {
        return withDocument("getCompletions", path, (client, target) -> {
            CompletionParams params = new CompletionParams(identifier(target), new Position(line, character));
            return client.execute(COMPLETION, server -> server.getTextDocumentService().completion(params))
                    .thenApply(LanguageClientRouter::completionsOrEmpty);
        });
    }

    public CompletableFuture<Either<List<? extends Location>, List<? extends LocationLink>>> getDefinition(String path, int line, int character) {
        return withDocument("getDefinition", path, (client, target) -> {
            DefinitionParams params = new DefinitionParams(identifier(target), new Position(line, character));
            return client.execute(DEFINITION, server -> server.getTextDocumentService().definition(params))
                    .thenApply(LanguageClientRouter::definitionOrEmpty);
        });
    }

    /**
     * Asks the server for formatting edits, applies them to the stored file, writes it back and
     * syncs the new content to the server.
     */
    public CompletableFuture<FormatResult> formatDocument(String path) {
        return withDocument("formatDocument", path, (client, target) -> {
            DocumentFormattingParams params = new DocumentFormattingParams(identifier(target),
                    new FormattingOptions(settings.getTabSize(), settings.isInsertSpaces()));
            return client.execute(FORMATTING, server -> server.getTextDocumentService().formatting(params))
                    .thenCompose(edits -> applyFormatting(client, target, edits != null ? edits : List.of()));
        });
    }

    /**
     * Shuts every client down. Only the first call does the work; later calls return the same
     * future. Completes once every server has been asked to stop and terminated.
     */
    public CompletableFuture<Void> shutdownAll() {
        CompletableFuture<Void> created = new CompletableFuture<>();
        if (!shutdown.compareAndSet(null, created)) {
            return shutdown.get();
        }
        LOG.info("Shutting down all language server clients...");
        CompletableFuture<?>[] stops = clients.values().stream()
                .map(LanguageServerClient::shutdown)
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(stops).whenComplete((v, ex) -> {
            LOG.info("All language server clients shut down.");
            created.complete(null);
        });
        return created;
    }

    private CompletableFuture<FormatResult> applyFormatting(LanguageServerClient client, Path target, List<? extends TextEdit> edits) {
        if (edits.isEmpty()) {
            return CompletableFuture.completedFuture(
                    FormatResult.unchanged("No formatting changes needed or returned by the language server."));
        }

        String updated;
        try {
            String original = files.readText(target);
            updated = TextEditApplier.apply(original, edits);
            if (updated.equals(original)) {
                return CompletableFuture.completedFuture(
                        FormatResult.unchanged("Formatting edits left the document unchanged."));
            }
            files.writeText(target, updated);
        } catch (IOException | RuntimeException ex) {
            return CompletableFuture.failedFuture(new LspClientException(LspClientException.Reason.STORAGE_ERROR,
                    "Could not apply formatting to " + target + ": " + ex.getMessage(), ex));
        }
        return client.notifyChanged(target, updated).thenApply(version -> FormatResult.applied(updated, version));
    }

    private <T> CompletableFuture<T> withDocument(String operation, String path,
                                                  BiFunction<LanguageServerClient, Path, CompletableFuture<T>> action) {
        Path target;
        try {
            target = files.resolve(path);
        } catch (IllegalArgumentException ex) {
            return CompletableFuture.failedFuture(failure(operation, path, ex));
        }
        LanguageServerClient client = selectClient(target);
        return client.ensureOpen(target)
                .thenCompose(opened -> action.apply(client, opened))
                .handle((value, ex) -> {
                    if (ex != null) {
                        throw failure(operation, path, ex);
                    }
                    return value;
                });
    }

    /** Names the operation, the path and the condition; keeps the reason of client failures. */
    static LspClientException failure(String operation, String path, Throwable ex) {
        Throwable cause = FutureUtil.unwrap(ex);
        LspClientException.Reason reason;
        Integer remoteCode = null;
        if (cause instanceof LspClientException lce) {
            reason = lce.getReason();
            remoteCode = lce.getRemoteCode();
        } else if (cause instanceof IllegalArgumentException || cause instanceof IOException) {
            reason = LspClientException.Reason.STORAGE_ERROR;
        } else {
            reason = LspClientException.Reason.PROTOCOL_ERROR;
        }
        String message = operation + " failed for " + path + ": " + FutureUtil.describe(cause);
        LOG.warn(message);
        return new LspClientException(reason, message, remoteCode, cause);
    }

    static Either<List<CompletionItem>, CompletionList> completionsOrEmpty(Either<List<CompletionItem>, CompletionList> result) {
        return result != null ? result : Either.forRight(new CompletionList());
    }

    static Either<List<? extends Location>, List<? extends LocationLink>> definitionOrEmpty(
            Either<List<? extends Location>, List<? extends LocationLink>> result) {
        return result != null ? result : Either.forLeft(List.of());
    }

    private static TextDocumentIdentifier identifier(Path target) {
        return new TextDocumentIdentifier(target.toUri().toString());
    }
}
