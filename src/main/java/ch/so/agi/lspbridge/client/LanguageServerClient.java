package ch.so.agi.lspbridge.client;

import ch.so.agi.lspbridge.config.BridgeSettings;
import ch.so.agi.lspbridge.config.LanguageServerConfig;
import ch.so.agi.lspbridge.workspace.FileAccess;
import org.eclipse.lsp4j.*;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.services.LanguageServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Client side of one language server process.
 *
 * <p>The connection itself is an LSP4J {@link Launcher}: it frames messages, matches responses to
 * requests and calls a {@link BridgeLanguageClient} for whatever the server sends on its own.
 * Around it, three kinds of threads are used:</p>
 * <ul>
 * <li>the event loop owns all mutable state (lifecycle, pending requests, open documents,
 * diagnostics) and runs the request deadlines. Public methods only enqueue work on it and return
 * futures;</li>
 * <li>the dispatcher makes every call into the server proxy, one after another, so messages are
 * written in the order they were issued and a server that stops reading cannot hold up the
 * loop;</li>
 * <li>LSP4J's listener reads the server's output; everything it delivers is handed to the loop.</li>
 * </ul>
 */
public class LanguageServerClient {
    private static final Logger LOG = LoggerFactory.getLogger(LanguageServerClient.class);

    public static final String INITIALIZE = "initialize";
    public static final String INITIALIZED = "initialized";
    public static final String SHUTDOWN = "shutdown";
    public static final String EXIT = "exit";
    public static final String DID_OPEN = "textDocument/didOpen";
    public static final String DID_CHANGE = "textDocument/didChange";
    public static final String PUBLISH_DIAGNOSTICS = "textDocument/publishDiagnostics";

    private final LanguageServerConfig config;
    private final Path workspaceRoot;
    private final FileAccess files;
    private final ServerProcessLauncher launcher;
    private final long requestTimeoutMs;
    private final long initializeTimeoutMs;
    private final long shutdownTimeoutMs;
    private final String name;

    private final ScheduledThreadPoolExecutor loop;
    private final ExecutorService dispatcher;
    private final ExecutorService listener;
    private final CompletableFuture<Void> ready = new CompletableFuture<>();
    private final AtomicReference<CompletableFuture<Void>> shutdown = new AtomicReference<>();

    // owned by the event loop
    private volatile ClientState state = ClientState.UNSTARTED;
    private ServerProcess process;
    private LanguageServer remote;
    private final PendingRequests pending;
    private final DocumentTracker documents = new DocumentTracker();
    private final DiagnosticsCache diagnostics = new DiagnosticsCache();
    private volatile ServerCapabilities serverCapabilities;

    public LanguageServerClient(LanguageServerConfig config, BridgeSettings settings, FileAccess files,
                                ServerProcessLauncher launcher) {
        this.config = config;
        this.workspaceRoot = settings.getBaseDir();
        this.files = files;
        this.launcher = launcher;
        this.requestTimeoutMs = settings.getRequestTimeoutMs();
        this.initializeTimeoutMs = settings.getInitializeTimeoutMs();
        this.shutdownTimeoutMs = settings.getShutdownTimeoutMs();
        this.name = "LSP " + config.getName();

        this.loop = new ScheduledThreadPoolExecutor(1, daemon("lsp-" + config.getName()));
        this.loop.setRemoveOnCancelPolicy(true);
        this.loop.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.dispatcher = Executors.newSingleThreadExecutor(daemon("lsp-" + config.getName() + "-dispatcher"));
        this.listener = Executors.newCachedThreadPool(daemon("lsp-" + config.getName() + "-listener"));

        this.pending = new PendingRequests(name, loop, dispatcher);
    }

    public LanguageServerConfig getConfig() {
        return config;
    }

    public ClientState getState() {
        return state;
    }

    /** Capabilities announced by the server in its {@code initialize} result, {@code null} before that. */
    public ServerCapabilities getServerCapabilities() {
        return serverCapabilities;
    }

    /**
     * Launches the server and performs the handshake unless that already happened. The returned
     * future completes when the client is ready and fails with {@link LspClientException.Reason#LAUNCH_FAILURE}
     * or {@link LspClientException.Reason#HANDSHAKE_FAILURE}.
     */
    public CompletableFuture<Void> start() {
        runOnLoop(this::startOnLoop);
        return ready.copy();
    }

    public <T> CompletableFuture<T> execute(String method, Function<LanguageServer, CompletableFuture<T>> call) {
        return execute(method, call, requestTimeoutMs);
    }

    /**
     * Sends the request made by {@code call} on the server proxy. Fails immediately with
     * {@link LspClientException.Reason#NOT_READY} unless the client is ready; otherwise completes with
     * the result or fails with {@link LspClientException.Reason#TIMEOUT},
     * {@link LspClientException.Reason#REMOTE_ERROR} or {@link LspClientException.Reason#UNAVAILABLE}.
     *
     * @param method the LSP method {@code call} invokes, used for gating and messages
     */
    public <T> CompletableFuture<T> execute(String method, Function<LanguageServer, CompletableFuture<T>> call,
                                            long timeoutMs) {
        return onLoop(() -> {
            if (state != ClientState.READY) {
                return notReady(method);
            }
            LanguageServer server = remote;
            return pending.send(method, () -> call.apply(server), timeoutMs);
        });
    }

    /**
     * Opens {@code path} on the server with version 1 unless it is already open. Waits for the
     * handshake first, starting the server if needed.
     *
     * @return the normalised absolute path the document is tracked under
     */
    public CompletableFuture<Path> ensureOpen(Path path) {
        Path target = path.toAbsolutePath().normalize();
        return start().thenCompose(v -> onLoop(() -> openOnLoop(target)));
    }

    /**
     * Sends the complete new content of an open document.
     *
     * @return the version sent, always the previous version plus one
     */
    public CompletableFuture<Integer> notifyChanged(Path path, String newText) {
        Path target = path.toAbsolutePath().normalize();
        return onLoop(() -> {
            if (state != ClientState.READY) {
                return notReady(DID_CHANGE);
            }
            int version = documents.nextVersion(target);
            DidChangeTextDocumentParams params = new DidChangeTextDocumentParams(
                    new VersionedTextDocumentIdentifier(DocumentTracker.toUri(target), version),
                    List.of(new TextDocumentContentChangeEvent(newText)));
            notifyServer(DID_CHANGE, server -> server.getTextDocumentService().didChange(params));
            return CompletableFuture.completedFuture(version);
        });
    }

    /** The version last sent for {@code path}, or {@code null} if it is not open. */
    public CompletableFuture<Integer> documentVersion(Path path) {
        Path target = path.toAbsolutePath().normalize();
        return onLoop(() -> CompletableFuture.completedFuture(documents.getVersion(target)));
    }

    /** The diagnostics last pushed for {@code path}; empty if none arrived yet. */
    public CompletableFuture<List<Diagnostic>> cachedDiagnostics(Path path) {
        Path target = path.toAbsolutePath().normalize();
        return onLoop(() -> CompletableFuture.completedFuture(diagnostics.get(target)));
    }

    /**
     * Waits until the server has published diagnostics for the version currently synced for
     * {@code path} (or a later one). Fails with {@link LspClientException.Reason#TIMEOUT} when none
     * arrive within {@code timeout}.
     */
    public CompletableFuture<List<Diagnostic>> awaitDiagnostics(Path path, Duration timeout) {
        Path target = path.toAbsolutePath().normalize();
        return onLoop(() -> {
            Integer version = documents.getVersion(target);
            if (version == null) {
                return FutureUtil.failed(LspClientException.Reason.NOT_OPEN, "Document is not open: " + target);
            }
            return diagnostics.await(target, version, timeout.toMillis(), loop, name);
        });
    }

    /**
     * Orderly stop: a {@code shutdown} request bounded by the configured timeout, then always an
     * {@code exit} notification and forcible termination. Idempotent.
     */
    public CompletableFuture<Void> shutdown() {
        CompletableFuture<Void> created = new CompletableFuture<>();
        if (!shutdown.compareAndSet(null, created)) {
            return shutdown.get();
        }
        onLoop(this::shutdownOnLoop).whenComplete((v, ex) -> {
            if (ex != null) {
                LOG.warn("{} shutdown error: {}", name, FutureUtil.describe(ex));
            }
            loop.shutdown();
            dispatcher.shutdownNow();
            listener.shutdownNow();
            created.complete(null);
        });
        return created;
    }

    // ---- event loop ----

    private void startOnLoop() {
        if (state != ClientState.UNSTARTED) return;
        state = ClientState.STARTING;

        ServerProcess started;
        LanguageServer server;
        try {
            started = launcher.launch(config, workspaceRoot);
        } catch (IOException | RuntimeException ex) {
            launchFailed(ex);
            return;
        }
        try {
            BridgeLanguageClient languageClient = new BridgeLanguageClient(name, workspaceFolder(),
                    params -> runOnLoop(() -> onDiagnostics(started, params)));
            Launcher<LanguageServer> connection = new Launcher.Builder<LanguageServer>()
                    .setLocalService(languageClient)
                    .setRemoteInterface(LanguageServer.class)
                    .setInput(started.stdout())
                    .setOutput(started.stdin())
                    .setExecutorService(listener)
                    .wrapMessages(consumer -> message -> {
                        LOG.trace("{} {}", name, message);
                        consumer.consume(message);
                    })
                    .create();
            server = connection.getRemoteProxy();
            Future<Void> listening = connection.startListening();
            listener.execute(() -> awaitEndOfStream(started, listening));
        } catch (RuntimeException ex) {
            started.destroy();
            launchFailed(ex);
            return;
        }
        process = started;
        remote = server;

        startDaemon("stderr", () -> pumpStderr(started));
        started.onExit().whenComplete((code, ex) ->
                runOnLoop(() -> handleDisconnect(started, "exited with code " + code)));

        state = ClientState.AWAITING_HANDSHAKE;
        InitializeParams initializeParams = initializeParams();
        pending.send(INITIALIZE, () -> server.initialize(initializeParams), initializeTimeoutMs)
                .whenComplete((result, ex) -> onHandshake(started, result, ex));
    }

    private void launchFailed(Exception ex) {
        state = ClientState.FAILED;
        LOG.error("{} could not be started: {}", name, ex.getMessage());
        ready.completeExceptionally(new LspClientException(LspClientException.Reason.LAUNCH_FAILURE,
                name + " could not be started: " + ex.getMessage(), ex));
    }

    private void onHandshake(ServerProcess started, InitializeResult result, Throwable ex) {
        if (ex != null) {
            LOG.error("{} initialization failed: {}", name, FutureUtil.describe(ex));
            if (!state.isTerminal()) {
                state = ClientState.FAILED;
            }
            started.destroy();
            ready.completeExceptionally(new LspClientException(LspClientException.Reason.HANDSHAKE_FAILURE,
                    name + " initialization failed: " + FutureUtil.describe(ex), FutureUtil.unwrap(ex)));
            return;
        }
        if (state != ClientState.AWAITING_HANDSHAKE) return;

        serverCapabilities = result != null ? result.getCapabilities() : null;
        LOG.info("{} initialized.", name);
        LOG.debug("{} capabilities: {}", name, serverCapabilities);

        state = ClientState.READY;
        notifyServer(INITIALIZED, server -> server.initialized(new InitializedParams()));
        ready.complete(null);
    }

    private CompletableFuture<Path> openOnLoop(Path target) {
        if (state != ClientState.READY) {
            return notReady(DID_OPEN);
        }
        if (documents.isOpen(target)) {
            return CompletableFuture.completedFuture(target);
        }

        String text;
        try {
            text = files.readText(target);
        } catch (IOException | RuntimeException ex) {
            return CompletableFuture.failedFuture(new LspClientException(LspClientException.Reason.STORAGE_ERROR,
                    "Could not read " + target + ": " + ex.getMessage(), ex));
        }

        String languageId = config.languageIdFor(target);
        DidOpenTextDocumentParams params = new DidOpenTextDocumentParams(
                new TextDocumentItem(DocumentTracker.toUri(target), languageId, 1, text));
        notifyServer(DID_OPEN, server -> server.getTextDocumentService().didOpen(params));
        documents.open(target);
        LOG.info("{} Opened document: {} ({})", name, display(target), languageId);
        return CompletableFuture.completedFuture(target);
    }

    private void onDiagnostics(ServerProcess source, PublishDiagnosticsParams params) {
        if (process != source) return;
        Path path = DocumentTracker.toPath(params.getUri());
        if (path == null) {
            LOG.warn("{} Diagnostics without usable uri: {}", name, params.getUri());
            return;
        }
        Integer version = params.getVersion() != null ? params.getVersion() : documents.getVersion(path);
        List<Diagnostic> list = params.getDiagnostics() != null ? params.getDiagnostics() : List.of();
        diagnostics.publish(path, version != null ? version : 0, list);
        LOG.info("{} Diagnostics for {} (version {}): {} issues.", name, display(path), version, list.size());
    }

    private CompletableFuture<Void> shutdownOnLoop() {
        ServerProcess running = process;
        if (running == null) {
            if (!state.isTerminal()) {
                state = ClientState.EXITED;
            }
            ready.completeExceptionally(new LspClientException(LspClientException.Reason.NOT_READY,
                    name + " was shut down"));
            return CompletableFuture.completedFuture(null);
        }

        LOG.info("Shutting down {}", name);
        LanguageServer server = remote;
        CompletableFuture<Object> reply = state == ClientState.READY
                ? pending.send(SHUTDOWN, server::shutdown, shutdownTimeoutMs)
                : CompletableFuture.completedFuture(null);

        return reply.handle((result, ex) -> {
                    if (ex != null) {
                        LOG.warn("{} shutdown request failed: {}", name, FutureUtil.describe(ex));
                    }
                    return process == running
                            ? notifyServer(EXIT, LanguageServer::exit)
                            : CompletableFuture.<Void>completedFuture(null);
                })
                .thenCompose(exit -> exit.completeOnTimeout(null, shutdownTimeoutMs, TimeUnit.MILLISECONDS))
                .thenRunAsync(() -> {
                    running.destroy();
                    handleDisconnect(running, "shut down");
                    LOG.info("{} process killed.", name);
                }, loop);
    }

    private void handleDisconnect(ServerProcess source, String cause) {
        if (source == null || process != source) return;

        process = null;
        remote = null;
        if (!state.isTerminal()) {
            state = ClientState.EXITED;
        }
        int outstanding = pending.size();
        if (outstanding > 0) {
            LOG.warn("{} {}, failing {} pending request(s)", name, cause, outstanding);
        } else {
            LOG.warn("{} {}", name, cause);
        }
        pending.failAll(LspClientException.Reason.UNAVAILABLE, name + " " + cause);
        diagnostics.failWaiters(LspClientException.Reason.UNAVAILABLE, name + " " + cause);
        source.destroy();
    }

    /** Queues {@code notification} on the dispatcher; the future completes once it was written. */
    private CompletableFuture<Void> notifyServer(String method, Consumer<LanguageServer> notification) {
        LanguageServer server = remote;
        if (server == null) {
            return CompletableFuture.completedFuture(null);
        }
        LOG.debug("{} NOTIFY {}", name, method);
        try {
            return CompletableFuture.runAsync(() -> notification.accept(server), dispatcher);
        } catch (RejectedExecutionException ex) {
            LOG.debug("{} dispatcher stopped, dropping {}", name, method);
            return CompletableFuture.completedFuture(null);
        }
    }

    private InitializeParams initializeParams() {
        InitializeParams params = new InitializeParams();
        params.setProcessId((int) ProcessHandle.current().pid());
        params.setRootUri(workspaceRoot.toUri().toString());
        params.setWorkspaceFolders(List.of(workspaceFolder()));
        params.setClientInfo(new ClientInfo("lsp-bridge"));

        TextDocumentClientCapabilities text = new TextDocumentClientCapabilities();
        text.setSynchronization(new SynchronizationCapabilities(true, true, true));
        text.setCompletion(new CompletionCapabilities(new CompletionItemCapabilities(true)));
        PublishDiagnosticsCapabilities publish = new PublishDiagnosticsCapabilities();
        publish.setVersionSupport(true);
        text.setPublishDiagnostics(publish);
        text.setDefinition(new DefinitionCapabilities());
        text.setFormatting(new FormattingCapabilities());

        WorkspaceClientCapabilities workspace = new WorkspaceClientCapabilities();
        workspace.setDidChangeConfiguration(new DidChangeConfigurationCapabilities(true));
        workspace.setWorkspaceFolders(true);
        workspace.setConfiguration(true);

        WindowClientCapabilities window = new WindowClientCapabilities();
        window.setWorkDoneProgress(true);

        ClientCapabilities capabilities = new ClientCapabilities();
        capabilities.setTextDocument(text);
        capabilities.setWorkspace(workspace);
        capabilities.setWindow(window);
        params.setCapabilities(capabilities);
        return params;
    }

    private WorkspaceFolder workspaceFolder() {
        Path fileName = workspaceRoot.getFileName();
        return new WorkspaceFolder(workspaceRoot.toUri().toString(),
                fileName != null ? fileName.toString() : workspaceRoot.toString());
    }

    // ---- streams ----

    private void awaitEndOfStream(ServerProcess source, Future<Void> listening) {
        String cause = "closed its output stream";
        try {
            listening.get();
        } catch (ExecutionException ex) {
            cause = "pipe error: " + FutureUtil.describe(ex);
        } catch (CancellationException ex) {
            return;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return;
        }
        String reason = cause;
        runOnLoop(() -> handleDisconnect(source, reason));
    }

    private void pumpStderr(ServerProcess source) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(source.stderr(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                LOG.info("{} STDERR: {}", name, line);
            }
        } catch (IOException ex) {
            LOG.debug("{} stderr closed: {}", name, ex.getMessage());
        }
    }

    private void startDaemon(String stream, Runnable task) {
        Thread t = new Thread(task, "lsp-" + config.getName() + "-" + stream);
        t.setDaemon(true);
        t.start();
    }

    private static ThreadFactory daemon(String threadName) {
        return r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        };
    }

    private void runOnLoop(Runnable task) {
        try {
            loop.execute(task);
        } catch (RejectedExecutionException ex) {
            LOG.debug("{} event loop stopped, dropping task", name);
        }
    }

    private <T> CompletableFuture<T> onLoop(Supplier<CompletableFuture<T>> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            loop.execute(() -> {
                try {
                    task.get().whenComplete((value, ex) -> {
                        if (ex != null) {
                            result.completeExceptionally(FutureUtil.unwrap(ex));
                        } else {
                            result.complete(value);
                        }
                    });
                } catch (RuntimeException ex) {
                    result.completeExceptionally(ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            result.completeExceptionally(new LspClientException(LspClientException.Reason.NOT_READY,
                    name + " has been shut down", ex));
        }
        return result;
    }

    private <T> CompletableFuture<T> notReady(String method) {
        return FutureUtil.failed(LspClientException.Reason.NOT_READY,
                name + " not ready or process not running for method " + method + " (" + state + ")");
    }

    private String display(Path path) {
        return path.startsWith(workspaceRoot) ? workspaceRoot.relativize(path).toString() : path.toString();
    }
}
