package ch.so.agi.lspbridge.router;

import ch.so.agi.lspbridge.client.ServerProcessLauncher;
import ch.so.agi.lspbridge.client.SubprocessLauncher;
import ch.so.agi.lspbridge.config.BridgeSettings;
import ch.so.agi.lspbridge.workspace.FileAccess;
import ch.so.agi.lspbridge.workspace.WorkspaceFileAccess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Holds the router together with the settings and workspace it was built from. Created once at
 * start-up and closed exactly once when the process stops.
 */
public final class LanguageIntelligence implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(LanguageIntelligence.class);

    private final BridgeSettings settings;
    private final LanguageClientRouter router;

    public LanguageIntelligence(BridgeSettings settings, FileAccess files, ServerProcessLauncher launcher) {
        this.settings = settings;
        this.router = new LanguageClientRouter(settings, files, launcher);
    }

    /** Workspace confined to the configured base directory, servers started as subprocesses. */
    public static LanguageIntelligence create(BridgeSettings settings) throws IOException {
        WorkspaceFileAccess workspace = new WorkspaceFileAccess(settings.getBaseDir(), settings.isReadOnly());
        workspace.ensureRoot();
        LOG.info("Base directory: {}{}", workspace.getRoot(), workspace.isReadOnly() ? " (read-only)" : "");
        return new LanguageIntelligence(settings, workspace, new SubprocessLauncher());
    }

    public BridgeSettings getSettings() {
        return settings;
    }

    public LanguageClientRouter getRouter() {
        return router;
    }

    /**
     * Shuts all servers down. Each one gets the shutdown timeout for its {@code shutdown} request and
     * again for {@code exit}, so that is waited for plus a second.
     */
    @Override
    public void close() {
        long waitMs = 2 * settings.getShutdownTimeoutMs() + 1_000;
        try {
            router.shutdownAll().get(waitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            LOG.warn("Language servers did not stop within {}ms", waitMs);
        } catch (ExecutionException ex) {
            LOG.warn("Error shutting down language servers: {}", ex.getCause() != null ? ex.getCause().getMessage() : ex.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while shutting down language servers");
        }
    }
}
