package ch.so.agi.lspbridge.client;

import org.eclipse.lsp4j.ApplyWorkspaceEditParams;
import org.eclipse.lsp4j.ApplyWorkspaceEditResponse;
import org.eclipse.lsp4j.ConfigurationParams;
import org.eclipse.lsp4j.MessageActionItem;
import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.ProgressParams;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.RegistrationParams;
import org.eclipse.lsp4j.ShowMessageRequestParams;
import org.eclipse.lsp4j.UnregistrationParams;
import org.eclipse.lsp4j.WorkDoneProgressCreateParams;
import org.eclipse.lsp4j.WorkspaceFolder;
import org.eclipse.lsp4j.services.LanguageClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * The client end of the connection, called by LSP4J on its listener thread for everything the
 * server sends on its own. Diagnostics are handed on; server requests are answered right away,
 * since servers block on some of them.
 */
final class BridgeLanguageClient implements LanguageClient {
    private static final Logger LOG = LoggerFactory.getLogger(BridgeLanguageClient.class);

    private final String name;
    private final WorkspaceFolder workspaceFolder;
    private final Consumer<PublishDiagnosticsParams> diagnosticsListener;

    BridgeLanguageClient(String name, WorkspaceFolder workspaceFolder, Consumer<PublishDiagnosticsParams> diagnosticsListener) {
        this.name = name;
        this.workspaceFolder = workspaceFolder;
        this.diagnosticsListener = diagnosticsListener;
    }

    @Override
    public void publishDiagnostics(PublishDiagnosticsParams diagnostics) {
        diagnosticsListener.accept(diagnostics);
    }

    @Override
    public void showMessage(MessageParams messageParams) {
        LOG.info("{} ShowMessage: [{}] {}", name, messageParams.getType(), messageParams.getMessage());
    }

    @Override
    public void logMessage(MessageParams message) {
        LOG.info("{} LogMessage: [{}] {}", name, message.getType(), message.getMessage());
    }

    @Override
    public void telemetryEvent(Object object) {
        LOG.debug("{} telemetry/event: {}", name, object);
    }

    @Override
    public void notifyProgress(ProgressParams params) {
        LOG.debug("{} $/progress: {}", name, params.getToken());
    }

    @Override
    public CompletableFuture<MessageActionItem> showMessageRequest(ShowMessageRequestParams requestParams) {
        LOG.info("{} ShowMessageRequest: {}", name, requestParams.getMessage());
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> createProgress(WorkDoneProgressCreateParams params) {
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> registerCapability(RegistrationParams params) {
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> unregisterCapability(UnregistrationParams params) {
        return CompletableFuture.completedFuture(null);
    }

    /** No settings of our own: one {@code null} per requested item. */
    @Override
    public CompletableFuture<List<Object>> configuration(ConfigurationParams configurationParams) {
        int count = configurationParams.getItems() != null ? configurationParams.getItems().size() : 0;
        List<Object> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            values.add(null);
        }
        return CompletableFuture.completedFuture(values);
    }

    @Override
    public CompletableFuture<List<WorkspaceFolder>> workspaceFolders() {
        return CompletableFuture.completedFuture(List.of(workspaceFolder));
    }

    @Override
    public CompletableFuture<ApplyWorkspaceEditResponse> applyEdit(ApplyWorkspaceEditParams params) {
        LOG.info("{} declined workspace/applyEdit {}", name, params.getLabel() != null ? params.getLabel() : "");
        ApplyWorkspaceEditResponse response = new ApplyWorkspaceEditResponse(false);
        response.setFailureReason("Workspace edits are not supported by this client");
        return CompletableFuture.completedFuture(response);
    }
}
