package ch.so.agi.lspbridge.tools;

import ch.so.agi.lspbridge.client.FakeLanguageServer;
import ch.so.agi.lspbridge.client.LanguageServerClient;
import ch.so.agi.lspbridge.config.BridgeSettings;
import ch.so.agi.lspbridge.config.LanguageServerConfig;
import ch.so.agi.lspbridge.router.LanguageClientRouter;
import ch.so.agi.lspbridge.router.LanguageIntelligence;
import ch.so.agi.lspbridge.workspace.WorkspaceFileAccess;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.eclipse.lsp4j.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LanguageToolHandlersTest {

    @TempDir
    Path root;

    private FakeLanguageServer server;
    private LanguageIntelligence context;
    private LanguageToolHandlers handlers;

    @BeforeEach
    void setUp() {
        BridgeSettings settings = new BridgeSettings();
        settings.setBaseDir(root);
        settings.setRequestTimeoutMs(1_000);
        settings.setInitializeTimeoutMs(1_000);
        settings.setShutdownTimeoutMs(500);
        settings.setDiagnosticsWaitMs(200);
        settings.putServer(new LanguageServerConfig("typescript", "typescript-language-server", List.of("--stdio"),
                Map.of(".ts", "typescript"), "typescript"));

        server = new FakeLanguageServer();
        context = new LanguageIntelligence(settings, new WorkspaceFileAccess(root, false), server);
        handlers = new LanguageToolHandlers(context.getRouter(), settings);
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void silentServerYieldsCachedDiagnosticsMarkedOutOfDate() throws Exception {
        Files.writeString(root.resolve("a.ts"), "let a = 1;");

        ToolResult result = handlers.getDiagnostics("a.ts");

        assertFalse(result.isError());
        assertEquals(3, result.getContent().size());
        assertEquals("Diagnostics for a.ts:", result.getContent().get(0).getText());
        String note = result.getContent().get(1).getText();
        assertTrue(note.startsWith("These diagnostics may be out of date: "), note);
        assertTrue(note.contains("for version 1 "), note);
        assertTrue(note.contains("within 200ms"), note);
        assertTrue(note.endsWith("(nothing published yet)"), note);
        assertEquals(0, result.getContent().get(2).getData().getAsJsonArray().size());
    }

    @Test
    void outdatedDiagnosticsNameTheVersionLastPublished() throws Exception {
        Path file = Files.writeString(root.resolve("a.ts"), "let  a;\n");
        server.on(LanguageClientRouter.FORMATTING, request -> {
            PublishDiagnosticsParams params = new PublishDiagnosticsParams(file.toUri().toString(), List.of(
                    new Diagnostic(new Range(new Position(0, 3), new Position(0, 5)), "Extra space",
                            DiagnosticSeverity.Warning, "lint")));
            params.setVersion(1);
            server.push(LanguageServerClient.PUBLISH_DIAGNOSTICS, params);
            return FakeLanguageServer.json(List.of(new TextEdit(new Range(new Position(0, 3), new Position(0, 5)), " ")));
        });
        // formatting syncs version 2, for which the server never publishes
        assertFalse(handlers.formatDocument("a.ts").isError());

        ToolResult result = handlers.getDiagnostics("a.ts");

        assertFalse(result.isError());
        String note = result.getContent().get(1).getText();
        assertTrue(note.contains("for version 2 "), note);
        assertTrue(note.endsWith("(last published for version 1)"), note);
        JsonArray diagnostics = result.getContent().get(2).getData().getAsJsonArray();
        assertEquals("Extra space", diagnostics.get(0).getAsJsonObject().get("message").getAsString());
    }

    @Test
    void diagnosticsArePublishedAsJson() throws Exception {
        Path file = Files.writeString(root.resolve("a.ts"), "let a: number = '1';");
        server.on(LanguageClientRouter.COMPLETION, request -> {
            PublishDiagnosticsParams params = new PublishDiagnosticsParams(file.toUri().toString(), List.of(
                    new Diagnostic(new Range(new Position(0, 4), new Position(0, 5)), "Type mismatch",
                            DiagnosticSeverity.Error, "ts", "2322")));
            params.setVersion(1);
            server.push(LanguageServerClient.PUBLISH_DIAGNOSTICS, params);
            return FakeLanguageServer.json(List.of());
        });
        // opening the document via completions makes the server publish
        handlers.getCompletions("a.ts", 0, 0);

        ToolResult result = handlers.getDiagnostics("a.ts");

        assertFalse(result.isError());
        JsonArray diagnostics = result.getContent().get(1).getData().getAsJsonArray();
        assertEquals(1, diagnostics.size());
        JsonObject first = diagnostics.get(0).getAsJsonObject();
        assertEquals("Type mismatch", first.get("message").getAsString());
        assertEquals(1, first.get("severity").getAsInt());
    }

    @Test
    void completionsReportOneBasedPosition() throws Exception {
        Files.writeString(root.resolve("a.ts"), "console.");
        server.on(LanguageClientRouter.COMPLETION, request -> FakeLanguageServer.json(List.of(new CompletionItem("log"))));

        ToolResult result = handlers.getCompletions("a.ts", 0, 8);

        assertFalse(result.isError());
        assertEquals("Completions for a.ts at line 1, char 9:", result.firstText());
        assertEquals("log", result.getContent().get(1).getData().getAsJsonArray().get(0)
                .getAsJsonObject().get("label").getAsString());
    }

    @Test
    void definitionFailureIsReportedAsError() throws Exception {
        Files.writeString(root.resolve("a.ts"), "b();");

        ToolResult result = handlers.findDefinition("a.ts", 0, 0);

        assertTrue(result.isError());
        assertTrue(result.firstText().startsWith("Error finding definition: getDefinition failed for a.ts"));
        assertTrue(result.toJson().get("isError").getAsBoolean());
    }

    @Test
    void definitionListsLocations() throws Exception {
        Files.writeString(root.resolve("a.ts"), "b();");
        Location location = new Location(root.resolve("b.ts").toUri().toString(),
                new Range(new Position(0, 16), new Position(0, 17)));
        server.on(LanguageClientRouter.DEFINITION, request -> FakeLanguageServer.json(List.of(location)));

        ToolResult result = handlers.findDefinition("a.ts", 0, 0);

        assertEquals("Definition(s) for a.ts at line 1, char 1:", result.firstText());
        JsonObject first = result.getContent().get(1).getData().getAsJsonArray().get(0).getAsJsonObject();
        assertEquals(location.getUri(), first.get("uri").getAsString());
    }

    @Test
    void formatReportsSuccessAndNoChange() throws Exception {
        Files.writeString(root.resolve("a.ts"), "let  a;\n");
        server.on(LanguageClientRouter.FORMATTING, request -> FakeLanguageServer.json(List.of(
                new TextEdit(new Range(new Position(0, 3), new Position(0, 5)), " "))));

        assertEquals("Document a.ts formatted successfully.", handlers.formatDocument("a.ts").firstText());
        assertEquals("let a;\n", Files.readString(root.resolve("a.ts")));

        server.on(LanguageClientRouter.FORMATTING, request -> FakeLanguageServer.json(List.of()));
        ToolResult unchanged = handlers.formatDocument("a.ts");
        assertFalse(unchanged.isError());
        assertEquals("No formatting changes needed or returned by the language server.", unchanged.firstText());
    }

    @Test
    void pathOutsideWorkspaceIsAnError() {
        ToolResult result = handlers.getDiagnostics("../../etc/passwd");

        assertTrue(result.isError());
        assertTrue(result.firstText().startsWith("Error getting diagnostics: "));
        assertEquals(0, server.launches());
    }
}
