package ch.so.agi.lspbridge.tools;

import ch.so.agi.lspbridge.client.FakeLanguageServer;
import ch.so.agi.lspbridge.config.BridgeSettings;
import ch.so.agi.lspbridge.config.LanguageServerConfig;
import ch.so.agi.lspbridge.router.LanguageClientRouter;
import ch.so.agi.lspbridge.router.LanguageIntelligence;
import ch.so.agi.lspbridge.workspace.WorkspaceFileAccess;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.eclipse.lsp4j.CompletionItem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolDispatcherTest {

    @TempDir
    Path root;

    private FakeLanguageServer server;
    private LanguageIntelligence context;
    private ToolDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        BridgeSettings settings = new BridgeSettings();
        settings.setBaseDir(root);
        settings.setRequestTimeoutMs(1_000);
        settings.setInitializeTimeoutMs(1_000);
        settings.setShutdownTimeoutMs(500);
        settings.setDiagnosticsWaitMs(100);
        settings.putServer(new LanguageServerConfig("typescript", "typescript-language-server", List.of("--stdio"),
                Map.of(".ts", "typescript"), "typescript"));

        server = new FakeLanguageServer();
        context = new LanguageIntelligence(settings, new WorkspaceFileAccess(root, false), server);
        dispatcher = new ToolDispatcher(new LanguageToolHandlers(context.getRouter(), settings));
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void dispatchesCompletions() throws Exception {
        Files.writeString(root.resolve("a.ts"), "x.");
        server.on(LanguageClientRouter.COMPLETION, request -> FakeLanguageServer.json(List.of(new CompletionItem("y"))));

        ToolResult result = dispatcher.dispatch("{\"tool\":\"getCompletions\",\"filePath\":\"a.ts\",\"line\":0,\"character\":2}");

        assertFalse(result.isError());
        assertEquals("Completions for a.ts at line 1, char 3:", result.firstText());
    }

    @Test
    void rejectsMalformedRequests() {
        assertTrue(dispatcher.dispatch("not json").isError());
        assertTrue(dispatcher.dispatch("[1]").isError());
        assertEquals("Invalid request: missing \"tool\"", dispatcher.dispatch("{\"filePath\":\"a.ts\"}").firstText());
        assertEquals("Unknown tool: rename", dispatcher.dispatch("{\"tool\":\"rename\",\"filePath\":\"a.ts\"}").firstText());
        assertTrue(dispatcher.dispatch("{\"tool\":\"findDefinition\",\"filePath\":\"a.ts\",\"line\":\"x\"}").isError());
        assertTrue(dispatcher.dispatch("{\"tool\":\"findDefinition\",\"filePath\":\"a.ts\",\"line\":-1,\"character\":0}").isError());
        assertEquals(0, server.launches());
    }

    @Test
    void serveWritesOneResultLinePerRequest() throws Exception {
        Files.writeString(root.resolve("a.ts"), "let a;");
        String input = "{\"tool\":\"getDiagnostics\",\"filePath\":\"a.ts\"}\n\n{\"tool\":\"nope\",\"filePath\":\"a.ts\"}\n";
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        dispatcher.serve(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out);

        String[] lines = out.toString(StandardCharsets.UTF_8).split("\n");
        assertEquals(2, lines.length);
        JsonObject first = JsonParser.parseString(lines[0]).getAsJsonObject();
        // the fake server never publishes, so the cached set comes with an out-of-date note
        JsonArray content = first.getAsJsonArray("content");
        assertEquals("text", content.get(0).getAsJsonObject().get("type").getAsString());
        assertEquals("text", content.get(1).getAsJsonObject().get("type").getAsString());
        assertEquals("json", content.get(2).getAsJsonObject().get("type").getAsString());
        assertFalse(first.has("isError"));
        assertTrue(JsonParser.parseString(lines[1]).getAsJsonObject().get("isError").getAsBoolean());
    }
}
