package ch.so.agi.lspbridge.tools;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Line protocol in front of {@link LanguageToolHandlers}: every input line is a JSON object
 * {@code {"tool": "...", "filePath": "...", "line": n, "character": n}}, every output line the
 * corresponding {@link ToolResult}.
 */
public class ToolDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(ToolDispatcher.class);

    public static final String GET_DIAGNOSTICS = "getDiagnostics";
    public static final String GET_COMPLETIONS = "getCompletions";
    public static final String FIND_DEFINITION = "findDefinition";
    public static final String FORMAT_DOCUMENT = "formatDocument";

    private final LanguageToolHandlers handlers;

    public ToolDispatcher(LanguageToolHandlers handlers) {
        this.handlers = handlers;
    }

    /** Serves requests until {@code in} reaches EOF. Blank lines are skipped. */
    public void serve(InputStream in, OutputStream out) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) continue;
            writer.write(dispatch(line).toJson().toString());
            writer.write('\n');
            writer.flush();
        }
        LOG.info("Input closed");
    }

    public ToolResult dispatch(String requestLine) {
        JsonObject request;
        try {
            JsonElement parsed = JsonParser.parseString(requestLine);
            if (!parsed.isJsonObject()) {
                return ToolResult.error("Invalid request: expected a JSON object");
            }
            request = parsed.getAsJsonObject();
        } catch (JsonParseException ex) {
            LOG.warn("Invalid request line: {}", ex.getMessage());
            return ToolResult.error("Invalid request: " + ex.getMessage());
        }

        String tool = string(request, "tool");
        String filePath = string(request, "filePath");
        if (tool == null) {
            return ToolResult.error("Invalid request: missing \"tool\"");
        }
        if (filePath == null) {
            return ToolResult.error("Invalid request: missing \"filePath\"");
        }

        try {
            switch (tool) {
                case GET_DIAGNOSTICS:
                    return handlers.getDiagnostics(filePath);
                case GET_COMPLETIONS:
                    return handlers.getCompletions(filePath, integer(request, "line"), integer(request, "character"));
                case FIND_DEFINITION:
                    return handlers.findDefinition(filePath, integer(request, "line"), integer(request, "character"));
                case FORMAT_DOCUMENT:
                    return handlers.formatDocument(filePath);
                default:
                    return ToolResult.error("Unknown tool: " + tool);
            }
        } catch (IllegalArgumentException ex) {
            return ToolResult.error("Invalid request: " + ex.getMessage());
        }
    }

    private static String string(JsonObject o, String key) {
        JsonElement e = o.get(key);
        return e != null && e.isJsonPrimitive() ? e.getAsString() : null;
    }

    private static int integer(JsonObject o, String key) {
        JsonElement e = o.get(key);
        if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isNumber()) {
            throw new IllegalArgumentException("missing or non-numeric \"" + key + "\"");
        }
        int value = e.getAsInt();
        if (value < 0) {
            throw new IllegalArgumentException("\"" + key + "\" must not be negative");
        }
        return value;
    }
}
