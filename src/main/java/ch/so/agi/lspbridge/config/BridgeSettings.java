package ch.so.agi.lspbridge.config;

import com.google.gson.*;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static configuration of the bridge: workspace root, timeouts, formatting options and the language
 * servers to launch. Read once at startup.
 */
public class BridgeSettings {
    private static final Logger LOG = LoggerFactory.getLogger(BridgeSettings.class);

    public static final String DEFAULTS_RESOURCE = "/language-servers.json";
    public static final String ENV_CONFIG_FILE = "LSP_BRIDGE_CONFIG";
    public static final String ENV_BASE_DIR = "MCP_BASE_DIR";
    public static final String ENV_READ_ONLY = "MCP_READ_ONLY_MODE";

    /** Root of every file operation and working directory of the language servers. */
    private Path baseDir = Paths.get("project-output").toAbsolutePath().normalize();

    private boolean readOnly;

    /** Server that handles extensions no server claims. */
    private String defaultServer = "";

    private long requestTimeoutMs = 5_000;
    private long initializeTimeoutMs = 15_000;
    private long shutdownTimeoutMs = 2_000;
    private long diagnosticsWaitMs = 3_000;

    private int tabSize = 2;
    private boolean insertSpaces = true;

    private final Map<String, LanguageServerConfig> servers = new LinkedHashMap<>();

    /**
     * Defaults from the classpath, overlaid with the file named by {@value #ENV_CONFIG_FILE} and the
     * {@value #ENV_BASE_DIR}/{@value #ENV_READ_ONLY} variables.
     */
    public static BridgeSettings load(Map<String, String> env) throws IOException {
        BridgeSettings s = fromClasspath();

        String configFile = env.get(ENV_CONFIG_FILE);
        if (configFile != null && !configFile.isBlank()) {
            Path file = Paths.get(configFile.trim());
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                s.apply(JsonParser.parseReader(reader));
            } catch (JsonParseException ex) {
                throw new IOException("Invalid configuration file " + file + ": " + ex.getMessage(), ex);
            }
            LOG.info("Loaded language server configuration from {}", file);
        }

        String baseDir = env.get(ENV_BASE_DIR);
        if (baseDir != null && !baseDir.isBlank()) {
            s.setBaseDir(Paths.get(baseDir.trim()));
        }
        s.setReadOnly(Boolean.parseBoolean(env.getOrDefault(ENV_READ_ONLY, "false")));
        return s;
    }

    public static BridgeSettings fromClasspath() throws IOException {
        BridgeSettings s = new BridgeSettings();
        try (InputStream in = BridgeSettings.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                LOG.warn("Resource {} not found, no language servers configured", DEFAULTS_RESOURCE);
                return s;
            }
            s.apply(JsonParser.parseReader(new InputStreamReader(in, StandardCharsets.UTF_8)));
        } catch (JsonParseException ex) {
            throw new IOException("Invalid " + DEFAULTS_RESOURCE + ": " + ex.getMessage(), ex);
        }
        return s;
    }

    /** Build from a JSON string, a Gson tree or a {@code Map} payload. Unknown keys are ignored. */
    public static BridgeSettings from(Object any) {
        BridgeSettings s = new BridgeSettings();
        if (any == null) return s;
        JsonElement je = (any instanceof JsonElement) ? (JsonElement) any
                : (any instanceof Map<?, ?>) ? new Gson().toJsonTree(any)
                : JsonParser.parseString(any.toString());
        s.apply(je);
        return s;
    }

    /** Overlays the keys present in {@code je}; servers are added or replaced by name. */
    public void apply(JsonElement je) {
        if (je == null || !je.isJsonObject()) return;
        JsonObject obj = je.getAsJsonObject();

        if (obj.has("baseDir") && obj.get("baseDir").isJsonPrimitive()) {
            setBaseDir(Paths.get(obj.get("baseDir").getAsString()));
        }
        if (obj.has("readOnly")) {
            setReadOnly(asBoolean(obj.get("readOnly"), readOnly));
        }
        if (obj.has("defaultServer") && obj.get("defaultServer").isJsonPrimitive()) {
            setDefaultServer(obj.get("defaultServer").getAsString());
        }
        requestTimeoutMs = asPositiveLong(obj, "requestTimeoutMs", requestTimeoutMs);
        initializeTimeoutMs = asPositiveLong(obj, "initializeTimeoutMs", initializeTimeoutMs);
        shutdownTimeoutMs = asPositiveLong(obj, "shutdownTimeoutMs", shutdownTimeoutMs);
        diagnosticsWaitMs = asPositiveLong(obj, "diagnosticsWaitMs", diagnosticsWaitMs);

        if (obj.has("formatting") && obj.get("formatting").isJsonObject()) {
            JsonObject fmt = obj.getAsJsonObject("formatting");
            tabSize = (int) asPositiveLong(fmt, "tabSize", tabSize);
            if (fmt.has("insertSpaces")) {
                insertSpaces = asBoolean(fmt.get("insertSpaces"), insertSpaces);
            }
        }

        if (obj.has("servers") && obj.get("servers").isJsonObject()) {
            for (Map.Entry<String, JsonElement> entry : obj.getAsJsonObject("servers").entrySet()) {
                LanguageServerConfig cfg = parseServer(entry.getKey(), entry.getValue());
                if (cfg != null) {
                    servers.put(cfg.getName(), cfg);
                }
            }
        }
    }

    private static LanguageServerConfig parseServer(String name, JsonElement je) {
        if (je == null || !je.isJsonObject()) {
            LOG.warn("Ignoring server '{}': expected an object", name);
            return null;
        }
        JsonObject obj = je.getAsJsonObject();
        if (!obj.has("command") || !obj.get("command").isJsonPrimitive()
                || obj.get("command").getAsString().isBlank()) {
            LOG.warn("Ignoring server '{}': no command", name);
            return null;
        }

        List<String> args = new ArrayList<>();
        if (obj.has("args") && obj.get("args").isJsonArray()) {
            for (JsonElement arg : obj.getAsJsonArray("args")) {
                if (arg.isJsonPrimitive()) args.add(arg.getAsString());
            }
        }

        Map<String, String> languageIds = new LinkedHashMap<>();
        if (obj.has("languageIds") && obj.get("languageIds").isJsonObject()) {
            for (Map.Entry<String, JsonElement> e : obj.getAsJsonObject("languageIds").entrySet()) {
                if (e.getValue().isJsonPrimitive()) languageIds.put(e.getKey(), e.getValue().getAsString());
            }
        }

        String fallback = obj.has("fallbackLanguageId") && obj.get("fallbackLanguageId").isJsonPrimitive()
                ? obj.get("fallbackLanguageId").getAsString()
                : null;

        return new LanguageServerConfig(name, obj.get("command").getAsString().trim(), args, languageIds, fallback);
    }

    private static long asPositiveLong(JsonObject obj, String key, long current) {
        if (!obj.has(key)) return current;
        JsonElement el = obj.get(key);
        try {
            long value = el.getAsLong();
            if (value > 0) return value;
        } catch (RuntimeException ex) {
            // falls through to the warning below
        }
        LOG.warn("Ignoring invalid value for {}: {}", key, el);
        return current;
    }

    private static boolean asBoolean(JsonElement el, boolean current) {
        if (el == null || !el.isJsonPrimitive()) return current;
        JsonPrimitive prim = el.getAsJsonPrimitive();
        if (prim.isBoolean()) return prim.getAsBoolean();
        if (prim.isString()) return Boolean.parseBoolean(prim.getAsString());
        return current;
    }

    public Path getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public void setReadOnly(boolean readOnly) {
        this.readOnly = readOnly;
    }

    /** The configured default server, or the first configured server when that name is unknown. */
    public String getDefaultServer() {
        if (servers.containsKey(defaultServer) || servers.isEmpty()) return defaultServer;
        return servers.keySet().iterator().next();
    }

    public void setDefaultServer(String defaultServer) {
        this.defaultServer = defaultServer != null ? defaultServer.trim() : "";
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public long getInitializeTimeoutMs() {
        return initializeTimeoutMs;
    }

    public void setInitializeTimeoutMs(long initializeTimeoutMs) {
        this.initializeTimeoutMs = initializeTimeoutMs;
    }

    public long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    public long getDiagnosticsWaitMs() {
        return diagnosticsWaitMs;
    }

    public void setDiagnosticsWaitMs(long diagnosticsWaitMs) {
        this.diagnosticsWaitMs = diagnosticsWaitMs;
    }

    public int getTabSize() {
        return tabSize;
    }

    public boolean isInsertSpaces() {
        return insertSpaces;
    }

    public Map<String, LanguageServerConfig> getServers() {
        return Collections.unmodifiableMap(servers);
    }

    public void putServer(LanguageServerConfig config) {
        servers.put(config.getName(), config);
    }

    public void clearServers() {
        servers.clear();
    }

    @Override public String toString() {
        return "BridgeSettings{baseDir=" + baseDir + ", readOnly=" + readOnly + ", defaultServer='" + getDefaultServer()
                + "', requestTimeoutMs=" + requestTimeoutMs + ", initializeTimeoutMs=" + initializeTimeoutMs
                + ", shutdownTimeoutMs=" + shutdownTimeoutMs + ", diagnosticsWaitMs=" + diagnosticsWaitMs
                + ", servers=" + servers.keySet() + "}";
    }
}
