package ch.so.agi.lspbridge.config;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Launch description of one language server family: how to start it and which file extensions it
 * serves under which LSP language id. Immutable.
 */
public final class LanguageServerConfig {

    private final String name;
    private final String command;
    private final List<String> args;
    private final Map<String, String> languageIdsByExtension;
    private final String fallbackLanguageId;

    public LanguageServerConfig(String name, String command, List<String> args,
                                Map<String, String> languageIdsByExtension, String fallbackLanguageId) {
        this.name = Objects.requireNonNull(name, "name");
        this.command = Objects.requireNonNull(command, "command");
        this.args = args != null ? List.copyOf(args) : List.of();

        Map<String, String> normalized = new LinkedHashMap<>();
        if (languageIdsByExtension != null) {
            languageIdsByExtension.forEach((ext, id) -> {
                String key = normalizeExtension(ext);
                if (key != null && id != null && !id.isBlank()) {
                    normalized.put(key, id.trim());
                }
            });
        }
        this.languageIdsByExtension = Map.copyOf(normalized);
        this.fallbackLanguageId = fallbackLanguageId != null && !fallbackLanguageId.isBlank()
                ? fallbackLanguageId.trim()
                : "plaintext";
    }

    public String getName() {
        return name;
    }

    public String getCommand() {
        return command;
    }

    public List<String> getArgs() {
        return args;
    }

    public Map<String, String> getLanguageIdsByExtension() {
        return languageIdsByExtension;
    }

    public String getFallbackLanguageId() {
        return fallbackLanguageId;
    }

    /** Extensions (lower case, with leading dot) routed to this server. */
    public Set<String> getExtensions() {
        return languageIdsByExtension.keySet();
    }

    public String languageIdFor(Path path) {
        String ext = extensionOf(path);
        return ext != null ? languageIdsByExtension.getOrDefault(ext, fallbackLanguageId) : fallbackLanguageId;
    }

    /** The lower-cased extension including its dot, or {@code null} if the file name has none. */
    public static String extensionOf(Path path) {
        if (path == null || path.getFileName() == null) return null;
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) return null;
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    static String normalizeExtension(String ext) {
        if (ext == null) return null;
        String trimmed = ext.trim().toLowerCase(Locale.ROOT);
        if (trimmed.isEmpty() || trimmed.equals(".")) return null;
        return trimmed.startsWith(".") ? trimmed : "." + trimmed;
    }

    @Override
    public String toString() {
        return "LanguageServerConfig{name='" + name + "', command='" + command + "', args=" + args
                + ", languageIds=" + languageIdsByExtension + ", fallback='" + fallbackLanguageId + "'}";
    }
}
