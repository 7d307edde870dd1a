package ch.so.agi.lspbridge.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * UTF-8 file access confined to one workspace root.
 */
public final class WorkspaceFileAccess implements FileAccess {
    private static final Logger LOG = LoggerFactory.getLogger(WorkspaceFileAccess.class);

    private final Path root;
    private final boolean readOnly;

    public WorkspaceFileAccess(Path root, boolean readOnly) {
        this.root = root.toAbsolutePath().normalize();
        this.readOnly = readOnly;
    }

    public Path getRoot() {
        return root;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    @Override
    public Path resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Invalid path provided.");
        }
        Path resolved;
        try {
            resolved = root.resolve(Paths.get(path.trim())).normalize();
        } catch (InvalidPathException ex) {
            throw new IllegalArgumentException("Invalid path \"" + path + "\": " + ex.getMessage(), ex);
        }
        if (!isInsideRoot(resolved)) {
            LOG.warn("Path validation failed: \"{}\" is outside base directory \"{}\"", resolved, root);
            throw new IllegalArgumentException("Path not allowed: \"" + path
                    + "\" is outside the configured base directory or is invalid.");
        }
        return resolved;
    }

    @Override
    public String readText(Path path) throws IOException {
        return Files.readString(checked(path), StandardCharsets.UTF_8);
    }

    @Override
    public void writeText(Path path, String text) throws IOException {
        if (readOnly) {
            throw new IOException("Operation not allowed: Server is in read-only mode.");
        }
        Path target = checked(path);
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, text, StandardCharsets.UTF_8);
    }

    /** Creates the workspace root if it does not exist yet. */
    public void ensureRoot() throws IOException {
        Files.createDirectories(root);
    }

    private Path checked(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        if (!isInsideRoot(normalized)) {
            throw new IllegalArgumentException("Path not allowed: \"" + path + "\" is outside the configured base directory.");
        }
        return normalized;
    }

    private boolean isInsideRoot(Path path) {
        return path.startsWith(root);
    }
}
