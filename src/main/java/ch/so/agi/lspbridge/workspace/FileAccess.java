package ch.so.agi.lspbridge.workspace;

import java.io.IOException;
import java.nio.file.Path;

/**
 * File content access used by document synchronisation and formatting.
 */
public interface FileAccess {

    /**
     * Resolves a caller supplied path, relative to the workspace root or absolute, to a normalised
     * absolute path.
     *
     * @throws IllegalArgumentException if the path is empty or points outside the workspace
     */
    Path resolve(String path);

    String readText(Path path) throws IOException;

    void writeText(Path path, String text) throws IOException;
}
