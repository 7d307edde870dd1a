package ch.so.agi.lspbridge.client;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Keeps track of the documents opened on one language server and the version last sent for each,
 * so that every {@code didChange} carries exactly the previous version plus one.
 *
 * <p>Confined to the owning client's event loop.</p>
 */
final class DocumentTracker {

    private final Map<Path, Integer> versions = new HashMap<>();

    boolean isOpen(Path path) {
        return versions.containsKey(key(path));
    }

    /** Records {@code path} as open with version 1. */
    int open(Path path) {
        versions.put(key(path), 1);
        return 1;
    }

    /**
     * Increments the version of an open document by one.
     *
     * @return the new version
     * @throws LspClientException with {@link LspClientException.Reason#NOT_OPEN} if the document was never opened
     */
    int nextVersion(Path path) {
        Integer current = versions.get(key(path));
        if (current == null) {
            throw new LspClientException(LspClientException.Reason.NOT_OPEN, "Document is not open: " + path);
        }
        int next = current + 1;
        versions.put(key(path), next);
        return next;
    }

    /** The current version, or {@code null} if the document is not open. */
    Integer getVersion(Path path) {
        return path == null ? null : versions.get(key(path));
    }

    static String toUri(Path path) {
        return key(path).toUri().toString();
    }

    /** Maps a {@code file:} URI back to a normalised path; other URIs are used verbatim as a path. */
    static Path toPath(String uri) {
        if (uri == null || uri.isBlank()) {
            return null;
        }
        try {
            URI parsed = URI.create(uri);
            if ("file".equalsIgnoreCase(parsed.getScheme())) {
                return key(Paths.get(parsed));
            }
        } catch (IllegalArgumentException ex) {
            // not a valid URI, treat it as a plain path below
        }
        try {
            return key(Paths.get(uri));
        } catch (RuntimeException ex) {
            return null;
        }
    }

    private static Path key(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
