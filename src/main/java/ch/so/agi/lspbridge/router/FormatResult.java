package ch.so.agi.lspbridge.router;

/**
 * Outcome of {@link LanguageClientRouter#formatDocument(String)}.
 */
public final class FormatResult {

    private final boolean applied;
    private final String newContent;
    private final Integer version;
    private final String message;

    private FormatResult(boolean applied, String newContent, Integer version, String message) {
        this.applied = applied;
        this.newContent = newContent;
        this.version = version;
        this.message = message;
    }

    public static FormatResult applied(String newContent, int version) {
        return new FormatResult(true, newContent, version, null);
    }

    public static FormatResult unchanged(String message) {
        return new FormatResult(false, null, null, message);
    }

    public boolean isApplied() {
        return applied;
    }

    /** The formatted content written to the workspace; {@code null} unless applied. */
    public String getNewContent() {
        return newContent;
    }

    /** Document version announced to the server with the formatted content; {@code null} unless applied. */
    public Integer getVersion() {
        return version;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "FormatResult{applied=" + applied + ", version=" + version + ", message='" + message + "'}";
    }
}
