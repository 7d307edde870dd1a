package ch.so.agi.lspbridge.text;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies range based {@link TextEdit}s, all expressed against the original text, to produce the
 * new document content.
 *
 * <p>Edits are applied back to front, so the length changes of one edit never shift the
 * coordinates of an edit before it. Each line keeps its own terminator ({@code \n}, {@code \r\n}
 * or {@code \r}); lines an edit does not touch keep their line endings.</p>
 */
public final class TextEditApplier {

    private static final class IndexedEdit {
        final TextEdit edit;
        final int index;

        IndexedEdit(TextEdit edit, int index) {
            this.edit = edit;
            this.index = index;
        }
    }

    /**
     * Start, then end, then input index, all descending. Inserts at the same position are applied
     * last-first, so they end up in input order.
     */
    private static final Comparator<IndexedEdit> BACK_TO_FRONT = Comparator
            .comparing((IndexedEdit e) -> e.edit.getRange().getStart(), positionOrder())
            .thenComparing(e -> e.edit.getRange().getEnd(), positionOrder())
            .thenComparingInt(e -> e.index)
            .reversed();

    private TextEditApplier() {
    }

    /**
     * @return the edited text, or {@code text} unchanged when {@code edits} is null or empty
     */
    public static String apply(String text, List<? extends TextEdit> edits) {
        String original = text != null ? text : "";
        if (edits == null || edits.isEmpty()) {
            return original;
        }

        List<IndexedEdit> ordered = new ArrayList<>();
        for (int i = 0; i < edits.size(); i++) {
            TextEdit edit = edits.get(i);
            if (edit != null && edit.getRange() != null
                    && edit.getRange().getStart() != null && edit.getRange().getEnd() != null) {
                ordered.add(new IndexedEdit(edit, i));
            }
        }
        ordered.sort(BACK_TO_FRONT);

        List<String> lines = splitLines(original);
        for (IndexedEdit indexed : ordered) {
            applyOne(lines, indexed.edit);
        }
        return String.join("", lines);
    }

    private static void applyOne(List<String> lines, TextEdit edit) {
        Range range = edit.getRange();
        int[] start = resolve(lines, range.getStart());
        int[] end = resolve(lines, range.getEnd());
        if (end[0] < start[0] || (end[0] == start[0] && end[1] < start[1])) {
            end = start;
        }

        String newText = edit.getNewText() != null ? edit.getNewText() : "";
        String endLine = lines.get(end[0]);
        String prefix = lines.get(start[0]).substring(0, start[1]);
        String suffix = endLine.substring(end[1]);

        if (start[0] == end[0] && newText.indexOf('\n') < 0 && newText.indexOf('\r') < 0) {
            lines.set(start[0], prefix + newText + suffix);
            return;
        }

        List<String> replacement = splitLines(prefix + newText + suffix);
        // suffix carried the end line's terminator, the empty tail is the next, untouched line
        if (contentLength(endLine) < endLine.length() && replacement.size() > 1) {
            replacement.remove(replacement.size() - 1);
        }
        List<String> spanned = lines.subList(start[0], end[0] + 1);
        spanned.clear();
        spanned.addAll(replacement);
        if (lines.isEmpty()) {
            lines.add("");
        }
    }

    /**
     * Maps a position to {line index, offset within that line string}. Characters are clamped to
     * the line's content (terminator excluded); a line past the end means the end of the document.
     */
    private static int[] resolve(List<String> lines, Position position) {
        int last = lines.size() - 1;
        int line = position != null ? position.getLine() : 0;
        int character = position != null ? position.getCharacter() : 0;
        if (line < 0) {
            return new int[]{0, 0};
        }
        if (line > last) {
            return new int[]{last, lines.get(last).length()};
        }
        int contentLength = contentLength(lines.get(line));
        return new int[]{line, Math.max(0, Math.min(character, contentLength))};
    }

    /** Splits into lines that keep their terminators; the last element has none and may be empty. */
    static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        int lineStart = 0;
        int length = text.length();
        for (int i = 0; i < length; i++) {
            char ch = text.charAt(i);
            if (ch == '\r') {
                if (i + 1 < length && text.charAt(i + 1) == '\n') {
                    i++;
                }
                lines.add(text.substring(lineStart, i + 1));
                lineStart = i + 1;
            } else if (ch == '\n') {
                lines.add(text.substring(lineStart, i + 1));
                lineStart = i + 1;
            }
        }
        lines.add(text.substring(lineStart));
        return lines;
    }

    private static int contentLength(String line) {
        if (line.endsWith("\r\n")) return line.length() - 2;
        if (line.endsWith("\n") || line.endsWith("\r")) return line.length() - 1;
        return line.length();
    }

    private static Comparator<Position> positionOrder() {
        return Comparator.comparingInt(Position::getLine).thenComparingInt(Position::getCharacter);
    }
}
