package ch.so.agi.lspbridge.text;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextEditApplierTest {

    private static TextEdit edit(int sl, int sc, int el, int ec, String text) {
        return new TextEdit(new Range(new Position(sl, sc), new Position(el, ec)), text);
    }

    @Test
    void noEditsReturnsTextUnchanged() {
        assertEquals("a\nb", TextEditApplier.apply("a\nb", List.of()));
        assertEquals("a\nb", TextEditApplier.apply("a\nb", null));
    }

    @Test
    void replacesWithinOneLine() {
        String result = TextEditApplier.apply("const  x=1;\n", List.of(edit(0, 5, 0, 7, " ")));

        assertEquals("const x=1;\n", result);
    }

    @Test
    void editsAreAppliedAgainstOriginalCoordinates() {
        String text = "let a=1;\nlet b=2;\n";
        // given front to back, each range refers to the unedited text
        List<TextEdit> edits = List.of(
                edit(0, 5, 0, 6, " = "),
                edit(1, 5, 1, 6, " = "));

        assertEquals("let a = 1;\nlet b = 2;\n", TextEditApplier.apply(text, edits));
    }

    @Test
    void orderOfInputDoesNotMatterForDisjointEdits() {
        String text = "a b c";
        List<TextEdit> forward = List.of(edit(0, 0, 0, 1, "A"), edit(0, 4, 0, 5, "C"));
        List<TextEdit> backward = List.of(edit(0, 4, 0, 5, "C"), edit(0, 0, 0, 1, "A"));

        assertEquals("A b C", TextEditApplier.apply(text, forward));
        assertEquals("A b C", TextEditApplier.apply(text, backward));
    }

    @Test
    void insertsAtSamePositionKeepInputOrder() {
        String result = TextEditApplier.apply("x", List.of(edit(0, 0, 0, 0, "1"), edit(0, 0, 0, 0, "2")));

        assertEquals("12x", result);
    }

    @Test
    void multiLineReplacementJoinsLines() {
        String text = "function f() {\n\n\n  return 1;\n}\n";

        String result = TextEditApplier.apply(text, List.of(edit(0, 14, 3, 2, "\n  ")));

        assertEquals("function f() {\n  return 1;\n}\n", result);
    }

    @Test
    void insertedLineBreaksSplitLines() {
        String result = TextEditApplier.apply("a;b;", List.of(edit(0, 2, 0, 2, "\n")));

        assertEquals("a;\nb;", result);
    }

    @Test
    void wholeDocumentReplacement() {
        String text = "if(x){y()}\n";
        String formatted = "if (x) {\n  y();\n}\n";

        assertEquals(formatted, TextEditApplier.apply(text, List.of(edit(0, 0, 1, 0, formatted))));
    }

    @Test
    void wholeDocumentReplacementOfCrLfText() {
        String text = "if(x){\r\ny()}\r\n";

        assertReplacesWholeDocument(text, 2, 0);
        assertReplacesWholeDocument(text, 5, 0);
    }

    @Test
    void wholeDocumentReplacementOfLoneCrText() {
        String text = "if(x){\ry()}\r";

        assertReplacesWholeDocument(text, 2, 0);
        assertReplacesWholeDocument(text, 2, 7);
    }

    @Test
    void wholeDocumentReplacementOfMixedLineEndings() {
        String text = "if(x)\n{\r\ny()\r}\n";

        assertReplacesWholeDocument(text, 4, 0);
        assertReplacesWholeDocument(text, 9, 9);
    }

    @Test
    void wholeDocumentReplacementWithoutTrailingNewline() {
        assertReplacesWholeDocument("if(x){\ny()}", 2, 0);
        assertReplacesWholeDocument("if(x){\ny()}", 1, 4);
        assertReplacesWholeDocument("if(x){\r\ny()}", 1, 4);
        assertReplacesWholeDocument("if(x){\ry()}", 2, 0);
        assertReplacesWholeDocument("if(x){y()}", 0, 10);
        assertReplacesWholeDocument("", 0, 0);
        assertReplacesWholeDocument("", 1, 0);
    }

    @Test
    void wholeDocumentReplacementKeepsReplacementLineEndings() {
        String formatted = "if (x) {\r\n  y();\r\n}\r\n";

        assertEquals(formatted, TextEditApplier.apply("if(x){\ny()}\n", List.of(edit(0, 0, 2, 0, formatted))));
        assertEquals(formatted, TextEditApplier.apply("if(x){\ry()}", List.of(edit(0, 0, 1, 4, formatted))));
    }

    private static void assertReplacesWholeDocument(String text, int endLine, int endCharacter) {
        String formatted = "if (x) {\n  y();\n}\n";

        String result = TextEditApplier.apply(text, List.of(edit(0, 0, endLine, endCharacter, formatted)));

        assertEquals(formatted, result, () -> "replacing \"" + text.replace("\r", "\\r").replace("\n", "\\n")
                + "\" up to " + endLine + ":" + endCharacter);
    }

    @Test
    void untouchedLinesKeepCrLf() {
        String text = "a\r\nb  \r\nc\r\n";

        String result = TextEditApplier.apply(text, List.of(edit(1, 1, 1, 3, "")));

        assertEquals("a\r\nb\r\nc\r\n", result);
    }

    @Test
    void deletingLineBreakAcrossCrLf() {
        String result = TextEditApplier.apply("a\r\nb", List.of(edit(0, 1, 1, 0, " ")));

        assertEquals("a b", result);
    }

    @Test
    void positionsBeyondTheTextAreClamped() {
        String text = "abc\ndef";

        assertEquals("abcX\ndef", TextEditApplier.apply(text, List.of(edit(0, 99, 0, 99, "X"))));
        assertEquals("abc\ndefX", TextEditApplier.apply(text, List.of(edit(7, 0, 9, 0, "X"))));
        assertEquals("abc", TextEditApplier.apply(text, List.of(edit(0, 3, 99, 0, ""))));
    }

    @Test
    void editsWithoutRangeAreIgnored() {
        TextEdit broken = new TextEdit();
        broken.setNewText("zzz");

        assertEquals("aXc", TextEditApplier.apply("abc", List.of(broken, edit(0, 1, 0, 2, "X"))));
    }

    @Test
    void splitLinesKeepsTerminators() {
        assertEquals(List.of("a\n", "b\r\n", "c\r", ""), TextEditApplier.splitLines("a\nb\r\nc\r"));
        assertEquals(List.of(""), TextEditApplier.splitLines(""));
    }
}
