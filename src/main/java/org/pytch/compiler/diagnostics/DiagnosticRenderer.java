package org.pytch.compiler.diagnostics;

import org.pytch.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders diagnostics for humans: a header naming the error code and position, the
 * message, and an ASCII excerpt of the offending line with a caret under the column.
 * Notes are rendered beneath the error they belong to and share its gutter.
 * <pre>
 * UNCLOSED_BRACKET_AT_EOF[1101] in main.pytch, line 3, character 1:
 * Error: I was expecting a ')' to close the '(' on line 1, character 6, but the file ended first.
 *   |
 * 3 |
 *   | ^
 * Note: This is the '(' that was never closed.
 *   |
 * 1 | print(1,
 *   |      ^
 * </pre>
 */
public final class DiagnosticRenderer {

    private DiagnosticRenderer() {}

    /**
     * Renders all diagnostics, one block per error.
     * @param diagnostics The diagnostics in reporting order.
     * @return The rendered text, one entry per output line.
     */
    public static List<String> renderLines(List<Diagnostic> diagnostics) {
        List<String> output = new ArrayList<>();
        List<Diagnostic> group = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.type() == Diagnostic.Type.ERROR && !group.isEmpty()) {
                renderGroup(group, output);
                group.clear();
            }
            group.add(diagnostic);
        }
        if (!group.isEmpty()) {
            renderGroup(group, output);
        }
        return output;
    }

    /**
     * Renders all diagnostics into a single string.
     * @param diagnostics The diagnostics in reporting order.
     * @return The rendered text, each line terminated by a newline.
     */
    public static String render(List<Diagnostic> diagnostics) {
        StringBuilder sb = new StringBuilder();
        for (String line : renderLines(diagnostics)) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    private static void renderGroup(List<Diagnostic> group, List<String> output) {
        int gutterWidth = group.stream()
                .mapToInt(d -> String.valueOf(d.location().lineNumber()).length())
                .max()
                .orElse(1);

        for (Diagnostic diagnostic : group) {
            SourceInfo location = diagnostic.location();
            if (diagnostic.type() == Diagnostic.Type.ERROR) {
                output.add(String.format("%s[%d] in %s, line %d, character %d:",
                        diagnostic.code().name(), diagnostic.code().id(), location.fileName(),
                        location.lineNumber(), location.columnNumber()));
                output.add("Error: " + diagnostic.message());
            } else {
                output.add("Note: " + diagnostic.message());
            }
            renderExcerpt(location, gutterWidth, output);
        }
    }

    private static void renderExcerpt(SourceInfo location, int gutterWidth, List<String> output) {
        if (location.lineContent() == null) {
            return;
        }
        String gutter = " ".repeat(gutterWidth);
        String lineNumber = String.valueOf(location.lineNumber());
        String paddedNumber = " ".repeat(gutterWidth - lineNumber.length()) + lineNumber;
        output.add(gutter + " |");
        output.add((paddedNumber + " | " + location.lineContent()).stripTrailing());
        output.add(gutter + " | " + " ".repeat(Math.max(0, location.columnNumber() - 1)) + "^");
    }
}
