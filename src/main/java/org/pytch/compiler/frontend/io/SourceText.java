package org.pytch.compiler.frontend.io;

import org.pytch.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * The decoded text of one compilation unit together with its logical file name.
 * Line offsets are only computed when a diagnostic first asks for the content of a line.
 */
public final class SourceText {

    private final String fileName;
    private final String content;
    private int[] lineOffsets;

    /**
     * @param fileName The logical file name, used in diagnostics.
     * @param content  The source code.
     */
    public SourceText(String fileName, String content) {
        this.fileName = fileName;
        this.content = content;
    }

    public String fileName() {
        return fileName;
    }

    public String content() {
        return content;
    }

    /**
     * Returns the content of a line without its terminating newline.
     * @param lineNumber The 1-based line number.
     * @return The line's content, or an empty string for lines past the end of the text.
     */
    public String lineContent(int lineNumber) {
        int[] offsets = lineOffsets();
        if (lineNumber < 1 || lineNumber > offsets.length) {
            return "";
        }
        int begin = offsets[lineNumber - 1];
        int end = content.indexOf('\n', begin);
        return content.substring(begin, end < 0 ? content.length() : end);
    }

    /**
     * Builds the public description of a position in this text.
     * @param lineNumber The 1-based line number.
     * @param columnNumber The 1-based column number.
     * @return The position including the content of its line.
     */
    public SourceInfo sourceInfo(int lineNumber, int columnNumber) {
        return new SourceInfo(fileName, lineNumber, columnNumber, lineContent(lineNumber));
    }

    private int[] lineOffsets() {
        if (lineOffsets == null) {
            List<Integer> offsets = new ArrayList<>();
            offsets.add(0);
            for (int i = 0; i < content.length(); i++) {
                if (content.charAt(i) == '\n') {
                    offsets.add(i + 1);
                }
            }
            lineOffsets = offsets.stream().mapToInt(Integer::intValue).toArray();
        }
        return lineOffsets;
    }
}
