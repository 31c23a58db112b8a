package org.pytch.compiler.frontend.io;

import org.pytch.compiler.api.SourceInfo;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link SourceText}.
 */
public class SourceTextTest {

    @Test
    @Tag("unit")
    void testLineContent() {
        SourceText text = new SourceText("a.pytch", "first\n  second\n\nlast");

        assertThat(text.lineContent(1)).isEqualTo("first");
        assertThat(text.lineContent(2)).isEqualTo("  second");
        assertThat(text.lineContent(3)).isEmpty();
        assertThat(text.lineContent(4)).isEqualTo("last");
        assertThat(text.lineContent(5)).isEmpty();
        assertThat(text.lineContent(0)).isEmpty();
    }

    @Test
    @Tag("unit")
    void testTrailingNewlineStartsEmptyLine() {
        SourceText text = new SourceText("a.pytch", "x\n");

        assertThat(text.lineContent(2)).isEmpty();
        assertThat(text.sourceInfo(2, 1)).isEqualTo(new SourceInfo("a.pytch", 2, 1, ""));
    }

    @Test
    @Tag("unit")
    void testSourceInfo() {
        SourceInfo info = new SourceText("a.pytch", "let x = 1").sourceInfo(1, 5);

        assertThat(info).isEqualTo(new SourceInfo("a.pytch", 1, 5, "let x = 1"));
        assertThat(info).hasToString("a.pytch:1:5");
    }
}
