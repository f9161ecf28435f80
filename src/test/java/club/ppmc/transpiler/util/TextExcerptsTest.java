package club.ppmc.transpiler.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TextExcerptsTest {

    @Test
    void truncateKeepsLeadingCharacters() {
        assertThat(TextExcerpts.truncate("abcdef", 3)).isEqualTo("abc");
        assertThat(TextExcerpts.truncate("ab", 3)).isEqualTo("ab");
        assertThat(TextExcerpts.truncate(null, 3)).isEmpty();
    }

    @Test
    void truncateDoesNotSplitSurrogatePairs() {
        String text = "a😀b";

        assertThat(TextExcerpts.truncate(text, 2)).isEqualTo("a");
    }

    @Test
    void lineCountCountsNewlines() {
        assertThat(TextExcerpts.lineCount("")).isEqualTo(1);
        assertThat(TextExcerpts.lineCount("a\nb\n")).isEqualTo(3);
    }
}
