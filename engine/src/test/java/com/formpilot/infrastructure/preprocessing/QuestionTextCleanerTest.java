package com.formpilot.infrastructure.preprocessing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class QuestionTextCleanerTest {

    private final QuestionTextCleaner cleaner = new QuestionTextCleaner();

    @Test
    @DisplayName("Required-field asterisk is removed")
    void removesAsterisk() {
        assertThat(cleaner.clean("Email Address *")).isEqualTo("Email Address");
    }

    @Test
    @DisplayName("Newlines and runs of spaces collapse to one space")
    void collapsesWhitespace() {
        assertThat(cleaner.clean("What is\n  your   name")).isEqualTo("What is your name");
    }

    @Test
    @DisplayName("Trailing question marks and colons are trimmed")
    void trimsTrailingPunctuation() {
        assertThat(cleaner.clean("Phone number?")).isEqualTo("Phone number");
        assertThat(cleaner.clean("City:")).isEqualTo("City");
        assertThat(cleaner.clean("Name ?: ")).isEqualTo("Name");
    }

    @Test
    @DisplayName("Zero-width characters are removed")
    void removesInvisibleCharacters() {
        assertThat(cleaner.clean("Full\u200B Name")).isEqualTo("Full Name");
    }

    @Test
    @DisplayName("Null and empty input give an empty string")
    void nullIsEmpty() {
        assertThat(cleaner.clean(null)).isEmpty();
        assertThat(cleaner.clean("")).isEmpty();
        assertThat(cleaner.clean(" * ")).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Email Address *", "Name?:", "  What is your\tmother's name ?  ", "Zip:?", "a*b*c", "Q: A?"
    })
    @DisplayName("Cleaning twice gives the same result as cleaning once")
    void idempotent(String raw) {
        String once = cleaner.clean(raw);
        assertThat(cleaner.clean(once)).isEqualTo(once);
    }

    @Test
    @DisplayName("Match key ignores case")
    void matchKeyIgnoresCase() {
        assertThat(cleaner.matchKey("Full Name *")).isEqualTo(cleaner.matchKey("full name"));
    }
}
