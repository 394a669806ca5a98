package com.libragraph.contentstore.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ContentIdTest {

    @Test
    void plainIdIsItsOwnKey() {
        assertThat(ContentId.of("post-42").storageKey()).isEqualTo("post-42");
    }

    @Test
    void escapesReservedCharacters() {
        assertThat(ContentId.of("https://example.com/blog/post 1").storageKey())
                .isEqualTo("https%3A%2F%2Fexample.com%2Fblog%2Fpost%201");
    }

    @Test
    void leavesUnreservedPunctuationAlone() {
        assertThat(ContentId.of("a_b.c!d~e*f'g(h)").storageKey())
                .isEqualTo("a_b.c!d~e*f'g(h)");
    }

    @Test
    void encodesNonAsciiAsUtf8() {
        assertThat(ContentId.of("café").storageKey()).isEqualTo("caf%C3%A9");
    }

    @Test
    void plusSignIsEscaped() {
        assertThat(ContentId.of("a+b").storageKey()).isEqualTo("a%2Bb");
    }

    @Test
    void dotSegmentsAreFullyEscaped() {
        assertThat(ContentId.of(".").storageKey()).isEqualTo("%2E");
        assertThat(ContentId.of("..").storageKey()).isEqualTo("%2E%2E");
        assertThat(ContentId.of("...").storageKey()).isEqualTo("%2E%2E%2E");
    }

    @Test
    void dotsInsideLongerIdsPassThrough() {
        assertThat(ContentId.of("..a").storageKey()).isEqualTo("..a");
        assertThat(ContentId.of("a..").storageKey()).isEqualTo("a..");
    }

    @Test
    void rejectsEmptyAndNull() {
        assertThatIllegalArgumentException().isThrownBy(() -> ContentId.of(""));
        assertThatNullPointerException().isThrownBy(() -> ContentId.of(null));
    }

    @Test
    void toStringIsRawValue() {
        assertThat(ContentId.of("a/b").toString()).isEqualTo("a/b");
    }
}
