package com.example.logmanager.logs.query;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QueryTokenizerTest {

    private final QueryTokenizer tokenizer = new QueryTokenizer();

    @Test
    void shouldSplitOnWhitespace() {
        assertThat(tokenizer.tokenize("level:error AND source:api"))
                .containsExactly("level:error", "AND", "source:api");
    }

    @Test
    void shouldNeverProduceEmptyTokens() {
        assertThat(tokenizer.tokenize("  level:error    source:api  "))
                .containsExactly("level:error", "source:api");
        assertThat(tokenizer.tokenize("")).isEmpty();
        assertThat(tokenizer.tokenize("   ")).isEmpty();
    }

    @Test
    void shouldKeepQuotedRunTogetherWithItsQuotes() {
        assertThat(tokenizer.tokenize("message:\"connection timeout\" level:error"))
                .containsExactly("message:\"connection timeout\"", "level:error");
    }

    @Test
    void shouldSupportSingleQuotes() {
        assertThat(tokenizer.tokenize("source:'payment service'"))
                .containsExactly("source:'payment service'");
    }

    @Test
    void shouldTreatOtherQuoteCharacterAsLiteralInsideRun() {
        assertThat(tokenizer.tokenize("message:\"it's down\" x"))
                .containsExactly("message:\"it's down\"", "x");
    }

    @Test
    void shouldConsumeToEndOfInputWhenQuoteIsUnterminated() {
        assertThat(tokenizer.tokenize("level:error message:\"never closed here"))
                .containsExactly("level:error", "message:\"never closed here");
    }

    @Test
    void shouldSplitOnTabsAndNewlines() {
        assertThat(tokenizer.tokenize("level:error\tsource:api\nfoo"))
                .containsExactly("level:error", "source:api", "foo");
    }
}
