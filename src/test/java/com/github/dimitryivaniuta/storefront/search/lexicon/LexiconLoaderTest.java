package com.github.dimitryivaniuta.storefront.search.lexicon;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.storefront.search.PriceBand;
import com.github.dimitryivaniuta.storefront.support.TestLexicons;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LexiconLoaderTest {

    private final LexiconLoader loader = new LexiconLoader(new ObjectMapper(), new DefaultResourceLoader());

    @Test
    void shouldLoadBundledLexicon() {
        Lexicon lexicon = loader.load(TestLexicons.LOCATION);

        assertThat(lexicon.substitutionCount()).isGreaterThan(100);
        assertThat(lexicon.termCount()).isGreaterThan(50);
        assertThat(lexicon.substitutionFor("summery")).contains("summer");
        assertThat(lexicon.substitutionFor("طقم")).contains("outfit");
        assertThat(lexicon.priceBandFor("cheap")).contains(PriceBand.LOW);
        assertThat(lexicon.isNegation("بدون")).isTrue();
    }

    @Test
    void bundledFillersShouldNotOverlapVocabulary() {
        Lexicon lexicon = loader.load(TestLexicons.LOCATION);

        assertThat(lexicon.vocabulary()).noneMatch(lexicon::isFiller);
        assertThat(lexicon.vocabulary()).noneMatch(lexicon::isNegation);
    }

    @Test
    void shouldDefaultMissingSections() throws Exception {
        String json = """
                {"categories": {"COLOR": ["red"]}}
                """;

        Lexicon lexicon = loader.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        assertThat(lexicon.negationToken()).isEqualTo("not");
        assertThat(lexicon.inVocabulary("red")).isTrue();
        assertThat(lexicon.substitutionCount()).isZero();
    }

    @Test
    void missingResourceShouldFailFast() {
        assertThatThrownBy(() -> loader.load("classpath:lexicon/does-not-exist.json"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void invalidLexiconShouldFailWithLocation() {
        assertThatThrownBy(() -> loader.load("classpath:lexicon/invalid-lexicon.json"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("invalid-lexicon.json");
    }
}
