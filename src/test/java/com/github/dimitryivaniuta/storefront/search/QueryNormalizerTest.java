package com.github.dimitryivaniuta.storefront.search;

import com.github.dimitryivaniuta.storefront.search.lexicon.KeywordCategory;
import com.github.dimitryivaniuta.storefront.search.lexicon.Lexicon;
import com.github.dimitryivaniuta.storefront.support.TestLexicons;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class QueryNormalizerTest {

    private final QueryNormalizer normalizer = new QueryNormalizer(TestLexicons.catalog(), 100, 4);

    @Test
    void slangAndTypoVariantsShouldShareCanonicalText() {
        assertThat(normalizer.normalize("summer outfit").canonicalText()).isEqualTo("summer outfit");
        assertThat(normalizer.normalize("i want a summery fit pls").canonicalText()).isEqualTo("summer outfit");
        assertThat(normalizer.normalize("Summr OUTFITT!").canonicalText()).isEqualTo("summer outfit");
    }

    @Test
    void arabicDialectShouldMapOntoCanonicalVocabulary() {
        NormalizedQuery q = normalizer.normalize("عايز طقم صيفي");

        assertThat(q.canonicalText()).isEqualTo("outfit summer");
        assertThat(q.intent().season()).isEqualTo(Season.SUMMER);
        assertThat(q.intent().completeOutfit()).isTrue();
    }

    @Test
    void intentShouldCarrySeasonOccasionAndPriceBand() {
        NormalizedQuery q = normalizer.normalize("cheap summer dress for a wedding");

        assertThat(q.intent().season()).isEqualTo(Season.SUMMER);
        assertThat(q.intent().occasion()).isEqualTo(Occasion.WEDDING);
        assertThat(q.intent().priceBand()).isEqualTo(PriceBand.LOW);
        assertThat(q.intent().completeOutfit()).isFalse();
    }

    @Test
    void negatedPhraseShouldBeSubstitutedBeforeNegationHandling() {
        assertThat(normalizer.normalize("not expensive").canonicalText()).isEqualTo("cheap");
        assertThat(normalizer.normalize("مش غالي").intent().priceBand()).isEqualTo(PriceBand.LOW);
    }

    @Test
    void negationShouldMarkFollowingKeyword() {
        NormalizedQuery q = normalizer.normalize("summer dress without black");

        assertThat(q.canonicalText()).isEqualTo("summer dress not black");
        assertThat(q.negatedKeywords()).extracting(Keyword::term).containsExactly("black");
        assertThat(q.positiveKeywords()).extracting(Keyword::term).containsExactly("summer", "dress");
    }

    @Test
    void repeatedNegationsShouldCollapse() {
        NormalizedQuery q = normalizer.normalize("no no red");

        assertThat(q.canonicalText()).isEqualTo("not red");
        assertThat(q.keywords()).containsExactly(new Keyword("red", KeywordCategory.COLOR, true));
    }

    @Test
    void longestCategoryTermShouldWin() {
        NormalizedQuery q = normalizer.normalize("light blue shirt");

        assertThat(q.keywords()).extracting(Keyword::term).containsExactly("light blue", "shirt");
        assertThat(q.keywords().get(0).category()).isEqualTo(KeywordCategory.COLOR);
    }

    @Test
    void keywordsShouldBeDistinctByTerm() {
        NormalizedQuery q = normalizer.normalize("dress dresses فستان");

        assertThat(q.keywords()).extracting(Keyword::term).containsExactly("dress");
    }

    @Test
    void unknownWordsShouldBeKeptAsUncategorizedKeywords() {
        NormalizedQuery q = normalizer.normalize("zara dress");

        assertThat(q.keywords().get(0)).isEqualTo(new Keyword("zara", null, false));
        assertThat(q.keywords().get(0).isCategorized()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "i want a summery fit pls",
            "Wedding dress, NOT too expensive!!",
            "عايز طقم صيفي مش غالي",
            "summr outfitt without black",
            "t shirt cotton comfy for gym",
            "فستان سهرة من غير اكمام"
    })
    void normalizingCanonicalTextShouldBeIdempotent(String raw) {
        NormalizedQuery once = normalizer.normalize(raw);
        NormalizedQuery twice = normalizer.normalize(once.canonicalText());

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void fillerOnlyQueryShouldBeBlank() {
        assertThat(normalizer.normalize("please show me something").isBlank()).isTrue();
        assertThat(normalizer.normalize(null).isBlank()).isTrue();
        assertThat(normalizer.normalize("   ").keywords()).isEmpty();
    }

    @Test
    void shortTokensShouldNotBeCorrected() {
        assertThat(normalizer.correctTypo("rad")).isEqualTo("rad");
        assertThat(normalizer.correctTypo("summr")).isEqualTo("summer");
    }

    @Test
    void ambiguousTypoShouldBeLeftAlone() {
        Lexicon lexicon = new Lexicon(Map.of(),
                Map.of(KeywordCategory.GARMENT, List.of("coat", "boat")),
                List.of(), List.of(), "not", Map.of());
        QueryNormalizer n = new QueryNormalizer(lexicon, 10, 4);

        assertThat(n.correctTypo("moat")).isEqualTo("moat");
        assertThat(n.correctTypo("coats")).isEqualTo("coat");
    }

    @Test
    void resultsShouldBeMemoized() {
        NormalizedQuery first = normalizer.normalize("summer outfit");
        NormalizedQuery second = normalizer.normalize("summer outfit");

        assertThat(second).isSameAs(first);
        assertThat(normalizer.memoizedCount()).isGreaterThanOrEqualTo(1);
    }
}
