package com.github.dimitryivaniuta.storefront.search;

import com.github.dimitryivaniuta.storefront.catalog.CatalogItem;
import com.github.dimitryivaniuta.storefront.support.TestLexicons;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FuzzyRankerTest {

    private final QueryNormalizer normalizer = new QueryNormalizer(TestLexicons.catalog(), 100, 4);
    private final FuzzyRanker ranker = new FuzzyRanker(0.2);

    private static CatalogItem item(String id, String name, double rating, int stock, boolean bestSeller, String... tags) {
        return new CatalogItem(id, name, BigDecimal.valueOf(100), rating, stock, null, List.of(tags), bestSeller, null);
    }

    @Test
    void exactMatchesShouldOutrankFuzzyOnes() {
        List<CatalogItem> candidates = List.of(
                item("fuzzy", "Sumer dres", 5.0, 10, true),
                item("exact", "Summer dress", 1.0, 0, false));

        List<ScoredMatch> ranked = ranker.rank(normalizer.normalize("summer dress"), candidates, 10);

        assertThat(ranked).extracting(m -> m.item().id()).containsExactly("exact", "fuzzy");
        assertThat(ranked.get(0).exactMatch()).isTrue();
        assertThat(ranked.get(0).rank()).isEqualTo(1);
        assertThat(ranked.get(1).rank()).isEqualTo(2);
    }

    private static NormalizedQuery unknownWordQuery(String word) {
        return new NormalizedQuery(word, List.of(new Keyword(word, null, false)), SearchIntent.NONE);
    }

    @Test
    void substitutionTypoInQueryShouldStillRankIntendedItemFirst() {
        List<CatalogItem> candidates = List.of(
                item("tee", "Plain tee", 5.0, 20, true),
                item("dress", "Striped dress", 4.8, 9, true),
                item("paisley", "Paisley scarf", 2.0, 0, false),
                item("skirt", "Floral skirt", 4.9, 3, true));

        // "paislay" is not a lexicon word, so only the ranker can bridge the typo
        List<ScoredMatch> ranked = ranker.rank(unknownWordQuery("paislay"), candidates, 3);

        assertThat(ranked).isNotEmpty();
        assertThat(ranked.get(0).item().id()).isEqualTo("paisley");
        assertThat(ranked.get(0).exactMatch()).isFalse();
        assertThat(ranked.get(0).similarityScore()).isCloseTo(6.0 / 7.0, within(1e-9));
    }

    @Test
    void substitutionTypoInCatalogTextShouldStillMatch() {
        List<CatalogItem> candidates = List.of(
                item("striped", "Striped dress", 5.0, 20, true),
                item("lonen", "Lonen tunic", 1.0, 0, false),
                item("silk", "Silk top", 4.5, 5, true));

        List<ScoredMatch> ranked = ranker.rank(unknownWordQuery("linen"), candidates, 3);

        assertThat(ranked.get(0).item().id()).isEqualTo("lonen");
        assertThat(ranked.get(0).similarityScore()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void businessWeightShouldBreakSimilarityTies() {
        List<CatalogItem> candidates = List.of(
                item("low", "Linen shirt", 3.0, 0, false),
                item("high", "Linen shirt", 4.5, 12, true));

        List<ScoredMatch> ranked = ranker.rank(normalizer.normalize("linen shirt"), candidates, 10);

        assertThat(ranked).extracting(m -> m.item().id()).containsExactly("high", "low");
    }

    @Test
    void equalCandidatesShouldKeepUpstreamOrder() {
        List<CatalogItem> candidates = List.of(
                item("first", "Cotton hoodie", 4.0, 1, false),
                item("second", "Cotton hoodie", 4.0, 1, false));

        List<ScoredMatch> ranked = ranker.rank(normalizer.normalize("cotton hoodie"), candidates, 10);

        assertThat(ranked).extracting(m -> m.item().id()).containsExactly("first", "second");
    }

    @Test
    void unrelatedCandidatesShouldBeDroppedBelowMinSimilarity() {
        List<CatalogItem> candidates = List.of(
                item("match", "Wool coat", 4.0, 1, false),
                item("noise", "xxxxxxxx", 5.0, 1, true));

        List<ScoredMatch> ranked = ranker.rank(normalizer.normalize("wool coat"), candidates, 10);

        assertThat(ranked).extracting(m -> m.item().id()).containsExactly("match");
    }

    @Test
    void negatedKeywordShouldPushMatchingItemsDown() {
        List<CatalogItem> candidates = List.of(
                item("black", "Summer dress", 5.0, 10, true, "black"),
                item("red", "Summer dress", 3.0, 1, false, "red"));

        List<ScoredMatch> ranked = ranker.rank(normalizer.normalize("summer dress without black"), candidates, 10);

        assertThat(ranked).extracting(m -> m.item().id()).containsExactly("red", "black");
        assertThat(ranked.get(1).exactMatch()).isFalse();
        assertThat(ranked.get(1).similarityScore()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void shouldHonourLimit() {
        List<CatalogItem> candidates = List.of(
                item("1", "Summer outfit", 4.0, 1, false),
                item("2", "Summer outfit", 4.0, 1, false),
                item("3", "Summer outfit", 4.0, 1, false),
                item("4", "Summer outfit", 4.0, 1, false));

        assertThat(ranker.rank(normalizer.normalize("summer outfit"), candidates, 3)).hasSize(3);
        assertThatThrownBy(() -> ranker.rank(normalizer.normalize("summer outfit"), candidates, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void businessWeightShouldCombineRatingStockAndBestSeller() {
        CatalogItem item = item("x", "x", 5.0, 3, true);

        assertThat(FuzzyRanker.businessWeight(item)).isCloseTo(1.0, within(1e-9));
        assertThat(FuzzyRanker.businessWeight(item("y", "y", 2.5, 0, false))).isCloseTo(0.3, within(1e-9));
    }

    @Test
    void multiWordKeywordShouldAverageWordSimilarity() {
        assertThat(FuzzyRanker.keywordSimilarity("light blue", List.of("light", "blue", "shirt"))).isEqualTo(1.0);
        // "blu" is one edit from "blue": (1.0 + 0.75) / 2
        assertThat(FuzzyRanker.keywordSimilarity("light blue", List.of("light", "blu")))
                .isCloseTo(0.875, within(1e-9));
    }
}
