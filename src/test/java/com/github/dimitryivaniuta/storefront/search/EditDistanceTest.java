package com.github.dimitryivaniuta.storefront.search;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EditDistanceTest {

    @Test
    void levenshteinShouldCountInsertsDeletesAndSubstitutions() {
        assertThat(EditDistance.levenshtein("summr", "summer")).isEqualTo(1);
        assertThat(EditDistance.levenshtein("outfitt", "outfit")).isEqualTo(1);
        assertThat(EditDistance.levenshtein("kitten", "sitting")).isEqualTo(3);
        assertThat(EditDistance.levenshtein("", "abc")).isEqualTo(3);
    }

    @Test
    void similarityShouldBeNormalizedByLongerString() {
        assertThat(EditDistance.similarity("dress", "dress")).isEqualTo(1.0);
        assertThat(EditDistance.similarity("dres", "dress")).isCloseTo(0.8, within(1e-9));
        assertThat(EditDistance.similarity("", "")).isEqualTo(1.0);
        assertThat(EditDistance.similarity("abc", "xyz")).isZero();
    }
}
