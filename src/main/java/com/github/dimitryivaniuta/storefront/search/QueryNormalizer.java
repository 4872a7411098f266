package com.github.dimitryivaniuta.storefront.search;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.dimitryivaniuta.storefront.search.lexicon.KeywordCategory;
import com.github.dimitryivaniuta.storefront.search.lexicon.Lexicon;
import com.github.dimitryivaniuta.storefront.search.lexicon.QueryTokenizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a free-form shopper query (English, Arabic dialect, slang, typos) into a
 * {@link NormalizedQuery}.
 *
 * Pipeline:
 * 1) fold + tokenize, 2) longest-match phrase substitution, 3) filler removal,
 * 4) negation markers rewritten to the lexicon's negation token,
 * 5) typo correction against the category vocabulary,
 * 6) keyword extraction, 7) intent derivation.
 *
 * Steps 2-5 are repeated until the token list stops changing. Dropping a filler or fixing a
 * typo can bring two tokens together that form a substitution source, and repeating makes
 * {@code normalize(normalize(x).canonicalText())} equal to {@code normalize(x)}.
 */
@Slf4j
public class QueryNormalizer {

    private static final int MAX_PASSES = 4;

    private final Lexicon lexicon;
    private final int minCorrectionLength;
    private final Cache<String, NormalizedQuery> memo;

    public QueryNormalizer(Lexicon lexicon, int memoSize, int minCorrectionLength) {
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon must not be null");
        this.minCorrectionLength = Math.max(1, minCorrectionLength);
        this.memo = Caffeine.newBuilder()
                .maximumSize(Math.max(0, memoSize))
                .build();
    }

    public NormalizedQuery normalize(String rawQuery) {
        return memo.get(rawQuery == null ? "" : rawQuery, this::compute);
    }

    public long memoizedCount() {
        memo.cleanUp();
        return memo.estimatedSize();
    }

    private NormalizedQuery compute(String rawQuery) {
        List<String> tokens = QueryTokenizer.tokenize(rawQuery);
        boolean stable = false;
        for (int pass = 0; pass < MAX_PASSES && !stable; pass++) {
            List<String> next = canonicalize(tokens);
            stable = next.equals(tokens);
            tokens = next;
        }
        if (!stable) {
            log.debug("Normalization of '{}' did not settle after {} passes", rawQuery, MAX_PASSES);
        }

        List<Keyword> keywords = extractKeywords(tokens);
        return new NormalizedQuery(String.join(" ", tokens), keywords, deriveIntent(keywords));
    }

    private List<String> canonicalize(List<String> tokens) {
        List<String> substituted = lexicon.substitute(tokens);
        List<String> out = new ArrayList<>(substituted.size());
        for (String token : substituted) {
            if (lexicon.isFiller(token)) {
                continue;
            }
            if (lexicon.isNegation(token)) {
                String neg = lexicon.negationToken();
                // "not no red" carries one negation
                if (out.isEmpty() || !out.get(out.size() - 1).equals(neg)) {
                    out.add(neg);
                }
                continue;
            }
            out.add(correctTypo(token));
        }
        return out;
    }

    /**
     * Replaces an unknown token by the single vocabulary word one edit away. Ambiguous
     * candidates leave the token untouched.
     */
    String correctTypo(String token) {
        if (token.length() < minCorrectionLength || lexicon.inVocabulary(token)) {
            return token;
        }
        String best = null;
        for (String word : lexicon.vocabulary()) {
            if (Math.abs(word.length() - token.length()) > 1) {
                continue;
            }
            if (EditDistance.levenshtein(token, word) == 1) {
                if (best != null) {
                    return token;
                }
                best = word;
            }
        }
        return best == null ? token : best;
    }

    private List<Keyword> extractKeywords(List<String> tokens) {
        List<Keyword> keywords = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        boolean negatePending = false;
        int i = 0;
        while (i < tokens.size()) {
            String token = tokens.get(i);
            if (lexicon.isNegation(token)) {
                negatePending = true;
                i++;
                continue;
            }
            Optional<Lexicon.TermMatch> match = lexicon.matchTermAt(tokens, i);
            String term = match.map(Lexicon.TermMatch::term).orElse(token);
            KeywordCategory category = match.map(Lexicon.TermMatch::category).orElse(null);
            if (seen.add(term)) {
                keywords.add(new Keyword(term, category, negatePending));
            }
            negatePending = false;
            i += match.map(Lexicon.TermMatch::length).orElse(1);
        }
        return keywords;
    }

    private SearchIntent deriveIntent(List<Keyword> keywords) {
        Season season = null;
        Occasion occasion = null;
        PriceBand band = null;
        boolean outfit = false;
        for (Keyword k : keywords) {
            if (k.negated() || k.category() == null) continue;
            switch (k.category()) {
                case SEASON -> {
                    if (season == null) season = Season.fromTerm(k.term()).orElse(null);
                }
                case OCCASION -> {
                    if (occasion == null) occasion = Occasion.fromTerm(k.term()).orElse(null);
                }
                case PRICE -> {
                    if (band == null) band = lexicon.priceBandFor(k.term()).orElse(null);
                }
                case GARMENT -> outfit |= "outfit".equals(k.term()) || "set".equals(k.term());
                default -> {
                }
            }
        }
        return new SearchIntent(season, occasion, band, outfit);
    }
}
