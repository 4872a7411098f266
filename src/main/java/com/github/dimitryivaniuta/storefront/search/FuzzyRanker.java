package com.github.dimitryivaniuta.storefront.search;

import com.github.dimitryivaniuta.storefront.catalog.CatalogItem;
import com.github.dimitryivaniuta.storefront.search.lexicon.QueryTokenizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders catalog candidates against a normalized query.
 *
 * Order: exact keyword match first, then similarity, then business weight
 * (rating, stock, best seller). The sort is stable, so equal candidates keep upstream order.
 */
public class FuzzyRanker {

    static final double NEGATED_MATCH_THRESHOLD = 0.85;

    private static final Comparator<Scored> ORDER = Comparator
            .comparing(Scored::exact).reversed()
            .thenComparing(Comparator.comparingDouble(Scored::similarity).reversed())
            .thenComparing(Comparator.comparingDouble(Scored::business).reversed());

    private final double minSimilarity;

    public FuzzyRanker(double minSimilarity) {
        if (minSimilarity < 0.0 || minSimilarity > 1.0) {
            throw new IllegalArgumentException("minSimilarity must be within 0..1, got " + minSimilarity);
        }
        this.minSimilarity = minSimilarity;
    }

    public List<ScoredMatch> rank(NormalizedQuery query, List<CatalogItem> candidates, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        }
        List<Keyword> positives = query.positiveKeywords();
        List<Keyword> negatives = query.negatedKeywords();

        List<Scored> scored = new ArrayList<>(candidates.size());
        for (CatalogItem item : candidates) {
            Scored s = score(item, positives, negatives);
            if (positives.isEmpty() || s.exact() || s.similarity() >= minSimilarity) {
                scored.add(s);
            }
        }
        scored.sort(ORDER);

        List<ScoredMatch> out = new ArrayList<>(Math.min(limit, scored.size()));
        for (int i = 0; i < scored.size() && i < limit; i++) {
            Scored s = scored.get(i);
            out.add(new ScoredMatch(s.item(), s.similarity(), s.exact(), s.business(), i + 1));
        }
        return out;
    }

    private Scored score(CatalogItem item, List<Keyword> positives, List<Keyword> negatives) {
        List<String> tokens = QueryTokenizer.tokenize(item.searchableText());
        String text = String.join(" ", tokens);

        double similarity = 0.0;
        boolean exact = false;
        if (!positives.isEmpty()) {
            double sum = 0.0;
            for (Keyword k : positives) {
                sum += keywordSimilarity(k.term(), tokens);
                exact |= text.contains(k.term());
            }
            similarity = sum / positives.size();
        }
        for (Keyword k : negatives) {
            if (keywordSimilarity(k.term(), tokens) >= NEGATED_MATCH_THRESHOLD) {
                similarity *= 0.5;
                exact = false;
            }
        }
        return new Scored(item, similarity, exact, businessWeight(item));
    }

    /** Multi-word keywords average the best per-word similarity. */
    static double keywordSimilarity(String term, List<String> tokens) {
        if (tokens.isEmpty()) return 0.0;
        String[] words = term.split(" ");
        double sum = 0.0;
        for (String w : words) {
            double best = 0.0;
            for (String t : tokens) {
                best = Math.max(best, EditDistance.similarity(w, t));
                if (best == 1.0) break;
            }
            sum += best;
        }
        return sum / words.length;
    }

    static double businessWeight(CatalogItem item) {
        double rating = Math.max(0.0, Math.min(5.0, item.rating()));
        return 0.6 * (rating / 5.0)
                + 0.3 * (item.inStock() ? 1.0 : 0.0)
                + 0.1 * (item.bestSeller() ? 1.0 : 0.0);
    }

    private record Scored(CatalogItem item, double similarity, boolean exact, double business) {}
}
