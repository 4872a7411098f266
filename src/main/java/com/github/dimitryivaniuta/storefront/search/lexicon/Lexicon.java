package com.github.dimitryivaniuta.storefront.search.lexicon;

import com.github.dimitryivaniuta.storefront.search.PriceBand;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable vocabulary driving query normalization.
 *
 * Every entry is folded and tokenized with {@link QueryTokenizer} on construction, so
 * matching always happens on the same token form as the query.
 *
 * Construction rejects lexicons that would make normalization unstable:
 * a substitution target containing a substitution source, two different targets for the
 * same folded source, or a price term without a band.
 */
public final class Lexicon {

    /** A category term found at some position of a token list. */
    public record TermMatch(String term, KeywordCategory category, int length) {}

    private final Map<List<String>, List<String>> substitutions;
    private final int maxSourceLength;
    private final Map<List<String>, KeywordCategory> terms;
    private final int maxTermLength;
    private final Set<String> fillers;
    private final Set<String> negations;
    private final String negationToken;
    private final Map<String, PriceBand> priceBands;
    private final Set<String> vocabulary;

    public Lexicon(Map<String, String> substitutions,
                   Map<KeywordCategory, List<String>> categories,
                   Iterable<String> fillers,
                   Iterable<String> negations,
                   String negationToken,
                   Map<String, PriceBand> priceBands) {
        Objects.requireNonNull(substitutions, "substitutions must not be null");
        Objects.requireNonNull(categories, "categories must not be null");

        List<String> negTokens = QueryTokenizer.tokenize(negationToken);
        if (negTokens.size() != 1) {
            throw new IllegalArgumentException("negationToken must be a single token, got '" + negationToken + "'");
        }
        this.negationToken = negTokens.get(0);

        Map<List<String>, List<String>> subs = new HashMap<>();
        int maxSource = 0;
        for (Map.Entry<String, String> e : substitutions.entrySet()) {
            List<String> source = QueryTokenizer.tokenize(e.getKey());
            List<String> target = QueryTokenizer.tokenize(e.getValue());
            if (source.isEmpty() || target.isEmpty()) {
                throw new IllegalArgumentException("Empty substitution '" + e.getKey() + "' -> '" + e.getValue() + "'");
            }
            List<String> previous = subs.putIfAbsent(List.copyOf(source), List.copyOf(target));
            if (previous != null && !previous.equals(target)) {
                throw new IllegalArgumentException("Conflicting substitutions for '" + String.join(" ", source)
                        + "': " + previous + " vs " + target);
            }
            maxSource = Math.max(maxSource, source.size());
        }
        for (Map.Entry<List<String>, List<String>> e : subs.entrySet()) {
            List<String> target = e.getValue();
            for (List<String> source : subs.keySet()) {
                if (Collections.indexOfSubList(target, source) >= 0) {
                    throw new IllegalArgumentException("Substitution target '" + String.join(" ", target)
                            + "' contains source '" + String.join(" ", source) + "'");
                }
            }
        }
        this.substitutions = Collections.unmodifiableMap(subs);
        this.maxSourceLength = maxSource;

        Map<List<String>, KeywordCategory> termMap = new HashMap<>();
        Set<String> vocab = new LinkedHashSet<>();
        int maxTerm = 0;
        for (Map.Entry<KeywordCategory, List<String>> e : categories.entrySet()) {
            for (String raw : e.getValue()) {
                List<String> term = QueryTokenizer.tokenize(raw);
                if (term.isEmpty()) continue;
                KeywordCategory previous = termMap.putIfAbsent(List.copyOf(term), e.getKey());
                if (previous != null && previous != e.getKey()) {
                    throw new IllegalArgumentException("Term '" + raw + "' listed under " + previous + " and " + e.getKey());
                }
                vocab.addAll(term);
                maxTerm = Math.max(maxTerm, term.size());
            }
        }
        this.terms = Collections.unmodifiableMap(termMap);
        this.maxTermLength = maxTerm;
        this.vocabulary = Collections.unmodifiableSet(vocab);

        this.fillers = Collections.unmodifiableSet(singleTokens(fillers));
        Set<String> neg = singleTokens(negations);
        neg.add(this.negationToken);
        this.negations = Collections.unmodifiableSet(neg);

        Map<String, PriceBand> bands = new HashMap<>();
        if (priceBands != null) {
            priceBands.forEach((k, v) -> bands.put(String.join(" ", QueryTokenizer.tokenize(k)), v));
        }
        for (Map.Entry<List<String>, KeywordCategory> e : termMap.entrySet()) {
            if (e.getValue() == KeywordCategory.PRICE && !bands.containsKey(String.join(" ", e.getKey()))) {
                throw new IllegalArgumentException("Price term '" + String.join(" ", e.getKey()) + "' has no price band");
            }
        }
        this.priceBands = Collections.unmodifiableMap(bands);
    }

    /**
     * Longest-match-first phrase substitution. Replaced output is emitted as is and never
     * re-examined within this pass.
     */
    public List<String> substitute(List<String> tokens) {
        List<String> out = new ArrayList<>(tokens.size());
        int i = 0;
        while (i < tokens.size()) {
            int longest = Math.min(maxSourceLength, tokens.size() - i);
            boolean replaced = false;
            for (int len = longest; len >= 1; len--) {
                List<String> target = substitutions.get(tokens.subList(i, i + len));
                if (target != null) {
                    out.addAll(target);
                    i += len;
                    replaced = true;
                    break;
                }
            }
            if (!replaced) {
                out.add(tokens.get(i));
                i++;
            }
        }
        return out;
    }

    /** Longest category term starting at {@code index}, if any. */
    public Optional<TermMatch> matchTermAt(List<String> tokens, int index) {
        int longest = Math.min(maxTermLength, tokens.size() - index);
        for (int len = longest; len >= 1; len--) {
            List<String> candidate = tokens.subList(index, index + len);
            KeywordCategory category = terms.get(candidate);
            if (category != null) {
                return Optional.of(new TermMatch(String.join(" ", candidate), category, len));
            }
        }
        return Optional.empty();
    }

    public boolean isFiller(String token) {
        return fillers.contains(token);
    }

    public boolean isNegation(String token) {
        return negations.contains(token);
    }

    public String negationToken() {
        return negationToken;
    }

    public boolean inVocabulary(String token) {
        return vocabulary.contains(token);
    }

    /** Single words of every category term; the target set of typo correction. */
    public Set<String> vocabulary() {
        return vocabulary;
    }

    public Optional<PriceBand> priceBandFor(String term) {
        return Optional.ofNullable(priceBands.get(term));
    }

    /** Multi-token substitution sources, as space-joined phrases. */
    public Set<String> multiTokenSources() {
        Set<String> out = new HashSet<>();
        for (List<String> source : substitutions.keySet()) {
            if (source.size() > 1) out.add(String.join(" ", source));
        }
        return out;
    }

    public Optional<String> substitutionFor(String phrase) {
        List<String> target = substitutions.get(QueryTokenizer.tokenize(phrase));
        return target == null ? Optional.empty() : Optional.of(String.join(" ", target));
    }

    public int substitutionCount() {
        return substitutions.size();
    }

    public int termCount() {
        return terms.size();
    }

    private static Set<String> singleTokens(Iterable<String> raw) {
        Set<String> out = new HashSet<>();
        if (raw == null) return out;
        for (String r : raw) {
            List<String> t = QueryTokenizer.tokenize(r);
            if (t.size() == 1) {
                out.add(t.get(0));
            } else if (t.size() > 1) {
                throw new IllegalArgumentException("Expected a single token, got '" + r + "'");
            }
        }
        return out;
    }
}
