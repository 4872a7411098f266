package com.github.dimitryivaniuta.storefront.search;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.github.dimitryivaniuta.storefront.catalog.CatalogItem;
import com.github.dimitryivaniuta.storefront.catalog.CatalogItemParser;
import com.github.dimitryivaniuta.storefront.catalog.ProductFilter;
import com.github.dimitryivaniuta.storefront.gateway.CallDeadline;
import com.github.dimitryivaniuta.storefront.gateway.CatalogEndpoint;
import com.github.dimitryivaniuta.storefront.gateway.CatalogGateway;
import com.github.dimitryivaniuta.storefront.gateway.UpstreamResponse;
import com.github.dimitryivaniuta.storefront.gateway.cache.CacheStrategy;
import com.github.dimitryivaniuta.storefront.search.lexicon.KeywordCategory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Free-text product search: normalize, fetch candidates through the Gateway, rank.
 *
 * The canonical text is sent as the catalog's {@code search} parameter. When that returns no
 * candidates, the joined positive keywords and then the first garment keyword are tried.
 * Upstream failures are returned in the result, never thrown.
 */
@Slf4j
public class SearchOrchestrator {

    private final QueryNormalizer normalizer;
    private final CatalogGateway gateway;
    private final FuzzyRanker ranker;
    private final boolean fallbackEnabled;
    private final int candidatePoolSize;
    private final double priceTolerance;

    public SearchOrchestrator(QueryNormalizer normalizer,
                              CatalogGateway gateway,
                              FuzzyRanker ranker,
                              boolean fallbackEnabled,
                              int candidatePoolSize,
                              double priceTolerance) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.ranker = Objects.requireNonNull(ranker, "ranker must not be null");
        this.fallbackEnabled = fallbackEnabled;
        this.candidatePoolSize = Math.max(1, Math.min(ProductFilter.MAX_PAGE_SIZE, candidatePoolSize));
        this.priceTolerance = Math.max(0.0, priceTolerance);
    }

    public SearchResult search(String rawQuery, int limit) {
        return search(rawQuery, limit, CallDeadline.none());
    }

    public SearchResult search(String rawQuery, int limit, CallDeadline deadline) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        }
        NormalizedQuery query = normalizer.normalize(rawQuery);
        if (query.isBlank()) {
            return new SearchResult(List.of(), UpstreamResponse.ok(JsonNodeFactory.instance.arrayNode(), 0L), query);
        }

        UpstreamResponse envelope = null;
        List<CatalogItem> candidates = List.of();
        for (String text : searchTexts(query)) {
            envelope = gateway.call(CatalogEndpoint.SEARCH, params(text), CacheStrategy.MEDIUM_TERM, deadline);
            if (envelope.isFailure()) {
                return new SearchResult(List.of(), envelope, query);
            }
            candidates = CatalogItemParser.parseList(envelope.data());
            if (!candidates.isEmpty()) {
                break;
            }
            log.debug("No catalog candidates for '{}'", text);
        }

        candidates = narrowByPrice(candidates, query.intent().priceBand());
        List<ScoredMatch> ranked = ranker.rank(query, candidates, limit);
        log.debug("Search '{}' -> canonical '{}': {} candidates, {} returned",
                rawQuery, query.canonicalText(), candidates.size(), ranked.size());
        return new SearchResult(ranked, envelope, query);
    }

    /** Primary text first, then the fallbacks, without duplicates. */
    List<String> searchTexts(NormalizedQuery query) {
        Set<String> texts = new LinkedHashSet<>();
        texts.add(query.canonicalText());
        if (fallbackEnabled) {
            String joined = query.positiveKeywords().stream()
                    .map(Keyword::term)
                    .collect(Collectors.joining(" "));
            if (!joined.isBlank()) {
                texts.add(joined);
            }
            query.firstPositive(KeywordCategory.GARMENT).ifPresent(k -> texts.add(k.term()));
        }
        return new ArrayList<>(texts);
    }

    /** Drops candidates outside the band unless that would drop all of them. */
    List<CatalogItem> narrowByPrice(List<CatalogItem> candidates, PriceBand band) {
        if (band == null || candidates.isEmpty()) {
            return candidates;
        }
        List<CatalogItem> inBand = candidates.stream()
                .filter(i -> band.accepts(i.price(), priceTolerance))
                .toList();
        return inBand.isEmpty() ? candidates : inBand;
    }

    private Map<String, String> params(String text) {
        return ProductFilter.builder()
                .search(text)
                .page(1)
                .pageSize(candidatePoolSize)
                .build()
                .toParams();
    }
}
