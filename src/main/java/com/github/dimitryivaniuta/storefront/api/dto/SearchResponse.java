package com.github.dimitryivaniuta.storefront.api.dto;

import java.util.List;

/**
 * Search outcome. A failed catalog call still answers 200: {@code items} is empty and the
 * error fields say why, so the caller can pick its own fallback message.
 */
public record SearchResponse(
        String query,
        String canonicalText,
        List<KeywordView> keywords,
        List<RankedProductView> items,
        boolean cached,
        String errorKind,
        Integer upstreamStatus,
        String errorMessage
) {}
