package com.github.dimitryivaniuta.storefront.api.dto;

import java.util.List;

public record ProductPageResponse(
        List<ProductView> items,
        String category,
        int page,
        int pageSize,
        boolean cached
) {}
