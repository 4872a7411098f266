package com.github.dimitryivaniuta.storefront.api;

import com.github.dimitryivaniuta.storefront.api.dto.KeywordView;
import com.github.dimitryivaniuta.storefront.api.dto.ProductPageResponse;
import com.github.dimitryivaniuta.storefront.api.dto.ProductView;
import com.github.dimitryivaniuta.storefront.api.dto.RankedProductView;
import com.github.dimitryivaniuta.storefront.api.dto.SearchResponse;
import com.github.dimitryivaniuta.storefront.catalog.CatalogClient;
import com.github.dimitryivaniuta.storefront.catalog.CatalogItem;
import com.github.dimitryivaniuta.storefront.catalog.CatalogResult;
import com.github.dimitryivaniuta.storefront.gateway.CatalogGateway;
import com.github.dimitryivaniuta.storefront.gateway.CatalogGatewayProperties;
import com.github.dimitryivaniuta.storefront.gateway.GatewayStatus;
import com.github.dimitryivaniuta.storefront.gateway.UpstreamResponse;
import com.github.dimitryivaniuta.storefront.search.SearchOrchestrator;
import com.github.dimitryivaniuta.storefront.search.SearchResult;
import com.github.dimitryivaniuta.storefront.web.UpstreamFailureException;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/catalog")
public class CatalogController {

    private final SearchOrchestrator searchOrchestrator;
    private final CatalogClient catalogClient;
    private final CatalogGateway catalogGateway;
    private final CatalogGatewayProperties properties;

    @GetMapping("/search")
    public SearchResponse search(@RequestParam @NotBlank @Size(max = 200) String q,
                                 @RequestParam(required = false) @Min(1) @Max(50) Integer limit) {
        int effectiveLimit = limit != null ? limit : properties.getSearch().getDefaultLimit();
        SearchResult result = searchOrchestrator.search(q, effectiveLimit);
        UpstreamResponse env = result.envelope();
        return new SearchResponse(
                q,
                result.query().canonicalText(),
                result.query().keywords().stream().map(KeywordView::from).toList(),
                result.matches().stream().map(RankedProductView::from).toList(),
                env.cached(),
                env.isFailure() ? env.errorKind().name() : null,
                env.isFailure() ? env.statusCode() : null,
                env.errorMessage());
    }

    @GetMapping("/products/{id}")
    public ProductView product(@PathVariable @NotBlank @Size(max = 64) String id) {
        CatalogResult<Optional<CatalogItem>> result = catalogClient.productDetails(id);
        if (!result.isSuccess()) {
            throw new UpstreamFailureException(result.envelope());
        }
        return result.value()
                .map(ProductView::from)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Product " + id + " not found"));
    }

    @GetMapping("/products")
    public ProductPageResponse products(@RequestParam(required = false) @Size(max = 100) String category,
                                        @RequestParam(defaultValue = "1") @Min(1) int page,
                                        @RequestParam(defaultValue = "10") @Min(1) @Max(100) int pageSize) {
        CatalogResult<List<CatalogItem>> result = (category == null || category.isBlank())
                ? catalogClient.listProducts(page, pageSize)
                : catalogClient.productsByCategory(category, page, pageSize);
        if (!result.isSuccess()) {
            throw new UpstreamFailureException(result.envelope());
        }
        return new ProductPageResponse(
                result.value().stream().map(ProductView::from).toList(),
                category,
                page,
                pageSize,
                result.envelope().cached());
    }

    @GetMapping("/status")
    public GatewayStatus status() {
        return catalogGateway.getStatus();
    }
}
