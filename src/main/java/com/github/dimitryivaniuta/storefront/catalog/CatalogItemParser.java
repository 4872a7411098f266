package com.github.dimitryivaniuta.storefront.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Extracts {@link CatalogItem}s from the catalog's JSON, which is not consistent across
 * endpoints.
 *
 * Accepted shapes:
 * - {"data": {"products": [...]}}
 * - {"products": [...]}
 * - {"data": [...]}
 * - [...]
 * - a single product object, optionally wrapped in {"data": {...}}
 *
 * Products without an id are skipped.
 */
@Slf4j
public final class CatalogItemParser {

    private CatalogItemParser() {}

    public static List<CatalogItem> parseList(JsonNode payload) {
        JsonNode array = locateArray(payload);
        List<CatalogItem> items = new ArrayList<>();
        if (array != null) {
            for (JsonNode node : array) {
                toItem(node).ifPresent(items::add);
            }
        } else if (payload != null && payload.isObject()) {
            JsonNode single = payload.path("data").isObject() ? payload.get("data") : payload;
            toItem(single).ifPresent(items::add);
        }
        return items;
    }

    public static Optional<CatalogItem> parseOne(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return Optional.empty();
        }
        List<CatalogItem> items = parseList(payload);
        return items.isEmpty() ? Optional.empty() : Optional.of(items.get(0));
    }

    private static JsonNode locateArray(JsonNode payload) {
        if (payload == null) return null;
        if (payload.isArray()) return payload;
        JsonNode data = payload.path("data");
        if (data.isArray()) return data;
        if (data.path("products").isArray()) return data.get("products");
        if (payload.path("products").isArray()) return payload.get("products");
        return null;
    }

    static Optional<CatalogItem> toItem(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        String id = text(node.get("id"));
        if (id == null || id.isBlank()) {
            log.debug("Skipping catalog product without id");
            return Optional.empty();
        }
        return Optional.of(new CatalogItem(
                id,
                text(node.get("name")),
                price(node),
                node.path("rating").asDouble(0.0),
                firstInt(node, "stock_quantity", "stock"),
                category(node.get("category")),
                tags(node),
                node.path("is_best_seller").asBoolean(false),
                node));
    }

    private static BigDecimal price(JsonNode node) {
        for (String field : new String[]{"final_price", "price"}) {
            JsonNode p = node.get(field);
            if (p == null || p.isNull()) continue;
            if (p.isNumber()) return p.decimalValue();
            if (p.isTextual()) {
                try {
                    return new BigDecimal(p.asText().strip());
                } catch (NumberFormatException e) {
                    log.debug("Unparseable {} '{}'", field, p.asText());
                }
            }
        }
        return null;
    }

    private static int firstInt(JsonNode node, String... fields) {
        for (String f : fields) {
            JsonNode v = node.get(f);
            if (v != null && !v.isNull()) return v.asInt(0);
        }
        return 0;
    }

    private static String category(JsonNode c) {
        if (c == null || c.isNull()) return null;
        if (c.isObject()) return text(c.get("name"));
        return text(c);
    }

    private static List<String> tags(JsonNode node) {
        List<String> out = new ArrayList<>();
        addAll(out, node.get("tags"));
        addAll(out, node.get("colors"));
        addAll(out, node.get("material"));
        return out;
    }

    private static void addAll(List<String> out, JsonNode v) {
        if (v == null || v.isNull()) return;
        if (v.isArray()) {
            for (JsonNode e : v) {
                String s = e.isObject() ? text(e.get("name")) : text(e);
                if (s != null && !s.isBlank()) out.add(s);
            }
        } else {
            String s = text(v);
            if (s != null && !s.isBlank()) out.add(s);
        }
    }

    private static String text(JsonNode v) {
        if (v == null || v.isNull() || v.isMissingNode() || v.isContainerNode()) return null;
        return v.asText();
    }
}
