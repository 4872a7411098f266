package com.github.dimitryivaniuta.storefront.search;

import java.util.Locale;
import java.util.Optional;

public enum Season {
    SUMMER,
    WINTER,
    SPRING,
    AUTUMN;

    public static Optional<Season> fromTerm(String term) {
        for (Season s : values()) {
            if (s.name().toLowerCase(Locale.ROOT).equals(term)) return Optional.of(s);
        }
        return Optional.empty();
    }
}
