package com.github.dimitryivaniuta.storefront.search;

import java.util.Locale;
import java.util.Optional;

public enum Occasion {
    WEDDING,
    WORK,
    PARTY,
    CASUAL,
    SPORTS,
    FORMAL,
    BEACH,
    HOME,
    SCHOOL;

    public static Optional<Occasion> fromTerm(String term) {
        for (Occasion o : values()) {
            if (o.name().toLowerCase(Locale.ROOT).equals(term)) return Optional.of(o);
        }
        return Optional.empty();
    }
}
