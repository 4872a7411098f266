package com.github.dimitryivaniuta.storefront.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.storefront.search.lexicon.Lexicon;
import com.github.dimitryivaniuta.storefront.search.lexicon.LexiconLoader;
import org.springframework.core.io.DefaultResourceLoader;

/** The bundled lexicon, loaded once per JVM. */
public final class TestLexicons {

    public static final String LOCATION = "classpath:lexicon/catalog-lexicon.json";

    private static Lexicon catalog;

    private TestLexicons() {}

    public static synchronized Lexicon catalog() {
        if (catalog == null) {
            catalog = new LexiconLoader(new ObjectMapper(), new DefaultResourceLoader()).load(LOCATION);
        }
        return catalog;
    }
}
