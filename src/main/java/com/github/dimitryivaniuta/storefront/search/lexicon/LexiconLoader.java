package com.github.dimitryivaniuta.storefront.search.lexicon;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Reads the lexicon JSON ({@link LexiconDocument}) from a Spring resource location such as
 * {@code classpath:lexicon/catalog-lexicon.json} or {@code file:/etc/storefront/lexicon.json}.
 */
@Slf4j
@RequiredArgsConstructor
public class LexiconLoader {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public Lexicon load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Lexicon resource not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            Lexicon lexicon = read(in);
            log.info("Loaded lexicon from {}: {} substitutions, {} category terms",
                    location, lexicon.substitutionCount(), lexicon.termCount());
            return lexicon;
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read lexicon from " + location, e);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid lexicon at " + location + ": " + e.getMessage(), e);
        }
    }

    public Lexicon read(InputStream in) throws IOException {
        LexiconDocument doc = objectMapper.readValue(in, LexiconDocument.class);
        if (doc == null) {
            throw new IllegalArgumentException("empty lexicon document");
        }
        return new Lexicon(
                doc.substitutions() == null ? Map.of() : doc.substitutions(),
                doc.categories() == null ? Map.of() : doc.categories(),
                doc.fillers() == null ? List.of() : doc.fillers(),
                doc.negations() == null ? List.of() : doc.negations(),
                doc.negationToken() == null ? "not" : doc.negationToken(),
                doc.priceBands() == null ? Map.of() : doc.priceBands());
    }
}
