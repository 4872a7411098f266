package com.github.dimitryivaniuta.storefront.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.storefront.catalog.CatalogClient;
import com.github.dimitryivaniuta.storefront.gateway.CatalogGateway;
import com.github.dimitryivaniuta.storefront.gateway.CatalogGatewayProperties;
import com.github.dimitryivaniuta.storefront.gateway.Sleeper;
import com.github.dimitryivaniuta.storefront.gateway.metrics.CatalogGatewayMetrics;
import com.github.dimitryivaniuta.storefront.gateway.transport.CatalogTransport;
import com.github.dimitryivaniuta.storefront.gateway.transport.RestCatalogTransport;
import com.github.dimitryivaniuta.storefront.search.FuzzyRanker;
import com.github.dimitryivaniuta.storefront.search.QueryNormalizer;
import com.github.dimitryivaniuta.storefront.search.SearchOrchestrator;
import com.github.dimitryivaniuta.storefront.search.lexicon.Lexicon;
import com.github.dimitryivaniuta.storefront.search.lexicon.LexiconLoader;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * Wires one gateway per application context. Components take their collaborators through
 * constructors, so tests build them directly without Spring.
 */
@Configuration
@EnableConfigurationProperties(CatalogGatewayProperties.class)
public class CatalogGatewayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    /**
     * JDK HttpClient underneath: its exchanges stop when the calling thread is interrupted.
     */
    @Bean
    public RestTemplate catalogRestTemplate(RestTemplateBuilder builder, CatalogGatewayProperties props) {
        CatalogGatewayProperties.Upstream upstream = props.getUpstream();
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(upstream.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(upstream.getReadTimeout());
        return builder.requestFactory(() -> factory).build();
    }

    @Bean
    public CatalogTransport catalogTransport(RestTemplate catalogRestTemplate, CatalogGatewayProperties props) {
        CatalogGatewayProperties.Upstream upstream = props.getUpstream();
        return new RestCatalogTransport(catalogRestTemplate, upstream.getBaseUrl(), upstream.getLanguage(), upstream.getUserAgent());
    }

    @Bean(destroyMethod = "shutdown")
    public CatalogGateway catalogGateway(CatalogGatewayProperties props,
                                         CatalogTransport catalogTransport,
                                         CatalogGatewayMetrics metrics,
                                         Clock clock,
                                         Sleeper sleeper) {
        return CatalogGateway.create(props, catalogTransport, metrics, clock, sleeper);
    }

    @Bean
    public Lexicon lexicon(ObjectMapper objectMapper, ResourceLoader resourceLoader, CatalogGatewayProperties props) {
        return new LexiconLoader(objectMapper, resourceLoader).load(props.getLexicon().getLocation());
    }

    @Bean
    public QueryNormalizer queryNormalizer(Lexicon lexicon, CatalogGatewayProperties props) {
        CatalogGatewayProperties.Lexicon cfg = props.getLexicon();
        return new QueryNormalizer(lexicon, cfg.getMemoSize(), cfg.getMinCorrectionLength());
    }

    @Bean
    public FuzzyRanker fuzzyRanker(CatalogGatewayProperties props) {
        return new FuzzyRanker(props.getSearch().getMinSimilarity());
    }

    @Bean
    public SearchOrchestrator searchOrchestrator(QueryNormalizer queryNormalizer,
                                                 CatalogGateway catalogGateway,
                                                 FuzzyRanker fuzzyRanker,
                                                 CatalogGatewayProperties props) {
        CatalogGatewayProperties.Search s = props.getSearch();
        return new SearchOrchestrator(queryNormalizer, catalogGateway, fuzzyRanker,
                s.isFallbackEnabled(), s.getCandidatePoolSize(), s.getPriceTolerance());
    }

    @Bean
    public CatalogClient catalogClient(CatalogGateway catalogGateway) {
        return new CatalogClient(catalogGateway);
    }
}
