package com.github.dimitryivaniuta.storefront.gateway;

import com.github.dimitryivaniuta.storefront.gateway.ratelimit.RateLimitMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "storefront.catalog")
public class CatalogGatewayProperties {

    private Upstream upstream = new Upstream();
    private Cache cache = new Cache();
    private RateLimit rateLimit = new RateLimit();
    private Breaker breaker = new Breaker();
    private Retry retry = new Retry();
    private Lexicon lexicon = new Lexicon();
    private Search search = new Search();

    @Getter
    @Setter
    public static class Upstream {
        private String baseUrl = "http://localhost:8081/api/v1";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);
        private String language = "ar";
        private String userAgent = "storefront-catalog-gateway/0.1";
    }

    @Getter
    @Setter
    public static class Cache {
        private int maxSize = 200;
        private Ttl ttl = new Ttl();
    }

    @Getter
    @Setter
    public static class Ttl {
        private Duration shortTerm = Duration.ofSeconds(300);
        private Duration mediumTerm = Duration.ofSeconds(900);
        private Duration longTerm = Duration.ofSeconds(3600);
    }

    @Getter
    @Setter
    public static class RateLimit {
        private int budget = 60;
        private Duration window = Duration.ofSeconds(60);
        private RateLimitMode mode = RateLimitMode.QUEUE;
        // upper bound for QUEUE mode; ignored by REJECT
        private Duration maxWait = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Breaker {
        private int failureThreshold = 5;
        private Duration cooldown = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
    }

    @Getter
    @Setter
    public static class Lexicon {
        private String location = "classpath:lexicon/catalog-lexicon.json";
        private int memoSize = 1_000;
        private int minCorrectionLength = 4;
    }

    @Getter
    @Setter
    public static class Search {
        private boolean fallbackEnabled = true;
        private double minSimilarity = 0.2;
        private int defaultLimit = 3;
        // page size requested from the catalog before local ranking
        private int candidatePoolSize = 20;
        private double priceTolerance = 0.2;
    }
}
