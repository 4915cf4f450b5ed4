package com.example.omnichat.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "omnichat.security")
public class OmnichatSecurityProperties {

    /**
     * Toggle to enable or disable the rate limiter on public webhook and widget endpoints.
     */
    private boolean rateLimitingEnabled = true;

    /**
     * Dashboard origins allowed to call the agent API. Widget endpoints accept any origin.
     */
    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:4200"));

    private final RateLimit rateLimit = new RateLimit();

    private final Jwt jwt = new Jwt();

    public boolean isRateLimitingEnabled() {
        return rateLimitingEnabled;
    }

    public void setRateLimitingEnabled(boolean rateLimitingEnabled) {
        this.rateLimitingEnabled = rateLimitingEnabled;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public Jwt getJwt() {
        return jwt;
    }

    @Validated
    public static class RateLimit {

        /**
         * Maximum number of requests allowed per refill period.
         */
        private long capacity = 120;

        /**
         * Number of tokens replenished every {@link #refillPeriod}.
         */
        private long refillTokens = 120;

        private Duration refillPeriod = Duration.ofSeconds(60);

        /**
         * Buckets untouched for this long are dropped; the client starts again with a full bucket.
         */
        private Duration idleEviction = Duration.ofMinutes(10);

        /**
         * Upper bound on tracked clients.
         */
        private long maxClients = 100_000;

        public long getCapacity() {
            return capacity;
        }

        public void setCapacity(long capacity) {
            this.capacity = capacity;
        }

        public long getRefillTokens() {
            return refillTokens;
        }

        public void setRefillTokens(long refillTokens) {
            this.refillTokens = refillTokens;
        }

        public Duration getRefillPeriod() {
            return refillPeriod;
        }

        public void setRefillPeriod(Duration refillPeriod) {
            this.refillPeriod = refillPeriod;
        }

        public Duration getIdleEviction() {
            return idleEviction;
        }

        public void setIdleEviction(Duration idleEviction) {
            this.idleEviction = idleEviction;
        }

        public long getMaxClients() {
            return maxClients;
        }

        public void setMaxClients(long maxClients) {
            this.maxClients = maxClients;
        }
    }

    public static class Jwt {

        /**
         * HS256 signing secret shared with the dashboard login service. At least 32 bytes.
         */
        private String secret;

        /**
         * Lifetime of tokens issued by this service.
         */
        private Duration ttl = Duration.ofHours(12);

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }
}
