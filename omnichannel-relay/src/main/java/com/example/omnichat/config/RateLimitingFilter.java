package com.example.omnichat.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Per-client token buckets for the unauthenticated surface: platform webhooks and the widget API.
 * Agent endpoints are authenticated and not limited here. Buckets of idle clients expire and the
 * number of tracked clients is capped.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RateLimitingFilter extends OncePerRequestFilter {

    static final List<String> LIMITED_PREFIXES = List.of("/api/webhooks/", "/api/widget/");

    private final OmnichatSecurityProperties securityProperties;
    private final Cache<String, Bucket> buckets;

    @Autowired
    public RateLimitingFilter(OmnichatSecurityProperties securityProperties) {
        this(securityProperties, Ticker.systemTicker());
    }

    RateLimitingFilter(OmnichatSecurityProperties securityProperties, Ticker ticker) {
        this.securityProperties = securityProperties;
        OmnichatSecurityProperties.RateLimit limitConfig = securityProperties.getRateLimit();
        this.buckets = Caffeine.newBuilder()
                .expireAfterAccess(limitConfig.getIdleEviction())
                .maximumSize(Math.max(limitConfig.getMaxClients(), 1))
                .ticker(ticker)
                .build();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return LIMITED_PREFIXES.stream().noneMatch(path::startsWith);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        if (!securityProperties.isRateLimitingEnabled() || "OPTIONS".equalsIgnoreCase(request.getMethod())) {
            filterChain.doFilter(request, response);
            return;
        }

        String key = resolveKey(request);
        Bucket bucket = buckets.get(key, ignored -> newBucket());
        if (bucket.tryConsume(1)) {
            filterChain.doFilter(request, response);
            return;
        }

        log.debug("Rate limit exceeded for {}", key);
        writeRateLimitResponse(response);
    }

    private Bucket newBucket() {
        OmnichatSecurityProperties.RateLimit limitConfig = securityProperties.getRateLimit();
        Duration refillPeriod = limitConfig.getRefillPeriod();
        if (refillPeriod.isZero() || refillPeriod.isNegative()) {
            refillPeriod = Duration.ofSeconds(60);
        }

        long capacity = Math.max(limitConfig.getCapacity(), 1);
        long refillTokens = Math.max(limitConfig.getRefillTokens(), 1);

        return Bucket.builder()
                .addLimit(Bandwidth.classic(capacity, Refill.greedy(refillTokens, refillPeriod)))
                .build();
    }

    private void writeRateLimitResponse(HttpServletResponse response) throws IOException {
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        long retryAfterSeconds = Math.max(securityProperties.getRateLimit().getRefillPeriod().toSeconds(), 1);
        response.setHeader("Retry-After", String.valueOf(retryAfterSeconds));
        response.getWriter().write("{\"error\":\"Request rate exceeded\",\"code\":\"too_many_requests\"}");
    }

    /**
     * Client address plus the endpoint family, so one noisy widget does not starve webhook delivery
     * from the same address.
     */
    private String resolveKey(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        String clientIp = forwardedFor != null && !forwardedFor.isBlank()
                ? forwardedFor.split(",")[0].trim()
                : request.getRemoteAddr();
        String path = request.getRequestURI();
        String family = LIMITED_PREFIXES.stream().filter(path::startsWith).findFirst().orElse(path);
        return clientIp + ":" + family;
    }
}
