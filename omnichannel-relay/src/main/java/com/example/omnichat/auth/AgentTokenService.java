package com.example.omnichat.auth;

import com.example.omnichat.config.OmnichatSecurityProperties;
import com.example.omnichat.service.exception.ServiceException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import javax.crypto.SecretKey;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * HS256 agent tokens shared with the dashboard. Claims: {@code sub} agent id, {@code company_id},
 * {@code name} and optional {@code picture}.
 */
@Service
public class AgentTokenService {

    static final String COMPANY_CLAIM = "company_id";
    static final String NAME_CLAIM = "name";
    static final String PICTURE_CLAIM = "picture";

    private static final String BEARER_PREFIX = "Bearer ";

    private final SecretKey key;
    private final OmnichatSecurityProperties properties;
    private final Clock clock;

    public AgentTokenService(OmnichatSecurityProperties properties, Clock clock) {
        String secret = properties.getJwt().getSecret();
        if (!StringUtils.hasText(secret)) {
            throw new IllegalStateException("omnichat.security.jwt.secret must be configured");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.properties = properties;
        this.clock = clock;
    }

    public String issue(AgentPrincipal agent) {
        Instant now = clock.instant();
        return Jwts.builder()
                .setSubject(agent.agentId())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(properties.getJwt().getTtl())))
                .claim(COMPANY_CLAIM, agent.companyId())
                .claim(NAME_CLAIM, agent.name())
                .claim(PICTURE_CLAIM, agent.photoUrl())
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    public AgentPrincipal authenticate(String token) {
        if (!StringUtils.hasText(token)) {
            throw unauthorized("Missing agent token");
        }
        Claims claims;
        try {
            claims = Jwts.parserBuilder()
                    .setSigningKey(key)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
        } catch (JwtException | IllegalArgumentException ex) {
            throw unauthorized("Invalid agent token");
        }
        String companyId = claims.get(COMPANY_CLAIM, String.class);
        if (!StringUtils.hasText(claims.getSubject()) || !StringUtils.hasText(companyId)) {
            throw unauthorized("Agent token lacks subject or company");
        }
        return new AgentPrincipal(
                claims.getSubject(),
                companyId,
                claims.get(NAME_CLAIM, String.class),
                claims.get(PICTURE_CLAIM, String.class));
    }

    public AgentPrincipal authenticateHeader(String authorization) {
        return authenticate(extractBearerToken(authorization).orElse(null));
    }

    public static Optional<String> extractBearerToken(String authorization) {
        if (!StringUtils.hasText(authorization) || !authorization.startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    private static ServiceException unauthorized(String message) {
        return new ServiceException(HttpStatus.UNAUTHORIZED, message, "unauthorized");
    }
}
