package com.basekit.authservice.SecurityConfig;

import com.basekit.authservice.entity.User;
import com.basekit.authservice.exception.AuthExceptions;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and validates the stateless HS256 session token.
 * Claims: {@code sub} (user id), {@code email}, {@code phone}, {@code role}, {@code jti}.
 */
@Slf4j
@Component
public class JwtTokenProviderConfig {

    public static final String CLAIM_EMAIL = "email";
    public static final String CLAIM_PHONE = "phone";
    public static final String CLAIM_ROLE = "role";

    private final Clock clock;

    @Value("${token.key.secret}")
    private String secret; // Base64-encoded HMAC secret

    @Value("${token.key.jwtExpiration:1800000}")
    private long jwtExpiration; // milliseconds

    // enforced only when configured
    @Value("${token.key.issuer:}")
    private String issuerOpt;

    @Value("${token.key.audience:}")
    private String audienceOpt;

    private SecretKey signingKey;
    private JwtParser jwtParser;

    public JwtTokenProviderConfig(Clock clock) {
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret must be provided (base64).");
        }
        final byte[] keyBytes;
        try {
            keyBytes = Decoders.BASE64.decode(secret.trim());
        } catch (RuntimeException e) {
            throw new IllegalStateException("JWT secret must be valid Base64.", e);
        }
        // HS256 requires >= 256-bit (32 bytes) key
        if (keyBytes.length < 32) {
            throw new IllegalStateException("JWT secret too short for HS256. Provide >= 256-bit Base64 key.");
        }
        if (jwtExpiration <= 0) {
            throw new IllegalStateException("token.key.jwtExpiration must be positive.");
        }

        signingKey = Keys.hmacShaKeyFor(keyBytes);

        var parserBuilder = Jwts.parser()
                .verifyWith(signingKey)
                .clock(() -> Date.from(clock.instant()))
                .clockSkewSeconds(30);

        if (StringUtils.hasText(issuerOpt)) {
            parserBuilder = parserBuilder.requireIssuer(issuerOpt);
        }
        if (StringUtils.hasText(audienceOpt)) {
            parserBuilder = parserBuilder.requireAudience(audienceOpt);
        }
        jwtParser = parserBuilder.build();
    }

    /** Signs a token for {@code user} valid for the configured lifetime from now. */
    public String generateToken(User user) {
        if (user == null || user.getId() == null) {
            throw new IllegalArgumentException("Cannot issue a token for an unsaved user.");
        }
        Instant now = clock.instant();
        Date issuedAt = Date.from(now);
        Date expiration = Date.from(now.plusMillis(jwtExpiration));

        JwtBuilder builder = Jwts.builder()
                .id(UUID.randomUUID().toString().replace("-", ""))
                .subject(user.getId().toString())
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_PHONE, user.getPhone())
                .claim(CLAIM_ROLE, user.getRole().name())
                .issuedAt(issuedAt)
                .notBefore(issuedAt)
                .expiration(expiration);

        if (StringUtils.hasText(issuerOpt)) {
            builder = builder.issuer(issuerOpt);
        }
        if (StringUtils.hasText(audienceOpt)) {
            builder = builder.audience().add(audienceOpt).and();
        }
        return builder.signWith(signingKey, Jwts.SIG.HS256).compact();
    }

    /**
     * Verifies signature, expiry and the configured issuer/audience.
     *
     * @throws AuthExceptions.TokenExpired past {@code exp}
     * @throws AuthExceptions.TokenInvalid on any other failure
     */
    public Claims validate(String token) {
        if (!StringUtils.hasText(token)) {
            throw new AuthExceptions.TokenInvalid("Session token is missing");
        }
        try {
            Claims claims = jwtParser.parseSignedClaims(token).getPayload();
            if (!StringUtils.hasText(claims.getSubject())) {
                throw new AuthExceptions.TokenInvalid("Session token has no subject");
            }
            return claims;
        } catch (ExpiredJwtException e) {
            log.debug("Expired JWT sub={}", e.getClaims().getSubject());
            throw new AuthExceptions.TokenExpired();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Invalid JWT: {}", e.getMessage());
            throw new AuthExceptions.TokenInvalid("Session token is invalid");
        }
    }

    public long getTokenValiditySeconds() {
        return jwtExpiration / 1000;
    }
}
