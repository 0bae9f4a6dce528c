package com.pizzeria.catalog.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * JwtUtil - Utility class for JSON Web Token (JWT) operations.
 *
 * Two token purposes are supported, each with its own key and lifetime:
 * - ACCESS: presented on every authenticated call (30 minutes by default)
 * - REFRESH: handed out at login for later re-issuing (7 days by default)
 *
 * JWT Structure (RFC 7519):
 * - Header: Algorithm (HS256) and token type (JWT)
 * - Payload: Subject (user email), "type" claim, issued at, expiration
 * - Signature: HMAC-SHA256 using the key of the token's purpose
 *
 * A token only parses under the purpose it was issued for: the signature is
 * checked with that purpose's key and the "type" claim must match. A refresh
 * token is therefore never accepted where an access token is expected.
 *
 * Security Configuration (from application.yml):
 * - jwt.access-secret / jwt.refresh-secret: HMAC keys (min 256 bits, must differ)
 * - jwt.access-expiration / jwt.refresh-expiration: lifetimes in milliseconds
 *
 * @see CredentialService for token issuance at login
 * @see IdentityService for access token resolution
 */
@Component
public class JwtUtil {

    static final String TYPE_CLAIM = "type";

    /**
     * What a token may be used for.
     */
    public enum TokenPurpose {
        ACCESS("access"),
        REFRESH("refresh");

        private final String claimValue;

        TokenPurpose(String claimValue) {
            this.claimValue = claimValue;
        }

        public String claimValue() {
            return claimValue;
        }
    }

    private final Key accessKey;
    private final Key refreshKey;
    private final long accessExpiration;
    private final long refreshExpiration;

    /**
     * @param accessSecret      HMAC secret for access tokens
     * @param refreshSecret     HMAC secret for refresh tokens, different from the access secret
     * @param accessExpiration  access token lifetime in milliseconds
     * @param refreshExpiration refresh token lifetime in milliseconds
     * @throws IllegalStateException if both purposes share one secret
     */
    public JwtUtil(
            @Value("${jwt.access-secret}") String accessSecret,
            @Value("${jwt.refresh-secret}") String refreshSecret,
            @Value("${jwt.access-expiration}") long accessExpiration,
            @Value("${jwt.refresh-expiration}") long refreshExpiration) {
        if (accessSecret.equals(refreshSecret)) {
            throw new IllegalStateException("jwt.access-secret and jwt.refresh-secret must differ");
        }
        this.accessKey = Keys.hmacShaKeyFor(accessSecret.getBytes(StandardCharsets.UTF_8));
        this.refreshKey = Keys.hmacShaKeyFor(refreshSecret.getBytes(StandardCharsets.UTF_8));
        this.accessExpiration = accessExpiration;
        this.refreshExpiration = refreshExpiration;
    }

    /**
     * Generate a signed access token for the given subject.
     *
     * @param subject user identity carried in the "sub" claim (the user's email)
     * @return compact JWT string (header.payload.signature)
     */
    public String generateAccessToken(String subject) {
        return createToken(subject, TokenPurpose.ACCESS);
    }

    /**
     * Generate a signed refresh token for the given subject.
     *
     * @param subject user identity carried in the "sub" claim (the user's email)
     * @return compact JWT string (header.payload.signature)
     */
    public String generateRefreshToken(String subject) {
        return createToken(subject, TokenPurpose.REFRESH);
    }

    /**
     * Extract the subject of a token issued for the given purpose.
     *
     * @param token   the JWT string (without "Bearer " prefix)
     * @param purpose the purpose the token must have been issued for
     * @return the "sub" claim
     * @throws io.jsonwebtoken.ExpiredJwtException if the token is expired
     * @throws io.jsonwebtoken.security.SignatureException if it was not signed with the purpose's key
     * @throws io.jsonwebtoken.IncorrectClaimException if its "type" claim names another purpose
     * @throws JwtException for any other malformed token
     */
    public String extractSubject(String token, TokenPurpose purpose) {
        return extractClaim(token, purpose, Claims::getSubject);
    }

    /**
     * Extract the expiration date of a token issued for the given purpose.
     */
    public Date extractExpiration(String token, TokenPurpose purpose) {
        return extractClaim(token, purpose, Claims::getExpiration);
    }

    public <T> T extractClaim(String token, TokenPurpose purpose, Function<Claims, T> claimsResolver) {
        final Claims claims = extractAllClaims(token, purpose);
        return claimsResolver.apply(claims);
    }

    /**
     * Parse and verify a token: signature with the purpose's key, expiration,
     * and the "type" claim.
     */
    private Claims extractAllClaims(String token, TokenPurpose purpose) {
        return Jwts.parserBuilder()
                .setSigningKey(signingKey(purpose))
                .require(TYPE_CLAIM, purpose.claimValue())
                .build()
                .parseClaimsJws(token)
                .getBody();
    }

    private String createToken(String subject, TokenPurpose purpose) {
        Map<String, Object> claims = new HashMap<>();
        claims.put(TYPE_CLAIM, purpose.claimValue());
        long now = System.currentTimeMillis();
        return Jwts.builder()
                .setClaims(claims)
                .setSubject(subject)
                .setIssuedAt(new Date(now))
                .setExpiration(new Date(now + lifetime(purpose)))
                .signWith(signingKey(purpose), SignatureAlgorithm.HS256)
                .compact();
    }

    private Key signingKey(TokenPurpose purpose) {
        return purpose == TokenPurpose.ACCESS ? accessKey : refreshKey;
    }

    private long lifetime(TokenPurpose purpose) {
        return purpose == TokenPurpose.ACCESS ? accessExpiration : refreshExpiration;
    }
}
