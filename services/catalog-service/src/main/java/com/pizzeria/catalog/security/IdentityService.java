package com.pizzeria.catalog.security;

import com.pizzeria.catalog.entity.User;
import com.pizzeria.catalog.exception.UnauthorizedException;
import com.pizzeria.catalog.repository.UserRepository;
import com.pizzeria.catalog.security.JwtUtil.TokenPurpose;
import io.jsonwebtoken.JwtException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * IdentityService - resolves the calling user from a presented access token.
 *
 * Resolution steps:
 * 1. Verify signature, expiry and purpose of the token (access only)
 * 2. Read the subject (the user's email)
 * 3. Load the user; a subject that no longer matches a user is rejected
 *
 * Every failure is reported as {@link UnauthorizedException} with the same
 * detail, so callers cannot tell an expired token from a forged one.
 *
 * @see JwtAuthenticationFilter for where this runs in the request pipeline
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdentityService {

    private final JwtUtil jwtUtil;

    private final UserRepository userRepository;

    /**
     * @param presentedToken the raw access token, without the "Bearer " prefix
     * @return the user the token was issued to
     * @throws UnauthorizedException if the token is missing, invalid, expired,
     *                               not an access token, or its subject is unknown
     */
    @Transactional(readOnly = true)
    public User resolveCurrentUser(String presentedToken) {
        if (presentedToken == null || presentedToken.isBlank()) {
            throw new UnauthorizedException();
        }

        String subject;
        try {
            subject = jwtUtil.extractSubject(presentedToken, TokenPurpose.ACCESS);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected access token: {}", e.getMessage());
            throw new UnauthorizedException(UnauthorizedException.MESSAGE, e);
        }

        return userRepository.findByEmail(subject)
                .orElseThrow(() -> {
                    log.debug("Access token subject has no matching user");
                    return new UnauthorizedException();
                });
    }
}
