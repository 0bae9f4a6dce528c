package com.pizzeria.catalog.security;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * CredentialService - password hashing and token issuance.
 *
 * Passwords are hashed once at signup with BCrypt (salted, adaptive) and
 * verified with {@link PasswordEncoder#matches}, which compares in constant
 * time. Tokens are issued through {@link JwtUtil} with distinct purposes so
 * access and refresh tokens are not interchangeable.
 *
 * A check without a stored hash (unknown user) still runs one BCrypt
 * comparison against a throwaway hash, so its timing matches a wrong password.
 *
 * This service has no side effects beyond producing strings.
 */
@Service
public class CredentialService {

    private final PasswordEncoder passwordEncoder;

    private final JwtUtil jwtUtil;

    /** Hash of a random value; nothing ever matches it. */
    private final String unmatchableHash;

    public CredentialService(PasswordEncoder passwordEncoder, JwtUtil jwtUtil) {
        this.passwordEncoder = passwordEncoder;
        this.jwtUtil = jwtUtil;
        this.unmatchableHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    public String hashPassword(String plaintext) {
        return passwordEncoder.encode(plaintext);
    }

    /**
     * @return true if the plaintext matches the stored hash; false on mismatch
     *         or when there is no stored hash
     */
    public boolean verifyPassword(String plaintext, String storedHash) {
        if (plaintext == null || storedHash == null) {
            passwordEncoder.matches(plaintext == null ? "" : plaintext, unmatchableHash);
            return false;
        }
        return passwordEncoder.matches(plaintext, storedHash);
    }

    public String issueAccessToken(String subject) {
        return jwtUtil.generateAccessToken(subject);
    }

    public String issueRefreshToken(String subject) {
        return jwtUtil.generateRefreshToken(subject);
    }
}
