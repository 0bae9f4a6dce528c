package com.pizzeria.catalog.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * TokenResponse - token pair returned by a successful login.
 *
 * Example Response:
 * <pre>
 * {
 *   "access_token": "eyJhbGciOiJIUzI1NiJ9...",
 *   "refresh_token": "eyJhbGciOiJIUzI1NiJ9..."
 * }
 * </pre>
 *
 * Client Usage:
 * 1. Send the access token as {@code Authorization: Bearer <access_token>}
 *    on every authenticated call
 * 2. Keep the refresh token; it is never accepted in place of an access token
 *
 * @see com.pizzeria.catalog.controller.AuthController#login
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenResponse {

    /**
     * Short-lived token (30 minutes by default) proving recent authentication.
     */
    private String accessToken;

    /**
     * Longer-lived token (7 days by default) signed with a separate key.
     */
    private String refreshToken;
}
