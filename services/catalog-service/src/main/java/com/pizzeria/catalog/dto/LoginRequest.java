package com.pizzeria.catalog.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * LoginRequest - form fields of a username/password login.
 *
 * Bound from an {@code application/x-www-form-urlencoded} body, the same
 * shape OAuth2 password-grant clients send:
 * <pre>
 * POST /login
 * Content-Type: application/x-www-form-urlencoded
 *
 * username=margherita_fan&amp;password=s3cret
 * </pre>
 *
 * Security Note:
 * Never log or persist the password field.
 *
 * @see com.pizzeria.catalog.controller.AuthController#login
 */
@Data
public class LoginRequest {

    @NotBlank
    private String username;

    @NotBlank
    private String password;
}
