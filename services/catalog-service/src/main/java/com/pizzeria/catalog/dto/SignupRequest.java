package com.pizzeria.catalog.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * SignupRequest - JSON payload of {@code POST /signup}.
 *
 * Example:
 * <pre>
 * {
 *   "username": "margherita_fan",
 *   "email": "fan@example.com",
 *   "password": "s3cret"
 * }
 * </pre>
 *
 * The permission level cannot be chosen here; new accounts are always ordinary.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignupRequest {

    @NotBlank
    @Size(max = 60)
    private String username;

    @NotBlank
    @Email
    private String email;

    @NotBlank
    private String password;
}
