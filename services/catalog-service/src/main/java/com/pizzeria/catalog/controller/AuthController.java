package com.pizzeria.catalog.controller;

import com.pizzeria.catalog.dto.LoginRequest;
import com.pizzeria.catalog.dto.SignupRequest;
import com.pizzeria.catalog.dto.TokenResponse;
import com.pizzeria.catalog.dto.UserResponse;
import com.pizzeria.catalog.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * AuthController - REST API endpoints for signup and login.
 *
 * Endpoints:
 * - POST /signup - Create a user account (JSON body)
 * - POST /login  - Exchange username/password (form-encoded) for tokens
 *
 * Both endpoints are public. Every other mutating endpoint requires the
 * access token returned by /login in the Authorization header.
 *
 * Error Handling:
 * - 400 Bad Request: username/email already registered, or wrong credentials
 * - 422 Unprocessable Entity: missing or malformed fields
 *
 * @see AuthService for business logic
 */
@RestController
@RequiredArgsConstructor
public class AuthController {

    /** Service layer for authentication business logic */
    private final AuthService authService;

    /**
     * Create a new user account.
     *
     * @param request username, email and password
     * @return 201 with the created user (no password in the output)
     */
    @PostMapping(value = "/signup", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<UserResponse> signup(@Valid @RequestBody SignupRequest request) {
        UserResponse user = authService.signup(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(user);
    }

    /**
     * Authenticate a user and issue an access/refresh token pair.
     *
     * The credentials come as form fields, like an OAuth2 password grant.
     * Unknown user and wrong password answer the same 400
     * "Incorrect username or password".
     *
     * @param request form-bound username and password
     * @return access and refresh tokens
     */
    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<TokenResponse> login(@Valid @ModelAttribute LoginRequest request) {
        TokenResponse response = authService.login(request.getUsername(), request.getPassword());
        return ResponseEntity.ok(response);
    }
}
