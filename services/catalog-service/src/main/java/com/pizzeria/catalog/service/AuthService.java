package com.pizzeria.catalog.service;

import com.pizzeria.catalog.dto.SignupRequest;
import com.pizzeria.catalog.dto.TokenResponse;
import com.pizzeria.catalog.dto.UserResponse;
import com.pizzeria.catalog.entity.User;
import com.pizzeria.catalog.exception.ConflictException;
import com.pizzeria.catalog.exception.InvalidCredentialsException;
import com.pizzeria.catalog.security.CredentialService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * AuthService - signup and login workflows.
 *
 * Key Responsibilities:
 * - Registering new users with a BCrypt-hashed password
 * - Checking submitted credentials at login
 * - Issuing the access/refresh token pair for an authenticated user
 *
 * Security Considerations:
 * - Plaintext passwords are hashed once at signup and never stored or logged
 * - Login failures never reveal whether the username exists: unknown user
 *   and wrong password raise the same {@link InvalidCredentialsException}
 * - Tokens carry the user's email as subject; access tokens are short-lived
 *
 * @see CredentialService for hashing and token issuance
 * @see UserService for user persistence
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    /** Store access for users */
    private final UserService userService;

    /** Password hashing and token issuance */
    private final CredentialService credentialService;

    /**
     * Register a new user.
     *
     * The username and email pre-checks give precise conflict messages; the
     * unique constraints behind {@link UserService#create} still decide when
     * two signups race for the same name.
     *
     * @param request signup payload
     * @return the created user, without password material
     * @throws ConflictException if the username or email is already registered
     */
    public UserResponse signup(SignupRequest request) {
        log.info("Signup attempt for username: {}", request.getUsername());

        if (userService.usernameTaken(request.getUsername())) {
            log.warn("Signup rejected - username already exists: {}", request.getUsername());
            throw new ConflictException(UserService.USERNAME_TAKEN);
        }
        if (userService.emailTaken(request.getEmail())) {
            log.warn("Signup rejected - email already registered for username: {}", request.getUsername());
            throw new ConflictException(UserService.EMAIL_TAKEN);
        }

        User user = userService.create(
                request.getUsername(),
                request.getEmail(),
                credentialService.hashPassword(request.getPassword()));
        return UserResponse.from(user);
    }

    /**
     * Authenticate a user and issue a token pair.
     *
     * @param username submitted login name
     * @param password submitted plaintext password
     * @return access and refresh tokens bound to the user's email
     * @throws InvalidCredentialsException if the user is unknown or the password is wrong
     */
    public TokenResponse login(String username, String password) {
        Optional<User> found = userService.findByUsername(username);
        // verified even for an unknown user, so both failures cost one hash comparison
        boolean passwordMatches = credentialService.verifyPassword(
                password, found.map(User::getPasswordHash).orElse(null));
        if (found.isEmpty()) {
            log.warn("Login failed - unknown username: {}", username);
            throw new InvalidCredentialsException();
        }

        User user = found.get();
        if (!passwordMatches) {
            log.warn("Login failed - wrong password for user: {}", user.getId());
            throw new InvalidCredentialsException();
        }

        log.info("User authenticated successfully: {}", user.getId());
        return TokenResponse.builder()
                .accessToken(credentialService.issueAccessToken(user.getEmail()))
                .refreshToken(credentialService.issueRefreshToken(user.getEmail()))
                .build();
    }
}
