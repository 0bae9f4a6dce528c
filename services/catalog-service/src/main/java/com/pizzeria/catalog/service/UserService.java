package com.pizzeria.catalog.service;

import com.pizzeria.catalog.entity.PermissionLevel;
import com.pizzeria.catalog.entity.User;
import com.pizzeria.catalog.exception.ConflictException;
import com.pizzeria.catalog.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * UserService - store access for user accounts.
 *
 * {@link #create} does not run inside an enclosing transaction: the insert is
 * flushed in its own repository transaction so a unique-constraint violation
 * surfaces here and can be reported as a conflict.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    static final String USERNAME_TAKEN = "The username already exists";
    static final String EMAIL_TAKEN = "The email is already registered";

    private final UserRepository userRepository;

    public Optional<User> findByUsername(String username) {
        return userRepository.findByUsername(username);
    }

    public boolean usernameTaken(String username) {
        return userRepository.existsByUsername(username);
    }

    public boolean emailTaken(String email) {
        return userRepository.existsByEmail(email);
    }

    /**
     * Insert a new ordinary user.
     *
     * @param username     login name
     * @param email        address, subject of the user's tokens
     * @param passwordHash already hashed password
     * @return the stored user with its generated id
     * @throws ConflictException if the username or email is taken
     */
    public User create(String username, String email, String passwordHash) {
        User user = User.builder()
                .username(username)
                .email(email)
                .passwordHash(passwordHash)
                .permissionLevel(PermissionLevel.ORDINARY)
                .build();
        try {
            User saved = userRepository.saveAndFlush(user);
            log.info("Created user: id={}, username={}", saved.getId(), saved.getUsername());
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.warn("Signup rejected by unique constraint: username={}", username);
            String detail = userRepository.existsByUsername(username) ? USERNAME_TAKEN : EMAIL_TAKEN;
            throw new ConflictException(detail, e);
        }
    }
}
