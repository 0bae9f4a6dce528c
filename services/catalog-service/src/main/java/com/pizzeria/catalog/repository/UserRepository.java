package com.pizzeria.catalog.repository;

import com.pizzeria.catalog.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * UserRepository - Data Access Layer for User entities.
 *
 * Custom Methods:
 * - findByUsername: login and signup lookups
 * - findByEmail: resolving the subject of an access token
 * - existsByUsername / existsByEmail: signup pre-checks
 *
 * The pre-checks give friendly error messages; the unique constraints on
 * the table remain the authority when two signups race.
 *
 * @see User for entity definition
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Find a user by login name.
     *
     * Query: SELECT * FROM users WHERE username = :username
     *
     * @param username the login name (case-sensitive)
     * @return Optional containing the User if found, empty Optional if not
     */
    Optional<User> findByUsername(String username);

    /**
     * Find a user by email address, the subject carried in issued tokens.
     *
     * @param email the email address (case-sensitive)
     * @return Optional containing the User if found, empty Optional if not
     */
    Optional<User> findByEmail(String email);

    boolean existsByUsername(String username);

    boolean existsByEmail(String email);
}
