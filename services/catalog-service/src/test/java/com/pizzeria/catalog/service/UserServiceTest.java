package com.pizzeria.catalog.service;

import com.pizzeria.catalog.entity.PermissionLevel;
import com.pizzeria.catalog.entity.User;
import com.pizzeria.catalog.exception.ConflictException;
import com.pizzeria.catalog.repository.UserRepository;
import org.hibernate.engine.jdbc.spi.SqlExceptionHelper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

/**
 * User store against the H2 schema; uniqueness comes from the table constraints.
 */
@SpringBootTest
class UserServiceTest {

    @Autowired UserService userService;
    @Autowired UserRepository userRepository;

    @BeforeEach
    void cleanDatabase() {
        userRepository.deleteAll();
    }

    @Test
    void create_storesOrdinaryUser() {
        User created = userService.create("chef", "chef@example.com", "$2a$10$hash");

        assertNotNull(created.getId());
        assertNotNull(created.getCreatedAt());
        assertEquals(PermissionLevel.ORDINARY, created.getPermissionLevel());
        assertTrue(userService.findByUsername("chef").isPresent());
        assertEquals("chef@example.com", userService.findByUsername("chef").orElseThrow().getEmail());
    }

    @Test
    void create_duplicateUsername_isConflictAndKeepsOneRecord() {
        userService.create("chef", "chef@example.com", "$2a$10$hash");

        ConflictException e = assertThrows(ConflictException.class,
                () -> userService.create("chef", "second@example.com", "$2a$10$hash"));

        assertEquals(UserService.USERNAME_TAKEN, e.getMessage());
        assertEquals(1, userRepository.count());
    }

    @Test
    void create_duplicateEmail_isConflict() {
        userService.create("chef", "chef@example.com", "$2a$10$hash");

        ConflictException e = assertThrows(ConflictException.class,
                () -> userService.create("sous-chef", "chef@example.com", "$2a$10$hash"));

        assertEquals(UserService.EMAIL_TAKEN, e.getMessage());
        assertEquals(1, userRepository.count());
    }

    @Test
    void create_duplicate_isNotLoggedAsJdbcError() {
        userService.create("chef", "chef@example.com", "$2a$10$hash");

        assertThrows(ConflictException.class,
                () -> userService.create("chef", "chef@example.com", "$2a$10$hash"));

        assertFalse(LoggerFactory.getLogger(SqlExceptionHelper.class).isErrorEnabled());
    }
}
