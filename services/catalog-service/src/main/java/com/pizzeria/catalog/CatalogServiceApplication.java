package com.pizzeria.catalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

/**
 * CatalogServiceApplication - Main entry point for the pizza catalog service.
 *
 * Responsibilities:
 * - User signup and login with BCrypt-hashed passwords
 * - Access/refresh JWT issuance and bearer-token authentication
 * - CRUD over pizzas, ingredients and the pizza/ingredient association
 *
 * Architecture Context:
 * - Runs on port 8080 (configured in application.yml)
 * - Connects to PostgreSQL; the schema is managed by Flyway migrations
 * - Stateless: no HTTP session, every call carries its own access token
 *
 * User accounts live in the database, so Spring Boot's generated in-memory
 * user is switched off.
 *
 * @see com.pizzeria.catalog.controller.AuthController for signup and login
 * @see com.pizzeria.catalog.security.SecurityConfig for route protection
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class CatalogServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CatalogServiceApplication.class, args);
    }
}
