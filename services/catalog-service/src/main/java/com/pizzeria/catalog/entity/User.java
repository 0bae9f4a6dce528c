package com.pizzeria.catalog.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * User - JPA Entity representing an account allowed to call the catalog API.
 *
 * Maps to the 'users' table (see V1__initial_schema.sql):
 * - id: identity primary key
 * - username: unique login name
 * - email: unique address, also the subject of issued tokens
 * - password_hash: BCrypt hash, never exposed in responses
 * - permission_level: ORDINARY or ELEVATED
 * - created_at: set once on insert
 *
 * Users are created at signup and are immutable afterwards.
 * Uniqueness of username and email is backed by database constraints so
 * concurrent signups cannot create duplicates.
 *
 * @see com.pizzeria.catalog.repository.UserRepository
 * @see com.pizzeria.catalog.service.UserService
 */
@Entity
@Table(name = "users")
@Data
@NoArgsConstructor  // required by JPA
@AllArgsConstructor
@Builder
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "username", unique = true, nullable = false, length = 60)
    private String username;

    @Column(name = "email", unique = true, nullable = false)
    private String email;

    @ToString.Exclude
    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "permission_level", nullable = false, length = 20)
    @Builder.Default
    private PermissionLevel permissionLevel = PermissionLevel.ORDINARY;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
