package com.pizzeria.catalog.entity;

/**
 * Permission level of a {@link User}.
 *
 * Every account created through signup is {@code ORDINARY}; {@code ELEVATED}
 * accounts (staff) are provisioned directly in the database.
 */
public enum PermissionLevel {
    ORDINARY,
    ELEVATED
}
