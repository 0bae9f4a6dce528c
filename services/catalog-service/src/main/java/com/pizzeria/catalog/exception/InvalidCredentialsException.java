package com.pizzeria.catalog.exception;

import org.springframework.http.HttpStatus;

/**
 * Login failed.
 *
 * The message is the same whether the username is unknown or the password
 * is wrong.
 */
public class InvalidCredentialsException extends CatalogException {

    public static final String MESSAGE = "Incorrect username or password";

    public InvalidCredentialsException() {
        super(HttpStatus.BAD_REQUEST, MESSAGE);
    }
}
