package com.pizzeria.catalog.exception;

import org.springframework.http.HttpStatus;

/**
 * The presented access token is missing, invalid, expired, of the wrong
 * type, or names a user that no longer exists.
 */
public class UnauthorizedException extends CatalogException {

    public static final String MESSAGE = "Could not validate credentials";

    public UnauthorizedException() {
        this(MESSAGE);
    }

    public UnauthorizedException(String detail) {
        super(HttpStatus.UNAUTHORIZED, detail);
    }

    public UnauthorizedException(String detail, Throwable cause) {
        super(HttpStatus.UNAUTHORIZED, detail, cause);
    }
}
