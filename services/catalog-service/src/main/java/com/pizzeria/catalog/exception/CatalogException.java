package com.pizzeria.catalog.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base class of every failure the API reports on purpose.
 *
 * Each subclass fixes the HTTP status; the message is the human-readable
 * detail sent back to the caller as {@code {"detail": "..."}}.
 *
 * @see GlobalExceptionHandler
 */
@Getter
public abstract class CatalogException extends RuntimeException {

    private final HttpStatus status;

    protected CatalogException(HttpStatus status, String detail) {
        super(detail);
        this.status = status;
    }

    protected CatalogException(HttpStatus status, String detail, Throwable cause) {
        super(detail, cause);
        this.status = status;
    }
}
