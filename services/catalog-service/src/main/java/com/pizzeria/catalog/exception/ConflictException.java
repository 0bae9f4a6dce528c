package com.pizzeria.catalog.exception;

import org.springframework.http.HttpStatus;

/**
 * A uniqueness rule or a deletion guard rejected the request.
 *
 * Reported as 400, like every other client-side conflict of this API.
 */
public class ConflictException extends CatalogException {

    public ConflictException(String detail) {
        super(HttpStatus.BAD_REQUEST, detail);
    }

    public ConflictException(String detail, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, detail, cause);
    }
}
