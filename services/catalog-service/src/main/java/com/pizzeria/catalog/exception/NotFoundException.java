package com.pizzeria.catalog.exception;

import org.springframework.http.HttpStatus;

/** The addressed pizza, ingredient or association does not exist. */
public class NotFoundException extends CatalogException {

    public NotFoundException(String detail) {
        super(HttpStatus.NOT_FOUND, detail);
    }
}
