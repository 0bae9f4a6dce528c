package com.pizzeria.catalog.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of {@link IngredientService#delete(Long)}.
 *
 * BLOCKED carries the number of pizzas that still contain the ingredient.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IngredientDeletion {

    public enum Outcome {
        DELETED,
        BLOCKED,
        MISSING
    }

    private final Outcome outcome;

    private final Long ingredientId;

    private final String ingredientName;

    private final long associationCount;

    static IngredientDeletion deleted(Long id, String name) {
        return new IngredientDeletion(Outcome.DELETED, id, name, 0);
    }

    static IngredientDeletion blocked(Long id, String name, long associationCount) {
        return new IngredientDeletion(Outcome.BLOCKED, id, name, associationCount);
    }

    static IngredientDeletion missing(Long id) {
        return new IngredientDeletion(Outcome.MISSING, id, null, 0);
    }
}
