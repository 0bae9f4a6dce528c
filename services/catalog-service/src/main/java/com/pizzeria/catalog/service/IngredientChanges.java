package com.pizzeria.catalog.service;

import lombok.Builder;
import lombok.Value;

/**
 * Partial update of an ingredient. Unset fields default to absent.
 */
@Value
@Builder
public class IngredientChanges {

    @Builder.Default
    FieldUpdate<String> name = FieldUpdate.absent();

    @Builder.Default
    FieldUpdate<String> category = FieldUpdate.absent();
}
