package com.pizzeria.catalog.service;

import lombok.Builder;
import lombok.Value;

/**
 * Partial update of a pizza. Unset fields default to absent.
 */
@Value
@Builder
public class PizzaChanges {

    @Builder.Default
    FieldUpdate<String> name = FieldUpdate.absent();

    @Builder.Default
    FieldUpdate<Integer> price = FieldUpdate.absent();

    @Builder.Default
    FieldUpdate<Boolean> active = FieldUpdate.absent();
}
