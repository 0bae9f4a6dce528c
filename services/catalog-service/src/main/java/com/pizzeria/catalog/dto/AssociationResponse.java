package com.pizzeria.catalog.dto;

import com.pizzeria.catalog.entity.PizzaIngredient;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * AssociationResponse - the (pizza, ingredient) pair of a created association.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssociationResponse {

    private Long pizzaId;

    private Long ingredientId;

    public static AssociationResponse from(PizzaIngredient association) {
        return AssociationResponse.builder()
                .pizzaId(association.getPizza().getId())
                .ingredientId(association.getIngredient().getId())
                .build();
    }
}
