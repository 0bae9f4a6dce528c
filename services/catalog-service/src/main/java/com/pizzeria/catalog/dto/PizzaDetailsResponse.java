package com.pizzeria.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pizzeria.catalog.entity.Pizza;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * PizzaDetailsResponse - a pizza with the ingredients it contains.
 *
 * Example Response:
 * <pre>
 * {
 *   "id": 1,
 *   "name": "Margherita",
 *   "price": 850,
 *   "is_active": true,
 *   "ingredient_number": 2,
 *   "ingredients": [
 *     {"id": 1, "name": "Mozzarella", "category": "cheese"},
 *     {"id": 2, "name": "Basil", "category": "herb"}
 *   ]
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PizzaDetailsResponse {

    private Long id;

    private String name;

    private Integer price;

    @JsonProperty("is_active")
    private Boolean active;

    private Long ingredientNumber;

    private List<IngredientResponse> ingredients;

    /**
     * Must be called while the pizza's association collection can still be loaded.
     */
    public static PizzaDetailsResponse from(Pizza pizza) {
        List<IngredientResponse> ingredients = pizza.getIngredients().stream()
                .map(association -> IngredientResponse.from(association.getIngredient()))
                .collect(Collectors.toList());
        return PizzaDetailsResponse.builder()
                .id(pizza.getId())
                .name(pizza.getName())
                .price(pizza.getPrice())
                .active(pizza.isActive())
                .ingredientNumber((long) ingredients.size())
                .ingredients(ingredients)
                .build();
    }
}
