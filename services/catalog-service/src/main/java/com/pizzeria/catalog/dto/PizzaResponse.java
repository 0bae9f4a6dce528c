package com.pizzeria.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pizzeria.catalog.entity.Pizza;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * PizzaResponse - a pizza without its ingredients, returned on creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PizzaResponse {

    private Long id;

    private String name;

    private Integer price;

    @JsonProperty("is_active")
    private Boolean active;

    public static PizzaResponse from(Pizza pizza) {
        return PizzaResponse.builder()
                .id(pizza.getId())
                .name(pizza.getName())
                .price(pizza.getPrice())
                .active(pizza.isActive())
                .build();
    }
}
