package com.pizzeria.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * PizzaSummaryResponse - one row of the pizza list.
 *
 * Built directly by a JPQL constructor expression in
 * {@link com.pizzeria.catalog.repository.PizzaRepository}; the argument order
 * of the all-args constructor is part of that query.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PizzaSummaryResponse {

    private Long id;

    private String name;

    private Integer price;

    @JsonProperty("is_active")
    private Boolean active;

    /** Live count of the ingredients associated with the pizza. */
    private Long ingredientNumber;
}
