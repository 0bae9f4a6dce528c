package com.pizzeria.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * PizzaCreateRequest - JSON payload of {@code POST /pizzas}.
 *
 * {@code is_active} is optional and defaults to true.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PizzaCreateRequest {

    @NotBlank
    @Size(max = 100)
    private String name;

    /** Price in the smallest currency unit. */
    @NotNull
    @PositiveOrZero
    private Integer price;

    @JsonProperty("is_active")
    private Boolean active;
}
