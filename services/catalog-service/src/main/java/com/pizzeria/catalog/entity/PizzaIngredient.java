package com.pizzeria.catalog.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * PizzaIngredient - join row meaning "pizza contains ingredient".
 *
 * The (pizza_id, ingredient_id) pair is unique in the table, so a second
 * insert of the same pair fails in the database even when two requests race.
 */
@Entity
@Table(name = "pizza_ingredients", uniqueConstraints = {
        @UniqueConstraint(name = "uk_pizza_ingredients_pair", columnNames = {"pizza_id", "ingredient_id"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class PizzaIngredient {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "pizza_id", nullable = false)
    private Pizza pizza;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "ingredient_id", nullable = false)
    private Ingredient ingredient;
}
