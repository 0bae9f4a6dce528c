package com.pizzeria.catalog.repository;

import com.pizzeria.catalog.entity.PizzaIngredient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * PizzaIngredientRepository - Data Access Layer for pizza/ingredient associations.
 *
 * Associations are always addressed by the exact (pizza, ingredient) pair.
 */
@Repository
public interface PizzaIngredientRepository extends JpaRepository<PizzaIngredient, Long> {

    Optional<PizzaIngredient> findByPizzaIdAndIngredientId(Long pizzaId, Long ingredientId);

    long countByIngredientId(Long ingredientId);
}
