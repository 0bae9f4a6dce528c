package com.pizzeria.catalog.service;

import com.pizzeria.catalog.dto.AssociationResponse;
import com.pizzeria.catalog.entity.Ingredient;
import com.pizzeria.catalog.entity.Pizza;
import com.pizzeria.catalog.entity.PizzaIngredient;
import com.pizzeria.catalog.exception.ConflictException;
import com.pizzeria.catalog.exception.NotFoundException;
import com.pizzeria.catalog.repository.IngredientRepository;
import com.pizzeria.catalog.repository.PizzaIngredientRepository;
import com.pizzeria.catalog.repository.PizzaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * PizzaIngredientService - store access for pizza/ingredient associations.
 *
 * Associations are addressed by the exact (pizzaId, ingredientId) pair.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PizzaIngredientService {

    public static final String ASSOCIATION_EXISTS = "Association already exists";

    private final PizzaRepository pizzaRepository;

    private final IngredientRepository ingredientRepository;

    private final PizzaIngredientRepository pizzaIngredientRepository;

    /**
     * Associate an ingredient with a pizza.
     *
     * Runs without an enclosing transaction so the insert is flushed in its
     * own repository transaction; a violation of the unique pair constraint
     * (a concurrent duplicate) then surfaces here as a conflict.
     *
     * @throws NotFoundException if the pizza or the ingredient does not exist
     * @throws ConflictException if the pair is already associated
     */
    public AssociationResponse create(Long pizzaId, Long ingredientId) {
        Pizza pizza = pizzaRepository.findById(pizzaId)
                .orElseThrow(() -> new NotFoundException(PizzaService.PIZZA_NOT_FOUND));
        Ingredient ingredient = ingredientRepository.findById(ingredientId)
                .orElseThrow(() -> new NotFoundException(IngredientService.INGREDIENT_NOT_FOUND));

        try {
            PizzaIngredient saved = pizzaIngredientRepository.saveAndFlush(PizzaIngredient.builder()
                    .pizza(pizza)
                    .ingredient(ingredient)
                    .build());
            log.info("Added ingredient {} to pizza {}", ingredientId, pizzaId);
            return AssociationResponse.from(saved);
        } catch (DataIntegrityViolationException e) {
            if (pizzaIngredientRepository.findByPizzaIdAndIngredientId(pizzaId, ingredientId).isPresent()) {
                log.warn("Duplicate association rejected: pizza={}, ingredient={}", pizzaId, ingredientId);
                throw new ConflictException(ASSOCIATION_EXISTS, e);
            }
            if (!ingredientRepository.existsById(ingredientId)) {
                throw new NotFoundException(IngredientService.INGREDIENT_NOT_FOUND);
            }
            throw e;
        }
    }

    /**
     * Remove the association of the given pair.
     *
     * @return the removed association, or empty if the pair was not associated
     */
    @Transactional
    public Optional<AssociationResponse> delete(Long pizzaId, Long ingredientId) {
        return pizzaIngredientRepository.findByPizzaIdAndIngredientId(pizzaId, ingredientId)
                .map(association -> {
                    AssociationResponse removed = AssociationResponse.from(association);
                    pizzaIngredientRepository.delete(association);
                    log.info("Removed ingredient {} from pizza {}", ingredientId, pizzaId);
                    return removed;
                });
    }
}
