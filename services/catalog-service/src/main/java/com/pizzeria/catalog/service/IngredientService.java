package com.pizzeria.catalog.service;

import com.pizzeria.catalog.dto.IngredientRequest;
import com.pizzeria.catalog.dto.IngredientResponse;
import com.pizzeria.catalog.entity.Ingredient;
import com.pizzeria.catalog.repository.IngredientRepository;
import com.pizzeria.catalog.repository.PizzaIngredientRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * IngredientService - store access for ingredients.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngredientService {

    public static final String INGREDIENT_NOT_FOUND = "Ingredient not found";

    private final IngredientRepository ingredientRepository;

    private final PizzaIngredientRepository pizzaIngredientRepository;

    @Transactional(readOnly = true)
    public Optional<IngredientResponse> getIngredient(Long ingredientId) {
        return ingredientRepository.findById(ingredientId).map(IngredientResponse::from);
    }

    @Transactional
    public IngredientResponse create(IngredientRequest request) {
        Ingredient saved = ingredientRepository.save(Ingredient.builder()
                .name(request.getName())
                .category(request.getCategory())
                .build());
        log.info("Created ingredient: id={}, name={}", saved.getId(), saved.getName());
        return IngredientResponse.from(saved);
    }

    /**
     * Apply a partial update. Absent fields keep their stored value.
     *
     * @return the updated ingredient, or empty if no ingredient has this id
     */
    @Transactional
    public Optional<IngredientResponse> update(Long ingredientId, IngredientChanges changes) {
        return ingredientRepository.findById(ingredientId).map(ingredient -> {
            changes.getName().ifPresent(ingredient::setName);
            changes.getCategory().ifPresent(ingredient::setCategory);
            log.info("Updated ingredient: id={}, changes={}", ingredientId, changes);
            return IngredientResponse.from(ingredient);
        });
    }

    /**
     * Delete an ingredient unless a pizza still contains it.
     *
     * A refused deletion is reported as {@link IngredientDeletion.Outcome#BLOCKED},
     * not as an exception. When the conditional delete removes nothing, the
     * store is asked again: the row may have been deleted by another request
     * since it was read.
     */
    @Transactional
    public IngredientDeletion delete(Long ingredientId) {
        Optional<Ingredient> found = ingredientRepository.findById(ingredientId);
        if (found.isEmpty()) {
            return IngredientDeletion.missing(ingredientId);
        }
        String name = found.get().getName();

        if (ingredientRepository.deleteIfUnreferenced(ingredientId) == 1) {
            log.info("Deleted ingredient: id={}, name={}", ingredientId, name);
            return IngredientDeletion.deleted(ingredientId, name);
        }

        if (!ingredientRepository.existsById(ingredientId)) {
            log.info("Ingredient already deleted: id={}", ingredientId);
            return IngredientDeletion.missing(ingredientId);
        }
        long references = pizzaIngredientRepository.countByIngredientId(ingredientId);
        log.warn("Ingredient deletion blocked: id={}, pizzas={}", ingredientId, references);
        return IngredientDeletion.blocked(ingredientId, name, references);
    }
}
