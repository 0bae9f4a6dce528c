package com.pizzeria.catalog.controller;

import com.pizzeria.catalog.dto.AssociationResponse;
import com.pizzeria.catalog.dto.StatusResponse;
import com.pizzeria.catalog.entity.User;
import com.pizzeria.catalog.exception.NotFoundException;
import com.pizzeria.catalog.service.PizzaIngredientService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * PizzaIngredientController - adds ingredients to and removes them from pizzas.
 *
 * Endpoints (auth):
 * - POST   /pizzas/ingredients/{pizzaId}/{ingredientId}
 * - DELETE /pizzas/ingredients/{pizzaId}/{ingredientId}
 */
@RestController
@RequestMapping("/pizzas/ingredients/{pizzaId}/{ingredientId}")
@RequiredArgsConstructor
@Slf4j
public class PizzaIngredientController {

    static final String ASSOCIATION_NOT_FOUND = "Association not found";

    private final PizzaIngredientService pizzaIngredientService;

    /**
     * Add an ingredient to a pizza.
     *
     * @return the created association; 404 if either side is missing
     *         (the pizza is checked first); 400 if the pizza already
     *         contains the ingredient
     */
    @PostMapping
    public ResponseEntity<AssociationResponse> addIngredientToPizza(@PathVariable Long pizzaId,
                                                                    @PathVariable Long ingredientId,
                                                                    @AuthenticationPrincipal User caller) {
        AssociationResponse association = pizzaIngredientService.create(pizzaId, ingredientId);
        log.info("Ingredient {} added to pizza {} by user {}", ingredientId, pizzaId, caller.getId());
        return ResponseEntity.ok(association);
    }

    @DeleteMapping
    public ResponseEntity<StatusResponse> removeIngredientFromPizza(@PathVariable Long pizzaId,
                                                                    @PathVariable Long ingredientId,
                                                                    @AuthenticationPrincipal User caller) {
        AssociationResponse removed = pizzaIngredientService.delete(pizzaId, ingredientId)
                .orElseThrow(() -> new NotFoundException(ASSOCIATION_NOT_FOUND));
        log.info("Ingredient {} removed from pizza {} by user {}", ingredientId, pizzaId, caller.getId());
        return ResponseEntity.ok(StatusResponse.completed(
                "Ingredient " + removed.getIngredientId() + " removed from pizza " + removed.getPizzaId()));
    }
}
