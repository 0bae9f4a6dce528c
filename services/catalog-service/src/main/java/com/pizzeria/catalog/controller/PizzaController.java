package com.pizzeria.catalog.controller;

import com.pizzeria.catalog.dto.PizzaCreateRequest;
import com.pizzeria.catalog.dto.PizzaDetailsResponse;
import com.pizzeria.catalog.dto.PizzaResponse;
import com.pizzeria.catalog.dto.PizzaSummaryResponse;
import com.pizzeria.catalog.entity.User;
import com.pizzeria.catalog.exception.NotFoundException;
import com.pizzeria.catalog.service.FieldUpdate;
import com.pizzeria.catalog.service.PizzaChanges;
import com.pizzeria.catalog.service.PizzaService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * PizzaController - REST API endpoints for pizzas.
 *
 * Endpoints:
 * - GET   /pizzas       - List pizzas with their ingredient count (auth)
 * - GET   /pizzas/{id}  - Pizza details including ingredients (public)
 * - POST  /pizzas       - Create a pizza (auth)
 * - PATCH /pizzas/{id}  - Change name, price and/or active flag (auth)
 *
 * Pizzas are never deleted; set {@code is_active=false} instead.
 */
@RestController
@RequestMapping("/pizzas")
@RequiredArgsConstructor
@Slf4j
public class PizzaController {

    private final PizzaService pizzaService;

    /**
     * List pizzas.
     *
     * @param activeOnly when true, inactive pizzas are left out; all pizzas by default
     * @return pizzas ordered by id with {@code ingredient_number} counted at read time
     */
    @GetMapping
    public ResponseEntity<List<PizzaSummaryResponse>> listPizzas(
            @RequestParam(name = "active_only", defaultValue = "false") boolean activeOnly) {
        return ResponseEntity.ok(pizzaService.getPizzaList(!activeOnly));
    }

    @GetMapping("/{pizzaId}")
    public ResponseEntity<PizzaDetailsResponse> getPizza(@PathVariable Long pizzaId) {
        return pizzaService.getPizza(pizzaId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotFoundException(PizzaService.PIZZA_NOT_FOUND));
    }

    @PostMapping
    public ResponseEntity<PizzaResponse> createPizza(@Valid @RequestBody PizzaCreateRequest request,
                                                     @AuthenticationPrincipal User caller) {
        PizzaResponse pizza = pizzaService.create(request);
        log.info("Pizza {} created by user {}", pizza.getId(), caller.getId());
        return ResponseEntity.ok(pizza);
    }

    /**
     * Partially update a pizza. Only the query parameters that are sent change;
     * a pizza's name cannot be cleared.
     *
     * @param name     new name (optional)
     * @param price    new price in the smallest currency unit (optional)
     * @param isActive new active flag (optional)
     * @return the updated pizza
     */
    @PatchMapping("/{pizzaId}")
    public ResponseEntity<PizzaDetailsResponse> updatePizza(
            @PathVariable Long pizzaId,
            @RequestParam(required = false) @Size(min = 1, max = 100) @Pattern(regexp = ".*\\S.*", message = "must not be blank") String name,
            @RequestParam(required = false) @PositiveOrZero Integer price,
            @RequestParam(name = "is_active", required = false) Boolean isActive,
            @AuthenticationPrincipal User caller) {
        PizzaChanges changes = PizzaChanges.builder()
                .name(FieldUpdate.ofNullable(name))
                .price(FieldUpdate.ofNullable(price))
                .active(FieldUpdate.ofNullable(isActive))
                .build();
        PizzaDetailsResponse pizza = pizzaService.update(pizzaId, changes)
                .orElseThrow(() -> new NotFoundException(PizzaService.PIZZA_NOT_FOUND));
        log.info("Pizza {} updated by user {}", pizzaId, caller.getId());
        return ResponseEntity.ok(pizza);
    }
}
