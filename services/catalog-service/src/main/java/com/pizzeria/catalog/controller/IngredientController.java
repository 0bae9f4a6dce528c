package com.pizzeria.catalog.controller;

import com.pizzeria.catalog.dto.IngredientRequest;
import com.pizzeria.catalog.dto.IngredientResponse;
import com.pizzeria.catalog.dto.StatusResponse;
import com.pizzeria.catalog.entity.User;
import com.pizzeria.catalog.exception.ConflictException;
import com.pizzeria.catalog.exception.NotFoundException;
import com.pizzeria.catalog.service.FieldUpdate;
import com.pizzeria.catalog.service.IngredientChanges;
import com.pizzeria.catalog.service.IngredientDeletion;
import com.pizzeria.catalog.service.IngredientService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * IngredientController - REST API endpoints for ingredients. All require an
 * authenticated caller.
 *
 * Endpoints:
 * - POST   /ingredients       - Create an ingredient
 * - PATCH  /ingredients/{id}  - Change name and/or category
 * - DELETE /ingredients/{id}  - Delete an ingredient no pizza contains
 */
@RestController
@RequestMapping("/ingredients")
@RequiredArgsConstructor
@Slf4j
public class IngredientController {

    static final String INGREDIENT_IN_USE = "Cannot delete an ingredient in an active pizza";

    private final IngredientService ingredientService;

    @PostMapping
    public ResponseEntity<IngredientResponse> createIngredient(@Valid @RequestBody IngredientRequest request,
                                                               @AuthenticationPrincipal User caller) {
        IngredientResponse ingredient = ingredientService.create(request);
        log.info("Ingredient {} created by user {}", ingredient.getId(), caller.getId());
        return ResponseEntity.ok(ingredient);
    }

    @PatchMapping("/{ingredientId}")
    public ResponseEntity<IngredientResponse> updateIngredient(
            @PathVariable Long ingredientId,
            @RequestParam(required = false) @Size(min = 1, max = 100) @Pattern(regexp = ".*\\S.*", message = "must not be blank") String name,
            @RequestParam(required = false) @Size(min = 1, max = 50) @Pattern(regexp = ".*\\S.*", message = "must not be blank") String category,
            @AuthenticationPrincipal User caller) {
        IngredientChanges changes = IngredientChanges.builder()
                .name(FieldUpdate.ofNullable(name))
                .category(FieldUpdate.ofNullable(category))
                .build();
        IngredientResponse ingredient = ingredientService.update(ingredientId, changes)
                .orElseThrow(() -> new NotFoundException(IngredientService.INGREDIENT_NOT_FOUND));
        log.info("Ingredient {} updated by user {}", ingredientId, caller.getId());
        return ResponseEntity.ok(ingredient);
    }

    /**
     * Delete an ingredient.
     *
     * @return 200 naming the deleted ingredient; 404 if it does not exist;
     *         400 if a pizza still contains it (the ingredient is kept)
     */
    @DeleteMapping("/{ingredientId}")
    public ResponseEntity<StatusResponse> deleteIngredient(@PathVariable Long ingredientId,
                                                           @AuthenticationPrincipal User caller) {
        IngredientDeletion deletion = ingredientService.delete(ingredientId);
        switch (deletion.getOutcome()) {
            case DELETED:
                log.info("Ingredient {} deleted by user {}", ingredientId, caller.getId());
                return ResponseEntity.ok(StatusResponse.completed(
                        "Ingredient " + deletion.getIngredientName() + " with id " + deletion.getIngredientId() + " deleted"));
            case BLOCKED:
                throw new ConflictException(INGREDIENT_IN_USE);
            case MISSING:
            default:
                throw new NotFoundException(IngredientService.INGREDIENT_NOT_FOUND);
        }
    }
}
