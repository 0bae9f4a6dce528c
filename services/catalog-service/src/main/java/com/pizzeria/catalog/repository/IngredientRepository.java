package com.pizzeria.catalog.repository;

import com.pizzeria.catalog.entity.Ingredient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * IngredientRepository - Data Access Layer for Ingredient entities.
 */
@Repository
public interface IngredientRepository extends JpaRepository<Ingredient, Long> {

    /**
     * Delete an ingredient only if no pizza references it.
     *
     * The reference check and the delete are one statement, so an ingredient
     * is never removed out from under an association created concurrently
     * (the foreign key rejects whatever slips through).
     *
     * @param id ingredient id
     * @return number of rows deleted: 1 on success, 0 if missing or still referenced
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Ingredient i where i.id = :id and not exists "
            + "(select link.id from PizzaIngredient link where link.ingredient.id = :id)")
    int deleteIfUnreferenced(@Param("id") Long id);
}
