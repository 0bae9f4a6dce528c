package com.pizzeria.catalog.service;

import com.pizzeria.catalog.dto.AssociationResponse;
import com.pizzeria.catalog.entity.Ingredient;
import com.pizzeria.catalog.entity.Pizza;
import com.pizzeria.catalog.exception.ConflictException;
import com.pizzeria.catalog.exception.NotFoundException;
import com.pizzeria.catalog.repository.IngredientRepository;
import com.pizzeria.catalog.repository.PizzaIngredientRepository;
import com.pizzeria.catalog.repository.PizzaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Association store. Calls {@link PizzaIngredientService#create} directly, past
 * the handler's pre-checks, so duplicates are stopped by the unique pair constraint.
 */
@SpringBootTest
class PizzaIngredientServiceTest {

    @Autowired PizzaIngredientService pizzaIngredientService;
    @Autowired PizzaRepository pizzaRepository;
    @Autowired IngredientRepository ingredientRepository;
    @Autowired PizzaIngredientRepository pizzaIngredientRepository;

    private Pizza margherita;
    private Ingredient basil;

    @BeforeEach
    void setUp() {
        pizzaIngredientRepository.deleteAll();
        pizzaRepository.deleteAll();
        ingredientRepository.deleteAll();
        margherita = pizzaRepository.save(Pizza.builder().name("Margherita").price(850).build());
        basil = ingredientRepository.save(Ingredient.builder().name("Basil").category("herb").build());
    }

    @Test
    void create_thenLookupByExactPair() {
        AssociationResponse created = pizzaIngredientService.create(margherita.getId(), basil.getId());

        assertEquals(margherita.getId(), created.getPizzaId());
        assertEquals(basil.getId(), created.getIngredientId());
        assertTrue(pizzaIngredientRepository.findByPizzaIdAndIngredientId(margherita.getId(), basil.getId()).isPresent());
        Ingredient oregano = ingredientRepository.save(Ingredient.builder().name("Oregano").category("herb").build());
        assertTrue(pizzaIngredientRepository.findByPizzaIdAndIngredientId(margherita.getId(), oregano.getId()).isEmpty());
    }

    @Test
    void create_duplicatePair_isConflictAndKeepsOneRow() {
        pizzaIngredientService.create(margherita.getId(), basil.getId());

        ConflictException e = assertThrows(ConflictException.class,
                () -> pizzaIngredientService.create(margherita.getId(), basil.getId()));

        assertEquals(PizzaIngredientService.ASSOCIATION_EXISTS, e.getMessage());
        assertEquals(1, pizzaIngredientRepository.count());
    }

    @Test
    void create_missingPizzaOrIngredient_isNotFound() {
        NotFoundException noPizza = assertThrows(NotFoundException.class,
                () -> pizzaIngredientService.create(Long.MAX_VALUE, basil.getId()));
        NotFoundException noIngredient = assertThrows(NotFoundException.class,
                () -> pizzaIngredientService.create(margherita.getId(), Long.MAX_VALUE));

        assertEquals("Pizza not found", noPizza.getMessage());
        assertEquals("Ingredient not found", noIngredient.getMessage());
        assertEquals(0, pizzaIngredientRepository.count());
    }

    @Test
    void delete_existing_removesRow() {
        pizzaIngredientService.create(margherita.getId(), basil.getId());

        AssociationResponse removed = pizzaIngredientService.delete(margherita.getId(), basil.getId()).orElseThrow();

        assertEquals(basil.getId(), removed.getIngredientId());
        assertEquals(0, pizzaIngredientRepository.count());
    }

    @Test
    void delete_missing_isEmptyWithoutSideEffects() {
        pizzaIngredientService.create(margherita.getId(), basil.getId());
        Ingredient oregano = ingredientRepository.save(Ingredient.builder().name("Oregano").category("herb").build());

        assertTrue(pizzaIngredientService.delete(margherita.getId(), oregano.getId()).isEmpty());
        assertEquals(1, pizzaIngredientRepository.count());
    }
}
