package com.pizzeria.catalog.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pizzeria.catalog.repository.IngredientRepository;
import com.pizzeria.catalog.repository.PizzaIngredientRepository;
import com.pizzeria.catalog.repository.PizzaRepository;
import com.pizzeria.catalog.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Pizza, ingredient and association endpoints over HTTP, authenticated with a
 * token obtained through /signup and /login.
 */
@SpringBootTest
@AutoConfigureMockMvc
class CatalogControllerIntegrationTests {

    @Autowired MockMvc mockMvc;
    @Autowired ObjectMapper objectMapper;
    @Autowired UserRepository userRepository;
    @Autowired PizzaRepository pizzaRepository;
    @Autowired IngredientRepository ingredientRepository;
    @Autowired PizzaIngredientRepository pizzaIngredientRepository;

    private String bearer;

    @BeforeEach
    void setUp() throws Exception {
        pizzaIngredientRepository.deleteAll();
        pizzaRepository.deleteAll();
        ingredientRepository.deleteAll();
        userRepository.deleteAll();

        mockMvc.perform(post("/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"chef\",\"email\":\"chef@example.com\",\"password\":\"s3cret\"}"))
                .andExpect(status().isCreated());
        String tokens = mockMvc.perform(post("/login")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("username", "chef")
                        .param("password", "s3cret"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        bearer = "Bearer " + objectMapper.readTree(tokens).get("access_token").asText();
    }

    // -------------------------
    // pizzas
    // -------------------------

    @Test
    void createPizza_returnsPizza() throws Exception {
        mockMvc.perform(post("/pizzas")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Margherita\",\"price\":850}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").isNumber())
                .andExpect(jsonPath("$.name").value("Margherita"))
                .andExpect(jsonPath("$.price").value(850))
                .andExpect(jsonPath("$.is_active").value(true));
    }

    @Test
    void createPizza_withoutToken_is401AndCreatesNothing() throws Exception {
        mockMvc.perform(post("/pizzas")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Margherita\",\"price\":850}"))
                .andExpect(status().isUnauthorized());

        assertEquals(0, pizzaRepository.count());
    }

    @Test
    void createPizza_invalidBody_is422() throws Exception {
        mockMvc.perform(post("/pizzas")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"price\":-5}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail").isString());
    }

    @Test
    void listPizzas_countsIngredientsAtReadTime() throws Exception {
        long margherita = createPizza("Margherita", 850, true);
        long marinara = createPizza("Marinara", 700, true);
        long tomato = createIngredient("Tomato", "sauce");
        long mozzarella = createIngredient("Mozzarella", "cheese");
        associate(margherita, tomato);
        associate(margherita, mozzarella);

        mockMvc.perform(get("/pizzas").header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].id").value((int) margherita))
                .andExpect(jsonPath("$[0].ingredient_number").value(2))
                .andExpect(jsonPath("$[1].id").value((int) marinara))
                .andExpect(jsonPath("$[1].ingredient_number").value(0));

        mockMvc.perform(delete("/pizzas/ingredients/{p}/{i}", margherita, tomato).header("Authorization", bearer))
                .andExpect(status().isOk());

        mockMvc.perform(get("/pizzas").header("Authorization", bearer))
                .andExpect(jsonPath("$[0].ingredient_number").value(1));
    }

    @Test
    void listPizzas_returnsInactiveByDefault_andFiltersWhenAsked() throws Exception {
        createPizza("Margherita", 850, true);
        createPizza("Hawaii", 990, false);

        mockMvc.perform(get("/pizzas").header("Authorization", bearer))
                .andExpect(jsonPath("$.length()").value(2));
        mockMvc.perform(get("/pizzas").param("active_only", "true").header("Authorization", bearer))
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].name").value("Margherita"));
    }

    @Test
    void getPizza_isPublicAndIncludesIngredients() throws Exception {
        long margherita = createPizza("Margherita", 850, true);
        long basil = createIngredient("Basil", "herb");
        associate(margherita, basil);

        mockMvc.perform(get("/pizzas/{id}", margherita))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Margherita"))
                .andExpect(jsonPath("$.ingredient_number").value(1))
                .andExpect(jsonPath("$.ingredients[0].id").value((int) basil))
                .andExpect(jsonPath("$.ingredients[0].name").value("Basil"))
                .andExpect(jsonPath("$.ingredients[0].category").value("herb"));
    }

    @Test
    void getPizza_missing_is404() throws Exception {
        mockMvc.perform(get("/pizzas/{id}", 987654))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Pizza not found"));
    }

    @Test
    void getPizza_nonNumericId_is422() throws Exception {
        mockMvc.perform(get("/pizzas/{id}", "margherita"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void patchPizza_priceOnly_leavesNameAndActiveUnchanged() throws Exception {
        long hawaii = createPizza("Hawaii", 990, false);

        mockMvc.perform(patch("/pizzas/{id}", hawaii).param("price", "1190").header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.price").value(1190));

        mockMvc.perform(get("/pizzas/{id}", hawaii))
                .andExpect(jsonPath("$.name").value("Hawaii"))
                .andExpect(jsonPath("$.price").value(1190))
                .andExpect(jsonPath("$.is_active").value(false));
    }

    @Test
    void patchPizza_nameAndActive() throws Exception {
        long hawaii = createPizza("Hawaii", 990, false);

        mockMvc.perform(patch("/pizzas/{id}", hawaii)
                        .param("name", "Tropical")
                        .param("is_active", "true")
                        .header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Tropical"))
                .andExpect(jsonPath("$.price").value(990))
                .andExpect(jsonPath("$.is_active").value(true));
    }

    @Test
    void patchPizza_missing_is404() throws Exception {
        mockMvc.perform(patch("/pizzas/{id}", 987654).param("price", "100").header("Authorization", bearer))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Pizza not found"));
    }

    @Test
    void patchPizza_invalidValues_are422() throws Exception {
        long hawaii = createPizza("Hawaii", 990, false);

        mockMvc.perform(patch("/pizzas/{id}", hawaii).param("price", "-1").header("Authorization", bearer))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(patch("/pizzas/{id}", hawaii).param("name", "   ").header("Authorization", bearer))
                .andExpect(status().isUnprocessableEntity());

        mockMvc.perform(get("/pizzas/{id}", hawaii))
                .andExpect(jsonPath("$.name").value("Hawaii"))
                .andExpect(jsonPath("$.price").value(990));
    }

    @Test
    void patchPizza_withoutToken_is401() throws Exception {
        long hawaii = createPizza("Hawaii", 990, false);

        mockMvc.perform(patch("/pizzas/{id}", hawaii).param("price", "1"))
                .andExpect(status().isUnauthorized());
    }

    // -------------------------
    // ingredients
    // -------------------------

    @Test
    void createIngredient_returnsIngredient() throws Exception {
        mockMvc.perform(post("/ingredients")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Basil\",\"category\":\"herb\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").isNumber())
                .andExpect(jsonPath("$.name").value("Basil"))
                .andExpect(jsonPath("$.category").value("herb"));
    }

    @Test
    void patchIngredient_nameOnly() throws Exception {
        long basil = createIngredient("Basil", "herb");

        mockMvc.perform(patch("/ingredients/{id}", basil).param("name", "Thai basil").header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Thai basil"))
                .andExpect(jsonPath("$.category").value("herb"));
    }

    @Test
    void patchIngredient_missing_is404() throws Exception {
        mockMvc.perform(patch("/ingredients/{id}", 987654).param("name", "x").header("Authorization", bearer))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Ingredient not found"));
    }

    @Test
    void deleteIngredient_unreferenced_thenGone() throws Exception {
        long basil = createIngredient("Basil", "herb");

        mockMvc.perform(delete("/ingredients/{id}", basil).header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.detail").value("Ingredient Basil with id " + basil + " deleted"));

        mockMvc.perform(delete("/ingredients/{id}", basil).header("Authorization", bearer))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Ingredient not found"));
        assertFalse(ingredientRepository.existsById(basil));
    }

    @Test
    void deleteIngredient_referenced_is400AndIngredientRemains() throws Exception {
        long margherita = createPizza("Margherita", 850, true);
        long tomato = createIngredient("Tomato", "sauce");
        associate(margherita, tomato);

        mockMvc.perform(delete("/ingredients/{id}", tomato).header("Authorization", bearer))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Cannot delete an ingredient in an active pizza"));

        assertTrue(ingredientRepository.existsById(tomato));
        mockMvc.perform(get("/pizzas/{id}", margherita))
                .andExpect(jsonPath("$.ingredient_number").value(1));
    }

    // -------------------------
    // associations
    // -------------------------

    @Test
    void addAssociation_returnsPair() throws Exception {
        long margherita = createPizza("Margherita", 850, true);
        long basil = createIngredient("Basil", "herb");

        mockMvc.perform(post("/pizzas/ingredients/{p}/{i}", margherita, basil).header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pizza_id").value((int) margherita))
                .andExpect(jsonPath("$.ingredient_id").value((int) basil));
    }

    @Test
    void addAssociation_twice_secondIs400AndOneRowExists() throws Exception {
        long margherita = createPizza("Margherita", 850, true);
        long basil = createIngredient("Basil", "herb");

        associate(margherita, basil);
        mockMvc.perform(post("/pizzas/ingredients/{p}/{i}", margherita, basil).header("Authorization", bearer))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Association already exists"));

        assertEquals(1, pizzaIngredientRepository.count());
    }

    @Test
    void addAssociation_missingSide_is404() throws Exception {
        long margherita = createPizza("Margherita", 850, true);
        long basil = createIngredient("Basil", "herb");

        mockMvc.perform(post("/pizzas/ingredients/{p}/{i}", 987654, basil).header("Authorization", bearer))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Pizza not found"));
        mockMvc.perform(post("/pizzas/ingredients/{p}/{i}", margherita, 987654).header("Authorization", bearer))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Ingredient not found"));

        assertEquals(0, pizzaIngredientRepository.count());
    }

    @Test
    void addAssociation_bothSidesMissing_reportsPizzaFirst() throws Exception {
        mockMvc.perform(post("/pizzas/ingredients/{p}/{i}", 987654, 987655).header("Authorization", bearer))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Pizza not found"));

        assertEquals(0, pizzaIngredientRepository.count());
    }

    @Test
    void removeAssociation_thenSecondRemovalIs404() throws Exception {
        long margherita = createPizza("Margherita", 850, true);
        long basil = createIngredient("Basil", "herb");
        associate(margherita, basil);

        mockMvc.perform(delete("/pizzas/ingredients/{p}/{i}", margherita, basil).header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.detail").value("Ingredient " + basil + " removed from pizza " + margherita));

        mockMvc.perform(delete("/pizzas/ingredients/{p}/{i}", margherita, basil).header("Authorization", bearer))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Association not found"));
    }

    @Test
    void removeAssociation_neverCreated_is404WithoutSideEffects() throws Exception {
        long margherita = createPizza("Margherita", 850, true);
        long basil = createIngredient("Basil", "herb");
        long oregano = createIngredient("Oregano", "herb");
        associate(margherita, basil);

        mockMvc.perform(delete("/pizzas/ingredients/{p}/{i}", margherita, oregano).header("Authorization", bearer))
                .andExpect(status().isNotFound());

        assertEquals(1, pizzaIngredientRepository.count());
        assertTrue(ingredientRepository.existsById(oregano));
    }

    @Test
    void associationRoutes_withoutToken_are401() throws Exception {
        long margherita = createPizza("Margherita", 850, true);
        long basil = createIngredient("Basil", "herb");

        mockMvc.perform(post("/pizzas/ingredients/{p}/{i}", margherita, basil))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(delete("/ingredients/{id}", basil))
                .andExpect(status().isUnauthorized());

        assertEquals(0, pizzaIngredientRepository.count());
        assertTrue(ingredientRepository.existsById(basil));
    }

    private long createPizza(String name, int price, boolean active) throws Exception {
        String body = mockMvc.perform(post("/pizzas")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"" + name + "\",\"price\":" + price + ",\"is_active\":" + active + "}"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body).get("id").asLong();
    }

    private long createIngredient(String name, String category) throws Exception {
        String body = mockMvc.perform(post("/ingredients")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"" + name + "\",\"category\":\"" + category + "\"}"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body).get("id").asLong();
    }

    private void associate(long pizzaId, long ingredientId) throws Exception {
        mockMvc.perform(post("/pizzas/ingredients/{p}/{i}", pizzaId, ingredientId).header("Authorization", bearer))
                .andExpect(status().isOk());
    }
}
