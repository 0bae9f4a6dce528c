package com.pizzeria.catalog.service;

import com.pizzeria.catalog.dto.PizzaCreateRequest;
import com.pizzeria.catalog.dto.PizzaDetailsResponse;
import com.pizzeria.catalog.dto.PizzaResponse;
import com.pizzeria.catalog.dto.PizzaSummaryResponse;
import com.pizzeria.catalog.entity.Pizza;
import com.pizzeria.catalog.repository.PizzaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * PizzaService - store access for pizzas.
 *
 * Every method runs in its own transaction and returns detached response
 * objects, so nothing lazy escapes the transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PizzaService {

    public static final String PIZZA_NOT_FOUND = "Pizza not found";

    private final PizzaRepository pizzaRepository;

    /**
     * @param all true for every pizza, false for active pizzas only
     * @return pizzas ordered by id, each with its current ingredient count
     */
    @Transactional(readOnly = true)
    public List<PizzaSummaryResponse> getPizzaList(boolean all) {
        return all ? pizzaRepository.findAllSummaries() : pizzaRepository.findActiveSummaries();
    }

    @Transactional(readOnly = true)
    public Optional<PizzaDetailsResponse> getPizza(Long pizzaId) {
        return pizzaRepository.findById(pizzaId).map(PizzaDetailsResponse::from);
    }

    @Transactional
    public PizzaResponse create(PizzaCreateRequest request) {
        Pizza pizza = Pizza.builder()
                .name(request.getName())
                .price(request.getPrice())
                .active(request.getActive() == null || request.getActive())
                .build();
        Pizza saved = pizzaRepository.save(pizza);
        log.info("Created pizza: id={}, name={}", saved.getId(), saved.getName());
        return PizzaResponse.from(saved);
    }

    /**
     * Apply a partial update. Absent fields keep their stored value.
     *
     * @return the updated pizza, or empty if no pizza has this id
     */
    @Transactional
    public Optional<PizzaDetailsResponse> update(Long pizzaId, PizzaChanges changes) {
        return pizzaRepository.findById(pizzaId).map(pizza -> {
            changes.getName().ifPresent(pizza::setName);
            changes.getPrice().ifPresent(pizza::setPrice);
            changes.getActive().ifPresent(pizza::setActive);
            log.info("Updated pizza: id={}, changes={}", pizzaId, changes);
            return PizzaDetailsResponse.from(pizza);
        });
    }
}
