package com.pizzeria.catalog.repository;

import com.pizzeria.catalog.dto.PizzaSummaryResponse;
import com.pizzeria.catalog.entity.Pizza;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * PizzaRepository - Data Access Layer for Pizza entities.
 *
 * The summary queries count association rows in the same statement that
 * reads the pizzas, so the ingredient number always reflects the table at
 * read time.
 */
@Repository
public interface PizzaRepository extends JpaRepository<Pizza, Long> {

    @Query("select new com.pizzeria.catalog.dto.PizzaSummaryResponse(p.id, p.name, p.price, p.active, count(link.id)) "
            + "from Pizza p left join p.ingredients link "
            + "group by p.id, p.name, p.price, p.active "
            + "order by p.id")
    List<PizzaSummaryResponse> findAllSummaries();

    @Query("select new com.pizzeria.catalog.dto.PizzaSummaryResponse(p.id, p.name, p.price, p.active, count(link.id)) "
            + "from Pizza p left join p.ingredients link "
            + "where p.active = true "
            + "group by p.id, p.name, p.price, p.active "
            + "order by p.id")
    List<PizzaSummaryResponse> findActiveSummaries();
}
