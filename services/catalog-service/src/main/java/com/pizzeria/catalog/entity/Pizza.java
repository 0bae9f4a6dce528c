package com.pizzeria.catalog.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Pizza - catalog item.
 *
 * Price is stored as an integer in the smallest currency unit. The number of
 * ingredients is never persisted; it is derived from {@link #ingredients}
 * whenever a pizza is read. Pizzas are deactivated rather than deleted.
 */
@Entity
@Table(name = "pizzas")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Pizza {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "price", nullable = false)
    private Integer price;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @OneToMany(mappedBy = "pizza")
    @OrderBy("id ASC")
    @Builder.Default
    @ToString.Exclude
    private List<PizzaIngredient> ingredients = new ArrayList<>();
}
