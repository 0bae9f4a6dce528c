package com.pizzeria.catalog.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Ingredient - something a pizza can contain.
 *
 * Whether an ingredient may be deleted is decided by the store, see
 * {@link com.pizzeria.catalog.repository.IngredientRepository#deleteIfUnreferenced}.
 */
@Entity
@Table(name = "ingredients")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Ingredient {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "category", nullable = false, length = 50)
    private String category;
}
