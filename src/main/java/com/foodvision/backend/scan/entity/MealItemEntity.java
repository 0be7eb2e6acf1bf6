package com.foodvision.backend.scan.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "meal_items", indexes = @Index(name = "idx_meal_items_meal_id", columnList = "meal_id"))
public class MealItemEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "meal_id", nullable = false)
    private Long mealId;

    // 不是 key：canonical name 多長都存得下
    @Column(nullable = false, columnDefinition = "TEXT")
    private String name;

    @Column(nullable = false)
    private double quantity = 1.0;

    private double calories;
    private double protein;
    private double carbs;
    private double fat;
}
