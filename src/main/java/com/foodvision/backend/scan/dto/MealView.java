package com.foodvision.backend.scan.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.foodvision.backend.scan.model.FoodItem;
import com.foodvision.backend.scan.model.Macros;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MealView(
        Long mealId,
        Instant createdAt,
        String imagePath,
        String imageUrl,
        String originalLabel,
        String correctedLabel,
        Macros totals,
        List<FoodItem> items
) {}
