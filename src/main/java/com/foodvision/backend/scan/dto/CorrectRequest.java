package com.foodvision.backend.scan.dto;

import jakarta.validation.constraints.NotNull;

public record CorrectRequest(
        @NotNull Long mealId,
        String newLabel
) {}
