package com.foodvision.backend.scan.dto;

import java.util.List;

public record HistoryResponse(List<MealView> items) {}
