package com.foodvision.backend.scan.dto;

import com.foodvision.backend.scan.model.FoodItem;
import com.foodvision.backend.scan.model.Macros;

import java.util.List;

public record CorrectResponse(String status, Macros totals, List<FoodItem> items) {

    public static CorrectResponse success(Macros totals, List<FoodItem> items) {
        return new CorrectResponse("success", totals, items);
    }
}
