package com.foodvision.backend.scan.service;

import com.foodvision.backend.scan.dto.CorrectResponse;
import com.foodvision.backend.scan.model.FoodItem;
import com.foodvision.backend.scan.model.Macros;
import com.foodvision.backend.scan.nutrition.NutritionCacheService;
import com.foodvision.backend.scan.nutrition.NutritionLookup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 使用者手動改名：用新名稱重查營養（走同一個 cache），整筆 meal 換成單一 item。
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class MealCorrectionService {

    private final MealHistoryService history;
    private final NutritionCacheService nutritionCache;

    public CorrectResponse correct(Long mealId, String newLabel) {
        String label = (newLabel == null) ? "" : newLabel.trim();
        if (label.isEmpty()) throw new IllegalArgumentException("NEW_LABEL_REQUIRED");
        if (history.find(mealId).isEmpty()) throw new IllegalArgumentException("MEAL_NOT_FOUND");

        NutritionLookup lookup = nutritionCache.lookup(label, 1.0);
        List<FoodItem> items = List.of(lookup.toItem());
        Macros totals = lookup.macros();

        history.updateCorrection(mealId, lookup.canonicalName(), totals, items);
        log.info("meal_correct mealId={} label={} incomplete={}", mealId, lookup.canonicalName(), lookup.incomplete());

        return CorrectResponse.success(totals, items);
    }
}
