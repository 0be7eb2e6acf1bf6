package com.foodvision.backend.scan.nutrition;

import com.foodvision.backend.scan.model.FoodItem;
import com.foodvision.backend.scan.model.Macros;

/**
 * @param canonicalName cache key
 * @param macros        已乘 quantity
 * @param rawResponse   cache hit 時是空字串
 * @param incomplete    外部查不到（全 0）
 */
public record NutritionLookup(
        String canonicalName,
        double quantity,
        Macros macros,
        String rawResponse,
        boolean incomplete
) {
    public FoodItem toItem() {
        return new FoodItem(canonicalName, quantity, macros);
    }
}
