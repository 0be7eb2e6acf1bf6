package com.foodvision.backend.scan.provider;

import com.foodvision.backend.scan.port.NutritionFacts;
import com.foodvision.backend.scan.port.NutritionSource;

/** USDA 關閉時：一律查不到 */
public class StubNutritionSource implements NutritionSource {

    @Override
    public NutritionFacts query(String name) {
        return NutritionFacts.notFound(name == null ? "" : name.trim(), "");
    }
}
