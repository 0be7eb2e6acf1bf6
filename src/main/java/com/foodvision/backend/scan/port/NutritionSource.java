package com.foodvision.backend.scan.port;

public interface NutritionSource {

    /** 查不到回全 0 的 NutritionFacts，不丟例外 */
    NutritionFacts query(String name);
}
