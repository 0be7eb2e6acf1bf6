package com.foodvision.backend.scan.pipeline;

import com.foodvision.backend.scan.nutrition.FoodNames;

import java.util.Set;

/**
 * 切割模型常把餐具、盤子一起框出來，這些不能算進營養總和。
 * 比對一律用 canonical name。
 */
public final class NonFoodBlocklist {
    private NonFoodBlocklist() {}

    private static final Set<String> BLOCKED = Set.of(
            "plate", "plates", "non_food", "table", "cutlery",
            "fork", "knife", "spoon", "napkin", "container",
            "bowl", "cup", "glass", FoodNames.UNKNOWN
    );

    public static boolean isBlocked(String rawLabel) {
        String key = FoodNames.canonicalize(rawLabel);
        return key.isEmpty() || BLOCKED.contains(key);
    }
}
