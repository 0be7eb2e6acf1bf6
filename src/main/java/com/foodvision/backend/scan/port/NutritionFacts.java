package com.foodvision.backend.scan.port;

import com.foodvision.backend.scan.model.Macros;

/**
 * @param correctedLabel 資料庫裡對到的名稱（查不到就是原 query）
 * @param per100g        每 100g；查不到是全 0，不是錯誤
 * @param rawResponse    除錯用
 */
public record NutritionFacts(String correctedLabel, Macros per100g, String rawResponse) {

    public NutritionFacts {
        if (per100g == null) per100g = Macros.ZERO;
        if (rawResponse == null) rawResponse = "";
    }

    public static NutritionFacts notFound(String query, String rawResponse) {
        return new NutritionFacts(query, Macros.ZERO, rawResponse);
    }
}
