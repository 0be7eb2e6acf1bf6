package com.foodvision.backend.scan.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.foodvision.backend.scan.model.FoodItem;
import com.foodvision.backend.scan.model.Macros;
import com.foodvision.backend.scan.model.Region;

import java.util.List;

/**
 * 成功的 scan 存成 meal 之後給前端的結果（SSE result event 的內容）。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScanResultPayload(
        Long mealId,
        String imagePath,
        String imageUrl,
        Macros totals,
        List<FoodItem> items,
        List<Region> regions,
        String originalLabel,
        String annotatedImageUrl      // 只有 deep scan 有
) {
    public ScanResultPayload {
        items = (items == null) ? List.of() : List.copyOf(items);
        regions = (regions == null) ? List.of() : List.copyOf(regions);
    }
}
