package com.foodvision.backend.scan.pipeline;

import com.foodvision.backend.scan.model.FoodItem;
import com.foodvision.backend.scan.model.Macros;
import com.foodvision.backend.scan.model.Region;

import java.util.List;

/**
 * @param originalLabel     vision model 原始輸出（非食物 / 切不到時是固定字串）
 * @param items             發現順序；可能是空的
 * @param totals            items 加總
 * @param regions           只有 deep scan 才有
 * @param annotatedImageKey 只有 deep scan 才有，fast scan 為 null
 * @param rawResponse       除錯用，下游不解析
 */
public record PipelineResult(
        String originalLabel,
        List<FoodItem> items,
        Macros totals,
        List<Region> regions,
        String annotatedImageKey,
        String rawResponse
) {
    public PipelineResult {
        items = (items == null) ? List.of() : List.copyOf(items);
        regions = (regions == null) ? List.of() : List.copyOf(regions);
        if (totals == null) totals = Macros.sum(items);
    }

    public static PipelineResult empty(String originalLabel, String annotatedImageKey, String rawResponse) {
        return new PipelineResult(originalLabel, List.of(), Macros.ZERO, List.of(), annotatedImageKey, rawResponse);
    }

    public boolean hasAnnotatedImage() {
        return annotatedImageKey != null && !annotatedImageKey.isBlank();
    }
}
