package com.foodvision.backend.scan.pipeline;

import com.foodvision.backend.scan.model.FoodItem;
import com.foodvision.backend.scan.model.ScanMode;
import com.foodvision.backend.scan.nutrition.FoodNames;
import com.foodvision.backend.scan.nutrition.NutritionCacheService;
import com.foodvision.backend.scan.port.ScanImage;
import com.foodvision.backend.scan.port.VisionLabeler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Deep scan：每個 crop 各自「辨識 → 過濾餐具 → 查營養」，在 segmentExecutor 上併發跑。
 * <p>
 * 合併時依 crop 的提交順序走（不是完成順序），同一個 canonical name 只留第一次出現的，
 * 所以輸出跟 thread 排程無關。
 * 單一 crop 失敗只會讓那個 crop 沒有 items，不影響整批。
 */
@Slf4j
@Component
public class SegmentFanOutProcessor {

    private final VisionLabeler labeler;
    private final NutritionCacheService nutritionCache;
    private final Executor segmentExecutor;

    public SegmentFanOutProcessor(
            VisionLabeler labeler,
            NutritionCacheService nutritionCache,
            @Qualifier("segmentExecutor") Executor segmentExecutor
    ) {
        this.labeler = labeler;
        this.nutritionCache = nutritionCache;
        this.segmentExecutor = segmentExecutor;
    }

    public List<FoodItem> process(List<ScanImage> crops) {
        if (crops == null || crops.isEmpty()) return List.of();

        List<CompletableFuture<List<FoodItem>>> futures = new ArrayList<>(crops.size());
        for (int i = 0; i < crops.size(); i++) {
            final int index = i;
            final ScanImage crop = crops.get(i);
            futures.add(submit(index, crop));
        }

        // ✅ fan-in：照 crop 原始順序合併
        List<FoodItem> merged = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (CompletableFuture<List<FoodItem>> f : futures) {
            for (FoodItem item : f.join()) {
                String key = FoodNames.canonicalize(item.name());
                if (seen.add(key)) merged.add(item);
            }
        }
        return merged;
    }

    private CompletableFuture<List<FoodItem>> submit(int index, ScanImage crop) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> analyzeCrop(crop), segmentExecutor)
                    .exceptionally(ex -> {
                        log.warn("segment_crop status=FAIL index={} objectKey={}", index, crop.objectKey(), ex);
                        return List.of();
                    });
        } catch (RejectedExecutionException e) {
            // pool 滿了：這個 crop 當作失敗，其他 crop 照跑
            log.warn("segment_crop status=REJECTED index={} objectKey={}", index, crop.objectKey());
            return CompletableFuture.completedFuture(List.of());
        }
    }

    List<FoodItem> analyzeCrop(ScanImage crop) {
        String label = labeler.label(crop, ScanMode.DEEP);
        if (VisionLabeler.isNonFood(label)) return List.of();

        List<FoodItem> items = new ArrayList<>();
        for (String candidate : FoodNames.splitCandidates(label)) {
            if (NonFoodBlocklist.isBlocked(candidate)) {
                log.debug("segment_crop drop non-food candidate={} objectKey={}", candidate, crop.objectKey());
                continue;
            }
            items.add(nutritionCache.lookup(candidate, 1.0).toItem());
        }
        return items;
    }
}
