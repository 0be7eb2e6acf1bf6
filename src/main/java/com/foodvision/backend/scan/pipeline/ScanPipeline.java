package com.foodvision.backend.scan.pipeline;

import com.foodvision.backend.scan.model.FoodItem;
import com.foodvision.backend.scan.model.Macros;
import com.foodvision.backend.scan.model.ScanMode;
import com.foodvision.backend.scan.nutrition.FoodNames;
import com.foodvision.backend.scan.nutrition.NutritionCacheService;
import com.foodvision.backend.scan.port.ScanImage;
import com.foodvision.backend.scan.port.Segmentation;
import com.foodvision.backend.scan.port.SegmentationUnavailableException;
import com.foodvision.backend.scan.port.Segmenter;
import com.foodvision.backend.scan.port.VisionLabeler;
import com.foodvision.backend.scan.storage.StorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 兩種掃描策略：
 * <pre>
 * FAST：Labeling → Resolving → Done / NonFood
 * DEEP：Segmenting → Classifying → Aggregating → Done / Empty
 * </pre>
 * 進度一律走 {@link ProgressListener}，呼叫端不輪詢 pipeline。
 */
@Slf4j
@Service
public class ScanPipeline {

    static final String NON_FOOD_LABEL = "Non-Food Item Detected";
    static final String NON_FOOD_RAW = "The AI determined there is no edible food in this image.";
    static final String NO_SEGMENTS_LABEL = "No food segments detected";
    static final String NO_SEGMENTS_RAW = "Segmentation found no distinct food regions.";
    static final String NO_EDIBLE_LABEL = "No edible food detected in segments";
    static final String NO_EDIBLE_RAW = "AI did not identify edible food in the segmented regions.";

    private final VisionLabeler labeler;
    private final Segmenter segmenter;
    private final NutritionCacheService nutritionCache;
    private final SegmentFanOutProcessor fanOut;
    private final StorageService storage;

    public ScanPipeline(
            VisionLabeler labeler,
            Segmenter segmenter,
            NutritionCacheService nutritionCache,
            SegmentFanOutProcessor fanOut,
            StorageService storage
    ) {
        this.labeler = labeler;
        this.segmenter = segmenter;
        this.nutritionCache = nutritionCache;
        this.fanOut = fanOut;
        this.storage = storage;
    }

    public PipelineResult run(ScanImage image, ScanMode mode, ProgressListener listener) {
        ProgressListener progress = (listener == null) ? ProgressListener.NOOP : listener;
        return (mode == ScanMode.DEEP) ? runDeep(image, progress) : runFast(image, progress);
    }

    PipelineResult runFast(ScanImage image, ProgressListener progress) {
        progress.report("Analyzing image", 10);
        String originalLabel = labeler.label(image, ScanMode.FAST);

        // ✅ 非食物：直接結束，不打營養查詢
        if (VisionLabeler.isNonFood(originalLabel)) {
            return PipelineResult.empty(NON_FOOD_LABEL, null, NON_FOOD_RAW);
        }

        progress.report("Identifying food", 45);

        List<String> candidates = FoodNames.splitCandidates(originalLabel);
        int n = candidates.size();

        // fast 模式刻意循序查，不開併發
        List<FoodItem> items = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            progress.report("Looking up nutrition", 50 + (i * 45) / Math.max(1, n));
            items.add(nutritionCache.lookup(candidates.get(i), 1.0).toItem());
        }

        progress.report("Done", 100);

        return new PipelineResult(
                originalLabel,
                items,
                Macros.sum(items),
                List.of(),
                null,
                "AI detected: " + originalLabel
        );
    }

    PipelineResult runDeep(ScanImage image, ProgressListener progress) {
        progress.report("Isolating items", 5);

        // SegmentationUnavailableException 原樣往上丟，job 層要給固定訊息
        Segmentation seg = segmenter.segment(image);
        if (seg == null) throw new SegmentationUnavailableException("SEGMENTER_RETURNED_NULL");

        String annotated = seg.annotatedImageKey();

        try {
            if (seg.crops().isEmpty()) {
                progress.report("Done", 100);
                return PipelineResult.empty(NO_SEGMENTS_LABEL, annotated, NO_SEGMENTS_RAW);
            }

            progress.report("Identifying food", 40);
            List<FoodItem> items = fanOut.process(seg.crops());

            if (items.isEmpty()) {
                progress.report("Done", 100);
                return PipelineResult.empty(NO_EDIBLE_LABEL, annotated, NO_EDIBLE_RAW);
            }

            String joined = items.stream().map(FoodItem::name).collect(Collectors.joining(", "));

            progress.report("Done", 100);

            return new PipelineResult(
                    joined,
                    items,
                    Macros.sum(items),
                    seg.regions(),
                    annotated,
                    "Deep Scan detected: " + joined
            );
        } finally {
            discardCrops(seg.crops());
        }
    }

    private void discardCrops(List<ScanImage> crops) {
        for (ScanImage crop : crops) {
            try {
                storage.delete(crop.objectKey());
            } catch (Exception e) {
                log.warn("crop cleanup failed objectKey={}", crop.objectKey(), e);
            }
        }
    }
}
