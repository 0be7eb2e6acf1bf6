package com.foodvision.backend.scan.service;

import com.foodvision.backend.scan.dto.ScanResultPayload;
import com.foodvision.backend.scan.dto.UploadUrls;
import com.foodvision.backend.scan.model.FoodItem;
import com.foodvision.backend.scan.pipeline.PipelineResult;
import com.foodvision.backend.scan.port.ScanImage;
import com.foodvision.backend.scan.storage.StorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * pipeline 結果 → 存成 meal → 組前端要的 payload。
 * deep scan 有標註圖時，meal 存標註圖，原始上傳檔刪掉。
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class ScanResultRecorder {

    private final MealHistoryService history;
    private final StorageService storage;

    public ScanResultPayload record(ScanImage upload, PipelineResult result) {
        String uploadKey = upload.objectKey();
        String imageKey = result.hasAnnotatedImage() ? result.annotatedImageKey() : uploadKey;

        List<FoodItem> items = result.items();
        String firstItem = items.isEmpty() ? "" : items.get(0).name();
        String originalLabel = (result.originalLabel() == null || result.originalLabel().isBlank())
                ? firstItem
                : result.originalLabel();

        Long mealId = history.append(new MealHistoryService.NewMeal(
                imageKey,
                originalLabel,
                firstItem,
                result.totals(),
                items,
                result.rawResponse()
        ));

        // meal 存進去之後才刪原圖：存失敗時原圖還在
        if (result.hasAnnotatedImage() && !result.annotatedImageKey().equals(uploadKey)) {
            try {
                storage.delete(uploadKey);
            } catch (Exception e) {
                log.warn("upload cleanup failed objectKey={}", uploadKey, e);
            }
        }

        return new ScanResultPayload(
                mealId,
                imageKey,
                UploadUrls.of(imageKey),
                result.totals(),
                items,
                result.regions(),
                result.originalLabel(),
                result.hasAnnotatedImage() ? UploadUrls.of(result.annotatedImageKey()) : null
        );
    }
}
