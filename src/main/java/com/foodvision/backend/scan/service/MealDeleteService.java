package com.foodvision.backend.scan.service;

import com.foodvision.backend.scan.storage.StorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 刪 DB 紀錄後再刪圖檔；圖檔刪不掉只記 log（紀錄已經沒了，不回滾）。
 */
@Slf4j
@Service
public class MealDeleteService {

    private final MealHistoryService history;
    private final StorageService storage;

    public MealDeleteService(MealHistoryService history, StorageService storage) {
        this.history = history;
        this.storage = storage;
    }

    public void delete(Long mealId) {
        List<String> keys = history.delete(mealId);
        int removed = deleteImages(keys);
        log.info("meal_delete mealId={} imagesRemoved={}", mealId, removed);
    }

    public void clear() {
        List<String> keys = history.clear();
        int removed = deleteImages(keys);
        log.info("meal_clear images={} imagesRemoved={}", keys.size(), removed);
    }

    private int deleteImages(List<String> keys) {
        int removed = 0;
        for (String k : keys) {
            try {
                if (storage.delete(k)) removed++;
            } catch (Exception e) {
                log.warn("meal image delete failed objectKey={}", k, e);
            }
        }
        return removed;
    }
}
