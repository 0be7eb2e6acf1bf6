package com.foodvision.backend.scan.port;

import com.foodvision.backend.scan.model.ScanMode;

import java.util.Locale;

/**
 * 圖 → 食物名稱（逗號分隔），或 {@link #NON_FOOD}。
 * <p>
 * 實作不可以往外丟例外：內部失敗一律回 NON_FOOD（辨識失敗 = 沒有食物，不讓 job 失敗）。
 */
public interface VisionLabeler {

    String NON_FOOD = "NON_FOOD";

    /**
     * @param modelHint FAST 用整圖模型，DEEP 用 crop 模型
     */
    String label(ScanImage image, ScanMode modelHint);

    static boolean isNonFood(String label) {
        return label == null || label.toUpperCase(Locale.ROOT).contains(NON_FOOD);
    }
}
