package com.foodvision.backend.scan.model;

import java.util.Locale;

/**
 * FAST：整張圖打一次 vision model。
 * DEEP：先切割 (segment) 再逐塊辨識。
 */
public enum ScanMode {
    FAST,
    DEEP;

    /** 不認得的值一律當 FAST（跟前端舊行為一致） */
    public static ScanMode parseOrFast(String raw) {
        if (raw == null || raw.isBlank()) return FAST;
        String v = raw.trim().toUpperCase(Locale.ROOT);
        return "DEEP".equals(v) ? DEEP : FAST;
    }
}
