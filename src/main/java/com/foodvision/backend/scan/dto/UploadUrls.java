package com.foodvision.backend.scan.dto;

/** objectKey → 前端可直接 GET 的路徑（對應 ScanImageController） */
public final class UploadUrls {
    private UploadUrls() {}

    public static final String PREFIX = "/api/uploads/";

    public static String of(String objectKey) {
        if (objectKey == null || objectKey.isBlank()) return null;
        int slash = objectKey.lastIndexOf('/');
        return PREFIX + (slash >= 0 ? objectKey.substring(slash + 1) : objectKey);
    }
}
