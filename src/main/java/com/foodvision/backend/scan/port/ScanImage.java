package com.foodvision.backend.scan.port;

/**
 * 指向 StorageService 裡的一張圖（上傳原圖或切割後的 crop）。
 */
public record ScanImage(String objectKey, String contentType) {

    public ScanImage {
        if (objectKey == null || objectKey.isBlank()) throw new IllegalArgumentException("IMAGE_OBJECT_KEY_MISSING");
        if (contentType == null || contentType.isBlank()) contentType = "image/jpeg";
    }
}
