package com.foodvision.backend.scan.provider.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 遠端切割服務（Grounded-SAM 之類）。
 * 介面：POST multipart image → JSON { annotated_image, crops: [{ image, bbox }] }，圖都是 base64。
 */
@ConfigurationProperties(prefix = "app.provider.segmenter")
public class SegmenterProperties {

    /** false：deep scan 上傳直接回 503 + USE_FAST_SCAN */
    private boolean enabled = false;

    private String baseUrl;

    private String path = "/segment";

    /** 有些部署放在 gateway 後面，要帶 token；空白就不送 header */
    private String apiKey;

    private Duration connectTimeout = Duration.ofSeconds(5);

    /** 冷啟動的 GPU space 很慢 */
    private Duration readTimeout = Duration.ofSeconds(90);

    /** 送出前縮圖 */
    private int maxSide = 800;
    private float jpegQuality = 0.85f;

    // ===== getters/setters =====
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getReadTimeout() { return readTimeout; }
    public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }

    public int getMaxSide() { return maxSide; }
    public void setMaxSide(int maxSide) { this.maxSide = maxSide; }

    public float getJpegQuality() { return jpegQuality; }
    public void setJpegQuality(float jpegQuality) { this.jpegQuality = jpegQuality; }
}
