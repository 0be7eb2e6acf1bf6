package com.foodvision.backend.scan.provider.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.provider.openrouter")
public class OpenRouterProperties {

    /** 開關：沒 key 的環境一律走 stub（辨識結果永遠是 NON_FOOD） */
    private boolean enabled = false;

    private String baseUrl = "https://openrouter.ai/api/v1";

    /** 用環境變數帶入：OPENROUTER_API_KEY */
    private String apiKey;

    /** Fast scan 整張圖用 */
    private String fastModel = "openai/gpt-4o";

    /** Deep scan 每個 crop 用（便宜、量大） */
    private String deepModel = "qwen/qwen-vl-plus";

    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(30);

    /** 只要一行逗號分隔名稱，64 夠用 */
    private int maxTokens = 64;

    private double temperature = 0.1;

    // ===== getters/setters =====
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public String getFastModel() { return fastModel; }
    public void setFastModel(String fastModel) { this.fastModel = fastModel; }

    public String getDeepModel() { return deepModel; }
    public void setDeepModel(String deepModel) { this.deepModel = deepModel; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getReadTimeout() { return readTimeout; }
    public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }

    public int getMaxTokens() { return maxTokens; }
    public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

    public double getTemperature() { return temperature; }
    public void setTemperature(double temperature) { this.temperature = temperature; }
}
