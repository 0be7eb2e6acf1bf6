package com.foodvision.backend.scan.provider.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodvision.backend.scan.port.NutritionSource;
import com.foodvision.backend.scan.port.Segmenter;
import com.foodvision.backend.scan.port.VisionLabeler;
import com.foodvision.backend.scan.provider.DisabledSegmenter;
import com.foodvision.backend.scan.provider.HttpSegmenterClient;
import com.foodvision.backend.scan.provider.OpenRouterVisionLabeler;
import com.foodvision.backend.scan.provider.ProviderTelemetry;
import com.foodvision.backend.scan.provider.StubNutritionSource;
import com.foodvision.backend.scan.provider.StubVisionLabeler;
import com.foodvision.backend.scan.provider.UsdaNutritionSource;
import com.foodvision.backend.scan.storage.StorageService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * 每個外部依賴都是 enabled=true 才接真的，否則給 stub / disabled，
 * 同一個 port 只會有一個 Bean。
 */
@Configuration
@EnableConfigurationProperties({OpenRouterProperties.class, UsdaProperties.class, SegmenterProperties.class})
public class ProviderConfig {

    // ===== vision =====

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.openrouter", name = "enabled", havingValue = "false", matchIfMissing = true)
    public VisionLabeler stubVisionLabeler() {
        return new StubVisionLabeler();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.openrouter", name = "enabled", havingValue = "true")
    public VisionLabeler openRouterVisionLabeler(
            OpenRouterProperties props,
            ObjectMapper om,
            StorageService storage,
            ProviderTelemetry telemetry
    ) {
        // ✅ Fail-fast：啟動就抓到 key 缺失
        requireText(props.getApiKey(), "OPENROUTER_API_KEY_MISSING");
        requireText(props.getBaseUrl(), "OPENROUTER_BASE_URL_MISSING");
        requireText(props.getFastModel(), "OPENROUTER_FAST_MODEL_MISSING");
        requireText(props.getDeepModel(), "OPENROUTER_DEEP_MODEL_MISSING");

        RestClient http = restClient(props.getBaseUrl(), props.getConnectTimeout(), props.getReadTimeout());
        return new OpenRouterVisionLabeler(http, props, om, storage, telemetry);
    }

    // ===== nutrition =====

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.usda", name = "enabled", havingValue = "false", matchIfMissing = true)
    public NutritionSource stubNutritionSource() {
        return new StubNutritionSource();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.usda", name = "enabled", havingValue = "true")
    public NutritionSource usdaNutritionSource(UsdaProperties props, ObjectMapper om, ProviderTelemetry telemetry) {
        requireText(props.getApiKey(), "USDA_API_KEY_MISSING");
        requireText(props.getBaseUrl(), "USDA_BASE_URL_MISSING");

        RestClient http = restClient(props.getBaseUrl(), props.getConnectTimeout(), props.getReadTimeout());
        return new UsdaNutritionSource(http, props, om, telemetry);
    }

    // ===== segmentation =====

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.segmenter", name = "enabled", havingValue = "false", matchIfMissing = true)
    public Segmenter disabledSegmenter() {
        return new DisabledSegmenter();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.segmenter", name = "enabled", havingValue = "true")
    public Segmenter httpSegmenter(SegmenterProperties props, StorageService storage, ProviderTelemetry telemetry) {
        requireText(props.getBaseUrl(), "SEGMENTER_BASE_URL_MISSING");

        RestClient http = restClient(props.getBaseUrl(), props.getConnectTimeout(), props.getReadTimeout());
        return new HttpSegmenterClient(http, props, storage, telemetry);
    }

    static RestClient restClient(String baseUrl, Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout((int) connectTimeout.toMillis());
        f.setReadTimeout((int) readTimeout.toMillis());

        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(f)
                .build();
    }

    private static void requireText(String v, String code) {
        if (v == null || v.isBlank()) throw new IllegalStateException(code);
    }
}
