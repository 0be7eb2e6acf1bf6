package com.foodvision.backend.scan.provider;

import com.foodvision.backend.scan.port.Segmenter;
import com.foodvision.backend.scan.provider.config.OpenRouterProperties;
import com.foodvision.backend.scan.provider.config.UsdaProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * 啟動自檢（不打外網）：
 * - vision / nutrition 關閉 → 還是 UP，但每次掃描都會是空結果，detail 標出來
 * - deep scan 不可用 → UP，detail deepScan=UNAVAILABLE（fast scan 照常）
 * <p>
 * 不輸出任何 apiKey。
 */
@Component
public class ScanProvidersHealthIndicator implements HealthIndicator {

    private final OpenRouterProperties openRouter;
    private final UsdaProperties usda;
    private final Segmenter segmenter;

    public ScanProvidersHealthIndicator(OpenRouterProperties openRouter, UsdaProperties usda, Segmenter segmenter) {
        this.openRouter = openRouter;
        this.usda = usda;
        this.segmenter = segmenter;
    }

    @Override
    public Health health() {
        return Health.up()
                .withDetail("vision", openRouter.isEnabled() ? "OPENROUTER" : "DISABLED")
                .withDetail("fastModel", openRouter.getFastModel())
                .withDetail("deepModel", openRouter.getDeepModel())
                .withDetail("nutrition", usda.isEnabled() ? "USDA" : "DISABLED")
                .withDetail("deepScan", segmenter.isAvailable() ? "AVAILABLE" : "UNAVAILABLE")
                .build();
    }
}
