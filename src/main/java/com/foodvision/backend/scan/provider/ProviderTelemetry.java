package com.foodvision.backend.scan.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 外部呼叫（vision / 營養 / 切割）統一一行 log，方便 grep latency 跟錯誤碼。
 */
@Slf4j
@Service
public class ProviderTelemetry {

    public void ok(String provider, String modelId, String subject, long latencyMs) {
        log.info("provider_call status=OK provider={} modelId={} subject={} latencyMs={}",
                safe(provider), safe(modelId), safe(subject), latencyMs);
    }

    public void fail(String provider, String modelId, String subject, long latencyMs, String errorCode) {
        log.warn("provider_call status=FAIL provider={} modelId={} subject={} latencyMs={} errorCode={}",
                safe(provider), safe(modelId), safe(subject), latencyMs, safe(errorCode));
    }

    public static long msSince(long t0Nanos) {
        return (System.nanoTime() - t0Nanos) / 1_000_000L;
    }

    private static String safe(String s) { return (s == null || s.isBlank()) ? "UNKNOWN" : s; }
}
