package com.foodvision.backend.scan.job;

import com.foodvision.backend.scan.dto.ScanResultPayload;

/**
 * job event log 的一筆：
 * - PROGRESS：stage + progress(0..100)
 * - RESULT：上傳結果 payload
 * - ERROR：給使用者看的訊息
 */
public record ScanJobEvent(
        Kind kind,
        String stage,
        Integer progress,
        ScanResultPayload result,
        String message
) {
    public enum Kind {
        PROGRESS,
        RESULT,
        ERROR;

        public boolean isTerminal() {
            return this != PROGRESS;
        }
    }

    public static ScanJobEvent progress(String stage, int percent) {
        int p = Math.max(0, Math.min(100, percent));
        return new ScanJobEvent(Kind.PROGRESS, stage, p, null, null);
    }

    public static ScanJobEvent result(ScanResultPayload payload) {
        if (payload == null) throw new IllegalArgumentException("RESULT_PAYLOAD_REQUIRED");
        return new ScanJobEvent(Kind.RESULT, null, null, payload, null);
    }

    public static ScanJobEvent error(String message) {
        return new ScanJobEvent(Kind.ERROR, null, null, null, message);
    }

    public boolean isTerminal() {
        return kind.isTerminal();
    }
}
