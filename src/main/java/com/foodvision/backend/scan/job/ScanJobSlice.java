package com.foodvision.backend.scan.job;

import java.util.List;

/**
 * readFrom 的回傳：events 是 snapshot（不可變），下次從 nextCursor 繼續讀。
 */
public record ScanJobSlice(List<ScanJobEvent> events, int nextCursor, ScanJobStatus status) {

    public ScanJobSlice {
        events = (events == null) ? List.of() : List.copyOf(events);
    }

    public boolean finished() {
        return status != null && status.isFinished();
    }
}
