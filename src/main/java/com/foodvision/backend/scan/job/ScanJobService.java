package com.foodvision.backend.scan.job;

import com.foodvision.backend.common.web.RequestIdFilter;
import com.foodvision.backend.scan.model.ScanMode;
import com.foodvision.backend.scan.port.ScanImage;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * submit：建 job → 丟到 scanJobExecutor → 立刻回 jobId（呼叫端不等）。
 * 沒有取消；觀察者斷線也不影響背景執行。
 */
@Slf4j
@Service
public class ScanJobService {

    public static final String MDC_JOB_ID = "jobId";

    private final ScanJobRegistry registry;
    private final ScanJobRunner runner;
    private final TaskExecutor scanJobExecutor;

    public ScanJobService(
            ScanJobRegistry registry,
            ScanJobRunner runner,
            @Qualifier("scanJobExecutor") TaskExecutor scanJobExecutor
    ) {
        this.registry = registry;
        this.runner = runner;
        this.scanJobExecutor = scanJobExecutor;
    }

    public String submit(ScanImage image, ScanMode mode) {
        String jobId = registry.create(mode);
        String rid = RequestIdFilter.currentOrNull();

        try {
            scanJobExecutor.execute(() -> {
                // 背景 thread 沿用上傳那個 request 的 rid，log 才串得起來
                if (rid != null) MDC.put(RequestIdFilter.MDC_KEY, rid);
                MDC.put(MDC_JOB_ID, jobId);
                try {
                    runner.run(jobId, image, mode);
                } finally {
                    MDC.remove(MDC_JOB_ID);
                    MDC.remove(RequestIdFilter.MDC_KEY);
                }
            });
        } catch (TaskRejectedException e) {
            // queue 滿：job 直接結束，避免有人一直等一個永遠不會跑的 job
            registry.append(jobId, ScanJobEvent.error("SCAN_QUEUE_FULL"));
            throw e;
        }
        return jobId;
    }

    public ScanJobSlice poll(String jobId, int cursor) {
        return registry.readFrom(jobId, cursor);
    }
}
