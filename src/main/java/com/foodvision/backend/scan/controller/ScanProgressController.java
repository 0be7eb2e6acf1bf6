package com.foodvision.backend.scan.controller;

import com.foodvision.backend.scan.config.ScanProperties;
import com.foodvision.backend.scan.dto.JobEventsResponse;
import com.foodvision.backend.scan.job.ScanJobEvent;
import com.foodvision.backend.scan.job.ScanJobNotFoundException;
import com.foodvision.backend.scan.job.ScanJobService;
import com.foodvision.backend.scan.job.ScanJobSlice;
import com.foodvision.backend.scan.web.ScanEventWire;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;

/**
 * 觀察 job 進度。兩種：
 * - SSE：server 端輪詢 event log 往下推，最多等 progress.timeout
 * - pull：前端自己帶 cursor 來拿
 * 觀察者斷線 / 逾時都不影響 job 本身。
 */
@Slf4j
@Tag(name = "ScanProgress", description = "Scan job progress (SSE / cursor pull)")
@RestController
@RequestMapping("/api/jobs")
public class ScanProgressController {

    private final ScanJobService jobs;
    private final ScanEventWire wire;
    private final ScanProperties props;
    private final TaskExecutor progressStreamExecutor;

    public ScanProgressController(
            ScanJobService jobs,
            ScanEventWire wire,
            ScanProperties props,
            @Qualifier("progressStreamExecutor") TaskExecutor progressStreamExecutor
    ) {
        this.jobs = jobs;
        this.wire = wire;
        this.props = props;
        this.progressStreamExecutor = progressStreamExecutor;
    }

    @GetMapping("/{jobId}/progress")
    public SseEmitter progress(@PathVariable("jobId") String jobId, HttpServletResponse resp) {
        // 先確認存在：不存在要回 404，不是開一條空的 stream
        jobs.poll(jobId, 0);

        resp.setHeader("Cache-Control", "no-store");
        resp.setHeader("X-Accel-Buffering", "no");

        long timeoutMs = props.getProgress().getTimeout().toMillis();
        // emitter 自己的 timeout 留一點緩衝，讓 "Request timed out" 有機會送出去
        SseEmitter emitter = new SseEmitter(timeoutMs + 5_000L);

        progressStreamExecutor.execute(() -> stream(jobId, emitter));
        return emitter;
    }

    @GetMapping("/{jobId}/events")
    public JobEventsResponse events(
            @PathVariable("jobId") String jobId,
            @RequestParam(value = "cursor", defaultValue = "0") int cursor
    ) {
        ScanJobSlice slice = jobs.poll(jobId, cursor);
        return new JobEventsResponse(
                wire.toWire(slice.events()),
                slice.nextCursor(),
                slice.status().name().toLowerCase(Locale.ROOT)
        );
    }

    void stream(String jobId, SseEmitter emitter) {
        long pollMs = Math.max(10L, props.getProgress().getPollInterval().toMillis());
        long deadline = System.nanoTime() + props.getProgress().getTimeout().toNanos();
        int cursor = 0;

        try {
            while (System.nanoTime() < deadline) {
                Thread.sleep(pollMs);

                ScanJobSlice slice;
                try {
                    slice = jobs.poll(jobId, cursor);
                } catch (ScanJobNotFoundException gone) {
                    // job 被回收：當作逾時收尾
                    log.debug("scan_progress job gone jobId={}", jobId);
                    break;
                }

                for (ScanJobEvent ev : slice.events()) {
                    send(emitter, wire.toWire(ev));
                    if (ev.isTerminal()) {
                        emitter.complete();
                        return;
                    }
                }
                cursor = slice.nextCursor();
                if (slice.finished()) break;
            }

            log.info("scan_progress observer timeout jobId={} cursor={}", jobId, cursor);
            send(emitter, ScanEventWire.timedOut());
            emitter.complete();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            emitter.completeWithError(e);
        } catch (IOException | IllegalStateException e) {
            // client 斷線；job 照跑，只結束這條 stream
            log.debug("scan_progress client disconnected jobId={} err={}", jobId, e.toString());
            emitter.completeWithError(e);
        }
    }

    private static void send(SseEmitter emitter, Map<String, Object> data) throws IOException {
        emitter.send(SseEmitter.event().data(data, MediaType.APPLICATION_JSON));
    }
}
