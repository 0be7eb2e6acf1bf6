package com.foodvision.backend.scan.job;

import com.foodvision.backend.scan.dto.ScanResultPayload;
import com.foodvision.backend.scan.model.ScanMode;
import com.foodvision.backend.scan.pipeline.PipelineResult;
import com.foodvision.backend.scan.pipeline.ScanPipeline;
import com.foodvision.backend.scan.port.ScanImage;
import com.foodvision.backend.scan.port.SegmentationUnavailableException;
import com.foodvision.backend.scan.service.ScanResultRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 一個 job 的背景執行：pipeline → 存 meal → 一個 terminal event。
 * 不論成功失敗，結尾一定剛好 append 一個 RESULT 或 ERROR。
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class ScanJobRunner {

    static final String ABORTED_MESSAGE = "Scan aborted due to an internal error";

    private final ScanJobRegistry registry;
    private final ScanPipeline pipeline;
    private final ScanResultRecorder recorder;

    public void run(String jobId, ScanImage image, ScanMode mode) {
        try {
            PipelineResult result = pipeline.run(image, mode,
                    (stage, percent) -> registry.append(jobId, ScanJobEvent.progress(stage, percent)));

            ScanResultPayload payload = recorder.record(image, result);
            registry.append(jobId, ScanJobEvent.result(payload));

        } catch (SegmentationUnavailableException e) {
            log.warn("scan_job segmentation unavailable jobId={} reason={}", jobId, e.getMessage());
            registry.append(jobId, ScanJobEvent.error(SegmentationUnavailableException.USER_MESSAGE));

        } catch (Exception e) {
            log.warn("scan_job failed jobId={} mode={}", jobId, mode, e);
            registry.append(jobId, ScanJobEvent.error(safeMsg(e)));

        } finally {
            // Error（例如 OOM）不會進上面的 catch：還是要收尾，不然 job 永遠 RUNNING 也不會被清掉
            if (registry.status(jobId).filter(s -> !s.isFinished()).isPresent()) {
                log.error("scan_job aborted without terminal event jobId={} mode={}", jobId, mode);
                registry.append(jobId, ScanJobEvent.error(ABORTED_MESSAGE));
            }
        }
    }

    private static String safeMsg(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }
}
