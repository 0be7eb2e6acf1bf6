package com.foodvision.backend.scan.job;

import com.foodvision.backend.scan.model.ScanMode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * 所有進行中 / 剛結束的 scan job。
 * <ul>
 *   <li>RUNNING：不過期、不算容量（weight=0），不會被回收</li>
 *   <li>DONE / ERROR：最後一次被讀取後 finished-ttl 才過期，觀察者還在讀就不會消失</li>
 * </ul>
 * 觀察者只拿得到 {@link ScanJobSlice} snapshot，拿不到 ScanJob 本身。
 */
@Slf4j
@Component
public class ScanJobRegistry {

    private final Cache<String, ScanJob> jobs;

    @Autowired
    public ScanJobRegistry(
            @Value("${app.scan.jobs.finished-ttl:PT10M}") Duration finishedTtl,
            @Value("${app.scan.jobs.max-finished:10000}") long maxFinished
    ) {
        this(finishedTtl, maxFinished, Ticker.systemTicker());
    }

    ScanJobRegistry(Duration finishedTtl, long maxFinished, Ticker ticker) {
        this.jobs = Caffeine.newBuilder()
                .ticker(ticker)
                .maximumWeight(maxFinished)
                .weigher((String id, ScanJob job) -> job.isFinished() ? 1 : 0)
                .expireAfter(new FinishedJobExpiry(finishedTtl))
                .build();
    }

    public String create(ScanMode mode) {
        String id = UUID.randomUUID().toString().replace("-", "");
        jobs.put(id, new ScanJob(id, mode, Instant.now()));
        log.info("scan_job status=RUNNING jobId={} mode={}", id, mode);
        return id;
    }

    /**
     * 只給背景執行的那條 thread 用（progress callback / 結束處理）。
     *
     * @return false = job 不存在或已結束
     */
    public boolean append(String jobId, ScanJobEvent event) {
        ScanJob job = jobs.getIfPresent(jobId);
        if (job == null) {
            log.warn("scan_job append to missing job jobId={} kind={}", jobId, event.kind());
            return false;
        }
        if (!job.append(event)) {
            log.warn("scan_job append after terminal ignored jobId={} kind={}", jobId, event.kind());
            return false;
        }
        if (event.isTerminal()) {
            // 重新 put：讓 weight / expiry 以 finished 狀態重算
            jobs.put(jobId, job);
            log.info("scan_job status={} jobId={} mode={} elapsedMs={}",
                    job.status(), jobId, job.mode(), Duration.between(job.createdAtUtc(), Instant.now()).toMillis());
        }
        return true;
    }

    public ScanJobSlice readFrom(String jobId, int cursor) {
        ScanJob job = jobs.getIfPresent(jobId);
        if (job == null) throw new ScanJobNotFoundException(jobId);
        return job.readFrom(cursor);
    }

    public Optional<ScanJobStatus> status(String jobId) {
        ScanJob job = jobs.getIfPresent(jobId);
        return (job == null) ? Optional.empty() : Optional.of(job.status());
    }

    public boolean exists(String jobId) {
        return jobId != null && jobs.getIfPresent(jobId) != null;
    }

    void cleanUp() {
        jobs.cleanUp();
    }

    private static final class FinishedJobExpiry implements Expiry<String, ScanJob> {

        private final long finishedTtlNanos;

        FinishedJobExpiry(Duration finishedTtl) {
            this.finishedTtlNanos = finishedTtl.toNanos();
        }

        @Override
        public long expireAfterCreate(String key, ScanJob job, long currentTime) {
            return job.isFinished() ? finishedTtlNanos : Long.MAX_VALUE;
        }

        @Override
        public long expireAfterUpdate(String key, ScanJob job, long currentTime, long currentDuration) {
            return expireAfterCreate(key, job, currentTime);
        }

        @Override
        public long expireAfterRead(String key, ScanJob job, long currentTime, long currentDuration) {
            return job.isFinished() ? finishedTtlNanos : currentDuration;
        }
    }
}
