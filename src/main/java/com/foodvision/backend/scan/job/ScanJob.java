package com.foodvision.backend.scan.job;

import com.foodvision.backend.scan.model.ScanMode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 一個 job 的 append-only event log。
 * 只有 registry 拿得到這個物件；append / readFrom 都在同一把鎖底下，觀察者看到的一定是 append 順序。
 */
final class ScanJob {

    private final String id;
    private final ScanMode mode;
    private final Instant createdAtUtc;

    private final List<ScanJobEvent> events = new ArrayList<>();
    private ScanJobStatus status = ScanJobStatus.RUNNING;

    ScanJob(String id, ScanMode mode, Instant createdAtUtc) {
        this.id = id;
        this.mode = mode;
        this.createdAtUtc = createdAtUtc;
    }

    String id() { return id; }
    ScanMode mode() { return mode; }
    Instant createdAtUtc() { return createdAtUtc; }

    /**
     * @return false = job 已結束，event 被丟掉
     */
    synchronized boolean append(ScanJobEvent event) {
        if (status.isFinished()) return false;
        events.add(event);
        if (event.kind() == ScanJobEvent.Kind.RESULT) status = ScanJobStatus.DONE;
        else if (event.kind() == ScanJobEvent.Kind.ERROR) status = ScanJobStatus.ERROR;
        return true;
    }

    synchronized ScanJobSlice readFrom(int cursor) {
        int from = Math.max(0, cursor);
        int size = events.size();
        if (from >= size) return new ScanJobSlice(List.of(), Math.max(from, size), status);
        return new ScanJobSlice(new ArrayList<>(events.subList(from, size)), size, status);
    }

    synchronized ScanJobStatus status() {
        return status;
    }

    synchronized boolean isFinished() {
        return status.isFinished();
    }
}
