package com.foodvision.backend.scan.job;

/** 單向：RUNNING → DONE | ERROR，之後不再變 */
public enum ScanJobStatus {
    RUNNING,
    DONE,
    ERROR;

    public boolean isFinished() {
        return this != RUNNING;
    }
}
