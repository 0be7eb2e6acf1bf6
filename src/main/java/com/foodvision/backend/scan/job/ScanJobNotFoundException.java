package com.foodvision.backend.scan.job;

public class ScanJobNotFoundException extends RuntimeException {

    private final String jobId;

    public ScanJobNotFoundException(String jobId) {
        super("Job not found");
        this.jobId = jobId;
    }

    public String jobId() { return jobId; }
}
