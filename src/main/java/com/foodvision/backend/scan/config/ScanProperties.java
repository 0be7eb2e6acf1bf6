package com.foodvision.backend.scan.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.scan")
public class ScanProperties {

    private final Upload upload = new Upload();
    private final Progress progress = new Progress();

    public Upload getUpload() { return upload; }
    public Progress getProgress() { return progress; }

    public static class Upload {
        /** 上傳大小上限（bytes），超過回 FILE_TOO_LARGE */
        private long maxBytes = 10L * 1024 * 1024;

        public long getMaxBytes() { return maxBytes; }
        public void setMaxBytes(long maxBytes) { this.maxBytes = maxBytes; }
    }

    public static class Progress {
        /** SSE 觀察者最多等多久；到了送 "Request timed out"，job 本身照跑 */
        private Duration timeout = Duration.ofSeconds(150);

        /** 多久看一次 event log */
        private Duration pollInterval = Duration.ofMillis(200);

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    }
}
