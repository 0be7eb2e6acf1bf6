package com.foodvision.backend.scan.port;

/**
 * Deep scan 的切割服務不可用。
 * 跟一般錯誤分開，前端才能提示「改用 Fast Scan」。
 */
public class SegmentationUnavailableException extends RuntimeException {

    public static final String USER_MESSAGE = "Deep Scan engine is currently unavailable. Please use Fast Scan.";

    public SegmentationUnavailableException(String message) {
        super(message);
    }

    public SegmentationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
