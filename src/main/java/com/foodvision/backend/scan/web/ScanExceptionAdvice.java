package com.foodvision.backend.scan.web;

import com.foodvision.backend.common.web.RequestIdFilter;
import com.foodvision.backend.scan.controller.MealHistoryController;
import com.foodvision.backend.scan.controller.ScanController;
import com.foodvision.backend.scan.controller.ScanImageController;
import com.foodvision.backend.scan.controller.ScanProgressController;
import com.foodvision.backend.scan.dto.ScanErrorResponse;
import com.foodvision.backend.scan.job.ScanJobNotFoundException;
import com.foodvision.backend.scan.port.SegmentationUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.io.FileNotFoundException;

@Slf4j
@RestControllerAdvice(assignableTypes = {
        ScanController.class,
        ScanProgressController.class,
        MealHistoryController.class,
        ScanImageController.class
})
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ScanExceptionAdvice {

    public static final String USE_FAST_SCAN = "USE_FAST_SCAN";

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ScanErrorResponse> handleIllegalArg(IllegalArgumentException e, HttpServletRequest req) {
        String code = norm(e.getMessage(), "BAD_REQUEST");
        HttpStatus status = switch (code) {
            case "MEAL_NOT_FOUND" -> HttpStatus.NOT_FOUND;

            case "FILE_REQUIRED",
                 "FILE_TOO_LARGE",
                 "FILE_MUST_BE_IMAGE",
                 "UNSUPPORTED_IMAGE_FORMAT",
                 "NEW_LABEL_REQUIRED",
                 "LIMIT_TOO_LARGE" -> HttpStatus.BAD_REQUEST;

            default -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status).body(err(code, e, req));
    }

    @ExceptionHandler(ScanJobNotFoundException.class)
    public ResponseEntity<ScanErrorResponse> handleJobNotFound(ScanJobNotFoundException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(err("JOB_NOT_FOUND", e, req));
    }

    /** deep scan 不可用：固定訊息 + 前端改 fast scan */
    @ExceptionHandler(SegmentationUnavailableException.class)
    public ResponseEntity<ScanErrorResponse> handleSegmentationUnavailable(
            SegmentationUnavailableException e, HttpServletRequest req
    ) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ScanErrorResponse(
                        "DEEP_SCAN_UNAVAILABLE",
                        SegmentationUnavailableException.USER_MESSAGE,
                        rid(req),
                        USE_FAST_SCAN
                ));
    }

    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<ScanErrorResponse> handleRejected(TaskRejectedException e, HttpServletRequest req) {
        log.warn("scan executor saturated uri={}", req.getRequestURI());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, "5")
                .body(new ScanErrorResponse("SCAN_QUEUE_FULL", "SCAN_QUEUE_FULL", rid(req), "RETRY_LATER"));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ScanErrorResponse> handleTooLarge(MaxUploadSizeExceededException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ScanErrorResponse("FILE_TOO_LARGE", "FILE_TOO_LARGE", rid(req), null));
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ScanErrorResponse> handleMissingPart(MissingServletRequestPartException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ScanErrorResponse("FILE_REQUIRED", "FILE_REQUIRED", rid(req), null));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ScanErrorResponse> handleInvalid(Exception e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(err("VALIDATION_FAILED", e, req));
    }

    @ExceptionHandler(FileNotFoundException.class)
    public ResponseEntity<ScanErrorResponse> handleNotFound(FileNotFoundException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(err("OBJECT_NOT_FOUND", e, req));
    }

    @ExceptionHandler(SecurityException.class)
    public ResponseEntity<ScanErrorResponse> handleSecurity(SecurityException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(err("INVALID_OBJECT_KEY", e, req));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ScanErrorResponse> handleUnknown(Exception e, HttpServletRequest req) {
        log.error("unhandled error uri={}", req.getRequestURI(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(err("INTERNAL_ERROR", e, req));
    }

    // ===== helpers =====

    private static ScanErrorResponse err(String code, Throwable e, HttpServletRequest req) {
        return new ScanErrorResponse(code, safeMsgOrCode(e, code), rid(req), null);
    }

    private static String rid(HttpServletRequest req) {
        return RequestIdFilter.getOrCreate(req);
    }

    private static String norm(String msg, String fallback) {
        if (msg == null) return fallback;
        String c = msg.trim();
        return c.isEmpty() ? fallback : c;
    }

    private static String safeMsgOrCode(Throwable t, String code) {
        String m = t.getMessage();
        if (m == null || m.isBlank()) return code;
        return m;
    }
}
