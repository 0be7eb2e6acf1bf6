package com.foodvision.backend.scan.controller;

import com.foodvision.backend.scan.storage.StorageService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.InputStream;
import java.util.concurrent.TimeUnit;

@Tag(name = "ScanImage", description = "Stored upload / annotated images")
@RequiredArgsConstructor
@RestController
public class ScanImageController {

    private final StorageService storage;

    @GetMapping("/api/uploads/{name:.+}")
    public ResponseEntity<StreamingResponseBody> image(@PathVariable("name") String name) throws Exception {
        // 找不到 → FileNotFoundException → 404；路徑跳脫 → SecurityException → 400
        StorageService.OpenResult opened = storage.open(name);

        StreamingResponseBody body = outputStream -> {
            try (InputStream in = opened.inputStream()) {
                byte[] buf = new byte[8192];
                int n;
                while ((n = in.read(buf)) >= 0) {
                    outputStream.write(buf, 0, n);
                }
            }
        };

        HttpHeaders headers = new HttpHeaders();
        String ct = (opened.contentType() == null || opened.contentType().isBlank())
                ? MediaType.APPLICATION_OCTET_STREAM_VALUE
                : opened.contentType();
        headers.set(HttpHeaders.CONTENT_TYPE, ct);
        headers.setCacheControl(CacheControl.maxAge(60, TimeUnit.SECONDS).cachePrivate());
        if (opened.sizeBytes() > 0) headers.setContentLength(opened.sizeBytes());

        return ResponseEntity.ok()
                .headers(headers)
                .body(body);
    }
}
