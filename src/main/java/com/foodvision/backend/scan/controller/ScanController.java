package com.foodvision.backend.scan.controller;

import com.foodvision.backend.scan.dto.UploadResponse;
import com.foodvision.backend.scan.service.ScanUploadService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@Tag(name = "Scan", description = "Photo upload → async scan job")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api")
public class ScanController {

    private final ScanUploadService uploadService;

    /**
     * 立刻回 jobId，結果從 /api/jobs/{jobId}/progress（SSE）或 /events 拿。
     * scan_mode：fast | deep，其他值一律當 fast。
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public UploadResponse upload(
            @RequestPart("file") MultipartFile file,
            @RequestParam(value = "scan_mode", required = false, defaultValue = "fast") String scanMode
    ) throws Exception {
        return new UploadResponse(uploadService.upload(file, scanMode));
    }
}
