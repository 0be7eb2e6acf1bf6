package com.foodvision.backend.scan.service;

import com.foodvision.backend.scan.config.ScanProperties;
import com.foodvision.backend.scan.image.ImageSniffer;
import com.foodvision.backend.scan.job.ScanJobService;
import com.foodvision.backend.scan.model.ScanMode;
import com.foodvision.backend.scan.port.ScanImage;
import com.foodvision.backend.scan.port.SegmentationUnavailableException;
import com.foodvision.backend.scan.port.Segmenter;
import com.foodvision.backend.scan.storage.StorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.InputStream;
import java.io.PushbackInputStream;
import java.util.Locale;
import java.util.UUID;

/**
 * 上傳入口：驗證 → 存檔 → 建 job → 回 jobId。
 * <p>
 * 驗證順序：空檔 → 大小 → content-type → deep scan 可用性 → magic bytes。
 */
@Slf4j
@Service
public class ScanUploadService {

    private final StorageService storage;
    private final ScanJobService jobs;
    private final Segmenter segmenter;
    private final ScanProperties props;

    public ScanUploadService(StorageService storage, ScanJobService jobs, Segmenter segmenter, ScanProperties props) {
        this.storage = storage;
        this.jobs = jobs;
        this.segmenter = segmenter;
        this.props = props;
    }

    public String upload(MultipartFile file, String scanModeRaw) throws Exception {
        if (file == null || file.isEmpty()) throw new IllegalArgumentException("FILE_REQUIRED");
        if (file.getSize() > props.getUpload().getMaxBytes()) throw new IllegalArgumentException("FILE_TOO_LARGE");

        String ct = file.getContentType();
        if (ct == null || !ct.toLowerCase(Locale.ROOT).startsWith("image/")) {
            throw new IllegalArgumentException("FILE_MUST_BE_IMAGE");
        }

        ScanMode mode = ScanMode.parseOrFast(scanModeRaw);

        // ✅ deep scan 沒有切割服務：存檔前就擋，不留孤兒檔
        if (mode == ScanMode.DEEP && !segmenter.isAvailable()) {
            throw new SegmentationUnavailableException(SegmentationUnavailableException.USER_MESSAGE);
        }

        ScanImage image = save(file);

        try {
            String jobId = jobs.submit(image, mode);
            log.info("scan_upload accepted jobId={} mode={} objectKey={} sizeBytes={}",
                    jobId, mode, image.objectKey(), file.getSize());
            return jobId;
        } catch (TaskRejectedException e) {
            deleteQuietly(image.objectKey());
            throw e;
        }
    }

    private ScanImage save(MultipartFile file) throws Exception {
        try (PushbackInputStream in = new PushbackInputStream(file.getInputStream(), ImageSniffer.HEAD_BYTES)) {
            ImageSniffer.ImageType type = ImageSniffer.detect(in);
            if (type == null) throw new IllegalArgumentException("UNSUPPORTED_IMAGE_FORMAT");

            String objectKey = UUID.randomUUID().toString().replace("-", "") + type.ext();
            storage.save(objectKey, (InputStream) in, type.contentType());
            return new ScanImage(objectKey, type.contentType());
        }
    }

    private void deleteQuietly(String objectKey) {
        try {
            storage.delete(objectKey);
        } catch (Exception e) {
            log.warn("upload cleanup failed objectKey={}", objectKey, e);
        }
    }
}
