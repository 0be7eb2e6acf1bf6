package com.foodvision.backend.scan.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.foodvision.backend.scan.image.ImageDownscaler;
import com.foodvision.backend.scan.image.ImageSniffer;
import com.foodvision.backend.scan.model.Region;
import com.foodvision.backend.scan.port.ScanImage;
import com.foodvision.backend.scan.port.Segmentation;
import com.foodvision.backend.scan.port.SegmentationUnavailableException;
import com.foodvision.backend.scan.port.Segmenter;
import com.foodvision.backend.scan.provider.config.SegmenterProperties;
import com.foodvision.backend.scan.storage.StorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

import static com.foodvision.backend.scan.provider.ProviderTelemetry.msSince;

/**
 * 遠端切割服務 client。
 * <p>
 * 流程：讀原圖 → 縮成 JPEG → multipart 上傳 → 解 base64 的標註圖與 crops → 存進 StorageService。
 * 任何一步失敗都轉成 {@link SegmentationUnavailableException}，已經存下的檔案會清掉。
 */
@Slf4j
public class HttpSegmenterClient implements Segmenter {

    private static final String PROVIDER = "SEGMENTER";

    private final RestClient http;
    private final SegmenterProperties props;
    private final StorageService storage;
    private final ProviderTelemetry telemetry;

    public HttpSegmenterClient(
            RestClient http,
            SegmenterProperties props,
            StorageService storage,
            ProviderTelemetry telemetry
    ) {
        this.http = http;
        this.props = props;
        this.storage = storage;
        this.telemetry = telemetry;
    }

    @Override
    public boolean isAvailable() {
        String base = props.getBaseUrl();
        return props.isEnabled() && base != null && !base.isBlank();
    }

    @Override
    public Segmentation segment(ScanImage image) {
        long t0 = System.nanoTime();
        List<String> written = new ArrayList<>();
        try {
            byte[] original = storage.readAllBytes(image.objectKey());
            byte[] jpeg = ImageDownscaler.toJpeg(original, props.getMaxSide(), props.getJpegQuality());

            JsonNode resp = callSegment(jpeg);
            Segmentation seg = store(image.objectKey(), resp, written);

            telemetry.ok(PROVIDER, props.getPath(), image.objectKey(), msSince(t0));
            log.info("segmentation done objectKey={} crops={}", image.objectKey(), seg.crops().size());
            return seg;
        } catch (Exception e) {
            telemetry.fail(PROVIDER, props.getPath(), image.objectKey(), msSince(t0), ProviderErrorMapper.code(e));
            log.warn("segmentation failed objectKey={} err={}", image.objectKey(), ProviderErrorMapper.safeMsg(e));
            discard(written);
            throw new SegmentationUnavailableException(SegmentationUnavailableException.USER_MESSAGE, e);
        }
    }

    private JsonNode callSegment(byte[] jpeg) {
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();

        ByteArrayResource file = new ByteArrayResource(jpeg) {
            @Override public String getFilename() { return "upload.jpg"; }
        };
        body.add("image", file);

        RestClient.RequestBodySpec req = http.post()
                .uri(props.getPath())
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .accept(MediaType.APPLICATION_JSON);

        String k = props.getApiKey();
        if (k != null && !k.isBlank()) req = req.header(HttpHeaders.AUTHORIZATION, "Bearer " + k.trim());

        JsonNode resp = req.body(body).retrieve().body(JsonNode.class);
        if (resp == null || resp.isNull()) throw new IllegalStateException("PROVIDER_EMPTY_RESPONSE");
        return resp;
    }

    private Segmentation store(String sourceKey, JsonNode resp, List<String> written) throws Exception {
        String stem = stemOf(sourceKey);

        // 沒有標註圖 = 遠端生成失敗，視為服務不可用
        byte[] annotated = decode(resp.path("annotated_image").asText(null));
        if (annotated == null) throw new IllegalStateException("PROVIDER_ANNOTATED_IMAGE_MISSING");

        String annotatedKey = "annotated_" + stem + "_" + hex(8) + extOf(annotated, ".png");
        storage.save(annotatedKey, annotated, contentTypeOf(annotated));
        written.add(annotatedKey);

        List<ScanImage> crops = new ArrayList<>();
        List<Region> regions = new ArrayList<>();

        int i = 0;
        for (JsonNode c : resp.path("crops")) {
            byte[] bytes = decode(c.path("image").asText(null));
            if (bytes == null) continue;

            String key = "crop_" + stem + "_" + i + "_" + hex(6) + extOf(bytes, ".png");
            storage.save(key, bytes, contentTypeOf(bytes));
            written.add(key);
            crops.add(new ScanImage(key, contentTypeOf(bytes)));
            i++;

            JsonNode bbox = c.path("bbox");
            if (bbox.isArray() && bbox.size() == 4) {
                List<Double> box = new ArrayList<>(4);
                for (JsonNode v : bbox) box.add(v.asDouble());
                regions.add(new Region(box));
            }
        }

        return new Segmentation(annotatedKey, crops, regions);
    }

    private void discard(List<String> keys) {
        for (String k : keys) {
            try {
                storage.delete(k);
            } catch (Exception e) {
                log.warn("segmentation cleanup failed objectKey={}", k, e);
            }
        }
    }

    private static byte[] decode(String b64) {
        if (b64 == null || b64.isBlank()) return null;
        String s = b64.trim();
        // 容忍 data URL
        int comma = s.startsWith("data:") ? s.indexOf(',') : -1;
        if (comma >= 0) s = s.substring(comma + 1);
        byte[] out = Base64.getMimeDecoder().decode(s);
        return out.length == 0 ? null : out;
    }

    private static String extOf(byte[] bytes, String fallback) {
        ImageSniffer.ImageType t = ImageSniffer.detect(bytes, bytes.length);
        return t == null ? fallback : t.ext();
    }

    private static String contentTypeOf(byte[] bytes) {
        ImageSniffer.ImageType t = ImageSniffer.detect(bytes, bytes.length);
        return t == null ? "image/png" : t.contentType();
    }

    private static String stemOf(String objectKey) {
        String name = objectKey;
        int slash = name.lastIndexOf('/');
        if (slash >= 0) name = name.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String hex(int n) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, n);
    }
}
