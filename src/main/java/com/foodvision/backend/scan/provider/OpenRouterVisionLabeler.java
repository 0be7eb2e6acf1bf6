package com.foodvision.backend.scan.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.foodvision.backend.scan.model.ScanMode;
import com.foodvision.backend.scan.port.ScanImage;
import com.foodvision.backend.scan.port.VisionLabeler;
import com.foodvision.backend.scan.provider.config.OpenRouterProperties;
import com.foodvision.backend.scan.storage.StorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.Base64;

import static com.foodvision.backend.scan.provider.ProviderTelemetry.msSince;

/**
 * OpenAI 相容的 /chat/completions（OpenRouter）。
 * 任何失敗（HTTP、timeout、空回應）都回 NON_FOOD，不往外丟。
 */
@Slf4j
public class OpenRouterVisionLabeler implements VisionLabeler {

    static final String PROMPT =
            "Identify the edible food in this image. Reply ONLY with a comma-separated list of the core food items "
            + "(e.g., 'burger, french fries, soda'). If there is absolutely no edible food in the image, "
            + "reply EXACTLY with 'NON_FOOD'.";

    private static final String PROVIDER = "OPENROUTER";

    private final RestClient http;
    private final OpenRouterProperties props;
    private final ObjectMapper om;
    private final StorageService storage;
    private final ProviderTelemetry telemetry;

    public OpenRouterVisionLabeler(
            RestClient http,
            OpenRouterProperties props,
            ObjectMapper om,
            StorageService storage,
            ProviderTelemetry telemetry
    ) {
        this.http = http;
        this.props = props;
        this.om = om;
        this.storage = storage;
        this.telemetry = telemetry;
    }

    @Override
    public String label(ScanImage image, ScanMode modelHint) {
        String modelId = (modelHint == ScanMode.DEEP) ? props.getDeepModel() : props.getFastModel();
        long t0 = System.nanoTime();
        try {
            byte[] bytes = storage.readAllBytes(image.objectKey());
            JsonNode resp = callChatCompletions(bytes, image.contentType(), modelId);

            String text = extractText(resp);
            telemetry.ok(PROVIDER, modelId, image.objectKey(), msSince(t0));

            if (text.isEmpty()) return NON_FOOD;
            log.debug("vision_label objectKey={} modelId={} label={}", image.objectKey(), modelId, text);
            return text;
        } catch (Exception e) {
            telemetry.fail(PROVIDER, modelId, image.objectKey(), msSince(t0), ProviderErrorMapper.code(e));
            log.warn("vision_label failed, treat as NON_FOOD objectKey={} err={}",
                    image.objectKey(), ProviderErrorMapper.safeMsg(e));
            return NON_FOOD;
        }
    }

    private JsonNode callChatCompletions(byte[] imageBytes, String mimeType, String modelId) {
        ObjectNode req = buildRequest(imageBytes, mimeType, modelId);
        return http.post()
                .uri("/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + requireApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(req)
                .retrieve()
                .body(JsonNode.class);
    }

    ObjectNode buildRequest(byte[] imageBytes, String mimeType, String modelId) {
        ObjectNode root = om.createObjectNode();
        root.put("model", modelId);

        ArrayNode messages = root.putArray("messages");
        ObjectNode m0 = messages.addObject();
        m0.put("role", "user");

        ArrayNode content = m0.putArray("content");
        content.addObject()
                .put("type", "text")
                .put("text", PROMPT);

        String dataUrl = "data:" + mimeType + ";base64," + Base64.getEncoder().encodeToString(imageBytes);
        ObjectNode img = content.addObject();
        img.put("type", "image_url");
        img.putObject("image_url").put("url", dataUrl);

        root.put("max_tokens", props.getMaxTokens());
        root.put("temperature", props.getTemperature());
        return root;
    }

    private static String extractText(JsonNode resp) {
        if (resp == null || resp.isNull()) return "";
        JsonNode content = resp.path("choices").path(0).path("message").path("content");
        if (content.isTextual()) return content.asText().trim();

        // 少數模型回 [{type:text, text:...}]
        if (content.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode part : content) {
                String t = part.path("text").asText("");
                if (!t.isBlank()) {
                    if (sb.length() > 0) sb.append(' ');
                    sb.append(t.trim());
                }
            }
            return sb.toString().trim();
        }
        return "";
    }

    private String requireApiKey() {
        String k = props.getApiKey();
        if (k == null || k.isBlank()) throw new IllegalStateException("PROVIDER_API_KEY_MISSING");
        return k.trim();
    }
}
