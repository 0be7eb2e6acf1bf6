package com.foodvision.backend.scan.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodvision.backend.scan.model.Macros;
import com.foodvision.backend.scan.port.NutritionFacts;
import com.foodvision.backend.scan.port.NutritionSource;
import com.foodvision.backend.scan.provider.config.UsdaProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.Locale;

import static com.foodvision.backend.scan.provider.ProviderTelemetry.msSince;

/**
 * USDA FoodData Central：/foods/search 取第一筆，數值是每 100g。
 * 查不到、HTTP 失敗都回全 0（rawResponse 帶錯誤訊息），由 cache 層決定要不要再試。
 */
@Slf4j
public class UsdaNutritionSource implements NutritionSource {

    private static final String PROVIDER = "USDA";

    static final String ENERGY = "Energy";
    static final String PROTEIN = "Protein";
    static final String CARBS = "Carbohydrate, by difference";
    static final String FAT = "Total lipid (fat)";

    private final RestClient http;
    private final UsdaProperties props;
    private final ObjectMapper om;
    private final ProviderTelemetry telemetry;

    public UsdaNutritionSource(RestClient http, UsdaProperties props, ObjectMapper om, ProviderTelemetry telemetry) {
        this.http = http;
        this.props = props;
        this.om = om;
        this.telemetry = telemetry;
    }

    @Override
    public NutritionFacts query(String name) {
        String q = (name == null) ? "" : name.trim();
        if (q.isEmpty()) return NutritionFacts.notFound("", "");

        long t0 = System.nanoTime();
        try {
            String raw = http.get()
                    .uri(b -> b.path("/foods/search")
                            .queryParam("api_key", props.getApiKey())
                            .queryParam("query", q)
                            .queryParam("pageSize", 1)
                            .build())
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(String.class);

            telemetry.ok(PROVIDER, "foods/search", q, msSince(t0));
            return parse(q, raw);
        } catch (Exception e) {
            telemetry.fail(PROVIDER, "foods/search", q, msSince(t0), ProviderErrorMapper.code(e));
            return NutritionFacts.notFound(q, ProviderErrorMapper.safeMsg(e));
        }
    }

    private NutritionFacts parse(String query, String raw) throws Exception {
        if (raw == null || raw.isBlank()) return NutritionFacts.notFound(query, "");

        JsonNode root = om.readTree(raw);
        JsonNode food = root.path("foods").path(0);
        if (food.isMissingNode() || food.isNull()) return NutritionFacts.notFound(query, raw);

        String description = food.path("description").asText(query);
        if (description.isBlank()) description = query;

        Double kcal = null;
        double protein = 0.0, carbs = 0.0, fat = 0.0;

        for (JsonNode n : food.path("foodNutrients")) {
            String nutrient = n.path("nutrientName").asText("");
            double v = n.path("value").asDouble(0.0);

            switch (nutrient) {
                case ENERGY -> {
                    // 同一筆可能同時有 kcal 跟 kJ，優先 kcal
                    String unit = n.path("unitName").asText("").toUpperCase(Locale.ROOT);
                    if (kcal == null || "KCAL".equals(unit)) kcal = v;
                }
                case PROTEIN -> protein = v;
                case CARBS -> carbs = v;
                case FAT -> fat = v;
                default -> { }
            }
        }

        Macros per100g = new Macros(kcal == null ? 0.0 : kcal, protein, carbs, fat);
        return new NutritionFacts(description, per100g, raw);
    }
}
