package com.foodvision.backend.scan.nutrition;

import com.foodvision.backend.scan.entity.FoodCacheEntity;
import com.foodvision.backend.scan.model.Macros;
import com.foodvision.backend.scan.port.NutritionFacts;
import com.foodvision.backend.scan.port.NutritionSource;
import com.foodvision.backend.scan.repo.FoodCacheRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * get-or-fetch-and-persist：
 * - cache hit：直接乘 quantity，不打外部
 * - miss：查外部（全 0 且多個字 → 只用最後一個字再查一次），結果一律 upsert（包含全 0）
 * <p>
 * 同一個沒看過的 key 併發時可能各打一次外部，最後寫入者為準。
 */
@Slf4j
@Service
public class NutritionCacheService {

    public static final String BASE_UNIT = "100g";

    /** food_cache.name 的欄寬；更長的 key 只查不存 */
    public static final int MAX_KEY_LENGTH = FoodCacheEntity.NAME_MAX_LENGTH;

    private final FoodCacheRepository cacheRepo;
    private final NutritionSource source;

    public NutritionCacheService(FoodCacheRepository cacheRepo, NutritionSource source) {
        this.cacheRepo = cacheRepo;
        this.source = source;
    }

    public NutritionLookup lookup(String rawLabel, double quantity) {
        if (quantity <= 0) throw new IllegalArgumentException("QUANTITY_INVALID");

        String key = FoodNames.canonicalize(rawLabel);

        Optional<FoodCacheEntity> cached = cacheRepo.findById(key);
        if (cached.isPresent()) {
            Macros per100g = toMacros(cached.get());
            return new NutritionLookup(key, quantity, per100g.scale(quantity), "", false);
        }

        NutritionFacts facts = fetch(rawLabel);
        boolean incomplete = facts.per100g().isZero();
        if (incomplete) {
            log.info("nutrition_lookup status=INCOMPLETE key={} label={}", key, rawLabel);
        }

        upsert(key, facts, incomplete);

        return new NutritionLookup(key, quantity, facts.per100g().scale(quantity), facts.rawResponse(), incomplete);
    }

    private NutritionFacts fetch(String rawLabel) {
        String human = FoodNames.humanize(rawLabel);
        if (human.isEmpty()) human = (rawLabel == null) ? "" : rawLabel;

        NutritionFacts first = source.query(human);
        if (!first.per100g().isZero()) return first;

        // 全 0 且多個字：只用最後一個字再試一次（"grilled chicken breast" → "breast"）
        String[] parts = human.trim().split("\\s+");
        if (parts.length > 1) {
            NutritionFacts simple = source.query(parts[parts.length - 1]);
            if (!simple.per100g().isZero()) return simple;
        }
        return first;
    }

    private void upsert(String key, NutritionFacts facts, boolean incomplete) {
        if (key.length() > MAX_KEY_LENGTH) {
            log.warn("food_cache skip key too long keyLength={} max={}", key.length(), MAX_KEY_LENGTH);
            return;
        }
        try {
            cacheRepo.save(toEntity(key, facts, incomplete));
        } catch (DataIntegrityViolationException e) {
            // 只有「另一個 thread 先 insert 了」才重試（第二次 save 會走 update）；其他違反約束照丟
            if (!cacheRepo.existsById(key)) throw e;
            log.debug("food_cache upsert race, retry as update key={}", key);
            cacheRepo.save(toEntity(key, facts, incomplete));
        }
    }

    private static FoodCacheEntity toEntity(String key, NutritionFacts facts, boolean incomplete) {
        Macros m = facts.per100g();
        FoodCacheEntity e = new FoodCacheEntity();
        e.setName(key);
        String label = facts.correctedLabel();
        e.setCorrectedLabel((label == null || label.isBlank()) ? key : label);
        e.setCalories(m.calories());
        e.setProtein(m.protein());
        e.setCarbs(m.carbs());
        e.setFat(m.fat());
        e.setBaseUnit(BASE_UNIT);
        e.setLookupIncomplete(incomplete);
        return e;
    }

    private static Macros toMacros(FoodCacheEntity e) {
        return new Macros(e.getCalories(), e.getProtein(), e.getCarbs(), e.getFat());
    }
}
