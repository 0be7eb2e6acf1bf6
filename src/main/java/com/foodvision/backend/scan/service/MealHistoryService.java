package com.foodvision.backend.scan.service;

import com.foodvision.backend.scan.dto.MealView;
import com.foodvision.backend.scan.dto.UploadUrls;
import com.foodvision.backend.scan.entity.MealEntity;
import com.foodvision.backend.scan.entity.MealItemEntity;
import com.foodvision.backend.scan.model.FoodItem;
import com.foodvision.backend.scan.model.Macros;
import com.foodvision.backend.scan.repo.MealItemRepository;
import com.foodvision.backend.scan.repo.MealRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 餐點紀錄（meals + meal_items）。
 * 圖檔本身不在這裡刪，delete / clear 只回傳 objectKey，由呼叫端處理。
 */
@RequiredArgsConstructor
@Service
public class MealHistoryService {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    private final MealRepository mealRepo;
    private final MealItemRepository itemRepo;

    public record NewMeal(
            String imageObjectKey,
            String originalLabel,
            String correctedLabel,
            Macros totals,
            List<FoodItem> items,
            String rawResponse
    ) {}

    @Transactional
    public Long append(NewMeal meal) {
        Macros totals = (meal.totals() == null) ? Macros.ZERO : meal.totals();

        MealEntity e = new MealEntity();
        e.setImageObjectKey(meal.imageObjectKey());
        e.setOriginalLabel(meal.originalLabel());
        e.setCorrectedLabel(meal.correctedLabel());
        applyTotals(e, totals);
        e.setRawResponse(meal.rawResponse());
        MealEntity saved = mealRepo.save(e);

        insertItems(saved.getId(), meal.items());
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public List<MealView> read(int limit) {
        if (limit <= 0) limit = DEFAULT_LIMIT;
        if (limit > MAX_LIMIT) throw new IllegalArgumentException("LIMIT_TOO_LARGE");

        List<MealEntity> meals = mealRepo.findLatest(PageRequest.of(0, limit));
        if (meals.isEmpty()) return List.of();

        // 一次撈完 items，避免 N+1
        Map<Long, List<FoodItem>> itemsByMeal = new LinkedHashMap<>();
        List<Long> ids = meals.stream().map(MealEntity::getId).toList();
        for (MealItemEntity it : itemRepo.findByMealIdInOrderByIdAsc(ids)) {
            itemsByMeal.computeIfAbsent(it.getMealId(), k -> new ArrayList<>()).add(toItem(it));
        }

        List<MealView> out = new ArrayList<>(meals.size());
        for (MealEntity m : meals) {
            out.add(new MealView(
                    m.getId(),
                    m.getCreatedAtUtc(),
                    m.getImageObjectKey(),
                    UploadUrls.of(m.getImageObjectKey()),
                    m.getOriginalLabel(),
                    m.getCorrectedLabel(),
                    new Macros(m.getCalories(), m.getProtein(), m.getCarbs(), m.getFat()),
                    itemsByMeal.getOrDefault(m.getId(), List.of())
            ));
        }
        return out;
    }

    @Transactional(readOnly = true)
    public Optional<MealEntity> find(Long mealId) {
        if (mealId == null) return Optional.empty();
        return mealRepo.findById(mealId);
    }

    @Transactional(readOnly = true)
    public List<FoodItem> items(Long mealId) {
        return itemRepo.findByMealIdOrderByIdAsc(mealId).stream().map(MealHistoryService::toItem).toList();
    }

    /** 覆寫 corrected label / totals，items 整批換掉 */
    @Transactional
    public void updateCorrection(Long mealId, String correctedLabel, Macros totals, List<FoodItem> items) {
        MealEntity m = mealRepo.findById(mealId).orElseThrow(() -> new IllegalArgumentException("MEAL_NOT_FOUND"));
        m.setCorrectedLabel(correctedLabel);
        applyTotals(m, totals == null ? Macros.ZERO : totals);
        mealRepo.save(m);

        itemRepo.deleteByMealId(mealId);
        insertItems(mealId, items);
    }

    /**
     * @return 要刪的圖檔 objectKey（找不到 meal 就是空 list）
     */
    @Transactional
    public List<String> delete(Long mealId) {
        Optional<MealEntity> found = mealRepo.findById(mealId);
        List<String> keys = new ArrayList<>();
        found.map(MealEntity::getImageObjectKey)
                .filter(k -> !k.isBlank())
                .ifPresent(keys::add);

        itemRepo.deleteByMealId(mealId);
        found.ifPresent(mealRepo::delete);
        return keys;
    }

    @Transactional
    public List<String> clear() {
        List<String> keys = mealRepo.findAllImageObjectKeys().stream()
                .filter(k -> !k.isBlank())
                .toList();
        itemRepo.deleteAllInBatch();
        mealRepo.deleteAllInBatch();
        return keys;
    }

    private void insertItems(Long mealId, List<FoodItem> items) {
        if (items == null || items.isEmpty()) return;
        List<MealItemEntity> rows = new ArrayList<>(items.size());
        for (FoodItem it : items) {
            MealItemEntity row = new MealItemEntity();
            row.setMealId(mealId);
            row.setName(it.name());
            row.setQuantity(it.quantity());
            row.setCalories(it.macros().calories());
            row.setProtein(it.macros().protein());
            row.setCarbs(it.macros().carbs());
            row.setFat(it.macros().fat());
            rows.add(row);
        }
        itemRepo.saveAll(rows);
    }

    private static void applyTotals(MealEntity e, Macros totals) {
        e.setCalories(totals.calories());
        e.setProtein(totals.protein());
        e.setCarbs(totals.carbs());
        e.setFat(totals.fat());
    }

    private static FoodItem toItem(MealItemEntity it) {
        double q = it.getQuantity() > 0 ? it.getQuantity() : 1.0;
        return new FoodItem(it.getName(), q, new Macros(it.getCalories(), it.getProtein(), it.getCarbs(), it.getFat()));
    }
}
