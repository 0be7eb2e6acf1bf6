package com.foodvision.backend.scan.service;

import com.foodvision.backend.scan.dto.CorrectResponse;
import com.foodvision.backend.scan.dto.MealView;
import com.foodvision.backend.scan.entity.FoodCacheEntity;
import com.foodvision.backend.scan.model.FoodItem;
import com.foodvision.backend.scan.model.Macros;
import com.foodvision.backend.scan.nutrition.NutritionCacheService;
import com.foodvision.backend.scan.nutrition.NutritionLookup;
import com.foodvision.backend.scan.port.NutritionFacts;
import com.foodvision.backend.scan.port.NutritionSource;
import com.foodvision.backend.scan.repo.FoodCacheRepository;
import com.foodvision.backend.scan.storage.StorageService;
import com.foodvision.backend.testsupport.BaseSpringTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@SpringBootTest
class MealHistoryServiceTest extends BaseSpringTest {

    @Autowired MealHistoryService history;
    @Autowired MealCorrectionService correction;
    @Autowired MealDeleteService deleteService;
    @Autowired NutritionCacheService nutritionCache;
    @Autowired FoodCacheRepository cacheRepo;
    @Autowired StorageService storage;

    @MockitoBean NutritionSource source;

    @BeforeEach
    void setUp() {
        history.clear();
        cacheRepo.deleteAll();
    }

    private Long meal(String key, String label, FoodItem... items) {
        List<FoodItem> list = List.of(items);
        return history.append(new MealHistoryService.NewMeal(
                key, label, list.isEmpty() ? "" : list.get(0).name(), Macros.sum(list), list, "raw"));
    }

    @Test
    void read_returns_newest_first_with_items_in_insert_order() {
        Long first = meal("a.jpg", "Rice", new FoodItem("rice", 1.0, new Macros(130, 2.7, 28, 0.3)));
        Long second = meal("b.jpg", "Egg, Toast",
                new FoodItem("egg", 1.0, new Macros(155, 13, 1.1, 11)),
                new FoodItem("toast", 2.0, new Macros(600, 18, 110, 8)));

        List<MealView> rows = history.read(50);

        assertThat(rows).extracting(MealView::mealId).containsExactly(second, first);
        MealView latest = rows.get(0);
        assertThat(latest.items()).extracting(FoodItem::name).containsExactly("egg", "toast");
        assertThat(latest.items().get(1).quantity()).isEqualTo(2.0);
        assertThat(latest.totals().calories()).isEqualTo(755.0);
        assertThat(latest.imageUrl()).isEqualTo("/api/uploads/b.jpg");
        assertThat(latest.createdAt()).isNotNull();
    }

    @Test
    void read_limit_rules() {
        meal("a.jpg", "Rice");
        meal("b.jpg", "Soup");

        assertThat(history.read(1)).hasSize(1);
        assertThat(history.read(0)).hasSize(2);
        assertThatThrownBy(() -> history.read(501))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("LIMIT_TOO_LARGE");
    }

    @Test
    void meal_without_items_still_listed() {
        Long id = meal("nf.jpg", "Non-Food Item Detected");

        MealView v = history.read(10).get(0);
        assertThat(v.mealId()).isEqualTo(id);
        assertThat(v.items()).isEmpty();
        assertThat(v.totals()).isEqualTo(Macros.ZERO);
    }

    @Test
    void correction_relooks_up_and_replaces_items() {
        Long id = meal("c.jpg", "Rice",
                new FoodItem("rice", 1.0, new Macros(130, 2.7, 28, 0.3)),
                new FoodItem("beans", 1.0, new Macros(100, 7, 18, 0.5)));
        when(source.query("Fried Rice")).thenReturn(new NutritionFacts("Fried rice", new Macros(163, 3.8, 31, 2.5), "{}"));

        CorrectResponse resp = correction.correct(id, "  Fried_Rice ");

        assertThat(resp.status()).isEqualTo("success");
        assertThat(resp.items()).extracting(FoodItem::name).containsExactly("fried_rice");
        assertThat(resp.totals().calories()).isEqualTo(163.0);

        MealView v = history.read(1).get(0);
        assertThat(v.correctedLabel()).isEqualTo("fried_rice");
        assertThat(v.originalLabel()).isEqualTo("Rice");
        assertThat(v.items()).hasSize(1);
        assertThat(v.totals().calories()).isEqualTo(163.0);
    }

    @Test
    void correction_errors() {
        assertThatThrownBy(() -> correction.correct(987654L, "apple"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("MEAL_NOT_FOUND");

        Long id = meal("d.jpg", "Rice");
        assertThatThrownBy(() -> correction.correct(id, "   "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("NEW_LABEL_REQUIRED");
        verifyNoInteractions(source);
    }

    @Test
    void nutrition_cache_upserts_on_h2() {
        when(source.query("Kiwi")).thenReturn(new NutritionFacts("Kiwifruit", new Macros(61, 1.1, 15, 0.5), "{}"));

        NutritionLookup first = nutritionCache.lookup("Kiwi", 1.0);
        NutritionLookup second = nutritionCache.lookup("kiwi", 2.0);

        assertThat(first.incomplete()).isFalse();
        assertThat(second.macros().calories()).isEqualTo(122.0);
        assertThat(second.rawResponse()).isEmpty();
        verify(source, times(1)).query(anyString());

        FoodCacheEntity row = cacheRepo.findById("kiwi").orElseThrow();
        assertThat(row.getCorrectedLabel()).isEqualTo("Kiwifruit");
        assertThat(row.getBaseUnit()).isEqualTo(NutritionCacheService.BASE_UNIT);
        assertThat(row.isLookupIncomplete()).isFalse();
    }

    @Test
    void nutrition_cache_stores_misses_as_incomplete() {
        when(source.query(anyString())).thenAnswer(inv -> NutritionFacts.notFound(inv.getArgument(0), ""));

        NutritionLookup miss = nutritionCache.lookup("mystery", 1.0);

        assertThat(miss.incomplete()).isTrue();
        assertThat(miss.macros()).isEqualTo(Macros.ZERO);
        assertThat(cacheRepo.findById("mystery")).get()
                .extracting(FoodCacheEntity::isLookupIncomplete)
                .isEqualTo(true);
    }

    @Test
    void long_labeler_reply_is_cached_and_stored_as_meal_item() {
        // labeler 回的是自由文字，canonical key 可能超過兩百字
        String label = "Grilled chicken breast with roasted garlic herb butter, " .repeat(4).trim();
        assertThat(label.length()).isGreaterThan(200);
        when(source.query(anyString())).thenReturn(new NutritionFacts("Chicken", new Macros(165, 31, 0, 3.6), "{}"));

        NutritionLookup out = nutritionCache.lookup(label, 1.0);

        assertThat(cacheRepo.findById(out.canonicalName())).isPresent();

        Long id = meal("long.jpg", label, out.toItem());
        assertThat(history.items(id)).extracting(FoodItem::name).containsExactly(out.canonicalName());
    }

    @Test
    void delete_removes_meal_and_image() throws Exception {
        storage.save("del_me.jpg", new byte[] {1, 2, 3}, "image/jpeg");
        Long id = meal("del_me.jpg", "Rice", new FoodItem("rice", 1.0, Macros.ZERO));

        deleteService.delete(id);

        assertThat(history.find(id)).isEmpty();
        assertThat(history.items(id)).isEmpty();
        assertThat(storage.exists("del_me.jpg")).isFalse();

        // 不存在的 id 不算錯
        assertThatCode(() -> deleteService.delete(id)).doesNotThrowAnyException();
    }

    @Test
    void clear_removes_everything() throws Exception {
        storage.save("clr_1.jpg", new byte[] {1}, "image/jpeg");
        meal("clr_1.jpg", "Rice");
        meal("clr_missing.jpg", "Soup");

        deleteService.clear();

        assertThat(history.read(50)).isEmpty();
        assertThat(storage.exists("clr_1.jpg")).isFalse();
    }
}
