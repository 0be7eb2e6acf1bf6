package com.foodvision.backend.scan.nutrition;

import com.foodvision.backend.scan.entity.FoodCacheEntity;
import com.foodvision.backend.scan.model.Macros;
import com.foodvision.backend.scan.port.NutritionFacts;
import com.foodvision.backend.scan.port.NutritionSource;
import com.foodvision.backend.scan.repo.FoodCacheRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class NutritionCacheServiceTest {

    private FoodCacheRepository repo;
    private NutritionSource source;
    private NutritionCacheService service;

    @BeforeEach
    void setUp() {
        repo = mock(FoodCacheRepository.class);
        source = mock(NutritionSource.class);
        service = new NutritionCacheService(repo, source);
        when(repo.save(any(FoodCacheEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void cached_banana_times_two_never_calls_source() {
        FoodCacheEntity banana = new FoodCacheEntity();
        banana.setName("banana");
        banana.setCalories(105.0);
        banana.setProtein(1.3);
        banana.setCarbs(27.0);
        banana.setFat(0.4);
        when(repo.findById("banana")).thenReturn(Optional.of(banana));

        NutritionLookup out = service.lookup("Banana", 2.0);

        assertThat(out.canonicalName()).isEqualTo("banana");
        assertThat(out.quantity()).isEqualTo(2.0);
        assertThat(out.macros().calories()).isCloseTo(210.0, within(1e-9));
        assertThat(out.macros().protein()).isCloseTo(2.6, within(1e-9));
        assertThat(out.macros().carbs()).isCloseTo(54.0, within(1e-9));
        assertThat(out.macros().fat()).isCloseTo(0.8, within(1e-9));
        assertThat(out.incomplete()).isFalse();
        assertThat(out.rawResponse()).isEmpty();

        verifyNoInteractions(source);
        verify(repo, never()).save(any());
    }

    @Test
    void miss_fetches_once_and_persists_per_100g() {
        when(repo.findById("apple")).thenReturn(Optional.empty());
        when(source.query("apple")).thenReturn(new NutritionFacts("Apples, raw", new Macros(52, 0.3, 14, 0.2), "{raw}"));

        NutritionLookup out = service.lookup("apple", 1.5);

        assertThat(out.macros().calories()).isCloseTo(78.0, within(1e-9));
        assertThat(out.incomplete()).isFalse();
        assertThat(out.rawResponse()).isEqualTo("{raw}");

        ArgumentCaptor<FoodCacheEntity> saved = ArgumentCaptor.forClass(FoodCacheEntity.class);
        verify(repo).save(saved.capture());
        assertThat(saved.getValue().getName()).isEqualTo("apple");
        assertThat(saved.getValue().getCorrectedLabel()).isEqualTo("Apples, raw");
        assertThat(saved.getValue().getCalories()).isEqualTo(52.0);
        assertThat(saved.getValue().getBaseUnit()).isEqualTo("100g");
        assertThat(saved.getValue().isLookupIncomplete()).isFalse();
        verify(source, times(1)).query(anyString());
    }

    @Test
    void zero_result_retries_with_last_word() {
        when(repo.findById("grilled_chicken_breast")).thenReturn(Optional.empty());
        when(source.query("grilled chicken breast")).thenReturn(NutritionFacts.notFound("grilled chicken breast", ""));
        when(source.query("breast")).thenReturn(new NutritionFacts("Chicken breast", new Macros(165, 31, 0, 3.6), "{b}"));

        NutritionLookup out = service.lookup("Grilled Chicken-Breast", 1.0);

        assertThat(out.canonicalName()).isEqualTo("grilled_chicken_breast");
        assertThat(out.macros().protein()).isEqualTo(31.0);
        assertThat(out.incomplete()).isFalse();
        verify(source).query("grilled chicken breast");
        verify(source).query("breast");
    }

    @Test
    void still_zero_is_cached_as_incomplete() {
        when(repo.findById("mystery_stew")).thenReturn(Optional.empty());
        when(source.query(anyString())).thenAnswer(inv -> NutritionFacts.notFound(inv.getArgument(0), "no match"));

        NutritionLookup out = service.lookup("mystery stew", 1.0);

        assertThat(out.macros().isZero()).isTrue();
        assertThat(out.incomplete()).isTrue();

        ArgumentCaptor<FoodCacheEntity> saved = ArgumentCaptor.forClass(FoodCacheEntity.class);
        verify(repo).save(saved.capture());
        assertThat(saved.getValue().isLookupIncomplete()).isTrue();
    }

    @Test
    void single_word_zero_does_not_retry() {
        when(repo.findById("zzz")).thenReturn(Optional.empty());
        when(source.query("zzz")).thenReturn(NutritionFacts.notFound("zzz", ""));

        service.lookup("zzz", 1.0);

        verify(source, times(1)).query(anyString());
    }

    @Test
    void concurrent_insert_race_is_retried_as_update() {
        when(repo.findById("rice")).thenReturn(Optional.empty());
        when(source.query("rice")).thenReturn(new NutritionFacts("Rice", new Macros(130, 2.7, 28, 0.3), ""));
        when(repo.save(any(FoodCacheEntity.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key"))
                .thenAnswer(inv -> inv.getArgument(0));
        when(repo.existsById("rice")).thenReturn(true);

        NutritionLookup out = service.lookup("rice", 1.0);

        assertThat(out.macros().calories()).isEqualTo(130.0);
        verify(repo, times(2)).save(any(FoodCacheEntity.class));
    }

    @Test
    void integrity_violation_without_competing_row_is_not_retried() {
        when(repo.findById("rice")).thenReturn(Optional.empty());
        when(source.query("rice")).thenReturn(new NutritionFacts("Rice", new Macros(130, 2.7, 28, 0.3), ""));
        when(repo.save(any(FoodCacheEntity.class))).thenThrow(new DataIntegrityViolationException("value too long"));
        when(repo.existsById("rice")).thenReturn(false);

        assertThatThrownBy(() -> service.lookup("rice", 1.0))
                .isInstanceOf(DataIntegrityViolationException.class);
        verify(repo, times(1)).save(any(FoodCacheEntity.class));
    }

    @Test
    void key_wider_than_column_is_resolved_but_not_cached() {
        String label = "grilled chicken " + "x".repeat(NutritionCacheService.MAX_KEY_LENGTH);
        when(repo.findById(anyString())).thenReturn(Optional.empty());
        when(source.query(anyString())).thenReturn(new NutritionFacts("Chicken", new Macros(165, 31, 0, 3.6), ""));

        NutritionLookup out = service.lookup(label, 1.0);

        assertThat(out.canonicalName()).hasSizeGreaterThan(NutritionCacheService.MAX_KEY_LENGTH);
        assertThat(out.macros().calories()).isEqualTo(165.0);
        assertThat(out.incomplete()).isFalse();
        verify(repo, never()).save(any());
    }

    @Test
    void quantity_must_be_positive() {
        assertThatThrownBy(() -> service.lookup("banana", 0.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("QUANTITY_INVALID");
    }
}
