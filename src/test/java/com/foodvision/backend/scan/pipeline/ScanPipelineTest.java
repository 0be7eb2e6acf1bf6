package com.foodvision.backend.scan.pipeline;

import com.foodvision.backend.scan.model.FoodItem;
import com.foodvision.backend.scan.model.Macros;
import com.foodvision.backend.scan.model.Region;
import com.foodvision.backend.scan.model.ScanMode;
import com.foodvision.backend.scan.nutrition.FoodNames;
import com.foodvision.backend.scan.nutrition.NutritionCacheService;
import com.foodvision.backend.scan.nutrition.NutritionLookup;
import com.foodvision.backend.scan.port.ScanImage;
import com.foodvision.backend.scan.port.Segmentation;
import com.foodvision.backend.scan.port.SegmentationUnavailableException;
import com.foodvision.backend.scan.port.Segmenter;
import com.foodvision.backend.scan.port.VisionLabeler;
import com.foodvision.backend.scan.storage.StorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ScanPipelineTest {

    private VisionLabeler labeler;
    private Segmenter segmenter;
    private NutritionCacheService cache;
    private SegmentFanOutProcessor fanOut;
    private StorageService storage;
    private ScanPipeline pipeline;

    private final ScanImage upload = new ScanImage("abc.jpg", "image/jpeg");
    private final List<String> stages = new ArrayList<>();
    private final List<Integer> percents = new ArrayList<>();

    @BeforeEach
    void setUp() {
        labeler = mock(VisionLabeler.class);
        segmenter = mock(Segmenter.class);
        cache = mock(NutritionCacheService.class);
        fanOut = mock(SegmentFanOutProcessor.class);
        storage = mock(StorageService.class);
        pipeline = new ScanPipeline(labeler, segmenter, cache, fanOut, storage);

        when(cache.lookup(anyString(), anyDouble())).thenAnswer(inv ->
                new NutritionLookup(FoodNames.canonicalize(inv.getArgument(0)), 1.0, new Macros(100, 10, 5, 2), "", false));
    }

    private ProgressListener recorder() {
        return (stage, percent) -> {
            stages.add(stage);
            percents.add(percent);
        };
    }

    @Test
    void fast_non_food_returns_empty_without_nutrition_calls() {
        when(labeler.label(upload, ScanMode.FAST)).thenReturn("NON_FOOD");

        PipelineResult r = pipeline.run(upload, ScanMode.FAST, recorder());

        assertThat(r.items()).isEmpty();
        assertThat(r.totals()).isEqualTo(Macros.ZERO);
        assertThat(r.originalLabel()).isEqualTo("Non-Food Item Detected");
        assertThat(r.annotatedImageKey()).isNull();
        verifyNoInteractions(cache);
    }

    @Test
    void fast_resolves_each_candidate_in_order_with_monotonic_progress() {
        when(labeler.label(upload, ScanMode.FAST)).thenReturn("burger, french fries, soda");

        PipelineResult r = pipeline.run(upload, ScanMode.FAST, recorder());

        assertThat(r.items()).extracting(FoodItem::name).containsExactly("burger", "french_fries", "soda");
        assertThat(r.totals()).isEqualTo(new Macros(300, 30, 15, 6));
        assertThat(r.originalLabel()).isEqualTo("burger, french fries, soda");
        assertThat(r.rawResponse()).isEqualTo("AI detected: burger, french fries, soda");

        assertThat(stages.get(0)).isEqualTo("Analyzing image");
        assertThat(stages.get(stages.size() - 1)).isEqualTo("Done");
        assertThat(percents).isSorted();
        assertThat(percents.get(percents.size() - 1)).isEqualTo(100);
        assertThat(percents).allMatch(p -> p >= 0 && p <= 100);
    }

    @Test
    void fast_duplicates_are_kept() {
        when(labeler.label(upload, ScanMode.FAST)).thenReturn("egg, egg");

        PipelineResult r = pipeline.run(upload, ScanMode.FAST, ProgressListener.NOOP);

        assertThat(r.items()).hasSize(2);
    }

    @Test
    void deep_without_crops_reports_no_segments() {
        when(segmenter.segment(upload)).thenReturn(new Segmentation("annotated_abc.png", List.of(), List.of()));

        PipelineResult r = pipeline.run(upload, ScanMode.DEEP, recorder());

        assertThat(r.items()).isEmpty();
        assertThat(r.originalLabel()).isEqualTo("No food segments detected");
        assertThat(r.annotatedImageKey()).isEqualTo("annotated_abc.png");
        assertThat(stages).containsExactly("Isolating items", "Done");
        verifyNoInteractions(fanOut);
    }

    @Test
    void deep_joins_items_and_discards_crops() throws Exception {
        List<ScanImage> crops = List.of(new ScanImage("crop_0.png", "image/png"), new ScanImage("crop_1.png", "image/png"));
        Region region = new Region(List.of(1.0, 2.0, 30.0, 40.0));
        when(segmenter.segment(upload)).thenReturn(new Segmentation("annotated_abc.png", crops, List.of(region)));
        when(fanOut.process(crops)).thenReturn(List.of(
                new FoodItem("rice", 1.0, new Macros(130, 2.7, 28, 0.3)),
                new FoodItem("egg", 1.0, new Macros(155, 13, 1.1, 11))
        ));

        PipelineResult r = pipeline.run(upload, ScanMode.DEEP, recorder());

        assertThat(r.originalLabel()).isEqualTo("rice, egg");
        assertThat(r.rawResponse()).isEqualTo("Deep Scan detected: rice, egg");
        assertThat(r.regions()).containsExactly(region);
        assertThat(r.totals().calories()).isEqualTo(285.0);
        assertThat(stages).containsExactly("Isolating items", "Identifying food", "Done");

        verify(storage).delete("crop_0.png");
        verify(storage).delete("crop_1.png");
        verify(storage, never()).delete("annotated_abc.png");
    }

    @Test
    void deep_with_only_inedible_crops_reports_no_edible_food() throws Exception {
        List<ScanImage> crops = List.of(new ScanImage("crop_0.png", "image/png"));
        when(segmenter.segment(upload)).thenReturn(new Segmentation("annotated_abc.png", crops, List.of()));
        when(fanOut.process(anyList())).thenReturn(List.of());

        PipelineResult r = pipeline.run(upload, ScanMode.DEEP, recorder());

        assertThat(r.originalLabel()).isEqualTo("No edible food detected in segments");
        assertThat(r.items()).isEmpty();
        assertThat(stages.get(stages.size() - 1)).isEqualTo("Done");
        verify(storage).delete("crop_0.png");
    }

    @Test
    void deep_propagates_segmentation_unavailable() {
        when(segmenter.segment(any())).thenThrow(new SegmentationUnavailableException("down"));

        assertThatThrownBy(() -> pipeline.run(upload, ScanMode.DEEP, recorder()))
                .isInstanceOf(SegmentationUnavailableException.class);
        verifyNoInteractions(fanOut, cache);
        verify(labeler, never()).label(any(), eq(ScanMode.FAST));
    }
}
