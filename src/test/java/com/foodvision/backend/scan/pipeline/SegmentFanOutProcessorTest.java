package com.foodvision.backend.scan.pipeline;

import com.foodvision.backend.config.AsyncSchedulingConfig;
import com.foodvision.backend.scan.model.FoodItem;
import com.foodvision.backend.scan.model.Macros;
import com.foodvision.backend.scan.model.ScanMode;
import com.foodvision.backend.scan.nutrition.FoodNames;
import com.foodvision.backend.scan.nutrition.NutritionCacheService;
import com.foodvision.backend.scan.nutrition.NutritionLookup;
import com.foodvision.backend.scan.port.ScanImage;
import com.foodvision.backend.scan.port.VisionLabeler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SegmentFanOutProcessorTest {

    private ExecutorService pool;
    private VisionLabeler labeler;
    private NutritionCacheService cache;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
        labeler = mock(VisionLabeler.class);
        cache = mock(NutritionCacheService.class);
        when(cache.lookup(anyString(), anyDouble())).thenAnswer(inv -> {
            String key = FoodNames.canonicalize(inv.getArgument(0));
            return new NutritionLookup(key, inv.getArgument(1), new Macros(100, 1, 10, 1), "", false);
        });
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static ScanImage crop(String key) {
        return new ScanImage(key, "image/png");
    }

    @Test
    void merge_follows_crop_order_even_when_later_crops_finish_first() {
        CountDownLatch lastDone = new CountDownLatch(1);

        when(labeler.label(eq(crop("c0")), eq(ScanMode.DEEP))).thenAnswer(inv -> {
            // 第一個 crop 等最後一個先做完
            assertThat(lastDone.await(5, TimeUnit.SECONDS)).isTrue();
            return "Rice, Egg";
        });
        when(labeler.label(eq(crop("c1")), eq(ScanMode.DEEP))).thenReturn("egg, broccoli");
        when(labeler.label(eq(crop("c2")), eq(ScanMode.DEEP))).thenAnswer(inv -> {
            lastDone.countDown();
            return "chicken";
        });

        SegmentFanOutProcessor p = new SegmentFanOutProcessor(labeler, cache, pool);
        List<FoodItem> items = p.process(List.of(crop("c0"), crop("c1"), crop("c2")));

        assertThat(items).extracting(FoodItem::name)
                .containsExactly("rice", "egg", "broccoli", "chicken");
    }

    @Test
    void blocklisted_candidates_never_reach_the_cache() {
        when(labeler.label(any(), eq(ScanMode.DEEP))).thenReturn("plate, Fork, steak");

        SegmentFanOutProcessor p = new SegmentFanOutProcessor(labeler, cache, pool);
        List<FoodItem> items = p.process(List.of(crop("c0")));

        assertThat(items).extracting(FoodItem::name).containsExactly("steak");
        verify(cache, never()).lookup(eq("plate"), anyDouble());
        verify(cache, never()).lookup(eq("Fork"), anyDouble());
        verify(cache, times(1)).lookup(anyString(), anyDouble());
    }

    @Test
    void non_food_crop_contributes_nothing() {
        when(labeler.label(eq(crop("c0")), eq(ScanMode.DEEP))).thenReturn(VisionLabeler.NON_FOOD);
        when(labeler.label(eq(crop("c1")), eq(ScanMode.DEEP))).thenReturn("salad");

        SegmentFanOutProcessor p = new SegmentFanOutProcessor(labeler, cache, pool);

        assertThat(p.process(List.of(crop("c0"), crop("c1"))))
                .extracting(FoodItem::name).containsExactly("salad");
    }

    @Test
    void one_failing_crop_does_not_fail_the_batch() {
        when(labeler.label(eq(crop("c0")), eq(ScanMode.DEEP))).thenThrow(new IllegalStateException("boom"));
        when(labeler.label(eq(crop("c1")), eq(ScanMode.DEEP))).thenReturn("soup");

        SegmentFanOutProcessor p = new SegmentFanOutProcessor(labeler, cache, pool);

        assertThat(p.process(List.of(crop("c0"), crop("c1"))))
                .extracting(FoodItem::name).containsExactly("soup");
    }

    @Test
    void empty_batch_is_empty() {
        SegmentFanOutProcessor p = new SegmentFanOutProcessor(labeler, cache, pool);
        assertThat(p.process(List.of())).isEmpty();
        verifyNoInteractions(labeler, cache);
    }

    @Test
    void segment_executor_runs_at_most_ten_crops_at_once() {
        ThreadPoolTaskExecutor segmentExecutor =
                (ThreadPoolTaskExecutor) new AsyncSchedulingConfig().segmentExecutor(10);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        // 前 10 個呼叫互等，確定 10 條真的同時在跑；之後的直接過
        CountDownLatch firstTen = new CountDownLatch(10);

        when(labeler.label(any(), eq(ScanMode.DEEP))).thenAnswer(inv -> {
            int now = active.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                firstTen.countDown();
                firstTen.await(5, TimeUnit.SECONDS);
                Thread.sleep(20);
                return "food " + ((ScanImage) inv.getArgument(0)).objectKey();
            } finally {
                active.decrementAndGet();
            }
        });

        List<ScanImage> crops = IntStream.range(0, 25).mapToObj(i -> crop("crop" + i)).toList();
        try {
            List<FoodItem> items = new SegmentFanOutProcessor(labeler, cache, segmentExecutor).process(crops);

            assertThat(items).hasSize(25);
            assertThat(peak.get()).isEqualTo(10);
        } finally {
            segmentExecutor.shutdown();
        }
    }

    @Test
    void rejected_crop_is_skipped_and_others_still_merge() {
        AtomicInteger submitted = new AtomicInteger();
        Executor rejectsSecond = task -> {
            if (submitted.incrementAndGet() == 2) throw new TaskRejectedException("segment queue full");
            pool.execute(task);
        };
        when(labeler.label(eq(crop("a")), eq(ScanMode.DEEP))).thenReturn("rice");
        when(labeler.label(eq(crop("b")), eq(ScanMode.DEEP))).thenReturn("soup");
        when(labeler.label(eq(crop("c")), eq(ScanMode.DEEP))).thenReturn("tofu");

        List<FoodItem> items = new SegmentFanOutProcessor(labeler, cache, rejectsSecond)
                .process(List.of(crop("a"), crop("b"), crop("c")));

        assertThat(items).extracting(FoodItem::name).containsExactly("rice", "tofu");
        verify(labeler, never()).label(eq(crop("b")), any());
    }
}
