package com.foodvision.backend.scan.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * 營養查詢快取：key = canonical name，值是每 100g 的 macros。
 * 只做 upsert，core 不會刪。
 */
@Getter
@Setter
@Entity
@Table(name = "food_cache")
public class FoodCacheEntity {

    // utf8mb4 下 InnoDB 索引上限 3072 bytes = 768 字
    public static final int NAME_MAX_LENGTH = 512;

    @Id
    @Column(length = NAME_MAX_LENGTH, nullable = false)
    private String name;

    @Column(name = "corrected_label", nullable = false, columnDefinition = "TEXT")
    private String correctedLabel;

    @Column(nullable = false)
    private double calories;

    @Column(nullable = false)
    private double protein;

    @Column(nullable = false)
    private double carbs;

    @Column(nullable = false)
    private double fat;

    @Column(name = "base_unit", nullable = false, length = 16)
    private String baseUnit;

    /** true = 外部查不到而存的 0（跟「真的 0 卡」分開，之後要修正才找得到） */
    @Column(name = "lookup_incomplete", nullable = false)
    private boolean lookupIncomplete;

    @Column(name = "updated_at_utc", nullable = false)
    private Instant updatedAtUtc;

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAtUtc = Instant.now();
    }
}
