package com.foodvision.backend.scan.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "meals")
public class MealEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    /** deep scan 有標註圖時存標註圖，否則存原圖 */
    @Column(name = "image_object_key", columnDefinition = "TEXT")
    private String imageObjectKey;

    @Column(name = "original_label", columnDefinition = "TEXT")
    private String originalLabel;

    @Column(name = "corrected_label", columnDefinition = "TEXT")
    private String correctedLabel;

    private double calories;
    private double protein;
    private double carbs;
    private double fat;

    @Column(name = "raw_response", columnDefinition = "TEXT")
    private String rawResponse;

    @PrePersist
    void prePersist() {
        if (createdAtUtc == null) createdAtUtc = Instant.now();
    }
}
