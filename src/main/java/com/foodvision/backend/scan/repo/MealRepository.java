package com.foodvision.backend.scan.repo;

import com.foodvision.backend.scan.entity.MealEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface MealRepository extends JpaRepository<MealEntity, Long> {

    @Query("select m from MealEntity m order by m.createdAtUtc desc, m.id desc")
    List<MealEntity> findLatest(Pageable pageable);

    @Query("select m.imageObjectKey from MealEntity m where m.imageObjectKey is not null")
    List<String> findAllImageObjectKeys();
}
