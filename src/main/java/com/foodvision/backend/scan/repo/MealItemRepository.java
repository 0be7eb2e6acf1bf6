package com.foodvision.backend.scan.repo;

import com.foodvision.backend.scan.entity.MealItemEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface MealItemRepository extends JpaRepository<MealItemEntity, Long> {

    List<MealItemEntity> findByMealIdOrderByIdAsc(Long mealId);

    List<MealItemEntity> findByMealIdInOrderByIdAsc(Collection<Long> mealIds);

    @Modifying
    @Query("delete from MealItemEntity i where i.mealId = :mealId")
    int deleteByMealId(@Param("mealId") Long mealId);
}
