package com.foodvision.backend.scan.repo;

import com.foodvision.backend.scan.entity.FoodCacheEntity;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * id = canonical name。
 * save() 對已指定 id 的 entity 走 merge，也就是 insert-or-update。
 */
public interface FoodCacheRepository extends JpaRepository<FoodCacheEntity, String> {
}
