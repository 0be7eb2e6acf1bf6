package com.foodvision.backend.scan.model;

/**
 * @param name     canonical name（同時是 cache key / 去重 key）
 * @param quantity 份量倍數，預設 1.0
 * @param macros   已乘上 quantity
 */
public record FoodItem(String name, double quantity, Macros macros) {

    public FoodItem {
        if (quantity <= 0) throw new IllegalArgumentException("QUANTITY_INVALID");
        if (macros == null) macros = Macros.ZERO;
    }
}
