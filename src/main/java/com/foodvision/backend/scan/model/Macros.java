package com.foodvision.backend.scan.model;

/**
 * calories / protein / carbs / fat。
 * cache 裡存的是每 100g，FoodItem 上的是已乘 quantity 的值。
 */
public record Macros(double calories, double protein, double carbs, double fat) {

    public static final Macros ZERO = new Macros(0.0, 0.0, 0.0, 0.0);

    public Macros scale(double quantity) {
        return new Macros(calories * quantity, protein * quantity, carbs * quantity, fat * quantity);
    }

    public Macros plus(Macros other) {
        if (other == null) return this;
        return new Macros(
                calories + other.calories,
                protein + other.protein,
                carbs + other.carbs,
                fat + other.fat
        );
    }

    public boolean isZero() {
        return calories == 0.0 && protein == 0.0 && carbs == 0.0 && fat == 0.0;
    }

    public static Macros sum(Iterable<FoodItem> items) {
        Macros total = ZERO;
        if (items == null) return total;
        for (FoodItem it : items) {
            total = total.plus(it.macros());
        }
        return total;
    }
}
