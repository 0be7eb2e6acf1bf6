package com.foodvision.backend.scan.nutrition;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 食物名稱正規化（cache key / 去重 key 共用同一套規則）：
 * 1) trim
 * 2) toLowerCase
 * 3) 空白、連字號 → 底線
 * 4) 連續底線壓成一個，去頭尾底線
 * 5) 結果為空 → "unknown"
 *
 * 純函式，永不丟例外、永不回空字串。
 */
public final class FoodNames {
    private FoodNames() {}

    public static final String UNKNOWN = "unknown";

    private static final Pattern P_MULTI_UNDERSCORE = Pattern.compile("_+");

    public static String canonicalize(String text) {
        if (text == null) return UNKNOWN;
        String s = text.trim().toLowerCase(Locale.ROOT)
                .replace(' ', '_')
                .replace('-', '_');
        s = P_MULTI_UNDERSCORE.matcher(s).replaceAll("_");
        s = stripUnderscores(s);
        return s.isEmpty() ? UNKNOWN : s;
    }

    /** 給外部查詢 / 顯示用：底線轉回空白 */
    public static String humanize(String text) {
        if (text == null) return "";
        return text.replace('_', ' ').trim();
    }

    /** "burger, french fries, ,soda" → [burger, french fries, soda]（保留順序） */
    public static List<String> splitCandidates(String label) {
        List<String> out = new ArrayList<>();
        if (label == null || label.isBlank()) return out;
        for (String part : label.split(",")) {
            String t = part.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    private static String stripUnderscores(String s) {
        int from = 0;
        int to = s.length();
        while (from < to && s.charAt(from) == '_') from++;
        while (to > from && s.charAt(to - 1) == '_') to--;
        return s.substring(from, to);
    }
}
