package com.foodvision.backend.scan.port;

import com.foodvision.backend.scan.model.Region;

import java.util.List;

/**
 * @param annotatedImageKey 標註過的總覽圖（存在 StorageService）
 * @param crops             每個候選食物一張 crop，順序即 segmenter 回傳順序
 * @param regions           bounding box，可能比 crops 少（segmenter 沒給就空）
 */
public record Segmentation(String annotatedImageKey, List<ScanImage> crops, List<Region> regions) {

    public Segmentation {
        crops = (crops == null) ? List.of() : List.copyOf(crops);
        regions = (regions == null) ? List.of() : List.copyOf(regions);
    }
}
