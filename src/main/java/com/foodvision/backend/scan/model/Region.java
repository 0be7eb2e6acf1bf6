package com.foodvision.backend.scan.model;

import java.util.List;

/** segmenter 回來的 bounding box：[x1, y1, x2, y2]（像素） */
public record Region(List<Double> bbox) {

    public Region {
        bbox = (bbox == null) ? List.of() : List.copyOf(bbox);
    }
}
