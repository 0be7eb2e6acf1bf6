package com.foodvision.backend.scan.provider;

import com.foodvision.backend.scan.port.ScanImage;
import com.foodvision.backend.scan.port.Segmentation;
import com.foodvision.backend.scan.port.SegmentationUnavailableException;
import com.foodvision.backend.scan.port.Segmenter;

/** 沒設定切割服務：deep scan 一律不可用 */
public class DisabledSegmenter implements Segmenter {

    @Override
    public Segmentation segment(ScanImage image) {
        throw new SegmentationUnavailableException(SegmentationUnavailableException.USER_MESSAGE);
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
