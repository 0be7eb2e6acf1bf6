package com.foodvision.backend.scan.provider;

import com.foodvision.backend.scan.model.ScanMode;
import com.foodvision.backend.scan.port.ScanImage;
import com.foodvision.backend.scan.port.VisionLabeler;
import lombok.extern.slf4j.Slf4j;

/**
 * 沒設定 vision provider 時用：每張圖都是 NON_FOOD。
 */
@Slf4j
public class StubVisionLabeler implements VisionLabeler {

    @Override
    public String label(ScanImage image, ScanMode modelHint) {
        log.debug("vision provider disabled, objectKey={} -> NON_FOOD", image.objectKey());
        return NON_FOOD;
    }
}
