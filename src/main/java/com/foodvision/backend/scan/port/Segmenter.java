package com.foodvision.backend.scan.port;

public interface Segmenter {

    /**
     * @throws SegmentationUnavailableException 服務連不上、回傳格式不對
     */
    Segmentation segment(ScanImage image) throws SegmentationUnavailableException;

    /** 上傳時先擋：沒設定 segmenter 就不要收 deep scan */
    boolean isAvailable();
}
