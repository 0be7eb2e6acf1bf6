package com.foodvision.backend.scan.storage;

import java.io.InputStream;

/**
 * 上傳原圖、切割 crop、標註圖都放這裡；objectKey 是相對路徑（目前就是檔名）。
 */
public interface StorageService {

    SaveResult save(String objectKey, InputStream in, String contentType) throws Exception;

    SaveResult save(String objectKey, byte[] bytes, String contentType) throws Exception;

    OpenResult open(String objectKey) throws Exception;

    byte[] readAllBytes(String objectKey) throws Exception;

    /** 不存在也不算錯，回 false */
    boolean delete(String objectKey) throws Exception;

    boolean exists(String objectKey) throws Exception;

    record SaveResult(String objectKey, long sizeBytes, String contentType) {}

    record OpenResult(InputStream inputStream, long sizeBytes, String contentType) {}
}
