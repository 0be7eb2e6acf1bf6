package com.foodvision.backend.scan.pipeline;

/**
 * pipeline 唯一的進度出口，呼叫順序即事件順序。
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NOOP = (stage, percent) -> { };

    void report(String stage, int percent);
}
