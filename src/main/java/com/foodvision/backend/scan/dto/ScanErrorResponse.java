package com.foodvision.backend.scan.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param clientAction USE_FAST_SCAN：deep scan 不可用，前端提示改 fast scan
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScanErrorResponse(
        String errorCode,
        String message,
        String requestId,
        String clientAction
) {
    // 舊前端讀 detail 欄位
    @JsonProperty("detail")
    public String detail() {
        return message;
    }
}
