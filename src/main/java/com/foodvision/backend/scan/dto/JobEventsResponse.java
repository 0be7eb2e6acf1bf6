package com.foodvision.backend.scan.dto;

import java.util.List;
import java.util.Map;

/** pull 版本的進度查詢：events 跟 SSE 的 data 格式一樣 */
public record JobEventsResponse(List<Map<String, Object>> events, int cursor, String status) {}
