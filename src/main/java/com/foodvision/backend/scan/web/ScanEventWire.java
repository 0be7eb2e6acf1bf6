package com.foodvision.backend.scan.web;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodvision.backend.scan.job.ScanJobEvent;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * job event → 前端吃的扁平 JSON：
 * <pre>
 * {"type":"progress","stage":"...","progress":45}
 * {"type":"result", ...upload payload 欄位攤平}
 * {"type":"error","message":"..."}
 * </pre>
 * SSE 跟 pull 兩個端點共用。
 */
@Component
public class ScanEventWire {

    public static final String TIMED_OUT_MESSAGE = "Request timed out";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper om;

    public ScanEventWire(ObjectMapper om) {
        this.om = om;
    }

    public Map<String, Object> toWire(ScanJobEvent ev) {
        Map<String, Object> m = new LinkedHashMap<>();
        switch (ev.kind()) {
            case PROGRESS -> {
                m.put("type", "progress");
                m.put("stage", ev.stage());
                m.put("progress", ev.progress());
            }
            case RESULT -> {
                m.put("type", "result");
                // 欄位名稱跟著全域 naming strategy 走（snake_case）
                m.putAll(om.convertValue(ev.result(), MAP_TYPE));
            }
            case ERROR -> {
                m.put("type", "error");
                m.put("message", ev.message());
            }
        }
        return m;
    }

    public List<Map<String, Object>> toWire(List<ScanJobEvent> events) {
        return events.stream().map(this::toWire).toList();
    }

    public static Map<String, Object> timedOut() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", "error");
        m.put("message", TIMED_OUT_MESSAGE);
        return m;
    }
}
