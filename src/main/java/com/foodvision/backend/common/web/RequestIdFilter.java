package com.foodvision.backend.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 每個 request 一個 rid：header 有帶就沿用（格式不對就換新的），
 * 放進 request attribute + MDC，並回寫到 response header。
 * <p>
 * scan job 在背景跑，rid 由 ScanJobService 從 MDC 帶過去，所以 log 能串起 upload 跟 job。
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTR = "requestId";
    public static final String MDC_KEY = "rid";

    // 會進 log pattern，不收奇怪字元 / 超長字串
    private static final Pattern SAFE_RID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String rid = acceptOrNew(req.getHeader(HEADER));

        req.setAttribute(ATTR, rid);
        MDC.put(MDC_KEY, rid);
        res.setHeader(HEADER, rid);

        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    static String acceptOrNew(String incoming) {
        if (incoming != null) {
            String t = incoming.trim();
            if (SAFE_RID.matcher(t).matches()) return t;
        }
        return newId();
    }

    /** 背景 thread 沒有 request，只能從 MDC 拿 */
    public static String currentOrNull() {
        String rid = MDC.get(MDC_KEY);
        return (rid == null || rid.isBlank()) ? null : rid;
    }

    public static String getOrCreate(HttpServletRequest req) {
        Object v = req.getAttribute(ATTR);
        return (v == null) ? newId() : String.valueOf(v);
    }

    private static String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
