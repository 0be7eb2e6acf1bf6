package com.foodvision.backend.scan.provider;

import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * 外部呼叫例外 → 錯誤碼（只用在 log / 診斷字串，不往 core 丟）。
 */
public final class ProviderErrorMapper {

    private ProviderErrorMapper() {}

    public static String code(Throwable e) {
        if (e == null) return "PROVIDER_FAILED";

        if (isTimeoutThrowable(e)) return "PROVIDER_TIMEOUT";

        // 自己丟的明確 code
        if (e instanceof IllegalStateException) {
            String m = e.getMessage();
            if (m != null && m.startsWith("PROVIDER_")) return m;
        }

        if (e instanceof RestClientResponseException re) {
            var sc = re.getStatusCode();
            int status = sc.value();
            if (status == 401 || status == 403) return "PROVIDER_AUTH_FAILED";
            if (status == 429) return "PROVIDER_RATE_LIMITED";
            if (status == 408) return "PROVIDER_TIMEOUT";
            if (sc.is5xxServerError()) return "PROVIDER_UPSTREAM_5XX";
            if (sc.is4xxClientError()) return "PROVIDER_BAD_REQUEST";
            return "PROVIDER_FAILED";
        }

        // timeout 已先擋掉，這裡是純網路錯誤
        if (e instanceof ResourceAccessException) return "PROVIDER_NETWORK_ERROR";
        if (e instanceof RestClientException) return "PROVIDER_CLIENT_ERROR";

        return "PROVIDER_FAILED";
    }

    public static String safeMsg(Throwable t) {
        if (t == null) return "";
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }

    /** 含 cause chain；RestClient 常把 timeout 包在 ResourceAccessException 裡 */
    private static boolean isTimeoutThrowable(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof SocketTimeoutException) return true;
            if (c instanceof TimeoutException) return true;
            if ("java.net.http.HttpTimeoutException".equals(c.getClass().getName())) return true;

            String m = c.getMessage();
            if (m != null) {
                String s = m.toLowerCase(Locale.ROOT);
                if (s.contains("timeout") || s.contains("timed out")) return true;
            }
        }
        return false;
    }
}
