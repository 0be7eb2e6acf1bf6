package com.foodvision.backend.common.web;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class RequestIdFilterTest {

    @Test
    void keeps_safe_incoming_id() {
        assertThat(RequestIdFilter.acceptOrNew(" app-42.retry_1 ")).isEqualTo("app-42.retry_1");
    }

    @Test
    void replaces_missing_or_unsafe_id() {
        assertThat(RequestIdFilter.acceptOrNew(null)).matches("[0-9a-f]{32}");
        assertThat(RequestIdFilter.acceptOrNew("a b\nc")).matches("[0-9a-f]{32}");
        assertThat(RequestIdFilter.acceptOrNew("x".repeat(65))).matches("[0-9a-f]{32}");
    }

    @Test
    void echoes_id_and_sets_attribute() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/health");
        req.addHeader(RequestIdFilter.HEADER, "rid-7");
        MockHttpServletResponse res = new MockHttpServletResponse();

        new RequestIdFilter().doFilter(req, res, new MockFilterChain());

        assertThat(res.getHeader(RequestIdFilter.HEADER)).isEqualTo("rid-7");
        assertThat(req.getAttribute(RequestIdFilter.ATTR)).isEqualTo("rid-7");
        assertThat(RequestIdFilter.currentOrNull()).isNull();
    }
}
