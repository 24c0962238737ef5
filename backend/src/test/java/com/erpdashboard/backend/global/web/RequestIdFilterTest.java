package com.erpdashboard.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.servlet.FilterChain;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    @Test
    void safeHeaderIsKept() {
        assertThat(RequestIdFilter.resolveRequestId("  trace-42:a.b  ")).isEqualTo("trace-42:a.b");
    }

    @Test
    void unsafeOrMissingHeaderIsReplaced() {
        String injected = RequestIdFilter.resolveRequestId("abc\nFAKE LOG LINE");
        assertThat(injected).doesNotContain("FAKE");
        assertThat(UUID.fromString(injected)).isNotNull();

        assertThat(UUID.fromString(RequestIdFilter.resolveRequestId(null))).isNotNull();
        assertThat(UUID.fromString(RequestIdFilter.resolveRequestId("x".repeat(65)))).isNotNull();
    }

    @Test
    void requestIdIsVisibleInMdcOnlyDuringTheRequest() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/branches/active");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "req-1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        FilterChain chain = (req, res) -> seen.set(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));
        new RequestIdFilter().doFilter(request, response, chain);

        assertThat(seen.get()).isEqualTo("req-1");
        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("req-1");
        assertThat(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)).isNull();
    }
}
