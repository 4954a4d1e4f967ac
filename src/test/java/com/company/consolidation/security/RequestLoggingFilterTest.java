package com.company.consolidation.security;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RequestLoggingFilterTest {

    private final RequestLoggingFilter filter = new RequestLoggingFilter();

    @Test
    void shouldPropagateIncomingRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/consolidation/batches");
        request.addHeader(RequestLoggingFilter.REQUEST_ID_HEADER, "req-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seen.set(MDC.get(RequestLoggingFilter.MDC_REQUEST_ID_KEY));
            }
        });

        assertEquals("req-42", seen.get());
        assertEquals("req-42", response.getHeader(RequestLoggingFilter.REQUEST_ID_HEADER));
        assertNull(MDC.get(RequestLoggingFilter.MDC_REQUEST_ID_KEY));
    }

    @Test
    void shouldGenerateRequestIdWhenMissing() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/health");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertNotNull(response.getHeader(RequestLoggingFilter.REQUEST_ID_HEADER));
    }
}
