package com.contacthub.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void echoesCallerRequestIdAndClearsMdc() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/users/me");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "  abc-123  ");
        MockHttpServletResponse response = new MockHttpServletResponse();
        String[] seen = new String[1];

        filter.doFilter(request, response, (req, res) -> seen[0] = MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));

        assertThat(seen[0]).isEqualTo("abc-123");
        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("abc-123");
        assertThat(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)).isNull();
    }

    @Test
    void generatesIdWhenMissingAndCapsLength() throws Exception {
        MockHttpServletResponse generated = new MockHttpServletResponse();
        filter.doFilter(new MockHttpServletRequest(), generated, new MockFilterChain());
        assertThat(generated.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).hasSize(36);

        MockHttpServletRequest longId = new MockHttpServletRequest();
        longId.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "x".repeat(100));
        MockHttpServletResponse capped = new MockHttpServletResponse();
        filter.doFilter(longId, capped, new MockFilterChain());
        assertThat(capped.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).hasSize(64);
    }
}
