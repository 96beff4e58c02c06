package com.di.fragnova.config;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MdcRequestFilter Tests")
class MdcRequestFilterTest {

    private final MdcRequestFilter filter = new MdcRequestFilter();

    @AfterEach
    void clear() {
        MDC.clear();
    }

    private Map<String, String> contextDuring(MockHttpServletRequest request, MockHttpServletResponse response)
            throws Exception {
        Map<String, String> seen = new HashMap<>();
        FilterChain chain = (req, res) -> seen.putAll(MDC.getCopyOfContextMap());
        filter.doFilter(request, response, chain);
        return seen;
    }

    @Test
    @DisplayName("Epoch calls are tagged with their operation and a generated request id")
    void tagsResidencyCall() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/residency/epochs");
        MockHttpServletResponse response = new MockHttpServletResponse();

        Map<String, String> seen = contextDuring(request, response);

        assertEquals("residency.epochs", seen.get(MdcRequestFilter.OPERATION));
        assertEquals("/api/residency/epochs", seen.get(MdcRequestFilter.REQUEST_PATH));
        assertTrue(seen.get(MdcRequestFilter.REQUEST_ID).startsWith("req-"));
        assertEquals(seen.get(MdcRequestFilter.REQUEST_ID), response.getHeader(MdcRequestFilter.REQUEST_ID_HEADER));
        assertNull(MDC.get(MdcRequestFilter.OPERATION));
        assertNull(MDC.get(MdcRequestFilter.REQUEST_ID));
    }

    @Test
    @DisplayName("A caller-supplied request id is kept and echoed")
    void keepsCallerRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/placement/plan");
        request.addHeader(MdcRequestFilter.REQUEST_ID_HEADER, "plan-42");
        MockHttpServletResponse response = new MockHttpServletResponse();

        Map<String, String> seen = contextDuring(request, response);

        assertEquals("plan-42", seen.get(MdcRequestFilter.REQUEST_ID));
        assertEquals("placement.plan", seen.get(MdcRequestFilter.OPERATION));
        assertEquals("plan-42", response.getHeader(MdcRequestFilter.REQUEST_ID_HEADER));
    }

    @Test
    @DisplayName("Paths outside the API carry no operation")
    void noOperationOutsideApi() throws Exception {
        Map<String, String> seen = contextDuring(new MockHttpServletRequest("GET", "/actuator/health"),
                new MockHttpServletResponse());

        assertFalse(seen.containsKey(MdcRequestFilter.OPERATION));
        assertNotNull(seen.get(MdcRequestFilter.REQUEST_ID));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "/api/residency, residency",
            "/api/residency/, residency",
            "/api/residency/rebalance, residency.rebalance",
            "/api/placement/plan/extra, placement.plan"
    })
    @DisplayName("Operation is area.action from the API path")
    void operationFromPath(String uri, String operation) {
        assertEquals(operation, MdcRequestFilter.operation(uri));
    }

    @Test
    @DisplayName("Oversized request ids are replaced")
    void oversizedRequestIdReplaced() {
        assertTrue(MdcRequestFilter.requestId("x".repeat(65)).startsWith("req-"));
        assertTrue(MdcRequestFilter.requestId("  ").startsWith("req-"));
    }
}
