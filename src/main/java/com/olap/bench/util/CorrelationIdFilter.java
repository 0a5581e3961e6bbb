package com.olap.bench.util;

import java.io.IOException;
import java.util.UUID;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;

import lombok.extern.slf4j.Slf4j;

/**
 * Servlet filter that tags every request with a correlation id.
 *
 * The id is taken from the {@code X-Correlation-ID} header when it holds a
 * UUID, otherwise generated. It is put into the MDC under
 * {@code correlationId} (see logback-spring.xml), echoed in the response
 * header and attached to the current span.
 *
 * Benchmark runs fan out to worker threads. Workers pick the id up through
 * {@link #getCurrentCorrelationId()} and {@link #setCorrelationId(String)},
 * so worker log lines carry the id of the request that started the run.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements Filter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private static final String CORRELATION_ID_MDC_KEY = "correlationId";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        Span currentSpan = Span.current();

        try {
            String correlationId = extractOrGenerateCorrelationId(httpRequest);

            MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
            httpResponse.setHeader(CORRELATION_ID_HEADER, correlationId);

            currentSpan.setAttribute("correlation.id", correlationId);
            currentSpan.setAttribute("http.request.uri", httpRequest.getRequestURI());

            log.debug("Processing request with correlationId: {} traceId: {}",
                correlationId, currentSpan.getSpanContext().getTraceId());

            chain.doFilter(request, response);

            currentSpan.setStatus(StatusCode.OK);

        } catch (IOException | ServletException | RuntimeException e) {
            currentSpan.recordException(e);
            currentSpan.setStatus(StatusCode.ERROR, "Request processing failed: " + e.getMessage());
            throw e;
        } finally {
            // MDC is thread-local and servlet threads are pooled
            MDC.remove(CORRELATION_ID_MDC_KEY);
        }
    }

    private String extractOrGenerateCorrelationId(HttpServletRequest request) {
        String correlationId = request.getHeader(CORRELATION_ID_HEADER);

        if (correlationId != null && !correlationId.isBlank()) {
            try {
                UUID.fromString(correlationId);
                return correlationId;
            } catch (IllegalArgumentException e) {
                log.warn("Invalid correlation ID in header: {}. Generating new one.", correlationId);
            }
        }

        return UUID.randomUUID().toString();
    }

    /**
     * @return correlation id of the current thread, or null if not set
     */
    public static String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    /**
     * Sets the correlation id on a thread that did not go through the filter.
     * Null is ignored.
     */
    public static void setCorrelationId(String correlationId) {
        if (correlationId != null) {
            MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
        }
    }

    public static void clearCorrelationId() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
    }
}
