package com.olap.bench.util;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs engine calls that exceed a latency threshold.
 *
 * Configuration:
 * - slow.payload.threshold.ms: threshold in milliseconds (default: 1000)
 * - slow.payload.preview.chars: how much of the payload text to log (default: 200)
 *
 * Usage:
 * <pre>
 * slowPayloadLogger.logIfSlow(queryName, startMs, payload.size(), payload.text());
 * </pre>
 *
 * @see MetricsHelper#recordSlowPayload
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlowPayloadLogger {

    private final MetricsHelper metricsHelper;

    @Value("${slow.payload.threshold.ms:1000}")
    private long thresholdMs;

    @Value("${slow.payload.preview.chars:200}")
    private int previewChars;

    /**
     * @param queryName query set or family name
     * @param startTimeMs engine call start, {@link System#currentTimeMillis()}
     * @param statements statements in the payload
     * @param text payload text
     * @return true if the call was slow
     */
    public boolean logIfSlow(String queryName, long startTimeMs, int statements, String text) {
        long durationMs = System.currentTimeMillis() - startTimeMs;
        if (durationMs <= thresholdMs) {
            return false;
        }

        metricsHelper.recordSlowPayload(queryName, durationMs, thresholdMs);
        log.warn("Slow engine call: query={}, statements={}, duration={}ms (threshold={}ms), payload={}",
            queryName, statements, durationMs, thresholdMs, preview(text));
        return true;
    }

    private String preview(String text) {
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= previewChars ? flat : flat.substring(0, previewChars) + "...";
    }
}
