package com.olap.bench.controller;

import java.util.List;
import java.util.Locale;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.olap.bench.domain.Dimension;
import com.olap.bench.domain.DimensionEncoder;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-only view of the dimension tables, handy for writing queries by hand.
 */
@Slf4j
@RestController
@RequestMapping("/api/dimensions")
@RequiredArgsConstructor
@Tag(name = "Dimensions", description = "Star-schema value to row id mappings")
public class DimensionController {

    private final DimensionEncoder encoder;

    @GetMapping("/{dimension}")
    @Operation(summary = "List dimension values", description = "Values in row id order")
    public ResponseEntity<List<String>> listValues(@PathVariable String dimension) {
        return ResponseEntity.ok(encoder.values(parse(dimension)));
    }

    @GetMapping("/{dimension}/{value}")
    @Operation(summary = "Look up a row id", description = "404 when the value is not in the dimension")
    public ResponseEntity<DimensionId> lookup(@PathVariable String dimension, @PathVariable String value) {
        Dimension parsed = parse(dimension);
        log.debug("API: Dimension lookup - {} {}", parsed, value);
        return ResponseEntity.ok(new DimensionId(parsed, value, encoder.idOf(parsed, value)));
    }

    private static Dimension parse(String dimension) {
        try {
            return Dimension.valueOf(dimension.toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown dimension: " + dimension, e);
        }
    }

    public record DimensionId(Dimension dimension, String value, int id) {}
}
