package com.olap.bench.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.olap.bench.domain.BenchmarkResult;
import com.olap.bench.domain.GroupedReport;
import com.olap.bench.service.BenchmarkService;
import com.olap.bench.service.grouped.GroupedBenchmarkService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST controller for benchmark runs.
 *
 * Endpoints:
 * - GET /api/query-sets: catalog of monolithic query sets
 * - GET /api/query/{name}: run a query set, or sweep it when no concurrency is given
 * - GET /api/grouped: grouped family names
 * - GET /api/grouped/{name}: run a grouped family
 * - GET /api/version: service and engine versions
 *
 * Runs are synchronous: the response is sent when the run is over.
 * Unknown names answer 404 and invalid concurrency or batch size 400, see
 * {@link com.olap.bench.util.GlobalExceptionHandler}.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Benchmarks", description = "Star-schema query benchmarks against the bitmap engine")
public class BenchmarkController {

    private final BenchmarkService benchmarkService;
    private final GroupedBenchmarkService groupedBenchmarkService;

    @GetMapping("/query-sets")
    @Operation(summary = "List query sets",
               description = "Names, iteration counts and dimension cardinalities of the monolithic query sets")
    public ResponseEntity<List<BenchmarkService.QuerySetInfo>> listQuerySets() {
        log.debug("API: List query sets");
        return ResponseEntity.ok(benchmarkService.querySets());
    }

    @GetMapping("/query/{name}")
    @Operation(summary = "Run a query set",
               description = "Dispatches every query of the set with the given concurrency and batch size. "
                   + "Without concurrency (or with 0) the set is run once per cell of the sweep grid.")
    public ResponseEntity<List<BenchmarkResult>> runQuerySet(
            @PathVariable String name,
            @RequestParam(required = false) Integer concurrency,
            @RequestParam(defaultValue = "1") int batchSize) {

        log.info("API: Run query set - name={}, concurrency={}, batchSize={}", name, concurrency, batchSize);

        return ResponseEntity.ok(benchmarkService.run(name, concurrency, batchSize));
    }

    @GetMapping("/grouped")
    @Operation(summary = "List grouped families",
               description = "Families that emulate GROUP BY / ORDER BY with one point query per group")
    public ResponseEntity<List<String>> listGroupedFamilies() {
        log.debug("API: List grouped families");
        return ResponseEntity.ok(groupedBenchmarkService.familyNames());
    }

    @GetMapping("/grouped/{name}")
    @Operation(summary = "Run a grouped family",
               description = "Queries every group of the family and returns the rows in ORDER BY order")
    public ResponseEntity<GroupedReport> runGroupedFamily(
            @PathVariable String name,
            @RequestParam(required = false) Integer concurrency) {

        log.info("API: Run grouped family - name={}, concurrency={}", name, concurrency);

        GroupedReport report = concurrency != null
            ? groupedBenchmarkService.run(name, concurrency)
            : groupedBenchmarkService.run(name);
        return ResponseEntity.ok(report);
    }

    @GetMapping("/version")
    @Operation(summary = "Get versions", description = "Version of this service and of the engine")
    public ResponseEntity<BenchmarkService.VersionInfo> getVersion() {
        return ResponseEntity.ok(benchmarkService.version());
    }
}
