package com.olap.bench.controller;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import com.olap.bench.domain.BenchmarkResult;
import com.olap.bench.domain.GroupedReport;
import com.olap.bench.domain.GroupedRow;
import com.olap.bench.domain.UnknownQuerySetException;
import com.olap.bench.repository.EngineUnavailableException;
import com.olap.bench.service.BenchmarkService;
import com.olap.bench.service.grouped.GroupedBenchmarkService;
import com.olap.bench.util.CorrelationIdFilter;

/**
 * Web layer of the benchmark endpoints, services mocked.
 */
@WebMvcTest(BenchmarkController.class)
class BenchmarkControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BenchmarkService benchmarkService;

    @MockBean
    private GroupedBenchmarkService groupedBenchmarkService;

    private static BenchmarkResult result(int concurrency, int batchSize) {
        return new BenchmarkResult("3.2", 600, concurrency, batchSize, 1.5, 6000, 1700000000L, 600, 0, null);
    }

    @Test
    void runQuerySet_ShouldReturnResultWithWireNames() throws Exception {
        // Given
        when(benchmarkService.run("3.2", 4, 2)).thenReturn(List.of(result(4, 2)));

        // When / Then
        mockMvc.perform(get("/api/query/3.2").param("concurrency", "4").param("batchSize", "2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].name").value("3.2"))
            .andExpect(jsonPath("$[0].iterations").value(600))
            .andExpect(jsonPath("$[0].batchsize").value(2))
            .andExpect(jsonPath("$[0].columncount").value(6000))
            .andExpect(jsonPath("$[0].resultfile").doesNotExist());
    }

    @Test
    @DisplayName("Without concurrency the service is asked for a sweep with the default batch size")
    void runQuerySet_ShouldPassMissingConcurrencyThrough() throws Exception {
        when(benchmarkService.run("3.2", null, 1)).thenReturn(List.of(result(1, 1), result(1, 2)));

        mockMvc.perform(get("/api/query/3.2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2));

        verify(benchmarkService).run("3.2", null, 1);
    }

    @Test
    void runQuerySet_ShouldAnswer404ForUnknownQuerySet() throws Exception {
        when(benchmarkService.run(eq("9.9"), eq(1), anyInt())).thenThrow(new UnknownQuerySetException("9.9"));

        mockMvc.perform(get("/api/query/9.9").param("concurrency", "1"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.status").value(404))
            .andExpect(jsonPath("$.message").value("Unknown query set: 9.9"))
            .andExpect(jsonPath("$.path").value("/api/query/9.9"))
            .andExpect(jsonPath("$.correlationId").exists());
    }

    @Test
    void runQuerySet_ShouldAnswer400ForInvalidConcurrency() throws Exception {
        when(benchmarkService.run("3.2", -2, 1))
            .thenThrow(new IllegalArgumentException("Concurrency must be at least 1, was -2"));

        mockMvc.perform(get("/api/query/3.2").param("concurrency", "-2"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Concurrency must be at least 1, was -2"));
    }

    @Test
    void runQuerySet_ShouldAnswer400ForNonNumericBatchSize() throws Exception {
        mockMvc.perform(get("/api/query/3.2").param("concurrency", "2").param("batchSize", "many"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Invalid value for parameter 'batchSize': many"));

        verify(benchmarkService, never()).run(eq("3.2"), eq(2), anyInt());
    }

    @Test
    void runQuerySet_ShouldAnswer503WhenEngineIsDown() throws Exception {
        when(benchmarkService.run("3.2", 1, 1))
            .thenThrow(new EngineUnavailableException("Engine unreachable: refused", null));

        mockMvc.perform(get("/api/query/3.2").param("concurrency", "1"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("Service Unavailable"));
    }

    @Test
    void runGroupedFamily_ShouldUseDefaultConcurrencyWhenMissing() throws Exception {
        GroupedRow row = GroupedRow.builder().family("2.3").year(1992).brand("MFGR#2221").brandNumber(21)
            .result(99L).build();
        when(groupedBenchmarkService.run("2.3")).thenReturn(new GroupedReport("2.3", 32, 0.2, 1L, 0, List.of(row)));

        mockMvc.perform(get("/api/grouped/2.3"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.family").value("2.3"))
            .andExpect(jsonPath("$.concurrency").value(32))
            .andExpect(jsonPath("$.rows[0].brand").value("MFGR#2221"))
            .andExpect(jsonPath("$.rows[0].result").value(99))
            .andExpect(jsonPath("$.rows[0].failure_reason").doesNotExist());

        verify(groupedBenchmarkService, never()).run(eq("2.3"), anyInt());
    }

    @Test
    void runGroupedFamily_ShouldPassConcurrency() throws Exception {
        when(groupedBenchmarkService.run("4.1", 8)).thenReturn(new GroupedReport("4.1", 8, 0.1, 1L, 0, List.of()));

        mockMvc.perform(get("/api/grouped/4.1").param("concurrency", "8"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.concurrency").value(8));
    }

    @Test
    void listEndpoints_ShouldExposeCatalogs() throws Exception {
        when(benchmarkService.querySets())
            .thenReturn(List.of(new BenchmarkService.QuerySetInfo("test", 72, List.of(6, 4, 3))));
        when(groupedBenchmarkService.familyNames()).thenReturn(List.of("2.1", "2.2"));

        mockMvc.perform(get("/api/query-sets"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].name").value("test"))
            .andExpect(jsonPath("$[0].cardinalities[2]").value(3));

        mockMvc.perform(get("/api/grouped"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[1]").value("2.2"));
    }

    @Test
    void getVersion_ShouldUseLowercaseFieldNames() throws Exception {
        when(benchmarkService.version()).thenReturn(new BenchmarkService.VersionInfo("v1.0.0", "v0.9.3"));

        mockMvc.perform(get("/api/version"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.demoversion").value("v1.0.0"))
            .andExpect(jsonPath("$.engineversion").value("v0.9.3"));
    }

    @Test
    void request_ShouldEchoValidCorrelationId() throws Exception {
        String correlationId = "3f2b8c1e-5d4a-4e6b-9c7d-1a2b3c4d5e6f";
        when(benchmarkService.version()).thenReturn(new BenchmarkService.VersionInfo("v1.0.0", "unknown"));

        mockMvc.perform(get("/api/version").header(CorrelationIdFilter.CORRELATION_ID_HEADER, correlationId))
            .andExpect(status().isOk())
            .andExpect(header().string(CorrelationIdFilter.CORRELATION_ID_HEADER, correlationId));
    }
}
