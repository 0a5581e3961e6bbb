package com.olap.bench.repository.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.net.ConnectException;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.olap.bench.domain.EngineResult;
import com.olap.bench.repository.EngineCallException;
import com.olap.bench.repository.EngineUnavailableException;

/**
 * Wire format of the engine's HTTP API, against a mock server.
 */
class HttpBitmapEngineClientTest {

    private static final String QUERY_URL = "http://engine:10101/index/ssb1/query";

    private MockRestServiceServer server;
    private HttpBitmapEngineClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://engine:10101");
        server = MockRestServiceServer.bindTo(builder).build();
        client = new HttpBitmapEngineClient(builder.build(), "ssb1", new ObjectMapper());
    }

    @Test
    @DisplayName("Statements are posted as text and every result element is parsed")
    void query_ShouldPostStatementsAndParseResults() {
        // Given
        String pql = "Sum(Bitmap(frame=\"lo_year\", rowID=1), frame=\"lo_revenue\")\n"
            + "Count(Bitmap(frame=\"p_mfgr\", rowID=0))";
        server.expect(requestTo(QUERY_URL))
            .andExpect(method(HttpMethod.POST))
            .andExpect(content().string(pql))
            .andRespond(withSuccess(
                "{\"results\":[{\"value\":1200,\"count\":3},{\"sum\":7,\"count\":1},4500]}",
                MediaType.APPLICATION_JSON));

        // When
        List<EngineResult> results = client.query(pql);

        // Then
        assertThat(results).containsExactly(
            new EngineResult(1200, 3),
            new EngineResult(7, 1),
            new EngineResult(4500, 4500));
        server.verify();
    }

    @Test
    void query_ShouldTurnErrorBodyIntoEngineCallException() {
        server.expect(requestTo(QUERY_URL))
            .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":\"executing: invalid argument value\"}"));

        assertThatThrownBy(() -> client.query("Sum(Range(frame=\"lo_discount\", lo_discount >< [1,3]))"))
            .isInstanceOf(EngineCallException.class)
            .isNotInstanceOf(EngineUnavailableException.class)
            .hasMessage("executing: invalid argument value")
            .satisfies(e -> assertThat(((EngineCallException) e).isUnsupportedOperator()).isTrue());
    }

    @Test
    void query_ShouldKeepPlainTextErrorBody() {
        server.expect(requestTo(QUERY_URL))
            .andRespond(withServerError().body("frame not found"));

        assertThatThrownBy(() -> client.query("Sum(Bitmap(frame=\"nope\", rowID=0))"))
            .isInstanceOf(EngineCallException.class)
            .hasMessageContaining("frame not found");
    }

    @Test
    void query_ShouldReportUnreachableEngineAsUnavailable() {
        server.expect(requestTo(QUERY_URL))
            .andRespond(request -> {
                throw new ConnectException("Connection refused");
            });

        assertThatThrownBy(() -> client.query("Count(Bitmap(frame=\"p_mfgr\", rowID=0))"))
            .isInstanceOf(EngineUnavailableException.class)
            .hasMessageContaining("Connection refused");
    }

    @Test
    void query_ShouldRejectResponseWithoutResults() {
        server.expect(requestTo(QUERY_URL))
            .andRespond(withSuccess("{\"error\":\"index not found\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.query("Count(Bitmap(frame=\"p_mfgr\", rowID=0))"))
            .isInstanceOf(EngineCallException.class)
            .hasMessage("index not found");
    }

    @Test
    void countRecords_ShouldSumManufacturerCounts() {
        server.expect(requestTo(QUERY_URL))
            .andExpect(content().string(containsString("rowID=4))")))
            .andRespond(withSuccess("{\"results\":[10,20,30,40,50]}", MediaType.APPLICATION_JSON));

        assertThat(client.countRecords()).isEqualTo(150);
    }

    @Test
    void version_ShouldReadVersionField() {
        server.expect(requestTo("http://engine:10101/version"))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withSuccess("{\"version\":\"v0.9.3\"}", MediaType.APPLICATION_JSON));

        assertThat(client.version()).contains("v0.9.3");
    }

    @Test
    void version_ShouldBeEmptyWhenEngineFails() {
        server.expect(requestTo("http://engine:10101/version"))
            .andRespond(withServerError());

        assertThat(client.version()).isEmpty();
    }
}
