package org.iceforge.runa.olap.service;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.iceforge.runa.olap.config.OlapProperties;
import org.iceforge.runa.olap.model.AggregateRow;
import org.iceforge.runa.olap.model.AggregationRequest;
import org.iceforge.runa.olap.model.Dimension;
import org.iceforge.runa.olap.web.SkadiQueryRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SkadiAggregationExecutorTest {

    private static final String ROWS = """
            {
              "columns": ["geo_value", "time_value", "product_value",
                          "geo_grouping", "time_grouping", "product_grouping",
                          "total_quantity", "total_revenue", "transaction_count", "avg_unit_price"],
              "rows": [
                ["North", "Q1", "Bikes", 0, 0, 0, 3, 1150.00, 2, 283.33],
                [null, "Q1", "Bikes", 0, 0, 0, 7, 70.00, 1, 10.0],
                [null, null, null, 1, 1, 1, 10, 1220.00, 3, null]
              ]
            }
            """;

    private final HierarchyCatalog catalog = TestCatalogs.standard();
    private final AggregationRequestBuilder builder = new AggregationRequestBuilder(catalog);

    private MockWebServer skadi;
    private SkadiClient client;
    private SkadiAggregationExecutor executor;

    @BeforeEach
    void setUp() throws IOException {
        skadi = new MockWebServer();
        skadi.start();

        OlapProperties props = new OlapProperties();
        props.getSkadi().setBaseUrl(skadi.url("/").toString());
        props.getSkadi().setTimeout(Duration.ofSeconds(5));
        WebClient webClient = WebClient.builder().baseUrl(props.getSkadi().getBaseUrl()).build();

        client = new SkadiClient(webClient, props);
        executor = new SkadiAggregationExecutor(client, new AggregationSqlCompiler(catalog), props);
    }

    @AfterEach
    void tearDown() throws IOException {
        skadi.shutdown();
    }

    @Test
    void rowsReturnedInlineAreMapped() throws Exception {
        skadi.enqueue(json(ROWS));
        AggregationRequest req = builder.cube(new NavigationState(catalog, 2, 2, 1), builder.filter("Year", 2019));

        List<AggregateRow> rows = executor.execute(req);

        assertThat(rows).hasSize(3);
        assertThat(rows.get(0).dimensionValues()).containsExactly("North", "Q1", "Bikes");
        assertThat(rows.get(0).measures().revenue()).isEqualByComparingTo("1150.00");
        assertThat(rows.get(1).value(Dimension.GEOGRAPHY)).isNull();
        assertThat(rows.get(1).isCollapsed(Dimension.GEOGRAPHY)).isFalse();
        assertThat(rows.get(2).flags().bitmask()).isEqualTo(0b111);
        assertThat(rows.get(2).measures().avgUnitPrice()).isNull();

        RecordedRequest submit = skadi.takeRequest(1, TimeUnit.SECONDS);
        assertThat(submit).isNotNull();
        assertThat(submit.getMethod()).isEqualTo("POST");
        assertThat(submit.getPath()).contains("/api/v1/queries");
        String body = submit.getBody().readUtf8();
        assertThat(body).contains("GROUP BY CUBE").contains("\"parameters\":[2019]").contains("jdbc:postgresql");
    }

    @Test
    void queryIdIsFollowedByAResultsFetch() throws Exception {
        skadi.enqueue(json("{\"queryId\":\"q-7\"}"));
        skadi.enqueue(json(ROWS));

        List<AggregateRow> rows = executor.execute(builder.groupingSets(new NavigationState(catalog, 2, 2, 1), null));

        assertThat(rows).hasSize(3);
        RecordedRequest submit = skadi.takeRequest(1, TimeUnit.SECONDS);
        RecordedRequest fetch = skadi.takeRequest(1, TimeUnit.SECONDS);
        assertThat(submit).isNotNull();
        assertThat(fetch).isNotNull();
        assertThat(fetch.getMethod()).isEqualTo("GET");
        assertThat(fetch.getPath()).contains("/api/v1/queries/q-7/results");
    }

    @Test
    void clientEmitsTheFetchedResult() {
        skadi.enqueue(json("{\"queryId\":\"q-9\"}"));
        skadi.enqueue(json("{\"queryId\":\"q-9\",\"columns\":[\"geo_value\"],\"rows\":[]}"));

        SkadiQueryRequest body = new SkadiQueryRequest();
        body.setSql("SELECT 1");
        body.setParameters(List.of());

        StepVerifier.create(client.runQuery(body))
                .assertNext(r -> {
                    assertThat(r.getQueryId()).isEqualTo("q-9");
                    assertThat(r.getColumns()).containsExactly("geo_value");
                    assertThat(r.getRows()).isEmpty();
                })
                .verifyComplete();
    }

    @Test
    void serverErrorBecomesExecutionFailure() {
        skadi.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        assertThatThrownBy(() -> executor.execute(builder.cube(new NavigationState(catalog, 2, 2, 1), null)))
                .isInstanceOf(AggregationExecutionException.class)
                .hasMessageContaining("Skadi");
    }

    @Test
    void answerWithoutRowsOrQueryIdIsAnError() {
        skadi.enqueue(json("{\"status\":\"ok\"}"));

        assertThatThrownBy(() -> executor.execute(builder.cube(new NavigationState(catalog, 2, 2, 1), null)))
                .isInstanceOf(AggregationExecutionException.class)
                .hasMessageContaining("neither rows nor a queryId");
    }

    @Test
    void missingGroupingColumnIsAnError() {
        skadi.enqueue(json("{\"columns\":[\"geo_value\"],\"rows\":[[\"North\"]]}"));

        assertThatThrownBy(() -> executor.execute(builder.cube(new NavigationState(catalog, 2, 2, 1), null)))
                .isInstanceOf(AggregationExecutionException.class)
                .hasMessageContaining("geo_grouping");
    }

    @Test
    void unreadableMeasuresAreExecutionFailures() {
        skadi.enqueue(json(singleRow("7, \"n/a\", 1, null")));
        skadi.enqueue(json(singleRow("1.5, 70.00, 1, null")));
        AggregationRequest req = builder.cube(new NavigationState(catalog, 2, 2, 1), null);

        assertThatThrownBy(() -> executor.execute(req))
                .isInstanceOf(AggregationExecutionException.class)
                .hasMessageContaining("Unreadable measure")
                .hasCauseInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> executor.execute(req))
                .isInstanceOf(AggregationExecutionException.class)
                .hasMessageContaining("Unreadable measure")
                .hasCauseInstanceOf(ArithmeticException.class);
    }

    @Test
    void shortOrMissingRowsAreExecutionFailures() {
        skadi.enqueue(json(ROWS.replace("[\"North\", \"Q1\", \"Bikes\", 0, 0, 0, 3, 1150.00, 2, 283.33]",
                "[\"North\", \"Q1\", \"Bikes\", 0, 0, 0]")));
        skadi.enqueue(json(ROWS.replace("[\"North\", \"Q1\", \"Bikes\", 0, 0, 0, 3, 1150.00, 2, 283.33]", "null")));
        AggregationRequest req = builder.cube(new NavigationState(catalog, 2, 2, 1), null);

        assertThatThrownBy(() -> executor.execute(req))
                .isInstanceOf(AggregationExecutionException.class)
                .hasMessageContaining("has 6 values for 10 columns");
        assertThatThrownBy(() -> executor.execute(req))
                .isInstanceOf(AggregationExecutionException.class)
                .hasMessageContaining("has no values");
    }

    private static String singleRow(String measures) {
        return """
                {
                  "columns": ["geo_value", "time_value", "product_value",
                              "geo_grouping", "time_grouping", "product_grouping",
                              "total_quantity", "total_revenue", "transaction_count", "avg_unit_price"],
                  "rows": [["North", "Q1", "Bikes", 0, 0, 0, %s]]
                }
                """.formatted(measures);
    }

    private static MockResponse json(String body) {
        return new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody(body);
    }
}
