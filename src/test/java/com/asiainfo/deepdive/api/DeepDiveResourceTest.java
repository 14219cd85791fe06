package com.asiainfo.deepdive.api;

import com.asiainfo.deepdive.infra.persistence.AggregateQuery;
import com.asiainfo.deepdive.infra.persistence.DataSourceException;
import com.asiainfo.deepdive.infra.persistence.WarehouseClient;
import com.asiainfo.deepdive.infra.persistence.WarehouseRow;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;

import java.util.List;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

/**
 * DeepDiveResource 集成测试（数据仓库为 Mock）
 */
@QuarkusTest
class DeepDiveResourceTest {

    @InjectMock
    WarehouseClient warehouse;

    static final String BODY = """
            {
              "perspective": "pid",
              "period1": {"start": "2025-09-01", "end": "2025-09-30"},
              "period2": {"start": "2025-10-01", "end": "2025-10-31"},
              "filters": {"team": ["APAC"]}
            }
            """;

    static List<WarehouseRow> rows(AggregateQuery q) {
        if (q.range().start().getMonthValue() == 9) {
            return List.of(
                    new WarehouseRow("101", "Pub 101", 1000L, 800L, 500.0, 2.0, 3),
                    new WarehouseRow("103", "Pub 103", 1000L, 800L, 100.0, 2.0, 1));
        }
        return List.of(
                new WarehouseRow("101", "Pub 101", 1000L, 800L, 800.0, 2.0, 3),
                new WarehouseRow("102", "Pub 102", 1000L, 800L, 200.0, 2.0, 1));
    }

    @BeforeEach
    void setUp() {
        Mockito.when(warehouse.queryAggregates(ArgumentMatchers.any()))
                .thenAnswer(inv -> rows(inv.getArgument(0)));
    }

    @Test
    void testAnalyze() {
        given()
                .contentType(ContentType.JSON)
                .body(BODY)
                .when()
                .post("/api/v2/deep-dive/analyze")
                .then()
                .statusCode(200)
                .body("status", equalTo("success"))
                .body("perspective", equalTo("pid"))
                .body("data", hasSize(3))
                .body("data.entityId", hasItems("101", "102", "103"))
                .body("data.find { it.entityId == '101' }.tier", equalTo("A"))
                .body("data.find { it.entityId == '102' }.tier", equalTo("NEW-B"))
                .body("data.find { it.entityId == '103' }.lifecycleStatus", equalTo("lost"))
                .body("data.find { it.entityId == '103' }.displayTier", equalTo("LOST"))
                .body("data.find { it.entityId == '103' }.tier", equalTo("LOST-A"))
                .body("summary.totalItems", equalTo(3))
                .body("summary.tierCounts.LOST", equalTo(1));

        Mockito.verify(warehouse, Mockito.times(2)).queryAggregates(ArgumentMatchers.any());
    }

    @Test
    void testTierFilter() {
        given()
                .contentType(ContentType.JSON)
                .body("""
                        {
                          "perspective": "pid",
                          "period1": {"start": "2025-09-01", "end": "2025-09-30"},
                          "period2": {"start": "2025-10-01", "end": "2025-10-31"},
                          "tierFilter": ["new"]
                        }
                        """)
                .when()
                .post("/api/v2/deep-dive/analyze")
                .then()
                .statusCode(200)
                .body("data.entityId", contains("102"))
                .body("summary.totalItems", equalTo(1));
    }

    @Test
    void testUnknownPerspectiveIsBadRequest() {
        given()
                .contentType(ContentType.JSON)
                .body(BODY.replace("\"pid\"", "\"country\""))
                .when()
                .post("/api/v2/deep-dive/analyze")
                .then()
                .statusCode(400)
                .body("status", equalTo("error"))
                .body("retryable", equalTo(false))
                .body("error", containsString("country"));
    }

    @Test
    void testInvertedPeriodIsBadRequest() {
        given()
                .contentType(ContentType.JSON)
                .body(BODY.replace("\"2025-09-01\"", "\"2025-12-01\""))
                .when()
                .post("/api/v2/deep-dive/analyze")
                .then()
                .statusCode(400);
    }

    @Test
    void testNonAncestorFilterIsBadRequest() {
        given()
                .contentType(ContentType.JSON)
                .body(BODY.replace("\"team\"", "\"zid\""))
                .when()
                .post("/api/v2/deep-dive/analyze")
                .then()
                .statusCode(400)
                .body("error", containsString("zid"));

        Mockito.verify(warehouse, Mockito.never()).queryAggregates(ArgumentMatchers.any());
    }

    @Test
    void testWarehouseFailureIsRetryable() {
        Mockito.when(warehouse.queryAggregates(ArgumentMatchers.any()))
                .thenThrow(new DataSourceException("Quota exceeded"));

        given()
                .contentType(ContentType.JSON)
                .body(BODY)
                .when()
                .post("/api/v2/deep-dive/analyze")
                .then()
                .statusCode(502)
                .body("status", equalTo("error"))
                .body("retryable", equalTo(true))
                .body("error", equalTo("Quota exceeded"));
    }
}
