package com.asiainfo.deepdive.api;

import com.asiainfo.deepdive.infra.persistence.WarehouseClient;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

/**
 * DrillDownSessionResource 集成测试（数据仓库为 Mock）
 */
@QuarkusTest
class DrillDownSessionResourceTest {

    @InjectMock
    WarehouseClient warehouse;

    private static final String CREATE = """
            {
              "perspective": "team",
              "period1": {"start": "2025-09-01", "end": "2025-09-30"},
              "period2": {"start": "2025-10-01", "end": "2025-10-31"}
            }
            """;

    @BeforeEach
    void setUp() {
        Mockito.when(warehouse.queryAggregates(ArgumentMatchers.any()))
                .thenAnswer(inv -> DeepDiveResourceTest.rows(inv.getArgument(0)));
    }

    private String createSession() {
        return given()
                .contentType(ContentType.JSON)
                .body(CREATE)
                .when()
                .post("/api/v2/deep-dive/sessions")
                .then()
                .statusCode(201)
                .body("sessionId", notNullValue())
                .body("perspective", equalTo("team"))
                .body("drillableTo", contains("pic"))
                .body("view.mode", equalTo("unified"))
                .extract().path("sessionId");
    }

    @Test
    void testDrillDownAndBack() {
        String id = createSession();

        given()
                .contentType(ContentType.JSON)
                .body("{\"entityId\": \"APAC\", \"displayName\": \"Asia Pacific\"}")
                .when()
                .post("/api/v2/deep-dive/sessions/{id}/drill-down", id)
                .then()
                .statusCode(200)
                .body("perspective", equalTo("pic"))
                .body("scope.team", equalTo("APAC"))
                .body("view.breadcrumbs[0].displayName", equalTo("Asia Pacific"))
                .body("view.servedFromCache", equalTo(false));

        given()
                .when()
                .post("/api/v2/deep-dive/sessions/{id}/back", id)
                .then()
                .statusCode(200)
                .body("perspective", equalTo("team"))
                .body("scope.size()", equalTo(0))
                .body("view.servedFromCache", equalTo(true));

        // 创建 + 下钻各两次查询，返回命中缓存
        Mockito.verify(warehouse, Mockito.times(4)).queryAggregates(ArgumentMatchers.any());
    }

    @Test
    void testInvalidTransitionsAreBadRequest() {
        String id = createSession();

        given()
                .when()
                .post("/api/v2/deep-dive/sessions/{id}/back", id)
                .then()
                .statusCode(400)
                .body("status", equalTo("error"));

        given()
                .contentType(ContentType.JSON)
                .body("{\"entityId\": \"APAC\", \"childPerspective\": \"pid\"}")
                .when()
                .post("/api/v2/deep-dive/sessions/{id}/drill-down", id)
                .then()
                .statusCode(400);

        given()
                .contentType(ContentType.JSON)
                .body("{\"filters\": {\"zid\": [\"1001\"]}}")
                .when()
                .post("/api/v2/deep-dive/sessions/{id}/filters", id)
                .then()
                .statusCode(400);
    }

    @Test
    void testPerspectiveAndPeriodChange() {
        String id = createSession();

        given()
                .contentType(ContentType.JSON)
                .body("{\"perspective\": \"product\"}")
                .when()
                .post("/api/v2/deep-dive/sessions/{id}/perspective", id)
                .then()
                .statusCode(200)
                .body("perspective", equalTo("product"))
                .body("drillableTo", contains("zone"));

        given()
                .contentType(ContentType.JSON)
                .body("""
                        {"period1": {"start": "2025-08-01", "end": "2025-08-31"},
                         "period2": {"start": "2025-09-01", "end": "2025-09-30"}}
                        """)
                .when()
                .post("/api/v2/deep-dive/sessions/{id}/periods", id)
                .then()
                .statusCode(200)
                .body("view.period1.start", equalTo("2025-08-01"));
    }

    @Test
    void testMultiSelectIsSegmented() {
        String id = createSession();

        given()
                .contentType(ContentType.JSON)
                .body("{\"filters\": {\"team\": [\"APAC\", \"EMEA\"]}}")
                .when()
                .post("/api/v2/deep-dive/sessions/{id}/filters", id)
                .then()
                .statusCode(200)
                .body("view.mode", equalTo("segmented"))
                .body("view.segments.entityId", contains("APAC", "EMEA"));
    }

    @Test
    void testFailedRefreshIsRetryable() {
        String id = createSession();
        Mockito.when(warehouse.queryAggregates(ArgumentMatchers.any()))
                .thenThrow(new com.asiainfo.deepdive.infra.persistence.DataSourceException("timeout"));

        given()
                .when()
                .post("/api/v2/deep-dive/sessions/{id}/refresh", id)
                .then()
                .statusCode(502)
                .body("retryable", equalTo(true));

        given()
                .when()
                .get("/api/v2/deep-dive/sessions/{id}", id)
                .then()
                .statusCode(200)
                .body("view.generation", equalTo(1));
    }

    @Test
    void testCloseAndUnknownSession() {
        String id = createSession();

        given().when().delete("/api/v2/deep-dive/sessions/{id}", id).then().statusCode(204);
        given().when().get("/api/v2/deep-dive/sessions/{id}", id).then().statusCode(404);
        given().when().post("/api/v2/deep-dive/sessions/{id}/refresh", "missing").then().statusCode(404);
    }
}
