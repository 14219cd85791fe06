package com.asiainfo.deepdive.api;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

/**
 * FilterPresetResource 集成测试
 */
@QuarkusTest
class FilterPresetResourceTest {

    private static String presetJson(String page) {
        return """
                {
                  "name": "APAC video",
                  "description": "only video inventory",
                  "page": "%s",
                  "perspective": "pid",
                  "filters": {"team": ["APAC"]},
                  "simplifiedFilter": {
                    "includeExclude": "include",
                    "clauseLogic": "and",
                    "clauses": [{"field": "product", "operator": "equals", "value": "video", "enabled": true}]
                  },
                  "isDefault": true
                }
                """.formatted(page);
    }

    @Test
    void testSaveListGetDelete() {
        String page = "test-" + UUID.randomUUID();

        String id = given()
                .contentType(ContentType.JSON)
                .body(presetJson(page))
                .when()
                .post("/api/v2/filter-presets")
                .then()
                .statusCode(201)
                .body("id", notNullValue())
                .body("createdAt", notNullValue())
                .extract().path("id");

        given()
                .queryParam("page", page)
                .when()
                .get("/api/v2/filter-presets")
                .then()
                .statusCode(200)
                .body("$", hasSize(1))
                .body("[0].isDefault", equalTo(true))
                .body("[0].filters.team", contains("APAC"))
                .body("[0].simplifiedFilter.clauses[0].field", equalTo("product"));

        given().when().get("/api/v2/filter-presets/{id}", id)
                .then()
                .statusCode(200)
                .body("name", equalTo("APAC video"));

        given().when().delete("/api/v2/filter-presets/{id}", id).then().statusCode(204);
        given().when().get("/api/v2/filter-presets/{id}", id).then().statusCode(404);
    }

    @Test
    void testMissingNameIsBadRequest() {
        given()
                .contentType(ContentType.JSON)
                .body("{\"page\": \"deep-dive\"}")
                .when()
                .post("/api/v2/filter-presets")
                .then()
                .statusCode(400)
                .body("status", equalTo("error"));
    }
}
