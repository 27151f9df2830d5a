package io.medpack.integrator.rest;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.medpack.integrator.TestContent;
import io.medpack.integrator.load.PackageDocument;
import io.medpack.integrator.model.ContentPackage;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;

/**
 * REST tests for the integration endpoint.
 *
 * <p>Verifies the success body, the 422 problem with the report attached and the 400 problem for
 * directive failures.</p>
 */
@QuarkusTest
class IntegrationResourceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static String body(List<ContentPackage> packages, String directives, String format) throws IOException {
        ObjectNode request = MAPPER.createObjectNode();
        ArrayNode documents = request.putArray("packages");
        for (ContentPackage p : packages) {
            documents.add(MAPPER.valueToTree(new PackageDocument(p.tag(), p.version(), p.priority(),
                p.diseases(), p.symptoms(), p.examinations(), p.treatments())));
        }
        if (directives != null) {
            request.set("directives", MAPPER.readTree(directives));
        }
        if (format != null) {
            request.put("format", format);
        }
        return MAPPER.writeValueAsString(request);
    }

    @Test
    @DisplayName("POST /integrations returns the document and the report")
    void shouldIntegrate() throws IOException {
        String directives = "{\"reassignments\": [{\"type\": \"restrictToCategory\","
            + " \"department\": \"Psychology\", \"keepTags\": [\"mental-health\"]}]}";

        given()
            .contentType(ContentType.JSON)
            .body(body(TestContent.hospital(), directives, "xml"))
            .when()
            .post("/integrations")
            .then()
            .statusCode(200)
            .body("format", equalTo("xml"))
            .body("document", containsString("ID=\"anxiety\""))
            .body("document", not(containsString("insomnia")))
            .body("report.status", equalTo("SUCCEEDED"))
            .body("report.removedDiseases", hasItem("insomnia"));
    }

    @Test
    @DisplayName("POST /integrations/report returns Markdown")
    void shouldReturnMarkdownReport() throws IOException {
        given()
            .contentType(ContentType.JSON)
            .accept("text/markdown")
            .body(body(TestContent.hospital(), null, "json"))
            .when()
            .post("/integrations/report")
            .then()
            .statusCode(200)
            .body(containsString("# Integration Report"))
            .body(containsString("Status: SUCCEEDED"));
    }

    @Test
    @DisplayName("POST /integrations answers 422 with the report on hard violations")
    void shouldRejectViolations() throws IOException {
        given()
            .contentType(ContentType.JSON)
            .body(body(List.of(TestContent.dermatology()), null, null))
            .when()
            .post("/integrations")
            .then()
            .statusCode(422)
            .contentType(containsString("application/problem+json"))
            .body("status", equalTo(422))
            .body("report.status", equalTo("REJECTED"))
            .body("report.violations[0].type", equalTo("DUPLICATE_MAIN_SYMPTOM"))
            .body("report.violations[0].entityId", equalTo("skin_itching"));
    }

    @Test
    @DisplayName("POST /integrations answers 400 on an unknown department")
    void shouldRejectUnknownDepartment() throws IOException {
        String directives = "{\"reassignments\": [{\"type\": \"moveToDepartment\","
            + " \"entity\": \"migraine\", \"department\": \"Astrology\"}]}";

        given()
            .contentType(ContentType.JSON)
            .body(body(TestContent.hospital(), directives, null))
            .when()
            .post("/integrations")
            .then()
            .statusCode(400)
            .body("detail", containsString("Astrology"));
    }

    @Test
    @DisplayName("POST /integrations answers 400 on an unknown format")
    void shouldRejectUnknownFormat() throws IOException {
        given()
            .contentType(ContentType.JSON)
            .body(body(TestContent.hospital(), null, "csv"))
            .when()
            .post("/integrations")
            .then()
            .statusCode(400);
    }

    @Test
    @DisplayName("POST /integrations answers 400 without packages")
    void shouldRequirePackages() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"packages\": []}")
            .when()
            .post("/integrations")
            .then()
            .statusCode(400);
    }

    @Test
    @DisplayName("POST /integrations answers 400 on a null entity in a package")
    void shouldRejectNullEntity() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"packages\": [{\"tag\": \"holes\", \"priority\": 1, \"diseases\": [null]}]}")
            .when()
            .post("/integrations")
            .then()
            .statusCode(400)
            .contentType(containsString("application/problem+json"))
            .body("detail", containsString("diseases[0]"));
    }
}
