package com.ospicorp.waterquality.it;

import static org.assertj.core.api.Assertions.assertThat;

import io.swagger.v3.oas.models.tags.Tag;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;

class ApiIT extends PostgresIntegrationSupport {

  @Autowired
  private TestRestTemplate rest;

  @Autowired
  private JdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    jdbcTemplate.update("DELETE FROM daily_predictions");
    jdbcTemplate.update("DELETE FROM sensor_readings");
  }

  @Test
  @SuppressWarnings("unchecked")
  void ingestTriggerAndQuery() {
    Map<String, Double> acidityByTime = Map.of(
        "2024-01-01T10:00:00Z", 7.0,
        "2024-01-01T12:00:00Z", 7.2,
        "2024-01-01T14:00:00Z", 7.4);
    acidityByTime.forEach((timestamp, ph) -> {
      ResponseEntity<Map> created = rest.postForEntity("/api/readings", Map.of(
          "ph", ph, "tds", 300, "turbidity", 2, "temperature", 20,
          "timestamp", timestamp), Map.class);
      assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
    });

    ResponseEntity<Map> run = rest.postForEntity("/api/predictions/trigger?date=2024-01-01", null,
        Map.class);
    assertThat(run.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(run.getBody()).containsEntry("state", "COMPLETED");

    Map<String, Object> prediction = rest.getForObject("/api/predictions/2024-01-01", Map.class);
    assertThat(prediction).containsEntry("label", "Safe").containsEntry("reading_count", 3);

    Map<String, Object> dashboard = rest.getForObject("/api/dashboard", Map.class);
    assertThat((Map<String, Object>) dashboard.get("latest_prediction"))
        .containsEntry("date", "2024-01-01");
    assertThat((Map<String, Object>) dashboard.get("latest_reading"))
        .containsEntry("timestamp", "2024-01-01T14:00:00Z");

    List<Map<String, Object>> history = rest.getForObject(
        "/api/predictions?start=2024-01-01&end=2024-01-31", List.class);
    assertThat(history).hasSize(1);

    Map<String, Object> status = rest.getForObject("/admin/job", Map.class);
    assertThat((Map<String, Object>) status.get("last_run")).containsEntry("date", "2024-01-01");
    assertThat(status).containsEntry("classifier_loaded", true);
  }

  @Test
  void invalidReadingIsAProblemDetail() {
    ResponseEntity<Map> response = rest.postForEntity("/api/readings",
        Map.of("ph", 20, "tds", 300, "turbidity", 2, "temperature", 20), Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getHeaders().getContentType().toString()).contains("application/problem+json");
    assertThat(response.getBody()).containsKeys("type", "title", "status", "detail", "instance");
  }

  @Test
  @SuppressWarnings("unchecked")
  void classifierHealthIsReported() {
    ResponseEntity<Map> health = rest.getForEntity("/actuator/health", Map.class);

    assertThat(health.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(health.getBody()).containsEntry("status", "UP");
    assertThat((Map<String, Object>) health.getBody().get("components")).containsKey("classifier");
  }

  @Test
  void openapiDocumentIsValid() {
    String yaml = rest.getForObject("/v3/api-docs.yaml", String.class);
    ParseOptions options = new ParseOptions();
    options.setResolve(true);
    SwaggerParseResult result = new OpenAPIV3Parser().readContents(yaml, null, options);
    assertThat(result.getMessages()).as("validation messages").isEmpty();
    assertThat(result.getOpenAPI().getPaths()).containsKeys(
        "/api/readings", "/api/predictions", "/api/predictions/trigger", "/api/dashboard");
    assertThat(result.getOpenAPI().getTags())
        .extracting(Tag::getName)
        .contains("Readings", "Predictions", "Dashboard", "Admin");
  }
}
