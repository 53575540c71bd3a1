package com.ospicorp.waterquality.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.tags.Tag;
import org.junit.jupiter.api.Test;

class OpenApiConfigTest {

  @Test
  void declaresATagForEveryController() {
    OpenAPI api = new OpenApiConfig().waterQualityApi("0 0 0 * * *");

    assertThat(api.getTags()).extracting(Tag::getName)
        .containsExactly("Readings", "Predictions", "Dashboard", "Admin");
    assertThat(api.getTags()).allSatisfy(tag -> assertThat(tag.getDescription()).isNotBlank());
  }

  @Test
  void predictionTagNamesTheSchedule() {
    OpenAPI api = new OpenApiConfig().waterQualityApi("0 30 1 * * *");

    assertThat(api.getTags()).filteredOn(tag -> "Predictions".equals(tag.getName()))
        .singleElement()
        .satisfies(tag -> assertThat(tag.getDescription()).contains("0 30 1 * * *", "UTC"));
  }
}
