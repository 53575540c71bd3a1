package com.ospicorp.waterquality.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API document metadata. Tag names match the {@code @Tag} on each controller so the descriptions
 * below attach to the generated operations.
 */
@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI waterQualityApi(@Value("${waterquality.job.cron:0 0 0 * * *}") String cron) {
    return new OpenAPI()
        .info(new Info()
            .title("Water Quality Risk API")
            .version("v1")
            .description("Ingests pH, TDS, turbidity and temperature readings and classifies each "
                + "UTC calendar day into a water-quality risk label.")
            .contact(new Contact().name("Water Quality Platform Team").email("water-ops@ospicorp.com"))
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/").description("This deployment")))
        .tags(List.of(
            new Tag().name("Readings")
                .description("Sensor reading ingestion. Timestamps are stored at microsecond precision."),
            new Tag().name("Predictions")
                .description("One prediction per UTC date, recomputed in place on re-run. "
                    + "The scheduled run uses cron '" + cron + "' in UTC."),
            new Tag().name("Dashboard").description("Latest reading and latest prediction in one call."),
            new Tag().name("Admin").description("Daily job state and classifier status.")));
  }
}
