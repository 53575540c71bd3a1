package com.ospicorp.waterquality.reading.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

@Schema(description = "Reading submitted by a field probe")
public record SensorReadingRequest(
    @NotNull @DecimalMin("0.0") @DecimalMax("14.0")
    @Schema(description = "Acidity index (pH)", example = "7.2") Double ph,

    @NotNull @DecimalMin("0.0")
    @Schema(description = "Total dissolved solids (ppm)", example = "350.5") Double tds,

    @NotNull @DecimalMin("0.0")
    @Schema(description = "Turbidity (NTU)", example = "2.8") Double turbidity,

    @NotNull @DecimalMin("-20.0") @DecimalMax("100.0")
    @Schema(description = "Water temperature (Celsius)", example = "25.3") Double temperature,

    @JsonAlias("recorded_at")
    @Schema(description = "Observation time (UTC); defaults to the time of receipt")
    Instant timestamp
) {}
