package com.ospicorp.waterquality.dashboard;

import com.ospicorp.waterquality.prediction.service.PredictionQueryService;
import com.ospicorp.waterquality.reading.service.SensorReadingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dashboard")
@Tag(name = "Dashboard")
public class DashboardController {
  private final SensorReadingService readings;
  private final PredictionQueryService predictions;

  public DashboardController(SensorReadingService readings, PredictionQueryService predictions) {
    this.readings = readings;
    this.predictions = predictions;
  }

  @GetMapping
  @Operation(summary = "Latest reading and latest prediction",
      description = "Single call for the dashboard landing view; either field may be null.")
  public DashboardResponse dashboard() {
    return new DashboardResponse(
        readings.latest().orElse(null),
        predictions.latest().orElse(null));
  }
}
