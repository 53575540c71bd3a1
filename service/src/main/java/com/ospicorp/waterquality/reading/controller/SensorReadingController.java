package com.ospicorp.waterquality.reading.controller;

import com.ospicorp.waterquality.reading.model.SensorReadingDto;
import com.ospicorp.waterquality.reading.model.SensorReadingRequest;
import com.ospicorp.waterquality.reading.service.SensorReadingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.NoSuchElementException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/readings")
@Tag(name = "Readings")
public class SensorReadingController {
  private final SensorReadingService service;

  public SensorReadingController(SensorReadingService service) {
    this.service = service;
  }

  @PostMapping
  @Operation(summary = "Submit a sensor reading",
      description = "Called by field probes on their reporting cadence.")
  @ApiResponses({
      @ApiResponse(responseCode = "201", description = "Reading stored",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = SensorReadingDto.class))),
      @ApiResponse(responseCode = "400", description = "Malformed or out-of-range reading",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<SensorReadingDto> submit(@Valid @RequestBody SensorReadingRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED).body(service.record(request));
  }

  @GetMapping("/latest")
  @Operation(summary = "Most recent reading")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Latest reading"),
      @ApiResponse(responseCode = "404", description = "No readings stored yet",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public SensorReadingDto latest() {
    return service.latest()
        .orElseThrow(() -> new NoSuchElementException("No sensor readings found"));
  }
}
