package com.ospicorp.waterquality.prediction.controller;

import com.ospicorp.waterquality.job.DailyPredictionJob;
import com.ospicorp.waterquality.job.JobRun;
import com.ospicorp.waterquality.prediction.model.DailyPrediction;
import com.ospicorp.waterquality.prediction.service.PredictionQueryService;
import com.ospicorp.waterquality.web.CsvHttpMessageConverter;
import com.ospicorp.waterquality.web.InvalidParameterException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/predictions")
@Tag(name = "Predictions")
public class PredictionController {
  private static final MediaType CSV_MEDIA_TYPE = CsvHttpMessageConverter.TEXT_CSV;

  private final PredictionQueryService queries;
  private final DailyPredictionJob job;

  public PredictionController(PredictionQueryService queries, DailyPredictionJob job) {
    this.queries = queries;
    this.job = job;
  }

  @GetMapping
  @Operation(summary = "Prediction history",
      description = "Daily predictions for an inclusive date range, oldest first. Defaults to the last 30 days.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Predictions",
          content = {
              @Content(mediaType = "application/json",
                  array = @ArraySchema(schema = @Schema(implementation = DailyPrediction.class))),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<List<DailyPrediction>> history(
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
      @Parameter(description = "First date (inclusive)", example = "2024-01-01") LocalDate start,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
      @Parameter(description = "Last date (inclusive)", example = "2024-01-31") LocalDate end,
      @RequestParam(name = "format", required = false)
      @Parameter(description = "Response format: json or csv") String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    List<DailyPrediction> predictions = queries.history(start, end);
    ResponseEntity.BodyBuilder builder = ResponseEntity.ok().contentType(contentType);
    if (contentType.isCompatibleWith(CSV_MEDIA_TYPE)) {
      builder = builder.header(HttpHeaders.CONTENT_DISPOSITION,
          "attachment; filename=\"predictions.csv\"");
    }
    return builder.body(predictions);
  }

  @GetMapping("/latest")
  @Operation(summary = "Most recent prediction")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Latest prediction"),
      @ApiResponse(responseCode = "404", description = "No predictions stored yet",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public DailyPrediction latest() {
    return queries.latest()
        .orElseThrow(() -> new NoSuchElementException("No predictions available"));
  }

  @GetMapping("/{date}")
  @Operation(summary = "Prediction for one date")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Prediction"),
      @ApiResponse(responseCode = "404", description = "No prediction for that date",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public DailyPrediction forDate(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
      @Parameter(description = "UTC calendar date", example = "2024-01-03") LocalDate date) {
    return queries.forDate(date)
        .orElseThrow(() -> new NoSuchElementException("No prediction for " + date));
  }

  @PostMapping("/trigger")
  @Operation(summary = "Run the daily prediction now",
      description = "Aggregates and classifies the given UTC date (default yesterday). "
          + "A day without readings ends SKIPPED_NO_DATA and a classifier or storage failure ends FAILED; "
          + "both still answer 200 with the run record.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Run finished",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = JobRun.class))),
      @ApiResponse(responseCode = "409", description = "A run for that date is already in progress",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public JobRun trigger(@RequestParam(required = false)
      @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
      @Parameter(description = "UTC date to process; defaults to yesterday") LocalDate date) {
    return job.run(date != null ? date : job.yesterday());
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV_MEDIA_TYPE;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw InvalidParameterException.of("Invalid format value. Supported values: json,csv.", 3003);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV_MEDIA_TYPE)) {
        return CSV_MEDIA_TYPE;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
