package com.ospicorp.waterquality.admin;

import com.ospicorp.waterquality.classifier.RiskClassifier;
import com.ospicorp.waterquality.job.DailyPredictionJob;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
@Tag(name = "Admin")
public class AdminController {
  private final DailyPredictionJob job;
  private final RiskClassifier classifier;

  public AdminController(DailyPredictionJob job, RiskClassifier classifier) {
    this.job = job;
    this.classifier = classifier;
  }

  @GetMapping("/job")
  @Operation(summary = "Daily job status",
      description = "Most recent run, dates currently being processed and classifier availability.")
  public JobStatus job() {
    return new JobStatus(
        job.lastRun().orElse(null),
        job.runningDates(),
        classifier.isLoaded(),
        classifier.artifactVersion(),
        classifier.labels());
  }
}
