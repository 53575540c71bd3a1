package com.ospicorp.waterquality.admin;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ospicorp.waterquality.classifier.RiskClassifier;
import com.ospicorp.waterquality.config.SecurityConfig;
import com.ospicorp.waterquality.job.DailyPredictionJob;
import com.ospicorp.waterquality.job.JobRun;
import com.ospicorp.waterquality.job.JobState;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AdminController.class)
@Import(SecurityConfig.class)
class AdminControllerTest {

  @Autowired
  private MockMvc mvc;

  @MockBean
  private DailyPredictionJob job;

  @MockBean
  private RiskClassifier classifier;

  @Test
  void reportsLastRunAndClassifierStatus() throws Exception {
    LocalDate day = LocalDate.of(2024, 1, 2);
    when(job.lastRun()).thenReturn(Optional.of(new JobRun(day, JobState.FAILED,
        Instant.parse("2024-01-03T00:00:00Z"), Instant.parse("2024-01-03T00:00:01Z"), null,
        "Classifier artifact not loaded; predictions are unavailable")));
    when(job.runningDates()).thenReturn(Set.of(LocalDate.of(2024, 1, 5)));
    when(classifier.isLoaded()).thenReturn(false);
    when(classifier.labels()).thenReturn(List.of());

    mvc.perform(get("/admin/job"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.last_run.date").value("2024-01-02"))
        .andExpect(jsonPath("$.last_run.state").value("FAILED"))
        .andExpect(jsonPath("$.running_dates[0]").value("2024-01-05"))
        .andExpect(jsonPath("$.classifier_loaded").value(false));
  }

  @Test
  void answersBeforeAnyRun() throws Exception {
    when(job.lastRun()).thenReturn(Optional.empty());
    when(job.runningDates()).thenReturn(Set.of());
    when(classifier.isLoaded()).thenReturn(true);
    when(classifier.artifactVersion()).thenReturn("wq-forest-2024.06");
    when(classifier.labels()).thenReturn(List.of("High Risk", "Moderate Risk", "Safe"));

    mvc.perform(get("/admin/job"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.last_run").value((Object) null))
        .andExpect(jsonPath("$.classifier_version").value("wq-forest-2024.06"));
  }
}
