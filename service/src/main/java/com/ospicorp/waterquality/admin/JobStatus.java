package com.ospicorp.waterquality.admin;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.waterquality.job.JobRun;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

public record JobStatus(
    @JsonProperty("last_run") JobRun lastRun,
    @JsonProperty("running_dates") Set<LocalDate> runningDates,
    @JsonProperty("classifier_loaded") boolean classifierLoaded,
    @JsonProperty("classifier_version") String classifierVersion,
    @JsonProperty("classifier_labels") List<String> classifierLabels
) {}
