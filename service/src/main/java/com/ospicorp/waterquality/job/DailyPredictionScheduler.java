package com.ospicorp.waterquality.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "waterquality.job.enabled", havingValue = "true", matchIfMissing = true)
public class DailyPredictionScheduler {

  private static final Logger log = LoggerFactory.getLogger(DailyPredictionScheduler.class);

  private final DailyPredictionJob job;

  public DailyPredictionScheduler(DailyPredictionJob job) {
    this.job = job;
  }

  @Scheduled(cron = "${waterquality.job.cron:0 0 0 * * *}", zone = "UTC")
  public void runDaily() {
    try {
      JobRun run = job.runForYesterday();
      log.info("Scheduled daily prediction for {} ended {}", run.date(), run.state());
    } catch (ConcurrentRunRejectedException ex) {
      log.warn("Scheduled daily prediction skipped: {}", ex.getMessage());
    } catch (RuntimeException ex) {
      // The next tick must still fire.
      log.error("Scheduled daily prediction aborted unexpectedly", ex);
    }
  }
}
