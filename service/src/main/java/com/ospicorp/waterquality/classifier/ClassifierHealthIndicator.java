package com.ospicorp.waterquality.classifier;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("classifier")
public class ClassifierHealthIndicator implements HealthIndicator {
  private final RiskClassifier classifier;

  public ClassifierHealthIndicator(RiskClassifier classifier) {
    this.classifier = classifier;
  }

  @Override
  public Health health() {
    if (!classifier.isLoaded()) {
      return Health.down()
          .withDetail("reason", "artifact not loaded; daily predictions are disabled")
          .build();
    }
    return Health.up()
        .withDetail("artifactVersion", classifier.artifactVersion())
        .withDetail("labels", classifier.labels())
        .build();
  }
}
