package com.ospicorp.waterquality.classifier;

import java.util.Objects;

/**
 * Result of one classification. {@code confidence} is the probability of {@code label}, or
 * {@code null} when the model has no probability estimate.
 */
public record Classification(String label, Double confidence) {

  public Classification {
    Objects.requireNonNull(label, "label is required");
    if (confidence != null && (confidence.isNaN() || confidence < 0d || confidence > 1d)) {
      throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
    }
  }

  public static Classification withoutConfidence(String label) {
    return new Classification(label, null);
  }
}
