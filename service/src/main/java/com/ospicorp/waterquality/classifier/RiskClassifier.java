package com.ospicorp.waterquality.classifier;

import java.util.List;

/**
 * Port to the frozen risk model. Implementations are loaded once at startup and never retrained.
 */
public interface RiskClassifier {

  /**
   * Scores one set of daily means.
   *
   * @throws ArtifactNotLoadedException if the model artifact has not been loaded
   */
  Classification classify(double ph, double tds, double turbidity, double temperature);

  boolean isLoaded();

  /** Label set declared by the artifact, empty until loaded. */
  List<String> labels();

  /** Version string of the loaded artifact, or {@code null} when nothing is loaded. */
  String artifactVersion();
}
