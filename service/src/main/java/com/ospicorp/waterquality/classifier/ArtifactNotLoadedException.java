package com.ospicorp.waterquality.classifier;

public class ArtifactNotLoadedException extends IllegalStateException {

  public ArtifactNotLoadedException() {
    super("Classifier artifact not loaded; predictions are unavailable");
  }
}
