package com.ospicorp.waterquality.classifier;

public class ArtifactLoadException extends RuntimeException {

  public ArtifactLoadException(String message) {
    super(message);
  }

  public ArtifactLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
