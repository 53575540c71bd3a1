package com.ospicorp.waterquality.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.waterquality.classifier.ArtifactLoadException;
import com.ospicorp.waterquality.classifier.RiskClassifier;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

class ClassifierConfigTest {

  private final ClassifierConfig config = new ClassifierConfig();

  @Test
  void loadsTheConfiguredArtifact() {
    RiskClassifier classifier = config.riskClassifier(new ObjectMapper(),
        new DefaultResourceLoader(), "classpath:classifier/test-forest.json", true);

    assertThat(classifier.isLoaded()).isTrue();
    assertThat(classifier.artifactVersion()).isEqualTo("test-forest-1");
  }

  @Test
  void missingArtifactDegradesByDefault() {
    RiskClassifier classifier = config.riskClassifier(new ObjectMapper(),
        new DefaultResourceLoader(), "classpath:classifier/absent.json", false);

    assertThat(classifier.isLoaded()).isFalse();
  }

  @Test
  void corruptArtifactAbortsStartupWhenFailFast() {
    assertThatThrownBy(() -> config.riskClassifier(new ObjectMapper(),
        new DefaultResourceLoader(), "classpath:classifier/malformed.json", true))
        .isInstanceOf(ArtifactLoadException.class);
  }
}
