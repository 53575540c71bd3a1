package com.ospicorp.waterquality.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.waterquality.classifier.ArtifactLoadException;
import com.ospicorp.waterquality.classifier.RiskClassifier;
import com.ospicorp.waterquality.classifier.TreeEnsembleClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class ClassifierConfig {

  private static final Logger log = LoggerFactory.getLogger(ClassifierConfig.class);

  /**
   * Loads the artifact once. Without fail-fast a missing or corrupt artifact leaves the service
   * up in degraded mode: ingestion and queries work, job runs end FAILED.
   */
  @Bean
  RiskClassifier riskClassifier(ObjectMapper mapper, ResourceLoader resourceLoader,
      @Value("${waterquality.classifier.artifact:classpath:classifier/water-quality-forest.json}") String location,
      @Value("${waterquality.classifier.fail-fast:false}") boolean failFast) {
    TreeEnsembleClassifier classifier = new TreeEnsembleClassifier(mapper);
    try {
      classifier.load(resourceLoader.getResource(location));
    } catch (ArtifactLoadException ex) {
      if (failFast) {
        throw ex;
      }
      log.error("Classifier artifact {} could not be loaded; running without predictions",
          location, ex);
    }
    return classifier;
  }
}
