package com.ospicorp.waterquality.classifier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * On-disk shape of a tree-ensemble artifact. Node arrays are flat: split nodes carry
 * {@code feature}/{@code threshold}/{@code left}/{@code right}, leaves carry {@code value}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ForestArtifact(
    String version,
    List<String> featureNames,
    List<String> labels,
    boolean probabilities,
    List<Tree> trees
) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Tree(List<Node> nodes) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Node(Integer feature, Double threshold, Integer left, Integer right,
      double[] value) {

    boolean isLeaf() {
      return feature == null;
    }
  }
}
