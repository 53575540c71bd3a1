package com.ospicorp.waterquality.classifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

/**
 * Evaluates a frozen tree-ensemble artifact the way a random forest predicts: each tree yields a
 * normalized class distribution, the ensemble averages them, the label is the argmax and the
 * confidence is the winning probability.
 *
 * <p>The compiled model is immutable and published through a volatile field, so {@link #classify}
 * is safe to call from several threads once {@link #load} has returned.
 */
public class TreeEnsembleClassifier implements RiskClassifier {

  private static final Logger log = LoggerFactory.getLogger(TreeEnsembleClassifier.class);

  static final List<String> FEATURE_NAMES = List.of("ph", "tds", "turbidity", "temperature");

  private final ObjectMapper mapper;
  private volatile Model model;

  public TreeEnsembleClassifier(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public void load(Resource resource) {
    if (resource == null || !resource.exists()) {
      throw new ArtifactLoadException("Classifier artifact not found: "
          + (resource == null ? "<none>" : resource.getDescription()));
    }
    ForestArtifact artifact;
    try (InputStream in = resource.getInputStream()) {
      artifact = mapper.readValue(in, ForestArtifact.class);
    } catch (IOException ex) {
      throw new ArtifactLoadException("Unreadable classifier artifact " + resource.getDescription(),
          ex);
    }
    Model compiled = compile(artifact);
    this.model = compiled;
    log.info("Loaded classifier artifact {} from {}: {} trees, labels {}, probabilities={}",
        compiled.version(), resource.getDescription(), compiled.trees().size(), compiled.labels(),
        compiled.probabilities());
  }

  @Override
  public Classification classify(double ph, double tds, double turbidity, double temperature) {
    Model current = model;
    if (current == null) {
      throw new ArtifactNotLoadedException();
    }
    double[] features = {ph, tds, turbidity, temperature};
    double[] distribution = new double[current.labels().size()];
    for (CompiledTree tree : current.trees()) {
      double[] leaf = tree.evaluate(features);
      for (int i = 0; i < distribution.length; i++) {
        distribution[i] += leaf[i];
      }
    }
    int best = 0;
    for (int i = 0; i < distribution.length; i++) {
      distribution[i] /= current.trees().size();
      if (distribution[i] > distribution[best]) {
        best = i;
      }
    }
    String label = current.labels().get(best);
    log.debug("Classified ph={} tds={} turbidity={} temperature={} as {} (p={})",
        ph, tds, turbidity, temperature, label, distribution[best]);
    if (!current.probabilities()) {
      return Classification.withoutConfidence(label);
    }
    return new Classification(label, Math.min(1d, Math.max(0d, distribution[best])));
  }

  @Override
  public boolean isLoaded() {
    return model != null;
  }

  @Override
  public List<String> labels() {
    Model current = model;
    return current == null ? List.of() : current.labels();
  }

  @Override
  public String artifactVersion() {
    Model current = model;
    return current == null ? null : current.version();
  }

  private static Model compile(ForestArtifact artifact) {
    if (artifact == null) {
      throw new ArtifactLoadException("Classifier artifact is empty");
    }
    if (!FEATURE_NAMES.equals(artifact.featureNames())) {
      throw new ArtifactLoadException("Artifact features " + artifact.featureNames()
          + " do not match expected " + FEATURE_NAMES);
    }
    List<String> labels = artifact.labels();
    if (labels == null || labels.isEmpty() || labels.stream().anyMatch(l -> l == null || l.isBlank())) {
      throw new ArtifactLoadException("Artifact must declare a non-empty label set");
    }
    if (artifact.trees() == null || artifact.trees().isEmpty()) {
      throw new ArtifactLoadException("Artifact contains no trees");
    }
    List<CompiledTree> trees = new ArrayList<>(artifact.trees().size());
    for (int t = 0; t < artifact.trees().size(); t++) {
      trees.add(CompiledTree.compile(t, artifact.trees().get(t), labels.size()));
    }
    String version = artifact.version() == null ? "unversioned" : artifact.version();
    return new Model(version, List.copyOf(labels), artifact.probabilities(), List.copyOf(trees));
  }

  private record Model(String version, List<String> labels, boolean probabilities,
      List<CompiledTree> trees) {}

  private static final class CompiledTree {
    private final int[] feature;
    private final double[] threshold;
    private final int[] left;
    private final int[] right;
    private final double[][] leaves;

    private CompiledTree(int size) {
      feature = new int[size];
      threshold = new double[size];
      left = new int[size];
      right = new int[size];
      leaves = new double[size][];
    }

    static CompiledTree compile(int index, ForestArtifact.Tree tree, int labelCount) {
      if (tree == null || tree.nodes() == null || tree.nodes().isEmpty()) {
        throw new ArtifactLoadException("Tree " + index + " has no nodes");
      }
      List<ForestArtifact.Node> nodes = tree.nodes();
      CompiledTree compiled = new CompiledTree(nodes.size());
      for (int i = 0; i < nodes.size(); i++) {
        ForestArtifact.Node node = nodes.get(i);
        String where = "tree " + index + " node " + i;
        if (node == null) {
          throw new ArtifactLoadException("Missing " + where);
        }
        if (node.isLeaf()) {
          compiled.feature[i] = -1;
          compiled.leaves[i] = normalize(node.value(), labelCount, where);
          continue;
        }
        if (node.feature() < 0 || node.feature() >= FEATURE_NAMES.size()) {
          throw new ArtifactLoadException("Unknown feature index " + node.feature() + " at " + where);
        }
        if (node.threshold() == null || !Double.isFinite(node.threshold())) {
          throw new ArtifactLoadException("Split without a finite threshold at " + where);
        }
        // Children must come after their parent so evaluation always terminates.
        if (!validChild(node.left(), i, nodes.size()) || !validChild(node.right(), i, nodes.size())) {
          throw new ArtifactLoadException("Invalid child index at " + where);
        }
        compiled.feature[i] = node.feature();
        compiled.threshold[i] = node.threshold();
        compiled.left[i] = node.left();
        compiled.right[i] = node.right();
      }
      return compiled;
    }

    double[] evaluate(double[] features) {
      int node = 0;
      while (feature[node] >= 0) {
        node = features[feature[node]] <= threshold[node] ? left[node] : right[node];
      }
      return leaves[node];
    }

    private static boolean validChild(Integer child, int parent, int size) {
      return child != null && child > parent && child < size;
    }

    private static double[] normalize(double[] value, int labelCount, String where) {
      if (value == null || value.length != labelCount) {
        throw new ArtifactLoadException("Leaf at " + where + " must have " + labelCount + " values");
      }
      double sum = 0d;
      for (double v : value) {
        if (!Double.isFinite(v) || v < 0d) {
          throw new ArtifactLoadException("Leaf at " + where + " has an invalid weight " + v);
        }
        sum += v;
      }
      if (sum == 0d) {
        throw new ArtifactLoadException("Leaf at " + where + " has no weight");
      }
      double[] normalized = new double[labelCount];
      for (int i = 0; i < labelCount; i++) {
        normalized[i] = value[i] / sum;
      }
      return normalized;
    }
  }
}
