package dev.pooleval.pipeline;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Batch pipeline settings, bound from {@code pooleval.pipeline.*}.
 *
 * <p>Hit files are read from {@code results-dir/<method>.csv}, or from {@code
 * results-dir/<partition>/<method>.csv} when partitions are configured.
 */
@ConfigurationProperties(prefix = "pooleval.pipeline")
@Validated
public class PipelineProperties {

  /** Which stage to run. */
  public enum Step {
    POOL,
    LABEL,
    METRICS,
    ALL
  }

  /** Documents labeled in test mode. */
  static final int TEST_MODE_LIMIT = 50;

  private boolean enabled;

  @NotNull private Step step = Step.ALL;

  private List<String> methods = new ArrayList<>();

  @Min(1)
  private int depthK = 20;

  @NotNull private Path resultsDir = Path.of("results/search");

  private List<String> partitions = new ArrayList<>();

  @NotNull private Path pooledTable = Path.of("results/pooled.csv");

  @Min(0)
  private @Nullable Integer limit;

  private boolean testMode;

  private @Nullable String evaluatePartition;

  @NotNull private String exportLabel = "all";

  /** The labeling limit in effect: the explicit limit, else the test-mode limit, else none. */
  public @Nullable Integer effectiveLimit() {
    if (limit != null) {
      return limit;
    }
    return testMode ? TEST_MODE_LIMIT : null;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Step getStep() {
    return step;
  }

  public void setStep(Step step) {
    this.step = step;
  }

  public List<String> getMethods() {
    return methods;
  }

  public void setMethods(List<String> methods) {
    this.methods = methods;
  }

  public int getDepthK() {
    return depthK;
  }

  public void setDepthK(int depthK) {
    this.depthK = depthK;
  }

  public Path getResultsDir() {
    return resultsDir;
  }

  public void setResultsDir(Path resultsDir) {
    this.resultsDir = resultsDir;
  }

  public List<String> getPartitions() {
    return partitions;
  }

  public void setPartitions(List<String> partitions) {
    this.partitions = partitions;
  }

  public Path getPooledTable() {
    return pooledTable;
  }

  public void setPooledTable(Path pooledTable) {
    this.pooledTable = pooledTable;
  }

  public @Nullable Integer getLimit() {
    return limit;
  }

  public void setLimit(@Nullable Integer limit) {
    this.limit = limit;
  }

  public boolean isTestMode() {
    return testMode;
  }

  public void setTestMode(boolean testMode) {
    this.testMode = testMode;
  }

  public @Nullable String getEvaluatePartition() {
    return evaluatePartition;
  }

  public void setEvaluatePartition(@Nullable String evaluatePartition) {
    this.evaluatePartition = evaluatePartition;
  }

  public String getExportLabel() {
    return exportLabel;
  }

  public void setExportLabel(String exportLabel) {
    this.exportLabel = exportLabel;
  }
}
