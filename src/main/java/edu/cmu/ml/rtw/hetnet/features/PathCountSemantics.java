package edu.cmu.ml.rtw.hetnet.features;

/**
 * Whether a metapath's chain product counts walks, which may revisit nodes, or approximately
 * counts paths, which may not.
 */
public enum PathCountSemantics {
  /** Degree-weighted path count. */
  PATHS("DWPC"),
  /** Degree-weighted walk count. */
  WALKS("DWWC");

  private final String featureName;

  private PathCountSemantics(String featureName) {
    this.featureName = featureName;
  }

  public String getFeatureName() {
    return featureName;
  }
}
