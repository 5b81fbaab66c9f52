package edu.cmu.ml.rtw.hetnet.errors;

/**
 * Wraps a failure that happened while counting paths or walks for a single metapath, so the
 * caller can tell which metapath it came from.
 */
public class MetaPathComputationException extends HetnetException {
  private static final long serialVersionUID = 1L;

  private final String metaPath;

  public MetaPathComputationException(String metaPath, Throwable cause) {
    super("Computation failed for metapath " + metaPath + ": " + cause.getMessage(), cause);
    this.metaPath = metaPath;
  }

  public String getMetaPath() {
    return metaPath;
  }
}
