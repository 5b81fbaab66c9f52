package edu.cmu.ml.rtw.hetnet.errors;

/**
 * Base class for every error the feature extraction and permutation code reports.  These are all
 * unchecked; each is thrown synchronously by the call that detects the problem, and none of them
 * are recovered from inside this library.
 */
public class HetnetException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public HetnetException(String message) {
    super(message);
  }

  public HetnetException(String message, Throwable cause) {
    super(message, cause);
  }
}
