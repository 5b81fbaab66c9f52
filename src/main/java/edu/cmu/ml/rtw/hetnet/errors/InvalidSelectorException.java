package edu.cmu.ml.rtw.hetnet.errors;

/**
 * A node selection was neither a known node type, a list of known node ids, nor a list of valid
 * node indices.
 */
public class InvalidSelectorException extends HetnetException {
  private static final long serialVersionUID = 1L;

  public InvalidSelectorException(String message) {
    super(message);
  }
}
