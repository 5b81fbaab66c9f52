package edu.cmu.ml.rtw.hetnet.errors;

/**
 * The edges handed to the permuter contain the same (start, end) pair more than once.  This is a
 * precondition violation of the input, not something the permuter can work around.
 */
public class DuplicateEdgeException extends HetnetException {
  private static final long serialVersionUID = 1L;

  public DuplicateEdgeException(String edgeType, String startId, String endId) {
    super("Duplicate edge of type " + edgeType + ": (" + startId + ", " + endId + ")");
  }
}
