package edu.cmu.ml.rtw.hetnet.errors;

import java.util.Collection;

public class MultipleEdgeTypesException extends HetnetException {
  private static final long serialVersionUID = 1L;

  public MultipleEdgeTypesException(Collection<String> edgeTypes) {
    super("Permutation works on a single edge type at a time, but saw " + edgeTypes.size()
          + " types: " + edgeTypes);
  }
}
