package edu.cmu.ml.rtw.hetnet.graphs;

import java.util.List;

/**
 * The result of resolving a {@link NodeSelector}: node indices, their ids in the same order, and
 * the node type of the selection (taken from its first node).
 */
public class SelectedNodes {
  private final int[] indices;
  private final List<String> ids;
  private final String type;

  public SelectedNodes(int[] indices, List<String> ids, String type) {
    this.indices = indices;
    this.ids = ids;
    this.type = type;
  }

  public int[] getIndices() {
    return indices.clone();
  }

  public List<String> getIds() {
    return ids;
  }

  public String getType() {
    return type;
  }

  public int size() {
    return indices.length;
  }

  /** Column name for these nodes in an output table, e.g. "compound_id". */
  public String getColumnName() {
    return type.toLowerCase() + "_id";
  }
}
