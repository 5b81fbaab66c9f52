package edu.cmu.ml.rtw.hetnet.errors;

public class UnknownNodeReferenceException extends HetnetException {
  private static final long serialVersionUID = 1L;

  private final String nodeId;

  public UnknownNodeReferenceException(String nodeId) {
    super("Node id not found in the node table: " + nodeId);
    this.nodeId = nodeId;
  }

  public String getNodeId() {
    return nodeId;
  }
}
