package edu.cmu.ml.rtw.hetnet.graphs;

/**
 * One row of the edge table: a start node id, an end node id and the edge type string (e.g.
 * "binds_CbG").
 */
public class Edge {
  private final String startId;
  private final String endId;
  private final String type;

  public Edge(String startId, String endId, String type) {
    this.startId = startId;
    this.endId = endId;
    this.type = type;
  }

  public String getStartId() {
    return startId;
  }

  public String getEndId() {
    return endId;
  }

  public String getType() {
    return type;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + startId.hashCode();
    result = prime * result + endId.hashCode();
    result = prime * result + type.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    Edge other = (Edge) obj;
    return startId.equals(other.startId) && endId.equals(other.endId) && type.equals(other.type);
  }

  @Override
  public String toString() {
    return "(" + startId + ", " + type + ", " + endId + ")";
  }
}
