package edu.cmu.ml.rtw.hetnet.graphs;

public class Node {
  private final String id;
  private final String type;

  public Node(String id, String type) {
    this.id = id;
    this.type = type;
  }

  public String getId() {
    return id;
  }

  public String getType() {
    return type;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + id.hashCode();
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
    Node other = (Node) obj;
    return id.equals(other.id) && type.equals(other.type);
  }

  @Override
  public String toString() {
    return id + " (" + type + ")";
  }
}
