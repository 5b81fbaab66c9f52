package edu.cmu.ml.rtw.hetnet.errors;

/**
 * An edge type string did not follow the name_ABBREV convention, or the abbreviations it implies
 * contradict ones already seen.
 */
public class SchemaParseException extends HetnetException {
  private static final long serialVersionUID = 1L;

  private final String edgeType;

  public SchemaParseException(String edgeType, String message) {
    super("Could not parse edge type '" + edgeType + "': " + message);
    this.edgeType = edgeType;
  }

  public String getEdgeType() {
    return edgeType;
  }
}
