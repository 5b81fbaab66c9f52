package edu.cmu.ml.rtw.hetnet.schema;

/**
 * The pieces of an edge type string after parsing, e.g. "binds_CbG" gives name "binds", start
 * code "C", predicate code "b", end code "G" and direction BOTH.
 */
public class EdgeTypeAbbreviation {
  private final String edgeType;
  private final String name;
  private final String abbreviation;
  private final String startCode;
  private final String predicateCode;
  private final String endCode;
  private final EdgeDirection direction;

  public EdgeTypeAbbreviation(String edgeType,
                              String name,
                              String abbreviation,
                              String startCode,
                              String predicateCode,
                              String endCode,
                              EdgeDirection direction) {
    this.edgeType = edgeType;
    this.name = name;
    this.abbreviation = abbreviation;
    this.startCode = startCode;
    this.predicateCode = predicateCode;
    this.endCode = endCode;
    this.direction = direction;
  }

  /** The full edge type string this was parsed from. */
  public String getEdgeType() {
    return edgeType;
  }

  /**
   * The human-readable predicate name.  When the edge type carries no name part, this is the
   * abbreviation itself.
   */
  public String getName() {
    return name;
  }

  public String getAbbreviation() {
    return abbreviation;
  }

  public String getStartCode() {
    return startCode;
  }

  public String getPredicateCode() {
    return predicateCode;
  }

  public String getEndCode() {
    return endCode;
  }

  public EdgeDirection getDirection() {
    return direction;
  }

  @Override
  public String toString() {
    return edgeType;
  }
}
