package edu.cmu.ml.rtw.hetnet.schema;

/**
 * A schema-level edge: the node types it connects, its predicate and its direction.  Every
 * metaedge knows its inverse (endpoints swapped, direction inverted), which is what a metapath
 * uses when it walks the edge type from its end back to its start.  An undirected metaedge between
 * a node type and itself is its own inverse.
 *
 * <p>Metaedges are created in pairs by {@link #declare}, and are immutable afterwards.
 */
public class MetaEdge {
  private final String edgeType;
  private final String sourceType;
  private final String targetType;
  private final String sourceCode;
  private final String targetCode;
  private final String name;
  private final String predicateCode;
  private final EdgeDirection direction;
  private final boolean inverted;
  private MetaEdge inverse;

  private MetaEdge(String edgeType,
                   String sourceType,
                   String targetType,
                   String sourceCode,
                   String targetCode,
                   String name,
                   String predicateCode,
                   EdgeDirection direction,
                   boolean inverted) {
    this.edgeType = edgeType;
    this.sourceType = sourceType;
    this.targetType = targetType;
    this.sourceCode = sourceCode;
    this.targetCode = targetCode;
    this.name = name;
    this.predicateCode = predicateCode;
    this.direction = direction;
    this.inverted = inverted;
  }

  /**
   * Creates the metaedge for a parsed edge type whose edges run from sourceType nodes to
   * targetType nodes, along with its inverse.
   */
  public static MetaEdge declare(EdgeTypeAbbreviation abbreviation,
                                 String sourceType,
                                 String targetType) {
    MetaEdge forward = new MetaEdge(abbreviation.getEdgeType(),
                                    sourceType,
                                    targetType,
                                    abbreviation.getStartCode(),
                                    abbreviation.getEndCode(),
                                    abbreviation.getName(),
                                    abbreviation.getPredicateCode(),
                                    abbreviation.getDirection(),
                                    false);
    if (!forward.isDirected() && sourceType.equals(targetType)) {
      forward.inverse = forward;
      return forward;
    }
    MetaEdge backward = new MetaEdge(abbreviation.getEdgeType(),
                                     targetType,
                                     sourceType,
                                     abbreviation.getEndCode(),
                                     abbreviation.getStartCode(),
                                     abbreviation.getName(),
                                     abbreviation.getPredicateCode(),
                                     abbreviation.getDirection().inverse(),
                                     true);
    forward.inverse = backward;
    backward.inverse = forward;
    return forward;
  }

  /** The edge type string, as it appears in the edge table, that this metaedge was declared by. */
  public String getEdgeType() {
    return edgeType;
  }

  public String getSourceType() {
    return sourceType;
  }

  public String getTargetType() {
    return targetType;
  }

  public String getSourceCode() {
    return sourceCode;
  }

  public String getTargetCode() {
    return targetCode;
  }

  public String getName() {
    return name;
  }

  public EdgeDirection getDirection() {
    return direction;
  }

  public boolean isDirected() {
    return direction.isDirected();
  }

  /**
   * True if this is the inverse of a declared metaedge rather than the declared orientation.
   */
  public boolean isInverted() {
    return inverted;
  }

  public MetaEdge getInverse() {
    return inverse;
  }

  /** The predicate code with its direction marker, as it appears inside a metapath id. */
  public String getPredicatePart() {
    return AbbreviationParser.predicatePart(predicateCode, direction);
  }

  public String getAbbrev() {
    return sourceCode + getPredicatePart() + targetCode;
  }

  /**
   * The abbreviation of the declared orientation of this edge type, which is what external
   * metapath catalogs match on.
   */
  public String getStandardAbbrev() {
    if (inverted) {
      return inverse.getAbbrev();
    }
    return getAbbrev();
  }

  @Override
  public String toString() {
    String separator = " " + direction.getSymbol() + " ";
    return sourceType + separator + name + separator + targetType;
  }
}
