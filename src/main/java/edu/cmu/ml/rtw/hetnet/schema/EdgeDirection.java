package edu.cmu.ml.rtw.hetnet.schema;

/**
 * Direction of a metaedge, as encoded by the '>' and '<' markers in its abbreviation.
 */
public enum EdgeDirection {
  FORWARD(">"),
  BACKWARD("<"),
  BOTH("-");

  private final String symbol;

  private EdgeDirection(String symbol) {
    this.symbol = symbol;
  }

  /**
   * The separator used in a metaedge's display name, e.g. "Gene > regulates > Gene".
   */
  public String getSymbol() {
    return symbol;
  }

  public boolean isDirected() {
    return this != BOTH;
  }

  public EdgeDirection inverse() {
    switch (this) {
      case FORWARD:
        return BACKWARD;
      case BACKWARD:
        return FORWARD;
      default:
        return BOTH;
    }
  }

  public static EdgeDirection fromAbbreviation(String abbreviation) {
    if (abbreviation.contains(">")) {
      return FORWARD;
    } else if (abbreviation.contains("<")) {
      return BACKWARD;
    }
    return BOTH;
  }
}
