package edu.cmu.ml.rtw.hetnet.schema;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import edu.cmu.ml.rtw.hetnet.errors.SchemaParseException;

/**
 * Parses edge type strings of the form {@code name_ABBREV}, where ABBREV is an uppercase start
 * node code, a lowercase predicate code and an uppercase end node code, optionally with one
 * direction marker on either side of the predicate.  '>' means forward and '<' backward, so "Gr>G"
 * and "G>rG" are the same edge type.  Abbreviations built here always use the "r>" and "<r"
 * forms.  The name is everything before the last underscore, so "PROCESS_OF_PpoP" has name
 * "PROCESS_OF".  A type with no underscore is treated as a bare abbreviation.
 *
 * <p>All knowledge of this string convention lives here; nothing else should pick abbreviations
 * apart by hand.
 */
public class AbbreviationParser {
  private static final Pattern ABBREVIATION =
      Pattern.compile("^([A-Z]+)([<>]?)([a-z]+)([<>]?)([A-Z]+)$");

  private AbbreviationParser() {}

  public static EdgeTypeAbbreviation parse(String edgeType) {
    if (edgeType == null || edgeType.isEmpty()) {
      throw new SchemaParseException(String.valueOf(edgeType), "edge type is empty");
    }
    String name;
    String abbreviation;
    int split = edgeType.lastIndexOf('_');
    if (split >= 0) {
      name = edgeType.substring(0, split);
      abbreviation = edgeType.substring(split + 1);
      if (name.isEmpty()) {
        throw new SchemaParseException(edgeType, "nothing before the abbreviation separator");
      }
    } else {
      abbreviation = edgeType;
      name = edgeType;
    }
    Matcher matcher = ABBREVIATION.matcher(abbreviation);
    if (!matcher.matches()) {
      throw new SchemaParseException(edgeType, "abbreviation '" + abbreviation
                                     + "' is not START code, predicate code, END code");
    }
    if (!matcher.group(2).isEmpty() && !matcher.group(4).isEmpty()) {
      throw new SchemaParseException(edgeType, "abbreviation has more than one direction marker");
    }
    EdgeDirection direction = EdgeDirection.fromAbbreviation(abbreviation);
    return new EdgeTypeAbbreviation(edgeType,
                                    name,
                                    abbreviation,
                                    matcher.group(1),
                                    matcher.group(3),
                                    matcher.group(5),
                                    direction);
  }

  /**
   * Builds the abbreviation for the inverse of a directed abbreviation, e.g. "Gr>G" becomes
   * "G<rG" and "CDreg<X" becomes "Xreg>CD".  Undirected abbreviations have their endpoint codes
   * swapped.
   */
  public static String inverseAbbreviation(String abbreviation) {
    EdgeTypeAbbreviation parsed = parse(abbreviation);
    return buildAbbreviation(parsed.getEndCode(),
                             parsed.getPredicateCode(),
                             parsed.getStartCode(),
                             parsed.getDirection().inverse());
  }

  public static String buildAbbreviation(String startCode,
                                         String predicateCode,
                                         String endCode,
                                         EdgeDirection direction) {
    return startCode + predicatePart(predicateCode, direction) + endCode;
  }

  /**
   * The part of an abbreviation between the two node codes: "r>", "<r" or "r".
   */
  public static String predicatePart(String predicateCode, EdgeDirection direction) {
    switch (direction) {
      case FORWARD:
        return predicateCode + ">";
      case BACKWARD:
        return "<" + predicateCode;
      default:
        return predicateCode;
    }
  }
}
