package edu.cmu.ml.rtw.hetnet.schema;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import edu.cmu.ml.rtw.hetnet.errors.SchemaParseException;
import edu.cmu.ml.rtw.hetnet.graphs.Edge;
import edu.cmu.ml.rtw.hetnet.graphs.HetGraph;
import edu.cmu.ml.rtw.hetnet.util.MapUtil;

/**
 * The schema of a heterogeneous network: node types, the metaedges between them, and the short
 * codes used to name metapaths.  Stored as a small directed multigraph over node types, with one
 * outgoing list per node type holding every metaedge (declared or inverse) that can be traversed
 * from it.  The lists are sorted by abbreviation so that metapath enumeration does not depend on
 * the order of the edge table.
 */
public class MetaGraph {
  private static final Logger log = Logger.getLogger(MetaGraph.class);

  private final List<MetaEdge> metaEdges;
  private final Map<String, MetaEdge> byAbbreviation;
  private final Map<String, List<MetaEdge>> outgoing;
  private final Map<String, String> nodeTypeCodes;

  private MetaGraph(Builder builder) {
    this.metaEdges = ImmutableList.copyOf(builder.metaEdges);
    this.nodeTypeCodes = ImmutableMap.copyOf(builder.nodeTypeCodes);
    Map<String, MetaEdge> abbreviations = Maps.newLinkedHashMap();
    Map<String, List<MetaEdge>> traversals = Maps.newLinkedHashMap();
    for (MetaEdge metaEdge : metaEdges) {
      addTraversal(metaEdge, abbreviations, traversals);
      if (metaEdge.getInverse() != metaEdge) {
        addTraversal(metaEdge.getInverse(), abbreviations, traversals);
      }
    }
    Map<String, List<MetaEdge>> sorted = Maps.newLinkedHashMap();
    for (Map.Entry<String, List<MetaEdge>> entry : traversals.entrySet()) {
      List<MetaEdge> edges = Lists.newArrayList(entry.getValue());
      Collections.sort(edges, new Comparator<MetaEdge>() {
        @Override
        public int compare(MetaEdge a, MetaEdge b) {
          return a.getAbbrev().compareTo(b.getAbbrev());
        }
      });
      sorted.put(entry.getKey(), ImmutableList.copyOf(edges));
    }
    this.byAbbreviation = ImmutableMap.copyOf(abbreviations);
    this.outgoing = ImmutableMap.copyOf(sorted);
  }

  private static void addTraversal(MetaEdge metaEdge,
                                   Map<String, MetaEdge> abbreviations,
                                   Map<String, List<MetaEdge>> traversals) {
    MetaEdge previous = abbreviations.put(metaEdge.getAbbrev(), metaEdge);
    if (previous != null) {
      throw new SchemaParseException(metaEdge.getEdgeType(), "abbreviation "
                                     + metaEdge.getAbbrev() + " is already used by "
                                     + previous.getEdgeType());
    }
    MapUtil.addValueToKeyList(traversals, metaEdge.getSourceType(), metaEdge);
  }

  /**
   * Recovers the schema from a graph's flat edge type vocabulary.  Each edge type's abbreviation
   * gives the node type codes, and the types of the endpoints of its first edge tell us which node
   * types those codes belong to.
   */
  public static MetaGraph fromGraph(HetGraph graph) {
    Builder builder = new Builder();
    for (Map.Entry<String, List<Edge>> entry : graph.getEdgesByType().entrySet()) {
      Edge first = entry.getValue().get(0);
      builder.addEdgeType(entry.getKey(),
                          graph.getNodeType(first.getStartId()),
                          graph.getNodeType(first.getEndId()));
    }
    MetaGraph metaGraph = builder.build();
    log.info("Initialized metagraph with " + metaGraph.getNodeTypeCodes().size()
             + " node types and " + metaGraph.getMetaEdges().size() + " edge types");
    return metaGraph;
  }

  /** The declared metaedges, one per edge type, in the order they were added. */
  public List<MetaEdge> getMetaEdges() {
    return metaEdges;
  }

  /**
   * Every metaedge that can be traversed starting at nodeType, declared or inverse.
   */
  public List<MetaEdge> getOutgoing(String nodeType) {
    return MapUtil.getWithDefault(outgoing, nodeType, Collections.<MetaEdge>emptyList());
  }

  /**
   * Looks up a metaedge, in either orientation, by its abbreviation.  Returns null if there is no
   * such metaedge.
   */
  public MetaEdge getMetaEdge(String abbreviation) {
    return byAbbreviation.get(abbreviation);
  }

  public boolean hasNodeType(String nodeType) {
    return nodeTypeCodes.containsKey(nodeType);
  }

  public String getNodeTypeCode(String nodeType) {
    return nodeTypeCodes.get(nodeType);
  }

  public Map<String, String> getNodeTypeCodes() {
    return nodeTypeCodes;
  }

  public static class Builder {
    private final List<MetaEdge> metaEdges = Lists.newArrayList();
    private final Map<String, String> nodeTypeCodes = Maps.newLinkedHashMap();
    private final Map<String, String> codeNodeTypes = Maps.newHashMap();

    public Builder() {}

    public Builder addEdgeType(String edgeType, String sourceType, String targetType) {
      EdgeTypeAbbreviation abbreviation = AbbreviationParser.parse(edgeType);
      learnCode(edgeType, sourceType, abbreviation.getStartCode());
      learnCode(edgeType, targetType, abbreviation.getEndCode());
      metaEdges.add(MetaEdge.declare(abbreviation, sourceType, targetType));
      return this;
    }

    private void learnCode(String edgeType, String nodeType, String code) {
      String knownCode = nodeTypeCodes.get(nodeType);
      if (knownCode != null && !knownCode.equals(code)) {
        throw new SchemaParseException(edgeType, "node type " + nodeType + " is abbreviated as "
                                       + code + " here but as " + knownCode + " elsewhere");
      }
      String knownType = codeNodeTypes.get(code);
      if (knownType != null && !knownType.equals(nodeType)) {
        throw new SchemaParseException(edgeType, "code " + code + " is used for both "
                                       + knownType + " and " + nodeType);
      }
      nodeTypeCodes.put(nodeType, code);
      codeNodeTypes.put(code, nodeType);
    }

    public MetaGraph build() {
      return new MetaGraph(this);
    }
  }
}
